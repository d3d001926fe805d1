package com.github.pfc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Text renderings of a chart's structure, used in logs and test assertions.
 */
public final class PfcDiagnostics {

  private PfcDiagnostics() {}

  /**
   * One line per link, sorted by link name, in the form {@code {pred-->[link]-->succ}}.
   */
  public static String getStructure(final ProcedureFunctionChart chart) {
    final List<PfcLink> links = new ArrayList<>(chart.getLinks());
    links.sort((first, second) -> first.getName().compareTo(second.getName()));
    final StringBuilder builder = new StringBuilder();
    for (final PfcLink link : links) {
      builder.append('{').append(nameOf(link.getPredecessor())).append("-->[")
          .append(link.getName()).append("]-->").append(nameOf(link.getSuccessor())).append("}\n");
    }
    return builder.toString();
  }

  /**
   * Summary counts followed by every node in graph order with its ordinal, and its outbound links
   * with their priorities. Child charts are described indented under their owning step.
   */
  public static String describe(final ProcedureFunctionChart chart) {
    final StringBuilder builder = new StringBuilder();
    describe(chart, builder, 0);
    return builder.toString();
  }

  private static void describe(final ProcedureFunctionChart chart, final StringBuilder builder,
      final int depth) {
    final String indent = indent(depth);
    builder.append(indent).append("Chart ").append(chart.getName()).append(" : ")
        .append(chart.getSteps().size()).append(" steps, ").append(chart.getTransitions().size())
        .append(" transitions, ").append(chart.getLinks().size()).append(" links\n");
    for (final PfcNode node : chart.getNodes()) {
      builder.append(indent).append("  ").append(node.getGraphOrdinal()).append(' ')
          .append(node.getElementType()).append(' ').append(node.getName()).append('\n');
      for (final PfcLink link : node.getSuccessors()) {
        builder.append(indent).append("    -> ").append(nameOf(link.getSuccessor())).append(" via ")
            .append(link.getName()).append(" (priority ").append(link.getPriority())
            .append(link.isLoopback() ? ", loopback" : "").append(")\n");
      }
      if (node instanceof PfcStep) {
        for (final Map.Entry<String, ProcedureFunctionChart> action : ((PfcStep) node).getActions()
            .entrySet()) {
          builder.append(indent).append("    [").append(action.getKey()).append("]\n");
          describe(action.getValue(), builder, depth + 3);
        }
      }
    }
  }

  private static String indent(final int depth) {
    final StringBuilder builder = new StringBuilder();
    for (int i = 0; i < depth; i++) {
      builder.append("  ");
    }
    return builder.toString();
  }

  private static String nameOf(final PfcNode node) {
    return node == null ? "<null>" : node.getName();
  }

}
