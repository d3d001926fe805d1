package com.github.pfc;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The stock reduction rules.
 */
public final class Reductions {
  private static final Logger logger = LogManager.getLogger(Reductions.class.getSimpleName());

  private Reductions() {}

  /**
   * The rules applied by {@link ProcedureFunctionChart#reduce()}.
   */
  public static List<ReductionRule> defaultRules() {
    final List<ReductionRule> rules = new ArrayList<>();
    rules.add(sequentialPairElimination(true));
    rules.add(duplicateLinkElimination());
    return rules;
  }

  /**
   * Collapses a pass-through pair: a simple node followed by a simple node of the other kind, where
   * either the node before the pair has no other successors or the node after it has no other
   * predecessors. The surrounding nodes are bound directly and both members of the pair are
   * deleted. With {@code nullNodesOnly} set, only pairs of null nodes are collapsed, which leaves
   * the chart's behavior intact; without it the rule is purely structural.
   */
  public static ReductionRule sequentialPairElimination(final boolean nullNodesOnly) {
    return chart -> {
      for (final PfcNode node : new ArrayList<>(chart.getNodes())) {
        if (!node.isSimple()) {
          continue;
        }
        final PfcNode partner = node.getSuccessorNodes().get(0);
        if (!partner.isSimple()) {
          continue;
        }
        final PfcNode before = node.getPredecessorNodes().get(0);
        final PfcNode after = partner.getSuccessorNodes().get(0);
        // a pair closing a loop on itself has nothing to splice to
        if (before == node || before == partner || after == node || after == partner) {
          continue;
        }
        if (before.getSuccessors().size() != 1 && after.getPredecessors().size() != 1) {
          continue;
        }
        if (nullNodesOnly && !(node.isNullNode() && partner.isNullNode())) {
          continue;
        }
        logDebug(chart, "eliminating pair " + node.getName() + ", " + partner.getName());
        chart.suspendNodeSorting();
        try {
          chart.removeNode(node);
          chart.removeNode(partner);
          chart.bind(before, after);
        } finally {
          chart.resumeNodeSorting();
        }
        return true;
      }
      return false;
    };
  }

  /**
   * Removes all but the highest-priority link among several links joining the same two nodes.
   */
  public static ReductionRule duplicateLinkElimination() {
    return chart -> {
      for (final PfcNode node : chart.getNodes()) {
        final List<PfcLink> successors = node.getSuccessors();
        for (int i = 0; i < successors.size(); i++) {
          for (int j = i + 1; j < successors.size(); j++) {
            if (successors.get(i).getSuccessor() == successors.get(j).getSuccessor()) {
              final PfcLink duplicate = successors.get(j);
              logDebug(chart, "eliminating duplicate link " + duplicate.getName());
              chart.removeLink(duplicate);
              return true;
            }
          }
        }
      }
      return false;
    };
  }

  private static void logDebug(final ProcedureFunctionChart chart, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[p:").append(chart.getName()).append("] ")
          .append(message));
    }
  }

}
