package com.github.pfc.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.function.Predicate;

import com.github.pfc.PfcNode;

/**
 * One defect found by {@link PfcValidator}. The subject is the offending node of the chart that
 * was validated, or null when the defect has no single node to blame.
 */
public final class PfcValidationError {
  private final Kind kind;
  private final String narrative;
  private final PfcNode subject;

  PfcValidationError(final Kind kind, final String narrative, final PfcNode subject) {
    this.kind = kind;
    this.narrative = narrative;
    this.subject = subject;
  }

  public Kind getKind() {
    return kind;
  }

  public String getName() {
    return kind.getDisplayName();
  }

  public String getNarrative() {
    return narrative;
  }

  public PfcNode getSubject() {
    return subject;
  }

  /**
   * Describes where the subject sits by naming the nearest nodes on either side that the
   * discriminator accepts, searching at most {@code distanceLimit} nodes away.
   */
  public String namesOfSubjectsNeighborNodes(final int distanceLimit,
      final Predicate<PfcNode> discriminator) {
    if (subject == null) {
      return "";
    }
    final List<String> before = collectNeighbors(subject.getPredecessorNodes(), distanceLimit,
        discriminator, true);
    final List<String> after = collectNeighbors(subject.getSuccessorNodes(), distanceLimit,
        discriminator, false);
    final String successors = after.isEmpty() ? "has no recognizable successors"
        : "is before " + toCommasAndAndedList(after);
    final String predecessors = before.isEmpty() ? "has no recognizable predecessors"
        : "is after " + toCommasAndAndedList(before);
    return "The node " + subject.getName() + " " + successors + " and " + predecessors + ".";
  }

  private static List<String> collectNeighbors(final List<PfcNode> start, final int distanceLimit,
      final Predicate<PfcNode> discriminator, final boolean upstream) {
    final List<String> names = new ArrayList<>();
    final Queue<PfcNode> frontier = new ArrayDeque<>(start);
    for (int distance = 0; distance < distanceLimit; distance++) {
      final int width = frontier.size();
      for (int i = 0; i < width; i++) {
        final PfcNode candidate = frontier.poll();
        if (discriminator.test(candidate)) {
          names.add(candidate.getName());
        } else {
          frontier.addAll(upstream ? candidate.getPredecessorNodes()
              : candidate.getSuccessorNodes());
        }
      }
    }
    return names;
  }

  static String toCommasAndAndedList(final List<String> names) {
    final StringBuilder builder = new StringBuilder();
    for (int i = 0; i < names.size(); i++) {
      if (i > 0) {
        builder.append(i == names.size() - 1 ? " and " : ", ");
      }
      builder.append(names.get(i));
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return getName() + ": " + narrative;
  }

  public static enum Kind {
    NO_START_NODE("No Start Node"),
    MULTIPLE_START_NODES("Multiple Start Nodes"),
    DUALITY_VIOLATION("Duality Violation"),
    UNREACHABLE_NODE("Unreachable PFC Node"),
    UNEXECUTED_NODE("Unexecuted PFC Node"),
    SERIAL_MISMATCH("Serial Di/Convergence Mismatch"),
    UNCOMPLETED_PARALLEL_BRANCHES("Uncompleted Parallel Branches"),
    PARALLEL_MISMATCH("Parallel Di/Convergence Mismatch"),
    NO_FINISH_NODE("No Finish Node"),
    MULTIPLE_FINISH_NODES("Multiple Finish Nodes"),
    FINISH_NOT_A_TRANSITION("Finish Node Is Not A Transition"),
    INTERNAL_FAILURE("Exception while validating.");

    private final String displayName;

    private Kind(final String displayName) {
      this.displayName = displayName;
    }

    public String getDisplayName() {
      return displayName;
    }
  }

}
