package com.github.pfc.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.pfc.NodeColor;
import com.github.pfc.PfcElement;
import com.github.pfc.PfcElementFactory;
import com.github.pfc.PfcElementType;
import com.github.pfc.PfcException;
import com.github.pfc.PfcException.Code;
import com.github.pfc.PfcLink;
import com.github.pfc.PfcNode;
import com.github.pfc.PfcStep;
import com.github.pfc.PfcTransition;
import com.github.pfc.ProcedureFunctionChart;
import com.github.pfc.validation.PfcValidator;

/**
 * Read-only structural queries over a chart: path shape, joins and divergences, primary and
 * priority paths, depths, and which new links would keep the chart valid.
 *
 * Notes for users:<br>
 * 1. an element argument may be a node or a link; a link is judged by the node it leads to unless
 * the query says otherwise<br>
 *
 * 2. the previous-divergence search behind {@link #hasParallelPaths(PfcElement)},
 * {@link #hasAlternatePaths(PfcElement)} and the join queries uses a convergence-level heuristic
 * that can misjudge deeply nested mixed divergences<br>
 *
 * 3. {@link #isTargetNodeLegal(PfcNode, PfcNode)} temporarily edits the chart and puts it back; the
 * chart must not be locked<br>
 *
 * @author gaurav
 */
public final class PfcAnalyst {
  private static final Logger logger = LogManager.getLogger(PfcAnalyst.class.getSimpleName());

  private PfcAnalyst() {}

  // ---------------------------------------------------------------------------------------------
  // link and path shape
  // ---------------------------------------------------------------------------------------------

  public static boolean isPostTransitionLink(final PfcLink link) {
    return link.getPredecessor() != null
        && link.getPredecessor().getElementType() == PfcElementType.TRANSITION;
  }

  public static boolean isPreTransitionLink(final PfcLink link) {
    return link.getSuccessor() != null
        && link.getSuccessor().getElementType() == PfcElementType.TRANSITION;
  }

  /**
   * True if the element is the only thing following its predecessor. For a node, it must have one
   * predecessor node, and that node must have no other successor.
   */
  public static boolean isSoleSuccessor(final PfcElement element) {
    if (element == null) {
      return false;
    }
    if (element instanceof PfcLink) {
      final PfcNode predecessor = ((PfcLink) element).getPredecessor();
      return predecessor != null && predecessor.getSuccessors().size() == 1;
    }
    final List<PfcNode> predecessors = ((PfcNode) element).getPredecessorNodes();
    return predecessors.size() == 1 && predecessors.get(0).getSuccessorNodes().size() == 1;
  }

  /**
   * True if the element lies on one of several paths leaving a parallel divergence.
   */
  public static boolean hasParallelPaths(final PfcElement element) {
    if (element == null) {
      return false;
    }
    if (element instanceof PfcLink) {
      final PfcNode predecessor = ((PfcLink) element).getPredecessor();
      if (predecessor != null && predecessor.getElementType() == PfcElementType.TRANSITION
          && predecessor.getSuccessors().size() > 1) {
        return true;
      }
      return hasParallelPaths(predecessor);
    }
    final PfcNode divergence = getPrevDivergenceNode(element);
    return divergence != null && divergence.getElementType() == PfcElementType.TRANSITION;
  }

  /**
   * True if the element lies on one of several alternative paths leaving a serial divergence.
   */
  public static boolean hasAlternatePaths(final PfcElement element) {
    if (element == null) {
      return false;
    }
    if (element instanceof PfcLink) {
      final PfcNode predecessor = ((PfcLink) element).getPredecessor();
      if (predecessor != null && predecessor.getElementType() == PfcElementType.STEP
          && predecessor.getSuccessors().size() > 1) {
        return true;
      }
      return hasAlternatePaths(predecessor);
    }
    final PfcNode divergence = getPrevDivergenceNode(element);
    return divergence != null && divergence.getElementType() == PfcElementType.STEP;
  }

  /**
   * True if nothing on the element's own path follows it: every successor is a convergence and
   * every predecessor is a divergence.
   */
  public static boolean isLastElementOnPath(final PfcElement element) {
    if (element instanceof PfcLink) {
      final PfcLink link = (PfcLink) element;
      if (link.getPredecessor().getSuccessorNodes().size() == 1) {
        return false;
      }
      return link.getSuccessor().getPredecessorNodes().size() != 1;
    }
    final PfcNode node = (PfcNode) element;
    for (final PfcNode predecessor : node.getPredecessorNodes()) {
      if (predecessor.getSuccessorNodes().size() == 1) {
        return false;
      }
    }
    for (final PfcNode successor : node.getSuccessorNodes()) {
      if (successor.getPredecessorNodes().size() == 1) {
        return false;
      }
    }
    return true;
  }

  public static boolean isLastElementOnAlternatePath(final PfcElement element) {
    return hasAlternatePaths(element) && isLastElementOnPath(element);
  }

  public static boolean isLastElementOnParallelPath(final PfcElement element) {
    return hasParallelPaths(element) && isLastElementOnPath(element);
  }

  // ---------------------------------------------------------------------------------------------
  // divergences and joins
  // ---------------------------------------------------------------------------------------------

  /**
   * The node where the paths leaving the given divergence come back together, or null if the node
   * does not diverge.
   */
  public static PfcNode getConvergenceNodeFor(final PfcNode divergenceNode) {
    if (divergenceNode.getSuccessorNodes().size() < 2) {
      return null;
    }
    return getJoinNodeForParallelPath(divergenceNode.getSuccessorNodes().get(0));
  }

  /**
   * The node whose paths meet at the given convergence, or null if the node does not converge.
   */
  public static PfcNode getDivergenceNodeFor(final PfcNode convergenceNode) {
    if (convergenceNode.getPredecessorNodes().size() < 2) {
      return null;
    }
    return getDivergenceElementForParallelPath(convergenceNode.getPredecessorNodes().get(0));
  }

  public static PfcStep getJoinNodeForAlternatePaths(final PfcElement element) {
    final PfcNode join = getJoinNodeForParallelPath(element);
    return join instanceof PfcStep ? (PfcStep) join : null;
  }

  public static PfcTransition getJoinTransitionForSimultaneousPaths(final PfcElement element) {
    final PfcNode join = getJoinNodeForParallelPath(element);
    return join instanceof PfcTransition ? (PfcTransition) join : null;
  }

  /**
   * Finds the divergence the element's path leaves from, walks every path out of it, and returns
   * the first node that all of those paths reach. Returns null if there is no such divergence or
   * the paths never meet.
   */
  public static PfcNode getJoinNodeForParallelPath(final PfcElement element) {
    final PfcNode divergence = getPrevDivergenceNode(element);
    if (divergence == null) {
      return null;
    }
    final List<PfcNode> pathHeads = divergence.getSuccessorNodes();
    final Map<PfcNode, Integer> hitCounts = new HashMap<>();
    final PfcNode[] convergence = new PfcNode[1];
    for (final PfcNode head : pathHeads) {
      traverse(pathHeads.size(), head, new HashSet<>(), hitCounts, convergence);
    }
    return convergence[0];
  }

  public static PfcNode getDivergenceElementForParallelPath(final PfcElement element) {
    return getPrevDivergenceNode(element);
  }

  private static void traverse(final int pathCount, final PfcNode current,
      final Set<PfcNode> beenThere, final Map<PfcNode, Integer> hitCounts,
      final PfcNode[] convergence) {
    if (convergence[0] != null || !beenThere.add(current)) {
      return;
    }
    final int hits = hitCounts.merge(current, 1, Integer::sum);
    if (hits == pathCount) {
      convergence[0] = current;
      return;
    }
    for (final PfcNode downstream : current.getSuccessorNodes()) {
      traverse(pathCount, downstream, beenThere, hitCounts, convergence);
    }
  }

  /**
   * The nearest upstream divergence that the element's path leaves from, or null.
   */
  public static PfcNode getPrevDivergenceNode(final PfcElement element) {
    final PfcNode origin = element instanceof PfcLink ? ((PfcLink) element).getSuccessor()
        : (PfcNode) element;
    if (origin == null) {
      return null;
    }
    final Set<PfcNode> beenThere = new HashSet<>();
    beenThere.add(origin);
    return getPrevDivergenceNode(origin, 0, beenThere);
  }

  // Walks upstream. Passing a divergence lowers the level and passing a convergence raises it;
  // the divergence that takes the level to -1 is the one this path left from. The level carries
  // over between sibling predecessors.
  private static PfcNode getPrevDivergenceNode(final PfcNode node, int convergenceLevel,
      final Set<PfcNode> beenThere) {
    for (final PfcNode predecessor : node.getPredecessorNodes()) {
      if (!beenThere.add(predecessor)) {
        continue;
      }
      if (predecessor.getSuccessorNodes().size() > 1) {
        convergenceLevel--;
      }
      if (convergenceLevel == -1) {
        return predecessor;
      }
      if (predecessor.getPredecessorNodes().size() > 1) {
        convergenceLevel++;
      }
      final PfcNode found = getPrevDivergenceNode(predecessor, convergenceLevel, beenThere);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  // ---------------------------------------------------------------------------------------------
  // link targets
  // ---------------------------------------------------------------------------------------------

  /**
   * Every node of the origin's chart that could be linked from the origin without making the chart
   * invalid.
   */
  public static List<PfcNode> getPermissibleTargetsForLinkFrom(final PfcNode origin)
      throws PfcException {
    final List<PfcNode> targets = new ArrayList<>();
    for (final PfcNode candidate : new ArrayList<>(origin.getParent().getNodes())) {
      if (isTargetNodeLegal(origin, candidate)) {
        targets.add(candidate);
      }
    }
    logDebug(origin.getParent().getName(), "permissible targets from " + origin.getName()
        + ": " + toCommasAndAndedList(targets));
    return targets;
  }

  /**
   * True if linking the origin to the target, through a shim of the other kind, leaves a valid
   * chart. Only nodes of the same kind are considered. The trial link and shim are removed and the
   * element factory's counters put back before returning.
   */
  public static boolean isTargetNodeLegal(final PfcNode origin, final PfcNode target)
      throws PfcException {
    if (origin.getElementType() != target.getElementType()) {
      return false;
    }
    final ProcedureFunctionChart chart = origin.getParent();
    final PfcElementFactory factory = chart.getElementFactory();
    final PfcElementFactory.Mark mark = factory.mark();
    final ProcedureFunctionChart.BindResult trial = chart.bind(origin, target, false);
    final boolean legal;
    try {
      legal = new PfcValidator(chart).isValid();
    } finally {
      final PfcNode shim = trial.getShim();
      chart.unbind(origin, shim, true);
      chart.unbind(shim, target, true);
      chart.delete(shim);
      chart.updateStructure();
      factory.retract(mark);
    }
    return legal;
  }

  // ---------------------------------------------------------------------------------------------
  // start, finish, primary path and depths
  // ---------------------------------------------------------------------------------------------

  /**
   * The first step with no predecessors, or null.
   */
  public static PfcStep getStartStep(final ProcedureFunctionChart chart) {
    for (final PfcStep step : chart.getSteps()) {
      if (step.getPredecessorNodes().isEmpty()) {
        return step;
      }
    }
    return null;
  }

  /**
   * The first step with no successors, or null.
   */
  public static PfcStep getFinishStep(final ProcedureFunctionChart chart) {
    for (final PfcStep step : chart.getSteps()) {
      if (step.getSuccessorNodes().isEmpty()) {
        return step;
      }
    }
    return null;
  }

  /**
   * Follows the first (highest priority) successor from the start point until a node with no
   * successors is reached.
   *
   * @throws PfcException with {@link Code#PRIMARY_PATH_LOOP} if the walk comes back to a node it
   *         has already visited
   */
  public static List<PfcNode> getPrimaryPath(final PfcNode startPoint, final boolean stepsOnly)
      throws PfcException {
    final List<PfcNode> walked = new ArrayList<>();
    final List<PfcNode> path = new ArrayList<>();
    PfcNode cursor = startPoint;
    while (true) {
      final int seenAt = walked.indexOf(cursor);
      if (seenAt >= 0) {
        throw new PfcException(Code.PRIMARY_PATH_LOOP,
            "Primary path contains a loop, which consists of "
                + toCommasAndAndedList(walked.subList(seenAt, walked.size())) + "!");
      }
      walked.add(cursor);
      if (!stepsOnly || cursor.getElementType() == PfcElementType.STEP) {
        path.add(cursor);
      }
      if (cursor.getSuccessors().isEmpty()) {
        return path;
      }
      cursor = cursor.getSuccessorNodes().get(0);
    }
  }

  public static String getPrimaryPathAsString(final PfcNode startPoint, final boolean stepsOnly)
      throws PfcException {
    return toCommasAndAndedList(getPrimaryPath(startPoint, stepsOnly));
  }

  /**
   * Depth of every node that reaches the finish transition: nodes with no predecessors are at
   * depth 0, every other node is one deeper than its deepest predecessor. Predecessors reached
   * through a loop back are not counted.
   */
  public static Map<PfcNode, Integer> getNodeDepths(final ProcedureFunctionChart chart)
      throws PfcException {
    final PfcTransition finish = chart.getFinishTransition();
    if (finish == null) {
      throw new PfcException(Code.MALFORMED_CHART,
          "Chart " + chart.getName() + " has no finish transition to measure depths from.");
    }
    final Map<PfcNode, Integer> depths = new LinkedHashMap<>();
    getDepth(finish, depths, new HashSet<>());
    return depths;
  }

  private static int getDepth(final PfcNode node, final Map<PfcNode, Integer> depths,
      final Set<PfcNode> inProgress) {
    final Integer known = depths.get(node);
    if (known != null) {
      return known;
    }
    inProgress.add(node);
    int depth = 0;
    for (final PfcNode predecessor : node.getPredecessorNodes()) {
      if (!inProgress.contains(predecessor)) {
        depth = Math.max(depth, getDepth(predecessor, depths, inProgress) + 1);
      }
    }
    inProgress.remove(node);
    depths.put(node, depth);
    return depth;
  }

  /**
   * Maps each step to the given transition that follows it ({@code precedingStep}) or that
   * precedes it. Only the first neighbor of each transition is considered.
   */
  public static Map<PfcStep, PfcTransition> getTransitionToStepMappings(
      final Collection<PfcTransition> transitions, final boolean precedingStep) {
    final Map<PfcStep, PfcTransition> mappings = new LinkedHashMap<>();
    for (final PfcTransition transition : transitions) {
      final List<PfcNode> neighbors = precedingStep ? transition.getPredecessorNodes()
          : transition.getSuccessorNodes();
      if (!neighbors.isEmpty() && neighbors.get(0) instanceof PfcStep) {
        mappings.put((PfcStep) neighbors.get(0), transition);
      }
    }
    return mappings;
  }

  // ---------------------------------------------------------------------------------------------
  // weighted and priority paths
  // ---------------------------------------------------------------------------------------------

  /**
   * Sets every link's priority to the breadth of the non-looping sub-chart behind it, so that the
   * highest-priority successor of each serial divergence leads down the broadest path. Links that
   * close a loop get large negative priorities and links that cannot be reached from the start
   * get {@link Integer#MIN_VALUE}.
   *
   * @return the weight of the start step
   */
  public static int assignWeightsForBroadestNonLoopingPath(final ProcedureFunctionChart chart)
      throws PfcException {
    final List<PfcStep> starts = chart.getStartSteps();
    if (starts.isEmpty()) {
      throw new PfcException(Code.MALFORMED_CHART,
          "Chart " + chart.getName() + " has no start step to weigh paths from.");
    }
    for (final PfcNode node : chart.getNodes()) {
      node.setNodeColor(NodeColor.WHITE);
    }
    final Map<PfcLink, Integer> weights = new HashMap<>();
    final int result = weigh(starts.get(0), weights);
    for (final PfcLink link : chart.getLinks()) {
      final Integer weight = weights.get(link);
      if (weight == null) {
        link.setPriority(Integer.MIN_VALUE);
      } else if (weight < 0) {
        link.setPriority(Integer.MIN_VALUE - weight);
      } else {
        link.setPriority(weight);
      }
    }
    return result;
  }

  private static int weigh(final PfcNode node, final Map<PfcLink, Integer> weights) {
    if (node.getNodeColor() == NodeColor.BLACK) {
      return Integer.MIN_VALUE;
    }
    if (node.getSuccessors().isEmpty()) {
      return 1;
    }
    node.setNodeColor(NodeColor.BLACK);
    for (final PfcLink link : node.getSuccessors()) {
      if (!weights.containsKey(link)) {
        weights.put(link, weigh(link.getSuccessor(), weights));
      }
    }
    node.setNodeColor(NodeColor.WHITE);

    if (node instanceof PfcStep) {
      int max = Integer.MIN_VALUE;
      for (final PfcLink link : node.getSuccessors()) {
        max = Math.max(max, weights.get(link));
      }
      return max + 1;
    }
    int total = 0;
    int maxNegative = Integer.MIN_VALUE;
    boolean anyNegative = false;
    for (final PfcLink link : node.getSuccessors()) {
      final int weight = weights.get(link);
      if (weight < 0) {
        anyNegative = true;
        maxNegative = Math.max(maxNegative, weight);
      } else {
        total += weight;
      }
    }
    return anyNegative ? maxNegative + 1 : total;
  }

  /**
   * Weighs the chart's links as {@link #assignWeightsForBroadestNonLoopingPath} does and returns
   * the resulting priority path.
   */
  public static List<PfcNode> getNodesOnBroadestNonLoopingPath(final ProcedureFunctionChart chart,
      final boolean restoreOldLinkPriorities) throws PfcException {
    final Map<PfcLink, Integer> saved = new HashMap<>();
    for (final PfcLink link : chart.getLinks()) {
      saved.put(link, link.getPriority());
    }
    try {
      assignWeightsForBroadestNonLoopingPath(chart);
      return getNodesOnPriorityPath(chart);
    } finally {
      if (restoreOldLinkPriorities) {
        for (final Map.Entry<PfcLink, Integer> entry : saved.entrySet()) {
          entry.getKey().setPriority(entry.getValue());
        }
      }
    }
  }

  /**
   * The nodes a run would visit if every serial divergence took its highest-priority link (the
   * first of equals) and every parallel divergence took all of its links. A transition is visited
   * only after all of its predecessors.
   *
   * @throws PfcException with {@link Code#PRIMARY_PATH_LOOP} if a serial divergence's chosen link
   *         leads back to a visited node, or {@link Code#MALFORMED_CHART} if the walk cannot
   *         proceed
   */
  public static List<PfcNode> getNodesOnPriorityPath(final ProcedureFunctionChart chart)
      throws PfcException {
    final List<PfcStep> starts = chart.getStartSteps();
    if (starts.isEmpty()) {
      throw new PfcException(Code.MALFORMED_CHART,
          "Chart " + chart.getName() + " has no start step to follow priorities from.");
    }
    for (final PfcNode node : chart.getNodes()) {
      node.setNodeColor(NodeColor.WHITE);
    }
    final List<PfcNode> sequence = new ArrayList<>();
    final Queue<PfcNode> working = new ArrayDeque<>();
    final PfcNode starter = starts.get(0);
    starter.setNodeColor(NodeColor.GRAY);
    working.add(starter);

    int deferrals = 0;
    while (!working.isEmpty()) {
      final PfcNode current = working.poll();
      if (current instanceof PfcTransition && !allPredecessorsVisited(current)
          && !current.getSuccessors().isEmpty()) {
        working.add(current);
        if (++deferrals > working.size()) {
          throw new PfcException(Code.MALFORMED_CHART, "Priority path through chart "
              + chart.getName() + " stalled waiting on the predecessors of "
              + toCommasAndAndedList(new ArrayList<>(working)) + ".");
        }
        continue;
      }
      deferrals = 0;
      current.setNodeColor(NodeColor.BLACK);
      sequence.add(current);
      if (current.getSuccessors().isEmpty()) {
        continue;
      }
      if (current instanceof PfcTransition || current.getSuccessors().size() == 1) {
        for (final PfcNode next : current.getSuccessorNodes()) {
          enqueueIfWhite(next, working);
        }
      } else {
        final PfcNode next = highestPriorityLink(current).getSuccessor();
        if (next.getNodeColor() == NodeColor.BLACK) {
          throw new PfcException(Code.PRIMARY_PATH_LOOP, "Primary path contains a loop, "
              + current.getName() + " chooses to go back to " + next.getName() + ".");
        }
        enqueueIfWhite(next, working);
      }
    }
    return sequence;
  }

  private static boolean allPredecessorsVisited(final PfcNode node) {
    for (final PfcNode predecessor : node.getPredecessorNodes()) {
      if (predecessor.getNodeColor() != NodeColor.BLACK) {
        return false;
      }
    }
    return true;
  }

  private static void enqueueIfWhite(final PfcNode next, final Queue<PfcNode> working) {
    if (next.getNodeColor() == NodeColor.WHITE) {
      next.setNodeColor(NodeColor.GRAY);
      working.add(next);
    }
  }

  private static PfcLink highestPriorityLink(final PfcNode node) {
    PfcLink best = null;
    for (final PfcLink link : node.getSuccessors()) {
      if (best == null || link.getPriority() > best.getPriority()) {
        best = link;
      }
    }
    return best;
  }

  // ---------------------------------------------------------------------------------------------
  // formatting
  // ---------------------------------------------------------------------------------------------

  /**
   * Formats element names as {@code "A, B and C"}.
   */
  public static String toCommasAndAndedList(final List<? extends PfcElement> elements) {
    final StringBuilder builder = new StringBuilder();
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        builder.append(i == elements.size() - 1 ? " and " : ", ");
      }
      builder.append(elements.get(i).getName());
    }
    return builder.toString();
  }

  private static void logDebug(final String chartName, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[p:").append(chartName).append("] ")
          .append(message));
    }
  }

}
