package com.github.pfc.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.pfc.NodeComparator;
import com.github.pfc.PfcElement;
import com.github.pfc.PfcElementType;
import com.github.pfc.PfcException;
import com.github.pfc.PfcLink;
import com.github.pfc.PfcNode;
import com.github.pfc.PfcStep;
import com.github.pfc.PfcTransition;
import com.github.pfc.ProcedureFunctionChart;
import com.github.pfc.Reductions;
import com.github.pfc.validation.PfcValidationError.Kind;

/**
 * Checks that a chart is well formed by pushing validation tokens through a reduced copy of it.
 *
 * Notes for users:<br>
 * 1. the chart passed in is never modified; every error's subject is a node of that chart<br>
 *
 * 2. validation runs once, in the constructor. Build a new validator after changing the chart<br>
 *
 * 3. parallel closures whose paths do not all lead back to one divergence take the token of the
 * closure's first predecessor, so nested mixtures of parallel and serial branches are judged
 * approximately<br>
 *
 * @author gaurav
 */
public final class PfcValidator {
  private static final Logger logger = LogManager.getLogger(PfcValidator.class.getSimpleName());

  private final ProcedureFunctionChart source;
  private final List<PfcValidationError> errors = new ArrayList<>();
  private final Map<PfcNode, NodeData> nodeData = new HashMap<>();
  private final Map<PfcLink, boolean[]> nodesBelow = new HashMap<>();
  private final List<PfcNode> workList = new ArrayList<>();
  private ProcedureFunctionChart scratch;
  private boolean[][] dependencies;
  private int tokenCount;
  private boolean valid;

  public PfcValidator(final ProcedureFunctionChart chart) {
    this.source = chart;
    try {
      scratch = chart.copy();
      scratch.reduce(Collections.singletonList(Reductions.sequentialPairElimination(false)));
      scratch.updateStructure();
      validate();
    } catch (PfcException | RuntimeException exception) {
      logError(chart.getName(), "validation failed", exception);
      errors.add(new PfcValidationError(Kind.INTERNAL_FAILURE, String.valueOf(
          exception.getMessage()), null));
      valid = false;
    }
    logDebug(chart.getName(), "valid:" + valid + ", errors:" + errors.size());
  }

  public boolean isValid() {
    return valid;
  }

  public List<PfcValidationError> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  private void validate() {
    final List<PfcStep> starts = scratch.getStartSteps();
    if (starts.isEmpty()) {
      errors.add(new PfcValidationError(Kind.NO_START_NODE,
          "Chart " + source.getName() + " has no step without predecessors to start from.", null));
      valid = false;
      return;
    }
    if (starts.size() > 1) {
      for (final PfcStep start : starts) {
        errors.add(new PfcValidationError(Kind.MULTIPLE_START_NODES, "Step " + start.getName()
            + " is one of " + starts.size() + " steps without predecessors.", original(start)));
      }
      valid = false;
      return;
    }
    for (final PfcNode node : scratch.getNodes()) {
      nodeData.put(node, new NodeData(node));
    }
    final boolean finishes = checkFinish();
    final boolean dual = checkDuality();
    buildDependencies(starts.get(0));
    propagate(starts.get(0));
    valid = check() && dual && finishes;
  }

  /*
   * Every path has to run out at the one finish transition.
   */
  private boolean checkFinish() {
    final List<PfcNode> terminals = new ArrayList<>();
    for (final PfcNode node : source.getNodes()) {
      if (node.getSuccessors().isEmpty()) {
        terminals.add(node);
      }
    }
    if (terminals.isEmpty()) {
      errors.add(new PfcValidationError(Kind.NO_FINISH_NODE, "Chart " + source.getName()
          + " has no node without successors, so it can never finish.", null));
      return false;
    }
    terminals.sort(Comparator.comparing(PfcElement::getName));
    boolean finishes = true;
    if (terminals.size() > 1) {
      for (final PfcNode terminal : terminals) {
        errors.add(new PfcValidationError(Kind.MULTIPLE_FINISH_NODES, "Node " + terminal.getName()
            + " is one of " + terminals.size() + " nodes without successors.", terminal));
      }
      finishes = false;
    }
    for (final PfcNode terminal : terminals) {
      if (terminal.getElementType() == PfcElementType.STEP) {
        errors.add(new PfcValidationError(Kind.FINISH_NOT_A_TRANSITION, "Step "
            + terminal.getName() + " has no successor transition to finish the path through it.",
            terminal));
        finishes = false;
      }
    }
    return finishes;
  }

  /*
   * A divergence may not lead into a convergence: the two would disagree on whether the paths
   * between them are parallel or alternative.
   */
  private boolean checkDuality() {
    boolean dual = true;
    for (final PfcNode node : scratch.getNodes()) {
      if (node.getSuccessors().size() < 2) {
        continue;
      }
      for (final PfcNode successor : node.getSuccessorNodes()) {
        if (successor.getPredecessors().size() > 1) {
          errors.add(new PfcValidationError(Kind.DUALITY_VIOLATION, "Node " + node.getName()
              + " diverges into " + successor.getName() + ", which also converges other paths.",
              original(node)));
          dual = false;
        }
      }
    }
    return dual;
  }

  // ---------------------------------------------------------------------------------------------
  // dependencies
  // ---------------------------------------------------------------------------------------------

  private void buildDependencies(final PfcStep start) {
    int maxOrdinal = 0;
    for (final PfcNode node : scratch.getNodes()) {
      maxOrdinal = Math.max(maxOrdinal, node.getGraphOrdinal());
    }
    final int size = maxOrdinal + 1;
    buildNodesBelow(start, new ArrayList<>(), size);
    dependencies = new boolean[size][size];
    for (final PfcLink link : scratch.getLinks()) {
      final boolean[] below = nodesBelow.get(link);
      if (below == null) {
        continue;
      }
      final boolean[] row = dependencies[link.getPredecessor().getGraphOrdinal()];
      for (int i = 0; i < size; i++) {
        row[i] |= below[i];
      }
    }
  }

  private void buildNodesBelow(final PfcNode node, final List<PfcLink> stack, final int size) {
    for (final PfcLink outbound : node.getSuccessors()) {
      if (stack.contains(outbound) || nodesBelow.containsKey(outbound)) {
        continue;
      }
      stack.add(outbound);
      buildNodesBelow(outbound.getSuccessor(), stack, size);
      stack.remove(stack.size() - 1);
      final boolean[] below = new boolean[size];
      below[outbound.getSuccessor().getGraphOrdinal()] = true;
      for (final PfcLink next : outbound.getSuccessor().getSuccessors()) {
        final boolean[] nextBelow = nodesBelow.get(next);
        if (nextBelow != null) {
          for (int i = 0; i < size; i++) {
            below[i] |= nextBelow[i];
          }
        }
      }
      nodesBelow.put(outbound, below);
    }
  }

  private boolean dependsOn(final PfcNode dependent, final PfcNode independent) {
    return dependencies[independent.getGraphOrdinal()][dependent.getGraphOrdinal()];
  }

  // ---------------------------------------------------------------------------------------------
  // token propagation
  // ---------------------------------------------------------------------------------------------

  private void propagate(final PfcStep start) {
    data(start).token = newToken(start, null);
    workList.add(start);
    while (!workList.isEmpty()) {
      final PfcNode node = dequeue();
      final NodeData data = data(node);
      data.dequeueCount++;
      logDebug(scratch.getName(), "dequeued " + node.getName() + " with " + data.token);
      boolean proceed = true;
      if (data.inputRole == InputRole.PARALLEL_CONVERGENCE) {
        proceed = processParallelConvergence(node);
      } else if (data.inputRole == InputRole.SERIAL_CONVERGENCE) {
        proceed = processSerialConvergence(node);
      }
      if (proceed) {
        switch (data.outputRole) {
          case PARALLEL_DIVERGENCE:
            processParallelDivergence(node);
            break;
          case SERIAL_DIVERGENCE:
            processSerialDivergence(node);
            break;
          case PASS_OUT:
            enqueue(node, node.getSuccessorNodes().get(0), data.token);
            break;
          case TERMINAL:
            data.token.decrementAlternatePathsOpen();
            break;
          default:
            break;
        }
      }
      data.hasRun = true;
    }
  }

  // only the first arrival carries on; later arrivals close their alternative path here
  private boolean processSerialConvergence(final PfcNode node) {
    final NodeData data = data(node);
    if (data.hasRun) {
      data.token.decrementAlternatePathsOpen();
      return false;
    }
    return true;
  }

  // runs on the last of the arrivals only
  private boolean processParallelConvergence(final PfcNode node) {
    if (data(node).dequeueCount == node.getPredecessorNodes().size()) {
      updateClosureToken(node);
      return true;
    }
    return false;
  }

  private void processParallelDivergence(final PfcNode node) {
    final ValidationToken token = data(node).token;
    for (final PfcNode successor : node.getSuccessorNodes()) {
      enqueue(node, successor, newToken(successor, token));
    }
    token.decrementAlternatePathsOpen();
  }

  private void processSerialDivergence(final PfcNode node) {
    final ValidationToken token = data(node).token;
    for (final PfcNode successor : node.getSuccessorNodes()) {
      token.incrementAlternatePathsOpen();
      enqueue(node, successor, token);
    }
    token.decrementAlternatePathsOpen();
  }

  private void enqueue(final PfcNode from, final PfcNode node, final ValidationToken token) {
    final NodeData data = data(node);
    if (data.inputRole == InputRole.PARALLEL_CONVERGENCE) {
      data(from).token.decrementAlternatePathsOpen();
      data.arrivals.add(token);
    }
    data.token = token;
    workList.add(node);
  }

  private PfcNode dequeue() {
    int best = 0;
    for (int i = 1; i < workList.size(); i++) {
      if (compareForProcessing(workList.get(i), workList.get(best)) < 0) {
        best = i;
      }
    }
    return workList.remove(best);
  }

  // parallel convergences last, then dependents after what they depend on, then graph order
  private int compareForProcessing(final PfcNode first, final PfcNode second) {
    final boolean firstCloses = data(first).inputRole == InputRole.PARALLEL_CONVERGENCE;
    final boolean secondCloses = data(second).inputRole == InputRole.PARALLEL_CONVERGENCE;
    if (firstCloses != secondCloses) {
      return firstCloses ? 1 : -1;
    }
    if (dependsOn(first, second)) {
      return 1;
    }
    if (dependsOn(second, first)) {
      return -1;
    }
    return Integer.compare(first.getGraphOrdinal(), second.getGraphOrdinal());
  }

  private ValidationToken newToken(final PfcNode origin, final ValidationToken parent) {
    return new ValidationToken("Token_" + tokenCount++, origin, parent);
  }

  // ---------------------------------------------------------------------------------------------
  // closure tokens
  // ---------------------------------------------------------------------------------------------

  private void updateClosureToken(final PfcNode closure) {
    final PfcNode divergence = divergenceNodeFor(closure);
    final boolean complete = divergence != null
        && allParallelAndOneOfEachSerialPathContain(divergence, closure, new HashMap<>(),
            new HashSet<>());
    final ValidationToken replacement = complete ? data(divergence).token
        : data(closure.getPredecessorNodes().get(0)).token;
    replacement.incrementAlternatePathsOpen();
    data(closure).token = replacement;
    logDebug(scratch.getName(), "closing " + closure.getName() + " with " + replacement);
  }

  /*
   * The youngest transition that the closure depends on and that every backward path from the
   * closure passes through.
   */
  private PfcNode divergenceNodeFor(final PfcNode closure) {
    final List<PfcNode> possibles = new ArrayList<>();
    for (final PfcTransition transition : scratch.getTransitions()) {
      if (dependsOn(closure, transition)) {
        possibles.add(transition);
      }
    }
    possibles.sort(Collections.reverseOrder(NodeComparator.INSTANCE));
    for (final PfcNode possible : possibles) {
      if (allBackwardPathsContain(closure, possible, new HashMap<>(), new HashSet<>())) {
        return possible;
      }
    }
    return null;
  }

  private static boolean allBackwardPathsContain(final PfcNode from, final PfcNode target,
      final Map<PfcNode, Boolean> known, final Set<PfcNode> inProgress) {
    final Boolean cached = known.get(from);
    if (cached != null) {
      return cached;
    }
    if (!inProgress.add(from)) {
      // a loop back to a node still being judged adds no path of its own
      return true;
    }
    boolean result;
    if (from.getPredecessors().isEmpty()) {
      result = false;
    } else if (from == target) {
      result = true;
    } else {
      result = true;
      for (final PfcNode predecessor : from.getPredecessorNodes()) {
        if (!allBackwardPathsContain(predecessor, target, known, inProgress)) {
          result = false;
          break;
        }
      }
    }
    inProgress.remove(from);
    known.put(from, result);
    return result;
  }

  private static boolean allParallelAndOneOfEachSerialPathContain(final PfcNode from,
      final PfcNode target, final Map<PfcNode, Boolean> known, final Set<PfcNode> inProgress) {
    final Boolean cached = known.get(from);
    if (cached != null) {
      return cached;
    }
    if (!inProgress.add(from)) {
      return false;
    }
    boolean result;
    if (from.getSuccessors().isEmpty()) {
      result = false;
    } else if (from == target) {
      result = true;
    } else if (from.getSuccessors().size() == 1) {
      result = allParallelAndOneOfEachSerialPathContain(from.getSuccessorNodes().get(0), target,
          known, inProgress);
    } else if (from.getElementType() == PfcElementType.STEP) {
      result = false;
      for (final PfcNode successor : from.getSuccessorNodes()) {
        result |= allParallelAndOneOfEachSerialPathContain(successor, target, known, inProgress);
      }
    } else {
      result = true;
      for (final PfcNode successor : from.getSuccessorNodes()) {
        result &= allParallelAndOneOfEachSerialPathContain(successor, target, known, inProgress);
      }
    }
    inProgress.remove(from);
    known.put(from, result);
    return result;
  }

  // ---------------------------------------------------------------------------------------------
  // verdict
  // ---------------------------------------------------------------------------------------------

  private boolean check() {
    final List<ValidationToken> tokensWithLiveChildren = new ArrayList<>();
    final List<ValidationToken> tokensWithOpenAlternates = new ArrayList<>();
    final List<PfcNode> unreachable = new ArrayList<>();
    final List<PfcNode> unexecuted = new ArrayList<>();
    final List<PfcNode> inconsistentConvergences = new ArrayList<>();
    final List<PfcNode> unmatchedClosures = new ArrayList<>();

    for (final PfcNode node : scratch.getNodes()) {
      final NodeData data = data(node);
      if (data.inputRole == InputRole.PARALLEL_CONVERGENCE && hasRepeatedArrival(data)) {
        unmatchedClosures.add(node);
      }
      final ValidationToken token = data.token;
      if (token == null) {
        unreachable.add(node);
        unexecuted.add(node);
        continue;
      }
      if (token.getAlternatePathsOpen() > 0 && !tokensWithOpenAlternates.contains(token)) {
        tokensWithOpenAlternates.add(token);
      }
      if (!data.hasRun) {
        unexecuted.add(node);
      }
      if (node.getElementType() == PfcElementType.STEP && node.getPredecessors().size() > 1) {
        final List<PfcNode> predecessors = node.getPredecessorNodes();
        final ValidationToken first = data(predecessors.get(0)).token;
        for (final PfcNode predecessor : predecessors) {
          if (!Objects.equals(first, data(predecessor).token)) {
            inconsistentConvergences.add(node);
            break;
          }
        }
      }
      if (token.isAnyChildLive() && !tokensWithLiveChildren.contains(token)) {
        tokensWithLiveChildren.add(token);
      }
    }

    final Comparator<PfcNode> byName = Comparator.comparing(PfcElement::getName);
    unreachable.sort(byName);
    unexecuted.sort(byName);
    inconsistentConvergences.sort(byName);
    unmatchedClosures.sort(byName);

    for (final PfcNode node : unreachable) {
      if (hasReachedPredecessor(node)) {
        errors.add(new PfcValidationError(Kind.UNREACHABLE_NODE, "Node " + node.getName()
            + ", along with others that follow it, is unreachable.", original(node)));
      }
    }
    for (final PfcNode node : unexecuted) {
      if (hasReachedPredecessor(node)) {
        errors.add(new PfcValidationError(Kind.UNEXECUTED_NODE,
            "Node " + node.getName() + " failed to run.", original(node)));
      }
    }
    for (final PfcNode node : inconsistentConvergences) {
      errors.add(new PfcValidationError(Kind.SERIAL_MISMATCH, "Branch paths (serial convergences)"
          + " into " + node.getName() + " do not all have the same validation token, meaning they"
          + " came from different branches (serial divergences).", original(node)));
    }
    for (final PfcNode node : unmatchedClosures) {
      errors.add(new PfcValidationError(Kind.PARALLEL_MISMATCH, "Parallel paths into "
          + node.getName() + " do not each come from their own parallel branch, meaning some of"
          + " them are alternatives (serial divergences) of one another.", original(node)));
    }
    for (final ValidationToken token : tokensWithLiveChildren) {
      final List<String> liveOrigins = new ArrayList<>();
      for (final ValidationToken child : token.getChildren()) {
        if (child.getAlternatePathsOpen() > 0) {
          liveOrigins.add(child.getOrigin().getName());
        }
      }
      final int open = token.getChildren().size();
      errors.add(new PfcValidationError(Kind.UNCOMPLETED_PARALLEL_BRANCHES, String.format(
          "Under %s, there %s %d parallel branch%s that did not complete - %s began at %s.",
          token.getOrigin().getName(), open == 1 ? "is" : "are", open, open == 1 ? "" : "es",
          open == 1 ? "it" : "they", PfcValidationError.toCommasAndAndedList(liveOrigins)),
          original(token.getOrigin())));
    }

    return tokensWithLiveChildren.isEmpty() && tokensWithOpenAlternates.isEmpty()
        && unreachable.isEmpty() && unexecuted.isEmpty() && inconsistentConvergences.isEmpty()
        && unmatchedClosures.isEmpty();
  }

  // one parallel branch, one arrival: a token seen twice came through alternatives
  private static boolean hasRepeatedArrival(final NodeData data) {
    final Set<ValidationToken> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (final ValidationToken arrival : data.arrivals) {
      if (!seen.add(arrival)) {
        return true;
      }
    }
    return false;
  }

  // reports only the first unreached node of an unreached stretch
  private boolean hasReachedPredecessor(final PfcNode node) {
    for (final PfcNode predecessor : node.getPredecessorNodes()) {
      if (data(predecessor).token != null) {
        return true;
      }
    }
    return false;
  }

  private NodeData data(final PfcNode node) {
    return nodeData.get(node);
  }

  private PfcNode original(final PfcNode scratchNode) {
    final PfcElement element = source.getElement(scratchNode.getSourceId());
    return element instanceof PfcNode ? (PfcNode) element : null;
  }

  private static enum InputRole {
    START, PASS_IN, SERIAL_CONVERGENCE, PARALLEL_CONVERGENCE
  }

  private static enum OutputRole {
    TERMINAL, PASS_OUT, SERIAL_DIVERGENCE, PARALLEL_DIVERGENCE
  }

  private static final class NodeData {
    private final InputRole inputRole;
    private final OutputRole outputRole;
    private final List<ValidationToken> arrivals = new ArrayList<>();
    private ValidationToken token;
    private boolean hasRun;
    private int dequeueCount;

    private NodeData(final PfcNode node) {
      final int in = node.getPredecessors().size();
      final int out = node.getSuccessors().size();
      final boolean step = node.getElementType() == PfcElementType.STEP;
      if (in == 0) {
        inputRole = InputRole.START;
      } else if (in == 1) {
        inputRole = InputRole.PASS_IN;
      } else {
        inputRole = step ? InputRole.SERIAL_CONVERGENCE : InputRole.PARALLEL_CONVERGENCE;
      }
      if (out == 0) {
        outputRole = OutputRole.TERMINAL;
      } else if (out == 1) {
        outputRole = OutputRole.PASS_OUT;
      } else {
        outputRole = step ? OutputRole.SERIAL_DIVERGENCE : OutputRole.PARALLEL_DIVERGENCE;
      }
    }
  }

  private static void logError(final String chartName, final String message,
      final Throwable problem) {
    logger.error(new StringBuilder().append("[v:").append(chartName).append("] ").append(message),
        problem);
  }

  private static void logDebug(final String chartName, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[v:").append(chartName).append("] ")
          .append(message));
    }
  }

}
