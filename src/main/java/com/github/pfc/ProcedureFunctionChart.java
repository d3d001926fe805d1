package com.github.pfc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.pfc.PfcException.Code;
import com.github.pfc.execution.ExecutionEngine;
import com.github.pfc.execution.ExecutionEngineConfiguration;
import com.github.pfc.execution.PfcExecutionContext;
import com.github.pfc.executive.EventController;
import com.github.pfc.executive.EventType;
import com.github.pfc.executive.Executive;

/**
 * A Procedure Function Chart: a bipartite directed graph of steps and transitions joined by
 * priority-ordered links.
 *
 * Notes for users:<br>
 * 1. every element is created through the chart and stays owned by it<br>
 *
 * 2. binding two nodes of the same kind inserts a shim node of the other kind, so the graph always
 * alternates between steps and transitions<br>
 *
 * 3. every structural edit is followed by {@link #updateStructure()}, which re-sorts successor
 * links and reassigns graph ordinals. Bracket bulk edits with {@link #suspendNodeSorting()} and
 * {@link #resumeNodeSorting()} to run it only once<br>
 *
 * 4. a chart is not thread-safe. Build it on one thread; once an execution engine is attached the
 * structure is locked (unless configured otherwise) and only runs touch it<br>
 *
 * @author gaurav
 */
public class ProcedureFunctionChart {
  private static final Logger logger =
      LogManager.getLogger(ProcedureFunctionChart.class.getSimpleName());

  private final UUID id;
  private String name;
  private String description;

  private final Map<UUID, PfcElement> elements = new HashMap<>();
  private final List<PfcNode> nodes = new ArrayList<>();
  private final List<PfcStep> steps = new ArrayList<>();
  private final List<PfcTransition> transitions = new ArrayList<>();
  private final List<PfcLink> links = new ArrayList<>();
  private final PfcElementFactory elementFactory = new PfcElementFactory(this);

  private int sortSuspensions;
  private boolean structureDirty;
  private long structureUpdateCount;
  private boolean structureLocked;

  private PfcStep parentStep;
  private PfcAction precondition;
  private long earliestStart = Long.MIN_VALUE;
  private ExecutionEngineConfiguration engineConfiguration =
      ExecutionEngineConfiguration.defaults();
  private ExecutionEngine executionEngine;
  private final List<PfcLifecycleListener> lifecycleListeners = new CopyOnWriteArrayList<>();

  public ProcedureFunctionChart(final String name) {
    this(name, null, UUID.randomUUID());
  }

  public ProcedureFunctionChart(final String name, final String description, final UUID id) {
    this.name = name;
    this.description = description;
    this.id = id == null ? UUID.randomUUID() : id;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(final String description) {
    this.description = description;
  }

  public PfcElementFactory getElementFactory() {
    return elementFactory;
  }

  /**
   * All nodes, in graph order once the structure has been updated.
   */
  public List<PfcNode> getNodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<PfcStep> getSteps() {
    return Collections.unmodifiableList(steps);
  }

  public List<PfcTransition> getTransitions() {
    return Collections.unmodifiableList(transitions);
  }

  public List<PfcLink> getLinks() {
    return Collections.unmodifiableList(links);
  }

  public PfcElement getElement(final UUID elementId) {
    return elements.get(elementId);
  }

  /**
   * The step this chart is an action of, or null for a top-level chart.
   */
  public PfcStep getParentStep() {
    return parentStep;
  }

  void setParentStep(final PfcStep parentStep) {
    this.parentStep = parentStep;
  }

  // ---------------------------------------------------------------------------------------------
  // element creation
  // ---------------------------------------------------------------------------------------------

  public PfcStep createStep() throws PfcException {
    return createStep(null, null, null);
  }

  public PfcStep createStep(final String stepName, final String stepDescription,
      final UUID stepId) throws PfcException {
    checkUnlocked();
    final UUID elementId = claimId(stepId);
    final String elementName = stepName == null ? elementFactory.nextStepName() : stepName;
    final PfcStep step = new PfcStep(this, elementName, stepDescription, elementId);
    register(step);
    return step;
  }

  public PfcTransition createTransition() throws PfcException {
    return createTransition(null, null, null);
  }

  public PfcTransition createTransition(final String transitionName,
      final String transitionDescription, final UUID transitionId) throws PfcException {
    checkUnlocked();
    final UUID elementId = claimId(transitionId);
    final String elementName =
        transitionName == null ? elementFactory.nextTransitionName() : transitionName;
    final PfcTransition transition =
        new PfcTransition(this, elementName, transitionDescription, elementId);
    register(transition);
    return transition;
  }

  public PfcLink createLink() throws PfcException {
    return createLink(null, null, null);
  }

  public PfcLink createLink(final String linkName, final String linkDescription,
      final UUID linkId) throws PfcException {
    checkUnlocked();
    final UUID elementId = claimId(linkId);
    final String elementName = linkName == null ? elementFactory.nextLinkName() : linkName;
    final PfcLink link = new PfcLink(this, elementName, linkDescription, elementId);
    register(link);
    return link;
  }

  /**
   * Creates a link and binds whichever of its ends are given.
   */
  public PfcLink createLink(final String linkName, final String linkDescription,
      final UUID linkId, final PfcNode predecessor, final PfcNode successor) throws PfcException {
    if (predecessor != null) {
      checkOwnership(predecessor);
    }
    if (successor != null) {
      checkOwnership(successor);
    }
    suspendNodeSorting();
    try {
      final PfcLink link = createLink(linkName, linkDescription, linkId);
      if (predecessor != null) {
        bind(predecessor, link);
      }
      if (successor != null) {
        bind(link, successor);
      }
      return link;
    } finally {
      resumeNodeSorting();
    }
  }

  private UUID claimId(final UUID requested) throws PfcException {
    final UUID elementId = requested == null ? elementFactory.nextId() : requested;
    if (elements.containsKey(elementId)) {
      throw new PfcException(Code.DUPLICATE_ELEMENT_ID,
          "Chart " + name + " already holds an element with id " + elementId + ".");
    }
    return elementId;
  }

  private void register(final PfcElement element) {
    elements.put(element.getId(), element);
    switch (element.getElementType()) {
      case STEP:
        steps.add((PfcStep) element);
        nodes.add((PfcNode) element);
        break;
      case TRANSITION:
        transitions.add((PfcTransition) element);
        nodes.add((PfcNode) element);
        break;
      case LINK:
        links.add((PfcLink) element);
        break;
    }
    structureChanged();
  }

  boolean isNameInUse(final String candidate) {
    for (final PfcElement element : elements.values()) {
      if (candidate.equals(element.getName())) {
        return true;
      }
    }
    return false;
  }

  void renameElement(final PfcElement element, final String newName) throws PfcException {
    for (final PfcElement other : elements.values()) {
      if (other != element && newName.equals(other.getName())) {
        throw new PfcException(Code.DUPLICATE_ELEMENT_NAME,
            "Cannot rename " + element.getName() + " to " + newName + " in chart " + name
                + ", the name is already in use.");
      }
    }
    element.assignName(newName);
  }

  // ---------------------------------------------------------------------------------------------
  // binding
  // ---------------------------------------------------------------------------------------------

  /**
   * Attaches the predecessor end of the given link to the node.
   */
  public void bind(final PfcNode predecessor, final PfcLink link) throws PfcException {
    checkOwnership(predecessor);
    checkOwnership(link);
    checkUnlocked();
    link.setPredecessor(predecessor);
    predecessor.addSuccessor(link);
    structureChanged();
  }

  /**
   * Attaches the successor end of the given link to the node.
   */
  public void bind(final PfcLink link, final PfcNode successor) throws PfcException {
    checkOwnership(link);
    checkOwnership(successor);
    checkUnlocked();
    link.setSuccessor(successor);
    successor.addPredecessor(link);
    structureChanged();
  }

  public BindResult bind(final PfcNode from, final PfcNode to) throws PfcException {
    return bind(from, to, true);
  }

  /**
   * Connects two nodes. Nodes of different kinds get a direct link; nodes of the same kind get a
   * shim node of the other kind between two links. With piggybacking allowed, an existing direct
   * link or an existing simple shim between the two nodes is reused instead.
   */
  public BindResult bind(final PfcNode from, final PfcNode to, final boolean allowPiggybacking)
      throws PfcException {
    checkOwnership(from);
    checkOwnership(to);
    checkUnlocked();
    if (from.getElementType() != to.getElementType()) {
      if (allowPiggybacking) {
        final PfcLink existing = from.getLinkForSuccessorNode(to);
        if (existing != null) {
          return new BindResult(existing, null, null);
        }
      }
      suspendNodeSorting();
      try {
        final PfcLink link = createLink();
        bind(from, link);
        bind(link, to);
        return new BindResult(link, null, null);
      } finally {
        resumeNodeSorting();
      }
    }

    if (allowPiggybacking) {
      for (final PfcLink first : from.getSuccessors()) {
        final PfcNode shim = first.getSuccessor();
        if (shim != null && shim.isSimple() && shim.getSuccessors().get(0).getSuccessor() == to) {
          return new BindResult(first, shim, shim.getSuccessors().get(0));
        }
      }
    }
    suspendNodeSorting();
    try {
      final PfcNode shim = from.getElementType() == PfcElementType.STEP ? createTransition()
          : createStep();
      final PfcLink first = createLink();
      final PfcLink second = createLink();
      bind(from, first);
      bind(first, shim);
      bind(shim, second);
      bind(second, to);
      return new BindResult(first, shim, second);
    } finally {
      resumeNodeSorting();
    }
  }

  /**
   * Parallel divergence: the paths to the targets leave through one transition.
   */
  public void bindParallelDivergent(final PfcNode from, final PfcNode[] to) throws PfcException {
    suspendNodeSorting();
    try {
      PfcNode fork = from;
      if (from.getElementType() == PfcElementType.STEP) {
        fork = createTransition();
        bind(from, fork);
      }
      for (final PfcNode target : to) {
        bind(fork, target);
      }
    } finally {
      resumeNodeSorting();
    }
  }

  /**
   * Serial divergence: the paths to the targets are alternatives leaving one step.
   */
  public void bindSeriesDivergent(final PfcNode from, final PfcNode[] to) throws PfcException {
    suspendNodeSorting();
    try {
      PfcNode branch = from;
      if (from.getElementType() == PfcElementType.TRANSITION) {
        branch = createStep();
        bind(from, branch);
      }
      for (final PfcNode target : to) {
        bind(branch, target);
      }
    } finally {
      resumeNodeSorting();
    }
  }

  /**
   * Parallel convergence: the paths from the sources join at one transition.
   */
  public void bindParallelConvergent(final PfcNode[] from, final PfcNode to) throws PfcException {
    suspendNodeSorting();
    try {
      PfcNode join = to;
      if (to.getElementType() == PfcElementType.STEP) {
        join = createTransition();
        bind(join, to);
      }
      for (final PfcNode source : from) {
        bind(source, join);
      }
    } finally {
      resumeNodeSorting();
    }
  }

  /**
   * Serial convergence: the alternative paths from the sources merge at one step.
   */
  public void bindSeriesConvergent(final PfcNode[] from, final PfcNode to) throws PfcException {
    suspendNodeSorting();
    try {
      PfcNode merge = to;
      if (to.getElementType() == PfcElementType.TRANSITION) {
        merge = createStep();
        bind(merge, to);
      }
      for (final PfcNode source : from) {
        bind(source, merge);
      }
    } finally {
      resumeNodeSorting();
    }
  }

  /**
   * Joins every predecessor to every successor through one new synchronizing transition. When the
   * nodes are transitions, each is connected to the synchronizer through a shim step.
   */
  public PfcTransition synchronize(final PfcNode[] predecessors, final PfcNode[] successors)
      throws PfcException {
    if (predecessors == null || successors == null || predecessors.length == 0
        || successors.length == 0) {
      throw new PfcException(Code.INVALID_SYNCHRONIZATION,
          "Synchronization needs at least one predecessor and one successor.");
    }
    final PfcElementType kind = predecessors[0].getElementType();
    for (final PfcNode node : predecessors) {
      checkSynchronizationKind(node, kind);
    }
    for (final PfcNode node : successors) {
      checkSynchronizationKind(node, kind);
    }
    suspendNodeSorting();
    try {
      final PfcTransition synchronizer = createTransition();
      for (final PfcNode predecessor : predecessors) {
        bind(predecessor, synchronizer);
      }
      for (final PfcNode successor : successors) {
        bind(synchronizer, successor);
      }
      return synchronizer;
    } finally {
      resumeNodeSorting();
    }
  }

  private void checkSynchronizationKind(final PfcNode node, final PfcElementType kind)
      throws PfcException {
    checkOwnership(node);
    if (node.getElementType() != kind) {
      throw new PfcException(Code.INVALID_SYNCHRONIZATION, "Cannot synchronize " + node.getName()
          + " with nodes of kind " + kind + ", all nodes must be of the same kind.");
    }
  }

  /**
   * Gives the link the highest possible priority so it leads the primary path.
   */
  public void makeLinkPrimary(final PfcLink link) throws PfcException {
    checkOwnership(link);
    link.setPriority(Integer.MAX_VALUE);
    structureChanged();
  }

  // ---------------------------------------------------------------------------------------------
  // unbinding and deletion
  // ---------------------------------------------------------------------------------------------

  public boolean unbind(final PfcNode from, final PfcNode to) throws PfcException {
    return unbind(from, to, false);
  }

  /**
   * Removes the direct link from one node to the other, if there is one.
   */
  public boolean unbind(final PfcNode from, final PfcNode to,
      final boolean skipStructureUpdating) throws PfcException {
    checkOwnership(from);
    checkOwnership(to);
    checkUnlocked();
    final PfcLink link = from.getLinkForSuccessorNode(to);
    if (link == null) {
      return false;
    }
    disconnect(link);
    deregister(link);
    if (skipStructureUpdating) {
      structureDirty = true;
    } else {
      structureChanged();
    }
    return true;
  }

  /**
   * Detaches the link from its predecessor node only.
   */
  public boolean unbind(final PfcNode predecessor, final PfcLink link) throws PfcException {
    checkOwnership(predecessor);
    checkOwnership(link);
    checkUnlocked();
    if (link.getPredecessor() != predecessor) {
      return false;
    }
    predecessor.removeSuccessor(link);
    link.setPredecessor(null);
    structureChanged();
    return true;
  }

  /**
   * Detaches the link from its successor node only.
   */
  public boolean unbind(final PfcLink link, final PfcNode successor) throws PfcException {
    checkOwnership(link);
    checkOwnership(successor);
    checkUnlocked();
    if (link.getSuccessor() != successor) {
      return false;
    }
    successor.removePredecessor(link);
    link.setSuccessor(null);
    structureChanged();
    return true;
  }

  /**
   * Deletes a node.
   * <ul>
   * <li>An unconnected node is simply removed.</li>
   * <li>A node with a single predecessor and a single successor that is one of several parallel or
   * alternative paths, meaning its predecessor has other successors and its successor has other
   * predecessors, is removed with its links.</li>
   * <li>A node with several predecessors and several successors is never deleted.</li>
   * <li>Otherwise the node is deleted together with its partner, the sole successor transition of a
   * step or the sole predecessor step of a transition, and the transition before the pair is bound
   * to the step after it. If either member of the pair has more than one predecessor or successor
   * nothing is changed and false is returned; those paths must be deleted first.</li>
   * </ul>
   */
  public boolean delete(final PfcNode node) throws PfcException {
    checkOwnership(node);
    checkUnlocked();
    if (node.getPredecessors().isEmpty() && node.getSuccessors().isEmpty()) {
      removeNode(node);
      structureChanged();
      return true;
    }
    if (node.getPredecessors().size() > 1 && node.getSuccessors().size() > 1) {
      logWarning(name, "cannot delete " + node.getName() + ", it joins "
          + node.getPredecessors().size() + " paths into " + node.getSuccessors().size());
      return false;
    }
    if (isRedundantPath(node)) {
      removeNode(node);
      structureChanged();
      return true;
    }

    final PfcNode step;
    final PfcNode transition;
    if (node.getElementType() == PfcElementType.STEP) {
      if (node.getSuccessors().size() != 1) {
        logWarning(name, "cannot delete " + node.getName() + ", it has "
            + node.getSuccessors().size() + " successors");
        return false;
      }
      step = node;
      transition = node.getSuccessorNodes().get(0);
    } else {
      if (node.getPredecessors().size() != 1) {
        logWarning(name, "cannot delete " + node.getName() + ", it has "
            + node.getPredecessors().size() + " predecessors");
        return false;
      }
      transition = node;
      step = node.getPredecessorNodes().get(0);
    }
    if (step.getPredecessors().size() > 1 || step.getSuccessors().size() > 1
        || transition.getPredecessors().size() > 1 || transition.getSuccessors().size() > 1) {
      logWarning(name, "cannot delete " + step.getName() + " and " + transition.getName()
          + ", other paths pass through them");
      return false;
    }

    final PfcNode before = step.getPredecessors().isEmpty() ? null
        : step.getPredecessorNodes().get(0);
    final PfcNode after = transition.getSuccessors().isEmpty() ? null
        : transition.getSuccessorNodes().get(0);
    suspendNodeSorting();
    try {
      removeNode(step);
      removeNode(transition);
      if (before != null && after != null && before != transition && after != step) {
        bind(before, after);
      }
    } finally {
      resumeNodeSorting();
    }
    return true;
  }

  private static boolean isRedundantPath(final PfcNode node) {
    if (node.getPredecessors().size() != 1 || node.getSuccessors().size() != 1) {
      return false;
    }
    final PfcNode predecessor = node.getPredecessors().get(0).getPredecessor();
    final PfcNode successor = node.getSuccessors().get(0).getSuccessor();
    return predecessor != null && successor != null && predecessor != node && successor != node
        && predecessor.getSuccessors().size() > 1 && successor.getPredecessors().size() > 1;
  }

  /**
   * Removes a node and every link attached to it, without splicing its neighbors.
   */
  void removeNode(final PfcNode node) {
    for (final PfcLink link : new ArrayList<>(node.getPredecessors())) {
      removeLink(link);
    }
    for (final PfcLink link : new ArrayList<>(node.getSuccessors())) {
      removeLink(link);
    }
    elements.remove(node.getId());
    nodes.remove(node);
    if (node instanceof PfcStep) {
      steps.remove(node);
    } else {
      transitions.remove(node);
    }
    structureDirty = true;
  }

  void removeLink(final PfcLink link) {
    disconnect(link);
    deregister(link);
    structureDirty = true;
  }

  private static void disconnect(final PfcLink link) {
    if (link.getPredecessor() != null) {
      link.getPredecessor().removeSuccessor(link);
    }
    if (link.getSuccessor() != null) {
      link.getSuccessor().removePredecessor(link);
    }
    link.clearEnds();
  }

  private void deregister(final PfcLink link) {
    elements.remove(link.getId());
    links.remove(link);
  }

  // ---------------------------------------------------------------------------------------------
  // structure maintenance
  // ---------------------------------------------------------------------------------------------

  public void suspendNodeSorting() {
    sortSuspensions++;
  }

  /**
   * Closes a bracket opened by {@link #suspendNodeSorting()}. Closing the outermost bracket runs
   * one structure update.
   */
  public void resumeNodeSorting() {
    if (sortSuspensions > 0 && --sortSuspensions == 0) {
      updateStructure();
    }
  }

  void structureChanged() {
    if (sortSuspensions == 0) {
      updateStructure();
    } else {
      structureDirty = true;
    }
  }

  public boolean isStructureDirty() {
    return structureDirty;
  }

  public long getStructureUpdateCount() {
    return structureUpdateCount;
  }

  public void updateStructure() {
    updateStructure(true);
  }

  /**
   * Re-sorts every node's successor links and reassigns graph ordinals by a breadth-first (or
   * depth-first) traversal from the start nodes, then sorts the node lists by ordinal and marks
   * loopback links.
   */
  public void updateStructure(final boolean breadthFirst) {
    structureUpdateCount++;
    for (final PfcNode node : nodes) {
      node.sortSuccessors();
    }
    if (breadthFirst) {
      assignOrdinalsBreadthFirst();
    } else {
      assignOrdinalsDepthFirst();
    }
    for (final PfcLink link : links) {
      link.setLoopback(link.isBound()
          && link.getSuccessor().getGraphOrdinal() <= link.getPredecessor().getGraphOrdinal());
    }
    nodes.sort(NodeComparator.INSTANCE);
    steps.sort(NodeComparator.INSTANCE);
    transitions.sort(NodeComparator.INSTANCE);
    for (final PfcNode node : nodes) {
      node.setStructureDirty(false);
    }
    structureDirty = false;
    logDebug(name, "structure updated, " + nodes.size() + " nodes");
  }

  private List<PfcNode> ordinalSeeds() {
    final List<PfcNode> seeds = new ArrayList<>();
    for (final PfcNode node : nodes) {
      if (node.isStartNode()) {
        seeds.add(node);
      }
    }
    if (seeds.isEmpty() && !nodes.isEmpty()) {
      seeds.add(nodes.get(0));
    }
    return seeds;
  }

  /*
   * Nodes are numbered as they leave the queue. A node that still has an unnumbered predecessor it
   * cannot itself reach goes to the back of the queue, so convergences are numbered after all of
   * their forward inputs. A full pass without progress numbers the head anyway.
   */
  private void assignOrdinalsBreadthFirst() {
    final Set<PfcNode> visited = new HashSet<>();
    final Set<PfcNode> discovered = new HashSet<>();
    final Deque<PfcNode> queue = new ArrayDeque<>();
    for (final PfcNode seed : ordinalSeeds()) {
      discovered.add(seed);
      queue.add(seed);
    }
    int ordinal = 0;
    while (visited.size() < nodes.size()) {
      if (queue.isEmpty()) {
        for (final PfcNode node : nodes) {
          if (!discovered.contains(node)) {
            discovered.add(node);
            queue.add(node);
            break;
          }
        }
      }
      int deferrals = 0;
      while (!queue.isEmpty()) {
        final PfcNode node = queue.poll();
        if (deferrals <= queue.size() && hasBlockingPredecessor(node, visited)) {
          queue.add(node);
          deferrals++;
          continue;
        }
        deferrals = 0;
        node.setGraphOrdinal(ordinal++);
        visited.add(node);
        for (final PfcNode successor : boundSuccessorNodes(node)) {
          if (discovered.add(successor)) {
            queue.add(successor);
          }
        }
      }
    }
  }

  private static boolean hasBlockingPredecessor(final PfcNode node, final Set<PfcNode> visited) {
    for (final PfcNode predecessor : boundPredecessorNodes(node)) {
      if (!visited.contains(predecessor) && !isReachable(node, predecessor)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isReachable(final PfcNode from, final PfcNode target) {
    final Set<PfcNode> seen = new HashSet<>();
    final Deque<PfcNode> stack = new ArrayDeque<>();
    stack.push(from);
    while (!stack.isEmpty()) {
      final PfcNode node = stack.pop();
      if (node == target) {
        return true;
      }
      if (seen.add(node)) {
        for (final PfcNode successor : boundSuccessorNodes(node)) {
          stack.push(successor);
        }
      }
    }
    return false;
  }

  private void assignOrdinalsDepthFirst() {
    final Set<PfcNode> visited = new HashSet<>();
    final int[] ordinal = {0};
    for (final PfcNode seed : ordinalSeeds()) {
      numberDepthFirst(seed, visited, ordinal);
    }
    for (final PfcNode node : new ArrayList<>(nodes)) {
      if (!visited.contains(node)) {
        numberDepthFirst(node, visited, ordinal);
      }
    }
  }

  private static void numberDepthFirst(final PfcNode node, final Set<PfcNode> visited,
      final int[] ordinal) {
    if (!visited.add(node)) {
      return;
    }
    node.setGraphOrdinal(ordinal[0]++);
    for (final PfcNode successor : boundSuccessorNodes(node)) {
      numberDepthFirst(successor, visited, ordinal);
    }
  }

  // a link that is only half bound has no far end to walk to
  private static List<PfcNode> boundSuccessorNodes(final PfcNode node) {
    final List<PfcNode> successors = new ArrayList<>();
    for (final PfcLink link : node.getSuccessors()) {
      if (link.getSuccessor() != null) {
        successors.add(link.getSuccessor());
      }
    }
    return successors;
  }

  private static List<PfcNode> boundPredecessorNodes(final PfcNode node) {
    final List<PfcNode> predecessors = new ArrayList<>();
    for (final PfcLink link : node.getPredecessors()) {
      if (link.getPredecessor() != null) {
        predecessors.add(link.getPredecessor());
      }
    }
    return predecessors;
  }

  // ---------------------------------------------------------------------------------------------
  // whole-chart transformations
  // ---------------------------------------------------------------------------------------------

  /**
   * Inlines every step's child charts. Each action-owning step S keeps its place as the exit of
   * the inlined section, and a new entry step takes over its predecessors. One child is spliced
   * in series between the two; several children run in parallel between a fork transition and a
   * join transition. Copied nodes are named {@code <S>:<child node>}.
   */
  public void flatten() throws PfcException {
    checkUnlocked();
    suspendNodeSorting();
    try {
      for (final PfcStep step : new ArrayList<>(steps)) {
        if (step.getActions().isEmpty()) {
          continue;
        }
        final List<ProcedureFunctionChart> children = new ArrayList<>(step.getActions().values());
        for (final ProcedureFunctionChart child : children) {
          child.flatten();
        }
        final PfcStep entry = createStep(step.getName() + ":entry", null, null);
        for (final PfcLink link : new ArrayList<>(step.getPredecessors())) {
          final PfcNode predecessor = link.getPredecessor();
          removeLink(link);
          bind(predecessor, entry);
        }
        PfcNode fork = entry;
        PfcNode join = step;
        if (children.size() > 1) {
          fork = createTransition(step.getName() + ":fork", null, null);
          bind(entry, fork);
          join = createTransition(step.getName() + ":join", null, null);
          bind(join, step);
        }
        for (final ProcedureFunctionChart child : children) {
          final Map<PfcNode, PfcNode> copies = importNodes(child, step.getName() + ":");
          for (final PfcNode childNode : child.getNodes()) {
            if (childNode.isStartNode()) {
              bind(fork, copies.get(childNode));
            }
            if (childNode.isFinishNode()) {
              bind(copies.get(childNode), join);
            }
          }
        }
        step.clearActions();
        step.setLeafLevelAction(PfcAction.NO_OP);
        logDebug(name, "flattened " + step.getName() + " with " + children.size() + " actions");
      }
    } finally {
      resumeNodeSorting();
    }
  }

  private Map<PfcNode, PfcNode> importNodes(final ProcedureFunctionChart source,
      final String prefix) throws PfcException {
    final Map<PfcNode, PfcNode> copies = new LinkedHashMap<>();
    for (final PfcNode node : source.getNodes()) {
      copies.put(node, copyNode(node, prefix + node.getName()));
    }
    for (final PfcLink link : source.getLinks()) {
      copyLink(link, link.getName().startsWith("L_") ? null : prefix + link.getName(), copies);
    }
    return copies;
  }

  private PfcNode copyNode(final PfcNode original, final String copyName) throws PfcException {
    final PfcNode copy;
    if (original instanceof PfcStep) {
      final PfcStep originalStep = (PfcStep) original;
      final PfcStep step = createStep(copyName, original.getDescription(), null);
      step.setLeafLevelAction(originalStep.getLeafLevelAction());
      step.setPrecondition(originalStep.getPrecondition());
      step.setUnitInfo(originalStep.getUnitInfo());
      for (final Map.Entry<String, ProcedureFunctionChart> action : originalStep.getActions()
          .entrySet()) {
        step.addAction(action.getKey(), action.getValue().copy());
      }
      copy = step;
    } else {
      final PfcTransition transition = createTransition(copyName, original.getDescription(), null);
      transition.setCondition(((PfcTransition) original).getCondition());
      copy = transition;
    }
    copy.setSourceId(original.getId());
    copy.setEarliestStart(original.getEarliestStart());
    copy.setUserData(original.getUserData());
    return copy;
  }

  private void copyLink(final PfcLink original, final String copyName,
      final Map<PfcNode, PfcNode> copies) throws PfcException {
    final PfcLink link = createLink(copyName, original.getDescription(), null);
    link.setSourceId(original.getId());
    link.setPriority(original.getPriority());
    if (original.getPredecessor() != null) {
      bind(copies.get(original.getPredecessor()), link);
    }
    if (original.getSuccessor() != null) {
      bind(link, copies.get(original.getSuccessor()));
    }
  }

  /**
   * Deep copy with fresh ids. Every copied element's source id names the element it was copied
   * from, and the copy's element factory continues from this chart's counters.
   */
  public ProcedureFunctionChart copy() throws PfcException {
    final ProcedureFunctionChart clone =
        new ProcedureFunctionChart(name, description, UUID.randomUUID());
    clone.precondition = precondition;
    clone.earliestStart = earliestStart;
    clone.engineConfiguration = engineConfiguration;
    clone.suspendNodeSorting();
    try {
      final Map<PfcNode, PfcNode> copies = new HashMap<>();
      for (final PfcNode node : nodes) {
        copies.put(node, clone.copyNode(node, node.getName()));
      }
      for (final PfcLink link : links) {
        clone.copyLink(link, link.getName(), copies);
      }
      clone.elementFactory.copyCountersFrom(elementFactory);
    } finally {
      clone.resumeNodeSorting();
    }
    return clone;
  }

  public boolean reduce() throws PfcException {
    return reduce(Reductions.defaultRules());
  }

  /**
   * Applies the rules until none of them changes the chart.
   *
   * @return true if anything was reduced
   */
  public boolean reduce(final List<ReductionRule> rules) throws PfcException {
    checkUnlocked();
    boolean reducedAny = false;
    suspendNodeSorting();
    try {
      boolean changed;
      do {
        changed = false;
        for (final ReductionRule rule : rules) {
          while (rule.apply(this)) {
            changed = true;
            reducedAny = true;
          }
        }
      } while (changed);
    } finally {
      resumeNodeSorting();
    }
    return reducedAny;
  }

  /**
   * Deletes every step that fails the predicate and can be deleted.
   *
   * @return the number of steps deleted
   */
  public int prune(final Predicate<PfcStep> keep) throws PfcException {
    int pruned = 0;
    suspendNodeSorting();
    try {
      for (final PfcStep step : new ArrayList<>(steps)) {
        if (steps.contains(step) && !keep.test(step) && delete(step)) {
          pruned++;
        }
      }
    } finally {
      resumeNodeSorting();
    }
    return pruned;
  }

  /**
   * Renames transitions {@code T_001}, {@code T_002}... and null steps {@code NULL_UP:0}... in
   * graph order.
   */
  public void applyNamingCosmetics() {
    updateStructure();
    int transitionNumber = 1;
    int nullStepNumber = 0;
    for (final PfcNode node : nodes) {
      if (node instanceof PfcTransition) {
        node.assignName(String.format("T_%03d", transitionNumber++));
      } else if (node.isNullNode()) {
        node.assignName("NULL_UP:" + nullStepNumber++);
      }
    }
  }

  // ---------------------------------------------------------------------------------------------
  // queries
  // ---------------------------------------------------------------------------------------------

  public List<PfcStep> getStartSteps() {
    final List<PfcStep> result = new ArrayList<>();
    for (final PfcStep step : steps) {
      if (step.isStartNode()) {
        result.add(step);
      }
    }
    return result;
  }

  public List<PfcStep> getFinishSteps() {
    final List<PfcStep> result = new ArrayList<>();
    for (final PfcStep step : steps) {
      if (step.isFinishNode()) {
        result.add(step);
      }
    }
    return result;
  }

  /**
   * The first transition with no successors, or null if there is none.
   */
  public PfcTransition getFinishTransition() {
    for (final PfcTransition transition : transitions) {
      if (transition.isFinishNode()) {
        return transition;
      }
    }
    return null;
  }

  /**
   * Looks a node up by name. A path such as {@code "STEP/action/CHILD"} descends through the named
   * action of a step into its child chart.
   */
  public PfcNode findNode(final String path) {
    final String[] segments = path.split("/", 3);
    PfcNode found = null;
    for (final PfcNode node : nodes) {
      if (node.getName().equals(segments[0])) {
        found = node;
        break;
      }
    }
    if (found == null || segments.length == 1) {
      return found;
    }
    if (!(found instanceof PfcStep) || segments.length < 3) {
      return null;
    }
    final ProcedureFunctionChart action = ((PfcStep) found).getActions().get(segments[1]);
    return action == null ? null : action.findNode(segments[2]);
  }

  public PfcNode findFirst(final Predicate<PfcNode> predicate) {
    for (final PfcNode node : nodes) {
      if (predicate.test(node)) {
        return node;
      }
    }
    return null;
  }

  public List<PfcNode> findAll(final Predicate<PfcNode> predicate) {
    final List<PfcNode> result = new ArrayList<>();
    for (final PfcNode node : nodes) {
      if (predicate.test(node)) {
        result.add(node);
      }
    }
    return result;
  }

  /**
   * Preorder walk from the start nodes along successor links in priority order, followed by any
   * nodes the walk could not reach.
   */
  public Iterator<PfcNode> depthFirstIterator() {
    final List<PfcNode> order = new ArrayList<>(nodes.size());
    final Set<PfcNode> visited = new HashSet<>();
    final Deque<PfcNode> stack = new ArrayDeque<>();
    final List<PfcNode> roots = new ArrayList<>(ordinalSeeds());
    roots.addAll(nodes);
    for (final PfcNode root : roots) {
      stack.push(root);
      while (!stack.isEmpty()) {
        final PfcNode node = stack.pop();
        if (!visited.add(node)) {
          continue;
        }
        order.add(node);
        final List<PfcNode> successors = boundSuccessorNodes(node);
        for (int i = successors.size() - 1; i >= 0; i--) {
          stack.push(successors.get(i));
        }
      }
    }
    final Iterator<PfcNode> delegate = order.iterator();
    return new Iterator<PfcNode>() {
      @Override
      public boolean hasNext() {
        return delegate.hasNext();
      }

      @Override
      public PfcNode next() {
        if (!delegate.hasNext()) {
          throw new NoSuchElementException();
        }
        return delegate.next();
      }
    };
  }

  /**
   * Elements of this chart matching the filter, followed by those of its child charts down to the
   * given depth.
   */
  public List<PfcElement> getChildren(final int depth, final Predicate<PfcElement> filter) {
    final List<PfcElement> result = new ArrayList<>();
    for (final PfcNode node : nodes) {
      if (filter.test(node)) {
        result.add(node);
      }
    }
    for (final PfcLink link : links) {
      if (filter.test(link)) {
        result.add(link);
      }
    }
    if (depth > 0) {
      for (final ProcedureFunctionChart child : getChildCharts()) {
        result.addAll(child.getChildren(depth - 1, filter));
      }
    }
    return result;
  }

  public List<ProcedureFunctionChart> getChildCharts() {
    final List<ProcedureFunctionChart> children = new ArrayList<>();
    for (final PfcStep step : steps) {
      children.addAll(step.getActions().values());
    }
    return children;
  }

  // ---------------------------------------------------------------------------------------------
  // structure lock and execution
  // ---------------------------------------------------------------------------------------------

  public boolean isStructureLocked() {
    return structureLocked;
  }

  /**
   * Rejects structural edits on this chart and its child charts until
   * {@link #discardExecutionEngine()} is called.
   */
  public void lockStructure() {
    structureLocked = true;
    for (final ProcedureFunctionChart child : getChildCharts()) {
      child.lockStructure();
    }
  }

  void checkUnlocked() throws PfcException {
    if (structureLocked) {
      throw new PfcException(Code.STRUCTURE_LOCKED, "Chart " + name
          + " cannot be changed while an execution engine is attached to it.");
    }
  }

  private void checkOwnership(final PfcElement element) throws PfcException {
    if (element.getParent() != this) {
      throw new PfcException(Code.FOREIGN_ELEMENT, "Element " + element.getName()
          + " belongs to chart " + element.getParent().getName() + ", not " + name + ".");
    }
  }

  public ExecutionEngineConfiguration getEngineConfiguration() {
    return engineConfiguration;
  }

  public void setEngineConfiguration(final ExecutionEngineConfiguration engineConfiguration)
      throws PfcException {
    if (executionEngine != null) {
      throw new PfcException(Code.INVALID_ENGINE_CONFIG,
          "Chart " + name + " already has an execution engine.");
    }
    this.engineConfiguration = engineConfiguration;
  }

  /**
   * Builds the execution engine on first use. Building fails if a step has no successor
   * transition.
   */
  public ExecutionEngine getExecutionEngine() throws PfcException {
    if (executionEngine == null) {
      executionEngine = new ExecutionEngine(this, engineConfiguration);
    }
    return executionEngine;
  }

  public boolean hasExecutionEngine() {
    return executionEngine != null;
  }

  /**
   * Detaches the execution engine and its state machines and unlocks the structure.
   */
  public void discardExecutionEngine() {
    executionEngine = null;
    for (final PfcStep step : steps) {
      step.clearStepStateMachine();
    }
    for (final PfcTransition transition : transitions) {
      transition.clearTransitionStateMachine();
    }
    structureLocked = false;
    for (final ProcedureFunctionChart child : getChildCharts()) {
      child.discardExecutionEngine();
    }
  }

  public PfcAction getPrecondition() {
    return precondition;
  }

  public void setPrecondition(final PfcAction precondition) {
    this.precondition = precondition;
  }

  public long getEarliestStart() {
    return earliestStart;
  }

  public void setEarliestStart(final long earliestStart) {
    this.earliestStart = earliestStart;
  }

  public void addLifecycleListener(final PfcLifecycleListener listener) {
    lifecycleListeners.add(listener);
  }

  public void removeLifecycleListener(final PfcLifecycleListener listener) {
    lifecycleListeners.remove(listener);
  }

  /**
   * Runs the chart. If the executive is not currently servicing a detachable event, the run is
   * deferred to one requested for the current time. A {@link PfcExecutionContext} of this chart
   * passed as user data becomes the run's context; anything else is carried as the payload of a
   * new root context.
   */
  public void run(final Executive executive, final Object userData) throws PfcException {
    final ExecutionEngine engine = getExecutionEngine();
    final PfcExecutionContext context;
    if (userData instanceof PfcExecutionContext
        && ((PfcExecutionContext) userData).getChart() == this) {
      context = (PfcExecutionContext) userData;
    } else {
      context = new PfcExecutionContext(this, name, executive, userData);
    }
    for (final PfcLifecycleListener listener : lifecycleListeners) {
      listener.startRequested(this, context);
    }
    if (executive.getCurrentEventType() != EventType.DETACHABLE) {
      executive.requestEvent((exec, data) -> runWithPermission(engine, context), executive.getNow(),
          0.0, context, EventType.DETACHABLE);
    } else {
      runWithPermission(engine, context);
    }
  }

  private void runWithPermission(final ExecutionEngine engine, final PfcExecutionContext context)
      throws PfcException {
    final Executive executive = context.getExecutive();
    if (earliestStart > executive.getNow()) {
      final EventController controller = executive.getCurrentEventController();
      controller.suspendUntil(earliestStart);
    }
    if (precondition != null) {
      precondition.run(context, null);
    }
    context.setStartTime(executive.getNow());
    logInfo(name, "starting run " + context.getName() + " at " + executive.getNow());
    for (final PfcLifecycleListener listener : lifecycleListeners) {
      listener.starting(this, context);
    }
    engine.run(context);
  }

  /**
   * Called by the finish transition's state machine when a run of this chart completes.
   */
  public void notifyCompleting(final PfcExecutionContext context) {
    context.setEndTime(context.getExecutive().getNow());
    logInfo(name, "run " + context.getName() + " completing at " + context.getEndTime());
    for (final PfcLifecycleListener listener : lifecycleListeners) {
      listener.completing(this, context);
    }
  }

  @Override
  public String toString() {
    return "ProcedureFunctionChart [name=" + name + ", steps=" + steps.size() + ", transitions="
        + transitions.size() + ", links=" + links.size() + "]";
  }

  /**
   * Outcome of {@link ProcedureFunctionChart#bind(PfcNode, PfcNode, boolean)}: the link leaving
   * the source node and, when a shim was needed, the shim and the link into the target.
   */
  public static final class BindResult {
    private final PfcLink firstLink;
    private final PfcNode shim;
    private final PfcLink secondLink;

    BindResult(final PfcLink firstLink, final PfcNode shim, final PfcLink secondLink) {
      this.firstLink = firstLink;
      this.shim = shim;
      this.secondLink = secondLink;
    }

    public PfcLink getFirstLink() {
      return firstLink;
    }

    public PfcNode getShim() {
      return shim;
    }

    public PfcLink getSecondLink() {
      return secondLink;
    }
  }

  private static void logWarning(final String chartName, final String message) {
    logger.warn(new StringBuilder().append("[p:").append(chartName).append("] ").append(message));
  }

  private static void logInfo(final String chartName, final String message) {
    logger.info(new StringBuilder().append("[p:").append(chartName).append("] ").append(message));
  }

  private static void logDebug(final String chartName, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[p:").append(chartName).append("] ")
          .append(message));
    }
  }

}
