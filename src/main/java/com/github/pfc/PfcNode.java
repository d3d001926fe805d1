package com.github.pfc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A step or a transition. Nodes keep ordered lists of their inbound and outbound links; successor
 * links stay sorted by {@link LinkComparator}, so the first successor is the primary one.
 */
public abstract class PfcNode extends PfcElement {
  private final List<PfcLink> predecessors = new ArrayList<>();
  private final List<PfcLink> successors = new ArrayList<>();
  private int graphOrdinal;
  private boolean structureDirty = true;
  private NodeColor nodeColor = NodeColor.WHITE;
  private long earliestStart = Long.MIN_VALUE;

  PfcNode(final ProcedureFunctionChart parent, final String name, final String description,
      final UUID id) {
    super(parent, name, description, id);
  }

  /**
   * A null node performs no work; reductions may remove it without changing what the chart does.
   */
  public abstract boolean isNullNode();

  public List<PfcLink> getPredecessors() {
    return Collections.unmodifiableList(predecessors);
  }

  public List<PfcLink> getSuccessors() {
    return Collections.unmodifiableList(successors);
  }

  public List<PfcNode> getPredecessorNodes() {
    final List<PfcNode> nodes = new ArrayList<>(predecessors.size());
    for (final PfcLink link : predecessors) {
      nodes.add(link.getPredecessor());
    }
    return nodes;
  }

  public List<PfcNode> getSuccessorNodes() {
    final List<PfcNode> nodes = new ArrayList<>(successors.size());
    for (final PfcLink link : successors) {
      nodes.add(link.getSuccessor());
    }
    return nodes;
  }

  public PfcLink getLinkForSuccessorNode(final PfcNode node) {
    for (final PfcLink link : successors) {
      if (link.getSuccessor() == node) {
        return link;
      }
    }
    return null;
  }

  public PfcLink getLinkForPredecessorNode(final PfcNode node) {
    for (final PfcLink link : predecessors) {
      if (link.getPredecessor() == node) {
        return link;
      }
    }
    return null;
  }

  /**
   * Moves the given outbound link to the head of the successor list and renumbers the priorities of
   * all outbound links so that the new order survives the next structure update.
   */
  public void setLinkHighestPriority(final PfcLink link) {
    if (successors.remove(link)) {
      successors.add(0, link);
      renumberSuccessorPriorities();
    }
  }

  /**
   * Moves the given outbound link to the tail of the successor list, renumbering priorities.
   */
  public void setLinkLowestPriority(final PfcLink link) {
    if (successors.remove(link)) {
      successors.add(link);
      renumberSuccessorPriorities();
    }
  }

  private void renumberSuccessorPriorities() {
    final int count = successors.size();
    for (int i = 0; i < count; i++) {
      successors.get(i).setPriority(count - i);
    }
  }

  public boolean isStartNode() {
    return predecessors.isEmpty();
  }

  public boolean isFinishNode() {
    return successors.isEmpty();
  }

  /**
   * True if this node has exactly one inbound and one outbound link.
   */
  public boolean isSimple() {
    return predecessors.size() == 1 && successors.size() == 1;
  }

  public int getGraphOrdinal() {
    return graphOrdinal;
  }

  void setGraphOrdinal(final int graphOrdinal) {
    this.graphOrdinal = graphOrdinal;
  }

  public boolean isStructureDirty() {
    return structureDirty;
  }

  void setStructureDirty(final boolean structureDirty) {
    this.structureDirty = structureDirty;
  }

  public NodeColor getNodeColor() {
    return nodeColor;
  }

  public void setNodeColor(final NodeColor nodeColor) {
    this.nodeColor = nodeColor;
  }

  /**
   * Simulated time before which this node may not start, or {@link Long#MIN_VALUE} for no limit.
   */
  public long getEarliestStart() {
    return earliestStart;
  }

  public void setEarliestStart(final long earliestStart) {
    this.earliestStart = earliestStart;
  }

  void addPredecessor(final PfcLink link) {
    if (!predecessors.contains(link)) {
      predecessors.add(link);
      structureDirty = true;
    }
  }

  void addSuccessor(final PfcLink link) {
    if (!successors.contains(link)) {
      successors.add(link);
      successors.sort(LinkComparator.INSTANCE);
      structureDirty = true;
    }
  }

  boolean removePredecessor(final PfcLink link) {
    final boolean removed = predecessors.remove(link);
    structureDirty |= removed;
    return removed;
  }

  boolean removeSuccessor(final PfcLink link) {
    final boolean removed = successors.remove(link);
    structureDirty |= removed;
    return removed;
  }

  void sortSuccessors() {
    successors.sort(LinkComparator.INSTANCE);
  }

}
