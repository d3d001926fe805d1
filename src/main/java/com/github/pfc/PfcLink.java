package com.github.pfc;

import java.util.UUID;

import com.github.pfc.PfcException.Code;

/**
 * Directed edge from one node to another. Each end may be set only while it is unset; a link whose
 * successor is not later than its predecessor in graph order is a loopback.
 */
public final class PfcLink extends PfcElement {
  private PfcNode predecessor;
  private PfcNode successor;
  private int priority;
  private boolean loopback;

  PfcLink(final ProcedureFunctionChart parent, final String name, final String description,
      final UUID id) {
    super(parent, name, description, id);
  }

  @Override
  public PfcElementType getElementType() {
    return PfcElementType.LINK;
  }

  public PfcNode getPredecessor() {
    return predecessor;
  }

  void setPredecessor(final PfcNode node) throws PfcException {
    if (node != null && predecessor != null && predecessor != node) {
      throw new PfcException(Code.STRUCTURE_VIOLATION, "Trying to link " + node.getName() + " to "
          + getName() + ", where " + getName() + " already has a predecessor, "
          + predecessor.getName() + ".");
    }
    predecessor = node;
  }

  public PfcNode getSuccessor() {
    return successor;
  }

  void setSuccessor(final PfcNode node) throws PfcException {
    if (node != null && successor != null && successor != node) {
      throw new PfcException(Code.STRUCTURE_VIOLATION, "Trying to link " + getName() + " to "
          + node.getName() + ", where " + getName() + " already has a successor, "
          + successor.getName() + ".");
    }
    successor = node;
  }

  void clearEnds() {
    predecessor = null;
    successor = null;
  }

  /**
   * Higher values are preferred when choosing among the outbound links of a node. Changing the
   * priority takes effect on the successor order at the next structure update.
   */
  public int getPriority() {
    return priority;
  }

  public void setPriority(final int priority) {
    this.priority = priority;
    if (predecessor != null) {
      predecessor.setStructureDirty(true);
    }
  }

  public boolean isLoopback() {
    return loopback;
  }

  void setLoopback(final boolean loopback) {
    this.loopback = loopback;
  }

  public boolean isBound() {
    return predecessor != null && successor != null;
  }

  /**
   * Disconnects both ends of this link. The link stays a member of its chart.
   */
  public void detach() throws PfcException {
    getParent().checkUnlocked();
    if (predecessor != null) {
      predecessor.removeSuccessor(this);
      predecessor = null;
    }
    if (successor != null) {
      successor.removePredecessor(this);
      successor = null;
    }
    getParent().structureChanged();
  }

  public AggregateLinkType getAggregateLinkType() {
    if (predecessor == null || successor == null) {
      return AggregateLinkType.UNKNOWN;
    }
    final boolean fromStep = predecessor.getElementType() == PfcElementType.STEP;
    if (predecessor.getSuccessors().size() > 1) {
      return fromStep ? AggregateLinkType.SERIES_DIVERGENT : AggregateLinkType.PARALLEL_DIVERGENT;
    }
    if (successor.getPredecessors().size() > 1) {
      return fromStep ? AggregateLinkType.PARALLEL_CONVERGENT
          : AggregateLinkType.SERIES_CONVERGENT;
    }
    return AggregateLinkType.SIMPLE;
  }

}
