package com.github.pfc;

import java.util.UUID;

import com.github.pfc.PfcException.Code;
import com.github.pfc.execution.TransitionStateMachine;

/**
 * A gate between steps. When all of its predecessor steps are running or done, the transition
 * becomes active and its condition is scanned periodically until it fires.
 */
public final class PfcTransition extends PfcNode {
  private TransitionCondition condition = TransitionCondition.ALL_PREDECESSORS_COMPLETE;
  private TransitionStateMachine transitionStateMachine;

  PfcTransition(final ProcedureFunctionChart parent, final String name, final String description,
      final UUID id) {
    super(parent, name, description, id);
  }

  @Override
  public PfcElementType getElementType() {
    return PfcElementType.TRANSITION;
  }

  @Override
  public boolean isNullNode() {
    return condition == TransitionCondition.ALL_PREDECESSORS_COMPLETE;
  }

  public TransitionCondition getCondition() {
    return condition;
  }

  public void setCondition(final TransitionCondition condition) {
    this.condition =
        condition == null ? TransitionCondition.ALL_PREDECESSORS_COMPLETE : condition;
  }

  public TransitionStateMachine getTransitionStateMachine() {
    return transitionStateMachine;
  }

  public void setTransitionStateMachine(final TransitionStateMachine transitionStateMachine)
      throws PfcException {
    if (this.transitionStateMachine != null
        && transitionStateMachine != this.transitionStateMachine) {
      throw new PfcException(Code.STATE_MACHINE_REPLACEMENT,
          "Transition " + getName() + " already has a state machine.");
    }
    this.transitionStateMachine = transitionStateMachine;
  }

  void clearTransitionStateMachine() {
    this.transitionStateMachine = null;
  }

}
