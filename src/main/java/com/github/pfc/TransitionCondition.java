package com.github.pfc;

import com.github.pfc.execution.PfcExecutionContext;
import com.github.pfc.execution.StepState;
import com.github.pfc.execution.StepStateMachine;
import com.github.pfc.execution.TransitionStateMachine;

/**
 * Boolean firing condition of a transition, evaluated on every scan while the transition is active.
 */
@FunctionalInterface
public interface TransitionCondition {

  /**
   * The default condition: every predecessor step has completed in the evaluating context.
   */
  TransitionCondition ALL_PREDECESSORS_COMPLETE = (context, tsm) -> {
    for (final StepStateMachine predecessor : tsm.getPredecessorStateMachines()) {
      if (predecessor.getState(context) != StepState.COMPLETE) {
        return false;
      }
    }
    return true;
  };

  boolean evaluate(PfcExecutionContext context, TransitionStateMachine transitionStateMachine)
      throws PfcException;
}
