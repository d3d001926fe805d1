package com.github.pfc;

import com.github.pfc.execution.PfcExecutionContext;
import com.github.pfc.execution.StepStateMachine;

/**
 * Callback run on behalf of a step, either as its leaf-level action or as a precondition that must
 * return before the step may start. Implementations may suspend the current detachable unit of work
 * through the context's executive.
 */
@FunctionalInterface
public interface PfcAction {
  PfcAction NO_OP = (context, stepStateMachine) -> {
  };

  void run(PfcExecutionContext context, StepStateMachine stepStateMachine) throws PfcException;
}
