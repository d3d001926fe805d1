package com.github.pfc.execution;

/**
 * Observer of step state changes. The context passed is the step instance's own context.
 */
@FunctionalInterface
public interface StepStateListener {
  void stepStateChanged(StepStateMachine stepStateMachine, PfcExecutionContext context);
}
