package com.github.pfc.execution;

/**
 * Observer of transition state changes. The context passed is the chart-level context the
 * transition is being evaluated in.
 */
@FunctionalInterface
public interface TransitionStateListener {
  void transitionStateChanged(TransitionStateMachine transitionStateMachine,
      PfcExecutionContext context);
}
