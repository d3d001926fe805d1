package com.github.pfc.execution;

/**
 * Evaluation state of a transition within one execution context.
 */
public enum TransitionState {
  // every predecessor is under way and none is paused or held; the condition is being scanned
  ACTIVE,
  // every predecessor is idle
  INACTIVE,
  // some predecessor is paused or held; scanning is frozen
  NOT_BEING_EVALUATED;
}
