package com.github.pfc.execution;

/**
 * Execution state of one instance of a step.
 */
public enum StepState {
  IDLE, RUNNING, COMPLETE, ABORTING, ABORTED, STOPPING, STOPPED, PAUSING, PAUSED, HOLDING, HELD,
  RESTARTING;
}
