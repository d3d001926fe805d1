package com.github.pfc.execution.actions;

import com.github.pfc.PfcActor;
import com.github.pfc.PfcException;
import com.github.pfc.execution.PfcExecutionContext;
import com.github.pfc.execution.StepStateMachine;

/**
 * Leaf action that keeps its step running for a fixed span of simulated time.
 */
public final class SimpleDelay extends PfcActor {
  private final long delayMillis;

  public SimpleDelay(final String name, final long delayMillis) {
    super(name);
    this.delayMillis = delayMillis;
  }

  public long getDelayMillis() {
    return delayMillis;
  }

  @Override
  public void getPermissionToStart(final PfcExecutionContext context,
      final StepStateMachine stepStateMachine) {
    // always granted
  }

  @Override
  public void run(final PfcExecutionContext context, final StepStateMachine stepStateMachine)
      throws PfcException {
    final long when = context.getExecutive().getNow() + delayMillis;
    context.getExecutive().getCurrentEventController().suspendUntil(when);
  }

}
