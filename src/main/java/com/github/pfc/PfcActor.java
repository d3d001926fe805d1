package com.github.pfc;

import com.github.pfc.execution.PfcExecutionContext;
import com.github.pfc.execution.StepStateMachine;

/**
 * A reusable behavior that supplies both the start-permission hook and the body of a step. Install
 * it with {@link PfcStep#setActor(PfcActor)}.
 */
public abstract class PfcActor {
  private final String name;

  protected PfcActor(final String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public abstract void getPermissionToStart(PfcExecutionContext context,
      StepStateMachine stepStateMachine) throws PfcException;

  public abstract void run(PfcExecutionContext context, StepStateMachine stepStateMachine)
      throws PfcException;

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [name=" + name + "]";
  }

}
