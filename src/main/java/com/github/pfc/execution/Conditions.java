package com.github.pfc.execution;

import com.github.pfc.PfcException;
import com.github.pfc.PfcException.Code;
import com.github.pfc.PfcNode;
import com.github.pfc.PfcStep;
import com.github.pfc.TransitionCondition;

/**
 * Ready-made transition conditions.
 */
public final class Conditions {

  private Conditions() {}

  /**
   * True once the named step of the transition's own chart is Complete in the evaluating run. The
   * name is looked up on every evaluation.
   */
  public static TransitionCondition stepIsComplete(final String stepName) {
    return (context, tsm) -> {
      final PfcNode node = tsm.getTransition().getParent().findNode(stepName);
      if (!(node instanceof PfcStep)) {
        throw new PfcException(Code.UNRESOLVED_REFERENCE, "Condition on transition "
            + tsm.getName() + " refers to step " + stepName + ", which cannot be found in chart "
            + tsm.getTransition().getParent().getName() + ".");
      }
      final StepStateMachine ssm = ((PfcStep) node).getStepStateMachine();
      return ssm != null && ssm.getState(context) == StepState.COMPLETE;
    };
  }

  public static TransitionCondition allOf(final TransitionCondition... conditions) {
    return (context, tsm) -> {
      for (final TransitionCondition condition : conditions) {
        if (!condition.evaluate(context, tsm)) {
          return false;
        }
      }
      return true;
    };
  }

  public static TransitionCondition anyOf(final TransitionCondition... conditions) {
    return (context, tsm) -> {
      for (final TransitionCondition condition : conditions) {
        if (condition.evaluate(context, tsm)) {
          return true;
        }
      }
      return false;
    };
  }

  public static TransitionCondition not(final TransitionCondition condition) {
    return (context, tsm) -> !condition.evaluate(context, tsm);
  }

  /**
   * True once simulated time has reached the given instant.
   */
  public static TransitionCondition afterTime(final long whenMillis) {
    return (context, tsm) -> context.getExecutive().getNow() >= whenMillis;
  }

}
