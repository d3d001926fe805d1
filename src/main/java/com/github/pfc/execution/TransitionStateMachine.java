package com.github.pfc.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.pfc.PfcException;
import com.github.pfc.PfcTransition;
import com.github.pfc.TransitionCondition;
import com.github.pfc.executive.EventType;
import com.github.pfc.executive.Executive;

/**
 * Drives the state of one transition. While active, the transition scans its condition once per
 * scanning period; when the condition holds it fires, retiring its predecessor steps and starting
 * its successor steps.
 *
 * Notes for users:<br>
 * 1. per-run state is kept in the chart-level execution context, keyed by this machine<br>
 *
 * 2. a transition with no successors is the finish transition; its going inactive marks the
 * completion of the run<br>
 *
 * @author gaurav
 */
public final class TransitionStateMachine {
  private static final Logger logger =
      LogManager.getLogger(TransitionStateMachine.class.getSimpleName());

  private final PfcTransition transition;
  private final ExecutionStatistics statistics;
  private final List<StepStateMachine> predecessorStateMachines = new ArrayList<>();
  private final List<StepStateMachine> successorStateMachines = new ArrayList<>();
  private final List<TransitionStateListener> listeners = new CopyOnWriteArrayList<>();
  private volatile long scanningPeriodMillis;
  private volatile TransitionCondition conditionOverride;

  TransitionStateMachine(final PfcTransition transition, final ExecutionStatistics statistics,
      final long scanningPeriodMillis) {
    this.transition = transition;
    this.statistics = statistics;
    this.scanningPeriodMillis = scanningPeriodMillis;
  }

  public PfcTransition getTransition() {
    return transition;
  }

  public String getName() {
    return transition.getName();
  }

  public List<StepStateMachine> getPredecessorStateMachines() {
    return Collections.unmodifiableList(predecessorStateMachines);
  }

  public List<StepStateMachine> getSuccessorStateMachines() {
    return Collections.unmodifiableList(successorStateMachines);
  }

  void addPredecessorStateMachine(final StepStateMachine predecessor) {
    predecessorStateMachines.add(predecessor);
  }

  void addSuccessorStateMachine(final StepStateMachine successor) {
    successorStateMachines.add(successor);
  }

  public long getScanningPeriodMillis() {
    return scanningPeriodMillis;
  }

  void setScanningPeriodMillis(final long scanningPeriodMillis) {
    this.scanningPeriodMillis = scanningPeriodMillis;
  }

  /**
   * The condition this machine evaluates: the override if one was set, otherwise the transition's
   * own condition.
   */
  public TransitionCondition getExecutableCondition() {
    final TransitionCondition override = conditionOverride;
    return override != null ? override : transition.getCondition();
  }

  public void setExecutableCondition(final TransitionCondition condition) {
    this.conditionOverride = condition;
  }

  public void addTransitionStateListener(final TransitionStateListener listener) {
    listeners.add(listener);
  }

  public void removeTransitionStateListener(final TransitionStateListener listener) {
    listeners.remove(listener);
  }

  public TransitionState getState(final PfcExecutionContext context) {
    return getTsmData(chartContext(context)).state;
  }

  /**
   * Number of times the condition was evaluated in the given run.
   */
  public int getScanCount(final PfcExecutionContext context) {
    return getTsmData(chartContext(context)).scans;
  }

  /**
   * Called by a predecessor step's machine, with that step's instance context, after each of its
   * state changes.
   */
  void predecessorStateChange(final PfcExecutionContext stepContext) throws PfcException {
    final PfcExecutionContext context = chartContext(stepContext);
    switch (getTsmData(context).state) {
      case ACTIVE:
        if (anyPredecessorIsQuiescent(context)) {
          setState(TransitionState.NOT_BEING_EVALUATED, context);
          haltConditionScanning(context);
        } else if (allPredecessorsAreIdle(context)) {
          setState(TransitionState.INACTIVE, context);
          haltConditionScanning(context);
        }
        break;
      case INACTIVE:
        if (noPredecessorIsIdle(context)) {
          if (!anyPredecessorIsQuiescent(context)) {
            setState(TransitionState.ACTIVE, context);
            startConditionScanning(context);
          } else {
            setState(TransitionState.NOT_BEING_EVALUATED, context);
            haltConditionScanning(context);
          }
        }
        break;
      case NOT_BEING_EVALUATED:
        if (!anyPredecessorIsQuiescent(context)) {
          setState(TransitionState.ACTIVE, context);
          startConditionScanning(context);
        }
        break;
      default:
        break;
    }
  }

  private void setState(final TransitionState state, final PfcExecutionContext context) {
    final TsmData data = getTsmData(context);
    if (data.state != state) {
      logDebug(transition.getName(), context.getName(), data.state + "->" + state);
      data.state = state;
      for (final TransitionStateListener listener : listeners) {
        listener.transitionStateChanged(this, context);
      }
    }
    if (successorStateMachines.isEmpty() && state == TransitionState.INACTIVE) {
      statistics.totalChartCompletions++;
      transition.getParent().notifyCompleting(context);
    }
  }

  private void startConditionScanning(final PfcExecutionContext context) throws PfcException {
    haltConditionScanning(context);
    final Executive executive = context.getExecutive();
    getTsmData(context).nextEvaluation = executive.requestEvent(
        (exec, userData) -> evaluateCondition((PfcExecutionContext) userData),
        executive.getNow() + scanningPeriodMillis, 0.0, context, EventType.SYNCHRONOUS);
  }

  private void haltConditionScanning(final PfcExecutionContext context) {
    final TsmData data = getTsmData(context);
    if (data.nextEvaluation != 0L) {
      context.getExecutive().unRequestEvent(data.nextEvaluation);
      data.nextEvaluation = 0L;
    }
  }

  private void evaluateCondition(final PfcExecutionContext context) throws PfcException {
    final TsmData data = getTsmData(context);
    data.nextEvaluation = 0L;
    if (data.state != TransitionState.ACTIVE) {
      return;
    }
    data.scans++;
    statistics.totalConditionScans++;
    if (getExecutableCondition().evaluate(context, this)) {
      fire(context);
    } else {
      startConditionScanning(context);
    }
  }

  private void fire(final PfcExecutionContext context) throws PfcException {
    logDebug(transition.getName(), context.getName(), "firing");
    statistics.totalTransitionFirings++;
    for (final StepStateMachine predecessor : predecessorStateMachines) {
      if (predecessor.getState(context) == StepState.RUNNING) {
        predecessor.stop(context);
      }
      predecessor.reset(context);
    }
    final Executive executive = context.getExecutive();
    for (final StepStateMachine successor : successorStateMachines) {
      executive.requestEvent((exec, userData) -> successor.start(context), executive.getNow(), 0.0,
          context, EventType.DETACHABLE);
    }
  }

  private static PfcExecutionContext chartContext(final PfcExecutionContext context) {
    return context.isStepCentric() ? context.getParent() : context;
  }

  private TsmData getTsmData(final PfcExecutionContext context) {
    TsmData data = (TsmData) context.get(this);
    if (data == null) {
      data = new TsmData();
      context.put(this, data);
    }
    return data;
  }

  private boolean anyPredecessorIsQuiescent(final PfcExecutionContext context) {
    for (final StepStateMachine predecessor : predecessorStateMachines) {
      if (predecessor.isInQuiescentState(context)) {
        return true;
      }
    }
    return false;
  }

  private boolean allPredecessorsAreIdle(final PfcExecutionContext context) {
    for (final StepStateMachine predecessor : predecessorStateMachines) {
      if (predecessor.getState(context) != StepState.IDLE) {
        return false;
      }
    }
    return true;
  }

  private boolean noPredecessorIsIdle(final PfcExecutionContext context) {
    for (final StepStateMachine predecessor : predecessorStateMachines) {
      if (predecessor.getState(context) == StepState.IDLE) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "TransitionStateMachine [transition=" + transition.getName() + "]";
  }

  private static final class TsmData {
    private TransitionState state = TransitionState.INACTIVE;
    private long nextEvaluation;
    private int scans;
  }

  private static void logDebug(final String transitionName, final String contextName,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[t:").append(transitionName).append("][c:")
          .append(contextName).append("] ").append(message));
    }
  }

}
