package com.github.pfc.execution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.pfc.PfcException;
import com.github.pfc.PfcException.Code;
import com.github.pfc.PfcStep;
import com.github.pfc.PfcTransition;
import com.github.pfc.ProcedureFunctionChart;
import com.github.pfc.executive.EventController;
import com.github.pfc.executive.EventType;
import com.github.pfc.executive.Executive;

/**
 * Drives the state of one step. The machine itself is stateless with respect to runs: the state of
 * each run is kept in that run's chart-level execution context, so one step can be running in many
 * runs at once, and run repeatedly within one run, each time under a fresh step-instance context.
 *
 * @author gaurav
 */
public final class StepStateMachine {
  private static final Logger logger = LogManager.getLogger(StepStateMachine.class.getSimpleName());

  // rows are the from-state, columns the to-state, both in StepState declaration order
  private static final boolean[][] transitionMatrix = {
      // IDL RNG CMP ABG ABD STG STD PSG PSD HDG HLD RSG
      {false, true, false, false, false, false, false, false, false, false, false, false}, // IDL
      {false, false, true, true, false, true, false, true, false, true, false, false}, // RNG
      {true, false, false, false, false, false, false, false, false, false, false, false}, // CMP
      {false, false, false, false, true, false, false, false, false, false, false, false}, // ABG
      {true, false, false, false, false, false, false, false, false, false, false, false}, // ABD
      {false, false, false, false, false, false, true, false, false, false, false, false}, // STG
      {true, false, false, false, false, false, false, false, false, false, false, false}, // STD
      {false, false, false, false, false, false, false, false, true, false, false, false}, // PSG
      {false, true, false, false, false, false, false, false, false, false, false, false}, // PSD
      {false, false, false, false, false, false, false, false, false, false, true, false}, // HDG
      {false, false, false, false, false, false, false, false, false, false, false, true}, // HLD
      {false, true, false, false, false, false, false, false, false, false, false, false} // RSG
  };

  private static final StepState[] followOnStates = {
      StepState.IDLE, // IDLE
      StepState.RUNNING, // RUNNING
      StepState.COMPLETE, // COMPLETE
      StepState.ABORTED, // ABORTING
      StepState.ABORTED, // ABORTED
      StepState.STOPPED, // STOPPING
      StepState.STOPPED, // STOPPED
      StepState.PAUSED, // PAUSING
      StepState.PAUSED, // PAUSED
      StepState.HELD, // HOLDING
      StepState.HELD, // HELD
      StepState.RUNNING // RESTARTING
  };

  private final PfcStep step;
  private final ExecutionStatistics statistics;
  private final List<TransitionStateMachine> successorStateMachines = new ArrayList<>();
  private final List<StepStateListener> listeners = new CopyOnWriteArrayList<>();

  StepStateMachine(final PfcStep step, final ExecutionStatistics statistics) {
    this.step = step;
    this.statistics = statistics;
  }

  public PfcStep getStep() {
    return step;
  }

  public String getName() {
    return step.getName();
  }

  public List<TransitionStateMachine> getSuccessorStateMachines() {
    return Collections.unmodifiableList(successorStateMachines);
  }

  void addSuccessorStateMachine(final TransitionStateMachine successor) {
    successorStateMachines.add(successor);
  }

  public void addStepStateListener(final StepStateListener listener) {
    listeners.add(listener);
  }

  public void removeStepStateListener(final StepStateListener listener) {
    listeners.remove(listener);
  }

  /**
   * Starts a new instance of the step in the given chart-level context. If an earlier instance has
   * not yet returned to idle, the calling unit of work waits its turn. Must be called from a
   * detachable event.
   */
  public void start(final PfcExecutionContext parentContext) throws PfcException {
    final SsmData data = getSsmData(parentContext);
    final int instance = data.instanceCount++;
    final PfcExecutionContext myContext =
        new PfcExecutionContext(step, step.getName() + "#" + instance, data.owner);
    myContext.setInstanceCount(instance);
    logDebug(step.getName(), myContext.getName(), "start requested");

    getStartPermission(myContext, data);
    data.activeInstance = myContext;
    data.instanceContexts.add(myContext);
    doTransition(StepState.RUNNING, myContext);
  }

  public void stop(final PfcExecutionContext parentContext) throws PfcException {
    doTransition(StepState.STOPPING, activeInstance(parentContext, "stop"));
  }

  public void reset(final PfcExecutionContext parentContext) throws PfcException {
    doTransition(StepState.IDLE, activeInstance(parentContext, "reset"));
  }

  public void abort(final PfcExecutionContext parentContext) throws PfcException {
    doTransition(StepState.ABORTING, activeInstance(parentContext, "abort"));
  }

  public void pause(final PfcExecutionContext parentContext) throws PfcException {
    doTransition(StepState.PAUSING, activeInstance(parentContext, "pause"));
  }

  public void resume(final PfcExecutionContext parentContext) throws PfcException {
    doTransition(StepState.RUNNING, activeInstance(parentContext, "resume"));
  }

  public void hold(final PfcExecutionContext parentContext) throws PfcException {
    doTransition(StepState.HOLDING, activeInstance(parentContext, "hold"));
  }

  public void restart(final PfcExecutionContext parentContext) throws PfcException {
    doTransition(StepState.RESTARTING, activeInstance(parentContext, "restart"));
  }

  private PfcExecutionContext activeInstance(final PfcExecutionContext context,
      final String operation) throws PfcException {
    final PfcExecutionContext active = getSsmData(context).activeInstance;
    if (active == null) {
      throw new PfcException(Code.ILLEGAL_STATE_TRANSITION, "Cannot " + operation + " step "
          + step.getName() + ", it has no active instance in " + context.getName() + ".");
    }
    return active;
  }

  public StepState getState(final PfcExecutionContext context) {
    return getSsmData(context).state;
  }

  /**
   * True when the step is Complete, Aborted or Stopped.
   */
  public boolean isInFinalState(final PfcExecutionContext context) {
    final StepState state = getState(context);
    return state == StepState.COMPLETE || state == StepState.ABORTED
        || state == StepState.STOPPED;
  }

  /**
   * True when the step is Held or Paused.
   */
  public boolean isInQuiescentState(final PfcExecutionContext context) {
    final StepState state = getState(context);
    return state == StepState.HELD || state == StepState.PAUSED;
  }

  public int getStartCount(final PfcExecutionContext context) {
    return getSsmData(context).instanceCount;
  }

  public PfcExecutionContext getActiveInstanceContext(final PfcExecutionContext context) {
    return getSsmData(context).activeInstance;
  }

  public List<PfcExecutionContext> getInstanceContexts(final PfcExecutionContext context) {
    return Collections.unmodifiableList(new ArrayList<>(getSsmData(context).instanceContexts));
  }

  private SsmData getSsmData(final PfcExecutionContext context) {
    final PfcExecutionContext owner = step.equals(context.getStep()) ? context.getParent()
        : context;
    SsmData data = (SsmData) owner.get(this);
    if (data == null) {
      data = new SsmData(owner);
      owner.put(this, data);
    }
    return data;
  }

  private void getStartPermission(final PfcExecutionContext myContext, final SsmData data)
      throws PfcException {
    while (data.state != StepState.IDLE) {
      final EventController controller =
          myContext.getExecutive().getCurrentEventController();
      logDebug(step.getName(), myContext.getName(),
          "waiting for the previous instance, state is " + data.state);
      data.waitingStarts.add(controller);
      controller.suspend();
    }
  }

  private void doTransition(final StepState toState, final PfcExecutionContext myContext)
      throws PfcException {
    final SsmData data = getSsmData(myContext);
    final StepState fromState = data.state;
    if (!transitionMatrix[fromState.ordinal()][toState.ordinal()]) {
      throw new PfcException(Code.ILLEGAL_STATE_TRANSITION,
          String.format("Illegal attempt to transition from %s to %s in step state machine for %s.",
              fromState, toState, step.getName()));
    }
    final Executive executive = myContext.getExecutive();
    data.state = toState;
    logDebug(step.getName(), myContext.getName(), fromState + "->" + toState);

    if (fromState == StepState.RUNNING && toState == StepState.COMPLETE) {
      myContext.setEndTime(executive.getNow());
      statistics.totalStepCompletions++;
    }
    if (fromState == StepState.IDLE && toState == StepState.RUNNING) {
      step.getPermissionToStart(myContext, this);
      myContext.setStartTime(executive.getNow());
      statistics.totalStepStarts++;
    }
    if (toState == StepState.IDLE) {
      data.activeInstance = null;
    }

    stateChangeCompleted(myContext, data);

    if (fromState == StepState.IDLE && toState == StepState.RUNNING) {
      doRunning(myContext, data);
    }

    final StepState followOn = followOnStates[toState.ordinal()];
    if (followOn != toState && data.activeInstance == myContext && data.state == toState) {
      doTransition(followOn, myContext);
    }
  }

  private void stateChangeCompleted(final PfcExecutionContext myContext, final SsmData data)
      throws PfcException {
    for (final StepStateListener listener : listeners) {
      listener.stepStateChanged(this, myContext);
    }
    for (final TransitionStateMachine successor : successorStateMachines) {
      successor.predecessorStateChange(myContext);
    }
    if (data.state == StepState.IDLE && !data.waitingStarts.isEmpty()) {
      data.waitingStarts.poll().resume();
    }
  }

  private void doRunning(final PfcExecutionContext myContext, final SsmData data)
      throws PfcException {
    if (step.getActions().isEmpty()) {
      step.getLeafLevelAction().run(myContext, this);
    } else {
      runChildActions(myContext);
    }
    if (data.activeInstance != myContext || data.state != StepState.RUNNING) {
      logDebug(step.getName(), myContext.getName(),
          "action returned after the instance left Running, state is " + data.state);
      return;
    }
    doTransition(StepState.COMPLETE, myContext);
  }

  /**
   * Runs every child chart in its own detachable event and suspends until each child's finish
   * transition has gone inactive in that child's run.
   */
  private void runChildActions(final PfcExecutionContext myContext) throws PfcException {
    final Executive executive = myContext.getExecutive();
    final Map<ProcedureFunctionChart, PfcExecutionContext> childContexts = new LinkedHashMap<>();
    for (final Map.Entry<String, ProcedureFunctionChart> action : step.getActions().entrySet()) {
      childContexts.put(action.getValue(),
          new PfcExecutionContext(action.getValue(), action.getKey(), myContext));
    }
    final ChildJoiner joiner = new ChildJoiner(myContext, childContexts);
    for (final Map.Entry<ProcedureFunctionChart, PfcExecutionContext> child : childContexts
        .entrySet()) {
      final ProcedureFunctionChart childChart = child.getKey();
      executive.requestEvent((exec, userData) -> childChart.run(exec, userData), executive.getNow(),
          0.0, child.getValue(), EventType.DETACHABLE);
    }
    joiner.await();
  }

  @Override
  public String toString() {
    return "StepStateMachine [step=" + step.getName() + "]";
  }

  /**
   * Waits for the finish transition of each child run to go inactive.
   */
  private final class ChildJoiner implements TransitionStateListener {
    private final PfcExecutionContext stepContext;
    private final List<TransitionStateMachine> watched = new ArrayList<>();
    private int pending;
    private EventController controller;

    private ChildJoiner(final PfcExecutionContext stepContext,
        final Map<ProcedureFunctionChart, PfcExecutionContext> childContexts)
        throws PfcException {
      this.stepContext = stepContext;
      for (final ProcedureFunctionChart child : childContexts.keySet()) {
        final PfcTransition finish = child.getFinishTransition();
        if (finish == null) {
          throw new PfcException(Code.MALFORMED_CHART, "Child chart " + child.getName()
              + " of step " + step.getName() + " has no finish transition.");
        }
        final TransitionStateMachine finishMachine =
            child.getExecutionEngine().getTransitionStateMachine(finish);
        finishMachine.addTransitionStateListener(this);
        watched.add(finishMachine);
        pending++;
      }
    }

    @Override
    public void transitionStateChanged(final TransitionStateMachine machine,
        final PfcExecutionContext context) {
      if (context.getParent() != stepContext
          || machine.getState(context) != TransitionState.INACTIVE) {
        return;
      }
      machine.removeTransitionStateListener(this);
      pending--;
      logDebug(step.getName(), stepContext.getName(),
          "child " + context.getName() + " finished, " + pending + " pending");
      if (pending == 0 && controller != null) {
        controller.resume();
      }
    }

    private void await() throws PfcException {
      if (pending == 0) {
        return;
      }
      controller = stepContext.getExecutive().getCurrentEventController();
      while (pending > 0) {
        controller.suspend();
      }
    }
  }

  private static final class SsmData {
    private final PfcExecutionContext owner;
    private StepState state = StepState.IDLE;
    private final Queue<EventController> waitingStarts = new ArrayDeque<>();
    private final List<PfcExecutionContext> instanceContexts = new ArrayList<>();
    private PfcExecutionContext activeInstance;
    private int instanceCount;

    private SsmData(final PfcExecutionContext owner) {
      this.owner = owner;
    }
  }

  private static void logDebug(final String stepName, final String contextName,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[s:").append(stepName).append("][c:")
          .append(contextName).append("] ").append(message));
    }
  }

}
