package com.github.pfc.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.pfc.PfcException;
import com.github.pfc.PfcException.Code;
import com.github.pfc.PfcNode;
import com.github.pfc.PfcStep;
import com.github.pfc.PfcTransition;
import com.github.pfc.ProcedureFunctionChart;

/**
 * Runs a chart. The engine attaches one {@link StepStateMachine} to every step and one
 * {@link TransitionStateMachine} to every transition, wires them along the chart's links, and
 * starts runs at the chart's single start step.
 *
 * Notes for users:<br>
 * 1. the chart must be complete before the engine is built: every step needs a successor
 * transition, and there must be exactly one start step<br>
 *
 * 2. unless configured otherwise, the chart's structure stays locked until
 * {@link ProcedureFunctionChart#discardExecutionEngine()} is called<br>
 *
 * 3. one engine serves any number of concurrent runs; each run is isolated in its own
 * {@link PfcExecutionContext}<br>
 *
 * @author gaurav
 */
public final class ExecutionEngine {
  private static final Logger logger = LogManager.getLogger(ExecutionEngine.class.getSimpleName());

  private final ProcedureFunctionChart chart;
  private final ExecutionEngineConfiguration config;
  private final ExecutionStatistics statistics;
  private final Map<PfcStep, StepStateMachine> stepStateMachines = new LinkedHashMap<>();
  private final Map<PfcTransition, TransitionStateMachine> transitionStateMachines =
      new LinkedHashMap<>();
  private final PfcStep startStep;

  public ExecutionEngine(final ProcedureFunctionChart chart,
      final ExecutionEngineConfiguration config) throws PfcException {
    this.chart = chart;
    this.config = config == null ? ExecutionEngineConfiguration.defaults() : config;
    this.statistics = new ExecutionStatistics(chart.getName());
    this.startStep = validate();

    for (final PfcStep step : chart.getSteps()) {
      final StepStateMachine ssm = new StepStateMachine(step, statistics);
      step.setStepStateMachine(ssm);
      stepStateMachines.put(step, ssm);
    }
    for (final PfcTransition transition : chart.getTransitions()) {
      final TransitionStateMachine tsm =
          new TransitionStateMachine(transition, statistics, this.config.getScanningPeriodMillis());
      transition.setTransitionStateMachine(tsm);
      transitionStateMachines.put(transition, tsm);
    }
    for (final TransitionStateMachine tsm : transitionStateMachines.values()) {
      final PfcTransition transition = tsm.getTransition();
      for (final PfcNode predecessor : transition.getPredecessorNodes()) {
        final StepStateMachine ssm = stepStateMachines.get(predecessor);
        tsm.addPredecessorStateMachine(ssm);
        ssm.addSuccessorStateMachine(tsm);
      }
      for (final PfcNode successor : transition.getSuccessorNodes()) {
        tsm.addSuccessorStateMachine(stepStateMachines.get(successor));
      }
    }

    if (this.config.isStructureLockedDuringRun()) {
      chart.lockStructure();
    }
    logInfo(chart.getName(), "built engine with " + stepStateMachines.size()
        + " step machines and " + transitionStateMachines.size() + " transition machines, "
        + this.config);
  }

  private PfcStep validate() throws PfcException {
    PfcStep start = null;
    int startCount = 0;
    for (final PfcStep step : chart.getSteps()) {
      boolean hasTransition = false;
      for (final PfcNode successor : step.getSuccessorNodes()) {
        hasTransition |= successor instanceof PfcTransition;
      }
      if (!hasTransition) {
        throw new PfcException(Code.MISSING_SUCCESSOR_TRANSITION, String.format(
            "Step %s in PFC %s has no successor transition. A PFC must end with a termination"
                + " transition. (Did you acquire an Execution Engine while the Pfc was still"
                + " under construction?)",
            step.getName(), chart.getName()));
      }
      if (step.isStartNode()) {
        start = step;
        startCount++;
      }
    }
    for (final PfcTransition transition : chart.getTransitions()) {
      final List<PfcNode> neighbors = new ArrayList<>(transition.getPredecessorNodes());
      neighbors.addAll(transition.getSuccessorNodes());
      for (final PfcNode neighbor : neighbors) {
        if (!(neighbor instanceof PfcStep)) {
          throw new PfcException(Code.MALFORMED_CHART, "Transition " + transition.getName()
              + " in PFC " + chart.getName() + " is linked directly to another transition.");
        }
      }
    }
    if (startCount != 1) {
      throw new PfcException(Code.MALFORMED_CHART, "PFC " + chart.getName() + " has "
          + startCount + " start steps, an execution engine needs exactly one.");
    }
    return start;
  }

  /**
   * Starts the run described by the context at the chart's start step. Must be called from a
   * detachable event.
   */
  public void run(final PfcExecutionContext context) throws PfcException {
    logInfo(chart.getName(), "run " + context.getName() + " entering at " + startStep.getName());
    stepStateMachines.get(startStep).start(context);
  }

  public ProcedureFunctionChart getChart() {
    return chart;
  }

  public ExecutionEngineConfiguration getConfiguration() {
    return config;
  }

  public PfcStep getStartStep() {
    return startStep;
  }

  public StepStateMachine getStepStateMachine(final PfcStep step) {
    return stepStateMachines.get(step);
  }

  public TransitionStateMachine getTransitionStateMachine(final PfcTransition transition) {
    return transitionStateMachines.get(transition);
  }

  public Map<PfcStep, StepStateMachine> getStepStateMachines() {
    return Collections.unmodifiableMap(stepStateMachines);
  }

  public Map<PfcTransition, TransitionStateMachine> getTransitionStateMachines() {
    return Collections.unmodifiableMap(transitionStateMachines);
  }

  /**
   * Registers the listener with every step state machine of this chart.
   */
  public void addStepStateListener(final StepStateListener listener) {
    for (final StepStateMachine ssm : stepStateMachines.values()) {
      ssm.addStepStateListener(listener);
    }
  }

  public void removeStepStateListener(final StepStateListener listener) {
    for (final StepStateMachine ssm : stepStateMachines.values()) {
      ssm.removeStepStateListener(listener);
    }
  }

  /**
   * Registers the listener with every transition state machine of this chart.
   */
  public void addTransitionStateListener(final TransitionStateListener listener) {
    for (final TransitionStateMachine tsm : transitionStateMachines.values()) {
      tsm.addTransitionStateListener(listener);
    }
  }

  public void removeTransitionStateListener(final TransitionStateListener listener) {
    for (final TransitionStateMachine tsm : transitionStateMachines.values()) {
      tsm.removeTransitionStateListener(listener);
    }
  }

  public ExecutionStatistics getStatistics() {
    return statistics;
  }

  private static void logInfo(final String chartName, final String message) {
    logger.info(new StringBuilder().append("[p:").append(chartName).append("] ").append(message));
  }

}
