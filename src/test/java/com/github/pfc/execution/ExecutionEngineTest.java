package com.github.pfc.execution;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.pfc.PfcException;
import com.github.pfc.PfcException.Code;
import com.github.pfc.PfcLifecycleListener;
import com.github.pfc.PfcStep;
import com.github.pfc.PfcTestCharts;
import com.github.pfc.PfcTransition;
import com.github.pfc.ProcedureFunctionChart;
import com.github.pfc.execution.ExecutionEngineConfiguration.ExecutionEngineConfigurationBuilder;
import com.github.pfc.execution.actions.SimpleDelay;
import com.github.pfc.executive.DiscreteEventExecutive;
import com.github.pfc.executive.EventType;

/**
 * Tests to drive charts through the execution engine on a discrete-event executive.
 */
public class ExecutionEngineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  @Test
  public void testLinearRunOrder() throws PfcException {
    // 1. two steps, default one minute scanning
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Linear", "Start", "Finish");
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("linear");
    final List<String> events = Collections.synchronizedList(new ArrayList<>());
    final ExecutionEngine engine = pfc.getExecutionEngine();
    engine.addStepStateListener((ssm, ctx) -> events
        .add(ssm.getName() + ":" + ssm.getState(ctx) + "@" + executive.getNow()));
    engine.addTransitionStateListener((tsm, ctx) -> events
        .add(tsm.getName() + ":" + tsm.getState(ctx) + "@" + executive.getNow()));
    pfc.addLifecycleListener(new RecordingLifecycleListener(events, executive));

    // 2. run it
    pfc.run(executive, "batch-1");
    executive.start();

    // 3. every change in order
    assertEquals(Arrays.asList("startRequested@0", "starting@0", "Start:RUNNING@0",
        "T_000:ACTIVE@0", "Start:COMPLETE@0", "Start:IDLE@60000", "T_000:INACTIVE@60000",
        "Finish:RUNNING@60000", "T_end:ACTIVE@60000", "Finish:COMPLETE@60000",
        "Finish:IDLE@120000", "T_end:INACTIVE@120000", "completing@120000"), events);

    // 4. counters
    final ExecutionStatistics statistics = engine.getStatistics();
    assertEquals("Linear", statistics.getChartName());
    assertEquals(2, statistics.getTotalStepStarts());
    assertEquals(2, statistics.getTotalStepCompletions());
    assertEquals(2, statistics.getTotalTransitionFirings());
    assertEquals(2, statistics.getTotalConditionScans());
    assertEquals(1, statistics.getTotalChartCompletions());
  }

  @Test
  public void testRunContext() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Context", "A", "B");
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("context");
    final List<PfcExecutionContext> contexts = new ArrayList<>();
    pfc.addLifecycleListener(new PfcLifecycleListener() {
      @Override
      public void completing(final ProcedureFunctionChart chart,
          final PfcExecutionContext context) {
        contexts.add(context);
      }
    });
    pfc.run(executive, "payload");
    executive.start();

    // 1. the run's own context
    assertEquals(1, contexts.size());
    final PfcExecutionContext run = contexts.get(0);
    assertEquals("payload", run.getUserData());
    assertFalse(run.isStepCentric());
    assertEquals(0L, run.getStartTime());
    assertEquals(120000L, run.getEndTime());

    // 2. one instance per step, each nested under the run
    final PfcStep a = (PfcStep) pfc.findNode("A");
    final StepStateMachine ssm = a.getStepStateMachine();
    assertEquals(1, ssm.getStartCount(run));
    final List<PfcExecutionContext> instances = ssm.getInstanceContexts(run);
    assertEquals(1, instances.size());
    final PfcExecutionContext instance = instances.get(0);
    assertEquals("A#0", instance.getName());
    assertSame(run, instance.getParent());
    assertSame(run, instance.getRoot());
    assertEquals("payload", instance.getUserData());
    assertEquals(StepState.IDLE, ssm.getState(run));
    assertEquals(null, ssm.getActiveInstanceContext(run));
  }

  @Test
  public void testConcurrentRunsAreIsolated() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Twice", "A", "B");
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("twice");
    final List<String> completions = Collections.synchronizedList(new ArrayList<>());
    pfc.addLifecycleListener(new PfcLifecycleListener() {
      @Override
      public void completing(final ProcedureFunctionChart chart,
          final PfcExecutionContext context) {
        completions.add(context.getUserData() + "@" + executive.getNow());
      }
    });

    // 1. the second run starts half a minute later
    pfc.run(executive, "first");
    executive.requestEvent((exec, userData) -> pfc.run(exec, "second"), 30000L, 0.0, null,
        EventType.SYNCHRONOUS);
    executive.start();

    // 2. both finish on their own schedule
    assertEquals(Arrays.asList("first@120000", "second@150000"), completions);
    assertEquals(2, pfc.getExecutionEngine().getStatistics().getTotalChartCompletions());
  }

  @Test
  public void testTransitionCondition() throws PfcException {
    // 1. T_000 holds off until 150 seconds
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Timed", "A", "B");
    final PfcTransition gate = (PfcTransition) pfc.findNode("T_000");
    gate.setCondition(Conditions.allOf(Conditions.stepIsComplete("A"),
        Conditions.afterTime(150000L)));
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("timed");
    final List<Long> completions = Collections.synchronizedList(new ArrayList<>());
    pfc.addLifecycleListener(new PfcLifecycleListener() {
      @Override
      public void completing(final ProcedureFunctionChart chart,
          final PfcExecutionContext context) {
        completions.add(executive.getNow());
      }
    });

    // 2. scanned at 60, 120 and 180 seconds
    pfc.run(executive, null);
    executive.start();
    assertEquals(Collections.singletonList(240000L), completions);
    assertEquals(4, pfc.getExecutionEngine().getStatistics().getTotalConditionScans());
  }

  @Test
  public void testUnresolvedStepReference() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Dangling", "A", "B");
    ((PfcTransition) pfc.findNode("T_000")).setCondition(Conditions.stepIsComplete("Nope"));
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("dangling");
    pfc.run(executive, null);
    try {
      executive.start();
      fail("Nope is not a step of the chart");
    } catch (PfcException expected) {
      assertEquals(Code.UNRESOLVED_REFERENCE, expected.getCode());
    }
  }

  @Test
  public void testScanningPeriod() throws PfcException {
    // 1. scan every second
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Fast", "A", "B");
    pfc.setEngineConfiguration(ExecutionEngineConfigurationBuilder.newBuilder()
        .scanningPeriodMillis(1000L).structureLockedDuringRun(false).build());
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("fast");
    final List<Long> completions = Collections.synchronizedList(new ArrayList<>());
    pfc.addLifecycleListener(new PfcLifecycleListener() {
      @Override
      public void completing(final ProcedureFunctionChart chart,
          final PfcExecutionContext context) {
        completions.add(executive.getNow());
      }
    });

    // 2. two transitions, one second each
    pfc.run(executive, null);
    executive.start();
    assertEquals(Collections.singletonList(2000L), completions);
    assertEquals(1000L, pfc.getExecutionEngine().getConfiguration().getScanningPeriodMillis());
    assertFalse(pfc.isStructureLocked());

    // 3. an engine is configured once
    try {
      pfc.setEngineConfiguration(ExecutionEngineConfiguration.defaults());
      fail("the engine already exists");
    } catch (PfcException expected) {
      assertEquals(Code.INVALID_ENGINE_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testEngineConfiguration() throws PfcException {
    assertEquals(60000L, ExecutionEngineConfiguration.defaults().getScanningPeriodMillis());
    assertTrue(ExecutionEngineConfiguration.defaults().isStructureLockedDuringRun());
    assertEquals(60000L, ExecutionEngineConfigurationBuilder.newBuilder().scanningPeriodMillis(-5L)
        .build().getScanningPeriodMillis());
    try {
      ExecutionEngineConfigurationBuilder.newBuilder()
          .scanningPeriodMillis(Long.MAX_VALUE / 4 + 1L).build();
      fail("such a period overflows the clock");
    } catch (PfcException expected) {
      assertEquals(Code.INVALID_ENGINE_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testEngineLocksStructure() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Locked", "A", "B");
    final ExecutionEngine engine = pfc.getExecutionEngine();
    assertSame(engine, pfc.getExecutionEngine());
    assertTrue(pfc.isStructureLocked());
    try {
      pfc.createStep("C", "", null);
      fail("the structure is locked");
    } catch (PfcException expected) {
      assertEquals(Code.STRUCTURE_LOCKED, expected.getCode());
    }

    // a fresh engine after discarding
    pfc.discardExecutionEngine();
    assertFalse(pfc.isStructureLocked());
    assertEquals(null, ((PfcStep) pfc.findNode("A")).getStepStateMachine());
    assertNotSame(engine, pfc.getExecutionEngine());
  }

  @Test
  public void testMissingSuccessorTransition() throws PfcException {
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Unfinished");
    pfc.bind(pfc.createStep("A", "", null), pfc.createStep("B", "", null));
    try {
      pfc.getExecutionEngine();
      fail("B leads nowhere");
    } catch (PfcException expected) {
      assertEquals(Code.MISSING_SUCCESSOR_TRANSITION, expected.getCode());
      assertEquals("Step B in PFC Unfinished has no successor transition. A PFC must end with a"
          + " termination transition. (Did you acquire an Execution Engine while the Pfc was"
          + " still under construction?)", expected.getMessage());
    }
    assertFalse(pfc.isStructureLocked());
  }

  @Test
  public void testMultipleStartSteps() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Two starts", "A", "B");
    pfc.bind(pfc.createStep("C", "", null), pfc.findNode("T_end"));
    try {
      pfc.getExecutionEngine();
      fail("A and C both start the chart");
    } catch (PfcException expected) {
      assertEquals(Code.MALFORMED_CHART, expected.getCode());
    }
  }

  @Test
  public void testEarliestStart() throws PfcException {
    // 1. the run may not start before 5 seconds, B not before 200 seconds
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Late", "A", "B");
    pfc.setEarliestStart(5000L);
    pfc.findNode("B").setEarliestStart(200000L);
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("late");
    final List<String> running = Collections.synchronizedList(new ArrayList<>());
    pfc.getExecutionEngine().addStepStateListener((ssm, ctx) -> {
      if (ssm.getState(ctx) == StepState.RUNNING) {
        running.add(ssm.getName() + "@" + executive.getNow() + "/" + ctx.getStartTime());
      }
    });

    // 2. both waits are honoured
    pfc.run(executive, null);
    executive.start();
    assertEquals(Arrays.asList("A@5000/5000", "B@200000/200000"), running);
    assertEquals(260000L, executive.getNow());
  }

  @Test
  public void testPauseFreezesScanning() throws PfcException {
    // 1. A takes 100 seconds
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Paused", "A", "B");
    final PfcStep a = (PfcStep) pfc.findNode("A");
    a.setActor(new SimpleDelay("work", 100000L));
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("paused");
    final List<String> gate = Collections.synchronizedList(new ArrayList<>());
    final PfcTransition t000 = (PfcTransition) pfc.findNode("T_000");
    pfc.getExecutionEngine().getTransitionStateMachine(t000).addTransitionStateListener(
        (tsm, ctx) -> gate.add(tsm.getState(ctx) + "@" + executive.getNow()));
    final PfcExecutionContext[] run = new PfcExecutionContext[1];
    pfc.addLifecycleListener(new PfcLifecycleListener() {
      @Override
      public void starting(final ProcedureFunctionChart chart, final PfcExecutionContext context) {
        run[0] = context;
      }
    });

    // 2. paused from 10 to 20 seconds
    pfc.run(executive, null);
    executive.requestEvent((exec, userData) -> {
      a.getStepStateMachine().pause(run[0]);
      assertEquals(StepState.PAUSED, a.getStepStateMachine().getState(run[0]));
      assertTrue(a.getStepStateMachine().isInQuiescentState(run[0]));
    }, 10000L, 0.0, null, EventType.SYNCHRONOUS);
    executive.requestEvent((exec, userData) -> a.getStepStateMachine().resume(run[0]), 20000L,
        0.0, null, EventType.SYNCHRONOUS);
    executive.start();

    // 3. scanning restarted on resume and first succeeded after A completed at 100 seconds
    assertEquals(Arrays.asList("ACTIVE@0", "NOT_BEING_EVALUATED@10000", "ACTIVE@20000",
        "INACTIVE@140000"), gate);
  }

  @Test
  public void testIllegalStateTransitions() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Illegal", "A", "B");
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("illegal");
    final PfcExecutionContext context = new PfcExecutionContext(pfc, "idle run", executive, null);
    final StepStateMachine ssm =
        pfc.getExecutionEngine().getStepStateMachine((PfcStep) pfc.findNode("A"));

    // 1. nothing to stop
    try {
      ssm.stop(context);
      fail("A has no active instance");
    } catch (PfcException expected) {
      assertEquals(Code.ILLEGAL_STATE_TRANSITION, expected.getCode());
    }

    // 2. a completed step cannot be paused
    final List<Object> seen = Collections.synchronizedList(new ArrayList<>());
    executive.requestEvent((exec, userData) -> {
      ssm.start(context);
      seen.add(ssm.getState(context));
      seen.add(ssm.isInFinalState(context));
      try {
        ssm.pause(context);
      } catch (PfcException expected) {
        seen.add(expected.getCode());
      }
    }, 0L, 0.0, null, EventType.DETACHABLE);
    executive.start();
    assertEquals(Arrays.asList(StepState.COMPLETE, Boolean.TRUE, Code.ILLEGAL_STATE_TRANSITION),
        seen);
  }

  @Test
  public void testStateMachineReplacement() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Replaced", "A", "B");
    final PfcStep a = (PfcStep) pfc.findNode("A");
    final StepStateMachine original = pfc.getExecutionEngine().getStepStateMachine(a);
    final ProcedureFunctionChart other = PfcTestCharts.createLinearChart("Other", "A", "B");
    try {
      a.setStepStateMachine(
          other.getExecutionEngine().getStepStateMachine((PfcStep) other.findNode("A")));
      fail("A already has its machine");
    } catch (PfcException expected) {
      assertEquals(Code.STATE_MACHINE_REPLACEMENT, expected.getCode());
    }
    assertSame(original, a.getStepStateMachine());
  }

  @Test
  public void testHoldRestartAndForcedFiring() throws PfcException {
    // 1. A takes 100 seconds but T_000 gives up waiting after 50 seconds
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Held", "A", "B");
    final PfcStep a = (PfcStep) pfc.findNode("A");
    a.setActor(new SimpleDelay("work", 100000L));
    ((PfcTransition) pfc.findNode("T_000")).setCondition(Conditions.anyOf(
        Conditions.stepIsComplete("A"), Conditions.afterTime(50000L)));
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("held");
    final List<String> states = Collections.synchronizedList(new ArrayList<>());
    final StepStateMachine ssm = pfc.getExecutionEngine().getStepStateMachine(a);
    ssm.addStepStateListener((machine, ctx) -> states.add(machine.getState(ctx) + "@"
        + executive.getNow()));
    final List<String> events = Collections.synchronizedList(new ArrayList<>());
    pfc.addLifecycleListener(new RecordingLifecycleListener(events, executive));
    final PfcExecutionContext[] run = new PfcExecutionContext[1];
    pfc.addLifecycleListener(new PfcLifecycleListener() {
      @Override
      public void starting(final ProcedureFunctionChart chart, final PfcExecutionContext context) {
        run[0] = context;
      }
    });

    // 2. held from 10 to 20 seconds
    pfc.run(executive, null);
    executive.requestEvent((exec, userData) -> ssm.hold(run[0]), 10000L, 0.0, null,
        EventType.SYNCHRONOUS);
    executive.requestEvent((exec, userData) -> ssm.restart(run[0]), 20000L, 0.0, null,
        EventType.SYNCHRONOUS);
    executive.start();

    // 3. the first scan after the restart fires and stops A before its delay is over
    assertEquals(Arrays.asList("RUNNING@0", "HOLDING@10000", "HELD@10000", "RESTARTING@20000",
        "RUNNING@20000", "STOPPING@80000", "STOPPED@80000", "IDLE@80000"), states);
    assertEquals(Arrays.asList("startRequested@0", "starting@0", "completing@140000"), events);
    assertEquals(140000L, executive.getNow());
    final ExecutionStatistics statistics = pfc.getExecutionEngine().getStatistics();
    assertEquals(1, statistics.getTotalStepCompletions());
    assertEquals(2, statistics.getTotalTransitionFirings());
  }

  @Test
  public void testAbortedStepNeverSatisfiesDefaultCondition() throws PfcException {
    // 1. A is aborted a few seconds into its delay
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Aborted", "A", "B");
    final PfcStep a = (PfcStep) pfc.findNode("A");
    a.setActor(new SimpleDelay("work", 100000L));
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("aborted");
    final PfcExecutionContext[] run = new PfcExecutionContext[1];
    pfc.addLifecycleListener(new PfcLifecycleListener() {
      @Override
      public void starting(final ProcedureFunctionChart chart, final PfcExecutionContext context) {
        run[0] = context;
      }
    });
    final StepStateMachine ssm = pfc.getExecutionEngine().getStepStateMachine(a);

    // 2. nothing else would ever stop the scanning, so the executive is stopped by hand
    pfc.run(executive, null);
    executive.requestEvent((exec, userData) -> ssm.abort(run[0]), 10000L, 0.0, null,
        EventType.SYNCHRONOUS);
    executive.requestEvent((exec, userData) -> executive.stop(), 300000L, 0.0, null,
        EventType.SYNCHRONOUS);
    executive.start();

    // 3. A stays aborted and B never started
    assertEquals(300000L, executive.getNow());
    assertEquals(StepState.ABORTED, ssm.getState(run[0]));
    assertTrue(ssm.isInFinalState(run[0]));
    final StepStateMachine b =
        pfc.getExecutionEngine().getStepStateMachine((PfcStep) pfc.findNode("B"));
    assertEquals(0, b.getStartCount(run[0]));
    final ExecutionStatistics statistics = pfc.getExecutionEngine().getStatistics();
    assertEquals(0, statistics.getTotalStepCompletions());
    assertEquals(4, statistics.getTotalConditionScans());
    assertEquals(0, statistics.getTotalChartCompletions());
  }

  @Test
  public void testChildActionsRunBeforeStepCompletes() throws PfcException {
    // 1. P1 runs a two step child chart
    final ProcedureFunctionChart parent = PfcTestCharts.createLinearChart("Parent", "P1", "P2");
    final ProcedureFunctionChart child = PfcTestCharts.createLinearChart("Mix", "C1", "C2");
    final PfcStep p1 = (PfcStep) parent.findNode("P1");
    p1.addAction("mix", child);
    final DiscreteEventExecutive executive = new DiscreteEventExecutive("nested");
    final List<String> events = Collections.synchronizedList(new ArrayList<>());
    parent.addLifecycleListener(new RecordingLifecycleListener(events, executive));
    child.addLifecycleListener(new RecordingLifecycleListener(events, executive));
    parent.getExecutionEngine().addStepStateListener((ssm, ctx) -> {
      if (ssm.getState(ctx) == StepState.COMPLETE) {
        events.add(ssm.getName() + ":COMPLETE@" + executive.getNow());
      }
    });

    // 2. run the parent
    parent.run(executive, null);
    executive.start();

    // 3. P1 completes only when the child run does
    assertEquals(Arrays.asList("startRequested@0", "starting@0", "startRequested@0",
        "starting@0", "completing@120000", "P1:COMPLETE@120000", "P2:COMPLETE@180000",
        "completing@240000"), events);
    assertSame(child, parent.findNode("P1/mix/C1").getParent());
  }

  /**
   * Records lifecycle callbacks with the simulated time they arrived at.
   */
  private static final class RecordingLifecycleListener implements PfcLifecycleListener {
    private final List<String> events;
    private final DiscreteEventExecutive executive;

    private RecordingLifecycleListener(final List<String> events,
        final DiscreteEventExecutive executive) {
      this.events = events;
      this.executive = executive;
    }

    @Override
    public void startRequested(final ProcedureFunctionChart chart,
        final PfcExecutionContext context) {
      events.add("startRequested@" + executive.getNow());
    }

    @Override
    public void starting(final ProcedureFunctionChart chart, final PfcExecutionContext context) {
      events.add("starting@" + executive.getNow());
    }

    @Override
    public void completing(final ProcedureFunctionChart chart,
        final PfcExecutionContext context) {
      events.add("completing@" + executive.getNow());
    }
  }

}
