package com.github.pfc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.junit.Test;

import com.github.pfc.PfcException.Code;
import com.github.pfc.ProcedureFunctionChart.BindResult;
import com.github.pfc.analysis.PfcAnalyst;

/**
 * Tests to maintain the sanity and correctness of chart construction and editing.
 */
public class ProcedureFunctionChartTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  @Test
  public void testBindSymmetry() throws PfcException {
    // 1. a step, a transition and a free link
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Bind symmetry");
    final PfcStep step = pfc.createStep("S", "", null);
    final PfcTransition transition = pfc.createTransition("T", "", null);
    final PfcLink link = pfc.createLink();

    // 2. bind both ends
    pfc.bind(step, link);
    pfc.bind(link, transition);
    assertSame(step, link.getPredecessor());
    assertSame(transition, link.getSuccessor());
    assertEquals(1, Collections.frequency(step.getSuccessors(), link));
    assertEquals(1, Collections.frequency(transition.getPredecessors(), link));
    assertTrue(link.isBound());

    // 3. unbind reverses it exactly
    assertTrue(pfc.unbind(step, link));
    assertNull(link.getPredecessor());
    assertTrue(step.getSuccessors().isEmpty());
    assertTrue(pfc.unbind(link, transition));
    assertNull(link.getSuccessor());
    assertTrue(transition.getPredecessors().isEmpty());

    // 4. a second unbind has nothing to undo
    assertFalse(pfc.unbind(step, link));
  }

  @Test
  public void testDoubleBindIsRejected() throws PfcException {
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Double bind");
    final PfcStep first = pfc.createStep("S1", "", null);
    final PfcStep second = pfc.createStep("S2", "", null);
    final PfcLink link = pfc.createLink();
    pfc.bind(first, link);
    try {
      pfc.bind(second, link);
      fail("a bound link end cannot be bound again");
    } catch (PfcException expected) {
      assertEquals(Code.STRUCTURE_VIOLATION, expected.getCode());
    }
    assertSame(first, link.getPredecessor());
    assertTrue(second.getSuccessors().isEmpty());
  }

  @Test
  public void testHalfBoundLinksDuringStructureUpdate() throws PfcException {
    // 1. one link bound only at its predecessor, another only at its successor
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Half bound", "A", "B");
    final PfcLink outbound = pfc.createLink();
    final PfcLink inbound = pfc.createLink();
    pfc.bind(pfc.findNode("B"), outbound);
    pfc.bind(inbound, pfc.findNode("T_end"));
    assertNull(outbound.getSuccessor());
    assertNull(inbound.getPredecessor());

    // 2. both traversal orders number every node once
    for (final boolean breadthFirst : new boolean[] {true, false}) {
      pfc.updateStructure(breadthFirst);
      final Set<Integer> ordinals = new HashSet<>();
      for (final PfcNode node : pfc.getNodes()) {
        assertTrue(ordinals.add(node.getGraphOrdinal()));
      }
      assertEquals(pfc.getNodes().size(), ordinals.size());
    }
    assertFalse(outbound.isLoopback());

    // 3. iteration skips the open ends
    final List<String> names = new ArrayList<>();
    for (final Iterator<PfcNode> it = pfc.depthFirstIterator(); it.hasNext();) {
      names.add(it.next().getName());
    }
    assertEquals("[A, T_000, B, T_end]", names.toString());
  }

  @Test
  public void testBindInsertsShimBetweenLikeNodes() throws PfcException {
    // 1. two steps
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Shim");
    final PfcStep start = pfc.createStep("START", "", null);
    final PfcStep finish = pfc.createStep("FINISH", "", null);

    // 2. binding them puts a transition between
    final BindResult result = pfc.bind(start, finish);
    assertNotNull(result.getShim());
    assertEquals(PfcElementType.TRANSITION, result.getShim().getElementType());
    assertEquals("{START-->[L_000]-->T_000}\n{T_000-->[L_001]-->FINISH}\n",
        PfcDiagnostics.getStructure(pfc));

    // 3. binding them again rides on the existing shim
    final BindResult again = pfc.bind(start, finish);
    assertSame(result.getShim(), again.getShim());
    assertEquals(2, pfc.getLinks().size());

    // 4. without piggybacking a second shim is made
    final BindResult forced = pfc.bind(start, finish, false);
    assertFalse(result.getShim().equals(forced.getShim()));
    assertEquals(4, pfc.getLinks().size());
  }

  @Test
  public void testUnbindAndRebindKeepsNames() throws PfcException {
    // 1. START + FINISH
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Rebind");
    final PfcStep start = pfc.createStep("START", "", null);
    final PfcStep finish = pfc.createStep("FINISH", "", null);
    final PfcTransition t1 = pfc.createTransition();
    pfc.bind(start, t1);
    pfc.bind(t1, finish);

    // 2. splice a new step in and drop the old link
    final PfcStep newStep = pfc.createStep("NEW_STEP", "", null);
    final PfcTransition newTrans = pfc.createTransition();
    pfc.bind(t1, newStep);
    pfc.bind(newStep, newTrans);
    pfc.bind(newTrans, finish);
    pfc.unbind(t1, finish);

    assertEquals("{START-->[L_000]-->T_000}\n{T_000-->[L_002]-->NEW_STEP}\n"
        + "{NEW_STEP-->[L_003]-->T_001}\n{T_001-->[L_004]-->FINISH}\n",
        PfcDiagnostics.getStructure(pfc));
  }

  @Test
  public void testOrdinalsAreStable() throws PfcException {
    // 1. build and capture
    final ProcedureFunctionChart pfc = PfcTestCharts.createComplexLoopingChart();
    final String ordinals = ordinals(pfc);
    final List<String> successorOrder = successorOrder(pfc);

    // 2. a second update on an unchanged chart changes nothing
    pfc.updateStructure();
    assertEquals(ordinals, ordinals(pfc));
    assertEquals(successorOrder, successorOrder(pfc));
  }

  @Test
  public void testComplexLoopingOrdinals() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createComplexLoopingChart();
    assertEquals("START : 0\nT_000 : 1\nSTEP1 : 2\nSTEP4 : 3\nT_003 : 4\nT_002 : 5\nSTEP5 : 6\n"
        + "STEP6 : 7\nT_004 : 8\nT_005 : 9\nSTEP2 : 10\nT_001 : 11\nSTEP3 : 12\nT_006 : 13\n"
        + "FINISH : 14\n", ordinals(pfc));

    // the self loop at STEP5 is the only loopback
    int loopbacks = 0;
    for (final PfcLink link : pfc.getLinks()) {
      if (link.isLoopback()) {
        loopbacks++;
        assertSame(pfc.findNode("STEP5"), link.getSuccessor());
      }
    }
    assertEquals(1, loopbacks);
  }

  @Test
  public void testSeriesBranchingOrdinals() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createSeriesBranchingChart();
    assertEquals("START : 0\nT_000 : 1\nT_001 : 2\nSTEP3 : 3\nSTEP1 : 4\nT_004 : 5\nT_002 : 6\n"
        + "T_003 : 7\nSTEP2 : 8\nSTEP4 : 9\nT_005 : 10\nT_006 : 11\nFINISH : 12\n", ordinals(pfc));
  }

  @Test
  public void testDeleteRedundantPath() throws PfcException {
    // 1. T_014 is the direct alternative from Step_B to Step_N
    final ProcedureFunctionChart pfc = PfcTestCharts.createTestPfc();
    String structure = PfcDiagnostics.getStructure(pfc);
    assertTrue(structure.contains("{Step_B-->[L_032]-->T_014}"));
    assertTrue(structure.contains("{T_014-->[L_033]-->Step_N}"));

    // 2. deleting it takes its links along
    assertTrue(pfc.delete(pfc.findNode("T_014")));
    structure = PfcDiagnostics.getStructure(pfc);
    assertFalse(structure.contains("L_032"));
    assertFalse(structure.contains("L_033"));
    assertNull(pfc.findNode("T_014"));
  }

  @Test
  public void testDeleteStepSplicesNeighbors() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createTestPfc();
    String structure = PfcDiagnostics.getStructure(pfc);
    assertTrue(structure.contains("{T_003-->[L_007]-->Step_D}"));
    assertTrue(structure.contains("{Step_D-->[L_008]-->T_004}"));
    assertTrue(structure.contains("{T_004-->[L_009]-->Step_E}"));

    assertTrue(pfc.delete(pfc.findNode("Step_D")));
    structure = PfcDiagnostics.getStructure(pfc);
    assertFalse(structure.contains("Step_D"));
    assertFalse(structure.contains("T_004"));
    assertTrue(structure.contains("{T_003-->[L_034]-->Step_E}"));
  }

  @Test
  public void testDeleteTransitionSplicesNeighbors() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createTestPfc();
    assertTrue(pfc.delete(pfc.findNode("T_004")));
    final String structure = PfcDiagnostics.getStructure(pfc);
    assertFalse(structure.contains("Step_D"));
    assertFalse(structure.contains("T_004"));
    assertTrue(structure.contains("{T_003-->[L_034]-->Step_E}"));
  }

  @Test
  public void testDeleteOrphanGuard() throws PfcException {
    // 1. one transition synchronizing two steps into two steps
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Orphan guard");
    final PfcStep a = pfc.createStep("A", "", null);
    final PfcStep b = pfc.createStep("B", "", null);
    final PfcStep c = pfc.createStep("C", "", null);
    final PfcStep d = pfc.createStep("D", "", null);
    final PfcTransition sync = pfc.synchronize(new PfcNode[] {a, b}, new PfcNode[] {c, d});
    assertEquals(2, sync.getPredecessors().size());
    assertEquals(2, sync.getSuccessors().size());
    final String before = PfcDiagnostics.getStructure(pfc);

    // 2. deleting it would orphan both sides
    assertFalse(pfc.delete(sync));
    assertEquals(before, PfcDiagnostics.getStructure(pfc));
    assertSame(sync, pfc.findNode(sync.getName()));
  }

  @Test
  public void testDeleteRefusesManyToManyStep() throws PfcException {
    // 1. X joins T1 and T2 and feeds T3 and T4, and every neighbor has another path
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Many to many");
    final PfcStep x = pfc.createStep("X", "", null);
    final PfcTransition t1 = pfc.createTransition("T1", "", null);
    final PfcTransition t2 = pfc.createTransition("T2", "", null);
    final PfcTransition t3 = pfc.createTransition("T3", "", null);
    final PfcTransition t4 = pfc.createTransition("T4", "", null);
    pfc.bind(t1, x);
    pfc.bind(t1, pfc.createStep("Y1", "", null));
    pfc.bind(t2, x);
    pfc.bind(t2, pfc.createStep("Y2", "", null));
    pfc.bind(x, t3);
    pfc.bind(pfc.createStep("Z1", "", null), t3);
    pfc.bind(x, t4);
    pfc.bind(pfc.createStep("Z2", "", null), t4);
    final String before = PfcDiagnostics.getStructure(pfc);
    final int nodes = pfc.getNodes().size();

    // 2. refused, nothing touched
    assertFalse(pfc.delete(x));
    assertEquals(before, PfcDiagnostics.getStructure(pfc));
    assertEquals(nodes, pfc.getNodes().size());
    assertSame(x, pfc.findNode("X"));
  }

  @Test
  public void testSynchronizeTransitions() throws PfcException {
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Sync transitions");
    final PfcTransition t1 = pfc.createTransition("T1", "", null);
    final PfcTransition t2 = pfc.createTransition("T2", "", null);
    final PfcTransition t3 = pfc.createTransition("T3", "", null);
    final PfcTransition sync = pfc.synchronize(new PfcNode[] {t1, t2}, new PfcNode[] {t3});

    // every transition reaches the synchronizer through a shim step
    for (final PfcNode predecessor : sync.getPredecessorNodes()) {
      assertEquals(PfcElementType.STEP, predecessor.getElementType());
    }
    assertEquals(PfcElementType.STEP, sync.getSuccessorNodes().get(0).getElementType());
    assertSame(t3, sync.getSuccessorNodes().get(0).getSuccessorNodes().get(0));
  }

  @Test
  public void testSynchronizeRejectsMixedKinds() throws PfcException {
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Sync mixed");
    final PfcStep step = pfc.createStep("S", "", null);
    final PfcTransition transition = pfc.createTransition("T", "", null);
    final int linksBefore = pfc.getLinks().size();
    try {
      pfc.synchronize(new PfcNode[] {step, transition}, new PfcNode[] {step});
      fail("mixed kinds cannot be synchronized");
    } catch (PfcException expected) {
      assertEquals(Code.INVALID_SYNCHRONIZATION, expected.getCode());
    }
    try {
      pfc.synchronize(new PfcNode[0], new PfcNode[] {step});
      fail("empty predecessors cannot be synchronized");
    } catch (PfcException expected) {
      assertEquals(Code.INVALID_SYNCHRONIZATION, expected.getCode());
    }
    assertEquals(linksBefore, pfc.getLinks().size());
    assertEquals(1, pfc.getTransitions().size());
  }

  @Test
  public void testDuplicateIdsAndNames() throws PfcException {
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Duplicates");
    final UUID id = UUID.randomUUID();
    final PfcStep step = pfc.createStep("S", "", id);
    try {
      pfc.createTransition("T", "", id);
      fail("ids are unique within a chart");
    } catch (PfcException expected) {
      assertEquals(Code.DUPLICATE_ELEMENT_ID, expected.getCode());
    }
    final PfcStep other = pfc.createStep("OTHER", "", null);
    try {
      other.setName("S");
      fail("names are unique within a chart");
    } catch (PfcException expected) {
      assertEquals(Code.DUPLICATE_ELEMENT_NAME, expected.getCode());
    }
    step.setName("RENAMED");
    assertSame(step, pfc.findNode("RENAMED"));
    assertSame(step, pfc.getElement(id));
  }

  @Test
  public void testForeignElementsAreRejected() throws PfcException {
    final ProcedureFunctionChart first = new ProcedureFunctionChart("First");
    final ProcedureFunctionChart second = new ProcedureFunctionChart("Second");
    final PfcStep mine = first.createStep("A", "", null);
    final PfcStep theirs = second.createStep("B", "", null);
    try {
      first.bind(mine, theirs);
      fail("a chart binds only its own elements");
    } catch (PfcException expected) {
      assertEquals(Code.FOREIGN_ELEMENT, expected.getCode());
    }
    assertTrue(first.getLinks().isEmpty());
  }

  @Test
  public void testDefaultNamesSkipNamesInUse() throws PfcException {
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Names");
    pfc.createStep("S_000", "", null);
    assertEquals("S_001", pfc.createStep().getName());
    assertEquals("T_000", pfc.createTransition().getName());
    assertEquals("L_000", pfc.createLink().getName());
  }

  @Test
  public void testSuspendNodeSortingRunsOneUpdate() throws PfcException {
    // 1. bracket several binds
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Bracketed");
    final PfcStep a = pfc.createStep("A", "", null);
    final PfcStep b = pfc.createStep("B", "", null);
    final PfcStep c = pfc.createStep("C", "", null);
    final long updatesBefore = pfc.getStructureUpdateCount();
    pfc.suspendNodeSorting();
    pfc.suspendNodeSorting();
    pfc.bind(a, b);
    pfc.bind(b, c);
    pfc.resumeNodeSorting();
    assertEquals(updatesBefore, pfc.getStructureUpdateCount());
    assertTrue(pfc.isStructureDirty());

    // 2. the outermost resume runs exactly one update
    pfc.resumeNodeSorting();
    assertEquals(updatesBefore + 1, pfc.getStructureUpdateCount());
    assertFalse(pfc.isStructureDirty());
    assertEquals(0, a.getGraphOrdinal());
    assertEquals(4, c.getGraphOrdinal());
  }

  @Test
  public void testLinkPriorities() throws PfcException {
    // 1. START diverges serially to STEP1 and STEP2
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Priorities");
    final PfcStep start = pfc.createStep("START", "", null);
    final PfcStep step1 = pfc.createStep("STEP1", "", null);
    final PfcStep step2 = pfc.createStep("STEP2", "", null);
    pfc.bindSeriesDivergent(start, new PfcNode[] {step1, step2});
    assertEquals("START and STEP1", PfcAnalyst.getPrimaryPathAsString(start, true));

    // 2. making the STEP2 branch primary moves it to the front
    final PfcLink toStep2 = step2.getPredecessorNodes().get(0).getPredecessors().get(0);
    pfc.makeLinkPrimary(toStep2);
    assertSame(toStep2, start.getSuccessors().get(0));
    assertEquals("START and STEP2", PfcAnalyst.getPrimaryPathAsString(start, true));

    // 3. and the lowest priority sends it back
    start.setLinkLowestPriority(toStep2);
    pfc.updateStructure();
    assertSame(toStep2, start.getSuccessors().get(1));
    start.setLinkHighestPriority(toStep2);
    pfc.updateStructure();
    assertSame(toStep2, start.getSuccessors().get(0));
  }

  @Test
  public void testStructureLockedWhileEngineAttached() throws PfcException {
    // 1. building an engine locks the chart
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Locked", "A", "B");
    pfc.getExecutionEngine();
    assertTrue(pfc.isStructureLocked());
    try {
      pfc.createStep("C", "", null);
      fail("a locked chart cannot grow");
    } catch (PfcException expected) {
      assertEquals(Code.STRUCTURE_LOCKED, expected.getCode());
    }
    try {
      pfc.delete(pfc.findNode("B"));
      fail("a locked chart cannot shrink");
    } catch (PfcException expected) {
      assertEquals(Code.STRUCTURE_LOCKED, expected.getCode());
    }

    // 2. discarding the engine unlocks it and releases the machines
    pfc.discardExecutionEngine();
    assertFalse(pfc.isStructureLocked());
    assertNull(((PfcStep) pfc.findNode("A")).getStepStateMachine());
    pfc.createStep("C", "", null);
  }

  @Test
  public void testCopyKeepsSourceIds() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createTestPfc();
    final ProcedureFunctionChart copy = pfc.copy();
    assertEquals(PfcDiagnostics.getStructure(pfc), PfcDiagnostics.getStructure(copy));
    for (final PfcNode node : copy.getNodes()) {
      final PfcElement original = pfc.getElement(node.getSourceId());
      assertNotNull(original);
      assertEquals(original.getName(), node.getName());
      assertFalse(original.getId().equals(node.getId()));
      assertEquals(((PfcNode) original).getGraphOrdinal(), node.getGraphOrdinal());
    }

    // new elements in the copy continue its naming
    assertEquals("T_015", copy.createTransition().getName());
  }

  @Test
  public void testReduceCollapsesNullPairs() throws PfcException {
    // 1. a line of steps that do nothing
    final ProcedureFunctionChart pfc =
        PfcTestCharts.createLinearChart("Reducible", "A", "B", "C", "D");
    assertEquals(4, pfc.getSteps().size());

    // 2. everything between the start step and the finish transition goes
    assertTrue(pfc.reduce());
    assertEquals(1, pfc.getSteps().size());
    assertEquals(1, pfc.getTransitions().size());
    assertEquals(1, pfc.getLinks().size());
    assertSame(pfc.findNode("T_end"), pfc.findNode("A").getSuccessorNodes().get(0));
    assertFalse(pfc.reduce());
  }

  @Test
  public void testReduceKeepsStepsWithActions() throws PfcException {
    final ProcedureFunctionChart pfc =
        PfcTestCharts.createLinearChart("Busy", "A", "B", "C", "D");
    ((PfcStep) pfc.findNode("B")).setLeafLevelAction((context, ssm) -> {
    });
    ((PfcStep) pfc.findNode("C")).setLeafLevelAction((context, ssm) -> {
    });
    ((PfcStep) pfc.findNode("D")).setLeafLevelAction((context, ssm) -> {
    });
    assertFalse(pfc.reduce());
    assertEquals(4, pfc.getSteps().size());
  }

  @Test
  public void testDuplicateLinkElimination() throws PfcException {
    final ProcedureFunctionChart pfc = new ProcedureFunctionChart("Duplicate links");
    final PfcStep step = pfc.createStep("S", "", null);
    final PfcTransition transition = pfc.createTransition("T", "", null);
    pfc.createLink(null, null, null, step, transition);
    pfc.createLink(null, null, null, step, transition);
    assertEquals(2, step.getSuccessors().size());
    assertTrue(pfc.reduce(Collections.singletonList(Reductions.duplicateLinkElimination())));
    assertEquals(1, step.getSuccessors().size());
    assertEquals(1, pfc.getLinks().size());
  }

  @Test
  public void testPrune() throws PfcException {
    final ProcedureFunctionChart pfc =
        PfcTestCharts.createLinearChart("Prunable", "A", "KEEP_1", "B", "KEEP_2");
    final int pruned = pfc.prune(step -> step.getName().startsWith("KEEP") || step.isStartNode());
    assertEquals(1, pruned);
    assertNull(pfc.findNode("B"));
    assertEquals("A, KEEP_1 and KEEP_2",
        PfcAnalyst.getPrimaryPathAsString(pfc.findNode("A"), true));
  }

  @Test
  public void testFlattenInlinesSingleChild() throws PfcException {
    // 1. a parent whose middle step owns a child chart
    final ProcedureFunctionChart parent =
        PfcTestCharts.createLinearChart("Parent", "BEGIN", "MIX", "END");
    final ProcedureFunctionChart child = PfcTestCharts.createLinearChart("Child", "C1", "C2");
    final PfcStep mix = (PfcStep) parent.findNode("MIX");
    mix.addAction("mixing", child);
    assertSame(child.findNode("C2"), parent.findNode("MIX/mixing/C2"));
    assertEquals(1, parent.getChildCharts().size());

    // 2. the child's nodes take the step's place, ahead of the step itself
    parent.flatten();
    assertTrue(mix.getActions().isEmpty());
    assertNotNull(parent.findNode("MIX:C1"));
    assertNotNull(parent.findNode("MIX:entry"));
    assertEquals("BEGIN, MIX:entry, MIX:C1, MIX:C2, MIX and END",
        PfcAnalyst.getPrimaryPathAsString(parent.findNode("BEGIN"), true));
  }

  @Test
  public void testFlattenRunsSeveralChildrenInParallel() throws PfcException {
    final ProcedureFunctionChart parent =
        PfcTestCharts.createLinearChart("Parent", "BEGIN", "MIX", "END");
    final PfcStep mix = (PfcStep) parent.findNode("MIX");
    final ProcedureFunctionChart heat = PfcTestCharts.createLinearChart("Heat", "H1");
    heat.findNode("T_end").setName("H_end");
    final ProcedureFunctionChart stir = PfcTestCharts.createLinearChart("Stir", "S1");
    stir.findNode("T_end").setName("S_end");
    mix.addAction("heat", heat);
    mix.addAction("stir", stir);
    parent.flatten();

    final PfcNode fork = parent.findNode("MIX:fork");
    final PfcNode join = parent.findNode("MIX:join");
    assertNotNull(fork);
    assertNotNull(join);
    assertEquals(2, fork.getSuccessors().size());
    assertEquals(2, join.getPredecessors().size());
    assertSame(mix, join.getSuccessorNodes().get(0));
  }

  @Test
  public void testApplyNamingCosmetics() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Cosmetics", "A", "B");
    final PfcStep nullStep = pfc.createStep();
    pfc.bind(pfc.findNode("T_end"), nullStep);
    pfc.bind(nullStep, pfc.createTransition());
    ((PfcStep) pfc.findNode("A")).setLeafLevelAction((context, ssm) -> {
    });
    ((PfcStep) pfc.findNode("B")).setLeafLevelAction((context, ssm) -> {
    });
    pfc.applyNamingCosmetics();

    final List<String> names = new ArrayList<>();
    for (final PfcNode node : pfc.getNodes()) {
      names.add(node.getName());
    }
    assertEquals("[A, T_001, B, T_002, NULL_UP:0, T_003]", names.toString());
  }

  @Test
  public void testDescribeListsOrdinalsAndPriorities() throws PfcException {
    final ProcedureFunctionChart pfc = PfcTestCharts.createLinearChart("Described", "A", "B");
    final String description = PfcDiagnostics.describe(pfc);
    assertTrue(description.startsWith("Chart Described : 2 steps, 2 transitions, 3 links\n"));
    assertTrue(description.contains("  0 STEP A\n"));
    assertTrue(description.contains("    -> T_000 via L_000 (priority 0)\n"));
  }

  @Test
  public void testQueries() throws PfcException {
    // 1. START -> T1 -> (S1 | S2) -> T2
    final ProcedureFunctionChart pfc = PfcTestCharts.createParallelChart();
    final PfcNode t1 = pfc.findNode("T1");
    final PfcNode s1 = pfc.findNode("S1");
    final PfcNode t2 = pfc.findNode("T2");

    // 2. lookups in graph order
    assertSame(t1, pfc.findFirst(node -> node.getElementType() == PfcElementType.TRANSITION));
    assertEquals(3, pfc.findAll(node -> node.getElementType() == PfcElementType.STEP).size());
    assertEquals(Collections.singletonList(pfc.findNode("START")), pfc.getStartSteps());
    assertTrue(pfc.getFinishSteps().isEmpty());
    assertSame(t2, pfc.getFinishTransition());
    assertEquals(5, pfc.getChildren(0, element -> element instanceof PfcLink).size());

    // 3. depth first follows the first branch to its end before the second
    final List<String> walk = new ArrayList<>();
    for (final Iterator<PfcNode> nodes = pfc.depthFirstIterator(); nodes.hasNext();) {
      walk.add(nodes.next().getName());
    }
    assertEquals("[START, T1, S1, T2, S2]", walk.toString());

    // 4. link shapes
    assertEquals(AggregateLinkType.SIMPLE,
        pfc.findNode("START").getSuccessors().get(0).getAggregateLinkType());
    assertEquals(AggregateLinkType.PARALLEL_DIVERGENT,
        t1.getLinkForSuccessorNode(s1).getAggregateLinkType());
    final PfcLink closing = s1.getLinkForSuccessorNode(t2);
    assertSame(closing, t2.getLinkForPredecessorNode(s1));
    assertEquals(AggregateLinkType.PARALLEL_CONVERGENT, closing.getAggregateLinkType());

    // 5. a detached link stays in the chart with no ends
    closing.detach();
    assertEquals(AggregateLinkType.UNKNOWN, closing.getAggregateLinkType());
    assertTrue(pfc.getLinks().contains(closing));
    assertEquals(1, t2.getPredecessors().size());
  }

  private static String ordinals(final ProcedureFunctionChart pfc) {
    final StringBuilder builder = new StringBuilder();
    for (final PfcNode node : pfc.getNodes()) {
      builder.append(node.getName()).append(" : ").append(node.getGraphOrdinal()).append('\n');
    }
    return builder.toString();
  }

  private static List<String> successorOrder(final ProcedureFunctionChart pfc) {
    final List<String> order = new ArrayList<>();
    for (final PfcNode node : pfc.getNodes()) {
      for (final PfcLink link : node.getSuccessors()) {
        order.add(node.getName() + "->" + link.getName());
      }
    }
    return order;
  }

}
