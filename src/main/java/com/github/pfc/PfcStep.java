package com.github.pfc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.github.pfc.PfcException.Code;
import com.github.pfc.execution.PfcExecutionContext;
import com.github.pfc.execution.StepStateMachine;
import com.github.pfc.executive.EventController;
import com.github.pfc.executive.Executive;

/**
 * A unit of work in a chart. A step either runs a leaf-level action or, when it holds named child
 * charts, runs all of them concurrently and completes once every one of them has finished.
 */
public final class PfcStep extends PfcNode {
  private final Map<String, ProcedureFunctionChart> actions = new LinkedHashMap<>();
  private PfcAction leafLevelAction = PfcAction.NO_OP;
  private PfcAction precondition;
  private PfcUnitInfo unitInfo;
  private StepStateMachine stepStateMachine;

  PfcStep(final ProcedureFunctionChart parent, final String name, final String description,
      final UUID id) {
    super(parent, name, description, id);
  }

  @Override
  public PfcElementType getElementType() {
    return PfcElementType.STEP;
  }

  @Override
  public boolean isNullNode() {
    return actions.isEmpty() && leafLevelAction == PfcAction.NO_OP && precondition == null;
  }

  public Map<String, ProcedureFunctionChart> getActions() {
    return Collections.unmodifiableMap(actions);
  }

  /**
   * Adds a named child chart. The child is run in a context nested under the step's own context.
   */
  public void addAction(final String actionName, final ProcedureFunctionChart action)
      throws PfcException {
    getParent().checkUnlocked();
    action.setParentStep(this);
    actions.put(actionName, action);
  }

  public ProcedureFunctionChart removeAction(final String actionName) throws PfcException {
    getParent().checkUnlocked();
    final ProcedureFunctionChart removed = actions.remove(actionName);
    if (removed != null) {
      removed.setParentStep(null);
    }
    return removed;
  }

  void clearActions() {
    for (final ProcedureFunctionChart action : actions.values()) {
      action.setParentStep(null);
    }
    actions.clear();
  }

  public PfcAction getLeafLevelAction() {
    return leafLevelAction;
  }

  public void setLeafLevelAction(final PfcAction leafLevelAction) {
    this.leafLevelAction = leafLevelAction == null ? PfcAction.NO_OP : leafLevelAction;
  }

  public PfcAction getPrecondition() {
    return precondition;
  }

  public void setPrecondition(final PfcAction precondition) {
    this.precondition = precondition;
  }

  /**
   * Installs both hooks of the given actor: its permission check as this step's precondition and
   * its body as the leaf-level action.
   */
  public void setActor(final PfcActor actor) {
    this.precondition = actor::getPermissionToStart;
    this.leafLevelAction = actor::run;
  }

  public PfcUnitInfo getUnitInfo() {
    return unitInfo;
  }

  public void setUnitInfo(final PfcUnitInfo unitInfo) {
    this.unitInfo = unitInfo;
  }

  public StepStateMachine getStepStateMachine() {
    return stepStateMachine;
  }

  public void setStepStateMachine(final StepStateMachine stepStateMachine) throws PfcException {
    if (this.stepStateMachine != null && stepStateMachine != this.stepStateMachine) {
      throw new PfcException(Code.STATE_MACHINE_REPLACEMENT, "Step " + getName()
          + " already has a state machine. This could be due to initializing the execution engine"
          + " on a chart before that chart's construction is complete.");
    }
    this.stepStateMachine = stepStateMachine;
  }

  void clearStepStateMachine() {
    this.stepStateMachine = null;
  }

  /**
   * Blocks the current unit of work until this step may start: first until its earliest start
   * time, then for as long as its precondition takes to return.
   */
  public void getPermissionToStart(final PfcExecutionContext context,
      final StepStateMachine stateMachine) throws PfcException {
    final Executive executive = context.getExecutive();
    if (getEarliestStart() > executive.getNow()) {
      final EventController controller = executive.getCurrentEventController();
      controller.suspendUntil(getEarliestStart());
    }
    if (precondition != null) {
      precondition.run(context, stateMachine);
    }
  }

}
