package com.github.pfc;

import com.github.pfc.execution.PfcExecutionContext;

/**
 * Observer of a chart's run lifecycle. Callbacks arrive synchronously, in registration order.
 */
public interface PfcLifecycleListener {

  default void startRequested(final ProcedureFunctionChart chart,
      final PfcExecutionContext context) {}

  default void starting(final ProcedureFunctionChart chart, final PfcExecutionContext context) {}

  default void completing(final ProcedureFunctionChart chart,
      final PfcExecutionContext context) {}

}
