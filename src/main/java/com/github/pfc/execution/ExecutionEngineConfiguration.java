package com.github.pfc.execution;

import java.util.concurrent.TimeUnit;

import com.github.pfc.PfcException;

/**
 * This class encapsulates the configuration of an {@link ExecutionEngine}. Use the
 * {@code ExecutionEngineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. If the scanning period is not set, active transitions re-evaluate their conditions once a
 * minute of simulated time.<br>
 * 2. By default, building an engine locks the chart's structure until the engine is discarded.<br>
 *
 * @author gaurav
 */
public final class ExecutionEngineConfiguration {
  private static final long defaultScanningPeriodMillis = TimeUnit.MINUTES.toMillis(1L);
  private static final long maxScanningPeriodMillis = Long.MAX_VALUE / 4;

  private final long scanningPeriodMillis;
  private final boolean structureLockedDuringRun;

  public long getScanningPeriodMillis() {
    return scanningPeriodMillis;
  }

  public boolean isStructureLockedDuringRun() {
    return structureLockedDuringRun;
  }

  /**
   * The configuration used by charts that were not given one.
   */
  public static ExecutionEngineConfiguration defaults() {
    return new ExecutionEngineConfiguration(0L, true);
  }

  public final static class ExecutionEngineConfigurationBuilder {
    private long scanningPeriodMillis;
    private boolean structureLockedDuringRun = true;

    public static ExecutionEngineConfigurationBuilder newBuilder() {
      return new ExecutionEngineConfigurationBuilder();
    }

    public ExecutionEngineConfigurationBuilder scanningPeriodMillis(
        final long scanningPeriodMillis) {
      this.scanningPeriodMillis = scanningPeriodMillis;
      return this;
    }

    public ExecutionEngineConfigurationBuilder scanningPeriod(final long period,
        final TimeUnit unit) {
      this.scanningPeriodMillis = unit.toMillis(period);
      return this;
    }

    public ExecutionEngineConfigurationBuilder structureLockedDuringRun(
        final boolean structureLockedDuringRun) {
      this.structureLockedDuringRun = structureLockedDuringRun;
      return this;
    }

    public ExecutionEngineConfiguration build() throws PfcException {
      final ExecutionEngineConfiguration config =
          new ExecutionEngineConfiguration(scanningPeriodMillis, structureLockedDuringRun);
      config.validate();
      return config;
    }

    private ExecutionEngineConfigurationBuilder() {}
  }

  private void validate() throws PfcException {
    StringBuilder messages = new StringBuilder();
    if (scanningPeriodMillis > maxScanningPeriodMillis) {
      messages.append("Scanning period of ").append(scanningPeriodMillis)
          .append(" millis would overflow simulated time. ");
    }
    if (messages.length() > 0) {
      throw new PfcException(PfcException.Code.INVALID_ENGINE_CONFIG, messages.toString());
    }
  }

  @Override
  public String toString() {
    return "ExecutionEngineConfiguration [scanningPeriodMillis=" + scanningPeriodMillis
        + ", structureLockedDuringRun=" + structureLockedDuringRun + "]";
  }

  private ExecutionEngineConfiguration(final long scanningPeriodMillis,
      final boolean structureLockedDuringRun) {
    this.structureLockedDuringRun = structureLockedDuringRun;
    if (scanningPeriodMillis <= 0L) {
      this.scanningPeriodMillis = defaultScanningPeriodMillis;
    } else {
      this.scanningPeriodMillis = scanningPeriodMillis;
    }
  }

}
