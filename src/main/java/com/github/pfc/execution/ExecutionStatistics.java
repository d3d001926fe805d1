package com.github.pfc.execution;

/**
 * Counters kept by an execution engine across all runs of its chart.
 */
public final class ExecutionStatistics {
  private final String chartName;

  ExecutionStatistics(final String chartName) {
    this.chartName = chartName;
  }

  private final long startTstampMillis = System.currentTimeMillis();
  volatile int totalStepStarts;
  volatile int totalStepCompletions;
  volatile int totalTransitionFirings;
  volatile int totalConditionScans;
  volatile int totalChartCompletions;

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public String getChartName() {
    return chartName;
  }

  public int getTotalStepStarts() {
    return totalStepStarts;
  }

  public int getTotalStepCompletions() {
    return totalStepCompletions;
  }

  public int getTotalTransitionFirings() {
    return totalTransitionFirings;
  }

  public int getTotalConditionScans() {
    return totalConditionScans;
  }

  public int getTotalChartCompletions() {
    return totalChartCompletions;
  }

  @Override
  public String toString() {
    return "ExecutionStatistics [chartName=" + chartName + ", startTstampMillis="
        + startTstampMillis + ", totalStepStarts=" + totalStepStarts + ", totalStepCompletions="
        + totalStepCompletions + ", totalTransitionFirings=" + totalTransitionFirings
        + ", totalConditionScans=" + totalConditionScans + ", totalChartCompletions="
        + totalChartCompletions + "]";
  }

}
