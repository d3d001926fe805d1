package com.github.pfc;

import java.util.UUID;

/**
 * Supplies default names and ids for the elements of one chart. Default names use a per-kind
 * counter ({@code S_000}, {@code T_000}, {@code L_000}) and skip names already in use. Ids are
 * random unless the factory has been made repeatable, in which case they count up from a seed.
 */
public final class PfcElementFactory {
  private final ProcedureFunctionChart chart;
  private int stepCount;
  private int transitionCount;
  private int linkCount;
  private UUID nextRepeatableId;

  PfcElementFactory(final ProcedureFunctionChart chart) {
    this.chart = chart;
  }

  /**
   * Makes id generation deterministic, starting at the given seed.
   */
  public void setRepeatable(final UUID seed) {
    this.nextRepeatableId = seed;
  }

  public UUID nextId() {
    if (nextRepeatableId == null) {
      return UUID.randomUUID();
    }
    final UUID id = nextRepeatableId;
    nextRepeatableId =
        new UUID(id.getMostSignificantBits(), id.getLeastSignificantBits() + 1L);
    return id;
  }

  public String nextStepName() {
    String name;
    do {
      name = String.format("S_%03d", stepCount++);
    } while (chart.isNameInUse(name));
    return name;
  }

  public String nextTransitionName() {
    String name;
    do {
      name = String.format("T_%03d", transitionCount++);
    } while (chart.isNameInUse(name));
    return name;
  }

  public String nextLinkName() {
    String name;
    do {
      name = String.format("L_%03d", linkCount++);
    } while (chart.isNameInUse(name));
    return name;
  }

  /**
   * Captures the naming counters so that a tentative edit can later give its names back.
   */
  public Mark mark() {
    return new Mark(stepCount, transitionCount, linkCount);
  }

  public void retract(final Mark mark) {
    stepCount = mark.stepCount;
    transitionCount = mark.transitionCount;
    linkCount = mark.linkCount;
  }

  void copyCountersFrom(final PfcElementFactory other) {
    stepCount = other.stepCount;
    transitionCount = other.transitionCount;
    linkCount = other.linkCount;
  }

  public static final class Mark {
    private final int stepCount;
    private final int transitionCount;
    private final int linkCount;

    private Mark(final int stepCount, final int transitionCount, final int linkCount) {
      this.stepCount = stepCount;
      this.transitionCount = transitionCount;
      this.linkCount = linkCount;
    }
  }

}
