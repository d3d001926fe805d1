package com.github.pfc;

/**
 * Association of a step with the equipment unit that performs it.
 */
public final class PfcUnitInfo {
  private final String name;
  private final int sequenceNumber;

  public PfcUnitInfo(final String name) {
    this(name, -1);
  }

  public PfcUnitInfo(final String name, final int sequenceNumber) {
    this.name = name;
    this.sequenceNumber = sequenceNumber;
  }

  public String getName() {
    return name;
  }

  public int getSequenceNumber() {
    return sequenceNumber;
  }

  @Override
  public String toString() {
    return "PfcUnitInfo [name=" + name + ", sequenceNumber=" + sequenceNumber + "]";
  }

}
