package com.github.pfc;

import java.util.UUID;

/**
 * Common base of steps, transitions and links. Every element belongs to exactly one chart and is
 * identified within it by its id. Names are human-facing. Names given at creation are taken as
 * they are, but {@link #setName(String)} refuses a name that another element of the same chart
 * already holds.
 * 
 * @author gaurav
 */
public abstract class PfcElement {
  private final ProcedureFunctionChart parent;
  private final UUID id;
  private UUID sourceId;
  private String name;
  private String description;
  private Object userData;

  PfcElement(final ProcedureFunctionChart parent, final String name, final String description,
      final UUID id) {
    this.parent = parent;
    this.name = name;
    this.description = description;
    this.id = id;
    this.sourceId = id;
  }

  public abstract PfcElementType getElementType();

  public ProcedureFunctionChart getParent() {
    return parent;
  }

  public UUID getId() {
    return id;
  }

  /**
   * Id of the element this one was copied from, or this element's own id if it is not a copy.
   */
  public UUID getSourceId() {
    return sourceId;
  }

  void setSourceId(final UUID sourceId) {
    this.sourceId = sourceId;
  }

  public String getName() {
    return name;
  }

  /**
   * Renames this element, refusing a name already carried by another element of the same chart.
   */
  public void setName(final String name) throws PfcException {
    parent.renameElement(this, name);
  }

  void assignName(final String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(final String description) {
    this.description = description;
  }

  public Object getUserData() {
    return userData;
  }

  public void setUserData(final Object userData) {
    this.userData = userData;
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof PfcElement)) {
      return false;
    }
    final PfcElement other = (PfcElement) obj;
    return id.equals(other.id) && parent == other.parent;
  }

  @Override
  public String toString() {
    return name;
  }

}
