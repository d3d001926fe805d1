package com.github.pfc.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.pfc.PfcNode;

/**
 * Marks the provenance of a path while a chart is validated. A token starts with one open path;
 * a serial divergence opens one more per extra branch, and a parallel divergence hands each branch
 * a child token of its own. A token counts as open while it has open paths or any open child.
 */
public final class ValidationToken {
  private final String name;
  private final PfcNode origin;
  private final ValidationToken parent;
  private final List<ValidationToken> children = new ArrayList<>();
  private int openAlternatives = 1;

  ValidationToken(final String name, final PfcNode origin, final ValidationToken parent) {
    this.name = name;
    this.origin = origin;
    this.parent = parent;
    if (parent != null) {
      parent.children.add(this);
    }
  }

  public String getName() {
    return name;
  }

  /**
   * The node at which the token was created.
   */
  public PfcNode getOrigin() {
    return origin;
  }

  public ValidationToken getParent() {
    return parent;
  }

  public List<ValidationToken> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public int getGeneration() {
    return parent == null ? 0 : parent.getGeneration() + 1;
  }

  void incrementAlternatePathsOpen() {
    openAlternatives++;
  }

  void decrementAlternatePathsOpen() {
    openAlternatives--;
  }

  public int getAlternatePathsOpen() {
    return openAlternatives + (isAnyChildLive() ? 1 : 0);
  }

  public boolean isAnyChildLive() {
    for (final ValidationToken child : children) {
      if (child.getAlternatePathsOpen() > 0) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return name;
  }

}
