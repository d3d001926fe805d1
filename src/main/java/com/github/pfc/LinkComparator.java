package com.github.pfc;

import java.util.Comparator;

/**
 * Orders links by descending priority, then by successor name, then by id.
 */
public final class LinkComparator implements Comparator<PfcLink> {
  public static final LinkComparator INSTANCE = new LinkComparator();

  @Override
  public int compare(final PfcLink first, final PfcLink second) {
    int result = Integer.compare(second.getPriority(), first.getPriority());
    if (result != 0) {
      return result;
    }
    result = compareNames(first.getSuccessor(), second.getSuccessor());
    if (result != 0) {
      return result;
    }
    return first.getId().compareTo(second.getId());
  }

  private static int compareNames(final PfcNode first, final PfcNode second) {
    if (first == null || second == null) {
      return first == null ? (second == null ? 0 : -1) : 1;
    }
    return first.getName().compareTo(second.getName());
  }

}
