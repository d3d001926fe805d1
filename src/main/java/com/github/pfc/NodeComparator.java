package com.github.pfc;

import java.util.Comparator;

/**
 * Orders nodes by graph ordinal, falling back to id.
 */
public final class NodeComparator implements Comparator<PfcNode> {
  public static final NodeComparator INSTANCE = new NodeComparator();

  @Override
  public int compare(final PfcNode first, final PfcNode second) {
    final int result = Integer.compare(first.getGraphOrdinal(), second.getGraphOrdinal());
    return result != 0 ? result : first.getId().compareTo(second.getId());
  }

}
