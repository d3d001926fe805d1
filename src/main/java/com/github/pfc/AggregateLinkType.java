package com.github.pfc;

/**
 * How a link participates in the structure around it, judged from the number of paths leaving its
 * predecessor and entering its successor.
 */
public enum AggregateLinkType {
  UNKNOWN, SIMPLE, PARALLEL_CONVERGENT, SERIES_CONVERGENT, PARALLEL_DIVERGENT, SERIES_DIVERGENT;
}
