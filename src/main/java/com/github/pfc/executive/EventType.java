package com.github.pfc.executive;

/**
 * Kind of scheduled event. A synchronous event runs to completion on the dispatching thread; a
 * detachable event runs as a unit of work that may suspend and be resumed later.
 */
public enum EventType {
  SYNCHRONOUS, DETACHABLE;
}
