package com.github.pfc.executive;

import com.github.pfc.PfcException;

/**
 * Callback serviced when a requested event comes due.
 */
@FunctionalInterface
public interface EventReceiver {
  void receive(Executive executive, Object userData) throws PfcException;
}
