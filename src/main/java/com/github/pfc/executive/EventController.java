package com.github.pfc.executive;

import com.github.pfc.PfcException;

/**
 * Handle on the unit of work running a detachable event. Only the unit itself may suspend; anyone
 * may resume it.
 */
public interface EventController {

  /**
   * Parks the calling unit of work until someone calls {@link #resume()}.
   */
  void suspend() throws PfcException;

  /**
   * Parks the calling unit of work until the given simulated time.
   */
  void suspendUntil(long when) throws PfcException;

  /**
   * Schedules the suspended unit of work to continue at the current simulated time. Has no effect
   * on a unit that is not suspended or already has a pending resumption.
   */
  void resume();

  boolean isWaiting();
}
