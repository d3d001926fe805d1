package com.github.pfc.executive;

import com.github.pfc.PfcException;

/**
 * The scheduler the execution engine runs on: simulated time plus a calendar of requested events.
 */
public interface Executive {

  /**
   * Current simulated time in milliseconds.
   */
  long getNow();

  /**
   * Schedules an event. Among events due at the same time, higher priority is serviced first and
   * equal priorities are serviced in request order.
   *
   * @return the event's id, usable with {@link #unRequestEvent(long)}
   */
  long requestEvent(EventReceiver receiver, long when, double priority, Object userData,
      EventType eventType) throws PfcException;

  void unRequestEvent(long eventId);

  /**
   * Kind of the event being serviced, or null between events.
   */
  EventType getCurrentEventType();

  /**
   * Controller of the detachable event being serviced.
   *
   * @throws PfcException with {@code NOT_DETACHABLE} if the current event is not detachable
   */
  EventController getCurrentEventController() throws PfcException;
}
