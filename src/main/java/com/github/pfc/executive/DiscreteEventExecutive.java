package com.github.pfc.executive;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.pfc.PfcException;
import com.github.pfc.PfcException.Code;

/**
 * An in-process discrete-event executive.
 *
 * Notes for users:<br>
 * 1. simulated time only moves forward, jumping to the time of the next due event<br>
 *
 * 2. synchronous events run on the thread that called {@link #start()}<br>
 *
 * 3. every detachable event runs as a unit of work on its own daemon thread. Control is handed
 * back and forth through semaphores, so exactly one unit of work (or the dispatcher) runs at any
 * instant and the units never race each other<br>
 *
 * 4. the first exception raised by any event stops dispatching and is rethrown from
 * {@link #start()}. Units still suspended when dispatching ends are interrupted and released<br>
 *
 * @author gaurav
 */
public final class DiscreteEventExecutive implements Executive {
  private static final Logger logger =
      LogManager.getLogger(DiscreteEventExecutive.class.getSimpleName());

  private final static long releaseJoinMillis = 1000L;

  private final String name;
  private final PriorityQueue<ScheduledEvent> calendar = new PriorityQueue<>();
  private final Map<Long, ScheduledEvent> pendingEvents = new HashMap<>();
  private final Set<DetachableUnit> suspendedUnits = ConcurrentHashMap.newKeySet();

  // released by a unit of work whenever it suspends or finishes
  private final Semaphore dispatcherPermit = new Semaphore(0);

  private final AtomicBoolean running = new AtomicBoolean();
  private volatile boolean stopRequested;
  private volatile boolean draining;
  private volatile long now;
  private volatile EventType currentEventType;
  private volatile DetachableUnit currentUnit;
  private volatile PfcException failure;
  private long nextEventId = 1L;
  private long nextSequence;
  private volatile long eventCount;

  public DiscreteEventExecutive(final String name) {
    this(name, 0L);
  }

  public DiscreteEventExecutive(final String name, final long startTime) {
    this.name = name;
    this.now = startTime;
  }

  public String getName() {
    return name;
  }

  private String executiveName() {
    return name;
  }

  @Override
  public long getNow() {
    return now;
  }

  @Override
  public synchronized long requestEvent(final EventReceiver receiver, final long when,
      final double priority, final Object userData, final EventType eventType)
      throws PfcException {
    if (when < now) {
      throw new PfcException(Code.ILLEGAL_EVENT_TIME,
          "Cannot request an event for " + when + ", the time is already " + now + ".");
    }
    final ScheduledEvent event = new ScheduledEvent(nextEventId++, nextSequence++, when, priority,
        receiver, userData, eventType, null);
    calendar.add(event);
    pendingEvents.put(event.id, event);
    return event.id;
  }

  @Override
  public synchronized void unRequestEvent(final long eventId) {
    final ScheduledEvent event = pendingEvents.remove(eventId);
    if (event != null) {
      calendar.remove(event);
    }
  }

  private synchronized void scheduleResumption(final DetachableUnit unit, final long when) {
    calendar.add(new ScheduledEvent(0L, nextSequence++, when, 0.0, null, null,
        EventType.DETACHABLE, unit));
  }

  private synchronized ScheduledEvent nextEvent() {
    final ScheduledEvent event = calendar.poll();
    if (event != null && event.id != 0L) {
      pendingEvents.remove(event.id);
    }
    return event;
  }

  @Override
  public EventType getCurrentEventType() {
    return currentEventType;
  }

  @Override
  public EventController getCurrentEventController() throws PfcException {
    final DetachableUnit unit = currentUnit;
    if (currentEventType != EventType.DETACHABLE || unit == null) {
      throw new PfcException(Code.NOT_DETACHABLE, "Executive " + name
          + " is not servicing a detachable event, so there is nothing to suspend.");
    }
    return unit;
  }

  public long getEventCount() {
    return eventCount;
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Asks the dispatcher to stop once the event being serviced yields.
   */
  public void stop() {
    stopRequested = true;
  }

  /**
   * Services events until the calendar is empty, {@link #stop()} is called, or an event fails.
   */
  public void start() throws PfcException {
    if (!running.compareAndSet(false, true)) {
      throw new PfcException(Code.EXECUTIVE_RUNNING, "Executive " + name + " is already running.");
    }
    stopRequested = false;
    draining = false;
    failure = null;
    logInfo(name, now, "starting");
    try {
      ScheduledEvent event;
      while (!stopRequested && failure == null && (event = nextEvent()) != null) {
        now = event.when;
        eventCount++;
        dispatch(event);
      }
    } finally {
      currentEventType = null;
      currentUnit = null;
      releaseSuspendedUnits();
      running.set(false);
    }
    final PfcException thrown = failure;
    if (thrown != null) {
      failure = null;
      throw thrown;
    }
    logInfo(name, now, "stopped after " + eventCount + " events");
  }

  private void dispatch(final ScheduledEvent event) throws PfcException {
    if (event.resumedUnit != null) {
      final DetachableUnit unit = event.resumedUnit;
      if (!unit.isWaiting()) {
        logWarning(name, now, "dropping resumption of " + unit.getName() + ", it is not suspended");
        return;
      }
      logDebug(name, now, "resuming " + unit.getName());
      currentEventType = EventType.DETACHABLE;
      currentUnit = unit;
      unit.proceed();
      awaitDispatcherPermit();
    } else if (event.eventType == EventType.SYNCHRONOUS) {
      logDebug(name, now, "servicing synchronous event " + event.id);
      currentEventType = EventType.SYNCHRONOUS;
      currentUnit = null;
      try {
        event.receiver.receive(this, event.userData);
      } catch (PfcException exception) {
        recordFailure(exception);
      } catch (RuntimeException exception) {
        recordFailure(new PfcException(Code.UNKNOWN_FAILURE, exception));
      }
    } else {
      logDebug(name, now, "launching detachable event " + event.id);
      final DetachableUnit unit = new DetachableUnit(event);
      currentEventType = EventType.DETACHABLE;
      currentUnit = unit;
      unit.start();
      awaitDispatcherPermit();
    }
    currentEventType = null;
    currentUnit = null;
  }

  private void awaitDispatcherPermit() throws PfcException {
    try {
      dispatcherPermit.acquire();
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new PfcException(Code.INTERRUPTED,
          "Executive " + name + " was interrupted while a unit of work was running.", exception);
    }
  }

  private void recordFailure(final PfcException exception) {
    if (draining) {
      logWarning(name, now, "unit of work ended while being released: " + exception.getMessage());
      return;
    }
    if (failure == null) {
      failure = exception;
    }
    logError(name, now, "event failed, stopping", exception);
  }

  private void releaseSuspendedUnits() {
    draining = true;
    final List<DetachableUnit> units = new ArrayList<>(suspendedUnits);
    if (!units.isEmpty()) {
      logInfo(name, now, "releasing " + units.size() + " suspended units of work");
    }
    for (final DetachableUnit unit : units) {
      unit.thread.interrupt();
    }
    for (final DetachableUnit unit : units) {
      try {
        unit.thread.join(releaseJoinMillis);
      } catch (InterruptedException exception) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    dispatcherPermit.drainPermits();
  }

  /**
   * A detachable event's unit of work and its controller.
   */
  private final class DetachableUnit implements Runnable, EventController {
    private final ScheduledEvent origin;
    private final Thread thread;
    private final Semaphore runPermit = new Semaphore(0);
    private volatile boolean waiting;
    private volatile boolean resumptionPending;

    private DetachableUnit(final ScheduledEvent origin) {
      this.origin = origin;
      this.thread = new Thread(this, executiveName() + "-unit-" + origin.id);
      thread.setDaemon(true);
    }

    private String getName() {
      return thread.getName();
    }

    private void start() {
      thread.start();
    }

    @Override
    public void run() {
      try {
        origin.receiver.receive(DiscreteEventExecutive.this, origin.userData);
      } catch (PfcException exception) {
        recordFailure(exception);
      } catch (RuntimeException exception) {
        recordFailure(new PfcException(Code.UNKNOWN_FAILURE, exception));
      } finally {
        dispatcherPermit.release();
      }
    }

    private void proceed() {
      resumptionPending = false;
      runPermit.release();
    }

    @Override
    public void suspend() throws PfcException {
      if (Thread.currentThread() != thread) {
        throw new PfcException(Code.NOT_DETACHABLE,
            "Only the unit of work " + getName() + " can suspend itself.");
      }
      waiting = true;
      suspendedUnits.add(this);
      dispatcherPermit.release();
      try {
        runPermit.acquire();
      } catch (InterruptedException exception) {
        Thread.currentThread().interrupt();
        throw new PfcException(Code.INTERRUPTED,
            "Unit of work " + getName() + " was released while suspended.", exception);
      } finally {
        waiting = false;
        suspendedUnits.remove(this);
      }
    }

    @Override
    public void suspendUntil(final long when) throws PfcException {
      if (Thread.currentThread() != thread) {
        throw new PfcException(Code.NOT_DETACHABLE,
            "Only the unit of work " + getName() + " can suspend itself.");
      }
      if (when < now) {
        throw new PfcException(Code.ILLEGAL_EVENT_TIME,
            "Cannot suspend until " + when + ", the time is already " + now + ".");
      }
      resumptionPending = true;
      scheduleResumption(this, when);
      suspend();
    }

    @Override
    public void resume() {
      if (!waiting || resumptionPending) {
        logDebug(executiveName(), now, "ignoring resume of " + getName() + ", waiting:" + waiting
            + ", resumption pending:" + resumptionPending);
        return;
      }
      resumptionPending = true;
      scheduleResumption(this, now);
    }

    @Override
    public boolean isWaiting() {
      return waiting;
    }
  }

  private static final class ScheduledEvent implements Comparable<ScheduledEvent> {
    private final long id;
    private final long sequence;
    private final long when;
    private final double priority;
    private final EventReceiver receiver;
    private final Object userData;
    private final EventType eventType;
    private final DetachableUnit resumedUnit;

    private ScheduledEvent(final long id, final long sequence, final long when,
        final double priority, final EventReceiver receiver, final Object userData,
        final EventType eventType, final DetachableUnit resumedUnit) {
      this.id = id;
      this.sequence = sequence;
      this.when = when;
      this.priority = priority;
      this.receiver = receiver;
      this.userData = userData;
      this.eventType = eventType;
      this.resumedUnit = resumedUnit;
    }

    @Override
    public int compareTo(final ScheduledEvent other) {
      int result = Long.compare(when, other.when);
      if (result == 0) {
        result = Double.compare(other.priority, priority);
      }
      if (result == 0) {
        result = Long.compare(sequence, other.sequence);
      }
      return result;
    }
  }

  private static void logError(final String executiveName, final long time, final String message,
      final Throwable problem) {
    logger.error(new StringBuilder().append("[e:").append(executiveName).append("][t:")
        .append(time).append("] ").append(message), problem);
  }

  private static void logWarning(final String executiveName, final long time,
      final String message) {
    logger.warn(new StringBuilder().append("[e:").append(executiveName).append("][t:")
        .append(time).append("] ").append(message));
  }

  private static void logInfo(final String executiveName, final long time, final String message) {
    logger.info(new StringBuilder().append("[e:").append(executiveName).append("][t:")
        .append(time).append("] ").append(message));
  }

  private static void logDebug(final String executiveName, final long time,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[e:").append(executiveName).append("][t:")
          .append(time).append("] ").append(message));
    }
  }

}
