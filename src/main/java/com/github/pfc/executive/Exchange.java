package com.github.pfc.executive;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.github.pfc.PfcException;

/**
 * Rendezvous point between units of work. Values are posted under a key; a unit that takes or
 * reads a key that has not been posted yet can suspend until it is.
 */
public final class Exchange {
  private final Executive executive;
  private final Map<Object, Object> posted = new HashMap<>();
  private final Map<Object, List<EventController>> waiters = new HashMap<>();

  public Exchange(final Executive executive) {
    this.executive = executive;
  }

  /**
   * Posts a value and resumes every unit waiting for its key.
   */
  public synchronized void post(final Object key, final Object value) {
    posted.put(key, value);
    final List<EventController> waiting = waiters.remove(key);
    if (waiting != null) {
      for (final EventController controller : waiting) {
        controller.resume();
      }
    }
  }

  /**
   * Removes and returns the value posted under the key. With {@code blockIfAbsent} the calling
   * detachable unit suspends until the key is posted; otherwise null is returned.
   */
  public Object take(final Object key, final boolean blockIfAbsent) throws PfcException {
    return obtain(key, blockIfAbsent, true);
  }

  /**
   * Like {@link #take(Object, boolean)} but leaves the value in place.
   */
  public Object read(final Object key, final boolean blockIfAbsent) throws PfcException {
    return obtain(key, blockIfAbsent, false);
  }

  public synchronized boolean contains(final Object key) {
    return posted.containsKey(key);
  }

  private Object obtain(final Object key, final boolean blockIfAbsent, final boolean remove)
      throws PfcException {
    while (true) {
      final EventController controller;
      synchronized (this) {
        if (posted.containsKey(key)) {
          return remove ? posted.remove(key) : posted.get(key);
        }
        if (!blockIfAbsent) {
          return null;
        }
        controller = executive.getCurrentEventController();
        waiters.computeIfAbsent(key, k -> new ArrayList<>()).add(controller);
      }
      controller.suspend();
    }
  }

}
