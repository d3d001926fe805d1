package com.github.pfc.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.github.pfc.PfcStep;
import com.github.pfc.ProcedureFunctionChart;
import com.github.pfc.executive.Executive;

/**
 * One concrete run of a chart, or of one step within a run. Contexts form a tree: a chart run's
 * context holds the contexts of its step instances, and a step instance's context holds the
 * contexts of its child chart runs. Each context is also a key/value store in which the state
 * machines keep their per-run data, keyed by the machine itself.
 */
public class PfcExecutionContext {
  private final UUID id = UUID.randomUUID();
  private final String name;
  private final ProcedureFunctionChart chart;
  private final PfcStep step;
  private final PfcExecutionContext parent;
  private final Executive executive;
  private final Object userData;

  private final ConcurrentMap<Object, Object> entries = new ConcurrentHashMap<>();
  private final List<PfcExecutionContext> children = new CopyOnWriteArrayList<>();
  private final List<EntryListener> entryListeners = new CopyOnWriteArrayList<>();
  private volatile int instanceCount;
  private volatile long startTime = Long.MIN_VALUE;
  private volatile long endTime = Long.MIN_VALUE;

  /**
   * Root context of a top-level chart run.
   */
  public PfcExecutionContext(final ProcedureFunctionChart chart, final String name,
      final Executive executive, final Object userData) {
    this(chart, null, name, null, executive, userData);
  }

  /**
   * Context of a child chart run, nested under the context of the step that owns the chart.
   */
  public PfcExecutionContext(final ProcedureFunctionChart chart, final String name,
      final PfcExecutionContext parent) {
    this(chart, null, name, parent, parent.getExecutive(), null);
  }

  /**
   * Context of one instance of a step, nested under the context of the chart run.
   */
  public PfcExecutionContext(final PfcStep step, final String name,
      final PfcExecutionContext parent) {
    this(step.getParent(), step, name, parent, parent.getExecutive(), null);
  }

  private PfcExecutionContext(final ProcedureFunctionChart chart, final PfcStep step,
      final String name, final PfcExecutionContext parent, final Executive executive,
      final Object userData) {
    this.chart = chart;
    this.step = step;
    this.name = name;
    this.parent = parent;
    this.executive = executive;
    this.userData = userData;
    if (parent != null) {
      parent.children.add(this);
    }
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public ProcedureFunctionChart getChart() {
    return chart;
  }

  /**
   * The step this context is an instance of, or null for a chart-level context.
   */
  public PfcStep getStep() {
    return step;
  }

  public boolean isStepCentric() {
    return step != null;
  }

  public PfcExecutionContext getParent() {
    return parent;
  }

  public PfcExecutionContext getRoot() {
    PfcExecutionContext root = this;
    while (root.parent != null) {
      root = root.parent;
    }
    return root;
  }

  public List<PfcExecutionContext> getChildren() {
    return Collections.unmodifiableList(new ArrayList<>(children));
  }

  public Executive getExecutive() {
    return executive;
  }

  /**
   * The payload given to the run, looked up from the root when this context has none of its own.
   */
  public Object getUserData() {
    if (userData == null && parent != null) {
      return parent.getUserData();
    }
    return userData;
  }

  public Object get(final Object key) {
    return entries.get(key);
  }

  public boolean containsKey(final Object key) {
    return entries.containsKey(key);
  }

  public Set<Object> keySet() {
    return Collections.unmodifiableSet(entries.keySet());
  }

  /**
   * Stores a value. Entry listeners hear about keys that were not present before.
   */
  public Object put(final Object key, final Object value) {
    final Object previous = entries.put(key, value);
    if (previous == null) {
      for (final EntryListener listener : entryListeners) {
        listener.entryAdded(this, key, value);
      }
    }
    return previous;
  }

  public Object remove(final Object key) {
    return entries.remove(key);
  }

  public void addEntryListener(final EntryListener listener) {
    entryListeners.add(listener);
  }

  public void removeEntryListener(final EntryListener listener) {
    entryListeners.remove(listener);
  }

  public int getInstanceCount() {
    return instanceCount;
  }

  void setInstanceCount(final int instanceCount) {
    this.instanceCount = instanceCount;
  }

  /**
   * Simulated time the run started, or {@link Long#MIN_VALUE} if it has not.
   */
  public long getStartTime() {
    return startTime;
  }

  public void setStartTime(final long startTime) {
    this.startTime = startTime;
  }

  public long getEndTime() {
    return endTime;
  }

  public void setEndTime(final long endTime) {
    this.endTime = endTime;
  }

  @Override
  public String toString() {
    return "PfcExecutionContext [name=" + name + ", chart=" + chart.getName()
        + (step == null ? "" : ", step=" + step.getName()) + "]";
  }

  /**
   * Observer of keys being added to a context.
   */
  @FunctionalInterface
  public interface EntryListener {
    void entryAdded(PfcExecutionContext context, Object key, Object value);
  }

}
