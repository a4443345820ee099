package com.github.fsmhub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live or snapshotted state of one machine instance: the current and previous state, the typed
 * data bag owned by the instance, the last commit timestamp, a bounded machine-local transition
 * history and the static metadata of the instance.
 * 
 * Notes for users:<br>
 * 1. the live context is only ever mutated by the transition executor while it holds the
 * instance's write lock, so it is not thread-safe by itself<br>
 * 
 * 2. hooks and actions get a mutable context, invoked services and observers get read-only
 * snapshots; writing into a snapshot throws {@link UnsupportedOperationException}<br>
 */
public final class MachineContext<S extends Enum<S>, E extends Enum<E>> {
  private final String machineId;
  private final String version;
  private final Map<String, String> metadata;
  private final BoundedHistory<TransitionRecord<S, E>> transitionHistory;
  private final boolean readOnly;

  private final Map<String, Object> data = new LinkedHashMap<>();
  private S currentState;
  private S previousState;
  private long timestamp;

  MachineContext(final String machineId, final String version, final Map<String, String> metadata,
      final S initialState, final int historyCapacity) {
    this(machineId, version, metadata, new BoundedHistory<>(historyCapacity), false);
    this.currentState = initialState;
    this.timestamp = System.currentTimeMillis();
  }

  private MachineContext(final String machineId, final String version,
      final Map<String, String> metadata,
      final BoundedHistory<TransitionRecord<S, E>> transitionHistory, final boolean readOnly) {
    this.machineId = machineId;
    this.version = version;
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    this.transitionHistory = transitionHistory;
    this.readOnly = readOnly;
  }

  public String getMachineId() {
    return machineId;
  }

  public String getVersion() {
    return version;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public S getCurrentState() {
    return currentState;
  }

  public Optional<S> getPreviousState() {
    return Optional.ofNullable(previousState);
  }

  public long getTimestamp() {
    return timestamp;
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  public <T> Optional<T> get(final ContextKey<T> key) {
    return Optional.ofNullable(key.cast(data.get(key.getName())));
  }

  public <T> T getOrDefault(final ContextKey<T> key, final T defaultValue) {
    final Object value = data.get(key.getName());
    return value == null ? defaultValue : key.cast(value);
  }

  public boolean contains(final ContextKey<?> key) {
    return data.containsKey(key.getName());
  }

  /**
   * Null values are not stored; use {@link #remove(ContextKey)} to clear a key.
   */
  public <T> void put(final ContextKey<T> key, final T value) {
    checkWritable();
    if (value == null) {
      throw new IllegalArgumentException("Null value for " + key.getName()
          + " is not allowed, remove the key instead");
    }
    data.put(key.getName(), key.cast(value));
  }

  public <T> Optional<T> remove(final ContextKey<T> key) {
    checkWritable();
    return Optional.ofNullable(key.cast(data.remove(key.getName())));
  }

  /**
   * Oldest first.
   */
  public List<TransitionRecord<S, E>> getTransitionHistory() {
    return transitionHistory.toList();
  }

  public Map<String, Object> snapshotData() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  /**
   * Point-in-time, read-only copy including a copy of the transition history.
   */
  public MachineContext<S, E> snapshot() {
    final BoundedHistory<TransitionRecord<S, E>> historyCopy =
        new BoundedHistory<>(transitionHistory.capacity());
    historyCopy.addAll(transitionHistory.toList());
    final MachineContext<S, E> snapshot =
        new MachineContext<>(machineId, version, metadata, historyCopy, true);
    snapshot.copyStateFrom(this);
    return snapshot;
  }

  /**
   * Mutable staging copy; it shares the transition history with this context, which it never
   * writes to.
   */
  MachineContext<S, E> copy() {
    final MachineContext<S, E> staged =
        new MachineContext<>(machineId, version, metadata, transitionHistory, false);
    staged.copyStateFrom(this);
    return staged;
  }

  void restoreFrom(final MachineContext<S, E> staged) {
    copyStateFrom(staged);
  }

  void commit(final S nextState, final long commitTimestamp) {
    previousState = currentState;
    currentState = nextState;
    timestamp = commitTimestamp;
  }

  void touch(final long commitTimestamp) {
    timestamp = commitTimestamp;
  }

  void seed(final Map<ContextKey<?>, Object> initialValues) {
    for (final Map.Entry<ContextKey<?>, Object> entry : initialValues.entrySet()) {
      data.put(entry.getKey().getName(), entry.getKey().cast(entry.getValue()));
    }
  }

  void appendRecord(final TransitionRecord<S, E> record) {
    transitionHistory.add(record);
  }

  private void copyStateFrom(final MachineContext<S, E> other) {
    currentState = other.currentState;
    previousState = other.previousState;
    timestamp = other.timestamp;
    data.clear();
    data.putAll(other.data);
  }

  private void checkWritable() {
    if (readOnly) {
      throw new UnsupportedOperationException(
          "Context snapshot of machine " + machineId + " is read-only");
    }
  }

  @Override
  public String toString() {
    return "MachineContext [machineId=" + machineId + ", currentState=" + currentState
        + ", previousState=" + previousState + ", timestamp=" + timestamp + ", data=" + data
        + ", readOnly=" + readOnly + "]";
  }
}
