package com.github.fsmhub;

import java.util.Objects;

/**
 * Typed handle into the data bag of a {@link MachineContext}. Two keys are equal when their names
 * are equal; the type is carried along so reads come back without casts at the call site.
 */
public final class ContextKey<T> {
  private final String name;
  private final Class<T> type;

  private ContextKey(final String name, final Class<T> type) {
    this.name = name;
    this.type = type;
  }

  public static <T> ContextKey<T> of(final String name, final Class<T> type) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("ContextKey name cannot be null or blank");
    }
    if (type == null) {
      throw new IllegalArgumentException("ContextKey type cannot be null");
    }
    return new ContextKey<>(name.trim(), type);
  }

  public String getName() {
    return name;
  }

  public Class<T> getType() {
    return type;
  }

  T cast(final Object value) {
    return type.cast(value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ContextKey)) {
      return false;
    }
    return name.equals(((ContextKey<?>) obj).name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return "ContextKey [name=" + name + ", type=" + type.getSimpleName() + "]";
  }
}
