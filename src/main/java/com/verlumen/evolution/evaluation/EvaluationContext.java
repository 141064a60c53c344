package com.verlumen.evolution.evaluation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.Map;
import java.util.Optional;

/**
 * Named options forwarded to every objective call. Every value is serializable, so a context can
 * always be handed to a worker.
 */
public final class EvaluationContext {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final EvaluationContext EMPTY = new EvaluationContext(ImmutableMap.of());

  private final ImmutableMap<String, Serializable> values;

  private EvaluationContext(ImmutableMap<String, Serializable> values) {
    this.values = values;
  }

  public static EvaluationContext empty() {
    return EMPTY;
  }

  public static EvaluationContext of(Map<String, ? extends Serializable> values) {
    Builder builder = builder();
    values.forEach(builder::put);
    return builder.build();
  }

  /**
   * Copies the transferable entries of an open-ended option map. Entries that cannot be serialized
   * are dropped and logged instead of failing the run.
   */
  public static EvaluationContext transferableView(Map<String, ?> options) {
    Builder builder = builder();
    options.forEach(
        (key, value) -> {
          if (isTransferable(value)) {
            builder.put(key, value);
          } else {
            logger.atFine().log("Unable to transfer option %s to evaluation workers", key);
          }
        });
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<Serializable> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  public double getDouble(String key, double defaultValue) {
    Serializable value = values.get(key);
    return value instanceof Number ? ((Number) value).doubleValue() : defaultValue;
  }

  public ImmutableMap<String, Serializable> asMap() {
    return values;
  }

  static boolean isTransferable(Object value) {
    if (!(value instanceof Serializable)) {
      return false;
    }
    try (ObjectOutputStream out = new ObjectOutputStream(ByteStreams.nullOutputStream())) {
      out.writeObject(value);
      return true;
    } catch (IOException e) {
      return false;
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EvaluationContext && values.equals(((EvaluationContext) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "EvaluationContext" + values;
  }

  /** Collects options, rejecting any value that cannot be transferred to a worker. */
  public static final class Builder {
    private final ImmutableMap.Builder<String, Serializable> values = ImmutableMap.builder();

    private Builder() {}

    public Builder put(String key, Object value) {
      checkNotNull(key, "Key cannot be null");
      checkArgument(isTransferable(value), "Option %s is not serializable: %s", key, value);
      values.put(key, (Serializable) value);
      return this;
    }

    public EvaluationContext build() {
      ImmutableMap<String, Serializable> built = values.buildOrThrow();
      return built.isEmpty() ? EMPTY : new EvaluationContext(built);
    }
  }
}
