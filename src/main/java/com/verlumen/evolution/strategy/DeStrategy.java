package com.verlumen.evolution.strategy;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.verlumen.evolution.ConfigurationException;
import java.util.List;

/**
 * A differential-evolution recipe, named {@code DE/<base>/<differences>/<crossover>}, for example
 * {@code DE/rand-to-best/1/exp}. Ten combinations exist; {@code rand-to-best} only supports one
 * difference vector.
 */
@AutoValue
public abstract class DeStrategy {
  private static final String PREFIX = "DE";

  public abstract BaseVector baseVector();

  public abstract DifferenceArity arity();

  public abstract CrossoverScheme crossover();

  public static DeStrategy of(BaseVector base, DifferenceArity arity, CrossoverScheme crossover) {
    if (base == BaseVector.RAND_TO_BEST && arity != DifferenceArity.ONE) {
      throw new ConfigurationException(
          "Strategy rand-to-best supports a single difference vector only");
    }
    return new AutoValue_DeStrategy(base, arity, crossover);
  }

  /** Parses a canonical strategy name such as {@code DE/best/2/bin}. */
  public static DeStrategy parse(String name) {
    List<String> parts = Splitter.on('/').trimResults().splitToList(name);
    if (parts.size() != 4 || !parts.get(0).equals(PREFIX)) {
      throw new ConfigurationException("Malformed strategy name: " + name);
    }
    try {
      return of(
          BaseVector.fromLabel(parts.get(1)),
          DifferenceArity.fromCount(Integer.parseInt(parts.get(2))),
          CrossoverScheme.fromLabel(parts.get(3)));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown strategy: " + name, e);
    }
  }

  /** All supported strategies, exponential variants first. */
  public static ImmutableList<DeStrategy> all() {
    ImmutableList.Builder<DeStrategy> strategies = ImmutableList.builder();
    for (CrossoverScheme crossover : CrossoverScheme.values()) {
      strategies.add(of(BaseVector.BEST, DifferenceArity.ONE, crossover));
      strategies.add(of(BaseVector.RAND, DifferenceArity.ONE, crossover));
      strategies.add(of(BaseVector.RAND_TO_BEST, DifferenceArity.ONE, crossover));
      strategies.add(of(BaseVector.BEST, DifferenceArity.TWO, crossover));
      strategies.add(of(BaseVector.RAND, DifferenceArity.TWO, crossover));
    }
    return strategies.build();
  }

  public String name() {
    return String.join(
        "/",
        PREFIX,
        baseVector().label(),
        Integer.toString(arity().count()),
        crossover().label());
  }

  MutationRule mutationRule() {
    return MutationRule.forVariant(baseVector(), arity());
  }

  @Override
  public final String toString() {
    return name();
  }
}
