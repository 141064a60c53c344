package com.verlumen.evolution.population;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.evolution.ComparisonException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A candidate solution together with its fitness and auxiliary responses.
 *
 * <p>Individuals compare by fitness, respecting {@link #maximize()}: "greater" always means
 * "better". Under maximization a fitness of 4 beats 2; under minimization 2 beats 4. Ranking an
 * individual without a fitness throws {@link ComparisonException}.
 *
 * <p>Individuals are immutable. {@link #withCandidate} yields a new, unevaluated individual.
 *
 * <p>Note: {@link #compareTo} is not consistent with {@link #equals}; two different candidates with
 * the same fitness compare as equal.
 */
public final class Individual implements Comparable<Individual> {
  private final ImmutableList<Double> candidate;
  private final OptionalDouble fitness;
  private final ImmutableMap<String, Double> responses;
  private final boolean maximize;
  private final Instant birthdate;

  private Individual(
      List<Double> candidate,
      OptionalDouble fitness,
      Map<String, Double> responses,
      boolean maximize) {
    this.candidate = ImmutableList.copyOf(checkNotNull(candidate, "Candidate cannot be null"));
    this.fitness = fitness;
    this.responses = ImmutableMap.copyOf(checkNotNull(responses, "Responses cannot be null"));
    this.maximize = maximize;
    this.birthdate = Instant.now();
  }

  /** Creates an individual that has not been evaluated yet. */
  public static Individual create(List<Double> candidate, boolean maximize) {
    return new Individual(candidate, OptionalDouble.empty(), ImmutableMap.of(), maximize);
  }

  /** Creates an already evaluated individual. */
  public static Individual evaluated(
      List<Double> candidate, boolean maximize, double fitness, Map<String, Double> responses) {
    return new Individual(candidate, OptionalDouble.of(fitness), responses, maximize);
  }

  public ImmutableList<Double> candidate() {
    return candidate;
  }

  /** Returns an unevaluated individual holding {@code candidate} with the same direction. */
  public Individual withCandidate(List<Double> candidate) {
    return create(candidate, maximize);
  }

  public OptionalDouble fitness() {
    return fitness;
  }

  public boolean hasFitness() {
    return fitness.isPresent();
  }

  public ImmutableMap<String, Double> responses() {
    return responses;
  }

  public boolean maximize() {
    return maximize;
  }

  public Instant birthdate() {
    return birthdate;
  }

  /** Returns the fitness, failing if this individual was never evaluated. */
  public double requireFitness() {
    if (!fitness.isPresent()) {
      throw new ComparisonException("Fitness cannot be unset when comparing individuals: " + this);
    }
    return fitness.getAsDouble();
  }

  public boolean isBetterThan(Individual other) {
    return compareTo(other) > 0;
  }

  public boolean isWorseThan(Individual other) {
    return compareTo(other) < 0;
  }

  /** Negative when this individual is worse than {@code other}, positive when better. */
  @Override
  public int compareTo(Individual other) {
    double mine = requireFitness();
    double theirs = other.requireFitness();
    return maximize ? Double.compare(mine, theirs) : Double.compare(theirs, mine);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Individual)) {
      return false;
    }
    Individual that = (Individual) o;
    return maximize == that.maximize
        && candidate.equals(that.candidate)
        && fitness.equals(that.fitness);
  }

  @Override
  public int hashCode() {
    return Objects.hash(candidate, fitness, maximize);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("candidate", candidate)
        .add("fitness", fitness.isPresent() ? fitness.getAsDouble() : null)
        .add("responses", responses)
        .toString();
  }
}
