package com.verlumen.evolution.evaluation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.verlumen.evolution.EvolutionExit;
import com.verlumen.evolution.WorkerPoolException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Evaluates a batch on a fixed-size worker pool, one task per candidate.
 *
 * <p>Results are collected in submission order, so they line up with the input no matter which
 * task finishes first. A failing objective call yields an undefined fitness for that candidate
 * only. A failure of the pool itself aborts the batch with {@link WorkerPoolException}. Tasks are
 * never retried and have no timeout: one hung evaluation blocks the whole batch.
 */
public final class ParallelEvaluator implements Evaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final ObjectiveFunction objective;
  private final ExecutorService executorService;

  /** Creates an evaluator owning a pool with one worker per available processor. */
  public ParallelEvaluator(ObjectiveFunction objective) {
    this(objective, Runtime.getRuntime().availableProcessors());
  }

  public ParallelEvaluator(ObjectiveFunction objective, int workers) {
    this(objective, newPool(workers));
  }

  ParallelEvaluator(ObjectiveFunction objective, ExecutorService executorService) {
    this.objective = checkNotNull(objective, "Objective function cannot be null");
    this.executorService = checkNotNull(executorService, "Executor service cannot be null");
  }

  private static ExecutorService newPool(int workers) {
    checkArgument(workers > 0, "Worker pool size must be positive: %s", workers);
    return Executors.newFixedThreadPool(
        workers,
        new ThreadFactoryBuilder().setNameFormat("evaluation-worker-%d").setDaemon(true).build());
  }

  @Override
  public EvaluatedBatch evaluate(
      ImmutableList<ImmutableList<Double>> candidates, EvaluationContext context) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<Future<Evaluation>> futures = new ArrayList<>(candidates.size());
    try {
      for (ImmutableList<Double> candidate : candidates) {
        futures.add(
            executorService.submit(
                () -> SerialEvaluator.evaluateSafely(objective, candidate, context)));
      }
    } catch (RejectedExecutionException e) {
      cancelAll(futures);
      logger.atSevere().withCause(e).log("Worker pool rejected an evaluation task");
      throw new WorkerPoolException("Worker pool rejected an evaluation task", e);
    }

    ImmutableList.Builder<Evaluation> evaluations =
        ImmutableList.builderWithExpectedSize(candidates.size());
    for (Future<Evaluation> future : futures) {
      evaluations.add(await(future, futures));
    }
    logger.atFine().log(
        "Completed parallel evaluation of %d candidates in %s", candidates.size(), stopwatch);
    return EvaluatedBatch.of(evaluations.build());
  }

  private static Evaluation await(Future<Evaluation> future, List<Future<Evaluation>> all) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelAll(all);
      throw new WorkerPoolException("Interrupted while waiting for evaluations", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof EvolutionExit) {
        cancelAll(all);
        throw (EvolutionExit) e.getCause();
      }
      cancelAll(all);
      logger.atSevere().withCause(e.getCause()).log("Evaluation worker failed");
      throw new WorkerPoolException("Evaluation worker failed", e.getCause());
    }
  }

  private static void cancelAll(List<Future<Evaluation>> futures) {
    futures.forEach(f -> f.cancel(true));
  }

  @Override
  public void close() {
    MoreExecutors.shutdownAndAwaitTermination(
        executorService, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
  }
}
