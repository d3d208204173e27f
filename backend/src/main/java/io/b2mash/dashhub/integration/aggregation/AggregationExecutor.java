package io.b2mash.dashhub.integration.aggregation;

import io.b2mash.dashhub.integration.IntegrationProperties;
import io.b2mash.dashhub.integration.auth.CredentialAttempt;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;

/**
 * Runs independent upstream calls concurrently and folds their outcomes into one {@link
 * MergedResult}.
 *
 * <p>Every call runs on the integration executor, bounded by its own timeout; a failed or
 * timed-out call never cancels its siblings. At most {@code maxConcurrency} calls of one fan-out
 * are running at a time: a lane is released when its call returns, not when its timeout fires.
 */
@Component
public class AggregationExecutor {

  private static final Logger log = LoggerFactory.getLogger(AggregationExecutor.class);

  private final Executor executor;
  private final int maxFanOut;

  @Autowired
  public AggregationExecutor(
      @Qualifier("integrationCallExecutor") Executor executor, IntegrationProperties properties) {
    this(executor, properties.maxFanOut());
  }

  public AggregationExecutor(Executor executor, int maxFanOut) {
    this.executor = executor;
    this.maxFanOut = Math.max(1, maxFanOut);
  }

  public AggregationPlan plan(Duration timeout) {
    return new AggregationPlan(this, timeout, maxFanOut);
  }

  public List<Outcome<?>> fanOut(List<? extends SubCall<?>> calls) {
    return fanOut(calls, maxFanOut);
  }

  /**
   * Runs {@code calls} with at most {@code maxConcurrency} in flight and returns one outcome per
   * call, in input order. Never throws for a failing call.
   */
  public List<Outcome<?>> fanOut(List<? extends SubCall<?>> calls, int maxConcurrency) {
    if (calls.isEmpty()) {
      return List.of();
    }
    int size = calls.size();
    var slots = new ArrayList<CompletableFuture<Outcome<?>>>(size);
    for (int i = 0; i < size; i++) {
      slots.add(new CompletableFuture<>());
    }
    int lanes = Math.max(1, Math.min(maxConcurrency, size));
    var next = new AtomicInteger(lanes);
    for (int i = 0; i < lanes; i++) {
      launch(calls, slots, next, i);
    }
    CompletableFuture.allOf(slots.toArray(CompletableFuture[]::new)).join();
    return slots.stream().<Outcome<?>>map(CompletableFuture::join).toList();
  }

  /**
   * Folds outcomes in order. A failed required call fails the merge (the first one is reported);
   * a failed optional call contributes its fallback and a warning.
   *
   * <p>A 401/403 from a required call is rethrown as-is. So is one from an optional call while the
   * current {@link CredentialAttempt} can still re-authenticate. Otherwise an optional call's
   * rejection is recorded on the attempt and degrades to its fallback like any other failure.
   */
  public MergedResult reduce(List<? extends Outcome<?>> outcomes) {
    var values = new LinkedHashMap<String, Object>();
    var warnings = new ArrayList<String>();
    String failedCall = null;
    Throwable failure = null;

    for (Outcome<?> outcome : outcomes) {
      var call = outcome.call();
      if (outcome instanceof Outcome.Succeeded<?> succeeded) {
        values.put(call.name(), succeeded.value());
        continue;
      }
      var error = ((Outcome.Failed<?>) outcome).error();
      if (UpstreamErrorTranslator.isAuthRejection(error)) {
        if (call.policy() == CallPolicy.REQUIRED || CredentialAttempt.isRetryable()) {
          throw (HttpStatusCodeException) error;
        }
        CredentialAttempt.recordRejection();
      }
      var message = UpstreamErrorTranslator.translate(error).getMessage();
      if (call.policy() == CallPolicy.REQUIRED) {
        log.warn("Required sub-call '{}' failed: {}", call.name(), message);
        if (failure == null) {
          failure = error;
          failedCall = call.name();
        }
      } else {
        log.warn("Optional sub-call '{}' failed, using fallback: {}", call.name(), message);
        values.put(call.name(), call.fallback());
        warnings.add(call.name() + " unavailable: " + message);
      }
    }
    return new MergedResult(values, warnings, failedCall, failure);
  }

  private void launch(
      List<? extends SubCall<?>> calls,
      List<CompletableFuture<Outcome<?>>> slots,
      AtomicInteger next,
      int index) {
    var released = new CompletableFuture<Void>();
    start(calls.get(index), released)
        .whenComplete((outcome, error) -> slots.get(index).complete(outcome));
    released.whenComplete(
        (ignored, error) -> {
          int following = next.getAndIncrement();
          if (following < calls.size()) {
            launch(calls, slots, next, following);
          }
        });
  }

  /**
   * Submits {@code call}. The returned outcome completes at the call's result or its timeout,
   * whichever comes first; {@code released} completes once the call itself has returned.
   */
  private <T> CompletableFuture<Outcome<?>> start(
      SubCall<T> call, CompletableFuture<Void> released) {
    var result = new CompletableFuture<T>();
    try {
      executor.execute(
          () -> {
            try {
              result.complete(call.call().get());
            } catch (Throwable e) {
              result.completeExceptionally(e);
            } finally {
              released.complete(null);
            }
          });
    } catch (RejectedExecutionException e) {
      released.complete(null);
      return CompletableFuture.completedFuture(new Outcome.Failed<>(call, e));
    }
    return result
        .orTimeout(call.timeout().toMillis(), TimeUnit.MILLISECONDS)
        .<Outcome<?>>handle(
            (value, error) ->
                error == null
                    ? new Outcome.Succeeded<>(call, value)
                    : new Outcome.Failed<>(call, unwrap(error)));
  }

  private static Throwable unwrap(Throwable error) {
    return error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
  }
}
