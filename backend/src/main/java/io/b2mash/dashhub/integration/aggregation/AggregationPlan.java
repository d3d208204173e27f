package io.b2mash.dashhub.integration.aggregation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Declares the sub-calls of one aggregated metric, then runs them with {@link #execute()}.
 *
 * <pre>{@code
 * var plan = aggregation.plan(timeout);
 * var status = plan.required("status", () -> client.get()...);
 * var cpu = plan.optional("cpu", () -> client.get()..., null);
 * var merged = plan.execute();
 * }</pre>
 */
public final class AggregationPlan {

  private final AggregationExecutor executor;
  private final Duration timeout;
  private final int maxConcurrency;
  private final List<SubCall<?>> calls = new ArrayList<>();
  private final Set<String> names = new HashSet<>();

  AggregationPlan(AggregationExecutor executor, Duration timeout, int maxConcurrency) {
    this.executor = executor;
    this.timeout = timeout;
    this.maxConcurrency = maxConcurrency;
  }

  public <T> SubCall<T> required(String name, Supplier<T> call) {
    return add(SubCall.required(name, call, timeout));
  }

  public <T> SubCall<T> optional(String name, Supplier<T> call, T fallback) {
    return add(SubCall.optional(name, call, fallback, timeout));
  }

  /**
   * Per-entity enrichment: one optional call for each of the first {@code limit} items, named
   * {@code prefix:key}. A failed item is omitted from {@link MergedResult#collect}.
   */
  public <E, T> List<SubCall<T>> optionalEach(
      String prefix, List<E> items, int limit, Function<E, String> key, Function<E, T> call) {
    var added = new ArrayList<SubCall<T>>();
    for (var item : items.subList(0, Math.min(limit, items.size()))) {
      added.add(optional(prefix + ":" + key.apply(item), () -> call.apply(item), null));
    }
    return added;
  }

  public MergedResult execute() {
    return executor.reduce(executor.fanOut(calls, maxConcurrency));
  }

  private <T> SubCall<T> add(SubCall<T> call) {
    if (!names.add(call.name())) {
      throw new IllegalArgumentException("Duplicate sub-call name: " + call.name());
    }
    calls.add(call);
    return call;
  }
}
