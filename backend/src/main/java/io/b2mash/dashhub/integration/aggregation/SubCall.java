package io.b2mash.dashhub.integration.aggregation;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One independent upstream call within an aggregated metric. Also serves as the typed handle for
 * reading its value back from a {@link MergedResult}. A {@code null} fallback means the value is
 * omitted when an optional call fails.
 */
public record SubCall<T>(
    String name, CallPolicy policy, Supplier<T> call, T fallback, Duration timeout) {

  public SubCall {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(call, "call");
    Objects.requireNonNull(timeout, "timeout");
  }

  public static <T> SubCall<T> required(String name, Supplier<T> call, Duration timeout) {
    return new SubCall<>(name, CallPolicy.REQUIRED, call, null, timeout);
  }

  public static <T> SubCall<T> optional(
      String name, Supplier<T> call, T fallback, Duration timeout) {
    return new SubCall<>(name, CallPolicy.OPTIONAL, call, fallback, timeout);
  }
}
