package io.b2mash.dashhub.integration.aggregation;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/** Deterministic ordering for lists merged from several upstream calls. */
public final class MergeOrdering {

  private MergeOrdering() {}

  /**
   * Newest first by {@code timestamp}, entries without one last, ties broken by ascending {@code
   * id}.
   */
  public static <T, I extends Comparable<? super I>> Comparator<T> newestFirst(
      Function<T, Instant> timestamp, Function<T, I> id) {
    return Comparator.comparing(timestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(id, Comparator.nullsLast(Comparator.<I>naturalOrder()));
  }

  /** Concatenates {@code sources} and sorts the result; the inputs are not modified. */
  public static <T> List<T> merge(
      Comparator<? super T> order, List<? extends List<? extends T>> sources) {
    var merged = new ArrayList<T>();
    sources.forEach(merged::addAll);
    merged.sort(order);
    return merged;
  }

  /** Parses an ISO-8601 timestamp with offset; {@code null} when absent or malformed. */
  public static Instant parseTimestamp(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
