package io.b2mash.dashhub.integration.aggregation;

import io.b2mash.dashhub.integration.error.IntegrationException;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/** Values of a reduced fan-out, keyed by sub-call name, plus warnings and any required failure. */
public final class MergedResult {

  private final Map<String, Object> values;
  private final List<String> warnings;
  private final String failedCall;
  private final Throwable failure;

  MergedResult(
      Map<String, Object> values, List<String> warnings, String failedCall, Throwable failure) {
    this.values = Collections.unmodifiableMap(values);
    this.warnings = List.copyOf(warnings);
    this.failedCall = failedCall;
    this.failure = failure;
  }

  public boolean failed() {
    return failure != null;
  }

  /** Value of {@code call}: its result, its fallback after an optional failure, or {@code null}. */
  @SuppressWarnings("unchecked")
  public <T> T get(SubCall<T> call) {
    return (T) values.get(call.name());
  }

  /** Non-null values of {@code calls}, in the order given; omitted calls are skipped. */
  public <T> List<T> collect(List<SubCall<T>> calls) {
    var collected = new ArrayList<T>(calls.size());
    for (var call : calls) {
      var value = get(call);
      if (value != null) {
        collected.add(value);
      }
    }
    return collected;
  }

  public List<String> warnings() {
    return warnings;
  }

  /** Name of the required sub-call whose failure failed the merge, or {@code null}. */
  public String failedCall() {
    return failedCall;
  }

  public IntegrationException failure() {
    return failure == null ? null : UpstreamErrorTranslator.translate(failure);
  }

  /**
   * {@code Failure} when a required call failed; otherwise {@code Success}, or {@code
   * PartialSuccess} when warnings were recorded. {@code data} is only evaluated on success.
   */
  public MetricResult toResult(Supplier<Map<String, Object>> data) {
    if (failed()) {
      return MetricResult.failure(Objects.requireNonNull(failure()));
    }
    return MetricResult.of(data.get(), warnings);
  }
}
