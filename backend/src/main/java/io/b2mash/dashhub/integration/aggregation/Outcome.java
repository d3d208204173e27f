package io.b2mash.dashhub.integration.aggregation;

/** Result of running one {@link SubCall}: its value, or the error that ended it. */
public sealed interface Outcome<T> {

  SubCall<T> call();

  default boolean succeeded() {
    return this instanceof Succeeded;
  }

  record Succeeded<T>(SubCall<T> call, T value) implements Outcome<T> {}

  record Failed<T>(SubCall<T> call, Throwable error) implements Outcome<T> {}
}
