package com.ospicorp.seoanalytics.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a single-result analysis: either a value or an {@link AnalysisError}.
 *
 * <p>Missing or too-short input is an expected outcome and is reported as
 * {@link ErrorKind#INSUFFICIENT_DATA}; callers assembling a report should omit the section and
 * carry on. Repository exceptions are not captured here except at the per-client boundary,
 * where they become {@link ErrorKind#UPSTREAM_FAILURE}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisResult<T>(T value, AnalysisError error) {

  public AnalysisResult {
    if ((value == null) == (error == null)) {
      throw new IllegalArgumentException("exactly one of value or error must be set");
    }
  }

  public static <T> AnalysisResult<T> ok(T value) {
    return new AnalysisResult<>(value, null);
  }

  public static <T> AnalysisResult<T> failure(ErrorKind kind, String reason) {
    return new AnalysisResult<>(null, new AnalysisError(kind, reason));
  }

  public static <T> AnalysisResult<T> insufficientData(String reason) {
    return failure(ErrorKind.INSUFFICIENT_DATA, reason);
  }

  public static <T> AnalysisResult<T> invalidInput(String reason) {
    return failure(ErrorKind.INVALID_INPUT, reason);
  }

  public static <T> AnalysisResult<T> upstreamFailure(String reason) {
    return failure(ErrorKind.UPSTREAM_FAILURE, reason);
  }

  @JsonIgnore
  public boolean isOk() {
    return error == null;
  }

  @JsonIgnore
  public boolean hasError(ErrorKind kind) {
    return error != null && error.kind() == kind;
  }

  public T orElseThrow() {
    if (error != null) {
      throw new NoSuchElementException(error.kind().label() + ": " + error.reason());
    }
    return value;
  }

  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }

  @SuppressWarnings("unchecked")
  public <R> AnalysisResult<R> map(Function<? super T, ? extends R> mapper) {
    if (error != null) {
      return (AnalysisResult<R>) this;
    }
    return ok(mapper.apply(value));
  }
}
