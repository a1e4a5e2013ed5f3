package com.ospicorp.seoanalytics.common;

import java.util.Objects;

public record AnalysisError(ErrorKind kind, String reason) {
  public AnalysisError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(reason, "reason");
  }
}
