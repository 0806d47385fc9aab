package org.hypertrace.core.metrics.etl.executor;

import lombok.Getter;

public enum ExecutionStatus {
  RUNNING("running"),
  SUCCESS("success"),
  FAILED("failed");

  @Getter private final String value;

  ExecutionStatus(String value) {
    this.value = value;
  }
}
