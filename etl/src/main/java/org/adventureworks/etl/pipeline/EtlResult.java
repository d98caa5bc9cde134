/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.adventureworks.etl.pipeline;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of one pipeline run.
 *
 * <p>Carries an HTTP-style status code and body for the invoking runtime:
 * 200 on success, 500 on any failure.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * EtlResult result = pipeline.execute(event);
 * if (!result.isSuccessful()) {
 *   System.err.println(result.getBody());
 * }
 * }</pre>
 *
 * @see EtlPipeline
 */
public class EtlResult {

  public static final int STATUS_OK = 200;
  public static final int STATUS_ERROR = 500;

  public static final String SUCCESS_BODY =
      "Data cleaned and uploaded to warehouse successfully.";
  public static final String ERROR_PREFIX = "Error processing data: ";

  private final int statusCode;
  private final String body;
  private final @Nullable String sourceName;
  private final @Nullable String tableName;
  private final long rowCount;
  private final @Nullable String processedLocation;
  private final long elapsedMs;

  private EtlResult(Builder builder) {
    this.statusCode = builder.statusCode;
    this.body = builder.body;
    this.sourceName = builder.sourceName;
    this.tableName = builder.tableName;
    this.rowCount = builder.rowCount;
    this.processedLocation = builder.processedLocation;
    this.elapsedMs = builder.elapsedMs;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getBody() {
    return body;
  }

  /** Object key of the processed source, or null if the event was not read. */
  public @Nullable String getSourceName() {
    return sourceName;
  }

  public @Nullable String getTableName() {
    return tableName;
  }

  /** Number of cleaned rows written; 0 on failure. */
  public long getRowCount() {
    return rowCount;
  }

  public @Nullable String getProcessedLocation() {
    return processedLocation;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  public boolean isSuccessful() {
    return statusCode == STATUS_OK;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("EtlResult{status=").append(statusCode);
    if (sourceName != null) {
      sb.append(", source='").append(sourceName).append("'");
    }
    if (isSuccessful()) {
      sb.append(", table='").append(tableName).append("'");
      sb.append(", rows=").append(rowCount);
      sb.append(", processed='").append(processedLocation).append("'");
    } else {
      sb.append(", FAILED: ").append(body);
    }
    sb.append(", elapsed=").append(elapsedMs).append("ms}");
    return sb.toString();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a success result.
   */
  public static EtlResult success(String sourceName, String tableName, long rowCount,
      String processedLocation, long elapsedMs) {
    return builder()
        .statusCode(STATUS_OK)
        .body(SUCCESS_BODY)
        .sourceName(sourceName)
        .tableName(tableName)
        .rowCount(rowCount)
        .processedLocation(processedLocation)
        .elapsedMs(elapsedMs)
        .build();
  }

  /**
   * Creates a failure result.
   */
  public static EtlResult failure(@Nullable String sourceName, @Nullable String message,
      long elapsedMs) {
    return builder()
        .statusCode(STATUS_ERROR)
        .body(ERROR_PREFIX + message)
        .sourceName(sourceName)
        .elapsedMs(elapsedMs)
        .build();
  }

  /**
   * Builder for EtlResult.
   */
  public static class Builder {
    private int statusCode = STATUS_OK;
    private String body = SUCCESS_BODY;
    private @Nullable String sourceName;
    private @Nullable String tableName;
    private long rowCount;
    private @Nullable String processedLocation;
    private long elapsedMs;

    public Builder statusCode(int statusCode) {
      this.statusCode = statusCode;
      return this;
    }

    public Builder body(String body) {
      this.body = body;
      return this;
    }

    public Builder sourceName(@Nullable String sourceName) {
      this.sourceName = sourceName;
      return this;
    }

    public Builder tableName(@Nullable String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder rowCount(long rowCount) {
      this.rowCount = rowCount;
      return this;
    }

    public Builder processedLocation(@Nullable String processedLocation) {
      this.processedLocation = processedLocation;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public EtlResult build() {
      return new EtlResult(this);
    }
  }
}
