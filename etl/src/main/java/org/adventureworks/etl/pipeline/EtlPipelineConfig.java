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

import org.adventureworks.etl.format.csv.CsvDatasetReader;
import org.adventureworks.etl.warehouse.WarehouseConfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration for the object-storage to warehouse pipeline.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * targetLocation: "s3://e-commerce-processed/"
 * sourceCharset: ISO-8859-1
 * storage:
 *   region: us-east-1
 * warehouse:
 *   engine: redshift
 *   host: analytics.abc123.us-east-1.redshift.amazonaws.com
 *   database: adventureworks
 *   user: etl_loader
 *   iamRole: arn:aws:iam::123456789012:role/RedshiftCopy
 * }</pre>
 *
 * <p>{@code sourceRoot} is optional. When set, the event bucket is resolved
 * under it instead of {@code s3://<bucket>}, which lets local runs read from
 * a directory tree laid out as {@code <sourceRoot>/<bucket>/<key>}.
 *
 * @see EtlPipeline
 */
public class EtlPipelineConfig {

  public static final String DEFAULT_TARGET_LOCATION = "s3://e-commerce-processed/";

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final String targetLocation;
  private final @Nullable String sourceRoot;
  private final Charset sourceCharset;
  private final Map<String, Object> storageConfig;
  private final WarehouseConfig warehouse;

  private EtlPipelineConfig(Builder builder) {
    this.targetLocation = builder.targetLocation;
    this.sourceRoot = builder.sourceRoot;
    this.sourceCharset = builder.sourceCharset;
    this.storageConfig = builder.storageConfig;
    this.warehouse = builder.warehouse;
  }

  /** Directory or bucket prefix that receives {@code <table>_processed.csv}. */
  public String getTargetLocation() {
    return targetLocation;
  }

  public @Nullable String getSourceRoot() {
    return sourceRoot;
  }

  public Charset getSourceCharset() {
    return sourceCharset;
  }

  /** S3 client settings: region, endpoint, accessKeyId, secretAccessKey. */
  public Map<String, Object> getStorageConfig() {
    return storageConfig;
  }

  public WarehouseConfig getWarehouse() {
    return warehouse;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads a configuration from a YAML file.
   *
   * @param path YAML file
   * @return Parsed configuration
   * @throws IOException If the file cannot be read or parsed
   * @throws IllegalArgumentException If the configuration is invalid
   */
  public static EtlPipelineConfig load(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    }
  }

  @SuppressWarnings("unchecked")
  public static EtlPipelineConfig load(InputStream in) throws IOException {
    Map<String, Object> map = YAML_MAPPER.readValue(in, Map.class);
    if (map == null) {
      throw new IOException("Pipeline configuration is empty");
    }
    return fromMap(map);
  }

  /**
   * Creates an EtlPipelineConfig from a YAML/JSON map.
   */
  @SuppressWarnings("unchecked")
  public static EtlPipelineConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();

    Object targetObj = map.get("targetLocation");
    if (targetObj instanceof String) {
      builder.targetLocation((String) targetObj);
    }

    Object sourceRootObj = map.get("sourceRoot");
    if (sourceRootObj instanceof String) {
      builder.sourceRoot((String) sourceRootObj);
    }

    Object charsetObj = map.get("sourceCharset");
    if (charsetObj instanceof String) {
      try {
        builder.sourceCharset(Charset.forName((String) charsetObj));
      } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
        throw new IllegalArgumentException("Unsupported source charset: " + charsetObj, e);
      }
    }

    Object storageObj = map.get("storage");
    if (storageObj instanceof Map) {
      builder.storageConfig((Map<String, Object>) storageObj);
    }

    Object warehouseObj = map.get("warehouse");
    if (warehouseObj instanceof Map) {
      builder.warehouse(WarehouseConfig.fromMap((Map<String, Object>) warehouseObj));
    }

    return builder.build();
  }

  @Override public String toString() {
    return "EtlPipelineConfig{targetLocation='" + targetLocation + "', sourceRoot='"
        + sourceRoot + "', sourceCharset=" + sourceCharset + ", warehouse=" + warehouse + "}";
  }

  /**
   * Builder for EtlPipelineConfig.
   */
  public static class Builder {
    private String targetLocation = DEFAULT_TARGET_LOCATION;
    private @Nullable String sourceRoot;
    private Charset sourceCharset = CsvDatasetReader.DEFAULT_CHARSET;
    private Map<String, Object> storageConfig = ImmutableMap.of();
    private @Nullable WarehouseConfig warehouse;

    public Builder targetLocation(String targetLocation) {
      this.targetLocation = targetLocation;
      return this;
    }

    public Builder sourceRoot(@Nullable String sourceRoot) {
      this.sourceRoot = sourceRoot;
      return this;
    }

    public Builder sourceCharset(Charset sourceCharset) {
      this.sourceCharset = sourceCharset;
      return this;
    }

    public Builder storageConfig(Map<String, Object> storageConfig) {
      this.storageConfig = ImmutableMap.copyOf(storageConfig);
      return this;
    }

    public Builder warehouse(WarehouseConfig warehouse) {
      this.warehouse = warehouse;
      return this;
    }

    public EtlPipelineConfig build() {
      if (targetLocation == null || targetLocation.isEmpty()) {
        throw new IllegalArgumentException("Target location is required");
      }
      if (sourceCharset == null) {
        throw new IllegalArgumentException("Source charset is required");
      }
      if (warehouse == null) {
        throw new IllegalArgumentException("Warehouse configuration is required");
      }
      return new EtlPipelineConfig(this);
    }
  }
}
