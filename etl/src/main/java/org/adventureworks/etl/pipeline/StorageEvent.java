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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Object-created notification that triggers one pipeline run.
 *
 * <p>Parsed from the S3 event notification JSON; only the first record is
 * used:
 * <pre>{@code
 * {"Records": [{"s3": {"bucket": {"name": "e-commerce-raw"},
 *                      "object": {"key": "customers.csv"}}}]}
 * }</pre>
 */
public class StorageEvent {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final String bucket;
  private final String key;

  public StorageEvent(String bucket, String key) {
    if (bucket == null || bucket.isEmpty()) {
      throw new IllegalArgumentException("Bucket is required");
    }
    if (key == null || key.isEmpty()) {
      throw new IllegalArgumentException("Object key is required");
    }
    this.bucket = bucket;
    this.key = key;
  }

  /**
   * Parses an event notification.
   *
   * @param json Event JSON
   * @return Parsed event
   * @throws IOException If the JSON is malformed or lacks the bucket or key
   */
  public static StorageEvent fromJson(String json) throws IOException {
    return fromTree(OBJECT_MAPPER.readTree(json));
  }

  public static StorageEvent fromJson(InputStream in) throws IOException {
    return fromTree(OBJECT_MAPPER.readTree(in));
  }

  private static StorageEvent fromTree(JsonNode root) throws IOException {
    JsonNode s3 = root.path("Records").path(0).path("s3");
    JsonNode bucketName = s3.path("bucket").path("name");
    JsonNode objectKey = s3.path("object").path("key");
    if (!bucketName.isTextual() || bucketName.asText().isEmpty()) {
      throw new IOException("Event has no Records[0].s3.bucket.name");
    }
    if (!objectKey.isTextual() || objectKey.asText().isEmpty()) {
      throw new IOException("Event has no Records[0].s3.object.key");
    }
    // Keys arrive form-encoded: spaces as '+', other characters as %XX
    String key = URLDecoder.decode(objectKey.asText(), StandardCharsets.UTF_8);
    return new StorageEvent(bucketName.asText(), key);
  }

  public String getBucket() {
    return bucket;
  }

  public String getKey() {
    return key;
  }

  /** Last segment of the object key. */
  public String getFileName() {
    int slash = key.lastIndexOf('/');
    return slash >= 0 ? key.substring(slash + 1) : key;
  }

  /** File name up to its first dot; {@code sales_2015.csv} loads table {@code sales_2015}. */
  public String getTableName() {
    String fileName = getFileName();
    int dot = fileName.indexOf('.');
    return dot >= 0 ? fileName.substring(0, dot) : fileName;
  }

  @Override public String toString() {
    return "StorageEvent{bucket='" + bucket + "', key='" + key + "'}";
  }
}
