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
package org.adventureworks.etl.storage;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Creates a {@link StorageProvider} for a location URL.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * StorageProvider storage = StorageProviderFactory.createFromUrl("s3://e-commerce-raw/");
 * }</pre>
 */
public final class StorageProviderFactory {

  private StorageProviderFactory() {
  }

  /**
   * Picks a provider by URL scheme: {@code s3://} selects S3, anything else
   * the local filesystem.
   *
   * @param url Location URL or path
   * @return Storage provider for the location
   * @throws IllegalArgumentException if the scheme is not supported
   */
  public static StorageProvider createFromUrl(String url) {
    return createFromUrl(url, null);
  }

  /**
   * Picks a provider by URL scheme, passing S3 settings (region, endpoint,
   * accessKeyId, secretAccessKey) to the S3 provider.
   *
   * @param url Location URL or path
   * @param config S3 settings, or null to use the default provider chains
   * @return Storage provider for the location
   * @throws IllegalArgumentException if the scheme is not supported
   */
  public static StorageProvider createFromUrl(String url, @Nullable Map<String, Object> config) {
    String lower = url.toLowerCase(Locale.ROOT);
    if (lower.startsWith("s3://")) {
      return config != null ? new S3StorageProvider(config) : new S3StorageProvider();
    }
    if (lower.startsWith("file:") || !lower.contains("://")) {
      return new LocalFileStorageProvider();
    }
    throw new IllegalArgumentException("Unsupported storage location: " + url);
  }
}
