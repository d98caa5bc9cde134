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
package org.adventureworks.etl.clean;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The AdventureWorks extracts that have a cleaner.
 *
 * <p>Each constant is keyed by the base name of the source file and bound to
 * the cleaner that handles it. The three yearly sales extracts share one
 * {@link SalesCleaner}.
 *
 * @see DataCleaner
 */
public enum DatasetIdentity {
  /** Customer master data. */
  CUSTOMERS("customers.csv", CustomersCleaner.INSTANCE),

  /** Customer social media profile data. */
  CUSTOMERS_NEW("customers_new.csv", CustomerSocialMediaCleaner.INSTANCE),

  SALES_2015("sales_2015.csv", SalesCleaner.INSTANCE),

  SALES_2016("sales_2016.csv", SalesCleaner.INSTANCE),

  SALES_2017("sales_2017.csv", SalesCleaner.INSTANCE),

  RETURNS("returns.csv", ReturnsCleaner.INSTANCE),

  PRODUCTS("products.csv", ProductsCleaner.INSTANCE);

  private final String fileName;
  private final DatasetCleaner cleaner;

  DatasetIdentity(String fileName, DatasetCleaner cleaner) {
    this.fileName = fileName;
    this.cleaner = cleaner;
  }

  public String getFileName() {
    return fileName;
  }

  public DatasetCleaner getCleaner() {
    return cleaner;
  }

  /**
   * Resolves a source name to a dataset identity.
   *
   * <p>Only the base name matters: {@code raw/2024/customers.csv} resolves to
   * {@link #CUSTOMERS}. Matching is exact and case-sensitive.
   *
   * @param sourceName File name or object key
   * @return The identity, or null if the source is not a known extract
   */
  public static @Nullable DatasetIdentity fromSourceName(@Nullable String sourceName) {
    if (sourceName == null) {
      return null;
    }
    String baseName = baseName(sourceName);
    for (DatasetIdentity identity : values()) {
      if (identity.fileName.equals(baseName)) {
        return identity;
      }
    }
    return null;
  }

  /**
   * Returns the part of a path after the last {@code /}.
   */
  public static String baseName(String sourceName) {
    int slash = sourceName.lastIndexOf('/');
    return slash < 0 ? sourceName : sourceName.substring(slash + 1);
  }
}
