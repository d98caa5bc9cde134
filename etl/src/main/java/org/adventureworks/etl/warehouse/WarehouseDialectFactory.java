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
package org.adventureworks.etl.warehouse;

import java.util.Locale;

/**
 * Factory for creating {@link WarehouseDialect} instances based on engine type.
 *
 * <p>Supported engine types (case-insensitive):
 * <ul>
 *   <li>{@code redshift} - Amazon Redshift</li>
 *   <li>{@code duckdb} - DuckDB embedded database</li>
 * </ul>
 */
public final class WarehouseDialectFactory {

  /** Engine type constant for Redshift. */
  public static final String ENGINE_REDSHIFT = "redshift";

  /** Engine type constant for DuckDB. */
  public static final String ENGINE_DUCKDB = "duckdb";

  private WarehouseDialectFactory() {
  }

  /**
   * Creates a warehouse dialect for the specified engine type.
   *
   * @param engineType the engine type (e.g., "redshift", "duckdb")
   * @return the appropriate WarehouseDialect implementation
   * @throws IllegalArgumentException if the engine type is not recognized
   */
  public static WarehouseDialect createDialect(String engineType) {
    if (engineType == null || engineType.isEmpty()) {
      throw new IllegalArgumentException("Engine type cannot be null or empty");
    }

    switch (engineType.toLowerCase(Locale.ROOT)) {
    case ENGINE_REDSHIFT:
      return RedshiftDialect.INSTANCE;
    case ENGINE_DUCKDB:
      return DuckDBDialect.INSTANCE;
    default:
      throw new IllegalArgumentException(
          "Unknown warehouse engine type: " + engineType
          + ". Supported types: redshift, duckdb");
    }
  }

  public static boolean isSupported(String engineType) {
    if (engineType == null || engineType.isEmpty()) {
      return false;
    }
    String normalizedType = engineType.toLowerCase(Locale.ROOT);
    return ENGINE_REDSHIFT.equals(normalizedType) || ENGINE_DUCKDB.equals(normalizedType);
  }
}
