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

import java.util.Map;

/**
 * Warehouse dialect for DuckDB.
 *
 * <p>An embedded engine for local runs: processed files are written to the
 * local filesystem and loaded with DuckDB's own {@code COPY}.
 */
public class DuckDBDialect implements WarehouseDialect {

  /** Singleton instance for reuse. */
  public static final DuckDBDialect INSTANCE = new DuckDBDialect();

  @Override public String getDriverClassName() {
    return "org.duckdb.DuckDBDriver";
  }

  @Override public String buildJdbcUrl(Map<String, String> config) {
    String path = config != null ? config.get("path") : null;
    if (path == null || path.isEmpty()) {
      return "jdbc:duckdb:";
    }
    return "jdbc:duckdb:" + path;
  }

  @Override public String copyCsvSql(String tableName, String location, WarehouseConfig config) {
    return String.format("COPY %s FROM %s (FORMAT CSV, DELIMITER ',', HEADER false)",
        tableName, WarehouseDialect.quoteLiteral(location));
  }

  @Override public String getName() {
    return "DuckDB";
  }
}
