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
 * Abstraction for SQL dialect differences between warehouse engines that
 * bulk load CSV files.
 *
 * <p>Each engine has its own JDBC driver, URL format and {@code COPY} syntax.
 *
 * @see RedshiftDialect
 * @see DuckDBDialect
 */
public interface WarehouseDialect {

  /**
   * Returns the fully-qualified JDBC driver class name for this dialect.
   *
   * <p>This is used to load the driver via {@code Class.forName()} before
   * establishing connections.
   *
   * @return the JDBC driver class name (e.g., "org.postgresql.Driver")
   */
  String getDriverClassName();

  /**
   * Builds a JDBC connection URL from the provided configuration.
   *
   * <p>The configuration map may contain:
   * <ul>
   *   <li>{@code host} - server hostname (Redshift)</li>
   *   <li>{@code port} - server port number</li>
   *   <li>{@code database} - database name</li>
   *   <li>{@code path} - database file path (DuckDB)</li>
   * </ul>
   *
   * @param config configuration map with connection parameters
   * @return a valid JDBC URL for this dialect
   * @throws IllegalArgumentException if a required setting is missing
   */
  String buildJdbcUrl(Map<String, String> config);

  /**
   * Generates the statement that bulk loads a headerless, comma-separated CSV
   * file into an existing table.
   *
   * @param tableName target table, already validated as a simple identifier
   * @param location location of the CSV file as the engine sees it
   * @param config warehouse settings (for credentials the engine needs)
   * @return SQL statement
   */
  String copyCsvSql(String tableName, String location, WarehouseConfig config);

  /**
   * Returns the human-readable name of this dialect.
   *
   * @return dialect name (e.g., "Redshift")
   */
  String getName();

  /**
   * Quotes a string literal for SQL.
   */
  static String quoteLiteral(String literal) {
    return "'" + literal.replace("'", "''") + "'";
  }
}
