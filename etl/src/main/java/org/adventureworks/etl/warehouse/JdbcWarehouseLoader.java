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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.regex.Pattern;

/**
 * {@link WarehouseLoader} that issues the dialect's {@code COPY} statement
 * over JDBC.
 *
 * <p>Each load opens its own connection, executes the statement in a
 * transaction, commits and closes.
 */
public class JdbcWarehouseLoader implements WarehouseLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcWarehouseLoader.class);

  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final WarehouseConfig config;
  private final WarehouseDialect dialect;

  public JdbcWarehouseLoader(WarehouseConfig config) {
    this(config, WarehouseDialectFactory.createDialect(config.getEngine()));
  }

  public JdbcWarehouseLoader(WarehouseConfig config, WarehouseDialect dialect) {
    this.config = config;
    this.dialect = dialect;
  }

  @Override public void load(String tableName, String location) throws SQLException {
    if (!TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    String sql = dialect.copyCsvSql(tableName, location, config);
    String url = dialect.buildJdbcUrl(config.toConnectionMap());

    loadDriver();
    LOGGER.info("Establishing connection to {} warehouse: {}", dialect.getName(), url);
    try (Connection connection = openConnection(url)) {
      connection.setAutoCommit(false);
      try (Statement statement = connection.createStatement()) {
        LOGGER.info("Executing {} COPY command for table {}", dialect.getName(), tableName);
        statement.execute(sql);
        connection.commit();
      } catch (SQLException e) {
        connection.rollback();
        throw e;
      }
    }
    LOGGER.info("Data successfully loaded into {} table: {}", dialect.getName(), tableName);
  }

  public WarehouseDialect getDialect() {
    return dialect;
  }

  private Connection openConnection(String url) throws SQLException {
    // Embedded engines reject credential properties they do not know
    if (config.getUser() == null) {
      return DriverManager.getConnection(url);
    }
    return DriverManager.getConnection(url, config.getUser(), config.getPassword());
  }

  private void loadDriver() throws SQLException {
    try {
      Class.forName(dialect.getDriverClassName());
    } catch (ClassNotFoundException e) {
      throw new SQLException("JDBC driver not found: " + dialect.getDriverClassName(), e);
    }
  }
}
