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
 * Warehouse dialect for Amazon Redshift.
 *
 * <p>Connects through the PostgreSQL JDBC driver and loads files from S3
 * with {@code COPY ... IAM_ROLE}.
 *
 * <pre>{@code
 * COPY customers FROM 's3://e-commerce-processed/customers_processed.csv'
 * IAM_ROLE 'arn:aws:iam::123456789012:role/RedshiftCopy' FORMAT AS CSV DELIMITER ','
 * }</pre>
 */
public class RedshiftDialect implements WarehouseDialect {

  /** Singleton instance for reuse. */
  public static final RedshiftDialect INSTANCE = new RedshiftDialect();

  /** Default Redshift port. */
  public static final int DEFAULT_PORT = 5439;

  @Override public String getDriverClassName() {
    return "org.postgresql.Driver";
  }

  @Override public String buildJdbcUrl(Map<String, String> config) {
    String host = config.get("host");
    if (host == null || host.isEmpty()) {
      throw new IllegalArgumentException("Redshift requires a host");
    }
    String database = config.get("database");
    if (database == null || database.isEmpty()) {
      throw new IllegalArgumentException("Redshift requires a database");
    }
    String port = config.get("port");
    if (port == null || port.isEmpty()) {
      port = String.valueOf(DEFAULT_PORT);
    }
    return String.format("jdbc:postgresql://%s:%s/%s", host, port, database);
  }

  @Override public String copyCsvSql(String tableName, String location, WarehouseConfig config) {
    String iamRole = config.getIamRole();
    if (iamRole == null || iamRole.isEmpty()) {
      throw new IllegalArgumentException("Redshift COPY requires an IAM role");
    }
    return String.format("COPY %s FROM %s IAM_ROLE %s FORMAT AS CSV DELIMITER ','",
        tableName, WarehouseDialect.quoteLiteral(location),
        WarehouseDialect.quoteLiteral(iamRole));
  }

  @Override public String getName() {
    return "Redshift";
  }
}
