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

import java.sql.SQLException;

/**
 * Bulk loads a processed CSV file into a warehouse table.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * WarehouseLoader loader = new JdbcWarehouseLoader(config);
 * loader.load("customers", "s3://e-commerce-processed/customers_processed.csv");
 * }</pre>
 */
public interface WarehouseLoader {

  /**
   * Loads a headerless CSV file into an existing table.
   *
   * @param tableName Target table
   * @param location Location of the CSV file
   * @throws SQLException If the warehouse rejects the load
   */
  void load(String tableName, String location) throws SQLException;
}
