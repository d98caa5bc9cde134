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
package org.adventureworks.etl.table;

import java.util.List;

/**
 * Thrown when a transform references a column that the dataset does not have.
 */
public class MissingColumnException extends DatasetException {

  private static final long serialVersionUID = 1L;

  private final String columnName;

  public MissingColumnException(String columnName, List<String> availableColumns) {
    super("Column '" + columnName + "' not found; available columns: " + availableColumns);
    this.columnName = columnName;
  }

  /**
   * Returns the name of the column that was referenced but absent.
   *
   * @return The missing column name
   */
  public String getColumnName() {
    return columnName;
  }
}
