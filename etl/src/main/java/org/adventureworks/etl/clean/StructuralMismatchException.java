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

import org.adventureworks.etl.table.DatasetException;

/**
 * Thrown when a present cell cannot be given the structure a cleaner requires,
 * for example an email address without {@code @} or a return quantity with no
 * digits.
 */
public class StructuralMismatchException extends DatasetException {

  private static final long serialVersionUID = 1L;

  private final String columnName;
  private final int rowNumber;

  public StructuralMismatchException(String columnName, int rowNumber, String message) {
    super("Column '" + columnName + "', row " + rowNumber + ": " + message);
    this.columnName = columnName;
    this.rowNumber = rowNumber;
  }

  public String getColumnName() {
    return columnName;
  }

  /**
   * Returns the 0-based row index within the dataset the failing stage received.
   */
  public int getRowNumber() {
    return rowNumber;
  }
}
