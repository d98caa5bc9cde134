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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Immutable, column-oriented table of named cells.
 *
 * <p>A TabularDataset is an ordered sequence of uniquely named columns, each an
 * ordered list of cell values aligned by row index. A {@code null} cell denotes
 * a missing value. Every transform returns a new dataset, so all columns always
 * have the same length and row {@code i} of one column corresponds to row
 * {@code i} of every other column.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TabularDataset dataset = TabularDataset.builder()
 *     .column("CustomerKey", Arrays.asList("11000", null))
 *     .column("MaritalStatus", Arrays.asList("M", "S"))
 *     .build();
 *
 * TabularDataset keyed = dataset.filterRows(row -> dataset.getValue(row, "CustomerKey") != null);
 * }</pre>
 */
public final class TabularDataset {

  private final ImmutableList<String> columnNames;
  private final Map<String, List<Object>> columns;
  private final int rowCount;

  private TabularDataset(LinkedHashMap<String, List<Object>> columns, int rowCount) {
    this.columnNames = ImmutableList.copyOf(columns.keySet());
    this.columns = Collections.unmodifiableMap(columns);
    this.rowCount = rowCount;
  }

  /**
   * Creates a dataset from a header and a list of rows.
   *
   * @param header Column names, in order
   * @param rows Rows of cell values; each row must have exactly one value per column
   * @return A new dataset
   * @throws IllegalArgumentException if a row's width differs from the header's
   */
  public static TabularDataset fromRows(List<String> header, List<? extends List<?>> rows) {
    List<List<Object>> cells = new ArrayList<List<Object>>(header.size());
    for (int c = 0; c < header.size(); c++) {
      cells.add(new ArrayList<Object>(rows.size()));
    }
    int rowNum = 0;
    for (List<?> row : rows) {
      if (row.size() != header.size()) {
        throw new IllegalArgumentException("Row " + rowNum + " has " + row.size()
            + " values but the header has " + header.size() + " columns");
      }
      for (int c = 0; c < header.size(); c++) {
        cells.get(c).add(row.get(c));
      }
      rowNum++;
    }
    Builder builder = builder();
    for (int c = 0; c < header.size(); c++) {
      builder.column(header.get(c), cells.get(c));
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public int getColumnCount() {
    return columnNames.size();
  }

  public int getRowCount() {
    return rowCount;
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  /**
   * Returns the last column's name, or null if the dataset has no columns.
   */
  public @Nullable String getLastColumnName() {
    return columnNames.isEmpty() ? null : columnNames.get(columnNames.size() - 1);
  }

  /**
   * Returns the cells of a column.
   *
   * @param name Column name
   * @return Unmodifiable list of cell values, one per row
   * @throws MissingColumnException if no column has that name
   */
  public List<Object> getColumn(String name) {
    List<Object> column = columns.get(name);
    if (column == null) {
      throw new MissingColumnException(name, columnNames);
    }
    return column;
  }

  public @Nullable Object getValue(int row, String column) {
    return getColumn(column).get(row);
  }

  /**
   * Returns one row as an ordered map of column name to value.
   *
   * @param row Row index (0-based)
   * @return A new mutable map; changes do not affect this dataset
   */
  public Map<String, Object> getRow(int row) {
    if (row < 0 || row >= rowCount) {
      throw new IndexOutOfBoundsException("Row " + row + " out of range [0, " + rowCount + ")");
    }
    Map<String, Object> result = new LinkedHashMap<String, Object>();
    for (String name : columnNames) {
      result.put(name, columns.get(name).get(row));
    }
    return result;
  }

  /**
   * Returns a dataset with the given column replaced, or appended if absent.
   *
   * @param name Column name
   * @param values Cell values, one per row
   * @return A new dataset
   * @throws IllegalArgumentException if the number of values differs from the row count
   */
  public TabularDataset withColumn(String name, List<?> values) {
    if (values.size() != rowCount) {
      throw new IllegalArgumentException("Column '" + name + "' has " + values.size()
          + " values but the dataset has " + rowCount + " rows");
    }
    LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<String, List<Object>>(columns);
    copy.put(name, freeze(values));
    return new TabularDataset(copy, rowCount);
  }

  /**
   * Returns a dataset with one column renamed, keeping its position.
   *
   * @param from Existing column name
   * @param to New column name
   * @return A new dataset, or this dataset if the names are equal
   * @throws MissingColumnException if {@code from} does not exist
   * @throws IllegalArgumentException if another column is already named {@code to}
   */
  public TabularDataset renameColumn(String from, String to) {
    getColumn(from);
    if (from.equals(to)) {
      return this;
    }
    if (columns.containsKey(to)) {
      throw new IllegalArgumentException("Cannot rename '" + from + "' to '" + to
          + "': column already exists");
    }
    LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<String, List<Object>>();
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      String name = entry.getKey().equals(from) ? to : entry.getKey();
      copy.put(name, entry.getValue());
    }
    return new TabularDataset(copy, rowCount);
  }

  /**
   * Returns a dataset keeping only the rows accepted by the predicate.
   *
   * <p>The same rows are removed from every column.
   *
   * @param keep Predicate over row indexes of this dataset
   * @return A new dataset
   */
  public TabularDataset filterRows(IntPredicate keep) {
    List<Integer> kept = new ArrayList<Integer>();
    for (int row = 0; row < rowCount; row++) {
      if (keep.test(row)) {
        kept.add(row);
      }
    }
    if (kept.size() == rowCount) {
      return this;
    }
    LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<String, List<Object>>();
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      List<Object> source = entry.getValue();
      List<Object> values = new ArrayList<Object>(kept.size());
      for (int row : kept) {
        values.add(source.get(row));
      }
      copy.put(entry.getKey(), Collections.unmodifiableList(values));
    }
    return new TabularDataset(copy, kept.size());
  }

  /**
   * Returns a dataset containing only the named columns, in the given order.
   *
   * @param names Columns to keep
   * @return A new dataset
   * @throws MissingColumnException if any name does not exist
   */
  public TabularDataset selectColumns(List<String> names) {
    LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<String, List<Object>>();
    for (String name : names) {
      copy.put(name, getColumn(name));
    }
    return new TabularDataset(copy, rowCount);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TabularDataset)) {
      return false;
    }
    TabularDataset that = (TabularDataset) o;
    return rowCount == that.rowCount
        && columnNames.equals(that.columnNames)
        && columns.equals(that.columns);
  }

  @Override public int hashCode() {
    return columnNames.hashCode() * 31 + columns.hashCode();
  }

  @Override public String toString() {
    return "TabularDataset{rows=" + rowCount + ", columns=" + columnNames + "}";
  }

  private static List<Object> freeze(List<?> values) {
    return Collections.unmodifiableList(new ArrayList<Object>(values));
  }

  /**
   * Builder for TabularDataset.
   */
  public static class Builder {
    private final LinkedHashMap<String, List<Object>> columns =
        new LinkedHashMap<String, List<Object>>();
    private int rowCount = -1;

    /**
     * Appends a column.
     *
     * @param name Column name, unique within the dataset
     * @param values Cell values; every column must have the same number of values
     * @return This builder
     */
    public Builder column(String name, List<?> values) {
      if (name == null) {
        throw new IllegalArgumentException("Column name cannot be null");
      }
      if (columns.containsKey(name)) {
        throw new IllegalArgumentException("Duplicate column name: " + name);
      }
      if (rowCount >= 0 && values.size() != rowCount) {
        throw new IllegalArgumentException("Column '" + name + "' has " + values.size()
            + " values but previous columns have " + rowCount);
      }
      rowCount = values.size();
      columns.put(name, freeze(values));
      return this;
    }

    public TabularDataset build() {
      return new TabularDataset(new LinkedHashMap<String, List<Object>>(columns),
          Math.max(rowCount, 0));
    }
  }
}
