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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for TabularDataset.
 */
@Tag("unit")
public class TabularDatasetTest {

  private static TabularDataset sample() {
    return TabularDataset.fromRows(
        Arrays.asList("Key", "Name", "Qty"),
        Arrays.asList(
            Arrays.asList("1", "Alice", "3"),
            Arrays.asList("2", null, "0"),
            Arrays.asList("3", "Carol", "5")));
  }

  @Test void testFromRows() {
    TabularDataset dataset = sample();

    assertEquals(3, dataset.getRowCount());
    assertEquals(3, dataset.getColumnCount());
    assertEquals(Arrays.asList("Key", "Name", "Qty"), dataset.getColumnNames());
    assertEquals("Alice", dataset.getValue(0, "Name"));
    assertNull(dataset.getValue(1, "Name"));
    assertEquals("Qty", dataset.getLastColumnName());
  }

  @Test void testFromRowsRejectsRaggedRow() {
    assertThrows(IllegalArgumentException.class, () ->
        TabularDataset.fromRows(Arrays.asList("A", "B"),
            Collections.singletonList(Collections.singletonList("1"))));
  }

  @Test void testBuilderRejectsDuplicateAndMismatchedColumns() {
    assertThrows(IllegalArgumentException.class, () ->
        TabularDataset.builder()
            .column("A", Arrays.asList("1", "2"))
            .column("A", Arrays.asList("3", "4")));
    assertThrows(IllegalArgumentException.class, () ->
        TabularDataset.builder()
            .column("A", Arrays.asList("1", "2"))
            .column("B", Collections.singletonList("3")));
  }

  @Test void testEmptyDataset() {
    TabularDataset empty = TabularDataset.builder().build();

    assertEquals(0, empty.getRowCount());
    assertEquals(0, empty.getColumnCount());
    assertNull(empty.getLastColumnName());
  }

  @Test void testMissingColumnNamesAvailableColumns() {
    MissingColumnException e = assertThrows(MissingColumnException.class,
        () -> sample().getColumn("Email"));

    assertEquals("Email", e.getColumnName());
    assertTrue(e.getMessage().contains("Email"));
    assertTrue(e.getMessage().contains("Name"));
  }

  @Test void testWithColumnLeavesOriginalUntouched() {
    TabularDataset original = sample();
    TabularDataset changed = original.withColumn("Name", Arrays.asList("A", "B", "C"));

    assertEquals("Alice", original.getValue(0, "Name"));
    assertEquals("A", changed.getValue(0, "Name"));
    assertEquals(original.getColumnNames(), changed.getColumnNames());
  }

  @Test void testWithColumnAppendsNewColumn() {
    TabularDataset changed = sample().withColumn("Year", Arrays.asList(2020, 2021, 2022));

    assertEquals("Year", changed.getLastColumnName());
    assertEquals(2021, changed.getValue(1, "Year"));
    assertThrows(IllegalArgumentException.class,
        () -> sample().withColumn("Year", Collections.singletonList(2020)));
  }

  @Test void testRenameColumnKeepsPosition() {
    TabularDataset renamed = sample().renameColumn("Name", "FirstName");

    assertEquals(Arrays.asList("Key", "FirstName", "Qty"), renamed.getColumnNames());
    assertEquals("Carol", renamed.getValue(2, "FirstName"));
    assertFalse(renamed.hasColumn("Name"));
  }

  @Test void testRenameColumnOntoExistingFails() {
    assertThrows(IllegalArgumentException.class, () -> sample().renameColumn("Name", "Qty"));
    assertThrows(MissingColumnException.class, () -> sample().renameColumn("Nope", "X"));
  }

  @Test void testFilterRowsKeepsRowsAligned() {
    TabularDataset dataset = sample();
    List<Object> names = dataset.getColumn("Name");
    TabularDataset filtered = dataset.filterRows(row -> names.get(row) != null);

    assertEquals(2, filtered.getRowCount());
    Map<String, Object> second = filtered.getRow(1);
    assertEquals("3", second.get("Key"));
    assertEquals("Carol", second.get("Name"));
    assertEquals("5", second.get("Qty"));
  }

  @Test void testFilterRowsReturnsSameInstanceWhenNothingDropped() {
    TabularDataset dataset = sample();

    assertSame(dataset, dataset.filterRows(row -> true));
  }

  @Test void testSelectColumns() {
    TabularDataset selected = sample().selectColumns(Arrays.asList("Qty", "Key"));

    assertEquals(Arrays.asList("Qty", "Key"), selected.getColumnNames());
    assertEquals(3, selected.getRowCount());
  }

  @Test void testColumnsAreUnmodifiable() {
    assertThrows(UnsupportedOperationException.class,
        () -> sample().getColumn("Key").set(0, "9"));
  }

  @Test void testEquality() {
    assertEquals(sample(), sample());
    assertEquals(sample().hashCode(), sample().hashCode());
    assertFalse(sample().equals(sample().renameColumn("Qty", "Quantity")));
  }
}
