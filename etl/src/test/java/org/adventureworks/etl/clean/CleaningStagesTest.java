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
import org.adventureworks.etl.table.MissingColumnException;
import org.adventureworks.etl.table.TabularDataset;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for the reusable cleaning stages and CleaningPipeline.
 */
@Tag("unit")
public class CleaningStagesTest {

  private static TabularDataset dataset() {
    return TabularDataset.fromRows(
        Arrays.asList("Key", "Code", "Note"),
        Arrays.asList(
            Arrays.asList("1", "M", null),
            Arrays.asList(null, "S", "ok"),
            Arrays.asList("3", "X", " ")));
  }

  @Test void testDropMissing() {
    TabularDataset result = CleaningStages.dropMissing("Key").apply(dataset());

    assertEquals(2, result.getRowCount());
    assertEquals(Arrays.asList("1", "3"), result.getColumn("Key"));
    assertEquals(Arrays.asList("M", "X"), result.getColumn("Code"));
  }

  @Test void testReplaceValuesPassesOtherValuesThrough() {
    TabularDataset result = CleaningStages
        .replaceValues("Code", ImmutableMap.of("M", "Married", "S", "Single"))
        .apply(dataset());

    assertEquals(Arrays.asList("Married", "Single", "X"), result.getColumn("Code"));
  }

  @Test void testFillMissingTreatsBlankAsMissing() {
    TabularDataset result = CleaningStages.fillMissing("Note", "none").apply(dataset());

    assertEquals(Arrays.asList("none", "ok", "none"), result.getColumn("Note"));
  }

  @Test void testSetConstantAddsColumn() {
    TabularDataset result = CleaningStages.setConstant("Level", "High").apply(dataset());

    assertEquals("Level", result.getLastColumnName());
    assertEquals(Arrays.asList("High", "High", "High"), result.getColumn("Level"));
  }

  @Test void testDeriveColumn() {
    TabularDataset result = CleaningStages
        .deriveColumn("CodeLength", "Code", value -> value.toString().length())
        .apply(dataset());

    assertEquals(Arrays.asList(1, 1, 1), result.getColumn("CodeLength"));
  }

  @Test void testRenameIfPresent() {
    TabularDataset input = dataset();

    assertSame(input, CleaningStages.renameIfPresent("Missing", "Other").apply(input));
    assertEquals(Arrays.asList("Key", "Status", "Note"),
        CleaningStages.renameIfPresent("Code", "Status").apply(input).getColumnNames());
  }

  @Test void testRenameLastColumn() {
    TabularDataset result = CleaningStages.renameLastColumn("Comment").apply(dataset());

    assertEquals("Comment", result.getLastColumnName());
    assertThrows(MissingColumnException.class,
        () -> CleaningStages.renameLastColumn("X").apply(TabularDataset.builder().build()));
  }

  @Test void testRenameOntoExistingColumnFails() {
    assertThrows(DatasetException.class,
        () -> CleaningStages.renameLastColumn("Key").apply(dataset()));
    assertThrows(DatasetException.class,
        () -> CleaningStages.renameIfPresent("Code", "Note").apply(dataset()));
    assertThrows(DatasetException.class,
        () -> CleaningStages.renameColumn("Key", "Code").apply(dataset()));
  }

  @Test void testStageOnMissingColumnFails() {
    assertThrows(MissingColumnException.class,
        () -> CleaningStages.mapColumn("Email", value -> value).apply(dataset()));
  }

  @Test void testMapCellsReceivesRowIndex() {
    TabularDataset result = CleaningStages
        .mapCells("rowIndex", "Code", (value, row) -> value + "" + row)
        .apply(dataset());

    assertEquals(Arrays.asList("M0", "S1", "X2"), result.getColumn("Code"));
  }

  @Test void testPipelineAppliesStagesInOrder() {
    CleaningPipeline pipeline = CleaningPipeline.builder()
        .stage(CleaningStages.dropMissing("Key"))
        .stage(CleaningStages.renameColumn("Code", "Status"))
        .stage(CleaningStages.replaceValues("Status", ImmutableMap.of("M", "Married")))
        .build();

    TabularDataset result = pipeline.apply(dataset());

    assertEquals(3, pipeline.getStages().size());
    assertEquals(Arrays.asList("Married", "X"), result.getColumn("Status"));
  }

  @Test void testStagesDescribeThemselves() {
    assertEquals("dropMissing(Key)", CleaningStages.dropMissing("Key").describe());
    assertEquals("rename(A -> B)", CleaningStages.renameColumn("A", "B").describe());
  }
}
