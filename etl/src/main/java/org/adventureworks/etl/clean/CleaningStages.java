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

import org.adventureworks.etl.normalize.NullEquivalents;
import org.adventureworks.etl.table.DatasetException;
import org.adventureworks.etl.table.MissingColumnException;
import org.adventureworks.etl.table.TabularDataset;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Factory for the generic {@link CleaningStage}s that dataset cleaners are built from.
 */
public final class CleaningStages {

  private CleaningStages() {
    // Utility class
  }

  /**
   * Transforms one cell, knowing its row index.
   */
  @FunctionalInterface
  public interface CellTransform {
    @Nullable Object transform(@Nullable Object value, int row);
  }

  /** Drops every row whose value in {@code column} is missing. */
  public static CleaningStage dropMissing(String column) {
    return filterRows("dropMissing(" + column + ")", column,
        value -> !NullEquivalents.isMissing(value));
  }

  /** Keeps only the rows whose value in {@code column} satisfies {@code keep}. */
  public static CleaningStage filterRows(String description, String column,
      Predicate<@Nullable Object> keep) {
    return new NamedStage(description) {
      @Override public TabularDataset apply(TabularDataset dataset) {
        List<Object> values = dataset.getColumn(column);
        return dataset.filterRows(row -> keep.test(values.get(row)));
      }
    };
  }

  /** Replaces every cell of {@code column} with {@code function(cell)}. */
  public static CleaningStage mapColumn(String column, Function<@Nullable Object, ?> function) {
    return mapCells("map(" + column + ")", column, (value, row) -> function.apply(value));
  }

  /** Replaces every cell of {@code column}, passing the row index to the transform. */
  public static CleaningStage mapCells(String description, String column, CellTransform transform) {
    return new NamedStage(description) {
      @Override public TabularDataset apply(TabularDataset dataset) {
        List<Object> values = dataset.getColumn(column);
        List<Object> mapped = new ArrayList<Object>(values.size());
        for (int row = 0; row < values.size(); row++) {
          mapped.add(transform.transform(values.get(row), row));
        }
        return dataset.withColumn(column, mapped);
      }
    };
  }

  /**
   * Replaces string cells that exactly match a key of {@code replacements};
   * other cells pass through unchanged.
   */
  public static CleaningStage replaceValues(String column, Map<String, String> replacements) {
    ImmutableMap<String, String> copy = ImmutableMap.copyOf(replacements);
    return mapCells("replace(" + column + ", " + copy + ")", column, (value, row) -> {
      if (value instanceof String && copy.containsKey(value)) {
        return copy.get(value);
      }
      return value;
    });
  }

  /** Replaces missing cells of {@code column} with {@code fill}. */
  public static CleaningStage fillMissing(String column, Object fill) {
    return mapCells("fillMissing(" + column + ", " + fill + ")", column,
        (value, row) -> NullEquivalents.isMissing(value) ? fill : value);
  }

  /** Sets {@code column} to {@code constant} in every row, adding the column if absent. */
  public static CleaningStage setConstant(String column, Object constant) {
    return new NamedStage("setConstant(" + column + ", " + constant + ")") {
      @Override public TabularDataset apply(TabularDataset dataset) {
        return dataset.withColumn(column,
            Collections.nCopies(dataset.getRowCount(), constant));
      }
    };
  }

  /**
   * Adds (or replaces) {@code target} with values computed from the cells of {@code source}.
   */
  public static CleaningStage deriveColumn(String target, String source,
      Function<@Nullable Object, ?> function) {
    return new NamedStage("derive(" + target + " <- " + source + ")") {
      @Override public TabularDataset apply(TabularDataset dataset) {
        List<Object> values = dataset.getColumn(source);
        List<Object> derived = new ArrayList<Object>(values.size());
        for (Object value : values) {
          derived.add(function.apply(value));
        }
        return dataset.withColumn(target, derived);
      }
    };
  }

  /** Renames {@code from} to {@code to}; fails if {@code from} is absent or {@code to} is taken. */
  public static CleaningStage renameColumn(String from, String to) {
    return new NamedStage("rename(" + from + " -> " + to + ")") {
      @Override public TabularDataset apply(TabularDataset dataset) {
        return rename(dataset, from, to);
      }
    };
  }

  /** Renames {@code from} to {@code to} when {@code from} exists; otherwise a no-op. */
  public static CleaningStage renameIfPresent(String from, String to) {
    return new NamedStage("renameIfPresent(" + from + " -> " + to + ")") {
      @Override public TabularDataset apply(TabularDataset dataset) {
        return dataset.hasColumn(from) ? rename(dataset, from, to) : dataset;
      }
    };
  }

  /** Renames the last column to {@code name} unless it already has that name. */
  public static CleaningStage renameLastColumn(String name) {
    return new NamedStage("renameLast(" + name + ")") {
      @Override public TabularDataset apply(TabularDataset dataset) {
        String last = dataset.getLastColumnName();
        if (last == null) {
          throw new MissingColumnException(name, dataset.getColumnNames());
        }
        return rename(dataset, last, name);
      }
    };
  }

  private static TabularDataset rename(TabularDataset dataset, String from, String to) {
    if (!from.equals(to) && dataset.hasColumn(to)) {
      throw new DatasetException("Cannot rename column '" + from + "' to '" + to
          + "': a column with that name already exists; columns: " + dataset.getColumnNames());
    }
    return dataset.renameColumn(from, to);
  }

  /**
   * Base class giving anonymous stages a readable description.
   */
  abstract static class NamedStage implements CleaningStage {
    private final String description;

    NamedStage(String description) {
      this.description = description;
    }

    @Override public String describe() {
      return description;
    }

    @Override public String toString() {
      return description;
    }
  }
}
