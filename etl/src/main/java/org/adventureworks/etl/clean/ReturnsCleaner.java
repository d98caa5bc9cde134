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

import org.adventureworks.etl.normalize.FieldNormalizers;

import static org.adventureworks.etl.clean.CleaningStages.filterRows;
import static org.adventureworks.etl.clean.CleaningStages.mapCells;
import static org.adventureworks.etl.clean.CleaningStages.mapColumn;

/**
 * Cleans the product returns extract.
 *
 * <p>{@code ReturnQuantity} becomes an {@link Integer}. A quantity with no
 * digits at all (including a missing one) cannot be parsed and fails the whole
 * call with a {@link StructuralMismatchException}; rows whose quantity is
 * below 1 are dropped.
 */
public class ReturnsCleaner extends PipelineDatasetCleaner {

  public static final String RETURN_DATE = "ReturnDate";
  public static final String TERRITORY_KEY = "TerritoryKey";
  public static final String PRODUCT_KEY = "ProductKey";
  public static final String RETURN_QUANTITY = "ReturnQuantity";

  public static final ReturnsCleaner INSTANCE = new ReturnsCleaner();

  public ReturnsCleaner() {
    super("returns", CleaningPipeline.builder()
        .stage(mapColumn(RETURN_DATE, FieldNormalizers::normalizeDate))
        .stage(mapColumn(TERRITORY_KEY, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(PRODUCT_KEY, FieldNormalizers::normalizeNumeric))
        .stage(mapCells("parseInt(" + RETURN_QUANTITY + ")", RETURN_QUANTITY,
            ReturnsCleaner::parseQuantity))
        .stage(filterRows("dropReturnQuantityBelowOne", RETURN_QUANTITY,
            value -> (Integer) value >= 1))
        .build());
  }

  private static Object parseQuantity(Object value, int row) {
    String digits = FieldNormalizers.normalizeNumeric(value);
    if (digits.isEmpty()) {
      throw new StructuralMismatchException(RETURN_QUANTITY, row,
          "value '" + value + "' contains no digits");
    }
    try {
      return Integer.valueOf(digits);
    } catch (NumberFormatException e) {
      throw new StructuralMismatchException(RETURN_QUANTITY, row,
          "value '" + value + "' is out of integer range");
    }
  }
}
