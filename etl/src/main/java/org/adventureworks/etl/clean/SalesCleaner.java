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

import static org.adventureworks.etl.clean.CleaningStages.deriveColumn;
import static org.adventureworks.etl.clean.CleaningStages.dropMissing;
import static org.adventureworks.etl.clean.CleaningStages.mapColumn;
import static org.adventureworks.etl.clean.CleaningStages.renameLastColumn;

/**
 * Cleans any of the yearly sales extracts.
 *
 * <p>Some yearly extracts carry the quantity under a different header, so the
 * last column is always renamed to {@code OrderQuantity}. {@code OrderYear} is
 * appended from the normalized order date; an unparseable order date yields
 * the sentinel year 1900.
 */
public class SalesCleaner extends PipelineDatasetCleaner {

  public static final String ORDER_QUANTITY = "OrderQuantity";
  public static final String PRODUCT_KEY = "ProductKey";
  public static final String CUSTOMER_KEY = "CustomerKey";
  public static final String TERRITORY_KEY = "TerritoryKey";
  public static final String ORDER_LINE_ITEM = "OrderLineItem";
  public static final String ORDER_DATE = "OrderDate";
  public static final String STOCK_DATE = "StockDate";
  public static final String ORDER_YEAR = "OrderYear";

  public static final SalesCleaner INSTANCE = new SalesCleaner();

  public SalesCleaner() {
    super("customer sales", CleaningPipeline.builder()
        .stage(renameLastColumn(ORDER_QUANTITY))
        .stage(dropMissing(ORDER_QUANTITY))
        .stage(mapColumn(ORDER_QUANTITY, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(PRODUCT_KEY, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(CUSTOMER_KEY, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(TERRITORY_KEY, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(ORDER_LINE_ITEM, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(ORDER_DATE, FieldNormalizers::normalizeDate))
        .stage(mapColumn(STOCK_DATE, FieldNormalizers::normalizeDate))
        .stage(deriveColumn(ORDER_YEAR, ORDER_DATE, FieldNormalizers::yearOf))
        .build());
  }
}
