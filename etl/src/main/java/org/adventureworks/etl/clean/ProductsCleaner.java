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

import com.google.common.collect.ImmutableMap;

import static org.adventureworks.etl.clean.CleaningStages.dropMissing;
import static org.adventureworks.etl.clean.CleaningStages.fillMissing;
import static org.adventureworks.etl.clean.CleaningStages.mapColumn;
import static org.adventureworks.etl.clean.CleaningStages.replaceValues;

/**
 * Cleans the products extract.
 *
 * <p>Key, cost and price columns are reduced to their digits but stay text.
 * Missing descriptive fields get a readable placeholder, and a literal
 * {@code "0"} size or style is treated as not applicable.
 */
public class ProductsCleaner extends PipelineDatasetCleaner {

  public static final String PRODUCT_KEY = "ProductKey";
  public static final String PRODUCT_SUBCATEGORY_KEY = "ProductSubcategoryKey";
  public static final String PRODUCT_COST = "ProductCost";
  public static final String PRODUCT_PRICE = "ProductPrice";
  public static final String PRODUCT_SKU = "ProductSKU";
  public static final String PRODUCT_NAME = "ProductName";
  public static final String MODEL_NAME = "ModelName";
  public static final String PRODUCT_DESCRIPTION = "ProductDescription";
  public static final String PRODUCT_COLOR = "ProductColor";
  public static final String PRODUCT_SIZE = "ProductSize";
  public static final String PRODUCT_STYLE = "ProductStyle";

  public static final String UNKNOWN = "Unknown";
  public static final String NO_DESCRIPTION = "No Description";
  public static final String NOT_APPLICABLE = "NA";

  public static final ProductsCleaner INSTANCE = new ProductsCleaner();

  public ProductsCleaner() {
    super("products", CleaningPipeline.builder()
        .stage(dropMissing(PRODUCT_KEY))
        .stage(mapColumn(PRODUCT_KEY, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(PRODUCT_SUBCATEGORY_KEY, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(PRODUCT_COST, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(PRODUCT_PRICE, FieldNormalizers::normalizeNumeric))
        .stage(fillMissing(PRODUCT_SKU, UNKNOWN))
        .stage(fillMissing(PRODUCT_NAME, UNKNOWN))
        .stage(fillMissing(MODEL_NAME, UNKNOWN))
        .stage(fillMissing(PRODUCT_DESCRIPTION, NO_DESCRIPTION))
        .stage(fillMissing(PRODUCT_COLOR, NOT_APPLICABLE))
        .stage(fillMissing(PRODUCT_SIZE, NOT_APPLICABLE))
        .stage(fillMissing(PRODUCT_STYLE, NOT_APPLICABLE))
        .stage(replaceValues(PRODUCT_SIZE, ImmutableMap.of("0", NOT_APPLICABLE)))
        .stage(replaceValues(PRODUCT_STYLE, ImmutableMap.of("0", NOT_APPLICABLE)))
        .build());
  }
}
