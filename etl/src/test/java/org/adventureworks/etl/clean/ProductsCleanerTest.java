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

import org.adventureworks.etl.table.TabularDataset;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for ProductsCleaner.
 */
@Tag("unit")
public class ProductsCleanerTest {

  private static final List<String> HEADER = Arrays.asList(
      "ProductKey", "ProductSubcategoryKey", "ProductSKU", "ProductName", "ModelName",
      "ProductDescription", "ProductColor", "ProductSize", "ProductStyle", "ProductCost",
      "ProductPrice");

  @Test void testFillsMissingValues() {
    List<List<Object>> rows = new ArrayList<List<Object>>();
    rows.add(Arrays.<Object>asList("214", "31", null, null, null, null, null, null, null,
        "13.0863", "34.99"));
    TabularDataset result = ProductsCleaner.INSTANCE.clean(TabularDataset.fromRows(HEADER, rows));

    assertEquals("Unknown", result.getValue(0, "ProductSKU"));
    assertEquals("Unknown", result.getValue(0, "ProductName"));
    assertEquals("Unknown", result.getValue(0, "ModelName"));
    assertEquals("No Description", result.getValue(0, "ProductDescription"));
    assertEquals("NA", result.getValue(0, "ProductColor"));
    assertEquals("NA", result.getValue(0, "ProductSize"));
    assertEquals("NA", result.getValue(0, "ProductStyle"));
  }

  @Test void testZeroSizeAndStyleBecomeNotApplicable() {
    List<List<Object>> rows = new ArrayList<List<Object>>();
    rows.add(Arrays.<Object>asList("214", "31", "HL-U509-R", "Sport-100 Helmet, Red",
        "Sport-100", "Universal fit", "Red", "0", "0", "13.0863", "34.99"));
    rows.add(Arrays.<Object>asList("215", "31", "HL-U509", "Sport-100 Helmet, Black",
        "Sport-100", "Universal fit", "Black", "M", "U", "13.0863", "34.99"));
    TabularDataset result = ProductsCleaner.INSTANCE.clean(TabularDataset.fromRows(HEADER, rows));

    assertEquals(Arrays.asList("NA", "M"), result.getColumn("ProductSize"));
    assertEquals(Arrays.asList("NA", "U"), result.getColumn("ProductStyle"));
    assertEquals("Red", result.getValue(0, "ProductColor"));
  }

  @Test void testNumericColumnsKeepDigitsAsText() {
    List<List<Object>> rows = new ArrayList<List<Object>>();
    rows.add(Arrays.<Object>asList("P-214", "#31", "SKU", "Name", "Model", "Desc", "Red",
        "M", "U", "13.0863", "$34.99"));
    TabularDataset result = ProductsCleaner.INSTANCE.clean(TabularDataset.fromRows(HEADER, rows));

    assertEquals("214", result.getValue(0, "ProductKey"));
    assertEquals("31", result.getValue(0, "ProductSubcategoryKey"));
    assertEquals("130863", result.getValue(0, "ProductCost"));
    assertEquals("3499", result.getValue(0, "ProductPrice"));
  }

  @Test void testRowsWithMissingProductKeyAreDropped() {
    List<List<Object>> rows = new ArrayList<List<Object>>();
    rows.add(Arrays.<Object>asList(null, "31", "SKU", "Name", "Model", "Desc", "Red",
        "M", "U", "1", "2"));
    rows.add(Arrays.<Object>asList("7", "31", "SKU", "Name", "Model", "Desc", "Red",
        "M", "U", "1", "2"));
    TabularDataset result = ProductsCleaner.INSTANCE.clean(TabularDataset.fromRows(HEADER, rows));

    assertEquals(1, result.getRowCount());
    assertEquals("7", result.getValue(0, "ProductKey"));
  }
}
