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

import com.google.common.base.Splitter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.adventureworks.etl.clean.CleaningStages.dropMissing;
import static org.adventureworks.etl.clean.CleaningStages.fillMissing;

/**
 * Cleans the extended customers extract that lists each customer's social
 * media accounts.
 *
 * <p>The comma separated {@code Social Media Accounts} column is expanded into
 * one Boolean indicator column per distinct account name observed in the
 * input. The output schema therefore depends on the data: it is
 * {@code CustomerKey} followed by the indicator columns in name order, and all
 * other input columns are dropped. Customers without accounts get the
 * {@code NoSocialMedia} indicator.
 */
public class CustomerSocialMediaCleaner extends PipelineDatasetCleaner {

  public static final String CUSTOMER_KEY = "CustomerKey";
  public static final String SOCIAL_MEDIA_ACCOUNTS = "Social Media Accounts";
  public static final String NO_SOCIAL_MEDIA = "NoSocialMedia";

  /** Separator between account names within one cell. */
  public static final String ACCOUNT_SEPARATOR = ", ";

  private static final Splitter ACCOUNT_SPLITTER =
      Splitter.on(ACCOUNT_SEPARATOR).omitEmptyStrings();

  public static final CustomerSocialMediaCleaner INSTANCE = new CustomerSocialMediaCleaner();

  public CustomerSocialMediaCleaner() {
    super("customers social media", CleaningPipeline.builder()
        .stage(dropMissing(CUSTOMER_KEY))
        .stage(fillMissing(SOCIAL_MEDIA_ACCOUNTS, NO_SOCIAL_MEDIA))
        .stage(new OneHotStage(CUSTOMER_KEY, SOCIAL_MEDIA_ACCOUNTS))
        .build());
  }

  /**
   * Replaces a multi-valued column with one Boolean column per distinct value,
   * keeping only the key column alongside.
   */
  static class OneHotStage extends CleaningStages.NamedStage {
    private final String keyColumn;
    private final String valuesColumn;

    OneHotStage(String keyColumn, String valuesColumn) {
      super("oneHot(" + valuesColumn + ")");
      this.keyColumn = keyColumn;
      this.valuesColumn = valuesColumn;
    }

    @Override public TabularDataset apply(TabularDataset dataset) {
      List<Object> keys = dataset.getColumn(keyColumn);
      List<Object> cells = dataset.getColumn(valuesColumn);

      List<Set<String>> perRow = new ArrayList<Set<String>>(cells.size());
      Set<String> distinct = new TreeSet<String>();
      for (Object cell : cells) {
        Set<String> accounts = new LinkedHashSet<String>();
        if (cell != null) {
          for (String account : ACCOUNT_SPLITTER.split(cell.toString())) {
            accounts.add(account);
          }
        }
        perRow.add(accounts);
        distinct.addAll(accounts);
      }
      for (int row = 0; row < perRow.size(); row++) {
        if (perRow.get(row).contains(keyColumn)) {
          throw new StructuralMismatchException(valuesColumn, row,
              "account name collides with key column '" + keyColumn + "'");
        }
      }

      TabularDataset.Builder builder = TabularDataset.builder().column(keyColumn, keys);
      for (String account : distinct) {
        List<Boolean> indicator = new ArrayList<Boolean>(perRow.size());
        for (Set<String> accounts : perRow) {
          indicator.add(accounts.contains(account));
        }
        builder.column(account, indicator);
      }
      return builder.build();
    }
  }
}
