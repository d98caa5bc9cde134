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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a dataset to the cleaner for its source.
 *
 * <p>Unknown sources are not an error: the input dataset is returned as is.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TabularDataset cleaned = DataCleaner.INSTANCE.clean(raw, "sales_2016.csv");
 * }</pre>
 *
 * @see DatasetIdentity
 */
public class DataCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(DataCleaner.class);

  public static final DataCleaner INSTANCE = new DataCleaner();

  /**
   * Cleans a dataset according to its source name.
   *
   * @param dataset Raw dataset
   * @param sourceName File name or object key the dataset was read from
   * @return The cleaned dataset, or {@code dataset} itself if the source is unknown
   * @throws org.adventureworks.etl.table.DatasetException if cleaning fails
   */
  public TabularDataset clean(TabularDataset dataset, String sourceName) {
    DatasetIdentity identity = DatasetIdentity.fromSourceName(sourceName);
    if (identity == null) {
      LOGGER.info("No cleaning required for file: {}", sourceName);
      return dataset;
    }
    return clean(dataset, identity);
  }

  /**
   * Cleans a dataset with the cleaner bound to a known identity.
   *
   * @param dataset Raw dataset
   * @param identity Dataset identity
   * @return The cleaned dataset
   */
  public TabularDataset clean(TabularDataset dataset, DatasetIdentity identity) {
    LOGGER.info("Cleaning data for file: {}", identity.getFileName());
    return identity.getCleaner().clean(dataset);
  }
}
