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
 * Entry point of the cleaning engine for the surrounding pipeline.
 *
 * <p>Takes a raw dataset and the name of its source and returns the cleaned
 * dataset. Performs no I/O and keeps no state between calls, so one instance
 * can serve concurrent callers working on independent datasets.
 */
public class CleaningOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(CleaningOrchestrator.class);

  private final DataCleaner dataCleaner;

  public CleaningOrchestrator() {
    this(DataCleaner.INSTANCE);
  }

  public CleaningOrchestrator(DataCleaner dataCleaner) {
    this.dataCleaner = dataCleaner;
  }

  /**
   * Cleans a raw dataset.
   *
   * @param raw Dataset as read from the source
   * @param sourceName Source file name or object key
   * @return Cleaned dataset
   * @throws org.adventureworks.etl.table.DatasetException if cleaning fails
   */
  public TabularDataset process(TabularDataset raw, String sourceName) {
    LOGGER.info("Initializing data cleanup for {}: {} rows x {} columns",
        sourceName, raw.getRowCount(), raw.getColumnCount());
    TabularDataset cleaned = dataCleaner.clean(raw, sourceName);
    LOGGER.info("Data cleaning complete. New shape of the dataset: ({}, {})",
        cleaned.getRowCount(), cleaned.getColumnCount());
    return cleaned;
  }
}
