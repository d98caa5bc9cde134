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
 * Dataset cleaner backed by a fixed {@link CleaningPipeline}.
 */
public abstract class PipelineDatasetCleaner implements DatasetCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineDatasetCleaner.class);

  private final String name;
  private final CleaningPipeline pipeline;

  protected PipelineDatasetCleaner(String name, CleaningPipeline pipeline) {
    this.name = name;
    this.pipeline = pipeline;
  }

  @Override public TabularDataset clean(TabularDataset dataset) {
    LOGGER.info("Cleaning {} data...", name);
    TabularDataset cleaned = pipeline.apply(dataset);
    LOGGER.info("Data cleaning complete for {} data: {} of {} rows kept",
        name, cleaned.getRowCount(), dataset.getRowCount());
    return cleaned;
  }

  @Override public String getName() {
    return name;
  }

  public CleaningPipeline getPipeline() {
    return pipeline;
  }

  @Override public String toString() {
    return getClass().getSimpleName() + "{name='" + name + "', stages="
        + pipeline.getStages().size() + "}";
  }
}
