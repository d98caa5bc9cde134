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

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered, immutable sequence of {@link CleaningStage}s.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CleaningPipeline pipeline = CleaningPipeline.builder()
 *     .stage(CleaningStages.dropMissing("ProductKey"))
 *     .stage(CleaningStages.mapColumn("ProductKey", FieldNormalizers::normalizeNumeric))
 *     .build();
 *
 * TabularDataset cleaned = pipeline.apply(raw);
 * }</pre>
 */
public class CleaningPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(CleaningPipeline.class);

  private final ImmutableList<CleaningStage> stages;

  private CleaningPipeline(Builder builder) {
    this.stages = builder.stages.build();
  }

  public List<CleaningStage> getStages() {
    return stages;
  }

  /**
   * Runs every stage in order.
   *
   * @param dataset Input dataset
   * @return The output of the last stage
   */
  public TabularDataset apply(TabularDataset dataset) {
    TabularDataset current = dataset;
    for (CleaningStage stage : stages) {
      int before = current.getRowCount();
      current = stage.apply(current);
      if (current.getRowCount() != before) {
        LOGGER.debug("Stage {} dropped {} of {} rows",
            stage.describe(), before - current.getRowCount(), before);
      } else {
        LOGGER.trace("Stage {} applied to {} rows", stage.describe(), before);
      }
    }
    return current;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for CleaningPipeline.
   */
  public static class Builder {
    private final ImmutableList.Builder<CleaningStage> stages = ImmutableList.builder();

    public Builder stage(CleaningStage stage) {
      stages.add(stage);
      return this;
    }

    public CleaningPipeline build() {
      return new CleaningPipeline(this);
    }
  }
}
