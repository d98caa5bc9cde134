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

/**
 * One step of a {@link CleaningPipeline}.
 *
 * <p>A stage is a pure function from dataset to dataset. Stages that drop rows
 * do so through {@link TabularDataset#filterRows}, so every column loses the
 * same rows and row alignment is preserved.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CleaningStage stage = CleaningStages.mapColumn("BirthDate", FieldNormalizers::normalizeDate);
 * TabularDataset cleaned = stage.apply(raw);
 * }</pre>
 *
 * @see CleaningStages
 */
public interface CleaningStage {

  /**
   * Applies this stage.
   *
   * @param dataset Input dataset (not modified)
   * @return Transformed dataset
   * @throws org.adventureworks.etl.table.MissingColumnException if a referenced column is absent
   * @throws StructuralMismatchException if a cell cannot be transformed
   */
  TabularDataset apply(TabularDataset dataset);

  /**
   * Returns a short description used in log messages.
   */
  default String describe() {
    return getClass().getSimpleName();
  }
}
