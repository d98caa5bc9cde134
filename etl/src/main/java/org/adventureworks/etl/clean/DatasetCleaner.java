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
 * Cleans one kind of AdventureWorks extract.
 *
 * <p>Implementations are stateless and deterministic: the same input dataset
 * always yields an equal output dataset, and the input is never modified.
 * A failure aborts the whole call; no partially cleaned dataset is returned.
 *
 * @see DatasetIdentity
 * @see DataCleaner
 */
public interface DatasetCleaner {

  /**
   * Cleans a dataset.
   *
   * @param dataset Raw dataset
   * @return Cleaned dataset
   * @throws org.adventureworks.etl.table.MissingColumnException if a required column is absent
   * @throws StructuralMismatchException if a present value cannot be cleaned
   */
  TabularDataset clean(TabularDataset dataset);

  /**
   * Returns a short human-readable name, e.g. "customers".
   */
  String getName();
}
