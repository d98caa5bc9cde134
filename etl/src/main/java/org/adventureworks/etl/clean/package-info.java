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

/**
 * Cleaning engine for the AdventureWorks e-commerce extracts.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link org.adventureworks.etl.clean.CleaningOrchestrator} - Entry point: raw
 *       dataset and source name in, cleaned dataset out</li>
 *   <li>{@link org.adventureworks.etl.clean.DataCleaner} - Routes a source name to its
 *       cleaner; unknown sources pass through unchanged</li>
 *   <li>{@link org.adventureworks.etl.clean.DatasetIdentity} - The known source files and
 *       the cleaner bound to each</li>
 *   <li>{@link org.adventureworks.etl.clean.CleaningPipeline} - Ordered list of
 *       {@link org.adventureworks.etl.clean.CleaningStage}s; each stage returns a new dataset</li>
 * </ul>
 *
 * <h2>Cleaners</h2>
 * <ul>
 *   <li>{@link org.adventureworks.etl.clean.CustomersCleaner} - customers.csv</li>
 *   <li>{@link org.adventureworks.etl.clean.CustomerSocialMediaCleaner} - customers_new.csv,
 *       one-hot encodes social media accounts</li>
 *   <li>{@link org.adventureworks.etl.clean.SalesCleaner} - sales_2015.csv, sales_2016.csv,
 *       sales_2017.csv</li>
 *   <li>{@link org.adventureworks.etl.clean.ReturnsCleaner} - returns.csv</li>
 *   <li>{@link org.adventureworks.etl.clean.ProductsCleaner} - products.csv</li>
 * </ul>
 *
 * <p>Cleaners hold no state. Malformed field values become sentinels
 * ({@code 1900-01-01}, empty string); a missing column raises
 * {@link org.adventureworks.etl.table.MissingColumnException} and a value that cannot
 * be mapped raises {@link org.adventureworks.etl.clean.StructuralMismatchException}.
 */
package org.adventureworks.etl.clean;
