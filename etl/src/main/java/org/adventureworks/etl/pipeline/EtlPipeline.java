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
package org.adventureworks.etl.pipeline;

import org.adventureworks.etl.clean.CleaningOrchestrator;
import org.adventureworks.etl.format.csv.CsvDatasetReader;
import org.adventureworks.etl.format.csv.CsvDatasetWriter;
import org.adventureworks.etl.storage.StorageProvider;
import org.adventureworks.etl.storage.StorageProviderFactory;
import org.adventureworks.etl.table.TabularDataset;
import org.adventureworks.etl.warehouse.JdbcWarehouseLoader;
import org.adventureworks.etl.warehouse.WarehouseLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Runs one extract, clean and load cycle for a storage event.
 *
 * <p>EtlPipeline coordinates the full process:
 * <ol>
 *   <li>Extract - Read the raw CSV object named by the event</li>
 *   <li>Clean - Apply the cleaner registered for the file name</li>
 *   <li>Stage - Write {@code <table>_processed.csv} to the target location</li>
 *   <li>Load - Bulk load the staged file into table {@code <table>}</li>
 * </ol>
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * EtlPipelineConfig config = EtlPipelineConfig.load(Paths.get("etl-config.yaml"));
 * EtlPipeline pipeline = EtlPipeline.create(config);
 *
 * EtlResult result = pipeline.execute(StorageEvent.fromJson(eventJson));
 * System.out.println(result.getStatusCode() + " " + result.getBody());
 * }</pre>
 *
 * <h3>Error Handling</h3>
 * <p>Every failure is logged and reported as a result with status 500; no
 * exception escapes {@link #execute}. A staged file written before a failed
 * load is left in place.
 *
 * @see EtlPipelineConfig
 * @see EtlResult
 */
public class EtlPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(EtlPipeline.class);

  private static final String PROCESSED_SUFFIX = "_processed.csv";

  private final EtlPipelineConfig config;
  private final StorageProvider storageProvider;
  private final WarehouseLoader warehouseLoader;
  private final CleaningOrchestrator orchestrator;
  private final CsvDatasetReader reader;
  private final CsvDatasetWriter writer;

  /**
   * Creates a new pipeline with the default cleaning engine and CSV codec.
   *
   * @param config Pipeline configuration
   * @param storageProvider Storage provider for reading sources and writing staged files
   * @param warehouseLoader Loader for the target warehouse
   */
  public EtlPipeline(EtlPipelineConfig config, StorageProvider storageProvider,
      WarehouseLoader warehouseLoader) {
    this(config, storageProvider, warehouseLoader, new CleaningOrchestrator(),
        new CsvDatasetReader(), new CsvDatasetWriter());
  }

  public EtlPipeline(EtlPipelineConfig config, StorageProvider storageProvider,
      WarehouseLoader warehouseLoader, CleaningOrchestrator orchestrator,
      CsvDatasetReader reader, CsvDatasetWriter writer) {
    this.config = config;
    this.storageProvider = storageProvider;
    this.warehouseLoader = warehouseLoader;
    this.orchestrator = orchestrator;
    this.reader = reader;
    this.writer = writer;
  }

  /**
   * Creates a pipeline whose storage provider is chosen from the target
   * location and whose loader connects to the configured warehouse.
   */
  public static EtlPipeline create(EtlPipelineConfig config) {
    StorageProvider storage = StorageProviderFactory.createFromUrl(
        config.getTargetLocation(), config.getStorageConfig());
    return new EtlPipeline(config, storage, new JdbcWarehouseLoader(config.getWarehouse()));
  }

  /**
   * Executes the pipeline for one event.
   *
   * @param event Object-created event naming the raw file
   * @return Result with status 200 on success or 500 on failure
   */
  public EtlResult execute(StorageEvent event) {
    LOGGER.info("Pipeline triggered with event: {}", event);
    long startTime = System.currentTimeMillis();

    try {
      String sourcePath = resolveSourcePath(event);
      LOGGER.info("Bucket name: {}, File path: {}", event.getBucket(), event.getKey());

      if (!storageProvider.exists(sourcePath)) {
        throw new IOException("File " + event.getKey() + " not found in bucket "
            + event.getBucket());
      }
      byte[] content = storageProvider.readAllBytes(sourcePath);
      LOGGER.info("Successfully read file from storage: {} ({} bytes)", sourcePath,
          content.length);

      TabularDataset raw = reader.read(content, config.getSourceCharset());
      LOGGER.info("CSV file loaded. Columns: {}", raw.getColumnNames());

      TabularDataset cleaned = orchestrator.process(raw, event.getFileName());

      String tableName = event.getTableName();
      String processedLocation = storageProvider.resolvePath(config.getTargetLocation(),
          tableName + PROCESSED_SUFFIX);
      storageProvider.writeFile(processedLocation,
          writer.write(cleaned, CsvDatasetWriter.DEFAULT_CHARSET));
      LOGGER.info("Cleaned data uploaded to: {}", processedLocation);

      warehouseLoader.load(tableName, processedLocation);

      long elapsed = System.currentTimeMillis() - startTime;
      LOGGER.info("Pipeline complete for {}: {} rows loaded into {} in {}ms",
          event.getKey(), cleaned.getRowCount(), tableName, elapsed);
      return EtlResult.success(event.getKey(), tableName, cleaned.getRowCount(),
          processedLocation, elapsed);

    } catch (Exception e) {
      long elapsed = System.currentTimeMillis() - startTime;
      String message = e.getMessage() != null ? e.getMessage() : e.toString();
      LOGGER.error("Error occurred while processing {}: {}", event.getKey(), message, e);
      return EtlResult.failure(event.getKey(), message, elapsed);
    }
  }

  private String resolveSourcePath(StorageEvent event) {
    String sourceRoot = config.getSourceRoot();
    String bucketPath = sourceRoot != null
        ? storageProvider.resolvePath(sourceRoot, event.getBucket())
        : "s3://" + event.getBucket();
    return storageProvider.resolvePath(bucketPath, event.getKey());
  }
}
