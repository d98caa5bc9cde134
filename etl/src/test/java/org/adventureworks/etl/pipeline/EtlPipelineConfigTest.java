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

import org.adventureworks.etl.warehouse.WarehouseConfig;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for EtlPipelineConfig.
 */
@Tag("unit")
public class EtlPipelineConfigTest {

  @Test void testBuilderDefaults() {
    EtlPipelineConfig config = EtlPipelineConfig.builder()
        .warehouse(WarehouseConfig.builder().engine("duckdb").build())
        .build();

    assertEquals("s3://e-commerce-processed/", config.getTargetLocation());
    assertEquals(StandardCharsets.ISO_8859_1, config.getSourceCharset());
    assertNull(config.getSourceRoot());
    assertEquals(0, config.getStorageConfig().size());
  }

  @Test void testWarehouseIsRequired() {
    assertThrows(IllegalArgumentException.class, () -> EtlPipelineConfig.builder().build());
  }

  @Test void testFromMap() {
    Map<String, Object> warehouse = new HashMap<String, Object>();
    warehouse.put("engine", "duckdb");
    warehouse.put("path", "/tmp/wh.duckdb");
    Map<String, Object> storage = new HashMap<String, Object>();
    storage.put("region", "eu-west-1");
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("targetLocation", "/data/processed");
    map.put("sourceRoot", "/data/raw");
    map.put("sourceCharset", "UTF-8");
    map.put("storage", storage);
    map.put("warehouse", warehouse);

    EtlPipelineConfig config = EtlPipelineConfig.fromMap(map);

    assertEquals("/data/processed", config.getTargetLocation());
    assertEquals("/data/raw", config.getSourceRoot());
    assertEquals(StandardCharsets.UTF_8, config.getSourceCharset());
    assertEquals("eu-west-1", config.getStorageConfig().get("region"));
    assertEquals("duckdb", config.getWarehouse().getEngine());
    assertEquals("/tmp/wh.duckdb", config.getWarehouse().getPath());
  }

  @Test void testUnknownCharsetIsRejected() {
    Map<String, Object> warehouse = new HashMap<String, Object>();
    warehouse.put("engine", "duckdb");
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("sourceCharset", "NOT-A-CHARSET");
    map.put("warehouse", warehouse);

    assertThrows(IllegalArgumentException.class, () -> EtlPipelineConfig.fromMap(map));
  }

  @Test void testLoadYamlFile(@TempDir Path tempDir) throws IOException {
    Path file = tempDir.resolve("etl-config.yaml");
    Files.write(file, ("targetLocation: \"s3://processed-bucket/\"\n"
        + "warehouse:\n"
        + "  engine: redshift\n"
        + "  host: analytics.example.com\n"
        + "  port: 5439\n"
        + "  database: adventureworks\n"
        + "  user: etl_loader\n"
        + "  password: secret\n"
        + "  iamRole: arn:aws:iam::123456789012:role/RedshiftCopy\n")
        .getBytes(StandardCharsets.UTF_8));

    EtlPipelineConfig config = EtlPipelineConfig.load(file);

    assertEquals("s3://processed-bucket/", config.getTargetLocation());
    assertEquals(Integer.valueOf(5439), config.getWarehouse().getPort());
    assertEquals("secret", config.getWarehouse().getPassword());
  }

  @Test void testLoadBundledExample() throws IOException {
    try (InputStream in = getClass().getResourceAsStream("/etl-config.example.yaml")) {
      assertNotNull(in);
      EtlPipelineConfig config = EtlPipelineConfig.load(in);

      assertEquals(EtlPipelineConfig.DEFAULT_TARGET_LOCATION, config.getTargetLocation());
      assertEquals("redshift", config.getWarehouse().getEngine());
      assertEquals("us-east-1", config.getStorageConfig().get("region"));
    }
  }

  @Test void testEmptyYamlIsRejected() {
    assertThrows(IOException.class, () -> EtlPipelineConfig.load(
        new ByteArrayInputStream(new byte[0])));
  }
}
