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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the command-line entry point against local storage and DuckDB.
 */
@Tag("integration")
public class EtlMainTest {

  @TempDir
  Path tempDir;

  private Path writeConfig(Path database) throws Exception {
    Path config = tempDir.resolve("etl-config.yaml");
    Files.write(config, ("targetLocation: \"" + tempDir.resolve("processed") + "\"\n"
        + "sourceRoot: \"" + tempDir + "\"\n"
        + "warehouse:\n"
        + "  engine: duckdb\n"
        + "  path: \"" + database + "\"\n").getBytes(StandardCharsets.UTF_8));
    return config;
  }

  private Path writeEvent(String bucket, String key) throws Exception {
    Path event = tempDir.resolve("event.json");
    Files.write(event, StorageEventTest.eventJson(bucket, key).getBytes(StandardCharsets.UTF_8));
    return event;
  }

  @Test void testUsageError() {
    assertEquals(EtlMain.EXIT_USAGE, EtlMain.run(new String[0]));
    assertEquals(EtlMain.EXIT_USAGE, EtlMain.run(new String[] {"only-config.yaml"}));
  }

  @Test void testUnreadableConfigIsUsageError() throws Exception {
    Path event = writeEvent("raw", "returns.csv");

    assertEquals(EtlMain.EXIT_USAGE, EtlMain.run(new String[] {
        tempDir.resolve("missing.yaml").toString(), event.toString()}));
  }

  @Test void testEndToEndReturnsLoad() throws Exception {
    Path database = tempDir.resolve("warehouse.duckdb");
    String url = "jdbc:duckdb:" + database;
    try (Connection connection = DriverManager.getConnection(url);
         Statement statement = connection.createStatement()) {
      statement.execute("CREATE TABLE returns (ReturnDate DATE, TerritoryKey VARCHAR,"
          + " ProductKey VARCHAR, ReturnQuantity INTEGER)");
    }
    Path raw = tempDir.resolve("raw");
    Files.createDirectories(raw);
    Files.write(raw.resolve("returns.csv"), ("ReturnDate,TerritoryKey,ProductKey,ReturnQuantity\n"
        + "1/18/2015,9,312,1\n"
        + "1/18/2015,10,310,0\n"
        + "2/30/2015,1,311,2\n").getBytes(StandardCharsets.ISO_8859_1));

    int exit = EtlMain.run(new String[] {
        writeConfig(database).toString(), writeEvent("raw", "returns.csv").toString()});

    assertEquals(EtlMain.EXIT_OK, exit);
    assertTrue(Files.exists(tempDir.resolve("processed").resolve("returns_processed.csv")));
    try (Connection connection = DriverManager.getConnection(url);
         Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(
             "SELECT COUNT(*), SUM(ReturnQuantity), MIN(ReturnDate) FROM returns")) {
      assertTrue(rs.next());
      assertEquals(2, rs.getInt(1));
      assertEquals(3, rs.getInt(2));
      assertEquals("1900-01-01", rs.getString(3));
    }
  }

  @Test void testEndToEndFailureExitCode() throws Exception {
    Path database = tempDir.resolve("warehouse.duckdb");
    Path raw = tempDir.resolve("raw");
    Files.createDirectories(raw);
    Files.write(raw.resolve("products.csv"), "ProductKey\n1\n".getBytes(StandardCharsets.UTF_8));

    assertEquals(EtlMain.EXIT_FAILED, EtlMain.run(new String[] {
        writeConfig(database).toString(), writeEvent("raw", "products.csv").toString()}));
  }
}
