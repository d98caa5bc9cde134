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
package org.adventureworks.etl.storage;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for LocalFileStorageProvider.
 */
@Tag("unit")
public class LocalFileStorageProviderTest {

  @TempDir
  Path tempDir;

  private final LocalFileStorageProvider storage = new LocalFileStorageProvider();

  @Test void testWriteCreatesParentDirectoriesAndReadsBack() throws IOException {
    String path = storage.resolvePath(tempDir.toString(), "processed/customers_processed.csv");
    byte[] content = "11000,Jon\n".getBytes(StandardCharsets.UTF_8);

    storage.writeFile(path, content);

    assertTrue(storage.exists(path));
    assertArrayEquals(content, storage.readAllBytes(path));
  }

  @Test void testExistsIsFalseForMissingFileAndDirectory() throws IOException {
    assertFalse(storage.exists(tempDir.resolve("missing.csv").toString()));
    assertFalse(storage.exists(tempDir.toString()));
  }

  @Test void testFileUrisAreAccepted() throws IOException {
    Path file = tempDir.resolve("returns.csv");
    Files.write(file, "x".getBytes(StandardCharsets.UTF_8));

    assertTrue(storage.exists(file.toUri().toString()));
    assertEquals("x", new String(storage.readAllBytes(file.toUri().toString()),
        StandardCharsets.UTF_8));
  }

  @Test void testResolvePath() {
    assertEquals(tempDir.resolve("a.csv").toString(),
        storage.resolvePath(tempDir.toString(), "a.csv"));
    String absolute = tempDir.resolve("b.csv").toAbsolutePath().toString();
    assertEquals(absolute, storage.resolvePath("/elsewhere", absolute));
  }

  @Test void testMissingFileCannotBeOpened() {
    assertThrows(IOException.class,
        () -> storage.readAllBytes(tempDir.resolve("missing.csv").toString()));
  }

  @Test void testStorageType() {
    assertEquals("local", storage.getStorageType());
  }
}
