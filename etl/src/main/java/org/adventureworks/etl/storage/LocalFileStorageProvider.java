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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Storage provider backed by the local filesystem.
 *
 * <p>Accepts plain paths and {@code file:} URIs. Used for local runs and tests.
 */
public class LocalFileStorageProvider implements StorageProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileStorageProvider.class);

  private static final String FILE_SCHEME = "file:";

  @Override public InputStream openInputStream(String path) throws IOException {
    return Files.newInputStream(toPath(path));
  }

  @Override public boolean exists(String path) throws IOException {
    return Files.isRegularFile(toPath(path));
  }

  @Override public void writeFile(String path, byte[] content) throws IOException {
    Path target = toPath(path);
    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.write(target, content);
    LOGGER.debug("Wrote {} bytes to {}", content.length, target);
  }

  @Override public String getStorageType() {
    return "local";
  }

  @Override public String resolvePath(String basePath, String relativePath) {
    if (relativePath.startsWith(FILE_SCHEME) || Paths.get(relativePath).isAbsolute()) {
      return relativePath;
    }
    return toPath(basePath).resolve(relativePath).toString();
  }

  static Path toPath(String path) {
    if (path.startsWith(FILE_SCHEME)) {
      return Paths.get(URI.create(path));
    }
    return Paths.get(path);
  }
}
