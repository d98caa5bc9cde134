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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Storage provider interface for abstracting object access across storage systems.
 * Implementations provide access to S3 buckets and the local filesystem.
 */
public interface StorageProvider {

  /**
   * Opens an input stream for reading file content.
   *
   * @param path The file path
   * @return Input stream for the file
   * @throws IOException If an I/O error occurs
   */
  InputStream openInputStream(String path) throws IOException;

  /**
   * Checks if a path exists.
   *
   * @param path The path to check
   * @return true if the path exists
   * @throws IOException If an I/O error occurs
   */
  boolean exists(String path) throws IOException;

  /**
   * Gets the storage type identifier.
   *
   * @return Storage type (e.g., "local", "s3")
   */
  String getStorageType();

  /**
   * Resolves a relative path against a base path.
   *
   * @param basePath The base path (a directory, bucket or prefix)
   * @param relativePath The relative path
   * @return The resolved absolute path
   */
  String resolvePath(String basePath, String relativePath);

  /**
   * Writes content to a file.
   * Creates the file if it doesn't exist, overwrites if it does.
   *
   * @param path The file path
   * @param content The content to write
   * @throws IOException If an I/O error occurs
   */
  void writeFile(String path, byte[] content) throws IOException;

  /**
   * Reads a whole file into memory.
   *
   * @param path The file path
   * @return File content
   * @throws IOException If an I/O error occurs
   */
  default byte[] readAllBytes(String path) throws IOException {
    try (InputStream in = openInputStream(path)) {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      byte[] buffer = new byte[8192];
      int read;
      while ((read = in.read(buffer)) != -1) {
        out.write(buffer, 0, read);
      }
      return out.toByteArray();
    }
  }
}
