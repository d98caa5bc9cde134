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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Command-line entry point: runs the pipeline once for an event file.
 *
 * <pre>
 * EtlMain &lt;config.yaml&gt; &lt;event.json&gt;
 * </pre>
 *
 * <p>Exit status is 0 on success, 1 when the pipeline fails and 2 for a
 * usage or configuration error.
 */
public final class EtlMain {

  private static final Logger LOGGER = LoggerFactory.getLogger(EtlMain.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private EtlMain() {
  }

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args.length != 2) {
      System.err.println("Usage: EtlMain <config.yaml> <event.json>");
      return EXIT_USAGE;
    }

    EtlPipeline pipeline;
    StorageEvent event;
    try {
      pipeline = EtlPipeline.create(EtlPipelineConfig.load(Paths.get(args[0])));
      try (InputStream in = Files.newInputStream(Paths.get(args[1]))) {
        event = StorageEvent.fromJson(in);
      }
    } catch (IOException | IllegalArgumentException e) {
      LOGGER.error("Invalid pipeline input: {}", e.getMessage(), e);
      System.err.println("Invalid pipeline input: " + e.getMessage());
      return EXIT_USAGE;
    }

    EtlResult result = pipeline.execute(event);
    System.out.println(result.getStatusCode() + " " + result.getBody());
    return result.isSuccessful() ? EXIT_OK : EXIT_FAILED;
  }
}
