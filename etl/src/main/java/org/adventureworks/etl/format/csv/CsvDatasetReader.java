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
package org.adventureworks.etl.format.csv;

import org.adventureworks.etl.normalize.NullEquivalents;
import org.adventureworks.etl.table.TabularDataset;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a CSV extract with a header row into a {@link TabularDataset}.
 *
 * <p>Cells matching a {@link NullEquivalents null equivalent} become
 * {@code null}. Blank lines are skipped, short rows are padded with
 * {@code null}, and rows wider than the header are rejected. Duplicate
 * header names get a numeric suffix ({@code Name}, {@code Name.1}, ...).
 */
public class CsvDatasetReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvDatasetReader.class);

  /** Raw extracts are exported as Latin-1. */
  public static final Charset DEFAULT_CHARSET = StandardCharsets.ISO_8859_1;

  private final char separator;
  private final Set<String> nullEquivalents;

  public CsvDatasetReader() {
    this(',', NullEquivalents.DEFAULT_NULL_EQUIVALENTS);
  }

  public CsvDatasetReader(char separator, Set<String> nullEquivalents) {
    this.separator = separator;
    this.nullEquivalents = nullEquivalents;
  }

  /**
   * Decodes CSV bytes.
   *
   * @param content Raw file content
   * @param charset Character set of the content
   * @return Parsed dataset
   * @throws IOException If the content is not valid CSV
   */
  public TabularDataset read(byte[] content, Charset charset) throws IOException {
    return read(new ByteArrayInputStream(content), charset);
  }

  public TabularDataset read(InputStream in, Charset charset) throws IOException {
    return read(new InputStreamReader(in, charset));
  }

  /**
   * Parses CSV text. The reader is closed on return.
   *
   * @param reader CSV text
   * @return Parsed dataset; an empty input yields a dataset with no columns
   * @throws IOException If the text cannot be read or is not valid CSV
   */
  public TabularDataset read(Reader reader) throws IOException {
    try (CSVReader csv = new CSVReaderBuilder(reader)
        .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
        .build()) {
      String[] header = csv.readNext();
      if (header == null) {
        LOGGER.debug("CSV input is empty");
        return TabularDataset.builder().build();
      }
      List<String> columnNames = uniqueNames(header);

      List<List<Object>> rows = new ArrayList<List<Object>>();
      String[] record;
      while ((record = csv.readNext()) != null) {
        if (isBlank(record)) {
          continue;
        }
        if (record.length > columnNames.size()) {
          throw new IOException("CSV line " + csv.getLinesRead() + " has " + record.length
              + " fields but the header has " + columnNames.size());
        }
        List<Object> row = new ArrayList<Object>(columnNames.size());
        for (int c = 0; c < columnNames.size(); c++) {
          row.add(c < record.length ? toCell(record[c]) : null);
        }
        rows.add(row);
      }
      LOGGER.debug("Read {} rows with columns {}", rows.size(), columnNames);
      return TabularDataset.fromRows(columnNames, rows);
    } catch (CsvValidationException e) {
      throw new IOException("Invalid CSV: " + e.getMessage(), e);
    }
  }

  private Object toCell(String raw) {
    return NullEquivalents.isNullRepresentation(raw, nullEquivalents) ? null : raw;
  }

  private static boolean isBlank(String[] record) {
    return record.length == 0 || (record.length == 1 && record[0].trim().isEmpty());
  }

  private static List<String> uniqueNames(String[] header) {
    List<String> names = new ArrayList<String>(header.length);
    Set<String> used = new HashSet<String>();
    for (String name : header) {
      String candidate = name;
      int suffix = 1;
      while (used.contains(candidate)) {
        candidate = name + "." + suffix++;
      }
      used.add(candidate);
      names.add(candidate);
    }
    return names;
  }
}
