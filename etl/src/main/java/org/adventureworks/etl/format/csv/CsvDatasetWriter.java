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

import org.adventureworks.etl.table.TabularDataset;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes a {@link TabularDataset} as CSV for warehouse bulk loading.
 *
 * <p>The warehouse {@code COPY} maps fields to table columns by position, so by
 * default no header row is written. Missing cells become empty fields and
 * fields are quoted only when they contain the separator, a quote or a line
 * break.
 */
public class CsvDatasetWriter {

  public static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_8;

  private final char separator;
  private final boolean includeHeader;

  public CsvDatasetWriter() {
    this(',', false);
  }

  public CsvDatasetWriter(char separator, boolean includeHeader) {
    this.separator = separator;
    this.includeHeader = includeHeader;
  }

  /**
   * Encodes a dataset as CSV bytes.
   *
   * @param dataset Dataset to encode
   * @param charset Output character set
   * @return CSV content
   * @throws IOException If encoding fails
   */
  public byte[] write(TabularDataset dataset, Charset charset) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    write(dataset, new OutputStreamWriter(out, charset));
    return out.toByteArray();
  }

  /**
   * Writes a dataset as CSV text. The writer is closed on return.
   *
   * @param dataset Dataset to write
   * @param writer Destination
   * @throws IOException If writing fails
   */
  public void write(TabularDataset dataset, Writer writer) throws IOException {
    try (CSVWriter csv = new CSVWriter(writer, separator,
        ICSVWriter.DEFAULT_QUOTE_CHARACTER, ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
        ICSVWriter.DEFAULT_LINE_END)) {
      List<String> columnNames = dataset.getColumnNames();
      if (includeHeader) {
        csv.writeNext(columnNames.toArray(new String[0]), false);
      }
      String[] fields = new String[columnNames.size()];
      for (int row = 0; row < dataset.getRowCount(); row++) {
        for (int c = 0; c < fields.length; c++) {
          Object value = dataset.getValue(row, columnNames.get(c));
          fields[c] = value == null ? "" : value.toString();
        }
        csv.writeNext(fields, false);
      }
      csv.flush();
      if (csv.checkError()) {
        throw new IOException("Failed to write CSV for " + dataset);
      }
    }
  }
}
