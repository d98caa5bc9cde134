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
package org.adventureworks.etl.normalize;

import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Set;

/**
 * Utility class for handling null equivalent strings in raw CSV extracts.
 *
 * <p>The AdventureWorks extracts mark missing cells with a mix of empty fields
 * and text markers such as {@code NA} or {@code NULL}. The CSV reader turns all
 * of them into {@code null} cells so that cleaners see a single notion of
 * "missing".
 */
public final class NullEquivalents {

  /**
   * Default set of strings that are considered equivalent to NULL: the
   * default NA markers of the pandas CSV parser. Matching is exact and
   * case-sensitive, so {@code NaN} is missing but the name {@code Nan} is not.
   */
  public static final Set<String> DEFAULT_NULL_EQUIVALENTS =
      ImmutableSet.of("",
          "#N/A",
          "#N/A N/A",
          "#NA",
          "-1.#IND",
          "-1.#QNAN",
          "-NaN",
          "-nan",
          "1.#IND",
          "1.#QNAN",
          "<NA>",
          "N/A",
          "NA",
          "NULL",
          "NaN",
          "None",
          "n/a",
          "nan",
          "null");

  private NullEquivalents() {
    // Utility class
  }

  /**
   * Checks if a string value represents a null value using the default null equivalents.
   *
   * @param value The string value to check
   * @return true if the value is blank or exactly matches a null equivalent
   */
  public static boolean isNullRepresentation(@Nullable String value) {
    return isNullRepresentation(value, DEFAULT_NULL_EQUIVALENTS);
  }

  /**
   * Checks if a string value represents a null value using a custom set of null equivalents.
   *
   * @param value The string value to check
   * @param nullEquivalents Set of strings that represent null, matched exactly
   * @return true if the value is blank or exactly matches a null equivalent
   */
  public static boolean isNullRepresentation(@Nullable String value, Set<String> nullEquivalents) {
    if (value == null) {
      return false; // null is already null, not a "representation" of null
    }
    if (value.trim().isEmpty()) {
      return true;
    }
    return nullEquivalents.contains(value);
  }

  /**
   * Returns whether a cell is missing: either {@code null} or a blank string.
   *
   * @param value Cell value
   * @return true if the cell carries no value
   */
  public static boolean isMissing(@Nullable Object value) {
    return value == null || (value instanceof String && ((String) value).trim().isEmpty());
  }
}
