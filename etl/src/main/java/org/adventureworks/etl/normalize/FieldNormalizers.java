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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pure single-cell normalizers shared by the dataset cleaners.
 *
 * <p>None of these methods throw on malformed input: unparseable values map to
 * a documented sentinel instead.
 */
public final class FieldNormalizers {

  /** Returned by {@link #normalizeDate} when the input is not a valid date. */
  public static final String DEFAULT_DATE = "1900-01-01";

  // Month and day may be one or two digits, as in 2/5/2021.
  private static final DateTimeFormatter US_DATE =
      DateTimeFormatter.ofPattern("M/d/uuuu", Locale.ROOT)
          .withResolverStyle(ResolverStyle.STRICT);

  private static final Pattern NON_DIGIT = Pattern.compile("\\D");
  private static final Pattern PUNCTUATION = Pattern.compile("\\p{Punct}");

  private FieldNormalizers() {
    // Utility class
  }

  /**
   * Converts a {@code MM/DD/YYYY} date to ISO {@code YYYY-MM-DD}.
   *
   * @param raw Raw cell value
   * @return ISO date, or {@link #DEFAULT_DATE} if {@code raw} is missing or not a valid date
   */
  public static String normalizeDate(@Nullable Object raw) {
    if (raw == null) {
      return DEFAULT_DATE;
    }
    try {
      LocalDate date = LocalDate.parse(raw.toString(), US_DATE);
      // Calendar years start at 1; the proleptic year 0 is not a valid date
      return date.getYear() < 1 ? DEFAULT_DATE : date.toString();
    } catch (DateTimeParseException e) {
      return DEFAULT_DATE;
    }
  }

  /**
   * Removes every character that is not a decimal digit.
   *
   * @param raw Raw cell value; {@code null} yields the empty string
   * @return Digit-only string, possibly empty
   */
  public static String normalizeNumeric(@Nullable Object raw) {
    if (raw == null) {
      return "";
    }
    return NON_DIGIT.matcher(raw.toString()).replaceAll("");
  }

  /**
   * Removes all digit characters from a text value.
   *
   * @param raw Raw cell value
   * @return The text without digits, or null if {@code raw} is null
   */
  public static @Nullable String stripDigits(@Nullable Object raw) {
    if (raw == null) {
      return null;
    }
    String text = raw.toString();
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (!Character.isDigit(c)) {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Removes ASCII punctuation characters from a text value.
   *
   * @param raw Raw cell value
   * @return The text without punctuation, or null if {@code raw} is null
   */
  public static @Nullable String stripPunctuation(@Nullable Object raw) {
    if (raw == null) {
      return null;
    }
    return PUNCTUATION.matcher(raw.toString()).replaceAll("");
  }

  /**
   * Returns the text after the first {@code @} of an email address.
   *
   * @param raw Raw cell value
   * @return The domain part, or null if {@code raw} is null or has no {@code @}
   */
  public static @Nullable String emailDomain(@Nullable Object raw) {
    if (raw == null) {
      return null;
    }
    String text = raw.toString();
    int at = text.indexOf('@');
    if (at < 0) {
      return null;
    }
    return text.substring(at + 1);
  }

  /**
   * Coerces a yes/no indicator to a boolean.
   *
   * <p>{@code Y}, {@code true} (any case) and {@link Boolean#TRUE} are true;
   * everything else, including missing values, is false.
   *
   * @param raw Raw cell value
   * @return The indicator as a boolean
   */
  public static boolean toBoolean(@Nullable Object raw) {
    if (raw instanceof Boolean) {
      return (Boolean) raw;
    }
    if (raw == null) {
      return false;
    }
    String text = raw.toString().trim();
    return "Y".equals(text) || "true".equalsIgnoreCase(text);
  }

  /**
   * Returns the year of an ISO date produced by {@link #normalizeDate}.
   *
   * @param isoDate Date in {@code YYYY-MM-DD} form
   * @return The year; the year of {@link #DEFAULT_DATE} if the date cannot be parsed
   */
  public static int yearOf(@Nullable Object isoDate) {
    if (isoDate != null) {
      try {
        return LocalDate.parse(isoDate.toString()).getYear();
      } catch (DateTimeParseException e) {
        // fall through to the sentinel year
      }
    }
    return LocalDate.parse(DEFAULT_DATE).getYear();
  }
}
