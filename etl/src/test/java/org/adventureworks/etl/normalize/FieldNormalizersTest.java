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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for FieldNormalizers.
 */
@Tag("unit")
public class FieldNormalizersTest {

  @Test void testNormalizeDateConvertsMonthFirstDates() {
    assertEquals("2021-02-05", FieldNormalizers.normalizeDate("02/05/2021"));
    assertEquals("2021-02-05", FieldNormalizers.normalizeDate("2/5/2021"));
    assertEquals("1999-12-31", FieldNormalizers.normalizeDate("12/31/1999"));
    assertEquals("2020-02-29", FieldNormalizers.normalizeDate("02/29/2020"));
  }

  @Test void testNormalizeDateReturnsSentinelForMalformedInput() {
    List<Object> malformed = Arrays.<Object>asList(
        null, "", "not a date", "02/30/2020", "13/01/2020", "02/29/2021",
        "2021-02-05", "02-05-2021", "02/05/21", "02/05/0000", 42);
    for (Object value : malformed) {
      assertEquals(FieldNormalizers.DEFAULT_DATE, FieldNormalizers.normalizeDate(value),
          "value " + value);
    }
  }

  @Test void testNormalizeNumericKeepsOnlyDigits() {
    assertEquals("11000", FieldNormalizers.normalizeNumeric("AW-11000"));
    assertEquals("1299", FieldNormalizers.normalizeNumeric("$12.99"));
    assertEquals("", FieldNormalizers.normalizeNumeric("abc"));
    assertEquals("", FieldNormalizers.normalizeNumeric(null));
    assertEquals("42", FieldNormalizers.normalizeNumeric(42));
  }

  @Test void testNormalizeNumericIsIdempotent() {
    List<Object> values = Arrays.<Object>asList(
        "AW-11000", " 7 ", "-3.5", "", "no digits", "\u0661\u0662", null, 10L);
    for (Object value : values) {
      String once = FieldNormalizers.normalizeNumeric(value);
      assertEquals(once, FieldNormalizers.normalizeNumeric(once));
      assertTrue(once.chars().allMatch(c -> c >= '0' && c <= '9'), "value " + value);
    }
  }

  @Test void testStripDigits() {
    assertEquals("Jon", FieldNormalizers.stripDigits("J0o1n2"));
    assertEquals("", FieldNormalizers.stripDigits("123"));
    assertNull(FieldNormalizers.stripDigits(null));
  }

  @Test void testStripPunctuation() {
    assertEquals("Skilled Manual", FieldNormalizers.stripPunctuation("Skilled, Manual!"));
    assertEquals("Professional", FieldNormalizers.stripPunctuation("Professional"));
    assertNull(FieldNormalizers.stripPunctuation(null));
  }

  @Test void testEmailDomain() {
    assertEquals("adventure-works.com",
        FieldNormalizers.emailDomain("jon24@adventure-works.com"));
    assertEquals("b@c.com", FieldNormalizers.emailDomain("a@b@c.com"));
    assertNull(FieldNormalizers.emailDomain("no-at-sign"));
    assertNull(FieldNormalizers.emailDomain(null));
  }

  @Test void testToBoolean() {
    assertTrue(FieldNormalizers.toBoolean("Y"));
    assertTrue(FieldNormalizers.toBoolean("true"));
    assertTrue(FieldNormalizers.toBoolean("TRUE"));
    assertTrue(FieldNormalizers.toBoolean(Boolean.TRUE));
    assertFalse(FieldNormalizers.toBoolean("N"));
    assertFalse(FieldNormalizers.toBoolean("yes"));
    assertFalse(FieldNormalizers.toBoolean(null));
  }

  @Test void testYearOf() {
    assertEquals(2021, FieldNormalizers.yearOf("2021-02-05"));
    assertEquals(1900, FieldNormalizers.yearOf(FieldNormalizers.DEFAULT_DATE));
    assertEquals(1900, FieldNormalizers.yearOf("garbage"));
    assertEquals(1900, FieldNormalizers.yearOf(null));
  }
}
