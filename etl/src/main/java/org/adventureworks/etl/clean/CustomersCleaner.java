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
package org.adventureworks.etl.clean;

import org.adventureworks.etl.normalize.FieldNormalizers;

import com.google.common.collect.ImmutableMap;

import static org.adventureworks.etl.clean.CleaningStages.dropMissing;
import static org.adventureworks.etl.clean.CleaningStages.mapCells;
import static org.adventureworks.etl.clean.CleaningStages.mapColumn;
import static org.adventureworks.etl.clean.CleaningStages.renameIfPresent;
import static org.adventureworks.etl.clean.CleaningStages.replaceValues;
import static org.adventureworks.etl.clean.CleaningStages.setConstant;

/**
 * Cleans the customers extract.
 *
 * <p>Rows without a {@code CustomerKey} are dropped before any other stage
 * runs. A present email address without {@code @} fails the whole call with a
 * {@link StructuralMismatchException}; a missing email stays missing.
 */
public class CustomersCleaner extends PipelineDatasetCleaner {

  public static final String CUSTOMER_KEY = "CustomerKey";
  public static final String MISSPELLED_LAST_NAME = "LastNa";
  public static final String LAST_NAME = "LastName";
  public static final String EDUCATION_LEVEL = "EducationLevel";
  public static final String MARITAL_STATUS = "MaritalStatus";
  public static final String PREFIX = "Prefix";
  public static final String FIRST_NAME = "FirstName";
  public static final String OCCUPATION = "Occupation";
  public static final String EMAIL_ADDRESS = "EmailAddress";
  public static final String BIRTH_DATE = "BirthDate";
  public static final String HOME_OWNER = "HomeOwner";

  /** Every customer is grouped under a single education level. */
  public static final String EDUCATION_LEVEL_VALUE = "College Degree";

  public static final CustomersCleaner INSTANCE = new CustomersCleaner();

  public CustomersCleaner() {
    super("customers", CleaningPipeline.builder()
        .stage(dropMissing(CUSTOMER_KEY))
        .stage(renameIfPresent(MISSPELLED_LAST_NAME, LAST_NAME))
        .stage(setConstant(EDUCATION_LEVEL, EDUCATION_LEVEL_VALUE))
        .stage(replaceValues(MARITAL_STATUS, ImmutableMap.of("M", "Married", "S", "Single")))
        .stage(replaceValues(PREFIX, ImmutableMap.of("MrR", "MR")))
        .stage(mapColumn(FIRST_NAME, FieldNormalizers::stripDigits))
        .stage(mapColumn(OCCUPATION, FieldNormalizers::stripPunctuation))
        .stage(mapCells("emailDomain(" + EMAIL_ADDRESS + ")", EMAIL_ADDRESS,
            CustomersCleaner::emailDomain))
        .stage(mapColumn(BIRTH_DATE, FieldNormalizers::normalizeDate))
        .stage(mapColumn(CUSTOMER_KEY, FieldNormalizers::normalizeNumeric))
        .stage(mapColumn(HOME_OWNER, FieldNormalizers::toBoolean))
        .build());
  }

  private static Object emailDomain(Object value, int row) {
    if (value == null) {
      return null;
    }
    String domain = FieldNormalizers.emailDomain(value);
    if (domain == null) {
      throw new StructuralMismatchException(EMAIL_ADDRESS, row,
          "email address '" + value + "' has no '@' separator");
    }
    return domain;
  }
}
