/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.piwebapi.app.utils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

public class DateTimeUtils {

  /**
   * ISO-8601 local date-time followed by an optional <code>Z</code>, <code>+HH:MM</code> or
   * <code>+HHMM</code> offset.
   */
  private static final DateTimeFormatter TIMESTAMP_FORMATTER = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
      .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
      .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
      .toFormatter();

  /**
   * Parses a timestamp reported by the PI Web API into a UTC instant. Timestamps carry up to
   * seven fractional digits and either a <code>Z</code> or a numeric offset; a timestamp
   * without zone information is taken to be UTC.
   *
   * @throws DateTimeParseException if the text is not an ISO-8601 date-time
   */
  public static Instant parseTimestamp(String timestamp) {
    if (timestamp == null) {
      throw new DateTimeParseException("Timestamp is missing", "", 0);
    }
    TemporalAccessor parsed = TIMESTAMP_FORMATTER.parseBest(timestamp.trim(),
        OffsetDateTime::from, LocalDateTime::from);
    if (parsed instanceof OffsetDateTime) {
      return ((OffsetDateTime) parsed).toInstant();
    }
    return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
  }

  /**
   * Checks if the text can be parsed by {@link #parseTimestamp(String)}.
   */
  public static boolean isValidTimestamp(String timestamp) {
    try {
      parseTimestamp(timestamp);
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }
}
