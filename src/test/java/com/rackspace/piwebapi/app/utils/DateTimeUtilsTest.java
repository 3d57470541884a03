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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import org.junit.jupiter.api.Test;

public class DateTimeUtilsTest {

  @Test
  public void parseTimestampWithZulu() {
    assertThat(DateTimeUtils.parseTimestamp("2023-10-01T12:00:00Z"))
        .isEqualTo(Instant.parse("2023-10-01T12:00:00Z"));
  }

  @Test
  public void parseTimestampWithSevenFractionalDigits() {
    assertThat(DateTimeUtils.parseTimestamp("2023-10-01T12:00:00.1234567Z"))
        .isEqualTo(Instant.parse("2023-10-01T12:00:00.123456700Z"));
  }

  @Test
  public void parseTimestampWithOffset() {
    assertThat(DateTimeUtils.parseTimestamp("2023-10-01T14:00:00+02:00"))
        .isEqualTo(Instant.parse("2023-10-01T12:00:00Z"));
  }

  @Test
  public void parseTimestampWithOffsetWithoutColon() {
    assertThat(DateTimeUtils.parseTimestamp("2023-10-01T00:00:00+0000"))
        .isEqualTo(Instant.parse("2023-10-01T00:00:00Z"));
    assertThat(DateTimeUtils.parseTimestamp("2023-10-01T14:00:00.5+0200"))
        .isEqualTo(Instant.parse("2023-10-01T12:00:00.5Z"));
  }

  @Test
  public void parseTimestampWithoutZoneIsUtc() {
    assertThat(DateTimeUtils.parseTimestamp("2023-10-01T12:00:00"))
        .isEqualTo(Instant.parse("2023-10-01T12:00:00Z"));
  }

  @Test
  public void parseTimestamp_Invalid() {
    assertThatThrownBy(() -> DateTimeUtils.parseTimestamp("yesterday"))
        .isInstanceOf(DateTimeParseException.class);
    assertThatThrownBy(() -> DateTimeUtils.parseTimestamp(null))
        .isInstanceOf(DateTimeParseException.class);
  }

  @Test
  public void isValidTimestampTest() {
    assertThat(DateTimeUtils.isValidTimestamp("2020-11-10T14:24:35Z")).isTrue();
    assertThat(DateTimeUtils.isValidTimestamp("13:03:15.454+0530Z")).isFalse();
  }
}
