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

package com.rackspace.piwebapi.app.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.rackspace.piwebapi.app.model.StreamValue;
import com.rackspace.piwebapi.app.model.SummaryValue;
import com.rackspace.piwebapi.app.model.ValueRow;
import com.rackspace.piwebapi.app.utils.DateTimeUtils;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Flattens the items of one stream response into rows labelled with the tag they were
 * requested for.
 */
@Component
@Slf4j
public class TabularAssembler {

  /**
   * Plain decimal or exponent notation. Java literal suffixes and hex floats are not numbers here.
   */
  private static final Pattern DECIMAL_PATTERN =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  /**
   * Rows for recorded and interpolated items, which carry timestamp and value directly.
   */
  public List<ValueRow> toRows(String tag, List<StreamValue> items) {
    List<ValueRow> rows = new ArrayList<>(items.size());
    for (StreamValue item : items) {
      ValueRow row = toRow(tag, item);
      if (row != null) {
        rows.add(row);
      }
    }
    return rows;
  }

  /**
   * Rows for summary items, where the timestamped value sits under each item's
   * <code>Value</code>.
   */
  public List<ValueRow> toSummaryRows(String tag, List<SummaryValue> items) {
    List<ValueRow> rows = new ArrayList<>(items.size());
    for (SummaryValue item : items) {
      if (item == null || item.getValue() == null) {
        log.warn("Skipping summary item without a value for tag '{}'", tag);
        continue;
      }
      ValueRow row = toRow(tag, item.getValue());
      if (row != null) {
        rows.add(row.setSummaryType(item.getType()));
      }
    }
    return rows;
  }

  /**
   * Returns null when the timestamp cannot be parsed, the row is malformed then.
   */
  private ValueRow toRow(String tag, StreamValue item) {
    if (item == null) {
      return null;
    }
    Instant timestamp;
    try {
      timestamp = DateTimeUtils.parseTimestamp(item.getTimestamp());
    } catch (DateTimeParseException e) {
      log.warn("Skipping malformed row for tag '{}', unparseable timestamp '{}'",
          tag, item.getTimestamp());
      return null;
    }
    return new ValueRow()
        .setTag(tag)
        .setTimestamp(timestamp)
        .setValue(coerceValue(item.getValue()))
        .setUnitsAbbreviation(item.getUnitsAbbreviation())
        .setGood(item.getGood())
        .setQuestionable(item.getQuestionable())
        .setSubstituted(item.getSubstituted())
        .setAnnotated(item.getAnnotated());
  }

  /**
   * Numbers and numeric text become doubles and booleans become 1 or 0. Anything else,
   * including digital state objects, becomes null.
   */
  static Double coerceValue(JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return value.doubleValue();
    }
    if (value.isBoolean()) {
      return value.booleanValue() ? 1.0 : 0.0;
    }
    if (value.isTextual()) {
      String text = StringUtils.trim(value.textValue());
      if (StringUtils.isEmpty(text) || !DECIMAL_PATTERN.matcher(text).matches()) {
        log.trace("Non-numeric value '{}'", value.textValue());
        return null;
      }
      return Double.valueOf(text);
    }
    return null;
  }
}
