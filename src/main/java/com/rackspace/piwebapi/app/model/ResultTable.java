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

package com.rackspace.piwebapi.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Rows of every tag that returned data, in tag processing order and then in the order the
 * server returned them. Rows are neither sorted nor de-duplicated.
 */
@EqualsAndHashCode
@ToString
public class ResultTable {

  private final List<ValueRow> rows;

  public ResultTable() {
    this.rows = new ArrayList<>();
  }

  public ResultTable(List<ValueRow> rows) {
    this.rows = new ArrayList<>(rows);
  }

  public static ResultTable empty() {
    return new ResultTable();
  }

  public ResultTable append(List<ValueRow> fragment) {
    rows.addAll(fragment);
    return this;
  }

  public List<ValueRow> getRows() {
    return Collections.unmodifiableList(rows);
  }

  @JsonIgnore
  public int size() {
    return rows.size();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Distinct tag names in the order they first appear.
   */
  @JsonIgnore
  public List<String> getTags() {
    return List.copyOf(rows.stream()
        .map(ValueRow::getTag)
        .collect(Collectors.toCollection(LinkedHashSet::new)));
  }

  public List<ValueRow> rowsFor(String tag) {
    return rows.stream()
        .filter(row -> row.getTag().equals(tag))
        .collect(Collectors.toList());
  }
}
