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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Instant;
import lombok.Data;

@Data
@JsonInclude(Include.NON_NULL)
public class ValueRow {

  String tag;

  Instant timestamp;

  /**
   * Null when the value reported by the server is not numeric.
   */
  Double value;

  String unitsAbbreviation;

  Boolean good;

  Boolean questionable;

  Boolean substituted;

  Boolean annotated;

  /**
   * Only set on summary rows, for example <code>Average</code>.
   */
  String summaryType;
}
