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

package com.rackspace.piwebapi.app.validation;

import com.rackspace.piwebapi.app.config.AuthMode;
import com.rackspace.piwebapi.app.config.PiWebApiProperties;
import java.util.Map;
import org.springframework.util.StringUtils;

public class RequestValidator {

  public static final String VALUE_KEY = "Value";
  public static final String TIMESTAMP_KEY = "Timestamp";

  public static void validateCredentials(PiWebApiProperties properties) {
    if (!StringUtils.hasText(properties.getBaseUrl())) {
      throw new PiConfigurationException("Base URL must be provided.");
    }
    if (properties.getAuth() == AuthMode.BASIC
        && (!StringUtils.hasText(properties.getUsername())
        || !StringUtils.hasText(properties.getPassword()))) {
      throw new PiConfigurationException(
          "Username and password must be provided for basic authentication.");
    }
  }

  public static void validateInterval(String interval) {
    if (!StringUtils.hasText(interval)) {
      throw new PiConfigurationException("Interval must be provided.");
    }
  }

  public static void validateSummary(String summaryDuration, String summaryType) {
    if (!StringUtils.hasText(summaryType)) {
      throw new PiConfigurationException("Summary type must be provided.");
    }
    if (!StringUtils.hasText(summaryDuration)) {
      throw new PiConfigurationException("Summary duration must be provided.");
    }
  }

  /**
   * A recorded value needs both a <code>Value</code> and a <code>Timestamp</code> entry;
   * a present key with a null value is accepted and forwarded as JSON null.
   */
  public static void validateRecordedValue(Map<String, ?> data) {
    if (data == null) {
      throw new PiConfigurationException("Data cannot be null.");
    }
    if (!data.containsKey(VALUE_KEY)) {
      throw new PiConfigurationException("Data must contain a 'Value' key.");
    }
    if (!data.containsKey(TIMESTAMP_KEY)) {
      throw new PiConfigurationException("Data must contain a 'Timestamp' key.");
    }
  }

  public static void validateWebId(String webId) {
    if (!StringUtils.hasText(webId)) {
      throw new PiConfigurationException("WebId must be provided.");
    }
  }
}
