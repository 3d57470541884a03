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

import com.rackspace.piwebapi.app.utils.WebClientUtils;
import com.rackspace.piwebapi.app.validation.RequestValidator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class StreamWriteService {

  private final WebClientUtils webClientUtils;

  @Autowired
  public StreamWriteService(WebClientUtils webClientUtils) {
    this.webClientUtils = webClientUtils;
  }

  public Mono<Boolean> writeRecordedValue(String webId, String timestamp, Object value) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put(RequestValidator.VALUE_KEY, value);
    data.put(RequestValidator.TIMESTAMP_KEY, timestamp);
    return writeRecordedValue(webId, data);
  }

  /**
   * Sends a single value to the point's recorded stream. The payload must hold
   * <code>Value</code> and <code>Timestamp</code>, for example
   * <code>{"Value": 123.45, "Timestamp": "2023-10-01T12:00:00Z"}</code>.
   *
   * @return true if the server accepted the value, false if it answered with an error
   * @throws com.rackspace.piwebapi.app.validation.PiConfigurationException if the payload
   * is incomplete, before anything is sent
   */
  public Mono<Boolean> writeRecordedValue(String webId, Map<String, ?> data) {
    RequestValidator.validateWebId(webId);
    RequestValidator.validateRecordedValue(data);

    return webClientUtils.post(uriBuilder -> uriBuilder.path("/streams/{webId}/recorded")
            .build(webId), data)
        .map(response -> {
          if (response.isSuccessful()) {
            log.info("Recorded value sent successfully.");
            return true;
          }
          log.error("Failed to send recorded value: {} - {}", response.getStatus(), response.getBody());
          return false;
        })
        .onErrorResume(e -> {
          log.error("Failed to send recorded value: {}", e.getMessage());
          return Mono.just(false);
        });
  }
}
