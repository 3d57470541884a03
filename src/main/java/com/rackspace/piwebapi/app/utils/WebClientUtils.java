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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.piwebapi.app.model.PiItems;
import com.rackspace.piwebapi.app.model.PiResponse;
import java.net.URI;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

/**
 * Issues requests against the PI Web API and hands back status and body without raising on
 * error statuses, leaving the classification of each answer to the caller.
 */
@Component
@Slf4j
public class WebClientUtils {

  private final WebClient webClient;
  private final ObjectMapper objectMapper;

  @Autowired
  public WebClientUtils(@Qualifier("piWebApiWebClient") WebClient webClient,
                        ObjectMapper objectMapper) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
  }

  public Mono<PiResponse> get(Function<UriBuilder, URI> uriFunction) {
    return webClient.get()
        .uri(uriFunction)
        .accept(MediaType.APPLICATION_JSON)
        .exchangeToMono(this::toPiResponse);
  }

  public Mono<PiResponse> post(Function<UriBuilder, URI> uriFunction, Object body) {
    return webClient.post()
        .uri(uriFunction)
        .accept(MediaType.APPLICATION_JSON)
        .contentType(MediaType.APPLICATION_JSON)
        .body(BodyInserters.fromValue(body))
        .exchangeToMono(this::toPiResponse);
  }

  /**
   * Reads the <code>Items</code> envelope of a successful response.
   *
   * @throws IllegalStateException if the body is not the expected JSON
   */
  public <T> PiItems<T> readItems(PiResponse response, Class<T> itemType) {
    JavaType type = objectMapper.getTypeFactory()
        .constructParametricType(PiItems.class, itemType);
    try {
      PiItems<T> items = objectMapper.readValue(response.getBody(), type);
      return items == null ? new PiItems<>() : items;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to read PI Web API response: " + e.getOriginalMessage(), e);
    }
  }

  private Mono<PiResponse> toPiResponse(ClientResponse response) {
    return response.bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(body -> new PiResponse(response.rawStatusCode(), body));
  }
}
