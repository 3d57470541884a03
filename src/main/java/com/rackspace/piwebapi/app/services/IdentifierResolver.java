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

import com.rackspace.piwebapi.app.model.DataServer;
import com.rackspace.piwebapi.app.model.PiItems;
import com.rackspace.piwebapi.app.model.PiPoint;
import com.rackspace.piwebapi.app.model.PiResponse;
import com.rackspace.piwebapi.app.model.ServerIdentity;
import com.rackspace.piwebapi.app.model.TagBinding;
import com.rackspace.piwebapi.app.utils.WebClientUtils;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Turns a data server name and tag names into the WebIds the stream endpoints are addressed
 * by. Nothing is cached, every call resolves afresh.
 */
@Service
@Slf4j
public class IdentifierResolver {

  private final WebClientUtils webClientUtils;

  @Autowired
  public IdentifierResolver(WebClientUtils webClientUtils) {
    this.webClientUtils = webClientUtils;
  }

  /**
   * Lists the data servers and picks the first whose name matches exactly, case included.
   *
   * @return the resolved server, or empty if the listing failed or nothing matched
   */
  public Mono<ServerIdentity> resolveServer(String serverName) {
    return webClientUtils.get(uriBuilder -> uriBuilder.path("/dataservers").build())
        .flatMap(response -> matchServer(serverName, response))
        .onErrorResume(e -> {
          log.error("Failed to get data server ID for '{}': {}", serverName, e.getMessage());
          return Mono.empty();
        });
  }

  /**
   * Looks every tag up by name filter, one request per tag in the given order. The first
   * point returned for a tag wins, tags without a match or whose lookup failed are left out.
   *
   * @return bindings of the tags that resolved, or empty if none did
   */
  public Mono<List<TagBinding>> resolveTags(ServerIdentity server, List<String> tags) {
    if (tags == null || tags.isEmpty()) {
      log.error("No tags provided");
      return Mono.empty();
    }
    return Flux.fromIterable(tags)
        .concatMap(tag -> resolveTag(server, tag))
        .collectList()
        .filter(bindings -> {
          if (bindings.isEmpty()) {
            log.error("No valid tags found in data server '{}'.", server.getName());
          }
          return !bindings.isEmpty();
        });
  }

  /**
   * Resolves the server and then its tags.
   */
  public Mono<List<TagBinding>> webIds(String serverName, List<String> tags) {
    if (tags == null || tags.isEmpty()) {
      log.error("No tags provided");
      return Mono.empty();
    }
    return resolveServer(serverName)
        .flatMap(server -> resolveTags(server, tags));
  }

  private Mono<ServerIdentity> matchServer(String serverName, PiResponse response) {
    if (!response.isOk()) {
      log.error("Failed to get data server ID: {} - {}", response.getStatus(), response.getBody());
      return Mono.empty();
    }
    PiItems<DataServer> servers = webClientUtils.readItems(response, DataServer.class);
    return servers.getItems().stream()
        .filter(server -> server.getName() != null && server.getName().equals(serverName))
        .findFirst()
        .map(server -> {
          log.info("Data server '{}' found with ID: {}", serverName, server.getWebId());
          return Mono.just(new ServerIdentity(serverName, server.getWebId()));
        })
        .orElseGet(() -> {
          log.error("Data server '{}' not found.", serverName);
          return Mono.empty();
        });
  }

  private Mono<TagBinding> resolveTag(ServerIdentity server, String tag) {
    if (!StringUtils.hasText(tag)) {
      log.error("Skipping blank tag name for data server '{}'.", server.getName());
      return Mono.empty();
    }
    return webClientUtils.get(uriBuilder -> uriBuilder.path("/dataservers/{webId}/points")
            .queryParam("nameFilter", "{tag}")
            .build(server.getWebId(), tag))
        .flatMap(response -> {
          if (!response.isOk()) {
            log.error("Failed to get webid for tag '{}': {} - {}",
                tag, response.getStatus(), response.getBody());
            return Mono.empty();
          }
          PiItems<PiPoint> points = webClientUtils.readItems(response, PiPoint.class);
          if (points.isEmpty()) {
            log.error("Tag '{}' not found in data server '{}'.", tag, server.getName());
            return Mono.empty();
          }
          return Mono.just(new TagBinding(tag, points.getItems().get(0).getWebId()));
        })
        .onErrorResume(e -> {
          log.error("Failed to get webid for tag '{}': {}", tag, e.getMessage());
          return Mono.empty();
        });
  }
}
