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

package com.rackspace.piwebapi.app.web;

import com.rackspace.piwebapi.app.model.ResultTable;
import com.rackspace.piwebapi.app.model.TagBinding;
import com.rackspace.piwebapi.app.model.TimeWindow;
import com.rackspace.piwebapi.app.services.IdentifierResolver;
import com.rackspace.piwebapi.app.services.StreamRetrievalService;
import com.rackspace.piwebapi.app.services.StreamWriteService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Exposes the data server client over HTTP. Calls that produce no table, because the server
 * or all tags failed to resolve, answer 404.
 */
@RestController
@RequestMapping("/api")
public class DataQueryController {

  private final IdentifierResolver identifierResolver;
  private final StreamRetrievalService streamRetrievalService;
  private final StreamWriteService streamWriteService;
  private final Counter recordedQueryCounter;
  private final Counter interpolatedQueryCounter;
  private final Counter summaryQueryCounter;

  @Autowired
  public DataQueryController(IdentifierResolver identifierResolver,
                             StreamRetrievalService streamRetrievalService,
                             StreamWriteService streamWriteService,
                             MeterRegistry meterRegistry) {
    this.identifierResolver = identifierResolver;
    this.streamRetrievalService = streamRetrievalService;
    this.streamWriteService = streamWriteService;
    recordedQueryCounter = meterRegistry.counter("piwebapi.query", "type", "recorded");
    interpolatedQueryCounter = meterRegistry.counter("piwebapi.query", "type", "interpolated");
    summaryQueryCounter = meterRegistry.counter("piwebapi.query", "type", "summary");
  }

  @GetMapping("/points")
  public Mono<ResponseEntity<List<TagBinding>>> points(@RequestParam String server,
                                                       ServerHttpRequest request) {
    return identifierResolver.webIds(server, tags(request))
        .map(ResponseEntity::ok)
        .defaultIfEmpty(ResponseEntity.notFound().build());
  }

  @GetMapping("/data/recorded")
  public Mono<ResponseEntity<ResultTable>> recorded(@RequestParam String server,
                                                    ServerHttpRequest request,
                                                    @RequestParam(required = false) String start,
                                                    @RequestParam(required = false) String end) {
    recordedQueryCounter.increment();
    return respond(streamRetrievalService.recorded(server, tags(request),
        TimeWindow.of(start, end)));
  }

  @GetMapping("/data/interpolated")
  public Mono<ResponseEntity<ResultTable>> interpolated(@RequestParam String server,
                                                        ServerHttpRequest request,
                                                        @RequestParam(required = false) String start,
                                                        @RequestParam(required = false) String end,
                                                        @RequestParam(required = false) String interval) {
    interpolatedQueryCounter.increment();
    return respond(streamRetrievalService.interpolated(server, tags(request),
        TimeWindow.of(start, end), interval));
  }

  @GetMapping("/data/summary")
  public Mono<ResponseEntity<ResultTable>> summary(@RequestParam String server,
                                                   ServerHttpRequest request,
                                                   @RequestParam(required = false) String start,
                                                   @RequestParam(required = false) String end,
                                                   @RequestParam(required = false) String summaryDuration,
                                                   @RequestParam(required = false) String summaryType) {
    summaryQueryCounter.increment();
    List<String> tags = tags(request);
    TimeWindow window = TimeWindow.of(start, end);
    return respond(StringUtils.hasText(summaryType) ?
        streamRetrievalService.summary(server, tags, window, summaryDuration, summaryType) :
        streamRetrievalService.summary(server, tags, window, summaryDuration));
  }

  @PostMapping("/streams/{webId}/recorded")
  public Mono<ResponseEntity<Void>> writeRecordedValue(@PathVariable String webId,
                                                       @RequestBody Map<String, Object> data) {
    return streamWriteService.writeRecordedValue(webId, data)
        .map(accepted -> accepted ?
            ResponseEntity.accepted().<Void>build() :
            ResponseEntity.status(HttpStatus.BAD_GATEWAY).<Void>build());
  }

  /**
   * Every <code>tag</code> query parameter is one tag name, commas included.
   */
  private static List<String> tags(ServerHttpRequest request) {
    return request.getQueryParams().getOrDefault("tag", List.of());
  }

  private Mono<ResponseEntity<ResultTable>> respond(Mono<ResultTable> result) {
    return result
        .map(ResponseEntity::ok)
        .defaultIfEmpty(ResponseEntity.notFound().build());
  }
}
