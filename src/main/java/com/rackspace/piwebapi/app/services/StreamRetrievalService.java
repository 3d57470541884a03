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

import com.rackspace.piwebapi.app.config.PiWebApiProperties;
import com.rackspace.piwebapi.app.model.PiResponse;
import com.rackspace.piwebapi.app.model.ResultTable;
import com.rackspace.piwebapi.app.model.RetrievalMode;
import com.rackspace.piwebapi.app.model.StreamValue;
import com.rackspace.piwebapi.app.model.SummaryValue;
import com.rackspace.piwebapi.app.model.TagBinding;
import com.rackspace.piwebapi.app.model.TimeWindow;
import com.rackspace.piwebapi.app.model.ValueRow;
import com.rackspace.piwebapi.app.utils.WebClientUtils;
import com.rackspace.piwebapi.app.validation.PiConfigurationException;
import com.rackspace.piwebapi.app.validation.RequestValidator;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Fetches recorded, interpolated or summary values for a list of tags of one data server and
 * merges them into a single {@link ResultTable}.
 * <p>
 * Every call resolves the server and the tags first and then issues one request per resolved
 * tag, strictly one after the other. A failing tag only loses its own rows. Missing mode
 * parameters are rejected with a {@link PiConfigurationException} before anything is sent.
 * <p>
 * The returned Mono is empty when the call could not produce a table at all: no tags given,
 * server not resolved or no tag resolved. Once tags are bound the result is a table, possibly
 * without rows.
 */
@Service
@Slf4j
public class StreamRetrievalService {

  static final String METRIC_REQUESTS = "piwebapi.requests";

  private final IdentifierResolver identifierResolver;
  private final TabularAssembler tabularAssembler;
  private final WebClientUtils webClientUtils;
  private final PiWebApiProperties properties;
  private final MeterRegistry meterRegistry;

  @Autowired
  public StreamRetrievalService(IdentifierResolver identifierResolver,
                                TabularAssembler tabularAssembler,
                                WebClientUtils webClientUtils,
                                PiWebApiProperties properties,
                                MeterRegistry meterRegistry) {
    this.identifierResolver = identifierResolver;
    this.tabularAssembler = tabularAssembler;
    this.webClientUtils = webClientUtils;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Raw archived values, capped at <code>piwebapi.recorded-max-count</code> per tag.
   */
  public Mono<ResultTable> recorded(String serverName, List<String> tags, TimeWindow window) {
    validateWindow(window);
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("maxCount", properties.getRecordedMaxCount());
    return retrieve(serverName, tags, window, RetrievalMode.RECORDED, params);
  }

  /**
   * Values resampled every <code>interval</code>, for example <code>5m</code>.
   */
  public Mono<ResultTable> interpolated(String serverName, List<String> tags, TimeWindow window,
                                        String interval) {
    RequestValidator.validateInterval(interval);
    validateWindow(window);
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("interval", interval);
    return retrieve(serverName, tags, window, RetrievalMode.INTERPOLATED, params);
  }

  /**
   * Summary using the configured default summary type.
   */
  public Mono<ResultTable> summary(String serverName, List<String> tags, TimeWindow window,
                                   String summaryDuration) {
    return summary(serverName, tags, window, summaryDuration, properties.getDefaultSummaryType());
  }

  /**
   * One aggregated value of kind <code>summaryType</code> per <code>summaryDuration</code>
   * bucket, for example <code>1h</code> and <code>Average</code>.
   */
  public Mono<ResultTable> summary(String serverName, List<String> tags, TimeWindow window,
                                   String summaryDuration, String summaryType) {
    RequestValidator.validateSummary(summaryDuration, summaryType);
    validateWindow(window);
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("summaryDuration", summaryDuration);
    params.put("summaryType", summaryType);
    if (StringUtils.hasText(properties.getSummarySelectedFields())) {
      params.put("selectedFields", properties.getSummarySelectedFields());
    }
    return retrieve(serverName, tags, window, RetrievalMode.SUMMARY, params);
  }

  private Mono<ResultTable> retrieve(String serverName, List<String> tags, TimeWindow window,
                                     RetrievalMode mode, Map<String, Object> params) {
    return identifierResolver.webIds(serverName, tags)
        .flatMap(bindings -> Flux.fromIterable(bindings)
            .concatMap(binding -> fetch(binding, window, mode, params))
            .reduceWith(ResultTable::new, ResultTable::append)
        )
        .doOnNext(table -> log.debug("Retrieved {} {} rows for data server '{}'",
            table.size(), mode.getEndpoint(), serverName));
  }

  private Mono<List<ValueRow>> fetch(TagBinding binding, TimeWindow window, RetrievalMode mode,
                                     Map<String, Object> params) {
    log.debug("Fetching {} data for tag '{}'", mode.getEndpoint(), binding.getTag());
    return webClientUtils.get(uriBuilder -> streamUri(uriBuilder, binding, window, mode, params))
        .map(response -> classify(binding, mode, response))
        .onErrorResume(e -> {
          log.error("Failed to get data for tag '{}': {}", binding.getTag(), e.getMessage());
          count(mode, "failed");
          return Mono.just(List.of());
        });
  }

  private URI streamUri(UriBuilder uriBuilder, TagBinding binding, TimeWindow window,
                        RetrievalMode mode, Map<String, Object> params) {
    Map<String, Object> variables = new LinkedHashMap<>();
    variables.put("webId", binding.getWebId());
    uriBuilder.path("/streams/{webId}/" + mode.getEndpoint());
    if (window.getStart() != null) {
      uriBuilder.queryParam("startTime", "{startTime}");
      variables.put("startTime", window.getStart());
    }
    if (window.getEnd() != null) {
      uriBuilder.queryParam("endTime", "{endTime}");
      variables.put("endTime", window.getEnd());
    }
    params.forEach((name, value) -> {
      uriBuilder.queryParam(name, "{" + name + "}");
      variables.put(name, value);
    });
    return uriBuilder.build(variables);
  }

  private List<ValueRow> classify(TagBinding binding, RetrievalMode mode, PiResponse response) {
    String tag = binding.getTag();
    switch (response.getStatus()) {
      case 200:
        List<ValueRow> rows = toRows(tag, mode, response);
        if (rows == null) {
          log.error("No data found for tag '{}' in the specified time range.", tag);
          count(mode, "empty");
          return List.of();
        }
        count(mode, "ok");
        return rows;
      case 400:
        log.error("Bad request for tag '{}': {} - {}", tag, response.getStatus(), response.getBody());
        count(mode, "bad_request");
        return List.of();
      case 409:
        log.error("Conflict error for tag '{}': {} - {}", tag, response.getStatus(), response.getBody());
        count(mode, "conflict");
        return List.of();
      default:
        log.error("Failed to get data for tag '{}': {} - {}", tag, response.getStatus(), response.getBody());
        count(mode, "failed");
        return List.of();
    }
  }

  /**
   * Returns null if the response held no items.
   */
  private List<ValueRow> toRows(String tag, RetrievalMode mode, PiResponse response) {
    if (mode == RetrievalMode.SUMMARY) {
      List<SummaryValue> items = webClientUtils.readItems(response, SummaryValue.class).getItems();
      return items == null || items.isEmpty() ? null : tabularAssembler.toSummaryRows(tag, items);
    }
    List<StreamValue> items = webClientUtils.readItems(response, StreamValue.class).getItems();
    return items == null || items.isEmpty() ? null : tabularAssembler.toRows(tag, items);
  }

  private void validateWindow(TimeWindow window) {
    if (window == null) {
      throw new PiConfigurationException("Time window must be provided.");
    }
  }

  private void count(RetrievalMode mode, String outcome) {
    meterRegistry.counter(METRIC_REQUESTS, "mode", mode.getEndpoint(), "outcome", outcome)
        .increment();
  }
}
