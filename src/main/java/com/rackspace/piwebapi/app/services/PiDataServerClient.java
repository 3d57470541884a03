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

import com.rackspace.piwebapi.app.model.ResultTable;
import com.rackspace.piwebapi.app.model.ServerIdentity;
import com.rackspace.piwebapi.app.model.TagBinding;
import com.rackspace.piwebapi.app.model.TimeWindow;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Blocking entry points for callers outside of a reactive pipeline. Each call blocks until
 * every request of the call has completed.
 * <p>
 * An empty Optional means the call produced nothing usable: the server or every tag failed to
 * resolve, or no tags were given. The reason is only visible in the log.
 */
@Component
public class PiDataServerClient {

  private final IdentifierResolver identifierResolver;
  private final StreamRetrievalService streamRetrievalService;
  private final StreamWriteService streamWriteService;

  @Autowired
  public PiDataServerClient(IdentifierResolver identifierResolver,
                            StreamRetrievalService streamRetrievalService,
                            StreamWriteService streamWriteService) {
    this.identifierResolver = identifierResolver;
    this.streamRetrievalService = streamRetrievalService;
    this.streamWriteService = streamWriteService;
  }

  public Optional<ServerIdentity> dataServer(String serverName) {
    return identifierResolver.resolveServer(serverName).blockOptional();
  }

  public Optional<List<TagBinding>> webIds(String serverName, List<String> tags) {
    return identifierResolver.webIds(serverName, tags).blockOptional();
  }

  public Optional<ResultTable> recordedData(String serverName, List<String> tags,
                                            String startTime, String endTime) {
    return streamRetrievalService.recorded(serverName, tags, TimeWindow.of(startTime, endTime))
        .blockOptional();
  }

  public Optional<ResultTable> interpolatedData(String serverName, List<String> tags,
                                                String startTime, String endTime,
                                                String interval) {
    return streamRetrievalService.interpolated(serverName, tags,
            TimeWindow.of(startTime, endTime), interval)
        .blockOptional();
  }

  public Optional<ResultTable> summaryData(String serverName, List<String> tags,
                                           String startTime, String endTime,
                                           String summaryDuration) {
    return streamRetrievalService.summary(serverName, tags,
            TimeWindow.of(startTime, endTime), summaryDuration)
        .blockOptional();
  }

  public Optional<ResultTable> summaryData(String serverName, List<String> tags,
                                           String startTime, String endTime,
                                           String summaryDuration, String summaryType) {
    return streamRetrievalService.summary(serverName, tags,
            TimeWindow.of(startTime, endTime), summaryDuration, summaryType)
        .blockOptional();
  }

  public boolean sendRecordedValue(String webId, Map<String, ?> data) {
    return Boolean.TRUE.equals(streamWriteService.writeRecordedValue(webId, data).block());
  }
}
