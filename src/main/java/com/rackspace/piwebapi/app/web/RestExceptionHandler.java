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

import com.rackspace.piwebapi.app.model.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

@RestControllerAdvice
@Slf4j
public class RestExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
    log.debug("Rejecting request: {}", e.getMessage());
    return respondWith(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ApiErrorResponse> handleServerWebInputException(ServerWebInputException e) {
    // avoid logs cluttering for bad requests
    log.trace("Rejecting request input", e);
    return respondWith(HttpStatus.BAD_REQUEST, e.getReason());
  }

  private ResponseEntity<ApiErrorResponse> respondWith(HttpStatus status, String message) {
    return ResponseEntity.status(status)
        .body(new ApiErrorResponse().setStatus(status.value()).setMessage(message));
  }
}
