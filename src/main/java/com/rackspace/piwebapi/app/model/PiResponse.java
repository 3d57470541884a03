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

import lombok.Value;

/**
 * Status code and raw body of one PI Web API exchange.
 */
@Value
public class PiResponse {
  int status;
  String body;

  public boolean isOk() {
    return status == 200;
  }

  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }
}
