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

package com.rackspace.piwebapi.app.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("piwebapi")
@Component
@Data
@Validated
public class PiWebApiProperties {

  /**
   * Root of the PI Web API, for example <code>https://pi.example.com/piwebapi</code>.
   */
  @NotBlank
  String baseUrl;

  /**
   * KERBEROS uses the ticket cache of the running user. Unless the JVM was started with
   * <code>javax.security.auth.useSubjectCredsOnly</code> set, building the client sets that
   * JVM-wide property to <code>false</code>.
   */
  @NotNull
  AuthMode auth = AuthMode.KERBEROS;

  /**
   * When false, server certificates and host names are not verified.
   */
  boolean verifySsl = true;

  /**
   * Required along with the password when <code>auth</code> is BASIC.
   */
  String username;

  String password;

  /**
   * Service part of the host based principal used for SPNEGO, resolved as
   * <code>{serviceName}@{host of base-url}</code>.
   */
  @NotBlank
  String kerberosServiceName = "HTTP";

  /**
   * Cap on the number of values returned per tag by a recorded request.
   */
  @Min(1)
  int recordedMaxCount = 1000;

  /**
   * Summary calculation used when a caller does not name one.
   */
  @NotBlank
  String defaultSummaryType = "Average";

  /**
   * Optional <code>selectedFields</code> filter sent with summary requests,
   * for example <code>Items.Value.Timestamp;Items.Value.Value</code>.
   */
  String summarySelectedFields;

  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration responseTimeout = Duration.ofSeconds(60);

  @NotNull
  DataSize maxInMemorySize = DataSize.ofMegabytes(16);
}
