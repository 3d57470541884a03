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

import com.rackspace.piwebapi.app.validation.PiConfigurationException;
import com.rackspace.piwebapi.app.validation.RequestValidator;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFilterFunctions;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Builds the one session-scoped {@link WebClient} shared by every call of the client. Its
 * identity and TLS settings are fixed at construction.
 */
@Configuration
@Slf4j
public class WebClientConfig {

  static final String USE_SUBJECT_CREDS_ONLY = "javax.security.auth.useSubjectCredsOnly";

  private final PiWebApiProperties properties;

  @Autowired
  public WebClientConfig(PiWebApiProperties properties) {
    this.properties = properties;
  }

  @Bean
  public WebClient piWebApiWebClient(WebClient.Builder webClientBuilder) {
    RequestValidator.validateCredentials(properties);

    return webClientBuilder
        .baseUrl(properties.getBaseUrl())
        .clientConnector(new ReactorClientHttpConnector(httpClient()))
        .codecs(configurer -> configurer.defaultCodecs()
            .maxInMemorySize((int) properties.getMaxInMemorySize().toBytes()))
        .filter(authentication())
        .build();
  }

  ExchangeFilterFunction authentication() {
    if (properties.getAuth() == AuthMode.BASIC) {
      log.info("Using Basic authentication.");
      return ExchangeFilterFunctions.basicAuthentication(
          properties.getUsername(), properties.getPassword());
    }
    log.info("Using Kerberos authentication.");
    // allow GSS-API to use the native ticket cache rather than a JAAS login
    if (System.getProperty(USE_SUBJECT_CREDS_ONLY) == null) {
      log.info("Setting JVM system property {}=false for Kerberos authentication",
          USE_SUBJECT_CREDS_ONLY);
      System.setProperty(USE_SUBJECT_CREDS_ONLY, "false");
    }
    return new KerberosExchangeFilter(properties.getKerberosServiceName());
  }

  HttpClient httpClient() {
    HttpClient httpClient = HttpClient.create()
        .responseTimeout(properties.getResponseTimeout());
    if (properties.isVerifySsl()) {
      return httpClient;
    }
    log.warn("TLS certificate and host name verification is disabled for {}",
        properties.getBaseUrl());
    SslContext sslContext = insecureSslContext();
    return httpClient.secure(spec -> spec.sslContext(sslContext)
        .handlerConfigurator(handler -> {
          SSLEngine engine = handler.engine();
          SSLParameters parameters = engine.getSSLParameters();
          parameters.setEndpointIdentificationAlgorithm(null);
          engine.setSSLParameters(parameters);
        }));
  }

  private static SslContext insecureSslContext() {
    try {
      return SslContextBuilder.forClient()
          .trustManager(InsecureTrustManagerFactory.INSTANCE)
          .build();
    } catch (SSLException e) {
      throw new PiConfigurationException("Unable to create TLS context without verification", e);
    }
  }
}
