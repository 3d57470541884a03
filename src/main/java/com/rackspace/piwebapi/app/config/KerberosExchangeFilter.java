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

import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.ietf.jgss.GSSContext;
import org.ietf.jgss.GSSException;
import org.ietf.jgss.GSSManager;
import org.ietf.jgss.GSSName;
import org.ietf.jgss.Oid;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Adds an <code>Authorization: Negotiate</code> header carrying a SPNEGO token for the
 * request's host. The token is created from the Kerberos credentials available to the JVM,
 * such as the native ticket cache, and mutual authentication is not requested.
 */
@Slf4j
public class KerberosExchangeFilter implements ExchangeFilterFunction {

  static final String SPNEGO_OID = "1.3.6.1.5.5.2";
  static final String NEGOTIATE = "Negotiate ";

  private final String serviceName;
  private final GSSManager gssManager;

  public KerberosExchangeFilter(String serviceName) {
    this(serviceName, GSSManager.getInstance());
  }

  KerberosExchangeFilter(String serviceName, GSSManager gssManager) {
    this.serviceName = serviceName;
    this.gssManager = gssManager;
  }

  @Override
  public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
    String host = request.url().getHost();
    // token creation may contact the KDC
    return Mono.fromCallable(() -> negotiateToken(host))
        .subscribeOn(Schedulers.boundedElastic())
        .map(token -> ClientRequest.from(request)
            .header(HttpHeaders.AUTHORIZATION, NEGOTIATE + token)
            .build())
        .flatMap(next::exchange);
  }

  String servicePrincipal(String host) {
    return serviceName + "@" + host;
  }

  String negotiateToken(String host) throws GSSException {
    GSSName server = gssManager.createName(servicePrincipal(host), GSSName.NT_HOSTBASED_SERVICE);
    GSSContext context = gssManager.createContext(server, new Oid(SPNEGO_OID), null,
        GSSContext.DEFAULT_LIFETIME);
    try {
      context.requestMutualAuth(false);
      context.requestCredDeleg(false);
      byte[] token = context.initSecContext(new byte[0], 0, 0);
      log.debug("Created SPNEGO token for {}", servicePrincipal(host));
      return Base64.getEncoder().encodeToString(token);
    } finally {
      context.dispose();
    }
  }
}
