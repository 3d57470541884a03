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

import static com.rackspace.piwebapi.app.PiWebApiStub.items;
import static com.rackspace.piwebapi.app.PiWebApiStub.point;
import static com.rackspace.piwebapi.app.PiWebApiStub.server;
import static org.assertj.core.api.Assertions.assertThat;

import com.rackspace.piwebapi.app.PiWebApiStub;
import com.rackspace.piwebapi.app.model.ServerIdentity;
import com.rackspace.piwebapi.app.model.TagBinding;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class IdentifierResolverTest {

  PiWebApiStub stub;
  IdentifierResolver identifierResolver;

  @BeforeEach
  void setUp() {
    stub = new PiWebApiStub();
    identifierResolver = new IdentifierResolver(stub.webClientUtils());
  }

  @Nested
  class resolveServer {

    @Test
    void exactMatch() {
      stub.onDataServers(200, items(server("OTHER", "S0"), server("ARCH1", "S1")));

      StepVerifier.create(identifierResolver.resolveServer("ARCH1"))
          .expectNext(new ServerIdentity("ARCH1", "S1"))
          .verifyComplete();
    }

    @Test
    void firstMatchWins() {
      stub.onDataServers(200, items(server("ARCH1", "S1"), server("ARCH1", "S2")));

      StepVerifier.create(identifierResolver.resolveServer("ARCH1"))
          .expectNext(new ServerIdentity("ARCH1", "S1"))
          .verifyComplete();
    }

    @Test
    void matchIsCaseSensitive() {
      stub.onDataServers(200, items(server("arch1", "S1")));

      StepVerifier.create(identifierResolver.resolveServer("ARCH1"))
          .verifyComplete();
    }

    @Test
    void listingFails() {
      stub.onDataServers(500, "{\"Errors\":[\"boom\"]}");

      StepVerifier.create(identifierResolver.resolveServer("ARCH1"))
          .verifyComplete();
    }

    @Test
    void unreadableListing() {
      stub.onDataServers(200, "<html>login</html>");

      StepVerifier.create(identifierResolver.resolveServer("ARCH1"))
          .verifyComplete();
    }

    @Test
    void sendsBasicCredentials() {
      stub.onDataServers(200, items(server("ARCH1", "S1")));

      identifierResolver.resolveServer("ARCH1").block();

      assertThat(stub.getRequests()).hasSize(1);
      assertThat(stub.getRequests().get(0).headers().getFirst("Authorization"))
          .startsWith("Basic ");
    }
  }

  @Nested
  class resolveTags {

    final ServerIdentity archive = new ServerIdentity("ARCH1", "S1");

    @Test
    void firstPointWins() {
      stub.onPoints("S1", "A", 200, items(point("A", "W1"), point("A2", "W9")))
          .onPoints("S1", "B", 200, items(point("B", "W2")));

      StepVerifier.create(identifierResolver.resolveTags(archive, List.of("A", "B")))
          .expectNext(List.of(new TagBinding("A", "W1"), new TagBinding("B", "W2")))
          .verifyComplete();
    }

    @Test
    void unknownAndFailingTagsAreSkipped() {
      stub.onPoints("S1", "A", 200, items(point("A", "W1")))
          .onPoints("S1", "MISSING", 200, items())
          .onPoints("S1", "BROKEN", 502, "Bad Gateway")
          .onPoints("S1", "C", 200, items(point("C", "W3")));

      StepVerifier.create(identifierResolver.resolveTags(archive,
              List.of("A", "MISSING", "BROKEN", "C")))
          .expectNext(List.of(new TagBinding("A", "W1"), new TagBinding("C", "W3")))
          .verifyComplete();

      assertThat(stub.getRequests()).hasSize(4);
    }

    @Test
    void noTagResolves() {
      stub.onPoints("S1", "A", 200, items());

      StepVerifier.create(identifierResolver.resolveTags(archive, List.of("A")))
          .verifyComplete();
    }

    @Test
    void emptyTagList() {
      StepVerifier.create(identifierResolver.resolveTags(archive, List.of()))
          .verifyComplete();

      assertThat(stub.getRequests()).isEmpty();
    }

    @Test
    void tagNameIsEncoded() {
      stub.onPoints("S1", "UNIT 1.TEMP+", 200, items(point("UNIT 1.TEMP+", "W1")));

      StepVerifier.create(identifierResolver.resolveTags(archive, List.of("UNIT 1.TEMP+")))
          .expectNext(List.of(new TagBinding("UNIT 1.TEMP+", "W1")))
          .verifyComplete();
    }
  }

  @Nested
  class webIds {

    @Test
    void resolvesServerThenTags() {
      stub.onDataServers(200, items(server("ARCH1", "S1")))
          .onPoints("S1", "A", 200, items(point("A", "W1")));

      StepVerifier.create(identifierResolver.webIds("ARCH1", List.of("A")))
          .expectNext(List.of(new TagBinding("A", "W1")))
          .verifyComplete();

      assertThat(stub.requestedPaths()).containsExactly("/dataservers", "/dataservers/S1/points");
    }

    @Test
    void unresolvedServerStopsBeforeTagLookups() {
      stub.onDataServers(200, items(server("ARCH2", "S2")));

      StepVerifier.create(identifierResolver.webIds("ARCH1", List.of("A", "B")))
          .verifyComplete();

      assertThat(stub.requestedPaths()).containsExactly("/dataservers");
    }

    @Test
    void noTagsSendsNothing() {
      StepVerifier.create(identifierResolver.webIds("ARCH1", null))
          .verifyComplete();

      assertThat(stub.getRequests()).isEmpty();
    }
  }
}
