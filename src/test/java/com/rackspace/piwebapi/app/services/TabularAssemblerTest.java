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

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.rackspace.piwebapi.app.model.StreamValue;
import com.rackspace.piwebapi.app.model.SummaryValue;
import com.rackspace.piwebapi.app.model.ValueRow;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TabularAssemblerTest {

  final TabularAssembler tabularAssembler = new TabularAssembler();

  @Test
  void toRows() {
    List<ValueRow> rows = tabularAssembler.toRows("A", List.of(
        new StreamValue().setTimestamp("2023-10-01T12:00:00Z").setValue(DoubleNode.valueOf(1.5))
            .setUnitsAbbreviation("degC").setGood(true),
        new StreamValue().setTimestamp("2023-10-01T13:00:00Z").setValue(TextNode.valueOf("2.5"))
    ));

    assertThat(rows).hasSize(2);
    assertThat(rows).extracting(ValueRow::getTag).containsOnly("A");
    assertThat(rows.get(0).getTimestamp()).isEqualTo(Instant.parse("2023-10-01T12:00:00Z"));
    assertThat(rows.get(0).getValue()).isEqualTo(1.5);
    assertThat(rows.get(0).getUnitsAbbreviation()).isEqualTo("degC");
    assertThat(rows.get(0).getGood()).isTrue();
    assertThat(rows.get(1).getValue()).isEqualTo(2.5);
    assertThat(rows.get(1).getSummaryType()).isNull();
  }

  @Test
  void offsetWithoutColonKeepsRow() {
    List<ValueRow> rows = tabularAssembler.toRows("A", List.of(
        new StreamValue().setTimestamp("2023-10-01T00:00:00+0000").setValue(TextNode.valueOf("1"))
    ));

    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getTimestamp()).isEqualTo(Instant.parse("2023-10-01T00:00:00Z"));
    assertThat(rows.get(0).getValue()).isEqualTo(1.0);
  }

  @Test
  void nonNumericValueKeepsRow() {
    List<ValueRow> rows = tabularAssembler.toRows("A", List.of(
        new StreamValue().setTimestamp("2023-10-01T12:00:00Z").setValue(TextNode.valueOf("abc"))
    ));

    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getValue()).isNull();
    assertThat(rows.get(0).getTag()).isEqualTo("A");
  }

  @Test
  void digitalStateValueIsNull() throws Exception {
    StreamValue digital = new ObjectMapper().readValue(
        "{\"Timestamp\":\"2023-10-01T12:00:00Z\",\"Value\":{\"Name\":\"Bad Input\",\"Value\":307}}",
        StreamValue.class);

    List<ValueRow> rows = tabularAssembler.toRows("A", List.of(digital));

    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getValue()).isNull();
  }

  @Test
  void malformedTimestampDropsRow() {
    List<ValueRow> rows = tabularAssembler.toRows("A", Arrays.asList(
        new StreamValue().setTimestamp("not a time").setValue(DoubleNode.valueOf(1)),
        null,
        new StreamValue().setTimestamp("2023-10-01T12:00:00Z").setValue(DoubleNode.valueOf(2))
    ));

    assertThat(rows).extracting(ValueRow::getValue).containsExactly(2.0);
  }

  @Test
  void toSummaryRows() {
    List<ValueRow> rows = tabularAssembler.toSummaryRows("B", Arrays.asList(
        new SummaryValue().setType("Average").setValue(
            new StreamValue().setTimestamp("2023-10-01T12:00:00Z").setValue(DoubleNode.valueOf(10))),
        new SummaryValue().setType("Average"),
        new SummaryValue().setType("Average").setValue(
            new StreamValue().setTimestamp("2023-10-01T13:00:00Z").setValue(TextNode.valueOf("x")))
    ));

    assertThat(rows).hasSize(2);
    assertThat(rows).extracting(ValueRow::getSummaryType).containsOnly("Average");
    assertThat(rows).extracting(ValueRow::getValue).containsExactly(10.0, null);
    assertThat(rows.get(1).getTimestamp()).isEqualTo(Instant.parse("2023-10-01T13:00:00Z"));
  }

  @Test
  void coerceValue() {
    assertThat(TabularAssembler.coerceValue(DoubleNode.valueOf(3.25))).isEqualTo(3.25);
    assertThat(TabularAssembler.coerceValue(TextNode.valueOf(" -4.5 "))).isEqualTo(-4.5);
    assertThat(TabularAssembler.coerceValue(BooleanNode.TRUE)).isEqualTo(1.0);
    assertThat(TabularAssembler.coerceValue(BooleanNode.FALSE)).isEqualTo(0.0);
    assertThat(TabularAssembler.coerceValue(TextNode.valueOf("abc"))).isNull();
    assertThat(TabularAssembler.coerceValue(TextNode.valueOf("  "))).isNull();
    assertThat(TabularAssembler.coerceValue(TextNode.valueOf("1e3"))).isEqualTo(1000.0);
    assertThat(TabularAssembler.coerceValue(TextNode.valueOf(".5"))).isEqualTo(0.5);
    assertThat(TabularAssembler.coerceValue(TextNode.valueOf("1d"))).isNull();
    assertThat(TabularAssembler.coerceValue(TextNode.valueOf("2f"))).isNull();
    assertThat(TabularAssembler.coerceValue(TextNode.valueOf("0x1p3"))).isNull();
    assertThat(TabularAssembler.coerceValue(NullNode.getInstance())).isNull();
    assertThat(TabularAssembler.coerceValue(null)).isNull();
  }
}
