/*
 * Copyright 2023 Rackspace US, Inc.
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

package com.rackspace.analytics.datasource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rackspace.analytics.datasource.QueryExecutionException.Kind;
import com.rackspace.analytics.metrics.payments.PaymentMetricRow;
import com.rackspace.analytics.model.AttemptStatus;
import com.rackspace.analytics.model.Currency;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class SqlxClientTest {

  @Mock
  JdbcTemplate jdbcTemplate;

  SqlxClient sqlxClient;

  @BeforeEach
  void setUp() {
    sqlxClient = new SqlxClient(jdbcTemplate, new ObjectMapper().registerModule(new JavaTimeModule()));
  }

  @Test
  void usesPostgresDialect() {
    assertThat(sqlxClient.getDialect()).isInstanceOf(PostgresDialect.class);
  }

  @Test
  void decodesRows() {
    final String query = "SELECT currency, status, count(*) as count FROM payment_attempt";
    when(jdbcTemplate.queryForList(query)).thenReturn(List.of(
        Map.<String, Object>of(
            "CURRENCY", "USD",
            "status", new StatusLabel("charged"),
            "count", 4L,
            "total", new BigDecimal("1250"),
            "start_bucket", Timestamp.valueOf("2023-04-12 10:17:23")
        )
    ));

    StepVerifier.create(sqlxClient.loadResults(query, PaymentMetricRow.class))
        .assertNext(rows -> {
          assertThat(rows).hasSize(1);
          final PaymentMetricRow row = rows.get(0);
          assertThat(row.getCurrency()).isEqualTo(Currency.USD);
          assertThat(row.getStatus()).isEqualTo(AttemptStatus.CHARGED);
          assertThat(row.getCount()).isEqualTo(4L);
          assertThat(row.getTotal()).isEqualByComparingTo("1250");
          assertThat(row.getStartBucket())
              .isEqualTo(LocalDateTime.parse("2023-04-12T10:17:23"));
          assertThat(row.getConnector()).isNull();
        })
        .verifyComplete();
  }

  @Test
  void unknownEnumLabel() {
    when(jdbcTemplate.queryForList(anyString())).thenReturn(List.of(
        Map.<String, Object>of("currency", "XXX")
    ));

    StepVerifier.create(sqlxClient.loadResults("SELECT currency FROM payment_attempt",
            PaymentMetricRow.class))
        .expectErrorSatisfies(e -> assertThat(e)
            .isInstanceOf(QueryExecutionException.class)
            .extracting("kind").isEqualTo(Kind.ROW_EXTRACTION_FAILURE))
        .verify();
  }

  @Test
  void databaseError() {
    when(jdbcTemplate.queryForList(anyString())).thenThrow(
        new BadSqlGrammarException("query", "SELECT nope", new SQLException("syntax error")));

    StepVerifier.create(sqlxClient.loadResults("SELECT nope", PaymentMetricRow.class))
        .expectErrorSatisfies(e -> assertThat(e)
            .isInstanceOf(QueryExecutionException.class)
            .hasCauseInstanceOf(BadSqlGrammarException.class)
            .extracting("kind").isEqualTo(Kind.DATABASE_ERROR))
        .verify();
  }

  /**
   * Mimics the driver object returned for enum typed columns.
   */
  private static class StatusLabel {

    private final String label;

    StatusLabel(String label) {
      this.label = label;
    }

    @Override
    public String toString() {
      return label;
    }
  }
}
