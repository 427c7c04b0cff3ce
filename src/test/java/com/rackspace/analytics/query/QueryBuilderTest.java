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

package com.rackspace.analytics.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.analytics.datasource.AnalyticsDataSource;
import com.rackspace.analytics.datasource.ClickhouseDialect;
import com.rackspace.analytics.datasource.PostgresDialect;
import com.rackspace.analytics.model.AnalyticsCollection;
import com.rackspace.analytics.model.AttemptStatus;
import com.rackspace.analytics.model.Currency;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.payments.PaymentDimensions;
import com.rackspace.analytics.query.QueryBuildingException.Kind;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class QueryBuilderTest {

  private final QueryBuilder postgres =
      new QueryBuilder(AnalyticsCollection.PAYMENT, new PostgresDialect());

  @Test
  void requiresSelectColumn() {
    assertThatThrownBy(postgres::buildQuery)
        .isInstanceOf(QueryBuildingException.class)
        .hasMessage("Failed to build sql query: No select fields provided")
        .extracting("kind").isEqualTo(Kind.INVALID_QUERY);
  }

  @Test
  void selectOnly() throws QueryBuildingException {
    postgres.addSelectColumn(PaymentDimensions.CONNECTOR);
    postgres.addSelectColumn(Aggregate.count("count"));

    assertThat(postgres.buildQuery())
        .isEqualTo("SELECT connector, count(*) as count FROM payment_attempt");
  }

  @Test
  void distinct() throws QueryBuildingException {
    postgres.addSelectColumn("merchant_id");
    postgres.setDistinct();

    assertThat(postgres.buildQuery())
        .isEqualTo("SELECT DISTINCT merchant_id FROM payment_attempt");
  }

  @Test
  void clauseOrdering() throws QueryBuildingException {
    postgres.addSelectColumn(PaymentDimensions.CURRENCY);
    postgres.addSelectColumn(Aggregate.sum("amount", "total"));
    postgres.addFilterClause("merchant_id", "m1");
    postgres.addGroupByClause(PaymentDimensions.CURRENCY);
    postgres.addHavingClause(Aggregate.sum("amount", null), FilterType.GT, 100);

    assertThat(postgres.buildQuery()).isEqualTo(
        "SELECT currency, sum(amount) as total FROM payment_attempt"
            + " WHERE merchant_id = 'm1'"
            + " GROUP BY currency"
            + " HAVING sum(amount) > 100");
  }

  @Test
  void rendersRepeatably() throws QueryBuildingException {
    postgres.addSelectColumn(PaymentDimensions.CONNECTOR);
    postgres.addSelectColumn(Aggregate.count("count"));
    postgres.addFilterClause("merchant_id", "m1");
    postgres.addFilterInRangeClause("currency", List.of(Currency.USD, Currency.EUR));
    postgres.addGroupByClause(PaymentDimensions.CONNECTOR);
    postgres.addHavingClause(Aggregate.count(null), FilterType.GTE, 2);

    final String first = postgres.buildQuery();

    assertThat(postgres.buildQuery()).isEqualTo(first);
    assertThat(first).isEqualTo(
        "SELECT connector, count(*) as count FROM payment_attempt"
            + " WHERE merchant_id = 'm1' AND currency IN ('USD', 'EUR')"
            + " GROUP BY connector"
            + " HAVING count(*) >= 2");
  }

  @Nested
  class filters {

    @Test
    void everyType() throws QueryBuildingException {
      postgres.addSelectColumn("id");
      postgres.addFilterClause("status", AttemptStatus.CHARGED);
      postgres.addBoolFilterClause("is_test", false);
      postgres.addCustomFilterClause("created_at",
          LocalDateTime.parse("2023-01-01T00:00:00"), FilterType.GTE);
      postgres.addCustomFilterClause("created_at",
          LocalDateTime.parse("2023-01-02T00:00:00"), FilterType.LTE);
      postgres.addCustomFilterClause("amount", 10, FilterType.GT);

      assertThat(postgres.buildQuery()).isEqualTo(
          "SELECT id FROM payment_attempt WHERE status = 'charged'"
              + " AND is_test = false"
              + " AND created_at >= '2023-01-01T00:00:00'"
              + " AND created_at <= '2023-01-02T00:00:00'"
              + " AND amount > 10");
    }

    @Test
    void inRange() throws QueryBuildingException {
      postgres.addSelectColumn("id");
      postgres.addFilterInRangeClause(PaymentDimensions.CURRENCY,
          List.of(Currency.USD, Currency.EUR));

      assertThat(postgres.buildQuery())
          .isEqualTo("SELECT id FROM payment_attempt WHERE currency IN ('USD', 'EUR')");
    }

    @Test
    void inRangeStripsWhitespace() throws QueryBuildingException {
      postgres.addSelectColumn("id");
      postgres.addFilterInRangeClause("connector", List.of("str ipe", "a\tb\nc"));

      assertThat(postgres.buildQuery())
          .isEqualTo("SELECT id FROM payment_attempt WHERE connector IN ('stripe', 'abc')");
    }

    @Test
    void escapesQuotes() throws QueryBuildingException {
      postgres.addSelectColumn("id");
      postgres.addFilterClause("merchant_id", "o'brien");

      assertThat(postgres.buildQuery())
          .isEqualTo("SELECT id FROM payment_attempt WHERE merchant_id = 'o''brien'");
    }

    @Test
    void nullValue() {
      assertThatThrownBy(() -> postgres.addFilterClause("merchant_id", null))
          .isInstanceOf(QueryBuildingException.class)
          .hasMessageContaining("Error serializing filter value")
          .extracting("kind").isEqualTo(Kind.SQL_SERIALIZE_ERROR);
    }

    @Test
    void unsupportedValue() {
      assertThatThrownBy(() -> postgres.addFilterClause("merchant_id", Map.of()))
          .isInstanceOf(QueryBuildingException.class)
          .extracting("kind").isEqualTo(Kind.SQL_SERIALIZE_ERROR);
    }
  }

  @Nested
  class having {

    @Test
    void lessThanIsStrict() throws QueryBuildingException {
      postgres.addSelectColumn("connector");
      postgres.addGroupByClause("connector");
      postgres.addHavingClause(Aggregate.count(null), FilterType.LTE, 5);

      assertThat(postgres.buildQuery())
          .endsWith(" GROUP BY connector HAVING count(*) < 5");
    }

    @Test
    void multiple() throws QueryBuildingException {
      postgres.addSelectColumn("connector");
      postgres.addGroupByClause("connector");
      postgres.addHavingClause(Aggregate.count(null), FilterType.GTE, 2);
      postgres.addHavingClause(Aggregate.max("amount", null), FilterType.EQUAL, 50);

      assertThat(postgres.buildQuery())
          .endsWith(" HAVING count(*) >= 2 AND max(amount) = 50");
    }

    @Test
    void aggregateWithoutField() {
      assertThatThrownBy(() ->
          postgres.addHavingClause(Aggregate.sum(null, null), FilterType.GT, 1))
          .isInstanceOf(QueryBuildingException.class)
          .extracting("kind").isEqualTo(Kind.SQL_SERIALIZE_ERROR);
    }
  }

  @Nested
  class granularityInMins {

    @Test
    void clickhouse() throws QueryBuildingException {
      final QueryBuilder clickhouse =
          new QueryBuilder(AnalyticsCollection.PAYMENT, new ClickhouseDialect());
      clickhouse.addGranularityInMins(Granularity.FIFTEEN_MIN);

      assertThat(clickhouse.buildQuery()).isEqualTo(
          "SELECT toStartOfInterval(created_at, INTERVAL 15 MINUTE) as time_bucket"
              + " FROM payment_attempt_dist");
    }

    @Test
    void postgresNotImplemented() {
      assertThatThrownBy(() -> postgres.addGranularityInMins(Granularity.ONE_HOUR))
          .isInstanceOf(QueryBuildingException.class)
          .extracting("kind").isEqualTo(Kind.NOT_IMPLEMENTED);
    }
  }

  @Test
  void executeQueryHandsRenderedQueryToStore() throws QueryBuildingException {
    final AnalyticsDataSource store = mock(AnalyticsDataSource.class);
    when(store.loadResults(anyString(), eq(String.class)))
        .thenReturn(Mono.just(List.of("row")));
    postgres.addSelectColumn("id");

    StepVerifier.create(postgres.executeQuery(store, String.class))
        .expectNext(List.of("row"))
        .verifyComplete();

    verify(store).loadResults("SELECT id FROM payment_attempt", String.class);
  }
}
