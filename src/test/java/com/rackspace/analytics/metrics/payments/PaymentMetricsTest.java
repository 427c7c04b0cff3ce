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

package com.rackspace.analytics.metrics.payments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.analytics.datasource.AnalyticsDataSource;
import com.rackspace.analytics.datasource.ClickhouseDialect;
import com.rackspace.analytics.datasource.PostgresDialect;
import com.rackspace.analytics.datasource.QueryExecutionException;
import com.rackspace.analytics.datasource.SqlDialect;
import com.rackspace.analytics.metrics.MetricsException;
import com.rackspace.analytics.metrics.MetricsException.Kind;
import com.rackspace.analytics.model.AttemptStatus;
import com.rackspace.analytics.model.Currency;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import com.rackspace.analytics.model.payments.PaymentDimensions;
import com.rackspace.analytics.model.payments.PaymentFilters;
import com.rackspace.analytics.model.payments.PaymentMetricsBucketIdentifier;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class PaymentMetricsTest {

  static final TimeRange TIME_RANGE = new TimeRange(
      LocalDateTime.parse("2023-01-01T00:00:00"),
      LocalDateTime.parse("2023-01-02T00:00:00")
  );

  static final SqlDialect POSTGRES = new PostgresDialect();

  @Mock
  AnalyticsDataSource pool;

  private static PaymentFilters usdOnly() {
    return new PaymentFilters().setCurrency(List.of(Currency.USD));
  }

  @Nested
  class dispatch {

    @Test
    void eachMetricHasItsOwnImplementation() {
      final Set<Class<?>> implementations = Stream.of(PaymentMetrics.values())
          .map(metric -> metric.implementation().getClass())
          .collect(Collectors.toSet());

      assertThat(implementations).containsExactlyInAnyOrder(
          PaymentSuccessRate.class,
          PaymentCount.class,
          PaymentSuccessCount.class,
          PaymentProcessedAmount.class,
          AvgTicketSize.class
      );
    }

    @ParameterizedTest
    @EnumSource(PaymentMetrics.class)
    void loadsThroughDataSourceOnce(PaymentMetrics metric) {
      when(pool.getDialect()).thenReturn(POSTGRES);
      when(pool.loadResults(anyString(), eq(PaymentMetricRow.class)))
          .thenReturn(Mono.just(List.of()));

      StepVerifier.create(metric.loadMetrics(List.of(), "m1", new PaymentFilters(), null,
              TIME_RANGE, pool))
          .assertNext(buckets -> assertThat(buckets).isEmpty())
          .verifyComplete();

      verify(pool).loadResults(anyString(), eq(PaymentMetricRow.class));
    }
  }

  @Nested
  class queries {

    @Test
    void paymentCount() throws QueryBuildingException {
      final QueryBuilder builder = new PaymentCount().buildQuery(
          List.of(PaymentDimensions.CONNECTOR), "m1", usdOnly(), Granularity.FIVE_MIN,
          TIME_RANGE, POSTGRES);

      assertThat(builder.buildQuery()).isEqualTo(
          "SELECT connector, count(*) as count, min(created_at) as start_bucket,"
              + " max(created_at) as end_bucket FROM payment_attempt"
              + " WHERE currency IN ('USD') AND merchant_id = 'm1'"
              + " AND created_at >= '2023-01-01T00:00:00'"
              + " AND created_at <= '2023-01-02T00:00:00'"
              + " GROUP BY connector, DATE_TRUNC('hour', modified_at),"
              + " FLOOR(DATE_PART('minute', modified_at)/5)");
    }

    @Test
    void paymentSuccessCount() throws QueryBuildingException {
      final QueryBuilder builder = new PaymentSuccessCount().buildQuery(
          List.of(), "m1", new PaymentFilters(), null, TIME_RANGE, POSTGRES);

      assertThat(builder.buildQuery()).isEqualTo(
          "SELECT count(*) as count, min(created_at) as start_bucket,"
              + " max(created_at) as end_bucket FROM payment_attempt"
              + " WHERE status = 'charged' AND merchant_id = 'm1'"
              + " AND created_at >= '2023-01-01T00:00:00'"
              + " AND created_at <= '2023-01-02T00:00:00'");
    }

    @Test
    void processedAmountOnClickhouse() throws QueryBuildingException {
      final QueryBuilder builder = new PaymentProcessedAmount().buildQuery(
          List.of(PaymentDimensions.CURRENCY), "m1", new PaymentFilters(), Granularity.ONE_HOUR,
          new TimeRange(LocalDateTime.parse("2023-01-01T00:00:00"), null),
          new ClickhouseDialect());

      assertThat(builder.buildQuery()).isEqualTo(
          "SELECT currency, sum(amount) as total, count(*) as count,"
              + " min(created_at) as start_bucket, max(created_at) as end_bucket"
              + " FROM payment_attempt_dist"
              + " WHERE status = 'charged' AND merchant_id = 'm1'"
              + " AND created_at >= '2023-01-01 00:00:00'"
              + " GROUP BY currency, toStartOfInterval(created_at, INTERVAL 60 MINUTE)");
    }

    @Test
    void avgTicketSizeSelectsTotalAndCount() throws QueryBuildingException {
      final String query = new AvgTicketSize().buildQuery(
          List.of(), "m1", new PaymentFilters(), null, TIME_RANGE, POSTGRES).buildQuery();

      assertThat(query)
          .startsWith("SELECT sum(amount) as total, count(*) as count,")
          .contains("status = 'charged'");
    }

    @Test
    void successRateAlwaysGroupsOnStatus() throws QueryBuildingException {
      final String query = new PaymentSuccessRate().buildQuery(
          List.of(PaymentDimensions.CURRENCY), "m1", new PaymentFilters(), null,
          TIME_RANGE, POSTGRES).buildQuery();

      assertThat(query)
          .startsWith("SELECT currency, status, count(*) as count,")
          .endsWith(" GROUP BY currency, status")
          .doesNotContain("status = 'charged'");
    }

    @Test
    void successRateDoesNotDuplicateRequestedStatus() throws QueryBuildingException {
      final String query = new PaymentSuccessRate().buildQuery(
          List.of(PaymentDimensions.PAYMENT_STATUS), "m1", new PaymentFilters(), null,
          TIME_RANGE, POSTGRES).buildQuery();

      assertThat(query).endsWith(" GROUP BY status");
    }
  }

  @Nested
  class results {

    @Test
    void bucketsKeyedByDimensionsAndTime() {
      when(pool.getDialect()).thenReturn(POSTGRES);
      when(pool.loadResults(anyString(), eq(PaymentMetricRow.class)))
          .thenReturn(Mono.just(List.of(
              new PaymentMetricRow().setConnector("stripe").setCount(3L)
                  .setStartBucket(LocalDateTime.parse("2023-01-01T10:17:23")),
              new PaymentMetricRow().setConnector("adyen").setCount(1L)
                  .setStartBucket(LocalDateTime.parse("2023-01-01T10:21:00"))
          )));

      StepVerifier.create(PaymentMetrics.PAYMENT_COUNT.loadMetrics(
              List.of(PaymentDimensions.CONNECTOR), "m1", new PaymentFilters(),
              Granularity.FIVE_MIN, TIME_RANGE, pool))
          .assertNext(buckets -> {
            assertThat(buckets).hasSize(2);
            final Map.Entry<PaymentMetricsBucketIdentifier, PaymentMetricRow> first =
                buckets.entrySet().iterator().next();
            assertThat(first.getKey().getConnector()).isEqualTo("stripe");
            assertThat(first.getKey().getTimeBucket()).isEqualTo(new TimeRange(
                LocalDateTime.parse("2023-01-01T10:15:00"),
                LocalDateTime.parse("2023-01-01T10:19:59.999999999")));
            assertThat(first.getValue().getCount()).isEqualTo(3L);
          })
          .verifyComplete();
    }

    @Test
    void rowsLandingInSameBucketAreMerged() {
      when(pool.getDialect()).thenReturn(POSTGRES);
      when(pool.loadResults(anyString(), eq(PaymentMetricRow.class)))
          .thenReturn(Mono.just(List.of(
              new PaymentMetricRow().setConnector("stripe").setCount(3L)
                  .setStartBucket(LocalDateTime.parse("2023-01-01T10:01:00"))
                  .setEndBucket(LocalDateTime.parse("2023-01-01T10:01:30")),
              new PaymentMetricRow().setConnector("stripe").setCount(1L)
                  .setStartBucket(LocalDateTime.parse("2023-01-01T10:02:00"))
                  .setEndBucket(LocalDateTime.parse("2023-01-01T10:02:45"))
          )));

      StepVerifier.create(PaymentMetrics.PAYMENT_COUNT.loadMetrics(
              List.of(PaymentDimensions.CONNECTOR), "m1", new PaymentFilters(),
              Granularity.FIVE_MIN, TIME_RANGE, pool))
          .assertNext(buckets -> {
            assertThat(buckets).hasSize(1);
            final PaymentMetricRow row = buckets.values().iterator().next();
            assertThat(row.getConnector()).isEqualTo("stripe");
            assertThat(row.getCount()).isEqualTo(4L);
            assertThat(row.getStartBucket()).isEqualTo(LocalDateTime.parse("2023-01-01T10:01:00"));
            assertThat(row.getEndBucket()).isEqualTo(LocalDateTime.parse("2023-01-01T10:02:45"));
          })
          .verifyComplete();
    }

    @Test
    void withoutGranularity() {
      when(pool.getDialect()).thenReturn(POSTGRES);
      when(pool.loadResults(anyString(), eq(PaymentMetricRow.class)))
          .thenReturn(Mono.just(List.of(
              new PaymentMetricRow().setStatus(AttemptStatus.CHARGED).setCount(3L)
                  .setStartBucket(LocalDateTime.parse("2023-01-01T10:17:23"))
          )));

      StepVerifier.create(PaymentMetrics.PAYMENT_SUCCESS_RATE.loadMetrics(
              List.of(), "m1", new PaymentFilters(), null, TIME_RANGE, pool))
          .assertNext(buckets -> assertThat(buckets.keySet())
              .containsExactly(new PaymentMetricsBucketIdentifier(null, AttemptStatus.CHARGED,
                  null, null, null, new TimeRange(TIME_RANGE.getStartTime(), null))))
          .verifyComplete();
    }

    @Test
    void executionFailure() {
      when(pool.getDialect()).thenReturn(POSTGRES);
      when(pool.loadResults(anyString(), eq(PaymentMetricRow.class)))
          .thenReturn(Mono.error(new QueryExecutionException(
              QueryExecutionException.Kind.DATABASE_ERROR, "connection refused", null)));

      StepVerifier.create(PaymentMetrics.PAYMENT_COUNT.loadMetrics(
              List.of(), "m1", new PaymentFilters(), null, TIME_RANGE, pool))
          .expectErrorSatisfies(e -> assertThat(e)
              .isInstanceOf(MetricsException.class)
              .hasCauseInstanceOf(QueryExecutionException.class)
              .extracting("kind").isEqualTo(Kind.QUERY_EXECUTION))
          .verify();
    }

    @Test
    void buildFailureNeverReachesDataSource() {
      when(pool.getDialect()).thenReturn(POSTGRES);

      StepVerifier.create(PaymentMetrics.PAYMENT_COUNT.loadMetrics(
              List.of(), null, new PaymentFilters(), null, TIME_RANGE, pool))
          .expectErrorSatisfies(e -> assertThat(e)
              .isInstanceOf(MetricsException.class)
              .hasMessageContaining("PaymentCount")
              .extracting("kind").isEqualTo(Kind.QUERY_BUILDING))
          .verify();

      verify(pool, never()).loadResults(anyString(), eq(PaymentMetricRow.class));
    }
  }
}
