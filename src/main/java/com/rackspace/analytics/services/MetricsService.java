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

package com.rackspace.analytics.services;

import com.rackspace.analytics.config.AppProperties;
import com.rackspace.analytics.datasource.AnalyticsDataSource;
import com.rackspace.analytics.datasource.ClickhouseClient;
import com.rackspace.analytics.datasource.SqlxClient;
import com.rackspace.analytics.metrics.payments.PaymentMetricRow;
import com.rackspace.analytics.metrics.payments.PaymentMetrics;
import com.rackspace.analytics.metrics.payments.PaymentMetricsAccumulator;
import com.rackspace.analytics.metrics.refunds.RefundMetricRow;
import com.rackspace.analytics.metrics.refunds.RefundMetrics;
import com.rackspace.analytics.metrics.refunds.RefundMetricsAccumulator;
import com.rackspace.analytics.model.MetricsBucketResponse;
import com.rackspace.analytics.model.payments.GetPaymentMetricRequest;
import com.rackspace.analytics.model.payments.PaymentDimensions;
import com.rackspace.analytics.model.payments.PaymentMetricsBucketIdentifier;
import com.rackspace.analytics.model.payments.PaymentMetricsBucketValue;
import com.rackspace.analytics.model.refunds.GetRefundMetricRequest;
import com.rackspace.analytics.model.refunds.RefundDimensions;
import com.rackspace.analytics.model.refunds.RefundMetricsBucketIdentifier;
import com.rackspace.analytics.model.refunds.RefundMetricsBucketValue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuples;

/**
 * Loads every requested metric concurrently from the configured analytics source and merges
 * their rows into one value per bucket.
 */
@Service
@Slf4j
public class MetricsService {

  static final String DOMAIN_PAYMENTS = "payments";
  static final String DOMAIN_REFUNDS = "refunds";

  private final AnalyticsDataSource sqlxClient;
  private final AnalyticsDataSource clickhouseClient;
  private final AppProperties appProperties;
  private final MeterRegistry meterRegistry;

  @Autowired
  public MetricsService(SqlxClient sqlxClient,
                        ClickhouseClient clickhouseClient,
                        AppProperties appProperties,
                        MeterRegistry meterRegistry) {
    this.sqlxClient = sqlxClient;
    this.clickhouseClient = clickhouseClient;
    this.appProperties = appProperties;
    this.meterRegistry = meterRegistry;
  }

  public Mono<List<MetricsBucketResponse<PaymentMetricsBucketValue, PaymentMetricsBucketIdentifier>>>
  getPaymentMetrics(String merchantId, GetPaymentMetricRequest request) {
    final boolean statusRequested =
        request.getGroupByNames().contains(PaymentDimensions.PAYMENT_STATUS);

    return Flux.fromIterable(request.getMetrics())
        .flatMapSequential(metric -> loadFromSource(DOMAIN_PAYMENTS, metric.toString(),
            pool -> metric.loadMetrics(
                request.getGroupByNames(),
                merchantId,
                request.getFilters(),
                request.getGranularity(),
                request.getTimeRange(),
                pool
            ))
            .map(buckets -> Tuples.of(metric, buckets))
        )
        .collect(
            LinkedHashMap<PaymentMetricsBucketIdentifier, PaymentMetricsAccumulator>::new,
            (accumulated, result) -> {
              final PaymentMetrics metric = result.getT1();
              for (Map.Entry<PaymentMetricsBucketIdentifier, PaymentMetricRow> entry :
                  result.getT2().entrySet()) {
                // success rate groups on status internally; fold that away unless asked for
                final PaymentMetricsBucketIdentifier identifier =
                    metric == PaymentMetrics.PAYMENT_SUCCESS_RATE && !statusRequested ?
                        entry.getKey().withStatus(null) : entry.getKey();
                accumulated.computeIfAbsent(identifier, id -> new PaymentMetricsAccumulator())
                    .add(metric, entry.getValue());
              }
            }
        )
        .map(accumulated -> accumulated.entrySet().stream()
            .map(entry -> new MetricsBucketResponse<>(entry.getValue().collect(), entry.getKey()))
            .collect(Collectors.toList())
        )
        .name("getPaymentMetrics")
        .checkpoint();
  }

  public Mono<List<MetricsBucketResponse<RefundMetricsBucketValue, RefundMetricsBucketIdentifier>>>
  getRefundMetrics(String merchantId, GetRefundMetricRequest request) {
    final boolean statusRequested =
        request.getGroupByNames().contains(RefundDimensions.REFUND_STATUS);

    return Flux.fromIterable(request.getMetrics())
        .flatMapSequential(metric -> loadFromSource(DOMAIN_REFUNDS, metric.toString(),
            pool -> metric.loadMetrics(
                request.getGroupByNames(),
                merchantId,
                request.getFilters(),
                request.getGranularity(),
                request.getTimeRange(),
                pool
            ))
            .map(buckets -> Tuples.of(metric, buckets))
        )
        .collect(
            LinkedHashMap<RefundMetricsBucketIdentifier, RefundMetricsAccumulator>::new,
            (accumulated, result) -> {
              final RefundMetrics metric = result.getT1();
              for (Map.Entry<RefundMetricsBucketIdentifier, RefundMetricRow> entry :
                  result.getT2().entrySet()) {
                final RefundMetricsBucketIdentifier identifier =
                    metric == RefundMetrics.REFUND_SUCCESS_RATE && !statusRequested ?
                        entry.getKey().withRefundStatus(null) : entry.getKey();
                accumulated.computeIfAbsent(identifier, id -> new RefundMetricsAccumulator())
                    .add(metric, entry.getValue());
              }
            }
        )
        .map(accumulated -> accumulated.entrySet().stream()
            .map(entry -> new MetricsBucketResponse<>(entry.getValue().collect(), entry.getKey()))
            .collect(Collectors.toList())
        )
        .name("getRefundMetrics")
        .checkpoint();
  }

  /**
   * Loads one metric from the configured source. Nothing is counted or queried until the
   * returned {@link Mono} is subscribed.
   */
  <K, V> Mono<Map<K, V>> loadFromSource(String domain, String metric,
                                        Function<AnalyticsDataSource, Mono<Map<K, V>>> load) {
    return Mono.defer(() -> {
      meterRegistry.counter("analytics.metrics.query", "domain", domain, "metric", metric)
          .increment();

      return switch (appProperties.getSource()) {
        case SQLX -> load.apply(sqlxClient);
        case CLICKHOUSE -> load.apply(clickhouseClient);
        case COMBINED_SQLX -> compareWithSecondary(domain, metric,
            load.apply(sqlxClient), load.apply(clickhouseClient));
        case COMBINED_CKH -> compareWithSecondary(domain, metric,
            load.apply(clickhouseClient), load.apply(sqlxClient));
      };
    })
        .doOnError(e -> {
          log.warn("Failed to load {} metric={}", domain, metric, e);
          errorsCounter(domain, metric).increment();
        });
  }

  /**
   * Runs both sources and yields the primary's result. A differing secondary result is logged
   * and counted, a failing secondary only logged and counted.
   */
  private <K, V> Mono<Map<K, V>> compareWithSecondary(String domain, String metric,
                                                      Mono<Map<K, V>> primary,
                                                      Mono<Map<K, V>> secondary) {
    return Mono.zip(
            primary,
            secondary
                .map(Optional::of)
                .onErrorResume(e -> {
                  log.warn("Secondary analytics source failed for {} metric={}",
                      domain, metric, e);
                  errorsCounter(domain, metric).increment();
                  return Mono.just(Optional.<Map<K, V>>empty());
                })
        )
        .map(results -> {
          results.getT2()
              .filter(secondaryResult -> !secondaryResult.equals(results.getT1()))
              .ifPresent(secondaryResult -> {
                log.warn("Analytics sources disagree for {} metric={} primary={} secondary={}",
                    domain, metric, results.getT1(), secondaryResult);
                meterRegistry.counter("analytics.metrics.mismatch", "domain", domain)
                    .increment();
              });
          return results.getT1();
        });
  }

  private Counter errorsCounter(String domain, String metric) {
    return meterRegistry.counter("analytics.metrics.errors", "domain", domain, "metric", metric);
  }
}
