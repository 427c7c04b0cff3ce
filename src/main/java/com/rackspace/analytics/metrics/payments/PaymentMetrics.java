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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rackspace.analytics.datasource.AnalyticsDataSource;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import com.rackspace.analytics.model.payments.PaymentDimensions;
import com.rackspace.analytics.model.payments.PaymentFilters;
import com.rackspace.analytics.model.payments.PaymentMetricsBucketIdentifier;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import reactor.core.publisher.Mono;

/**
 * The payment metrics that can be requested. Each constant delegates to its implementation.
 */
public enum PaymentMetrics implements PaymentMetric {
  @JsonProperty("payment_success_rate")
  PAYMENT_SUCCESS_RATE,
  @JsonProperty("payment_count")
  PAYMENT_COUNT,
  @JsonProperty("payment_success_count")
  PAYMENT_SUCCESS_COUNT,
  @JsonProperty("payment_processed_amount")
  PAYMENT_PROCESSED_AMOUNT,
  @JsonProperty("avg_ticket_size")
  AVG_TICKET_SIZE;

  @Override
  public Mono<Map<PaymentMetricsBucketIdentifier, PaymentMetricRow>> loadMetrics(
      List<PaymentDimensions> dimensions, String merchantId, PaymentFilters filters,
      Granularity granularity, TimeRange timeRange, AnalyticsDataSource pool) {
    return implementation()
        .loadMetrics(dimensions, merchantId, filters, granularity, timeRange, pool);
  }

  PaymentMetric implementation() {
    return switch (this) {
      case PAYMENT_SUCCESS_RATE -> new PaymentSuccessRate();
      case PAYMENT_COUNT -> new PaymentCount();
      case PAYMENT_SUCCESS_COUNT -> new PaymentSuccessCount();
      case PAYMENT_PROCESSED_AMOUNT -> new PaymentProcessedAmount();
      case AVG_TICKET_SIZE -> new AvgTicketSize();
    };
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
