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

package com.rackspace.analytics.metrics.refunds;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rackspace.analytics.datasource.AnalyticsDataSource;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import com.rackspace.analytics.model.refunds.RefundDimensions;
import com.rackspace.analytics.model.refunds.RefundFilters;
import com.rackspace.analytics.model.refunds.RefundMetricsBucketIdentifier;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import reactor.core.publisher.Mono;

public enum RefundMetrics implements RefundMetric {
  @JsonProperty("refund_success_rate")
  REFUND_SUCCESS_RATE,
  @JsonProperty("refund_count")
  REFUND_COUNT,
  @JsonProperty("refund_success_count")
  REFUND_SUCCESS_COUNT,
  @JsonProperty("refund_processed_amount")
  REFUND_PROCESSED_AMOUNT;

  @Override
  public Mono<Map<RefundMetricsBucketIdentifier, RefundMetricRow>> loadMetrics(
      List<RefundDimensions> dimensions, String merchantId, RefundFilters filters,
      Granularity granularity, TimeRange timeRange, AnalyticsDataSource pool) {
    return implementation()
        .loadMetrics(dimensions, merchantId, filters, granularity, timeRange, pool);
  }

  RefundMetric implementation() {
    return switch (this) {
      case REFUND_SUCCESS_RATE -> new RefundSuccessRate();
      case REFUND_COUNT -> new RefundCount();
      case REFUND_SUCCESS_COUNT -> new RefundSuccessCount();
      case REFUND_PROCESSED_AMOUNT -> new RefundProcessedAmount();
    };
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
