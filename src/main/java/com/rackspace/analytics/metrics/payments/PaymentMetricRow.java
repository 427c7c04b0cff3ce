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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.rackspace.analytics.metrics.MetricRows;
import com.rackspace.analytics.model.AttemptStatus;
import com.rackspace.analytics.model.AuthenticationType;
import com.rackspace.analytics.model.Currency;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * One row returned by a payment metric query. Columns that were not selected stay null.
 */
@Data
@JsonNaming(SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentMetricRow {

  Currency currency;
  AttemptStatus status;
  String connector;
  AuthenticationType authenticationType;
  String paymentMethod;
  BigDecimal total;
  Long count;
  LocalDateTime startBucket;
  LocalDateTime endBucket;

  /**
   * Combines two rows that fall into the same bucket. Dimension columns are taken from
   * {@code first}, aggregates are summed and the bucket bounds widened.
   */
  public static PaymentMetricRow merge(PaymentMetricRow first, PaymentMetricRow second) {
    return new PaymentMetricRow()
        .setCurrency(first.getCurrency())
        .setStatus(first.getStatus())
        .setConnector(first.getConnector())
        .setAuthenticationType(first.getAuthenticationType())
        .setPaymentMethod(first.getPaymentMethod())
        .setTotal(MetricRows.addTotals(first.getTotal(), second.getTotal()))
        .setCount(MetricRows.addCounts(first.getCount(), second.getCount()))
        .setStartBucket(MetricRows.earliest(first.getStartBucket(), second.getStartBucket()))
        .setEndBucket(MetricRows.latest(first.getEndBucket(), second.getEndBucket()));
  }
}
