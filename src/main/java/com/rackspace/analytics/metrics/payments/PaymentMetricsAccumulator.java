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

import com.rackspace.analytics.metrics.AverageAccumulator;
import com.rackspace.analytics.metrics.CountAccumulator;
import com.rackspace.analytics.metrics.SuccessRateAccumulator;
import com.rackspace.analytics.metrics.SumAccumulator;
import com.rackspace.analytics.model.AttemptStatus;
import com.rackspace.analytics.model.payments.PaymentMetricsBucketValue;

/**
 * Folds the rows of every requested payment metric that share a bucket into one value.
 */
public class PaymentMetricsAccumulator {

  private final SuccessRateAccumulator successRate = new SuccessRateAccumulator();
  private final CountAccumulator count = new CountAccumulator();
  private final CountAccumulator successCount = new CountAccumulator();
  private final SumAccumulator processedAmount = new SumAccumulator();
  private final AverageAccumulator avgTicketSize = new AverageAccumulator();

  public void add(PaymentMetrics metric, PaymentMetricRow row) {
    switch (metric) {
      case PAYMENT_SUCCESS_RATE ->
          successRate.add(row.getStatus() == AttemptStatus.CHARGED, row.getCount());
      case PAYMENT_COUNT -> count.add(row.getCount());
      case PAYMENT_SUCCESS_COUNT -> successCount.add(row.getCount());
      case PAYMENT_PROCESSED_AMOUNT -> processedAmount.add(row.getTotal());
      case AVG_TICKET_SIZE -> avgTicketSize.add(row.getTotal(), row.getCount());
    }
  }

  public PaymentMetricsBucketValue collect() {
    return new PaymentMetricsBucketValue()
        .setPaymentSuccessRate(successRate.collect())
        .setPaymentCount(count.collect())
        .setPaymentSuccessCount(successCount.collect())
        .setPaymentProcessedAmount(processedAmount.collect())
        .setAvgTicketSize(avgTicketSize.collect());
  }
}
