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

import com.rackspace.analytics.metrics.CountAccumulator;
import com.rackspace.analytics.metrics.SuccessRateAccumulator;
import com.rackspace.analytics.metrics.SumAccumulator;
import com.rackspace.analytics.model.RefundStatus;
import com.rackspace.analytics.model.refunds.RefundMetricsBucketValue;

public class RefundMetricsAccumulator {

  private final SuccessRateAccumulator successRate = new SuccessRateAccumulator();
  private final CountAccumulator count = new CountAccumulator();
  private final CountAccumulator successCount = new CountAccumulator();
  private final SumAccumulator processedAmount = new SumAccumulator();

  public void add(RefundMetrics metric, RefundMetricRow row) {
    switch (metric) {
      case REFUND_SUCCESS_RATE ->
          successRate.add(row.getRefundStatus() == RefundStatus.SUCCESS, row.getCount());
      case REFUND_COUNT -> count.add(row.getCount());
      case REFUND_SUCCESS_COUNT -> successCount.add(row.getCount());
      case REFUND_PROCESSED_AMOUNT -> processedAmount.add(row.getTotal());
    }
  }

  public RefundMetricsBucketValue collect() {
    return new RefundMetricsBucketValue()
        .setRefundSuccessRate(successRate.collect())
        .setRefundCount(count.collect())
        .setRefundSuccessCount(successCount.collect())
        .setRefundProcessedAmount(processedAmount.collect());
  }
}
