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

import com.rackspace.analytics.datasource.AnalyticsDataSource;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import com.rackspace.analytics.model.refunds.RefundDimensions;
import com.rackspace.analytics.model.refunds.RefundFilters;
import com.rackspace.analytics.model.refunds.RefundMetricsBucketIdentifier;
import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

public interface RefundMetric {

  Mono<Map<RefundMetricsBucketIdentifier, RefundMetricRow>> loadMetrics(
      List<RefundDimensions> dimensions,
      String merchantId,
      RefundFilters filters,
      @Nullable Granularity granularity,
      TimeRange timeRange,
      AnalyticsDataSource pool);
}
