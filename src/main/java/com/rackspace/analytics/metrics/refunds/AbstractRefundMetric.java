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
import com.rackspace.analytics.datasource.SqlDialect;
import com.rackspace.analytics.metrics.MetricLoader;
import com.rackspace.analytics.model.AnalyticsCollection;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import com.rackspace.analytics.model.refunds.RefundDimensions;
import com.rackspace.analytics.model.refunds.RefundFilters;
import com.rackspace.analytics.model.refunds.RefundMetricsBucketIdentifier;
import com.rackspace.analytics.query.Aggregate;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import com.rackspace.analytics.utils.DateTimeUtils;
import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

public abstract class AbstractRefundMetric implements RefundMetric {

  static final String MERCHANT_ID = "merchant_id";
  static final String REFUND_STATUS = "refund_status";
  static final String REFUND_AMOUNT = "refund_amount";

  protected abstract QueryBuilder buildQuery(List<RefundDimensions> dimensions,
                                             String merchantId,
                                             RefundFilters filters,
                                             @Nullable Granularity granularity,
                                             TimeRange timeRange,
                                             SqlDialect dialect) throws QueryBuildingException;

  @Override
  public Mono<Map<RefundMetricsBucketIdentifier, RefundMetricRow>> loadMetrics(
      List<RefundDimensions> dimensions, String merchantId, RefundFilters filters,
      Granularity granularity, TimeRange timeRange, AnalyticsDataSource pool) {
    return MetricLoader.load(
        getClass().getSimpleName(),
        pool,
        RefundMetricRow.class,
        dialect -> buildQuery(dimensions, merchantId, filters, granularity, timeRange, dialect),
        row -> new RefundMetricsBucketIdentifier(
            row.getCurrency(),
            row.getRefundStatus(),
            row.getConnector(),
            row.getRefundType(),
            DateTimeUtils.bucketRange(granularity, row.getStartBucket(), timeRange)
        ),
        RefundMetricRow::merge
    );
  }

  static QueryBuilder selectDimensions(List<RefundDimensions> dimensions, SqlDialect dialect)
      throws QueryBuildingException {
    final QueryBuilder queryBuilder = new QueryBuilder(AnalyticsCollection.REFUND, dialect);
    for (RefundDimensions dimension : dimensions) {
      queryBuilder.addSelectColumn(dimension);
    }
    return queryBuilder;
  }

  static void addCommonClauses(QueryBuilder queryBuilder,
                               List<RefundDimensions> groupBy,
                               String merchantId,
                               RefundFilters filters,
                               @Nullable Granularity granularity,
                               TimeRange timeRange) throws QueryBuildingException {
    queryBuilder.addSelectColumn(Aggregate.count("count"));
    queryBuilder.addSelectColumn(Aggregate.min(TimeRange.CREATED_AT, "start_bucket"));
    queryBuilder.addSelectColumn(Aggregate.max(TimeRange.CREATED_AT, "end_bucket"));

    filters.setFilterClause(queryBuilder);
    queryBuilder.addFilterClause(MERCHANT_ID, merchantId);
    timeRange.setFilterClause(queryBuilder);

    for (RefundDimensions dimension : groupBy) {
      queryBuilder.addGroupByClause(dimension);
    }
    if (granularity != null) {
      granularity.setGroupByClause(queryBuilder);
    }
  }
}
