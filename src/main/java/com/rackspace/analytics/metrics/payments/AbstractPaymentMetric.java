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

import com.rackspace.analytics.datasource.AnalyticsDataSource;
import com.rackspace.analytics.datasource.SqlDialect;
import com.rackspace.analytics.metrics.MetricLoader;
import com.rackspace.analytics.model.AnalyticsCollection;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import com.rackspace.analytics.model.payments.PaymentDimensions;
import com.rackspace.analytics.model.payments.PaymentFilters;
import com.rackspace.analytics.model.payments.PaymentMetricsBucketIdentifier;
import com.rackspace.analytics.query.Aggregate;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import com.rackspace.analytics.utils.DateTimeUtils;
import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

public abstract class AbstractPaymentMetric implements PaymentMetric {

  static final String MERCHANT_ID = "merchant_id";
  static final String STATUS = "status";
  static final String AMOUNT = "amount";

  /**
   * Builds the query for this metric. Implementations select the grouped dimensions along with
   * the aggregate columns of {@link PaymentMetricRow} they populate.
   */
  protected abstract QueryBuilder buildQuery(List<PaymentDimensions> dimensions,
                                             String merchantId,
                                             PaymentFilters filters,
                                             @Nullable Granularity granularity,
                                             TimeRange timeRange,
                                             SqlDialect dialect) throws QueryBuildingException;

  @Override
  public Mono<Map<PaymentMetricsBucketIdentifier, PaymentMetricRow>> loadMetrics(
      List<PaymentDimensions> dimensions, String merchantId, PaymentFilters filters,
      Granularity granularity, TimeRange timeRange, AnalyticsDataSource pool) {
    return MetricLoader.load(
        getClass().getSimpleName(),
        pool,
        PaymentMetricRow.class,
        dialect -> buildQuery(dimensions, merchantId, filters, granularity, timeRange, dialect),
        row -> new PaymentMetricsBucketIdentifier(
            row.getCurrency(),
            row.getStatus(),
            row.getConnector(),
            row.getAuthenticationType(),
            row.getPaymentMethod(),
            DateTimeUtils.bucketRange(granularity, row.getStartBucket(), timeRange)
        ),
        PaymentMetricRow::merge
    );
  }

  /**
   * Common tail of every payment metric query: the row count and bucket bounds, the caller's
   * filters scoped to the merchant and time range, then grouping by dimensions and granularity.
   */
  static void addCommonClauses(QueryBuilder queryBuilder,
                               List<PaymentDimensions> groupBy,
                               String merchantId,
                               PaymentFilters filters,
                               @Nullable Granularity granularity,
                               TimeRange timeRange) throws QueryBuildingException {
    queryBuilder.addSelectColumn(Aggregate.count("count"));
    queryBuilder.addSelectColumn(Aggregate.min(TimeRange.CREATED_AT, "start_bucket"));
    queryBuilder.addSelectColumn(Aggregate.max(TimeRange.CREATED_AT, "end_bucket"));

    filters.setFilterClause(queryBuilder);
    queryBuilder.addFilterClause(MERCHANT_ID, merchantId);
    timeRange.setFilterClause(queryBuilder);

    for (PaymentDimensions dimension : groupBy) {
      queryBuilder.addGroupByClause(dimension);
    }
    if (granularity != null) {
      granularity.setGroupByClause(queryBuilder);
    }
  }

  static QueryBuilder selectDimensions(List<PaymentDimensions> dimensions, SqlDialect dialect)
      throws QueryBuildingException {
    final QueryBuilder queryBuilder = new QueryBuilder(AnalyticsCollection.PAYMENT, dialect);
    for (PaymentDimensions dimension : dimensions) {
      queryBuilder.addSelectColumn(dimension);
    }
    return queryBuilder;
  }
}
