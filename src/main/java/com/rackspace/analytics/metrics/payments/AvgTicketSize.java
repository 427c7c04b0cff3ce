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

import com.rackspace.analytics.datasource.SqlDialect;
import com.rackspace.analytics.model.AttemptStatus;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import com.rackspace.analytics.model.payments.PaymentDimensions;
import com.rackspace.analytics.model.payments.PaymentFilters;
import com.rackspace.analytics.query.Aggregate;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import java.util.List;

/**
 * Loads the charged total and count per bucket; the average is taken once buckets are
 * accumulated.
 */
public class AvgTicketSize extends AbstractPaymentMetric {

  @Override
  protected QueryBuilder buildQuery(List<PaymentDimensions> dimensions, String merchantId,
                                    PaymentFilters filters, Granularity granularity,
                                    TimeRange timeRange, SqlDialect dialect)
      throws QueryBuildingException {
    final QueryBuilder queryBuilder = selectDimensions(dimensions, dialect);
    queryBuilder.addSelectColumn(Aggregate.sum(AMOUNT, "total"));
    queryBuilder.addFilterClause(STATUS, AttemptStatus.CHARGED);
    addCommonClauses(queryBuilder, dimensions, merchantId, filters, granularity, timeRange);
    return queryBuilder;
  }
}
