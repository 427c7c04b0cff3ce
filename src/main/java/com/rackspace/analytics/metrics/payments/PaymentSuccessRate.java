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
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import com.rackspace.analytics.model.payments.PaymentDimensions;
import com.rackspace.analytics.model.payments.PaymentFilters;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import java.util.ArrayList;
import java.util.List;

/**
 * Counts attempts per bucket and status. The status is always grouped on so charged attempts
 * can be told apart from the rest when the rate is accumulated.
 */
public class PaymentSuccessRate extends AbstractPaymentMetric {

  @Override
  protected QueryBuilder buildQuery(List<PaymentDimensions> dimensions, String merchantId,
                                    PaymentFilters filters, Granularity granularity,
                                    TimeRange timeRange, SqlDialect dialect)
      throws QueryBuildingException {
    final List<PaymentDimensions> groupBy = new ArrayList<>(dimensions);
    if (!groupBy.contains(PaymentDimensions.PAYMENT_STATUS)) {
      groupBy.add(PaymentDimensions.PAYMENT_STATUS);
    }

    final QueryBuilder queryBuilder = selectDimensions(groupBy, dialect);
    addCommonClauses(queryBuilder, groupBy, merchantId, filters, granularity, timeRange);
    return queryBuilder;
  }
}
