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

package com.rackspace.analytics.model.refunds;

import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.rackspace.analytics.model.Connector;
import com.rackspace.analytics.model.Currency;
import com.rackspace.analytics.model.RefundStatus;
import com.rackspace.analytics.model.RefundType;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import com.rackspace.analytics.query.QueryFilter;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.util.CollectionUtils;

@Data
@JsonNaming(SnakeCaseStrategy.class)
public class RefundFilters implements QueryFilter {

  List<Currency> currency = new ArrayList<>();
  List<RefundStatus> refundStatus = new ArrayList<>();
  List<Connector> connector = new ArrayList<>();
  List<RefundType> refundType = new ArrayList<>();

  @Override
  public void setFilterClause(QueryBuilder builder) throws QueryBuildingException {
    if (!CollectionUtils.isEmpty(currency)) {
      builder.addFilterInRangeClause(RefundDimensions.CURRENCY, currency);
    }
    if (!CollectionUtils.isEmpty(refundStatus)) {
      builder.addFilterInRangeClause(RefundDimensions.REFUND_STATUS, refundStatus);
    }
    if (!CollectionUtils.isEmpty(connector)) {
      builder.addFilterInRangeClause(RefundDimensions.CONNECTOR, connector);
    }
    if (!CollectionUtils.isEmpty(refundType)) {
      builder.addFilterInRangeClause(RefundDimensions.REFUND_TYPE, refundType);
    }
  }
}
