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

package com.rackspace.analytics.datasource;

import com.rackspace.analytics.model.AnalyticsCollection;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Dialect of the columnar ClickHouse store, which truncates timestamps natively with
 * <code>toStartOfInterval</code>.
 */
public class ClickhouseDialect implements SqlDialect {

  public static final DateTimeFormatter DATE_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private static final String INTERVAL_EXPRESSION =
      "toStartOfInterval(created_at, INTERVAL %d MINUTE)";

  @Override
  public String collectionName(AnalyticsCollection collection) {
    return switch (collection) {
      case PAYMENT -> "payment_attempt_dist";
      case REFUND -> "refund_dist";
    };
  }

  @Override
  public String timestamp(LocalDateTime value) {
    return DATE_TIME_FORMAT.format(value);
  }

  @Override
  public void setGroupByClause(Granularity granularity, QueryBuilder builder)
      throws QueryBuildingException {
    builder.addGroupByClause(String.format(INTERVAL_EXPRESSION, granularity.getMinutes()));
  }

  @Override
  public String granularityInMins(Granularity granularity) {
    return String.format(INTERVAL_EXPRESSION, granularity.getMinutes()) + " as time_bucket";
  }
}
