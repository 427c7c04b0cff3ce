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
 * Dialect of the row oriented PostgreSQL store, which buckets rows with a two level
 * <code>DATE_TRUNC</code> and <code>FLOOR(DATE_PART)</code> grouping.
 */
public class PostgresDialect implements SqlDialect {

  public static final String MODIFIED_AT = "modified_at";

  @Override
  public String collectionName(AnalyticsCollection collection) {
    return switch (collection) {
      case PAYMENT -> "payment_attempt";
      case REFUND -> "refund";
    };
  }

  @Override
  public String timestamp(LocalDateTime value) {
    return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(value);
  }

  @Override
  public void setGroupByClause(Granularity granularity, QueryBuilder builder)
      throws QueryBuildingException {
    final String bucketScale = switch (granularity) {
      case FIVE_MIN, FIFTEEN_MIN, THIRTY_MIN -> "minute";
      case ONE_MIN, ONE_HOUR, ONE_DAY -> null;
    };

    builder.addGroupByClause(String.format("DATE_TRUNC('%s', %s)",
        granularity.getLowestCommonGranularityLevel(), MODIFIED_AT));
    if (bucketScale != null) {
      builder.addGroupByClause(String.format("FLOOR(DATE_PART('%s', %s)/%d)",
          bucketScale, MODIFIED_AT, granularity.getBucketSize()));
    }
  }

  @Override
  public String granularityInMins(Granularity granularity) throws QueryBuildingException {
    throw QueryBuildingException.notImplemented("interval truncation for postgres");
  }
}
