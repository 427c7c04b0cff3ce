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
import com.rackspace.analytics.query.Aggregate;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import com.rackspace.analytics.query.ToSql;
import java.time.LocalDateTime;

/**
 * Renders typed values into the literal query text of one backend. The
 * {@link QueryBuilder} only ever talks to this interface, so the same metric query can be
 * assembled for any backend.
 */
public interface SqlDialect {

  String collectionName(AnalyticsCollection collection);

  String timestamp(LocalDateTime value);

  /**
   * Adds the group by expressions that place rows into the buckets of the given granularity.
   */
  void setGroupByClause(Granularity granularity, QueryBuilder builder)
      throws QueryBuildingException;

  /**
   * @return a select expression, aliased <code>time_bucket</code>, that truncates the row
   * timestamp to the start of its bucket
   */
  String granularityInMins(Granularity granularity) throws QueryBuildingException;

  default String aggregate(Aggregate<?> aggregate) throws QueryBuildingException {
    final String function = aggregate.getFunction().name().toLowerCase();
    final String field;
    if (aggregate.getField() != null) {
      field = toSql(aggregate.getField());
    } else if (aggregate.getFunction() == Aggregate.Function.COUNT) {
      field = "*";
    } else {
      throw QueryBuildingException.serializeError(function + " requires a field");
    }
    final String rendered = function + "(" + field + ")";
    return aggregate.getAlias() == null ? rendered : rendered + " as " + aggregate.getAlias();
  }

  default String toSql(Object value) throws QueryBuildingException {
    if (value == null) {
      throw QueryBuildingException.serializeError("null value");
    }
    if (value instanceof AnalyticsCollection) {
      return collectionName((AnalyticsCollection) value);
    }
    if (value instanceof Aggregate) {
      return aggregate((Aggregate<?>) value);
    }
    if (value instanceof LocalDateTime) {
      return timestamp((LocalDateTime) value);
    }
    if (value instanceof ToSql) {
      return ((ToSql) value).toSql();
    }
    if (value instanceof CharSequence || value instanceof Boolean || value instanceof Number) {
      return value.toString();
    }
    throw QueryBuildingException.serializeError(
        "unsupported type " + value.getClass().getName());
  }
}
