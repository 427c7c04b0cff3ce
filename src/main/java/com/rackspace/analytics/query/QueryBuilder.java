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

package com.rackspace.analytics.query;

import com.rackspace.analytics.datasource.AnalyticsDataSource;
import com.rackspace.analytics.datasource.SqlDialect;
import com.rackspace.analytics.model.AnalyticsCollection;
import com.rackspace.analytics.model.Granularity;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Accumulates the parts of a single aggregate <code>SELECT</code> and renders them with the
 * given dialect. Every value is serialized as it is added, so a builder only ever holds query
 * text. Instances are not thread-safe and are meant to be owned by one metric computation.
 */
@Slf4j
public class QueryBuilder {

  private final List<String> columns = new ArrayList<>();
  private final List<FilterClause> filters = new ArrayList<>();
  private final List<String> groupBy = new ArrayList<>();
  private List<FilterClause> having;
  private final AnalyticsCollection table;
  @Getter
  private final SqlDialect dialect;
  private boolean distinct;

  public QueryBuilder(AnalyticsCollection table, SqlDialect dialect) {
    this.table = table;
    this.dialect = dialect;
  }

  public void addSelectColumn(Object column) throws QueryBuildingException {
    columns.add(serialize(column, "select column"));
  }

  public void setDistinct() {
    distinct = true;
  }

  public void addFilterClause(Object key, Object value) throws QueryBuildingException {
    addCustomFilterClause(key, value, FilterType.EQUAL);
  }

  public void addBoolFilterClause(Object key, Object value) throws QueryBuildingException {
    addCustomFilterClause(key, value, FilterType.EQUAL_BOOL);
  }

  public void addCustomFilterClause(Object lhs, Object rhs, FilterType type)
      throws QueryBuildingException {
    filters.add(new FilterClause(
        serialize(lhs, "filter key"),
        type,
        serialize(rhs, "filter value")
    ));
  }

  /**
   * Adds an <code>IN</code> filter. Whitespace is removed from every serialized value so that a
   * crafted value cannot smuggle additional SQL tokens into the list.
   */
  public void addFilterInRangeClause(Object key, Collection<?> values)
      throws QueryBuildingException {
    final List<String> quoted = new ArrayList<>(values.size());
    for (Object value : values) {
      quoted.add(quote(StringUtils.deleteWhitespace(serialize(value, "range filter value"))));
    }
    addCustomFilterClause(key, String.join(", ", quoted), FilterType.IN);
  }

  public void addGroupByClause(Object column) throws QueryBuildingException {
    groupBy.add(serialize(column, "group by field"));
  }

  /**
   * Adds a select column that truncates the row timestamp natively to the granularity, for
   * dialects that support interval truncation.
   */
  public void addGranularityInMins(Granularity granularity) throws QueryBuildingException {
    addSelectColumn(dialect.granularityInMins(granularity));
  }

  public void addHavingClause(Aggregate<?> aggregate, FilterType type, Object value)
      throws QueryBuildingException {
    final FilterClause entry = new FilterClause(
        serialize(aggregate, "having aggregate"),
        type,
        serialize(value, "having value")
    );
    if (having == null) {
      having = new ArrayList<>();
    }
    having.add(entry);
  }

  /**
   * Renders the accumulated clauses. The builder is left untouched, so repeated calls agree.
   */
  public String buildQuery() throws QueryBuildingException {
    if (columns.isEmpty()) {
      throw QueryBuildingException.invalidQuery("No select fields provided");
    }
    final StringBuilder query = new StringBuilder("SELECT ");

    if (distinct) {
      query.append("DISTINCT ");
    }

    query.append(String.join(", ", columns));

    query.append(" FROM ");
    query.append(serialize(table, "table value"));

    if (!filters.isEmpty()) {
      query.append(" WHERE ");
      query.append(getFilterClause());
    }

    if (!groupBy.isEmpty()) {
      query.append(" GROUP BY ");
      query.append(String.join(", ", groupBy));
    }

    if (having != null && !having.isEmpty()) {
      query.append(" HAVING ");
      query.append(getHavingClause());
    }
    return query.toString();
  }

  /**
   * Renders the query and hands it to the data source. Problems building the query are thrown
   * from this method; problems running it are signalled by the returned {@link Mono} as
   * {@link com.rackspace.analytics.datasource.QueryExecutionException}.
   */
  public <R> Mono<List<R>> executeQuery(AnalyticsDataSource store, Class<R> rowType)
      throws QueryBuildingException {
    final String query = buildQuery();
    log.debug("Executing analytics query={}", query);
    return store.loadResults(query, rowType);
  }

  private String getFilterClause() {
    return filters.stream()
        .map(filter -> {
          final String l = filter.getLhs();
          final String r = filter.getRhs();
          return switch (filter.getType()) {
            case EQUAL_BOOL -> l + " = " + r;
            case EQUAL -> l + " = " + quote(r);
            case IN -> l + " IN (" + r + ")";
            case GTE -> l + " >= " + quote(r);
            case GT -> l + " > " + r;
            case LTE -> l + " <= " + quote(r);
          };
        })
        .collect(Collectors.joining(" AND "));
  }

  // operands are unquoted aggregate comparisons; LTE renders as a strict '<', unlike WHERE
  private String getHavingClause() {
    return having.stream()
        .map(filter -> {
          final String l = filter.getLhs();
          final String r = filter.getRhs();
          return switch (filter.getType()) {
            case EQUAL, EQUAL_BOOL -> l + " = " + r;
            case IN -> l + " IN (" + r + ")";
            case GTE -> l + " >= " + r;
            case LTE -> l + " < " + r;
            case GT -> l + " > " + r;
          };
        })
        .collect(Collectors.joining(" AND "));
  }

  private String serialize(Object value, String what) throws QueryBuildingException {
    try {
      return dialect.toSql(value);
    } catch (QueryBuildingException e) {
      throw QueryBuildingException.serializeError("Error serializing " + what, e);
    }
  }

  private static String quote(String value) {
    return "'" + value.replace("'", "''") + "'";
  }
}
