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

import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Executes analytics queries against the PostgreSQL store over JDBC. The blocking JDBC calls are
 * moved onto the bounded elastic scheduler.
 */
@Slf4j
public class SqlxClient implements AnalyticsDataSource {

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final SqlDialect dialect = new PostgresDialect();

  public SqlxClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public SqlDialect getDialect() {
    return dialect;
  }

  @Override
  public <R> Mono<List<R>> loadResults(String query, Class<R> rowType) {
    return Mono.fromCallable(() -> jdbcTemplate.queryForList(query))
        .subscribeOn(Schedulers.boundedElastic())
        .onErrorMap(DataAccessException.class, e -> {
          log.warn("Postgres failed to execute query={}", query, e);
          return new QueryExecutionException(QueryExecutionException.Kind.DATABASE_ERROR,
              "Error running query on postgres", e);
        })
        .map(rows -> decode(rows, rowType))
        .name("sqlxLoadResults")
        .checkpoint();
  }

  private <R> List<R> decode(List<Map<String, Object>> rows, Class<R> rowType) {
    final List<R> decoded = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      try {
        decoded.add(objectMapper.convertValue(normalize(row), rowType));
      } catch (IllegalArgumentException e) {
        throw new QueryExecutionException(QueryExecutionException.Kind.ROW_EXTRACTION_FAILURE,
            "Error decoding postgres row into " + rowType.getSimpleName(), e);
      }
    }
    return decoded;
  }

  private static Map<String, Object> normalize(Map<String, Object> row) {
    final Map<String, Object> normalized = new LinkedHashMap<>();
    row.forEach((column, value) -> normalized.put(column.toLowerCase(), normalizeValue(value)));
    return normalized;
  }

  // enum typed columns come back as driver specific objects that only carry the label
  private static Object normalizeValue(Object value) {
    if (value == null || value instanceof Number || value instanceof String
        || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toLocalDateTime();
    }
    return value.toString();
  }
}
