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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.deser.LocalDateTimeDeserializer;
import com.rackspace.analytics.config.AppProperties;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Executes analytics queries through the ClickHouse HTTP interface, reading results in the
 * <code>JSONEachRow</code> format.
 */
@Slf4j
public class ClickhouseClient implements AnalyticsDataSource {

  static final String OUTPUT_FORMAT = " FORMAT JSONEachRow";

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final String databaseName;
  private final Duration queryTimeout;
  private final SqlDialect dialect = new ClickhouseDialect();

  public ClickhouseClient(WebClient.Builder webClientBuilder,
                          AppProperties.Clickhouse properties,
                          ObjectMapper objectMapper) {
    this.webClient = webClientBuilder
        .baseUrl(properties.getHost())
        .defaultHeaders(headers -> headers.setBasicAuth(properties.getUsername(),
            StringUtils.defaultString(properties.getPassword())))
        .build();
    this.objectMapper = objectMapper.copy()
        .registerModule(new SimpleModule("clickhouse-date-time")
            .addDeserializer(LocalDateTime.class,
                new LocalDateTimeDeserializer(ClickhouseDialect.DATE_TIME_FORMAT)));
    this.databaseName = properties.getDatabaseName();
    this.queryTimeout = properties.getQueryTimeout();
  }

  @Override
  public SqlDialect getDialect() {
    return dialect;
  }

  @Override
  public <R> Mono<List<R>> loadResults(String query, Class<R> rowType) {
    return webClient.post()
        .uri(uriBuilder -> uriBuilder
            .queryParam("database", databaseName)
            .queryParam("output_format_json_quote_64bit_integers", 0)
            .build())
        .contentType(MediaType.TEXT_PLAIN)
        .bodyValue(query + OUTPUT_FORMAT)
        .retrieve()
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .timeout(queryTimeout)
        .onErrorMap(WebClientResponseException.class, e -> {
          log.warn("Clickhouse rejected query={} status={}", query, e.getRawStatusCode());
          return new QueryExecutionException(QueryExecutionException.Kind.DATABASE_ERROR,
              "Clickhouse rejected query: " + e.getResponseBodyAsString(), e);
        })
        .onErrorMap(e -> !(e instanceof QueryExecutionException), e -> {
          log.warn("Clickhouse failed to execute query={}", query, e);
          return new QueryExecutionException(QueryExecutionException.Kind.DATABASE_ERROR,
              "Error running query on clickhouse", e);
        })
        .map(body -> decode(body, rowType))
        .name("clickhouseLoadResults")
        .checkpoint();
  }

  private <R> List<R> decode(String body, Class<R> rowType) {
    final List<R> rows = new ArrayList<>();
    for (String line : body.split("\n")) {
      if (StringUtils.isBlank(line)) {
        continue;
      }
      try {
        rows.add(objectMapper.readValue(line, rowType));
      } catch (JsonProcessingException e) {
        throw new QueryExecutionException(QueryExecutionException.Kind.ROW_EXTRACTION_FAILURE,
            "Error decoding clickhouse row into " + rowType.getSimpleName(), e);
      }
    }
    return rows;
  }
}
