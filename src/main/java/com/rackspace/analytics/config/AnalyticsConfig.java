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

package com.rackspace.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.analytics.datasource.ClickhouseClient;
import com.rackspace.analytics.datasource.SqlxClient;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@Slf4j
public class AnalyticsConfig {

  @Bean
  public SqlxClient sqlxClient(DataSource dataSource, AppProperties appProperties,
                               ObjectMapper objectMapper) {
    final JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
    jdbcTemplate.setQueryTimeout((int) appProperties.getSqlx().getQueryTimeout().toSeconds());
    return new SqlxClient(jdbcTemplate, objectMapper);
  }

  @Bean
  public ClickhouseClient clickhouseClient(WebClient.Builder webClientBuilder,
                                           AppProperties appProperties,
                                           ObjectMapper objectMapper) {
    log.debug("Using clickhouse host={} database={}", appProperties.getClickhouse().getHost(),
        appProperties.getClickhouse().getDatabaseName());
    return new ClickhouseClient(webClientBuilder, appProperties.getClickhouse(), objectMapper);
  }
}
