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

import java.time.Duration;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("analytics")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * The store, or combination of stores, that metric queries are executed against.
   */
  @NotNull
  AnalyticsProvider source = AnalyticsProvider.SQLX;

  @NotNull
  @Valid
  Sqlx sqlx = new Sqlx();

  @NotNull
  @Valid
  Clickhouse clickhouse = new Clickhouse();

  /**
   * The PostgreSQL connection itself is configured with <code>spring.datasource</code>.
   */
  @Data
  public static class Sqlx {

    @NotNull
    Duration queryTimeout = Duration.ofSeconds(30);
  }

  @Data
  public static class Clickhouse {

    /**
     * Base URL of the ClickHouse HTTP interface.
     * For example: http://localhost:8123
     */
    @NotBlank
    String host = "http://localhost:8123";

    @NotBlank
    String username = "default";

    String password;

    @NotBlank
    String databaseName = "default";

    @NotNull
    Duration queryTimeout = Duration.ofSeconds(30);
  }
}
