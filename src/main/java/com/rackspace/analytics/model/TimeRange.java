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

package com.rackspace.analytics.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.rackspace.analytics.query.FilterType;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import com.rackspace.analytics.query.QueryFilter;
import java.time.LocalDateTime;
import javax.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A time window with an inclusive start and an optional inclusive end.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(SnakeCaseStrategy.class)
public class TimeRange implements QueryFilter {

  public static final String CREATED_AT = "created_at";

  @NotNull
  LocalDateTime startTime;

  LocalDateTime endTime;

  @Override
  public void setFilterClause(QueryBuilder builder) throws QueryBuildingException {
    builder.addCustomFilterClause(CREATED_AT, startTime, FilterType.GTE);
    if (endTime != null) {
      builder.addCustomFilterClause(CREATED_AT, endTime, FilterType.LTE);
    }
  }
}
