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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rackspace.analytics.query.BucketClipper;
import com.rackspace.analytics.query.BucketClipper.Edge;
import com.rackspace.analytics.query.GroupByClause;
import com.rackspace.analytics.query.PostProcessingException;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import com.rackspace.analytics.query.SeriesBucket;
import com.rackspace.analytics.query.TimeGranularityLevel;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Width of the time buckets that metric rows are grouped into. Bucket timestamps are UTC wall
 * clock values.
 */
@RequiredArgsConstructor
@Getter
public enum Granularity implements SeriesBucket<LocalDateTime, TimeGranularityLevel>,
    GroupByClause {
  @JsonProperty("G_ONEMIN")
  ONE_MIN(TimeGranularityLevel.MINUTE, 60, 1),
  @JsonProperty("G_FIVEMIN")
  FIVE_MIN(TimeGranularityLevel.HOUR, 5, 5),
  @JsonProperty("G_FIFTEENMIN")
  FIFTEEN_MIN(TimeGranularityLevel.HOUR, 15, 15),
  @JsonProperty("G_THIRTYMIN")
  THIRTY_MIN(TimeGranularityLevel.HOUR, 30, 30),
  @JsonProperty("G_ONEHOUR")
  ONE_HOUR(TimeGranularityLevel.HOUR, 60, 60),
  @JsonProperty("G_ONEDAY")
  ONE_DAY(TimeGranularityLevel.DAY, 24, 1440);

  private final TimeGranularityLevel lowestCommonGranularityLevel;

  /**
   * Divisor applied to the bucket field of {@link #lowestCommonGranularityLevel}.
   */
  private final int bucketSize;

  /**
   * Total bucket width, used by dialects with native interval truncation.
   */
  private final int minutes;

  @Override
  public LocalDateTime clipToStart(LocalDateTime value) throws PostProcessingException {
    return clip(value, Edge.START);
  }

  @Override
  public LocalDateTime clipToEnd(LocalDateTime value) throws PostProcessingException {
    return clip(value, Edge.END);
  }

  @Override
  public void setGroupByClause(QueryBuilder builder) throws QueryBuildingException {
    builder.getDialect().setGroupByClause(this, builder);
  }

  private LocalDateTime clip(LocalDateTime value, Edge edge) throws PostProcessingException {
    try {
      return value.with(new BucketClipper(lowestCommonGranularityLevel, bucketSize, edge));
    } catch (DateTimeException e) {
      throw PostProcessingException.bucketClipping(value, e);
    }
  }
}
