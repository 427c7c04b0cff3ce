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

import java.time.temporal.ChronoField;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAdjuster;
import lombok.Getter;

/**
 * Moves a timestamp to the first or last instant of the bucket that contains it. Only the bucket
 * field of the truncation level and the fields finer than it are changed.
 */
public class BucketClipper implements TemporalAdjuster {

  public enum Edge {
    START,
    END
  }

  @Getter
  final TimeGranularityLevel level;
  @Getter
  final int bucketSize;
  @Getter
  final Edge edge;

  public BucketClipper(TimeGranularityLevel level, int bucketSize, Edge edge) {
    if (bucketSize <= 0) {
      throw new IllegalArgumentException("Bucket size must be positive");
    }
    this.level = level;
    this.bucketSize = bucketSize;
    this.edge = edge;
  }

  /**
   * @throws java.time.DateTimeException if the clipped component is out of range for its field
   */
  @Override
  public Temporal adjustInto(Temporal temporal) {
    final ChronoField bucketField = level.getBucketField();
    final int component = temporal.get(bucketField);
    final int clipped = edge == Edge.START ? clipStart(component) : clipEnd(component);
    bucketField.checkValidIntValue(clipped);

    Temporal result = temporal.with(bucketField, clipped);
    for (ChronoField finer : level.getFinerFields()) {
      result = result.with(finer, edge == Edge.START ?
          finer.range().getMinimum() : finer.range().getMaximum());
    }
    return result;
  }

  private int clipStart(int component) {
    return component - (component % bucketSize);
  }

  private int clipEnd(int component) {
    return component + bucketSize - 1 - (component % bucketSize);
  }
}
