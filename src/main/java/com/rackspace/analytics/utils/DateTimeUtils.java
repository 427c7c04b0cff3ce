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

package com.rackspace.analytics.utils;

import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import com.rackspace.analytics.query.PostProcessingException;
import java.time.LocalDateTime;
import org.springframework.lang.Nullable;

public class DateTimeUtils {

  private DateTimeUtils() {
  }

  /**
   * Computes the time bucket reported for a result row.
   *
   * @param granularity the requested bucketing, if any
   * @param startBucket the earliest timestamp seen in the row's group, if reported
   * @param timeRange the requested time range
   * @return the clipped bucket bounds when both a granularity and a start bucket are available,
   * otherwise an open range starting at the requested start time
   */
  public static TimeRange bucketRange(@Nullable Granularity granularity,
                                      @Nullable LocalDateTime startBucket,
                                      TimeRange timeRange) throws PostProcessingException {
    if (granularity == null || startBucket == null) {
      return new TimeRange(timeRange.getStartTime(), null);
    }
    return new TimeRange(
        granularity.clipToStart(startBucket),
        granularity.clipToEnd(startBucket)
    );
  }
}
