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
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum TimeGranularityLevel {
  MINUTE(ChronoField.SECOND_OF_MINUTE, List.of(ChronoField.NANO_OF_SECOND)),
  HOUR(ChronoField.MINUTE_OF_HOUR,
      List.of(ChronoField.SECOND_OF_MINUTE, ChronoField.NANO_OF_SECOND)),
  DAY(ChronoField.HOUR_OF_DAY,
      List.of(ChronoField.MINUTE_OF_HOUR, ChronoField.SECOND_OF_MINUTE,
          ChronoField.NANO_OF_SECOND));

  /**
   * The sub-unit field that is divided into buckets within one unit of this level.
   */
  @Getter
  private final ChronoField bucketField;

  /**
   * Fields finer than {@link #bucketField}, which carry no information once clipped.
   */
  @Getter
  private final List<ChronoField> finerFields;

  /**
   * @return the unit name as used by <code>DATE_TRUNC</code>
   */
  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
