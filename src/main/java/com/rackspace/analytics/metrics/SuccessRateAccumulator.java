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

package com.rackspace.analytics.metrics;

/**
 * Tracks the percentage of counted rows that were successful.
 */
public class SuccessRateAccumulator {

  private long success;
  private long total;

  public void add(boolean successful, Long rowCount) {
    if (rowCount == null) {
      return;
    }
    if (successful) {
      success += rowCount;
    }
    total += rowCount;
  }

  public Double collect() {
    if (total == 0) {
      return null;
    }
    return success * 100.0 / total;
  }
}
