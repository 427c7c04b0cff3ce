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
 * Sums row counts. Collects to null when no row carried a count.
 */
public class CountAccumulator {

  private Long count;

  public void add(Long rowCount) {
    if (rowCount != null) {
      count = count == null ? rowCount : count + rowCount;
    }
  }

  public Long collect() {
    return count;
  }
}
