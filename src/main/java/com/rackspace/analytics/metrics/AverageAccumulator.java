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

import java.math.BigDecimal;

/**
 * Divides the summed totals by the summed counts. Collects to null until a non-zero count has
 * been seen.
 */
public class AverageAccumulator {

  private BigDecimal total = BigDecimal.ZERO;
  private long count;

  public void add(BigDecimal rowTotal, Long rowCount) {
    if (rowTotal != null) {
      total = total.add(rowTotal);
    }
    if (rowCount != null) {
      count += rowCount;
    }
  }

  public Double collect() {
    if (count == 0) {
      return null;
    }
    return total.doubleValue() / count;
  }
}
