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

/**
 * A bucketing scheme over a series of values, such as timestamps grouped into fixed width time
 * buckets.
 *
 * @param <S> the type of the series values
 * @param <L> the truncation level the buckets are aligned to
 */
public interface SeriesBucket<S, L> {

  /**
   * @return the coarsest unit that every bucket boundary is aligned with
   */
  L getLowestCommonGranularityLevel();

  /**
   * @return the number of sub-units of the truncation level that make up one bucket
   */
  int getBucketSize();

  /**
   * @return the inclusive lower bound of the bucket containing the given value
   */
  S clipToStart(S value) throws PostProcessingException;

  /**
   * @return the inclusive upper bound of the bucket containing the given value
   */
  S clipToEnd(S value) throws PostProcessingException;
}
