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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * An aggregate function over a field, usable as a select column or in a HAVING clause.
 *
 * @param <R> the type of the aggregated field, serialized by the dialect
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Aggregate<R> {

  public enum Function {
    COUNT,
    SUM,
    MIN,
    MAX
  }

  Function function;
  /**
   * Only {@link Function#COUNT} may omit the field, which renders as <code>count(*)</code>.
   */
  R field;
  String alias;

  public static <R> Aggregate<R> count(String alias) {
    return new Aggregate<>(Function.COUNT, null, alias);
  }

  public static <R> Aggregate<R> count(R field, String alias) {
    return new Aggregate<>(Function.COUNT, field, alias);
  }

  public static <R> Aggregate<R> sum(R field, String alias) {
    return new Aggregate<>(Function.SUM, field, alias);
  }

  public static <R> Aggregate<R> min(R field, String alias) {
    return new Aggregate<>(Function.MIN, field, alias);
  }

  public static <R> Aggregate<R> max(R field, String alias) {
    return new Aggregate<>(Function.MAX, field, alias);
  }
}
