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

import com.rackspace.analytics.datasource.AnalyticsDataSource;
import com.rackspace.analytics.datasource.QueryExecutionException;
import com.rackspace.analytics.datasource.SqlDialect;
import com.rackspace.analytics.metrics.MetricsException.Kind;
import com.rackspace.analytics.query.PostProcessingException;
import com.rackspace.analytics.query.QueryBuilder;
import com.rackspace.analytics.query.QueryBuildingException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Builds, runs and buckets the query of a single metric. Rows whose bucket identifiers collide
 * are merged rather than replaced, since the group-by columns of a backend need not line up
 * exactly with the clipped buckets.
 */
@Slf4j
public class MetricLoader {

  @FunctionalInterface
  public interface QueryFactory {

    QueryBuilder build(SqlDialect dialect) throws QueryBuildingException;
  }

  @FunctionalInterface
  public interface BucketIdentifier<R, I> {

    I identify(R row) throws PostProcessingException;
  }

  private MetricLoader() {
  }

  public static <I, R> Mono<Map<I, R>> load(String metric,
                                            AnalyticsDataSource pool,
                                            Class<R> rowType,
                                            QueryFactory queryFactory,
                                            BucketIdentifier<R, I> bucketIdentifier,
                                            BinaryOperator<R> merger) {
    final Mono<List<R>> rows;
    try {
      rows = queryFactory.build(pool.getDialect()).executeQuery(pool, rowType);
    } catch (QueryBuildingException e) {
      return Mono.error(new MetricsException(Kind.QUERY_BUILDING, metric, e));
    }

    return rows
        .onErrorMap(QueryExecutionException.class,
            e -> new MetricsException(Kind.QUERY_EXECUTION, metric, e))
        .<Map<I, R>>handle((result, sink) -> {
          try {
            sink.next(toBuckets(result, bucketIdentifier, merger));
          } catch (PostProcessingException e) {
            sink.error(new MetricsException(Kind.POST_PROCESSING, metric, e));
          }
        })
        .doOnNext(buckets -> log.trace("Loaded metric={} buckets={}", metric, buckets.size()));
  }

  private static <I, R> Map<I, R> toBuckets(List<R> rows,
                                            BucketIdentifier<R, I> bucketIdentifier,
                                            BinaryOperator<R> merger)
      throws PostProcessingException {
    final Map<I, R> buckets = new LinkedHashMap<>();
    for (R row : rows) {
      buckets.merge(bucketIdentifier.identify(row), row, merger);
    }
    return buckets;
  }
}
