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

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.analytics.query.PostProcessingException;
import com.rackspace.analytics.query.TimeGranularityLevel;
import java.time.LocalDateTime;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

class GranularityTest {

  static Stream<Arguments> granularitiesAndTimestamps() {
    return Stream.of(Granularity.values())
        .flatMap(granularity -> Stream.of(
            "2023-01-01T00:00:00",
            "2023-01-01T23:59:59.999999999",
            "2023-02-28T10:17:23.450",
            "2024-02-29T13:44:59",
            "2023-12-31T18:30:00.000000001"
        ).map(value -> Arguments.of(granularity, LocalDateTime.parse(value))));
  }

  @Nested
  class clipping {

    @ParameterizedTest
    @MethodSource("com.rackspace.analytics.model.GranularityTest#granularitiesAndTimestamps")
    void bucketContainsValue(Granularity granularity, LocalDateTime value)
        throws PostProcessingException {
      final LocalDateTime start = granularity.clipToStart(value);
      final LocalDateTime end = granularity.clipToEnd(value);

      assertThat(start).isBeforeOrEqualTo(value);
      assertThat(end).isAfterOrEqualTo(value);
      assertThat(start.toLocalDate()).isEqualTo(value.toLocalDate());
      assertThat(end.toLocalDate()).isEqualTo(value.toLocalDate());
      if (granularity.getLowestCommonGranularityLevel() != TimeGranularityLevel.DAY) {
        // sub-hour buckets never cross an hour boundary
        assertThat(start.getHour()).isEqualTo(value.getHour());
        assertThat(end.getHour()).isEqualTo(value.getHour());
      }
    }

    @ParameterizedTest
    @MethodSource("com.rackspace.analytics.model.GranularityTest#granularitiesAndTimestamps")
    void idempotent(Granularity granularity, LocalDateTime value)
        throws PostProcessingException {
      final LocalDateTime start = granularity.clipToStart(value);
      final LocalDateTime end = granularity.clipToEnd(value);

      assertThat(granularity.clipToStart(start)).isEqualTo(start);
      assertThat(granularity.clipToEnd(end)).isEqualTo(end);
      assertThat(granularity.clipToStart(end)).isEqualTo(start);
      assertThat(granularity.clipToEnd(start)).isEqualTo(end);
    }

    @ParameterizedTest
    @MethodSource("com.rackspace.analytics.model.GranularityTest#granularitiesAndTimestamps")
    void bucketsAreContiguous(Granularity granularity, LocalDateTime value)
        throws PostProcessingException {
      final LocalDateTime nextStart = granularity.clipToEnd(value).plusNanos(1);

      assertThat(granularity.clipToStart(nextStart)).isEqualTo(nextStart);
    }

    @ParameterizedTest
    @CsvSource({
        "ONE_MIN,      2023-04-12T10:17:23.450, 2023-04-12T10:17:00, 2023-04-12T10:17:59.999999999",
        "FIVE_MIN,     2023-04-12T10:17:23.450, 2023-04-12T10:15:00, 2023-04-12T10:19:59.999999999",
        "FIFTEEN_MIN,  2023-04-12T10:37:12,     2023-04-12T10:30:00, 2023-04-12T10:44:59.999999999",
        "THIRTY_MIN,   2023-04-12T10:29:59,     2023-04-12T10:00:00, 2023-04-12T10:29:59.999999999",
        "ONE_HOUR,     2023-04-12T10:37:12,     2023-04-12T10:00:00, 2023-04-12T10:59:59.999999999",
        "ONE_DAY,      2023-04-12T17:42:05,     2023-04-12T00:00:00, 2023-04-12T23:59:59.999999999"
    })
    void knownBuckets(Granularity granularity, LocalDateTime value,
                      LocalDateTime expectedStart, LocalDateTime expectedEnd)
        throws PostProcessingException {
      assertThat(granularity.clipToStart(value)).isEqualTo(expectedStart);
      assertThat(granularity.clipToEnd(value)).isEqualTo(expectedEnd);
    }
  }

  @Test
  void minutesMatchBucketWidth() {
    assertThat(Granularity.ONE_MIN.getMinutes()).isEqualTo(1);
    assertThat(Granularity.FIVE_MIN.getMinutes()).isEqualTo(5);
    assertThat(Granularity.FIFTEEN_MIN.getMinutes()).isEqualTo(15);
    assertThat(Granularity.THIRTY_MIN.getMinutes()).isEqualTo(30);
    assertThat(Granularity.ONE_HOUR.getMinutes()).isEqualTo(60);
    assertThat(Granularity.ONE_DAY.getMinutes()).isEqualTo(1440);
  }

  @Test
  void jsonNames() throws Exception {
    final ObjectMapper objectMapper = new ObjectMapper();

    assertThat(objectMapper.readValue("\"G_FIFTEENMIN\"", Granularity.class))
        .isEqualTo(Granularity.FIFTEEN_MIN);
    assertThat(objectMapper.writeValueAsString(Granularity.ONE_DAY))
        .isEqualTo("\"G_ONEDAY\"");
  }
}
