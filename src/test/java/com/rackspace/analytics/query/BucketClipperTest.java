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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.analytics.query.BucketClipper.Edge;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BucketClipperTest {

  @Nested
  class clipStart {

    @Test
    void withinBucket() {
      final LocalDateTime result = LocalDateTime.parse("2023-04-12T10:17:23.450")
          .with(new BucketClipper(TimeGranularityLevel.HOUR, 5, Edge.START));

      assertThat(result).isEqualTo(LocalDateTime.parse("2023-04-12T10:15:00"));
    }

    @Test
    void alreadyAligned() {
      final LocalDateTime result = LocalDateTime.parse("2023-04-12T10:15:00")
          .with(new BucketClipper(TimeGranularityLevel.HOUR, 5, Edge.START));

      assertThat(result).isEqualTo(LocalDateTime.parse("2023-04-12T10:15:00"));
    }

    @Test
    void dayLevel() {
      final LocalDateTime result = LocalDateTime.parse("2023-04-12T17:42:05")
          .with(new BucketClipper(TimeGranularityLevel.DAY, 6, Edge.START));

      assertThat(result).isEqualTo(LocalDateTime.parse("2023-04-12T12:00:00"));
    }
  }

  @Nested
  class clipEnd {

    @Test
    void withinBucket() {
      final LocalDateTime result = LocalDateTime.parse("2023-04-12T10:17:23.450")
          .with(new BucketClipper(TimeGranularityLevel.HOUR, 5, Edge.END));

      assertThat(result).isEqualTo(LocalDateTime.parse("2023-04-12T10:19:59.999999999"));
    }

    @Test
    void minuteLevel() {
      final LocalDateTime result = LocalDateTime.parse("2023-04-12T10:17:23.450")
          .with(new BucketClipper(TimeGranularityLevel.MINUTE, 60, Edge.END));

      assertThat(result).isEqualTo(LocalDateTime.parse("2023-04-12T10:17:59.999999999"));
    }

    @Test
    void overflowsField() {
      final LocalDateTime value = LocalDateTime.parse("2023-04-12T10:59:00");
      final BucketClipper clipper = new BucketClipper(TimeGranularityLevel.HOUR, 7, Edge.END);

      assertThatThrownBy(() -> value.with(clipper))
          .isInstanceOf(DateTimeException.class);
    }
  }

  @Test
  void rejectsNonPositiveBucketSize() {
    assertThatThrownBy(() -> new BucketClipper(TimeGranularityLevel.HOUR, 0, Edge.START))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
