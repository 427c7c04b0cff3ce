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

import lombok.Getter;

/**
 * Signals that a single metric could not be loaded, tagged with the stage that failed.
 */
@Getter
public class MetricsException extends RuntimeException {

  public enum Kind {
    QUERY_BUILDING,
    QUERY_EXECUTION,
    POST_PROCESSING
  }

  private final Kind kind;
  private final String metric;

  public MetricsException(Kind kind, String metric, Throwable cause) {
    super(String.format("Failed to load metric=%s during %s: %s",
        metric, kind, cause.getMessage()), cause);
    this.kind = kind;
    this.metric = metric;
  }
}
