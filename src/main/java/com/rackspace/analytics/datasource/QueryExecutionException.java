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

package com.rackspace.analytics.datasource;

import lombok.Getter;

/**
 * Signals that a store rejected or failed to run an already built query, or returned rows that
 * could not be decoded.
 */
@Getter
public class QueryExecutionException extends RuntimeException {

  public enum Kind {
    DATABASE_ERROR,
    ROW_EXTRACTION_FAILURE
  }

  private final Kind kind;

  public QueryExecutionException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }
}
