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

import lombok.Getter;

/**
 * Raised while assembling a query, before anything is sent to a backend.
 */
@Getter
public class QueryBuildingException extends Exception {

  public enum Kind {
    NOT_IMPLEMENTED,
    SQL_SERIALIZE_ERROR,
    INVALID_QUERY
  }

  private final Kind kind;

  public QueryBuildingException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public QueryBuildingException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static QueryBuildingException notImplemented(String what) {
    return new QueryBuildingException(Kind.NOT_IMPLEMENTED, "Not Implemented: " + what);
  }

  public static QueryBuildingException serializeError(String message) {
    return new QueryBuildingException(Kind.SQL_SERIALIZE_ERROR,
        "Failed to Serialize to SQL: " + message);
  }

  public static QueryBuildingException serializeError(String message, Throwable cause) {
    return new QueryBuildingException(Kind.SQL_SERIALIZE_ERROR,
        "Failed to Serialize to SQL: " + message, cause);
  }

  public static QueryBuildingException invalidQuery(String reason) {
    return new QueryBuildingException(Kind.INVALID_QUERY, "Failed to build sql query: " + reason);
  }
}
