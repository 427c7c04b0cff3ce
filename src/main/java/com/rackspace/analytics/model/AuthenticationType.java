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

import com.fasterxml.jackson.annotation.JsonValue;
import com.rackspace.analytics.query.ToSql;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum AuthenticationType implements ToSql {
  THREE_DS("three_ds"),
  NO_THREE_DS("no_three_ds");

  @JsonValue
  @Getter
  private final String value;

  @Override
  public String toString() {
    return value;
  }
}
