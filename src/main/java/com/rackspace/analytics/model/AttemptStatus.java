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

/**
 * Lifecycle status of a payment attempt as stored in the <code>status</code> column.
 */
@RequiredArgsConstructor
public enum AttemptStatus implements ToSql {
  STARTED("started"),
  AUTHENTICATION_FAILED("authentication_failed"),
  ROUTER_DECLINED("router_declined"),
  AUTHENTICATION_PENDING("authentication_pending"),
  AUTHENTICATION_SUCCESSFUL("authentication_successful"),
  AUTHORIZED("authorized"),
  AUTHORIZATION_FAILED("authorization_failed"),
  CHARGED("charged"),
  AUTHORIZING("authorizing"),
  COD_INITIATED("cod_initiated"),
  VOIDED("voided"),
  VOID_INITIATED("void_initiated"),
  CAPTURE_INITIATED("capture_initiated"),
  CAPTURE_FAILED("capture_failed"),
  VOID_FAILED("void_failed"),
  AUTO_REFUNDED("auto_refunded"),
  PARTIAL_CHARGED("partial_charged"),
  UNRESOLVED("unresolved"),
  PENDING("pending"),
  FAILURE("failure"),
  PAYMENT_METHOD_AWAITED("payment_method_awaited"),
  CONFIRMATION_AWAITED("confirmation_awaited"),
  DEVICE_DATA_COLLECTION_PENDING("device_data_collection_pending");

  @JsonValue
  @Getter
  private final String value;

  @Override
  public String toString() {
    return value;
  }
}
