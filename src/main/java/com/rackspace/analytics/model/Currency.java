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
 * ISO 4217 currency codes accepted for payments.
 */
@RequiredArgsConstructor
public enum Currency implements ToSql {
  AED("AED"),
  ARS("ARS"),
  AUD("AUD"),
  BDT("BDT"),
  BRL("BRL"),
  CAD("CAD"),
  CHF("CHF"),
  CLP("CLP"),
  CNY("CNY"),
  COP("COP"),
  CZK("CZK"),
  DKK("DKK"),
  EGP("EGP"),
  EUR("EUR"),
  GBP("GBP"),
  HKD("HKD"),
  HUF("HUF"),
  IDR("IDR"),
  ILS("ILS"),
  INR("INR"),
  JPY("JPY"),
  KES("KES"),
  KRW("KRW"),
  MXN("MXN"),
  MYR("MYR"),
  NGN("NGN"),
  NOK("NOK"),
  NZD("NZD"),
  PEN("PEN"),
  PHP("PHP"),
  PKR("PKR"),
  PLN("PLN"),
  QAR("QAR"),
  RON("RON"),
  SAR("SAR"),
  SEK("SEK"),
  SGD("SGD"),
  THB("THB"),
  TRY("TRY"),
  TWD("TWD"),
  UAH("UAH"),
  USD("USD"),
  VND("VND"),
  ZAR("ZAR");

  @JsonValue
  @Getter
  private final String value;

  @Override
  public String toString() {
    return value;
  }
}
