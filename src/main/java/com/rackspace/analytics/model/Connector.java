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
 * Payment processors a payment attempt can be routed to.
 */
@RequiredArgsConstructor
public enum Connector implements ToSql {
  ACI("aci"),
  ADYEN("adyen"),
  AIRWALLEX("airwallex"),
  AUTHORIZEDOTNET("authorizedotnet"),
  BAMBORA("bambora"),
  BITPAY("bitpay"),
  BLUESNAP("bluesnap"),
  BRAINTREE("braintree"),
  CASHTOCODE("cashtocode"),
  CHECKOUT("checkout"),
  COINBASE("coinbase"),
  CRYPTOPAY("cryptopay"),
  CYBERSOURCE("cybersource"),
  DLOCAL("dlocal"),
  FISERV("fiserv"),
  FORTE("forte"),
  GLOBALPAY("globalpay"),
  GLOBEPAY("globepay"),
  IATAPAY("iatapay"),
  KLARNA("klarna"),
  MOLLIE("mollie"),
  MULTISAFEPAY("multisafepay"),
  NEXINETS("nexinets"),
  NMI("nmi"),
  NOON("noon"),
  NUVEI("nuvei"),
  OPENNODE("opennode"),
  PAYEEZY("payeezy"),
  PAYME("payme"),
  PAYPAL("paypal"),
  PAYU("payu"),
  POWERTRANZ("powertranz"),
  RAPYD("rapyd"),
  SHIFT4("shift4"),
  SQUARE("square"),
  STAX("stax"),
  STRIPE("stripe"),
  TRUSTPAY("trustpay"),
  TSYS("tsys"),
  WISE("wise"),
  WORLDLINE("worldline"),
  WORLDPAY("worldpay"),
  ZEN("zen");

  @JsonValue
  @Getter
  private final String value;

  @Override
  public String toString() {
    return value;
  }
}
