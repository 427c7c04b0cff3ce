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

package com.rackspace.analytics.model.payments;

import com.fasterxml.jackson.databind.PropertyNamingStrategies.SnakeCaseStrategy;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.rackspace.analytics.metrics.payments.PaymentMetrics;
import com.rackspace.analytics.model.Granularity;
import com.rackspace.analytics.model.TimeRange;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
@JsonNaming(SnakeCaseStrategy.class)
public class GetPaymentMetricRequest {

  @NotNull
  @Valid
  TimeRange timeRange;

  /**
   * When absent, each group of dimension values yields a single bucket spanning the time range.
   */
  Granularity granularity;

  @NotNull
  List<PaymentDimensions> groupByNames = new ArrayList<>();

  @NotNull
  PaymentFilters filters = new PaymentFilters();

  @NotEmpty
  Set<PaymentMetrics> metrics = new LinkedHashSet<>();
}
