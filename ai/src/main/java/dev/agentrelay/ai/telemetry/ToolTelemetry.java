/*
 * Copyright 2025 Google LLC
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
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.agentrelay.ai.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;

/**
 * ToolTelemetry records a request counter and a latency histogram for every
 * tool invocation, tagged with the tool, the invoking handler and the outcome.
 */
public class ToolTelemetry {

  private static final Logger logger = LoggerFactory.getLogger(ToolTelemetry.class);
  static final String METER_NAME = "agentrelay";

  private static final String METRIC_REQUESTS = "agentrelay/tool/requests";
  private static final String METRIC_LATENCY = "agentrelay/tool/latency";

  private final LongCounter requestCounter;
  private final LongHistogram latencyHistogram;

  private static ToolTelemetry instance;

  /**
   * Gets the singleton instance of ToolTelemetry.
   *
   * @return the ToolTelemetry instance
   */
  public static synchronized ToolTelemetry getInstance() {
    if (instance == null) {
      instance = new ToolTelemetry();
    }
    return instance;
  }

  private ToolTelemetry() {
    Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

    requestCounter = meter.counterBuilder(METRIC_REQUESTS).setDescription("Counts tool invocations.").setUnit("1")
        .build();

    latencyHistogram = meter.histogramBuilder(METRIC_LATENCY).setDescription("Latencies of tool invocations.")
        .setUnit("ms").ofLongs().build();

    logger.debug("ToolTelemetry initialized");
  }

  /**
   * Records metrics for a tool invocation.
   *
   * @param toolName
   *            the tool name
   * @param handlerName
   *            the handler that invoked the tool, may be null
   * @param latencyMs
   *            the latency in milliseconds
   * @param error
   *            the error kind if the tool returned a failure, null otherwise
   */
  public void recordToolMetrics(String toolName, String handlerName, long latencyMs, String error) {
    Attributes baseAttrs = Attributes.builder().put("toolName", TelemetryAttributes.truncate(toolName, 256))
        .put("handlerName", TelemetryAttributes.truncate(handlerName, 256))
        .put("status", error != null ? "failure" : "success").build();

    Attributes requestAttrs = error != null
        ? baseAttrs.toBuilder().put("error", TelemetryAttributes.truncate(error, 256)).build()
        : baseAttrs;
    requestCounter.add(1, requestAttrs);
    latencyHistogram.record(latencyMs, baseAttrs);
  }
}
