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
 * TurnTelemetry records conversation turn counts and latencies.
 *
 * <p>
 * Each turn is tagged with:
 * <ul>
 * <li>the application name</li>
 * <li>the routing kind (handle_self, delegate, decline, or none when routing
 * failed)</li>
 * <li>the outcome (success, failure, declined, inference_error, timeout,
 * capability_error)</li>
 * </ul>
 */
public class TurnTelemetry {

  private static final Logger logger = LoggerFactory.getLogger(TurnTelemetry.class);

  private static final String METRIC_TURNS = "agentrelay/turn/requests";
  private static final String METRIC_LATENCY = "agentrelay/turn/latency";

  private final LongCounter turnCounter;
  private final LongHistogram latencyHistogram;

  private static TurnTelemetry instance;

  /**
   * Gets the singleton instance of TurnTelemetry.
   *
   * @return the TurnTelemetry instance
   */
  public static synchronized TurnTelemetry getInstance() {
    if (instance == null) {
      instance = new TurnTelemetry();
    }
    return instance;
  }

  private TurnTelemetry() {
    Meter meter = GlobalOpenTelemetry.getMeter(ToolTelemetry.METER_NAME);

    turnCounter = meter.counterBuilder(METRIC_TURNS).setDescription("Counts conversation turns.").setUnit("1")
        .build();

    latencyHistogram = meter.histogramBuilder(METRIC_LATENCY).setDescription("Latencies of conversation turns.")
        .setUnit("ms").ofLongs().build();

    logger.debug("TurnTelemetry initialized");
  }

  /**
   * Records metrics for a finished turn.
   *
   * @param appName
   *            the application name
   * @param routingKind
   *            the routing decision kind, or null if routing did not complete
   * @param outcome
   *            the turn outcome
   * @param latencyMs
   *            the latency in milliseconds
   */
  public void recordTurn(String appName, String routingKind, String outcome, long latencyMs) {
    Attributes attrs = Attributes.builder().put("appName", TelemetryAttributes.truncate(appName, 256))
        .put("routing", routingKind != null ? routingKind : "none")
        .put("outcome", TelemetryAttributes.truncate(outcome, 64)).build();

    turnCounter.add(1, attrs);
    latencyHistogram.record(latencyMs, attrs);
  }
}
