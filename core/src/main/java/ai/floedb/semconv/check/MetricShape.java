/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.semconv.check;

import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import java.util.List;

/**
 * Shape of a metric's payload as far as the checker is concerned. Only number data points (gauge
 * and sum) carry attributes the checker compares; every other payload is {@link Unsupported}.
 */
public sealed interface MetricShape {

  /** Gauge or sum data points. */
  record NumberPoints(String kind, List<NumberDataPoint> points) implements MetricShape {}

  /** A payload the checker skips entirely. */
  record Unsupported(String kind) implements MetricShape {}

  /**
   * Classifies {@code metric}. The switch lists every data case without a default branch, so a new
   * OTLP payload type fails compilation here until it is classified.
   */
  static MetricShape of(Metric metric) {
    return switch (metric.getDataCase()) {
      case GAUGE -> new NumberPoints("gauge", metric.getGauge().getDataPointsList());
      case SUM -> new NumberPoints("sum", metric.getSum().getDataPointsList());
      case HISTOGRAM -> new Unsupported("histogram");
      case EXPONENTIAL_HISTOGRAM -> new Unsupported("exponential_histogram");
      case SUMMARY -> new Unsupported("summary");
      case DATA_NOT_SET -> new Unsupported("empty");
    };
  }
}
