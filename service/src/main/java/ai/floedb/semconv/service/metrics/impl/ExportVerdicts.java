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

package ai.floedb.semconv.service.metrics.impl;

import ai.floedb.semconv.check.Verdict;
import ai.floedb.semconv.service.error.impl.GrpcErrors;
import io.grpc.StatusRuntimeException;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsPartialSuccess;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceResponse;
import java.util.Map;

/** Renders a {@link Verdict} as the OTLP response or the rejection status. */
final class ExportVerdicts {
  static final String MISSING_ATTRIBUTES = "missing attributes";

  private ExportVerdicts() {}

  static ExportMetricsServiceResponse accepted() {
    return ExportMetricsServiceResponse.getDefaultInstance();
  }

  static ExportMetricsServiceResponse partialSuccess(Verdict verdict) {
    return ExportMetricsServiceResponse.newBuilder()
        .setPartialSuccess(
            ExportMetricsPartialSuccess.newBuilder()
                .setRejectedDataPoints(verdict.violationCount())
                .setErrorMessage(MISSING_ATTRIBUTES))
        .build();
  }

  static String rejectionMessage(Verdict verdict) {
    return MISSING_ATTRIBUTES + ": " + verdict.distinctScopes();
  }

  static StatusRuntimeException rejection(Verdict verdict) {
    return GrpcErrors.preconditionFailed(
        GrpcErrors.REASON_MISSING_ATTRIBUTES,
        rejectionMessage(verdict),
        Map.of(
            "violations", Long.toString(verdict.violationCount()),
            "scopes", String.join(",", verdict.distinctScopes())),
        partialSuccess(verdict));
  }
}
