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

import ai.floedb.semconv.check.ComplianceChecker;
import ai.floedb.semconv.check.Verdict;
import ai.floedb.semconv.service.common.LogHelper;
import ai.floedb.semconv.service.config.CheckerConfig;
import ai.floedb.semconv.service.error.impl.GrpcErrors;
import ai.floedb.semconv.service.oneshot.OneShotVerdicts;
import ai.floedb.semconv.service.telemetry.ComplianceMetrics;
import ai.floedb.semconv.service.telemetry.ComplianceMetrics.Outcome;
import io.grpc.Context;
import io.grpc.stub.StreamObserver;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceResponse;
import io.opentelemetry.proto.collector.metrics.v1.MetricsServiceGrpc;
import io.quarkus.grpc.GrpcService;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import java.util.concurrent.CancellationException;
import org.jboss.logging.Logger;

/**
 * OTLP {@code MetricsService/Export} endpoint that checks every call against the compiled rules.
 * Clean calls are acknowledged with an empty response; calls with missing attributes fail with
 * {@code FAILED_PRECONDITION}.
 */
@GrpcService
public class MetricsServiceImpl extends MetricsServiceGrpc.MetricsServiceImplBase {
  private static final Logger LOG = Logger.getLogger(MetricsServiceImpl.class);

  @Inject ComplianceChecker checker;
  @Inject ComplianceMetrics metrics;
  @Inject OneShotVerdicts oneShot;
  @Inject CheckerConfig config;

  @Override
  @Blocking
  public void export(
      ExportMetricsServiceRequest request,
      StreamObserver<ExportMetricsServiceResponse> responseObserver) {
    var L = LogHelper.start(LOG, "Export");

    final Verdict verdict;
    try {
      verdict = checker.check(request, Context.current()::isCancelled);
    } catch (CancellationException e) {
      L.cancelled();
      metrics.recordCall(Outcome.CANCELLED);
      responseObserver.onError(GrpcErrors.cancelled(e));
      failOneShot(e);
      return;
    } catch (RuntimeException e) {
      L.fail(e);
      metrics.recordCall(Outcome.FAILED);
      responseObserver.onError(GrpcErrors.internal(e));
      failOneShot(e);
      return;
    }

    metrics.recordVerdict(verdict);
    if (verdict.hasViolations()) {
      L.rejected(verdict);
      responseObserver.onError(ExportVerdicts.rejection(verdict));
    } else {
      L.accepted(verdict);
      responseObserver.onNext(ExportVerdicts.accepted());
      responseObserver.onCompleted();
    }

    if (config.oneShot()) {
      oneShot.publish(verdict);
    }
  }

  private void failOneShot(Throwable cause) {
    if (config.oneShot()) {
      oneShot.fail(cause);
    }
  }
}
