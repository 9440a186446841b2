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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ai.floedb.semconv.catalog.SemconvCatalogLoader;
import ai.floedb.semconv.check.ComplianceChecker;
import ai.floedb.semconv.check.ComplianceEvents;
import ai.floedb.semconv.check.CompiledRules;
import ai.floedb.semconv.check.LoggingComplianceEvents;
import ai.floedb.semconv.check.MatchTableBuilder;
import ai.floedb.semconv.config.CheckerSettings;
import ai.floedb.semconv.config.CheckerSettings.MetricRuleSettings;
import ai.floedb.semconv.config.CheckerSettings.ResourceSettings;
import ai.floedb.semconv.service.config.CheckerConfig;
import ai.floedb.semconv.service.error.impl.GrpcErrors;
import ai.floedb.semconv.service.oneshot.OneShotVerdicts;
import ai.floedb.semconv.service.telemetry.ComplianceMetrics;
import ai.floedb.semconv.service.telemetry.MeteredComplianceEvents;
import com.google.protobuf.Any;
import com.google.rpc.ErrorInfo;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.protobuf.StatusProto;
import io.grpc.stub.StreamObserver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceResponse;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.InstrumentationScope;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.metrics.v1.Gauge;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetricsServiceImplTest {
  private static final String SCHEMA = "https://opentelemetry.io/schemas/1.24.0";

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final CheckerConfig config = mock(CheckerConfig.class);
  private final MetricsServiceImpl service = new MetricsServiceImpl();
  private CompiledRules rules;

  @BeforeEach
  void setUp() {
    var catalog = new SemconvCatalogLoader().load(SemconvCatalogLoader.DEFAULT_LOCATION);
    var settings =
        new CheckerSettings(
            ResourceSettings.none(),
            List.of(
                new MetricRuleSettings("^rpc\\.server\\.", List.of("attributes.rpc"), List.of())),
            false,
            false);
    rules = MatchTableBuilder.build(settings, catalog);

    service.metrics = new ComplianceMetrics(registry);
    service.checker =
        new ComplianceChecker(
            rules, new MeteredComplianceEvents(new LoggingComplianceEvents(), service.metrics));
    service.oneShot = new OneShotVerdicts();
    service.config = config;
  }

  @Test
  void compliantCallIsAcknowledged() {
    var observer = new CapturingObserver<ExportMetricsServiceResponse>();

    service.export(
        request("grpc-lib", "rpc.server.duration", "rpc.system", "rpc.service", "rpc.method"),
        observer);

    assertThat(observer.error).isNull();
    assertThat(observer.completed).isTrue();
    assertThat(observer.values).containsExactly(ExportMetricsServiceResponse.getDefaultInstance());
    assertThat(registry.counter(ComplianceMetrics.EXPORT_CALLS, "outcome", "accepted").count())
        .isEqualTo(1.0);
  }

  @Test
  void missingAttributesRejectCallWithPartialSuccessDetails() throws Exception {
    var observer = new CapturingObserver<ExportMetricsServiceResponse>();

    service.export(request("grpc-lib", "rpc.server.duration", "rpc.system"), observer);

    assertThat(observer.values).isEmpty();
    assertThat(observer.completed).isFalse();
    assertThat(observer.error).isInstanceOf(StatusRuntimeException.class);
    var sre = (StatusRuntimeException) observer.error;
    assertThat(sre.getStatus().getCode()).isEqualTo(Status.Code.FAILED_PRECONDITION);
    assertThat(sre.getStatus().getDescription()).isEqualTo("missing attributes: [grpc-lib]");

    var status = StatusProto.fromThrowable(sre);
    assertThat(status).isNotNull();
    ExportMetricsServiceResponse partial = null;
    ErrorInfo info = null;
    for (Any detail : status.getDetailsList()) {
      if (detail.is(ExportMetricsServiceResponse.class)) {
        partial = detail.unpack(ExportMetricsServiceResponse.class);
      } else if (detail.is(ErrorInfo.class)) {
        info = detail.unpack(ErrorInfo.class);
      }
    }
    assertThat(partial).isNotNull();
    assertThat(partial.getPartialSuccess().getRejectedDataPoints()).isEqualTo(2);
    assertThat(partial.getPartialSuccess().getErrorMessage()).isEqualTo("missing attributes");
    assertThat(info).isNotNull();
    assertThat(info.getReason()).isEqualTo(GrpcErrors.REASON_MISSING_ATTRIBUTES);
    assertThat(info.getMetadataMap()).containsEntry("scopes", "grpc-lib");

    assertThat(registry.counter(ComplianceMetrics.EXPORT_CALLS, "outcome", "rejected").count())
        .isEqualTo(1.0);
    assertThat(registry.counter(ComplianceMetrics.MISSING_ATTRIBUTES).count()).isEqualTo(2.0);
  }

  @Test
  void unmatchedMetricsNeverReject() {
    var observer = new CapturingObserver<ExportMetricsServiceResponse>();

    service.export(request("web", "http.server.duration"), observer);

    assertThat(observer.error).isNull();
    assertThat(observer.completed).isTrue();
  }

  @Test
  void oneShotModePublishesOnlyTheFirstVerdict() throws Exception {
    when(config.oneShot()).thenReturn(true);

    service.export(
        request("first", "rpc.server.duration", "rpc.system"),
        new CapturingObserver<ExportMetricsServiceResponse>());
    service.export(
        request("second", "rpc.server.duration", "rpc.system", "rpc.service", "rpc.method"),
        new CapturingObserver<ExportMetricsServiceResponse>());

    var verdict = service.oneShot.await(Optional.of(Duration.ofSeconds(1)));
    assertThat(verdict).isPresent();
    assertThat(verdict.get().violationCount()).isEqualTo(2);
    assertThat(verdict.get().distinctScopes()).containsExactly("first");
  }

  @Test
  void continuousModeDoesNotPublish() {
    when(config.oneShot()).thenReturn(false);

    service.export(
        request("lib", "rpc.server.duration", "rpc.system"),
        new CapturingObserver<ExportMetricsServiceResponse>());

    assertThat(service.oneShot.isPublished()).isFalse();
  }

  @Test
  void cancelledCallFailsWithCancelled() {
    var observer = new CapturingObserver<ExportMetricsServiceResponse>();
    var ctx = Context.current().withCancellation();
    ctx.cancel(null);

    ctx.run(() -> service.export(request("lib", "rpc.server.duration"), observer));

    assertThat(observer.error).isInstanceOf(StatusRuntimeException.class);
    assertThat(((StatusRuntimeException) observer.error).getStatus().getCode())
        .isEqualTo(Status.Code.CANCELLED);
    assertThat(registry.counter(ComplianceMetrics.EXPORT_CALLS, "outcome", "cancelled").count())
        .isEqualTo(1.0);
  }

  @Test
  void unexpectedFailureMapsToInternal() {
    var events = mock(ComplianceEvents.class);
    doThrow(new IllegalStateException("sink down")).when(events).attributes(any(), any());
    service.checker = new ComplianceChecker(rules, events);
    var observer = new CapturingObserver<ExportMetricsServiceResponse>();

    service.export(request("lib", "rpc.server.duration"), observer);

    assertThat(observer.error).isInstanceOf(StatusRuntimeException.class);
    var sre = (StatusRuntimeException) observer.error;
    assertThat(sre.getStatus().getCode()).isEqualTo(Status.Code.INTERNAL);
    assertThat(sre.getStatus().getDescription()).isEqualTo("Internal error.");
    assertThat(registry.counter(ComplianceMetrics.EXPORT_CALLS, "outcome", "failed").count())
        .isEqualTo(1.0);
  }

  @Test
  void oneShotModeResolvesWhenTheCheckFails() throws Exception {
    when(config.oneShot()).thenReturn(true);
    var events = mock(ComplianceEvents.class);
    doThrow(new IllegalStateException("sink down")).when(events).attributes(any(), any());
    service.checker = new ComplianceChecker(rules, events);

    service.export(
        request("lib", "rpc.server.duration"),
        new CapturingObserver<ExportMetricsServiceResponse>());

    assertThat(service.oneShot.isPublished()).isTrue();
    assertThatThrownBy(() -> service.oneShot.await(Optional.empty()))
        .isInstanceOf(OneShotVerdicts.CheckFailedException.class)
        .hasRootCauseMessage("sink down");
  }

  @Test
  void oneShotModeResolvesWhenTheCallIsCancelled() {
    when(config.oneShot()).thenReturn(true);
    var ctx = Context.current().withCancellation();
    ctx.cancel(null);

    ctx.run(
        () ->
            service.export(
                request("lib", "rpc.server.duration"),
                new CapturingObserver<ExportMetricsServiceResponse>()));

    assertThat(service.oneShot.isPublished()).isTrue();
    assertThatThrownBy(() -> service.oneShot.await(Optional.of(Duration.ofSeconds(1))))
        .isInstanceOf(OneShotVerdicts.CheckFailedException.class);
  }

  private static ExportMetricsServiceRequest request(
      String scopeName, String metricName, String... pointKeys) {
    var point = NumberDataPoint.newBuilder().setAsInt(1);
    for (String key : pointKeys) {
      point.addAttributes(
          KeyValue.newBuilder().setKey(key).setValue(AnyValue.newBuilder().setStringValue("v")));
    }
    var metric =
        Metric.newBuilder().setName(metricName).setGauge(Gauge.newBuilder().addDataPoints(point));
    return ExportMetricsServiceRequest.newBuilder()
        .addResourceMetrics(
            ResourceMetrics.newBuilder()
                .setSchemaUrl(SCHEMA)
                .addScopeMetrics(
                    ScopeMetrics.newBuilder()
                        .setSchemaUrl(SCHEMA)
                        .setScope(InstrumentationScope.newBuilder().setName(scopeName))
                        .addMetrics(metric)))
        .build();
  }

  static final class CapturingObserver<T> implements StreamObserver<T> {
    final List<T> values = new ArrayList<>();
    Throwable error;
    boolean completed;

    @Override
    public void onNext(T value) {
      values.add(value);
    }

    @Override
    public void onError(Throwable t) {
      error = t;
    }

    @Override
    public void onCompleted() {
      completed = true;
    }
  }
}
