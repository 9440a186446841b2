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

package ai.floedb.semconv.service.error.impl;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.protobuf.Any;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.rpc.DebugInfo;
import com.google.rpc.ErrorInfo;
import io.grpc.Status;
import io.grpc.protobuf.StatusProto;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsPartialSuccess;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceResponse;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GrpcErrorsTest {

  @Test
  void preconditionFailedCarriesPayloadThenErrorInfo() throws Exception {
    var payload =
        ExportMetricsServiceResponse.newBuilder()
            .setPartialSuccess(ExportMetricsPartialSuccess.newBuilder().setRejectedDataPoints(3))
            .build();

    var sre =
        GrpcErrors.preconditionFailed(
            GrpcErrors.REASON_MISSING_ATTRIBUTES,
            "missing attributes: [a]",
            Map.of("k", "v"),
            payload);

    assertThat(sre.getStatus().getCode()).isEqualTo(Status.Code.FAILED_PRECONDITION);
    var status = StatusProto.fromThrowable(sre);
    assertThat(status.getMessage()).isEqualTo("missing attributes: [a]");
    assertThat(status.getDetailsCount()).isEqualTo(2);
    assertThat(status.getDetails(0).unpack(ExportMetricsServiceResponse.class)).isEqualTo(payload);

    var info = status.getDetails(1).unpack(ErrorInfo.class);
    assertThat(info.getReason()).isEqualTo("MISSING_ATTRIBUTES");
    assertThat(info.getDomain()).isEqualTo(GrpcErrors.ERROR_DOMAIN);
    assertThat(info.getMetadataMap())
        .containsEntry("k", "v")
        .containsEntry("grpc_status", "FAILED_PRECONDITION");
  }

  @Test
  void blankMessageFallsBackToCodeName() {
    var sre = GrpcErrors.preconditionFailed("R", " ", null, null);

    var status = StatusProto.fromThrowable(sre);
    assertThat(status.getMessage()).isEqualTo("FAILED_PRECONDITION");
    assertThat(status.getDetailsCount()).isEqualTo(1);
  }

  @Test
  void cancelledUsesRootCauseMessage() throws Exception {
    var sre = GrpcErrors.cancelled(new RuntimeException("outer", new RuntimeException("stopped")));

    assertThat(sre.getStatus().getCode()).isEqualTo(Status.Code.CANCELLED);
    assertThat(sre.getStatus().getDescription()).isEqualTo("stopped");
    assertThat(errorInfo(StatusProto.fromThrowable(sre)).getReason())
        .isEqualTo(GrpcErrors.REASON_CANCELLED);
  }

  @Test
  void internalHidesCauseWithoutDebugDetails() throws Exception {
    var sre = GrpcErrors.internal(new IllegalStateException("secret"));

    var status = StatusProto.fromThrowable(sre);
    assertThat(sre.getStatus().getCode()).isEqualTo(Status.Code.INTERNAL);
    assertThat(status.getMessage()).isEqualTo("Internal error.");
    assertThat(status.getDetailsList()).noneMatch(any -> any.is(DebugInfo.class));
    assertThat(errorInfo(status).getReason()).isEqualTo(GrpcErrors.REASON_INTERNAL);
  }

  private static ErrorInfo errorInfo(com.google.rpc.Status status)
      throws InvalidProtocolBufferException {
    for (Any any : status.getDetailsList()) {
      if (any.is(ErrorInfo.class)) {
        return any.unpack(ErrorInfo.class);
      }
    }
    throw new AssertionError("no ErrorInfo detail");
  }
}
