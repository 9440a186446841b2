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

import com.google.protobuf.Any;
import com.google.protobuf.Message;
import com.google.rpc.DebugInfo;
import com.google.rpc.ErrorInfo;
import com.google.rpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.protobuf.StatusProto;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.ConfigProvider;

/** Builds gRPC errors that carry {@code google.rpc.Status} details. */
public final class GrpcErrors {
  static final String ERROR_DOMAIN = "ai.floedb.semconv";

  public static final String REASON_MISSING_ATTRIBUTES = "MISSING_ATTRIBUTES";
  public static final String REASON_CANCELLED = "CANCELLED";
  public static final String REASON_INTERNAL = "INTERNAL";

  private GrpcErrors() {}

  /**
   * FAILED_PRECONDITION whose details carry {@code payload} (typically the partial-success export
   * response) followed by an {@link ErrorInfo}.
   */
  public static StatusRuntimeException preconditionFailed(
      String reason, String message, Map<String, String> metadata, Message payload) {
    return build(
        io.grpc.Status.FAILED_PRECONDITION,
        reason,
        message,
        metadata,
        payload == null ? List.of() : List.of(payload),
        null);
  }

  public static StatusRuntimeException cancelled(Throwable t) {
    return build(
        io.grpc.Status.CANCELLED, REASON_CANCELLED, rootMessage(t), Map.of(), List.of(), null);
  }

  public static StatusRuntimeException internal(Throwable t) {
    return build(
        io.grpc.Status.INTERNAL, REASON_INTERNAL, "Internal error.", Map.of(), List.of(), t);
  }

  static StatusRuntimeException build(
      io.grpc.Status canonical,
      String reason,
      String message,
      Map<String, String> metadata,
      List<Message> payloads,
      Throwable t) {
    Status.Builder statusBuilder =
        Status.newBuilder()
            .setCode(canonical.getCode().value())
            .setMessage(
                message == null || message.isBlank() ? canonical.getCode().name() : message);

    for (Message payload : payloads) {
      statusBuilder.addDetails(Any.pack(payload));
    }

    ErrorInfo.Builder info =
        ErrorInfo.newBuilder()
            .setReason(reason)
            .setDomain(ERROR_DOMAIN)
            .putMetadata("grpc_status", canonical.getCode().name());
    if (metadata != null) {
      info.putAllMetadata(metadata);
    }
    statusBuilder.addDetails(Any.pack(info.build()));

    if (t != null && debugDetailsEnabled()) {
      statusBuilder.addDetails(Any.pack(buildDebugInfo(t)));
    }
    return StatusProto.toStatusRuntimeException(statusBuilder.build());
  }

  private static boolean debugDetailsEnabled() {
    try {
      return ConfigProvider.getConfig()
          .getOptionalValue("semconv.errors.debug-details", Boolean.class)
          .orElse(false);
    } catch (IllegalStateException e) {
      // no config provider outside the container
      return false;
    }
  }

  private static DebugInfo buildDebugInfo(Throwable t) {
    Throwable root = rootCause(t);
    DebugInfo.Builder builder =
        DebugInfo.newBuilder().setDetail(root.getClass().getName() + ": " + rootMessage(root));
    StackTraceElement[] stackTrace = root.getStackTrace();
    int limit = Math.min(stackTrace.length, 5);
    for (int i = 0; i < limit; i++) {
      builder.addStackEntries(stackTrace[i].toString());
    }
    return builder.build();
  }

  private static Throwable rootCause(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root;
  }

  private static String rootMessage(Throwable t) {
    if (t == null) {
      return "";
    }
    String msg = rootCause(t).getMessage();
    return msg == null ? "" : msg;
  }
}
