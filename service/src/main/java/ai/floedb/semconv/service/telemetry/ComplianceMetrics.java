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

package ai.floedb.semconv.service.telemetry;

import ai.floedb.semconv.check.Section;
import ai.floedb.semconv.check.Verdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Locale;
import java.util.Objects;

/** Micrometer meters for export calls and the compliance events they raise. */
@ApplicationScoped
public class ComplianceMetrics {
  public static final String EXPORT_CALLS = "semconv.export.calls";
  public static final String MISSING_ATTRIBUTES = "semconv.attributes.missing";
  public static final String EVENTS = "semconv.events";

  public enum Outcome {
    ACCEPTED,
    REJECTED,
    CANCELLED,
    FAILED
  }

  private final MeterRegistry registry;
  private final Counter missingAttributes;

  @Inject
  public ComplianceMetrics(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.missingAttributes =
        Counter.builder(MISSING_ATTRIBUTES)
            .description("Required attributes missing from matched metrics")
            .register(registry);
  }

  public void recordVerdict(Verdict verdict) {
    if (verdict.hasViolations()) {
      missingAttributes.increment(verdict.violationCount());
      recordCall(Outcome.REJECTED);
    } else {
      recordCall(Outcome.ACCEPTED);
    }
  }

  public void recordCall(Outcome outcome) {
    registry.counter(EXPORT_CALLS, "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
  }

  public void recordEvent(String kind, Section section) {
    registry.counter(EVENTS, "kind", kind, "section", section.tag()).increment();
  }
}
