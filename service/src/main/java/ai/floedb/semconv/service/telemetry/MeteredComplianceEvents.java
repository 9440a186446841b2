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

import ai.floedb.semconv.check.ComparisonResult;
import ai.floedb.semconv.check.ComplianceEvents;
import ai.floedb.semconv.check.EventSite;
import java.util.Objects;

/** Counts compliance events before handing them to the wrapped sink. */
public final class MeteredComplianceEvents implements ComplianceEvents {
  private final ComplianceEvents delegate;
  private final ComplianceMetrics metrics;

  public MeteredComplianceEvents(ComplianceEvents delegate, ComplianceMetrics metrics) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void versionMismatch(EventSite site, String expected) {
    metrics.recordEvent("version_mismatch", site.section());
    delegate.versionMismatch(site, expected);
  }

  @Override
  public void attributes(EventSite site, ComparisonResult result) {
    if (result.hasMissing()) {
      metrics.recordEvent("missing_attributes", site.section());
    }
    if (result.hasExtra()) {
      metrics.recordEvent("extra_attributes", site.section());
    }
    delegate.attributes(site, result);
  }

  @Override
  public void unmatchedMetric(EventSite site) {
    metrics.recordEvent("unmatched_metric", site.section());
    delegate.unmatchedMetric(site);
  }

  @Override
  public void unsupportedMetric(EventSite site, String shape) {
    metrics.recordEvent("unsupported_metric", site.section());
    delegate.unsupportedMetric(site, shape);
  }
}
