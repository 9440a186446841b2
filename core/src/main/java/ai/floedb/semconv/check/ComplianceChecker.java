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

import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.metrics.v1.Metric;
import io.opentelemetry.proto.metrics.v1.NumberDataPoint;
import io.opentelemetry.proto.metrics.v1.ResourceMetrics;
import io.opentelemetry.proto.metrics.v1.ScopeMetrics;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Walks an OTLP metrics export request (resources, scopes, metrics, data points) and folds the
 * per-metric comparisons into a {@link Verdict}.
 *
 * <p>Resource attributes and schema versions are reported through {@link ComplianceEvents} but do
 * not count towards the verdict; only missing attributes on metrics matched by a rule do. The
 * checker holds no per-call state and may be shared by concurrent calls.
 */
public final class ComplianceChecker {
  private static final BooleanSupplier NEVER = () -> false;

  private final CompiledRules rules;
  private final ComplianceEvents events;

  public ComplianceChecker(CompiledRules rules, ComplianceEvents events) {
    this.rules = Objects.requireNonNull(rules, "rules");
    this.events = Objects.requireNonNull(events, "events");
  }

  public CompiledRules rules() {
    return rules;
  }

  public Verdict check(ExportMetricsServiceRequest request) {
    return check(request, NEVER);
  }

  /**
   * Checks {@code request}. {@code cancelled} is polled before each resource and scope.
   *
   * @throws CancellationException if {@code cancelled} reports true mid-traversal
   */
  public Verdict check(ExportMetricsServiceRequest request, BooleanSupplier cancelled) {
    if (request == null) {
      return Verdict.clean();
    }
    BooleanSupplier stop = cancelled == null ? NEVER : cancelled;
    Verdict verdict = Verdict.clean();
    for (ResourceMetrics resourceMetrics : request.getResourceMetricsList()) {
      ensureActive(stop);
      verdict = verdict.plus(checkResource(resourceMetrics, stop));
    }
    return verdict;
  }

  private Verdict checkResource(ResourceMetrics resourceMetrics, BooleanSupplier stop) {
    if (resourceMetrics == null) {
      return Verdict.clean();
    }
    ResourceSchema schema = rules.resource();
    EventSite site = EventSite.resource(resourceMetrics.getSchemaUrl());
    if (!schema.expectedVersion().equals(resourceMetrics.getSchemaUrl())) {
      events.versionMismatch(site, schema.expectedVersion());
    }
    // advisory only: resource deviations are reported but never counted
    events.attributes(
        site,
        AttributeComparator.compareKeyValues(
            schema.required(),
            resourceMetrics.getResource().getAttributesList(),
            schema.ignore()));

    Verdict verdict = Verdict.clean();
    for (ScopeMetrics scopeMetrics : resourceMetrics.getScopeMetricsList()) {
      ensureActive(stop);
      verdict = verdict.plus(checkScope(scopeMetrics));
    }
    return verdict;
  }

  private Verdict checkScope(ScopeMetrics scopeMetrics) {
    if (scopeMetrics == null) {
      return Verdict.clean();
    }
    String scopeName = scopeMetrics.hasScope() ? scopeMetrics.getScope().getName() : "";
    String schemaUrl = scopeMetrics.getSchemaUrl();
    String expected = rules.resource().expectedVersion();
    if (!expected.equals(schemaUrl)) {
      events.versionMismatch(EventSite.scope(scopeName, schemaUrl), expected);
    }

    Verdict verdict = Verdict.clean();
    for (Metric metric : scopeMetrics.getMetricsList()) {
      verdict = verdict.plus(checkMetric(scopeName, schemaUrl, metric));
    }
    return verdict;
  }

  private Verdict checkMetric(String scopeName, String schemaUrl, Metric metric) {
    if (metric == null) {
      return Verdict.clean();
    }
    EventSite site = EventSite.metric(scopeName, metric.getName(), schemaUrl);

    MetricShape shape = MetricShape.of(metric);
    if (shape instanceof MetricShape.Unsupported unsupported) {
      events.unsupportedMetric(site, unsupported.kind());
      return Verdict.clean();
    }
    List<NumberDataPoint> points = ((MetricShape.NumberPoints) shape).points();

    List<MatchRule> matched = rules.table().matching(metric.getName());
    if (matched.isEmpty()) {
      if (rules.reportUnmatched()) {
        events.unmatchedMetric(site);
      }
      return Verdict.clean();
    }

    Verdict verdict = Verdict.clean();
    for (MatchRule rule : matched) {
      ComparisonResult result = comparePoints(rule, points);
      events.attributes(site, result);
      verdict = verdict.plus(Verdict.of(result.missing().size(), scopeName));
    }
    return verdict;
  }

  /** Compares every data point against {@code rule} and concatenates the results. */
  static ComparisonResult comparePoints(MatchRule rule, List<NumberDataPoint> points) {
    ComparisonResult result = ComparisonResult.empty();
    for (NumberDataPoint point : points) {
      result =
          result.plus(
              AttributeComparator.compareKeyValues(
                  rule.required(), point.getAttributesList(), rule.ignore()));
    }
    return result;
  }

  private static void ensureActive(BooleanSupplier stop) {
    if (stop.getAsBoolean()) {
      throw new CancellationException("export check cancelled");
    }
  }
}
