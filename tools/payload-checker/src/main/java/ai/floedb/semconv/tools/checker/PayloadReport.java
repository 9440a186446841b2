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

package ai.floedb.semconv.tools.checker;

import ai.floedb.semconv.check.ComparisonResult;
import ai.floedb.semconv.check.ComplianceEvents;
import ai.floedb.semconv.check.EventSite;
import ai.floedb.semconv.check.Section;
import java.util.ArrayList;
import java.util.List;

/** Collects findings for the CLI report while forwarding every event to the log sink. */
final class PayloadReport implements ComplianceEvents {
  private final ComplianceEvents delegate;
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();

  PayloadReport(ComplianceEvents delegate) {
    this.delegate = delegate;
  }

  List<String> errors() {
    return List.copyOf(errors);
  }

  List<String> warnings() {
    return List.copyOf(warnings);
  }

  @Override
  public void versionMismatch(EventSite site, String expected) {
    if (site.section() == Section.RESOURCE) {
      warnings.add(
          "Resource declares schema '" + site.schemaUrl() + "', expected '" + expected + "'");
    } else {
      warnings.add(
          "Scope '"
              + site.scopeName()
              + "' declares schema '"
              + site.schemaUrl()
              + "', expected '"
              + expected
              + "'");
    }
    delegate.versionMismatch(site, expected);
  }

  @Override
  public void attributes(EventSite site, ComparisonResult result) {
    if (site.section() == Section.RESOURCE) {
      if (result.hasMissing()) {
        warnings.add("Resource is missing " + String.join(", ", result.missing()));
      }
      if (result.hasExtra()) {
        warnings.add("Resource has unexpected " + String.join(", ", result.extra()));
      }
    } else {
      if (result.hasMissing()) {
        errors.add(describe(site) + " is missing " + String.join(", ", result.missing()));
      }
      if (result.hasExtra()) {
        warnings.add(describe(site) + " has unexpected " + String.join(", ", result.extra()));
      }
    }
    delegate.attributes(site, result);
  }

  @Override
  public void unmatchedMetric(EventSite site) {
    warnings.add(describe(site) + " matches no rule");
    delegate.unmatchedMetric(site);
  }

  @Override
  public void unsupportedMetric(EventSite site, String shape) {
    warnings.add(describe(site) + " has unsupported kind " + shape + " and was skipped");
    delegate.unsupportedMetric(site, shape);
  }

  private static String describe(EventSite site) {
    return "Metric '" + site.metricName() + "' in scope '" + site.scopeName() + "'";
  }
}
