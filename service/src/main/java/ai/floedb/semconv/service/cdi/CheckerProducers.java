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

package ai.floedb.semconv.service.cdi;

import ai.floedb.semconv.catalog.SemconvCatalog;
import ai.floedb.semconv.catalog.SemconvCatalogLoader;
import ai.floedb.semconv.check.CompiledRules;
import ai.floedb.semconv.check.ComplianceChecker;
import ai.floedb.semconv.check.ComplianceEvents;
import ai.floedb.semconv.check.LoggingComplianceEvents;
import ai.floedb.semconv.check.MatchTableBuilder;
import ai.floedb.semconv.config.CheckerSettings;
import ai.floedb.semconv.config.CheckerSettings.MetricRuleSettings;
import ai.floedb.semconv.config.CheckerSettings.ResourceSettings;
import ai.floedb.semconv.service.config.CheckerConfig;
import ai.floedb.semconv.service.telemetry.ComplianceMetrics;
import ai.floedb.semconv.service.telemetry.MeteredComplianceEvents;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the read-only checker state once per process. Catalog or rule errors surface while these
 * producers run and abort startup.
 */
@ApplicationScoped
public class CheckerProducers {

  @Produces
  @Singleton
  public SemconvCatalog produceCatalog(CheckerConfig config) {
    return new SemconvCatalogLoader().load(config.catalog().location());
  }

  @Produces
  @Singleton
  public CompiledRules produceCompiledRules(CheckerConfig config, SemconvCatalog catalog) {
    return MatchTableBuilder.build(toSettings(config), catalog);
  }

  @Produces
  @Singleton
  public ComplianceEvents produceComplianceEvents(ComplianceMetrics metrics) {
    return new MeteredComplianceEvents(new LoggingComplianceEvents(), metrics);
  }

  @Produces
  @Singleton
  public ComplianceChecker produceChecker(CompiledRules rules, ComplianceEvents events) {
    return new ComplianceChecker(rules, events);
  }

  static CheckerSettings toSettings(CheckerConfig config) {
    var resource =
        new ResourceSettings(
            config.resource().groups().orElse(List.of()),
            config.resource().ignore().orElse(List.of()));
    var metrics = new ArrayList<MetricRuleSettings>();
    for (CheckerConfig.MetricRule rule : config.metrics().orElse(List.of())) {
      metrics.add(
          new MetricRuleSettings(
              rule.match(), rule.groups().orElse(List.of()), rule.ignore().orElse(List.of())));
    }
    return new CheckerSettings(resource, metrics, config.reportUnmatched(), config.oneShot());
  }
}
