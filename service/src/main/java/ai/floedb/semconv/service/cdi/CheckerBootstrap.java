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

import ai.floedb.semconv.check.ComplianceChecker;
import ai.floedb.semconv.service.config.CheckerConfig;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/** Compiles the checker before the gRPC endpoint accepts calls. */
@ApplicationScoped
public class CheckerBootstrap {
  private static final Logger LOG = Logger.getLogger(CheckerBootstrap.class);

  @Inject ComplianceChecker checker;
  @Inject CheckerConfig config;

  void onStart(@Observes StartupEvent ev) {
    var rules = checker.rules();
    LOG.infof(
        "Semantic convention checker ready metricRules=%d expectedVersion=%s reportUnmatched=%s"
            + " oneShot=%s",
        rules.table().size(),
        rules.resource().expectedVersion(),
        rules.reportUnmatched(),
        config.oneShot());
  }
}
