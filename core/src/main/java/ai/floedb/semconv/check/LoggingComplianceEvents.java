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

import org.jboss.logging.Logger;

/** Writes compliance events to the {@code ai.floedb.semconv.check} log category. */
public final class LoggingComplianceEvents implements ComplianceEvents {
  private static final Logger LOG = Logger.getLogger(LoggingComplianceEvents.class);

  @Override
  public void versionMismatch(EventSite site, String expected) {
    String subject = site.section() == Section.RESOURCE ? "resource" : "scope";
    LOG.infof("%s incorrect %s version expected=%s", site.fields(), subject, expected);
  }

  @Override
  public void attributes(EventSite site, ComparisonResult result) {
    if (result.hasMissing()) {
      LOG.infof("%s missing attributes missing=%s", site.fields(), result.missing());
    }
    if (result.hasExtra()) {
      LOG.infof("%s extra attributes extra=%s", site.fields(), result.extra());
    }
  }

  @Override
  public void unmatchedMetric(EventSite site) {
    LOG.infof("%s unmatched metric", site.fields());
  }

  @Override
  public void unsupportedMetric(EventSite site, String shape) {
    LOG.warnf("%s unsupported metric kind=%s", site.fields(), shape);
  }
}
