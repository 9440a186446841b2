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

/**
 * Sink for the observations made while checking an export call. None of these events changes the
 * verdict; they exist so that operators can see why a payload was accepted or rejected.
 */
public interface ComplianceEvents {

  /** The resource or scope at {@code site} declares a schema url other than {@code expected}. */
  void versionMismatch(EventSite site, String expected);

  /** Result of comparing the attributes at {@code site}; may be clean. */
  void attributes(EventSite site, ComparisonResult result);

  /** No rule matched the metric at {@code site}. Only raised when unmatched reporting is on. */
  void unmatchedMetric(EventSite site);

  /** The metric at {@code site} has a payload the checker cannot inspect. */
  void unsupportedMetric(EventSite site, String shape);
}
