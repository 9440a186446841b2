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

import java.util.Objects;

/**
 * Where a compliance event was raised.
 *
 * @param section resource or metric
 * @param scopeName instrumentation scope name, null for resource events
 * @param metricName metric name, null for resource and scope events
 * @param schemaUrl schema url declared by the resource or scope
 */
public record EventSite(Section section, String scopeName, String metricName, String schemaUrl) {
  public EventSite {
    Objects.requireNonNull(section, "section");
    schemaUrl = schemaUrl == null ? "" : schemaUrl;
  }

  public static EventSite resource(String schemaUrl) {
    return new EventSite(Section.RESOURCE, null, null, schemaUrl);
  }

  public static EventSite scope(String scopeName, String schemaUrl) {
    return new EventSite(Section.METRIC, scopeName, null, schemaUrl);
  }

  public static EventSite metric(String scopeName, String metricName, String schemaUrl) {
    return new EventSite(Section.METRIC, scopeName, metricName, schemaUrl);
  }

  /** Renders the site as {@code key=value} pairs for log lines. */
  public String fields() {
    var sb = new StringBuilder("type=metrics section=").append(section.tag());
    if (scopeName != null) {
      sb.append(" scope.name=").append(scopeName);
    }
    if (metricName != null) {
      sb.append(" name=").append(metricName);
    }
    sb.append(" version=").append(schemaUrl);
    return sb.toString();
  }
}
