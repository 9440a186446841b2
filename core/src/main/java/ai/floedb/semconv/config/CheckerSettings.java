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

package ai.floedb.semconv.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Checker configuration as consumed by the match table builder. The service fills it from
 * MicroProfile config, the payload checker from a YAML file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckerSettings(
    @JsonProperty("resource") ResourceSettings resource,
    @JsonProperty("metrics") List<MetricRuleSettings> metrics,
    @JsonProperty("reportUnmatched") boolean reportUnmatched,
    @JsonProperty("oneShot") boolean oneShot) {

  public CheckerSettings {
    resource = resource == null ? ResourceSettings.none() : resource;
    metrics = List.copyOf(metrics == null ? List.of() : metrics);
  }

  /** Resource-level requirements. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ResourceSettings(
      @JsonProperty("groups") List<String> groups, @JsonProperty("ignore") List<String> ignore) {
    public ResourceSettings {
      groups = List.copyOf(groups == null ? List.of() : groups);
      ignore = List.copyOf(ignore == null ? List.of() : ignore);
    }

    public static ResourceSettings none() {
      return new ResourceSettings(List.of(), List.of());
    }
  }

  /** One metric rule: a name pattern and the groups every matching metric must satisfy. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record MetricRuleSettings(
      @JsonProperty("match") String match,
      @JsonProperty("groups") List<String> groups,
      @JsonProperty("ignore") List<String> ignore) {
    public MetricRuleSettings {
      groups = List.copyOf(groups == null ? List.of() : groups);
      ignore = List.copyOf(ignore == null ? List.of() : ignore);
    }
  }
}
