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

package ai.floedb.semconv.service.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

@ConfigMapping(prefix = "semconv")
public interface CheckerConfig {
  Catalog catalog();

  Resource resource();

  Optional<List<MetricRule>> metrics();

  @WithDefault("false")
  boolean reportUnmatched();

  /** Exit after the first export call with a status reflecting its verdict. */
  @WithDefault("false")
  boolean oneShot();

  /** How long one-shot mode waits for its export call; unset waits indefinitely. */
  Optional<Duration> oneShotTimeout();

  interface Catalog {
    @WithDefault("classpath:semconv/registry.yaml")
    String location();
  }

  interface Resource {
    Optional<List<String>> groups();

    Optional<List<String>> ignore();
  }

  interface MetricRule {
    String match();

    Optional<List<String>> groups();

    Optional<List<String>> ignore();
  }
}
