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

import ai.floedb.semconv.catalog.AttributeSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A compiled metric rule.
 *
 * @param index position of the rule in the configuration, used in log output
 * @param pattern metric name pattern, matched anywhere in the name
 * @param required merged attribute keys of the rule's groups
 * @param ignore keys never reported as missing or extra for this rule
 */
public record MatchRule(int index, Pattern pattern, AttributeSet required, Set<String> ignore) {
  public MatchRule {
    Objects.requireNonNull(pattern, "pattern");
    required = required == null ? AttributeSet.empty() : required;
    ignore = Set.copyOf(ignore == null ? Set.of() : ignore);
  }

  public boolean matches(String metricName) {
    return metricName != null && pattern.matcher(metricName).find();
  }
}
