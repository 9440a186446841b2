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

import java.util.ArrayList;
import java.util.List;

/** Ordered, read-only list of metric rules. Safe to share between concurrent export calls. */
public final class MatchTable {
  private static final MatchTable EMPTY = new MatchTable(List.of());

  private final List<MatchRule> rules;

  public MatchTable(List<MatchRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static MatchTable empty() {
    return EMPTY;
  }

  /** Every rule whose pattern matches {@code metricName}, in declaration order. */
  public List<MatchRule> matching(String metricName) {
    List<MatchRule> out = new ArrayList<>(2);
    for (MatchRule rule : rules) {
      if (rule.matches(metricName)) {
        out.add(rule);
      }
    }
    return out;
  }

  public List<MatchRule> rules() {
    return rules;
  }

  public int size() {
    return rules.size();
  }
}
