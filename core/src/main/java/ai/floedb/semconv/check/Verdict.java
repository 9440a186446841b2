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
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Aggregated outcome of one export call.
 *
 * @param violationCount number of missing required attributes over all matched metrics
 * @param implicatedScopes scope name of every rule match that was evaluated, in traversal order
 */
public record Verdict(long violationCount, List<String> implicatedScopes) {
  private static final Verdict CLEAN = new Verdict(0, List.of());

  public Verdict {
    if (violationCount < 0) {
      throw new IllegalArgumentException("violationCount must be >= 0");
    }
    implicatedScopes = List.copyOf(implicatedScopes == null ? List.of() : implicatedScopes);
  }

  public static Verdict clean() {
    return CLEAN;
  }

  /** Verdict of a single rule match in {@code scopeName}. */
  public static Verdict of(long missing, String scopeName) {
    return new Verdict(missing, List.of(scopeName == null ? "" : scopeName));
  }

  public Verdict plus(Verdict other) {
    if (other == null || other == CLEAN) {
      return this;
    }
    if (this == CLEAN) {
      return other;
    }
    var scopes = new ArrayList<String>(implicatedScopes.size() + other.implicatedScopes.size());
    scopes.addAll(implicatedScopes);
    scopes.addAll(other.implicatedScopes);
    return new Verdict(violationCount + other.violationCount, scopes);
  }

  public boolean hasViolations() {
    return violationCount > 0;
  }

  /** Implicated scope names without repeats, first occurrence first. */
  public List<String> distinctScopes() {
    return List.copyOf(new LinkedHashSet<>(implicatedScopes));
  }
}
