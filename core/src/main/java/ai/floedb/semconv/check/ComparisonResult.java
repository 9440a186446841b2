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

/**
 * Outcome of one attribute comparison. After ignore filtering a key never appears in both lists.
 *
 * @param missing required keys absent from the observed attributes
 * @param extra observed keys not covered by the required set
 */
public record ComparisonResult(List<String> missing, List<String> extra) {
  private static final ComparisonResult EMPTY = new ComparisonResult(List.of(), List.of());

  public ComparisonResult {
    missing = List.copyOf(missing == null ? List.of() : missing);
    extra = List.copyOf(extra == null ? List.of() : extra);
  }

  public static ComparisonResult empty() {
    return EMPTY;
  }

  /** Concatenates both lists, keeping this result's entries first. */
  public ComparisonResult plus(ComparisonResult other) {
    if (other == null || other.isClean()) {
      return this;
    }
    if (isClean()) {
      return other;
    }
    var m = new ArrayList<String>(missing.size() + other.missing.size());
    m.addAll(missing);
    m.addAll(other.missing);
    var e = new ArrayList<String>(extra.size() + other.extra.size());
    e.addAll(extra);
    e.addAll(other.extra);
    return new ComparisonResult(m, e);
  }

  public boolean hasMissing() {
    return !missing.isEmpty();
  }

  public boolean hasExtra() {
    return !extra.isEmpty();
  }

  public boolean isClean() {
    return missing.isEmpty() && extra.isEmpty();
  }
}
