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
import io.opentelemetry.proto.common.v1.KeyValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Key-presence comparison between a required attribute set and the attributes observed on a
 * resource or data point. Values are never inspected.
 */
public final class AttributeComparator {
  private AttributeComparator() {}

  /**
   * Computes {@code missing = required - observed} and {@code extra = observed - required}, then
   * drops every key in {@code ignore} from both. Missing keys keep the required set's order, extra
   * keys the order in which they were first observed. A null {@code observed} is treated as empty.
   */
  public static ComparisonResult compare(
      AttributeSet required, Collection<String> observed, Set<String> ignore) {
    AttributeSet req = required == null ? AttributeSet.empty() : required;
    Set<String> ign = ignore == null ? Set.of() : ignore;
    Set<String> seen = new LinkedHashSet<>();
    if (observed != null) {
      for (String key : observed) {
        if (key != null) {
          seen.add(key);
        }
      }
    }

    List<String> missing = new ArrayList<>();
    for (String key : req) {
      if (!seen.contains(key) && !ign.contains(key)) {
        missing.add(key);
      }
    }

    List<String> extra = new ArrayList<>();
    for (String key : seen) {
      if (!req.contains(key) && !ign.contains(key)) {
        extra.add(key);
      }
    }
    return new ComparisonResult(missing, extra);
  }

  /** Same as {@link #compare} over the keys of an OTLP attribute list. */
  public static ComparisonResult compareKeyValues(
      AttributeSet required, List<KeyValue> observed, Set<String> ignore) {
    return compare(required, keysOf(observed), ignore);
  }

  static List<String> keysOf(List<KeyValue> attributes) {
    if (attributes == null || attributes.isEmpty()) {
      return List.of();
    }
    List<String> keys = new ArrayList<>(attributes.size());
    for (KeyValue kv : attributes) {
      if (kv != null) {
        keys.add(kv.getKey());
      }
    }
    return keys;
  }
}
