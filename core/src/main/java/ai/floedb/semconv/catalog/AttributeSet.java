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

package ai.floedb.semconv.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of attribute keys. Iteration follows first-seen insertion order so that
 * comparisons and log output are stable across runs.
 */
public final class AttributeSet implements Iterable<String> {
  private static final AttributeSet EMPTY = new AttributeSet(new LinkedHashSet<>());

  private final Set<String> keys;

  private AttributeSet(LinkedHashSet<String> keys) {
    this.keys = Collections.unmodifiableSet(keys);
  }

  public static AttributeSet empty() {
    return EMPTY;
  }

  public static AttributeSet of(String... keys) {
    return copyOf(List.of(keys));
  }

  /** Copies {@code keys}, dropping nulls and collapsing duplicates. A null collection is empty. */
  public static AttributeSet copyOf(Collection<String> keys) {
    if (keys == null || keys.isEmpty()) {
      return EMPTY;
    }
    var copy = new LinkedHashSet<String>(keys.size());
    for (String key : keys) {
      if (key != null) {
        copy.add(key);
      }
    }
    return copy.isEmpty() ? EMPTY : new AttributeSet(copy);
  }

  public AttributeSet union(AttributeSet other) {
    if (other == null || other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    var merged = new LinkedHashSet<String>(keys);
    merged.addAll(other.keys);
    return new AttributeSet(merged);
  }

  public boolean contains(String key) {
    return keys.contains(key);
  }

  public boolean isEmpty() {
    return keys.isEmpty();
  }

  public int size() {
    return keys.size();
  }

  public Set<String> asSet() {
    return keys;
  }

  public List<String> asList() {
    return List.copyOf(new ArrayList<>(keys));
  }

  @Override
  public Iterator<String> iterator() {
    return keys.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof AttributeSet other && keys.equals(other.keys);
  }

  @Override
  public int hashCode() {
    return keys.hashCode();
  }

  @Override
  public String toString() {
    return keys.toString();
  }
}
