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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only registry of semantic convention groups together with the schema url that telemetry is
 * expected to declare. Group inheritance is resolved once at construction, so lookups never walk
 * the {@code extends} chain.
 */
public final class SemconvCatalog {
  private final String schemaUrl;
  private final Map<String, SemconvGroup> groups;
  private final Map<String, AttributeSet> resolved;

  public SemconvCatalog(String schemaUrl, Collection<SemconvGroup> groups) {
    if (schemaUrl == null || schemaUrl.isBlank()) {
      throw new SemconvCatalogLoadException("Semantic convention catalog has no schema_url");
    }
    this.schemaUrl = schemaUrl;

    var byId = new LinkedHashMap<String, SemconvGroup>();
    for (SemconvGroup group : Objects.requireNonNull(groups, "groups")) {
      if (group.id() == null || group.id().isBlank()) {
        throw new SemconvCatalogLoadException("Semantic convention group without an id");
      }
      if (byId.putIfAbsent(group.id(), group) != null) {
        throw new SemconvCatalogLoadException("Duplicate semantic convention group: " + group.id());
      }
    }
    this.groups = Collections.unmodifiableMap(byId);

    var flattened = new LinkedHashMap<String, AttributeSet>();
    for (String id : byId.keySet()) {
      flattened.put(id, flatten(id, new LinkedHashSet<>()));
    }
    this.resolved = Collections.unmodifiableMap(flattened);
  }

  private AttributeSet flatten(String id, Set<String> visiting) {
    if (!visiting.add(id)) {
      throw new SemconvCatalogLoadException(
          "Cyclic extends chain in semantic convention groups: "
              + String.join(" -> ", visiting)
              + " -> "
              + id);
    }
    SemconvGroup group = groups.get(id);
    AttributeSet own = AttributeSet.copyOf(group.attributes());
    if (!group.hasParent()) {
      return own;
    }
    if (!groups.containsKey(group.extendsId())) {
      throw new SemconvCatalogLoadException(
          "Group " + id + " extends unknown group " + group.extendsId());
    }
    return flatten(group.extendsId(), visiting).union(own);
  }

  /** The schema url (version string) that resources and scopes are expected to declare. */
  public String schemaUrl() {
    return schemaUrl;
  }

  public SemconvGroup group(String id) {
    SemconvGroup group = groups.get(id);
    if (group == null) {
      throw new UnknownGroupException(id);
    }
    return group;
  }

  public boolean contains(String id) {
    return groups.containsKey(id);
  }

  public List<String> groupIds() {
    return new ArrayList<>(groups.keySet());
  }

  /**
   * Merges the attribute sets of the named groups, inherited attributes included.
   *
   * @throws UnknownGroupException if any id is not in the catalog
   */
  public AttributeSet attributes(List<String> groupIds) {
    AttributeSet merged = AttributeSet.empty();
    if (groupIds == null) {
      return merged;
    }
    for (String id : groupIds) {
      AttributeSet attrs = resolved.get(id);
      if (attrs == null) {
        throw new UnknownGroupException(id);
      }
      merged = merged.union(attrs);
    }
    return merged;
  }

  public int size() {
    return groups.size();
  }
}
