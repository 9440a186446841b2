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

import java.util.List;

/**
 * One semantic convention group as declared in the catalog.
 *
 * @param id group identifier, referenced from checker rules
 * @param prefix optional attribute prefix applied to locally declared attribute ids
 * @param extendsId optional parent group whose attributes are inherited
 * @param attributes fully qualified attribute keys declared by this group, in file order
 */
public record SemconvGroup(String id, String prefix, String extendsId, List<String> attributes) {
  public SemconvGroup {
    attributes = List.copyOf(attributes == null ? List.of() : attributes);
  }

  public boolean hasParent() {
    return extendsId != null && !extendsId.isBlank();
  }
}
