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
import java.util.Set;

/**
 * Requirements applied to every resource of an export call.
 *
 * @param required merged attribute keys of the configured resource groups
 * @param ignore keys never reported for resources
 * @param expectedVersion schema url resources and scopes should declare
 */
public record ResourceSchema(AttributeSet required, Set<String> ignore, String expectedVersion) {
  public ResourceSchema {
    required = required == null ? AttributeSet.empty() : required;
    ignore = Set.copyOf(ignore == null ? Set.of() : ignore);
    expectedVersion = expectedVersion == null ? "" : expectedVersion;
  }
}
