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

package ai.floedb.semconv.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads {@link CheckerSettings} from a YAML document. */
public final class CheckerSettingsLoader {
  private final ObjectMapper mapper;

  public CheckerSettingsLoader() {
    this.mapper =
        new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
  }

  public CheckerSettings load(Path path) throws IOException {
    if (path == null || !Files.exists(path)) {
      throw new IOException("Checker configuration does not exist: " + path);
    }
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    }
  }

  public CheckerSettings load(InputStream in) throws IOException {
    byte[] data = in.readAllBytes();
    if (data.length == 0) {
      return new CheckerSettings(null, null, false, false);
    }
    CheckerSettings settings = mapper.readValue(data, CheckerSettings.class);
    return settings == null ? new CheckerSettings(null, null, false, false) : settings;
  }
}
