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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class CheckerSettingsLoaderTest {
  private final CheckerSettingsLoader loader = new CheckerSettingsLoader();

  @Test
  void readsFullConfiguration() throws Exception {
    String yaml =
        """
        resource:
          groups: [service, telemetry.sdk]
          ignore: [service.version]
        metrics:
          - match: "^http\\\\.server\\\\."
            groups: [metric.http.server.request.duration]
            ignore: [network.protocol.name]
          - match: rpc
            groups: metric.rpc.server.duration
        reportUnmatched: true
        oneShot: true
        """;

    CheckerSettings settings = load(yaml);

    assertThat(settings.resource().groups()).containsExactly("service", "telemetry.sdk");
    assertThat(settings.resource().ignore()).containsExactly("service.version");
    assertThat(settings.metrics()).hasSize(2);
    assertThat(settings.metrics().get(0).match()).isEqualTo("^http\\.server\\.");
    assertThat(settings.metrics().get(0).ignore()).containsExactly("network.protocol.name");
    assertThat(settings.metrics().get(1).groups()).containsExactly("metric.rpc.server.duration");
    assertThat(settings.metrics().get(1).ignore()).isEmpty();
    assertThat(settings.reportUnmatched()).isTrue();
    assertThat(settings.oneShot()).isTrue();
  }

  @Test
  void missingSectionsDefaultToEmpty() throws Exception {
    CheckerSettings settings = load("reportUnmatched: true\n");

    assertThat(settings.reportUnmatched()).isTrue();
    assertThat(settings.oneShot()).isFalse();
    assertThat(settings.metrics()).isEmpty();
    assertThat(settings.resource().groups()).isEmpty();

    assertThat(load("").metrics()).isEmpty();
  }

  @Test
  void missingFileFails() {
    assertThatThrownBy(() -> loader.load(Path.of("does-not-exist.yaml")))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("does not exist");
  }

  private CheckerSettings load(String yaml) throws IOException {
    return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
  }
}
