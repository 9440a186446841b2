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

package ai.floedb.semconv.service;

import ai.floedb.semconv.check.ExitStatus;
import ai.floedb.semconv.check.Verdict;
import ai.floedb.semconv.service.config.CheckerConfig;
import ai.floedb.semconv.service.oneshot.OneShotVerdicts;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import java.util.Optional;
import org.jboss.logging.Logger;

@QuarkusMain
public class CheckerMain {

  public static void main(String... args) {
    Quarkus.run(CheckerApp.class, args);
  }

  public static class CheckerApp implements QuarkusApplication {
    private static final Logger LOG = Logger.getLogger(CheckerApp.class);

    @Inject CheckerConfig config;
    @Inject OneShotVerdicts verdicts;

    @Override
    public int run(String... args) throws Exception {
      if (!config.oneShot()) {
        Quarkus.waitForExit();
        return ExitStatus.CLEAN.code();
      }
      return exitCode(verdicts, config);
    }

    static int exitCode(OneShotVerdicts verdicts, CheckerConfig config)
        throws InterruptedException {
      Optional<Verdict> verdict;
      try {
        verdict = verdicts.await(config.oneShotTimeout());
      } catch (OneShotVerdicts.CheckFailedException e) {
        LOG.errorf(e.getCause(), "one-shot export check failed");
        return ExitStatus.CHECK_FAILED.code();
      }
      if (verdict.isEmpty()) {
        LOG.warnf(
            "one-shot timed out waiting for an export call timeout=%s",
            config.oneShotTimeout().orElseThrow());
        return ExitStatus.TIMED_OUT.code();
      }
      var status = ExitStatus.of(verdict.get());
      LOG.infof("one-shot exit status=%s code=%d", status, status.code());
      return status.code();
    }
  }
}
