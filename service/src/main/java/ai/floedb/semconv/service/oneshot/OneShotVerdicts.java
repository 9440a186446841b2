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

package ai.floedb.semconv.service.oneshot;

import ai.floedb.semconv.check.Verdict;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jboss.logging.Logger;

/**
 * Hands the outcome of the first export call to the process entry point. Only the first outcome
 * counts, whether a verdict or a failure; later ones are logged and dropped.
 */
@ApplicationScoped
public class OneShotVerdicts {
  private static final Logger LOG = Logger.getLogger(OneShotVerdicts.class);

  private final CompletableFuture<Verdict> first = new CompletableFuture<>();

  /** Returns true when {@code verdict} is the one the process will exit with. */
  public boolean publish(Verdict verdict) {
    Objects.requireNonNull(verdict, "verdict");
    if (first.complete(verdict)) {
      LOG.infof("one-shot verdict published violations=%d", verdict.violationCount());
      return true;
    }
    LOG.debugf(
        "one-shot verdict already published, ignoring violations=%d", verdict.violationCount());
    return false;
  }

  /** Records that the first call could not be checked. Returns true when this failure wins. */
  public boolean fail(Throwable cause) {
    Objects.requireNonNull(cause, "cause");
    if (first.completeExceptionally(cause)) {
      LOG.warnf("one-shot check failed cause=%s", cause.toString());
      return true;
    }
    LOG.debugf("one-shot outcome already published, ignoring failure cause=%s", cause.toString());
    return false;
  }

  public boolean isPublished() {
    return first.isDone();
  }

  /**
   * Blocks until the first outcome is published. Empty when {@code timeout} elapses first; an empty
   * {@code timeout} waits indefinitely.
   *
   * @throws CheckFailedException if the first call failed instead of producing a verdict
   */
  public Optional<Verdict> await(Optional<Duration> timeout) throws InterruptedException {
    try {
      if (timeout.isPresent()) {
        return Optional.of(first.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS));
      }
      return Optional.of(first.get());
    } catch (TimeoutException e) {
      return Optional.empty();
    } catch (ExecutionException e) {
      throw new CheckFailedException(e.getCause());
    }
  }

  /** The first export call ended without a verdict. */
  public static final class CheckFailedException extends RuntimeException {
    CheckFailedException(Throwable cause) {
      super("one-shot export check failed", cause);
    }
  }
}
