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

package ai.floedb.semconv.service.common;

import ai.floedb.semconv.check.Verdict;
import org.jboss.logging.Logger;

/** Start/finish logging with elapsed time for one RPC. */
public final class LogHelper {
  private final Logger log;
  private final String op;
  private final long startNs;

  private LogHelper(Logger log, String op) {
    this.log = log;
    this.op = op;
    this.startNs = System.nanoTime();
    log.debugf("op=%s start", op);
  }

  public static LogHelper start(Logger log, String op) {
    return new LogHelper(log, op);
  }

  public void accepted(Verdict verdict) {
    log.infof(
        "op=%s ok scopes=%d elapsedMs=%.1f", op, verdict.distinctScopes().size(), elapsedMs());
  }

  public void rejected(Verdict verdict) {
    log.infof(
        "op=%s rejected violations=%d scopes=%s elapsedMs=%.1f",
        op, verdict.violationCount(), verdict.distinctScopes(), elapsedMs());
  }

  public void cancelled() {
    log.warnf("op=%s cancelled elapsedMs=%.1f", op, elapsedMs());
  }

  public void fail(Throwable t) {
    log.errorf(t, "op=%s fail elapsedMs=%.1f", op, elapsedMs());
  }

  private double elapsedMs() {
    return (System.nanoTime() - startNs) / 1e6;
  }
}
