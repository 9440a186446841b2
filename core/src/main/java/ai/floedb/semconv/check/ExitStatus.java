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

/** Process exit codes of the one-shot checker and the payload checker CLI. */
public enum ExitStatus {
  CLEAN(0),
  USAGE(1),
  TIMED_OUT(2),
  CHECK_FAILED(3),
  VIOLATIONS(100);

  private final int code;

  ExitStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ExitStatus of(Verdict verdict) {
    return verdict != null && verdict.hasViolations() ? VIOLATIONS : CLEAN;
  }
}
