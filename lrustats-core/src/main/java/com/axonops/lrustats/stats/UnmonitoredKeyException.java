/*
 * Copyright 2025 AxonOps
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

package com.axonops.lrustats.stats;

import com.axonops.lrustats.util.KeyHasher;

/**
 * Thrown when per-key statistics are requested for a key that is not being monitored.
 *
 * <p>Always recoverable: check {@link Statistics#isMonitoring(Object)} first, or catch this and
 * treat the key as having no recorded accesses.
 *
 * @since 1.0.0
 */
public final class UnmonitoredKeyException extends LruStatsException {

  private final transient Object key;

  public UnmonitoredKeyException(Object key) {
    super("LruStats: Requested statistics for unmonitored key (key hash: "
        + KeyHasher.hashWithType(key) + ")");
    this.key = key;
  }

  /** The key that was queried. */
  public Object getKey() {
    return key;
  }
}
