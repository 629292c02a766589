/*
 * Copyright (c) 2024 - present - Yupiik SAS - https://www.yupiik.com
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.yupiik.kubernetes.annotator.configuration;

import io.yupiik.fusion.framework.build.api.configuration.Property;
import io.yupiik.kubernetes.annotator.service.wait.WaitMode;

public record WaitConfiguration(
        @Property(documentation = "How to wait for a change to be visible: a fixed pause or polling until the expected state is read.", defaultValue = "io.yupiik.kubernetes.annotator.service.wait.WaitMode.POLL") WaitMode mode,
        @Property(value = "fixed-delay", documentation = "Pause duration (ms) for the FIXED mode.", defaultValue = "2_000L") long fixedDelay,
        @Property(value = "max-attempts", documentation = "Max number of reads for the POLL mode.", defaultValue = "10") int maxAttempts,
        @Property(value = "initial-backoff", documentation = "First pause (ms) between two reads for the POLL mode.", defaultValue = "100L") long initialBackoff,
        @Property(value = "max-backoff", documentation = "Max pause (ms) between two reads for the POLL mode.", defaultValue = "2_000L") long maxBackoff,
        @Property(value = "backoff-multiplier", documentation = "Factor applied to the pause after each unsuccessful read.", defaultValue = "2.") double backoffMultiplier) {
    public static WaitConfiguration defaults() {
        return new WaitConfiguration(WaitMode.POLL, 2_000L, 10, 100L, 2_000L, 2.);
    }
}
