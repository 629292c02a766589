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
package io.yupiik.kubernetes.annotator.service.wait;

import io.yupiik.fusion.framework.api.scope.ApplicationScoped;
import io.yupiik.kubernetes.annotator.configuration.WaitConfiguration;
import io.yupiik.kubernetes.annotator.service.error.NotFoundException;
import io.yupiik.kubernetes.annotator.service.error.PropagationTimeoutException;

import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Waits for a mutation to be visible on subsequent reads.
 */
@ApplicationScoped
public class PropagationWaiter {
    private final Logger logger = Logger.getLogger(getClass().getName());

    /**
     * @param what      description of the awaited state, used in logs and errors.
     * @param reader    reads the current state, a {@link NotFoundException} means "not visible yet".
     * @param predicate the condition the read state must match.
     * @return the last read value in POLL mode, {@code null} in FIXED mode.
     */
    public <T> T await(final String what, final WaitConfiguration configuration,
                       final Supplier<T> reader, final Predicate<T> predicate) {
        return switch (configuration.mode()) {
            case FIXED -> {
                logger.finest(() -> "Waiting " + configuration.fixedDelay() + "ms for " + what);
                sleep(configuration.fixedDelay());
                yield null;
            }
            case POLL -> poll(what, configuration, reader, predicate);
        };
    }

    private <T> T poll(final String what, final WaitConfiguration configuration,
                       final Supplier<T> reader, final Predicate<T> predicate) {
        final int maxAttempts = Math.max(1, configuration.maxAttempts());
        long backoff = Math.max(0, configuration.initialBackoff());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                final var value = reader.get();
                if (predicate.test(value)) {
                    final int attempts = attempt;
                    logger.finest(() -> what + " after " + attempts + " attempt(s)");
                    return value;
                }
            } catch (final NotFoundException nfe) {
                logger.finest(() -> "Not yet visible (" + what + "): " + nfe.getMessage());
            }

            if (attempt < maxAttempts) {
                sleep(backoff);
                backoff = Math.min(configuration.maxBackoff(), (long) (backoff * Math.max(1., configuration.backoffMultiplier())));
            }
        }
        throw new PropagationTimeoutException("Timed out waiting for " + what + " (" + maxAttempts + " attempts)", maxAttempts);
    }

    protected void sleep(final long duration) {
        if (duration <= 0) {
            return;
        }
        try {
            Thread.sleep(duration);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
