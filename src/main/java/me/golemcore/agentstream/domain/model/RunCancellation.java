package me.golemcore.agentstream.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation token handed to a run by its transport.
 *
 * <p>
 * The first {@link #cancel(StopReason)} wins; later calls are ignored. The
 * signal is replayed to late subscribers, so a run started after the token was
 * cancelled stops right away.
 */
public final class RunCancellation {

    private final AtomicReference<StopReason> reason = new AtomicReference<>();
    private final Sinks.One<StopReason> signal = Sinks.one();

    public boolean cancel(StopReason stopReason) {
        if (!reason.compareAndSet(null, stopReason)) {
            return false;
        }
        signal.tryEmitValue(stopReason);
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<StopReason> getReason() {
        return Optional.ofNullable(reason.get());
    }

    public Mono<StopReason> whenCancelled() {
        return signal.asMono();
    }
}
