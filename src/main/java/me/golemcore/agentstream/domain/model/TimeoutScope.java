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

import java.time.Duration;

/**
 * Named deadline applied to one level of the timeout hierarchy.
 */
public record TimeoutScope(String name, Duration deadline) {

    public static final String CONNECTION = "connection";
    public static final String STREAM = "stream";
    public static final String TOOL = "tool";
    public static final String WEB_SEARCH = "web_search";

    public boolean isShorterThan(TimeoutScope other) {
        return deadline.compareTo(other.deadline) < 0;
    }

    @Override
    public String toString() {
        return name + "=" + deadline.toMillis() + "ms";
    }
}
