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

import me.golemcore.agentstream.domain.exception.TimeoutConfigurationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Nested timeout scopes of a run.
 *
 * <p>
 * {@code connection} bounds request/response transports only (the websocket
 * transport is exempt). {@code stream} bounds one run's total wall-clock time.
 * {@code tool} bounds each tool invocation, and the narrower
 * {@code web_search} scope applies to network-bound tools.
 *
 * <p>
 * Instances are only created through {@link #of}, which rejects any
 * configuration where {@code tool}, {@code web_search} or {@code connection} is
 * not strictly shorter than {@code stream}.
 */
public final class TimeoutHierarchy {

    private final TimeoutScope connection;
    private final TimeoutScope stream;
    private final TimeoutScope tool;
    private final TimeoutScope webSearch;
    private final Set<String> webSearchTools;

    private TimeoutHierarchy(TimeoutScope connection, TimeoutScope stream, TimeoutScope tool,
            TimeoutScope webSearch, Set<String> webSearchTools) {
        this.connection = connection;
        this.stream = stream;
        this.tool = tool;
        this.webSearch = webSearch;
        this.webSearchTools = webSearchTools;
    }

    public static TimeoutHierarchy of(Duration connection, Duration stream, Duration tool, Duration webSearch,
            List<String> webSearchTools) {
        List<String> violations = new ArrayList<>();
        requirePositive(violations, TimeoutScope.CONNECTION, connection);
        requirePositive(violations, TimeoutScope.STREAM, stream);
        requirePositive(violations, TimeoutScope.TOOL, tool);
        requirePositive(violations, TimeoutScope.WEB_SEARCH, webSearch);

        if (violations.isEmpty()) {
            requireShorter(violations, TimeoutScope.TOOL, tool, stream);
            requireShorter(violations, TimeoutScope.WEB_SEARCH, webSearch, stream);
            requireShorter(violations, TimeoutScope.CONNECTION, connection, stream);
            if (webSearch.compareTo(tool) > 0) {
                violations.add(String.format(Locale.ROOT, "%s timeout (%s) must not exceed %s timeout (%s)",
                        TimeoutScope.WEB_SEARCH, format(webSearch), TimeoutScope.TOOL, format(tool)));
            }
        }

        if (!violations.isEmpty()) {
            throw new TimeoutConfigurationException(violations);
        }

        Set<String> tools = webSearchTools == null ? Set.of()
                : webSearchTools.stream()
                        .filter(name -> name != null && !name.isBlank())
                        .map(String::trim)
                        .collect(Collectors.toUnmodifiableSet());
        return new TimeoutHierarchy(
                new TimeoutScope(TimeoutScope.CONNECTION, connection),
                new TimeoutScope(TimeoutScope.STREAM, stream),
                new TimeoutScope(TimeoutScope.TOOL, tool),
                new TimeoutScope(TimeoutScope.WEB_SEARCH, webSearch),
                tools);
    }

    private static void requirePositive(List<String> violations, String scope, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            violations.add(scope + " timeout must be positive, got " + (value == null ? "null" : format(value)));
        }
    }

    private static void requireShorter(List<String> violations, String scope, Duration value, Duration stream) {
        if (value.compareTo(stream) >= 0) {
            violations.add(String.format(Locale.ROOT, "%s timeout (%s) must be less than %s timeout (%s)",
                    scope, format(value), TimeoutScope.STREAM, format(stream)));
        }
    }

    private static String format(Duration value) {
        return value.toMillis() % 1000 == 0 ? value.toSeconds() + "s" : value.toMillis() + "ms";
    }

    public TimeoutScope getConnection() {
        return connection;
    }

    public TimeoutScope getStream() {
        return stream;
    }

    public TimeoutScope getTool() {
        return tool;
    }

    public TimeoutScope getWebSearch() {
        return webSearch;
    }

    /**
     * Deadline that applies to one invocation of the named tool.
     */
    public TimeoutScope scopeForTool(String toolName) {
        if (toolName != null && webSearchTools.contains(toolName)) {
            return webSearch;
        }
        return tool;
    }

    public String describe() {
        return stream + " [" + connection + ", " + tool + ", " + webSearch + "]";
    }
}
