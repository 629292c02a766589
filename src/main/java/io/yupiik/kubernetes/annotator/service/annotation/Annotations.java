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
package io.yupiik.kubernetes.annotator.service.annotation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.util.stream.Collectors.joining;

/**
 * String to string metadata helpers (annotations and labels).
 */
public final class Annotations {
    private Annotations() {
        // no-op
    }

    /**
     * Merges two annotation sets: every existing entry is kept unless {@code updates} redefines its key.
     * Applying it twice with the same updates gives the same result.
     *
     * @param existing the current annotations, can be {@code null} when the resource has none.
     * @param updates  the annotations to set.
     * @return a new sorted map.
     */
    public static Map<String, String> merge(final Map<String, String> existing, final Map<String, String> updates) {
        final var merged = new TreeMap<String, String>();
        if (existing != null) {
            merged.putAll(existing);
        }
        if (updates != null) {
            merged.putAll(updates);
        }
        return merged;
    }

    public static boolean containsAll(final Map<String, String> actual, final Map<String, String> expected) {
        if (expected == null || expected.isEmpty()) {
            return true;
        }
        if (actual == null) {
            return false;
        }
        return expected.entrySet().stream().allMatch(e -> e.getValue().equals(actual.get(e.getKey())));
    }

    /**
     * Parses {@code key=value} entries, the value can contain {@code =}. Keys and values are stripped.
     *
     * @throws IllegalArgumentException if an entry has no {@code =} or a blank key.
     */
    public static Map<String, String> parse(final Collection<String> entries) {
        final var errors = new ArrayList<String>();
        final var parsed = parse(entries, errors);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join(", ", errors));
        }
        return parsed;
    }

    public static Map<String, String> parse(final Collection<String> entries, final List<String> errors) {
        final var out = new TreeMap<String, String>();
        if (entries == null) {
            return out;
        }
        for (final var entry : entries) {
            final int sep = entry == null ? -1 : entry.indexOf('=');
            if (sep <= 0 || entry.substring(0, sep).isBlank()) {
                errors.add("invalid entry '" + entry + "', expected 'key=value'");
                continue;
            }
            out.put(entry.substring(0, sep).strip(), entry.substring(sep + 1).strip());
        }
        return out;
    }

    public static String format(final Map<String, String> annotations) {
        if (annotations == null || annotations.isEmpty()) {
            return "{}";
        }
        return new TreeMap<>(annotations).entrySet().stream()
                .map(e -> e.getKey() + '=' + e.getValue())
                .collect(joining(", ", "{", "}"));
    }
}
