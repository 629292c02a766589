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
package io.yupiik.kubernetes.annotator.table;

import io.yupiik.kubernetes.annotator.service.step.Report;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import static java.util.stream.Collectors.joining;

/**
 * Renders a {@link Report} as an ASCII table, one row per step.
 */
public class ReportFormatter {
    private final Report report;

    public ReportFormatter(final Report report) {
        this.report = report;
    }

    @Override
    public String toString() {
        final var rows = new ArrayList<List<String>>(report.steps().size() + 1);
        rows.add(List.of("step", "status", "details"));
        report.steps().forEach(step -> rows.add(List.of(
                step.name(),
                step.status().name().toLowerCase(Locale.ROOT),
                singleLine(step.message()))));

        final var widths = maxWidths(rows);
        final var lineSeparator = "-".repeat(widths.stream().mapToInt(i -> i).sum() + 4 + (widths.size() - 1) * 3);
        final var title = "Deployment '" + report.namespace() + "/" + (report.name() == null ? "?" : report.name()) + "': " +
                (report.success() ? "success" : report.failures().size() + " failed step(s)");
        return Stream.concat(Stream.concat(
                                Stream.of(title, lineSeparator, formatLine(rows.get(0), widths), lineSeparator),
                                rows.stream().skip(1).map(row -> formatLine(row, widths))),
                        Stream.of(lineSeparator + '\n'))
                .collect(joining("\n"));
    }

    private String singleLine(final String message) {
        return message == null ? "" : message.replace('\n', ' ');
    }

    private List<Integer> maxWidths(final List<List<String>> rows) {
        final var widths = new ArrayList<Integer>();
        for (final var row : rows) {
            for (int i = 0; i < row.size(); i++) {
                final int length = row.get(i).length();
                if (widths.size() <= i) {
                    widths.add(length);
                } else if (widths.get(i) < length) {
                    widths.set(i, length);
                }
            }
        }
        return widths;
    }

    private String formatLine(final List<String> data, final List<Integer> widths) {
        final var widthIt = widths.iterator();
        return data.stream()
                .map(it -> it + " ".repeat(Math.max(0, widthIt.next() - it.length())))
                .collect(joining(" | ", "| ", " |"));
    }
}
