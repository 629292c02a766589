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

import io.yupiik.fusion.framework.api.scope.ApplicationScoped;
import io.yupiik.fusion.json.JsonMapper;
import io.yupiik.kubernetes.annotator.service.step.Report;
import io.yupiik.kubernetes.annotator.service.step.StepResult;

import java.io.PrintStream;

import static java.util.stream.Collectors.joining;

@ApplicationScoped
public class ReportPrinter {
    private final JsonMapper jsonMapper;

    public ReportPrinter(final JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    /**
     * Prints the report then fails if any step failed so the process exits with an error status.
     */
    public void printAndCheck(final Report report, final Format format, final PrintStream out) {
        out.println(switch (format) {
            case TABLE -> new ReportFormatter(report);
            case JSON -> jsonMapper.toString(report);
        });
        if (!report.success()) {
            throw new IllegalStateException("Failed step(s): " + report.failures().stream()
                    .map(StepResult::name)
                    .collect(joining(", ")));
        }
    }

    public enum Format {
        TABLE, JSON
    }
}
