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
package io.yupiik.kubernetes.annotator.service.step;

import io.yupiik.fusion.framework.build.api.json.JsonModel;

@JsonModel
public record StepResult(String name, Status status, String message) {
    public static StepResult success(final String name, final String message) {
        return new StepResult(name, Status.SUCCESS, message);
    }

    public static StepResult failure(final String name, final String message) {
        return new StepResult(name, Status.FAILURE, message);
    }

    public static StepResult skipped(final String name) {
        return skipped(name, "previous step failed");
    }

    public static StepResult skipped(final String name, final String reason) {
        return new StepResult(name, Status.SKIPPED, reason);
    }

    public boolean failed() {
        return status == Status.FAILURE;
    }

    public enum Status {
        SUCCESS, FAILURE, SKIPPED
    }
}
