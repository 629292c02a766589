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

import java.util.List;
import java.util.Map;

@JsonModel
public record Report(String namespace, String name, List<StepResult> steps,
                     Map<String, String> annotationsBefore, Map<String, String> annotationsAfter) {
    public boolean success() {
        return steps.stream().noneMatch(StepResult::failed);
    }

    public List<StepResult> failures() {
        return steps.stream().filter(StepResult::failed).toList();
    }
}
