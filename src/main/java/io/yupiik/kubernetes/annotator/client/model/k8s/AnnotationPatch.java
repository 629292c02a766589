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
package io.yupiik.kubernetes.annotator.client.model.k8s;

import io.yupiik.fusion.framework.build.api.json.JsonModel;

import java.util.Map;

/**
 * JSON merge patch body touching only {@code metadata.annotations}.
 */
@JsonModel
public record AnnotationPatch(PatchMetadata metadata) {
    public static AnnotationPatch of(final Map<String, String> annotations) {
        return new AnnotationPatch(new PatchMetadata(annotations));
    }

    @JsonModel
    public record PatchMetadata(Map<String, String> annotations) {
    }
}
