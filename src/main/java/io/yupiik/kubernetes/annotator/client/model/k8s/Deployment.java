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

import java.util.List;
import java.util.Map;

@JsonModel
public record Deployment(String apiVersion, String kind, Metadata metadata, Spec spec, Status status) {
    @JsonModel
    public record Spec(Integer replicas, Selector selector, PodTemplate template) {
    }

    @JsonModel
    public record Selector(Map<String, String> matchLabels) {
    }

    @JsonModel
    public record PodTemplate(Metadata metadata, PodSpec spec) {
    }

    @JsonModel
    public record PodSpec(List<Container> containers) {
    }

    @JsonModel
    public record Container(String name, String image, String imagePullPolicy, List<ContainerPort> ports) {
    }

    @JsonModel
    public record ContainerPort(Integer containerPort) {
    }

    @JsonModel
    public record Status(Long observedGeneration, Integer replicas, Integer readyReplicas, Integer availableReplicas) {
    }
}
