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
package io.yupiik.kubernetes.annotator.configuration;

import io.yupiik.fusion.framework.build.api.configuration.Property;

import java.util.List;

/**
 * Values used to build the deployment descriptor, defaults create a single nginx replica.
 * Labels are {@code key=value} entries.
 */
public record DeploymentConfiguration(
        @Property(documentation = "Deployment name.", defaultValue = "\"deploy-nginx\"") String name,
        @Property(documentation = "Container image.", defaultValue = "\"nginx\"") String image,
        @Property(value = "container-name", documentation = "Container name in the pod template.", defaultValue = "\"nginx-sample\"") String containerName,
        @Property(value = "image-pull-policy", documentation = "Container image pull policy.", defaultValue = "\"IfNotPresent\"") String imagePullPolicy,
        @Property(documentation = "Number of replicas, must be positive.", defaultValue = "1") int replicas,
        @Property(value = "container-port", documentation = "Port exposed by the container (1-65535).", defaultValue = "80") int containerPort,
        @Property(value = "pod-labels", documentation = "Pod template labels (`key=value`).", defaultValue = "java.util.List.of(\"app=nginx\")") List<String> podLabels,
        @Property(value = "selector-labels", documentation = "Selector labels (`key=value`), must be a subset of the pod labels.", defaultValue = "java.util.List.of(\"app=nginx\")") List<String> selectorLabels) {
}
