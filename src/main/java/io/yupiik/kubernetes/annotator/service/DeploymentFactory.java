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
package io.yupiik.kubernetes.annotator.service;

import io.yupiik.fusion.framework.api.scope.ApplicationScoped;
import io.yupiik.kubernetes.annotator.client.model.k8s.Deployment;
import io.yupiik.kubernetes.annotator.client.model.k8s.Metadata;
import io.yupiik.kubernetes.annotator.configuration.DeploymentConfiguration;
import io.yupiik.kubernetes.annotator.service.annotation.Annotations;
import io.yupiik.kubernetes.annotator.service.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the deployment descriptor from the configuration and validates it before any submission.
 */
@ApplicationScoped
public class DeploymentFactory {
    private static final Pattern DNS_SUBDOMAIN = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*");

    public Deployment create(final DeploymentConfiguration configuration) {
        final var errors = new ArrayList<String>();
        final var podLabels = Annotations.parse(configuration.podLabels(), errors);
        final var selectorLabels = Annotations.parse(configuration.selectorLabels(), errors);

        validate(configuration, podLabels, selectorLabels, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        return new Deployment(
                "apps/v1", "Deployment",
                Metadata.of(configuration.name(), null),
                new Deployment.Spec(
                        configuration.replicas(),
                        new Deployment.Selector(selectorLabels),
                        new Deployment.PodTemplate(
                                Metadata.of(null, podLabels),
                                new Deployment.PodSpec(List.of(new Deployment.Container(
                                        configuration.containerName(), configuration.image(), configuration.imagePullPolicy(),
                                        List.of(new Deployment.ContainerPort(configuration.containerPort()))))))),
                null);
    }

    /**
     * Ensures a deployment name can be used in an API path (DNS-1123 subdomain).
     *
     * @throws ValidationException if it is not the case.
     */
    public void requireValidName(final String name) {
        final var errors = new ArrayList<String>(1);
        validateName(name, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private void validateName(final String name, final List<String> errors) {
        if (name == null || name.length() > 253 || !DNS_SUBDOMAIN.matcher(name).matches()) {
            errors.add("name '" + name + "' is not a valid DNS-1123 subdomain");
        }
    }

    private void validate(final DeploymentConfiguration configuration,
                          final Map<String, String> podLabels, final Map<String, String> selectorLabels,
                          final List<String> errors) {
        validateName(configuration.name(), errors);
        if (configuration.image() == null || configuration.image().isBlank()) {
            errors.add("image is required");
        }
        if (configuration.containerName() == null || configuration.containerName().isBlank()) {
            errors.add("container name is required");
        }
        if (configuration.replicas() <= 0) {
            errors.add("replicas must be positive, got " + configuration.replicas());
        }
        if (configuration.containerPort() < 1 || configuration.containerPort() > 65535) {
            errors.add("container port must be in [1, 65535], got " + configuration.containerPort());
        }
        if (selectorLabels.isEmpty()) {
            errors.add("selector labels can't be empty");
        } else if (!Annotations.containsAll(podLabels, selectorLabels)) { // else the API server rejects it
            errors.add("selector labels " + Annotations.format(selectorLabels) + " do not match pod labels " + Annotations.format(podLabels));
        }
    }
}
