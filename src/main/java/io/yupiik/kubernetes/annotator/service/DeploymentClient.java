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
import io.yupiik.fusion.json.JsonMapper;
import io.yupiik.fusion.kubernetes.client.KubernetesClient;
import io.yupiik.kubernetes.annotator.client.model.k8s.AnnotationPatch;
import io.yupiik.kubernetes.annotator.client.model.k8s.ApiStatus;
import io.yupiik.kubernetes.annotator.client.model.k8s.Deployment;
import io.yupiik.kubernetes.annotator.service.error.ConflictException;
import io.yupiik.kubernetes.annotator.service.error.NotFoundException;
import io.yupiik.kubernetes.annotator.service.error.ResourceException;
import io.yupiik.kubernetes.annotator.service.error.TransportException;
import io.yupiik.kubernetes.annotator.service.error.ValidationException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

import static java.net.http.HttpRequest.BodyPublishers.ofString;
import static java.net.http.HttpResponse.BodyHandlers.ofString;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Create/read/merge-patch calls on {@code apps/v1} deployments.
 * HTTP failures are mapped to {@link ResourceException} subclasses.
 */
@ApplicationScoped
public class DeploymentClient {
    private final Logger logger = Logger.getLogger(getClass().getName());

    private final JsonMapper jsonMapper;

    public DeploymentClient(final JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    public Deployment create(final KubernetesClient client, final Duration timeout,
                             final String namespace, final Deployment deployment) {
        final var name = deployment.metadata() == null ? null : deployment.metadata().name();
        logger.finest(() -> "Creating deployment '" + namespace + "/" + name + "'");
        return await(client.sendAsync(
                        request(collection(namespace), timeout)
                                .header("content-type", "application/json")
                                .POST(ofString(jsonMapper.toString(deployment)))
                                .build(),
                        ofString())
                .thenApply(res -> {
                    validateResponse(res, "Can't create deployment '" + namespace + "/" + name + "'");
                    return jsonMapper.fromString(Deployment.class, res.body());
                }), "create deployment '" + namespace + "/" + name + "'");
    }

    public Deployment read(final KubernetesClient client, final Duration timeout,
                           final String namespace, final String name) {
        return await(client.sendAsync(
                        request(item(namespace, name), timeout)
                                .GET()
                                .build(),
                        ofString())
                .thenApply(res -> {
                    validateResponse(res, "Can't read deployment '" + namespace + "/" + name + "'");
                    return jsonMapper.fromString(Deployment.class, res.body());
                }), "read deployment '" + namespace + "/" + name + "'");
    }

    /**
     * Sends a JSON merge patch containing only {@code metadata.annotations} so no other field
     * (replicas, selector, image...) can be overwritten from a stale local state.
     */
    public Deployment patchAnnotations(final KubernetesClient client, final Duration timeout,
                                       final String namespace, final String name,
                                       final Map<String, String> annotations) {
        final var body = jsonMapper.toString(AnnotationPatch.of(annotations));
        logger.finest(() -> "Patching deployment '" + namespace + "/" + name + "': " + body);
        return await(client.sendAsync(
                        request(item(namespace, name), timeout)
                                .header("content-type", "application/merge-patch+json")
                                .method("PATCH", ofString(body))
                                .build(),
                        ofString())
                .thenApply(res -> {
                    validateResponse(res, "Can't patch deployment '" + namespace + "/" + name + "'");
                    return jsonMapper.fromString(Deployment.class, res.body());
                }), "patch deployment '" + namespace + "/" + name + "'");
    }

    private HttpRequest.Builder request(final String path, final Duration timeout) {
        return HttpRequest.newBuilder()
                .header("accept", "application/json")
                .uri(URI.create("https://kubernetes.api" + path))
                .timeout(timeout);
    }

    private String collection(final String namespace) {
        return "/apis/apps/v1/namespaces/" + URLEncoder.encode(namespace, UTF_8) + "/deployments";
    }

    private String item(final String namespace, final String name) {
        return collection(namespace) + '/' + URLEncoder.encode(name, UTF_8);
    }

    private <T> T await(final CompletionStage<T> stage, final String action) {
        try {
            return stage.toCompletableFuture().get();
        } catch (final ExecutionException e) {
            throw unwrap(e.getCause(), action);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while trying to " + action, e);
        }
    }

    private ResourceException unwrap(final Throwable error, final String action) {
        final var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ResourceException re) {
            return re;
        }
        return new TransportException("Can't " + action + ": " + cause, cause);
    }

    private void validateResponse(final HttpResponse<String> res, final String error) {
        final int status = res.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }

        final var message = error + " (HTTP " + status + "): " + describe(res.body());
        switch (status) {
            case 404 -> throw new NotFoundException(message);
            case 409 -> throw new ConflictException(message);
            case 400, 422 -> throw new ValidationException(message);
            default -> throw new TransportException(message);
        }
    }

    private String describe(final String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        try {
            final var status = jsonMapper.fromString(ApiStatus.class, body);
            if (status.message() != null) {
                return status.reason() == null ? status.message() : status.reason() + ": " + status.message();
            }
        } catch (final RuntimeException re) { // not a Status payload, use the raw body
            logger.finest(() -> "Error payload is not a Kubernetes status: " + re.getMessage());
        }
        return body;
    }
}
