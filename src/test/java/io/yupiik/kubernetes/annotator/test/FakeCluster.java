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
package io.yupiik.kubernetes.annotator.test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.yupiik.fusion.json.JsonMapper;
import io.yupiik.fusion.kubernetes.client.KubernetesClient;
import io.yupiik.kubernetes.annotator.client.model.k8s.AnnotationPatch;
import io.yupiik.kubernetes.annotator.client.model.k8s.ApiStatus;
import io.yupiik.kubernetes.annotator.client.model.k8s.Deployment;
import io.yupiik.kubernetes.annotator.client.model.k8s.Metadata;
import io.yupiik.kubernetes.annotator.configuration.CliKubernetesConfiguration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * In memory {@code apps/v1} deployments API: create, get and merge-patch of the annotations.
 */
public class FakeCluster {
    private static final Pattern PATH = Pattern.compile("^/apis/apps/v1/namespaces/([^/]+)/deployments(?:/([^/]+))?$");

    private final HttpServer server;
    private final JsonMapper jsonMapper;
    private final Set<String> namespaces = ConcurrentHashMap.newKeySet();
    private final Map<String, Deployment> deployments = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> pendingStatus = new ConcurrentHashMap<>();
    private final List<String> patches = new CopyOnWriteArrayList<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> forcedStatus = new ConcurrentHashMap<>();
    private volatile int statusLag;

    public FakeCluster(final HttpServer server, final JsonMapper jsonMapper) {
        this.server = server;
        this.jsonMapper = jsonMapper;
        this.namespaces.addAll(List.of("default", "test"));
        server.createContext("/").setHandler(ex -> {
            try (ex) {
                handle(ex);
            }
        });
    }

    public KubernetesClient newClient() {
        return new CliKubernetesConfiguration(null, null, null, null, null, null, 10_000L).client();
    }

    /**
     * @param reads number of reads of a newly created deployment returning no observed generation yet.
     */
    public FakeCluster statusLag(final int reads) {
        this.statusLag = reads;
        return this;
    }

    /**
     * Makes the next request using this HTTP method fail with the given status, whatever the resource state.
     */
    public FakeCluster failNext(final String method, final int status) {
        forcedStatus.put(method, status);
        return this;
    }

    public FakeCluster put(final String namespace, final String name, final Map<String, String> annotations) {
        deployments.put(namespace + '/' + name, new Deployment(
                "apps/v1", "Deployment",
                new Metadata(name, namespace, Map.of(), annotations, OffsetDateTime.now(ZoneOffset.UTC), "1", UUID.randomUUID().toString(), 1L),
                new Deployment.Spec(
                        2,
                        new Deployment.Selector(Map.of("app", "existing")),
                        new Deployment.PodTemplate(
                                new Metadata(null, null, Map.of("app", "existing"), null, null, null, null, null),
                                new Deployment.PodSpec(List.of(new Deployment.Container(
                                        "existing", "httpd", "Always", List.of(new Deployment.ContainerPort(8080))))))),
                new Deployment.Status(1L, 2, 2, 2)));
        return this;
    }

    public Deployment get(final String namespace, final String name) {
        return deployments.get(namespace + '/' + name);
    }

    public int size() {
        return deployments.size();
    }

    public List<String> patches() {
        return patches;
    }

    // "METHOD path" of each received request
    public List<String> requests() {
        return requests;
    }

    private void handle(final HttpExchange ex) throws IOException {
        final var method = ex.getRequestMethod();
        final var path = ex.getRequestURI().getPath();
        requests.add(method + ' ' + path);

        final var forced = forcedStatus.remove(method);
        if (forced != null) {
            ex.getRequestBody().readAllBytes();
            sendStatus(ex, forced, "Forced", "forced " + forced + " on " + method);
            return;
        }

        final var matcher = PATH.matcher(path);
        if (!matcher.matches()) {
            sendStatus(ex, 404, "NotFound", "unknown path " + path);
            return;
        }

        final var namespace = matcher.group(1);
        final var name = matcher.group(2);
        if (!namespaces.contains(namespace)) {
            sendStatus(ex, 404, "NotFound", "namespaces \"" + namespace + "\" not found");
            return;
        }

        final var body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        if (name == null && "POST".equals(method)) {
            create(ex, namespace, body);
        } else if (name != null && "GET".equals(method)) {
            read(ex, namespace, name);
        } else if (name != null && "PATCH".equals(method)) {
            patch(ex, namespace, name, body);
        } else {
            sendStatus(ex, 405, "MethodNotAllowed", method + " not supported on " + path);
        }
    }

    private void create(final HttpExchange ex, final String namespace, final String body) throws IOException {
        final var deployment = jsonMapper.fromString(Deployment.class, body);
        final var name = deployment.metadata() == null ? null : deployment.metadata().name();
        if (name == null || name.isBlank()) {
            sendStatus(ex, 422, "Invalid", "metadata.name: Required value");
            return;
        }
        final var selector = deployment.spec().selector().matchLabels();
        final var labels = deployment.spec().template().metadata().labels();
        if (selector == null || labels == null || !labels.entrySet().containsAll(selector.entrySet())) {
            sendStatus(ex, 422, "Invalid", "spec.template.metadata.labels: Invalid value: `selector` does not match template `labels`");
            return;
        }

        final var key = namespace + '/' + name;
        final var stored = new Deployment(
                deployment.apiVersion(), deployment.kind(),
                new Metadata(name, namespace, deployment.metadata().labels(), deployment.metadata().annotations(),
                        OffsetDateTime.now(ZoneOffset.UTC), "1", UUID.randomUUID().toString(), 1L),
                deployment.spec(),
                new Deployment.Status(1L, deployment.spec().replicas(), 0, 0));
        if (deployments.putIfAbsent(key, stored) != null) {
            sendStatus(ex, 409, "AlreadyExists", "deployments.apps \"" + name + "\" already exists");
            return;
        }
        pendingStatus.put(key, new AtomicInteger(statusLag));
        send(ex, 201, jsonMapper.toString(stored));
    }

    private void read(final HttpExchange ex, final String namespace, final String name) throws IOException {
        final var key = namespace + '/' + name;
        final var deployment = deployments.get(key);
        if (deployment == null) {
            sendStatus(ex, 404, "NotFound", "deployments.apps \"" + name + "\" not found");
            return;
        }
        final var pending = pendingStatus.get(key);
        if (pending != null && pending.getAndDecrement() > 0) { // controller did not reconcile it yet
            send(ex, 200, jsonMapper.toString(new Deployment(
                    deployment.apiVersion(), deployment.kind(), deployment.metadata(), deployment.spec(), null)));
            return;
        }
        send(ex, 200, jsonMapper.toString(deployment));
    }

    private void patch(final HttpExchange ex, final String namespace, final String name, final String body) throws IOException {
        final var contentType = ex.getRequestHeaders().getFirst("content-type");
        if (contentType == null || !contentType.startsWith("application/merge-patch+json")) {
            sendStatus(ex, 415, "UnsupportedMediaType", "unsupported patch content type: " + contentType);
            return;
        }
        final var key = namespace + '/' + name;
        final var current = deployments.get(key);
        if (current == null) {
            sendStatus(ex, 404, "NotFound", "deployments.apps \"" + name + "\" not found");
            return;
        }
        patches.add(body);

        final var patch = jsonMapper.fromString(AnnotationPatch.class, body);
        final var annotations = new TreeMap<String, String>();
        if (current.metadata().annotations() != null) {
            annotations.putAll(current.metadata().annotations());
        }
        if (patch.metadata() != null && patch.metadata().annotations() != null) {
            annotations.putAll(patch.metadata().annotations());
        }
        final var meta = current.metadata();
        final var updated = new Deployment(
                current.apiVersion(), current.kind(),
                new Metadata(meta.name(), meta.namespace(), meta.labels(), annotations, meta.creationTimestamp(),
                        Integer.toString(Integer.parseInt(meta.resourceVersion()) + 1), meta.uid(), meta.generation()),
                current.spec(), current.status());
        deployments.put(key, updated);
        send(ex, 200, jsonMapper.toString(updated));
    }

    private void sendStatus(final HttpExchange ex, final int code, final String reason, final String message) throws IOException {
        send(ex, code, jsonMapper.toString(new ApiStatus("Status", "Failure", message, reason, code)));
    }

    private void send(final HttpExchange ex, final int code, final String payload) throws IOException {
        final var bytes = payload.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("content-type", "application/json");
        ex.sendResponseHeaders(code, bytes.length);
        ex.getResponseBody().write(bytes);
    }
}
