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
import io.yupiik.fusion.kubernetes.client.KubernetesClient;
import io.yupiik.kubernetes.annotator.client.model.k8s.Deployment;
import io.yupiik.kubernetes.annotator.configuration.WaitConfiguration;
import io.yupiik.kubernetes.annotator.service.annotation.Annotations;
import io.yupiik.kubernetes.annotator.service.error.ConflictException;
import io.yupiik.kubernetes.annotator.service.error.ResourceException;
import io.yupiik.kubernetes.annotator.service.error.ValidationException;
import io.yupiik.kubernetes.annotator.service.step.ErrorPolicy;
import io.yupiik.kubernetes.annotator.service.step.ExistingPolicy;
import io.yupiik.kubernetes.annotator.service.step.Report;
import io.yupiik.kubernetes.annotator.service.step.StepResult;
import io.yupiik.kubernetes.annotator.service.wait.PropagationWaiter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

import static java.util.logging.Level.SEVERE;

/**
 * Runs the create, wait, read, annotate, wait, read sequence against a single deployment.
 * Each step produces a {@link StepResult}, failures never escape this class.
 */
@ApplicationScoped
public class ResourceAnnotator {
    private final Logger logger = Logger.getLogger(getClass().getName());

    private final DeploymentClient deploymentClient;
    private final DeploymentFactory deploymentFactory;
    private final PropagationWaiter waiter;

    public ResourceAnnotator(final DeploymentClient deploymentClient, final DeploymentFactory deploymentFactory,
                             final PropagationWaiter waiter) {
        this.deploymentClient = deploymentClient;
        this.deploymentFactory = deploymentFactory;
        this.waiter = waiter;
    }

    public Report createAndAnnotate(final KubernetesClient k8s, final Options options,
                                    final Supplier<Deployment> descriptor, final Map<String, String> annotations) {
        final var run = new Run(options);
        run.step("create", () -> {
            final var deployment = descriptor.get(); // validation errors are create failures
            final var name = deployment.metadata().name();
            run.name = name;
            try {
                deploymentClient.create(k8s, options.timeout(), options.namespace(), deployment);
                logger.info(() -> "Deployment '" + name + "' created in namespace '" + options.namespace() + "'.");
                return "created " + options.namespace() + '/' + name;
            } catch (final ConflictException ce) {
                if (options.onExisting() != ExistingPolicy.REUSE) {
                    throw ce;
                }
                logger.info(() -> "Deployment '" + name + "' already exists in namespace '" + options.namespace() + "', reusing it.");
                return "already exists";
            }
        });
        if (run.name == null) { // invalid descriptor, nothing can be targeted
            return run.skipRemaining(List.of("wait-created", "read-before", "annotate", "wait-annotated", "read-after"));
        }
        run.step("wait-created", () -> {
            final var ready = waiter.await(
                    "deployment '" + run.name + "' creation", options.propagation(),
                    () -> deploymentClient.read(k8s, options.timeout(), options.namespace(), run.name),
                    this::isObserved);
            return ready == null ? "waited " + options.propagation().fixedDelay() + "ms" : "generation " + ready.metadata().generation() + " observed";
        });
        return annotate(run, k8s, annotations);
    }

    public Report annotate(final KubernetesClient k8s, final Options options,
                           final String name, final Map<String, String> annotations) {
        final var run = new Run(options);
        try { // a blank name would target the whole collection
            deploymentFactory.requireValidName(name);
        } catch (final ValidationException ve) {
            run.fail("read-before", ve);
            return run.skipRemaining(List.of("annotate", "wait-annotated", "read-after"));
        }
        run.name = name;
        return annotate(run, k8s, annotations);
    }

    private Report annotate(final Run run, final KubernetesClient k8s, final Map<String, String> annotations) {
        final var options = run.options;
        final var name = run.name;
        final var namespace = options.namespace();

        run.step("read-before", () -> {
            run.before = annotationsOf(deploymentClient.read(k8s, options.timeout(), namespace, name));
            logger.info(() -> "Before annotation: " + Annotations.format(run.before));
            return Annotations.format(run.before);
        });

        run.step("annotate", () -> {
            // re-read: the previous snapshot can be stale (or missing if the read failed)
            final var current = deploymentClient.read(k8s, options.timeout(), namespace, name);
            final var updated = Annotations.merge(annotationsOf(current), annotations);
            deploymentClient.patchAnnotations(k8s, options.timeout(), namespace, name, updated);
            run.merged = updated;
            logger.info(() -> "Annotations updated for deployment '" + name + "'.");
            return annotations.size() + " annotation(s) applied";
        });

        run.step("wait-annotated", () -> {
            final var expected = run.merged == null ? annotations : run.merged;
            final var visible = waiter.await(
                    "deployment '" + name + "' annotations", options.propagation(),
                    () -> deploymentClient.read(k8s, options.timeout(), namespace, name),
                    d -> Annotations.containsAll(annotationsOf(d), expected));
            return visible == null ? "waited " + options.propagation().fixedDelay() + "ms" : "annotations visible";
        });

        run.step("read-after", () -> {
            run.after = annotationsOf(deploymentClient.read(k8s, options.timeout(), namespace, name));
            logger.info(() -> "After annotation: " + Annotations.format(run.after));
            return Annotations.format(run.after);
        });

        return run.report();
    }

    private boolean isObserved(final Deployment deployment) {
        if (deployment == null || deployment.metadata() == null || deployment.status() == null) {
            return false;
        }
        final var generation = deployment.metadata().generation();
        final var observed = deployment.status().observedGeneration();
        return generation != null && observed != null && observed >= generation;
    }

    private Map<String, String> annotationsOf(final Deployment deployment) {
        if (deployment == null || deployment.metadata() == null || deployment.metadata().annotations() == null) {
            return Map.of();
        }
        return deployment.metadata().annotations();
    }

    public record Options(String namespace, Duration timeout, WaitConfiguration propagation,
                          ErrorPolicy onError, ExistingPolicy onExisting) {
        public Options {
            Objects.requireNonNull(namespace, "namespace can't be null");
            timeout = timeout == null ? Duration.ofMinutes(1) : timeout;
            propagation = propagation == null ? WaitConfiguration.defaults() : propagation;
            onError = onError == null ? ErrorPolicy.CONTINUE : onError;
            onExisting = onExisting == null ? ExistingPolicy.FAIL : onExisting;
        }
    }

    private class Run {
        private final Options options;
        private final List<StepResult> results = new ArrayList<>();
        private boolean failed;
        private String name;
        private Map<String, String> merged;
        private Map<String, String> before;
        private Map<String, String> after;

        private Run(final Options options) {
            this.options = options;
        }

        private void step(final String name, final Supplier<String> task) {
            if (failed && options.onError() == ErrorPolicy.ABORT) {
                results.add(StepResult.skipped(name));
                return;
            }
            try {
                results.add(StepResult.success(name, task.get()));
            } catch (final ResourceException re) {
                fail(name, re);
            } catch (final RuntimeException re) {
                failed = true;
                logger.log(SEVERE, re, () -> "Error in step '" + name + "': " + re.getMessage());
                results.add(StepResult.failure(name, String.valueOf(re.getMessage())));
            }
        }

        private void fail(final String name, final ResourceException re) {
            failed = true;
            logger.severe(() -> "Error in step '" + name + "' (" + re.type() + "): " + re.getMessage());
            results.add(StepResult.failure(name, re.type() + ": " + re.getMessage()));
        }

        private Report skipRemaining(final List<String> steps) {
            steps.forEach(s -> results.add(StepResult.skipped(s, "no valid deployment target")));
            return report();
        }

        private Report report() {
            return new Report(options.namespace(), name, List.copyOf(results), before, after);
        }
    }
}
