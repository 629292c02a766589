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
package io.yupiik.kubernetes.annotator.commands;

import io.yupiik.fusion.framework.build.api.cli.Command;
import io.yupiik.fusion.framework.build.api.configuration.Property;
import io.yupiik.fusion.framework.build.api.configuration.RootConfiguration;
import io.yupiik.kubernetes.annotator.configuration.CliKubernetesConfiguration;
import io.yupiik.kubernetes.annotator.configuration.DeploymentConfiguration;
import io.yupiik.kubernetes.annotator.configuration.WaitConfiguration;
import io.yupiik.kubernetes.annotator.service.DeploymentFactory;
import io.yupiik.kubernetes.annotator.service.ResourceAnnotator;
import io.yupiik.kubernetes.annotator.service.annotation.Annotations;
import io.yupiik.kubernetes.annotator.service.step.ErrorPolicy;
import io.yupiik.kubernetes.annotator.service.step.ExistingPolicy;
import io.yupiik.kubernetes.annotator.table.ReportPrinter;

import java.util.List;

@Command(name = "create-and-annotate", description = "Creates a deployment, waits for it, then merges annotations into its metadata.")
public class CreateAndAnnotate implements Runnable {
    private final Configuration configuration;
    private final DeploymentFactory deploymentFactory;
    private final ResourceAnnotator resourceAnnotator;
    private final ReportPrinter reportPrinter;

    public CreateAndAnnotate(final Configuration configuration,
                             final DeploymentFactory deploymentFactory,
                             final ResourceAnnotator resourceAnnotator,
                             final ReportPrinter reportPrinter) {
        this.configuration = configuration;
        this.deploymentFactory = deploymentFactory;
        this.resourceAnnotator = resourceAnnotator;
        this.reportPrinter = reportPrinter;
    }

    @Override
    public void run() {
        final var annotations = Annotations.parse(configuration.annotations());
        try (final var k8s = configuration.k8s().client()) {
            final var report = resourceAnnotator.createAndAnnotate(
                    k8s,
                    new ResourceAnnotator.Options(
                            configuration.namespace(), configuration.k8s().timeout(), configuration.propagation(),
                            configuration.onError(), configuration.onExisting()),
                    () -> deploymentFactory.create(configuration.deployment()),
                    annotations);
            reportPrinter.printAndCheck(report, configuration.format(), System.out);
        }
    }

    @RootConfiguration("-")
    public record Configuration(
            @Property(documentation = "Namespace to create the deployment into.", defaultValue = "\"default\"") String namespace,
            @Property(documentation = "Annotations to merge into the deployment (`key=value`).", defaultValue = "java.util.List.of(\"deployment.kubernetes.io/str=nginx\", \"deployment.kubernetes.io/int=5\")") List<String> annotations,
            @Property(value = "on-error", documentation = "What to do with the next steps when one fails.", defaultValue = "io.yupiik.kubernetes.annotator.service.step.ErrorPolicy.CONTINUE") ErrorPolicy onError,
            @Property(value = "on-existing", documentation = "What to do when the deployment already exists: fail or reuse it.", defaultValue = "io.yupiik.kubernetes.annotator.service.step.ExistingPolicy.FAIL") ExistingPolicy onExisting,
            @Property(documentation = "Output format.", defaultValue = "io.yupiik.kubernetes.annotator.table.ReportPrinter.Format.TABLE") ReportPrinter.Format format,
            @Property(documentation = "Deployment to create.") DeploymentConfiguration deployment,
            @Property(documentation = "How to wait for changes to be visible.") WaitConfiguration propagation,
            @Property(documentation = "How to connect to Kubernetes cluster.", defaultValue = "new CliKubernetesConfiguration()") CliKubernetesConfiguration k8s) {
    }
}
