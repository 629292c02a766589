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
import io.yupiik.fusion.kubernetes.client.KubernetesClient;
import io.yupiik.fusion.kubernetes.client.KubernetesClientConfiguration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static java.util.Optional.ofNullable;

public record CliKubernetesConfiguration(
        @Property(documentation = "Kubernetes API base.") String api,
        @Property(documentation = "If authenticated by token and not using a `kubeconfig`, the token to use.") String token,
        @Property(documentation = "SSL certificates for communication (not authentication).") String certificates,
        @Property(documentation = "If authenticated by a X509 client certificate, the private key.") String privateKey,
        @Property(documentation = "If authenticated by a X509 client certificate, the certificate.") String privateKeyCertificate,
        @Property(documentation = "A `kubeconfig` path.") String kubeconfig,
        @Property(value = "request-timeout", documentation = "Timeout (in milliseconds) applied to each Kubernetes API call.", defaultValue = "60_000L") long requestTimeout) {
    public Path kubeconfigPath() {
        if ((token != null && !token.isBlank()) || (privateKey != null && !privateKey.isBlank())) {
            return null;
        }

        if (kubeconfig != null && !kubeconfig.isBlank()) {
            return Path.of(kubeconfig);
        }

        final var home = Path.of(System.getProperty("annotator.home", System.getProperty("user.home", ".")));
        final var defaultValue = home.resolve(".kube/config");
        return Files.exists(defaultValue) ? defaultValue : null;
    }

    public Duration timeout() {
        return requestTimeout > 0 ? Duration.ofMillis(requestTimeout) : Duration.ofMinutes(1);
    }

    public KubernetesClient client() {
        return new KubernetesClient(new KubernetesClientConfiguration()
                .setKubeconfig(kubeconfigPath())
                // the client reads the token from a file, avoid to pick the in-cluster one when not running in a pod
                .setToken(ofNullable(token()).orElse("ignore_token_file_if_missing_" + Instant.now().toEpochMilli()))
                .setPrivateKey(privateKey())
                .setPrivateKeyCertificate(privateKeyCertificate())
                .setCertificates(certificates())
                .setMaster(api()));
    }
}
