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

import io.yupiik.fusion.testing.launcher.FusionCLITest;
import io.yupiik.fusion.testing.launcher.Stdout;
import io.yupiik.kubernetes.annotator.test.FakeCluster;
import io.yupiik.kubernetes.annotator.test.K8sMock;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnnotateTest {
    @K8sMock(existing = "default/deploy-nginx", existingAnnotations = {"team=platform", "deployment.kubernetes.io/int=1"})
    @FusionCLITest(args = "annotate")
    void mergeIntoExisting(final Stdout stdout, final FakeCluster cluster) {
        final var output = stdout.content();
        assertTrue(output.startsWith("Deployment 'default/deploy-nginx': success\n"), output);
        assertTrue(output.contains("| read-before    | success | {deployment.kubernetes.io/int=1, team=platform}"), output);
        assertTrue(output.contains(
                "| read-after     | success | {deployment.kubernetes.io/int=5, deployment.kubernetes.io/str=nginx, team=platform} |"), output);
        assertFalse(output.contains("| create "), output);

        assertEquals(
                Map.of("team", "platform", "deployment.kubernetes.io/int", "5", "deployment.kubernetes.io/str", "nginx"),
                cluster.get("default", "deploy-nginx").metadata().annotations());
        // unrelated fields untouched by the merge patch
        assertEquals(2, cluster.get("default", "deploy-nginx").spec().replicas());
        assertEquals(1, cluster.patches().size());
    }
}
