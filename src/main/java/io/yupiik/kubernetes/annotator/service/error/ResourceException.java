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
package io.yupiik.kubernetes.annotator.service.error;

/**
 * Base of the failures raised while talking to the Kubernetes API about a deployment.
 */
public abstract class ResourceException extends IllegalStateException {
    protected ResourceException(final String message) {
        super(message);
    }

    protected ResourceException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * @return a short category name used in reports.
     */
    public abstract String type();
}
