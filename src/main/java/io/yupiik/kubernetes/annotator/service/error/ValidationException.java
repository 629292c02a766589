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

import java.util.List;

/**
 * The descriptor was rejected, either by the local checks (then {@link #errors()} lists each violation)
 * or by the API server (400/422).
 */
public class ValidationException extends ResourceException {
    private final List<String> errors;

    public ValidationException(final String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ValidationException(final List<String> errors) {
        super("Invalid deployment descriptor:\n" + String.join("\n", errors.stream().map(e -> "- " + e).toList()));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }

    @Override
    public String type() {
        return "validation";
    }
}
