package me.golemcore.linkbay.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Every registered provider failed for one request. Keeps the last failure of
 * each provider in the order they were tried.
 */
public class AllProvidersFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Map<String, ProviderException> failures;

    public AllProvidersFailedException(Map<String, ProviderException> failures) {
        super(buildMessage(failures));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        failures.values().forEach(this::addSuppressed);
    }

    public Map<String, ProviderException> getFailures() {
        return failures;
    }

    private static String buildMessage(Map<String, ProviderException> failures) {
        if (failures.isEmpty()) {
            return "All providers failed";
        }
        return failures.entrySet().stream()
                .map(entry -> entry.getKey() + " (" + entry.getValue().getKind() + "): "
                        + entry.getValue().getMessage())
                .collect(Collectors.joining("; ", "All providers failed: ", ""));
    }
}
