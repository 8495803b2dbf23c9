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

import lombok.Getter;
import me.golemcore.linkbay.domain.model.ProviderErrorKind;

/**
 * Failure of a provider call after its retry policy has been applied.
 */
@Getter
public class ProviderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ProviderErrorKind kind;
    private final String providerName;

    public ProviderException(String message, ProviderErrorKind kind, String providerName, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.providerName = providerName;
    }

    /**
     * Creates the exception subtype matching the given kind.
     */
    public static ProviderException of(ProviderErrorKind kind, String providerName, String message,
            Throwable cause) {
        return switch (kind) {
        case RATE_LIMIT -> new ProviderRateLimitException(message, providerName, cause);
        case TIMEOUT -> new ProviderTimeoutException(message, providerName, cause);
        case CONNECTION -> new ProviderConnectionException(message, providerName, cause);
        default -> new ProviderException(message, kind, providerName, cause);
        };
    }
}
