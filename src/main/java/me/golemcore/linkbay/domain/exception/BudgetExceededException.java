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

/**
 * A request was rejected by the cost controller before reaching any provider.
 */
@Getter
public class BudgetExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Limit {
        HOURLY_TOKENS, DAILY_TOKENS, HOURLY_COST
    }

    private final Limit limit;

    public BudgetExceededException(Limit limit, String message) {
        super(message);
        this.limit = limit;
    }
}
