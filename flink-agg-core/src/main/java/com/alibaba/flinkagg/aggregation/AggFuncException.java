/*
 * Copyright 2022 The Feathub Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.flinkagg.aggregation;

import static java.util.Objects.requireNonNull;

/** Exception thrown when an {@link AggFunc} is misconfigured or fed with unusable data. */
public class AggFuncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AggFuncErrorCode errorCode;

    public AggFuncException(AggFuncErrorCode errorCode, String message) {
        super(message);
        this.errorCode = requireNonNull(errorCode, "errorCode is null");
    }

    public AggFuncException(AggFuncErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = requireNonNull(errorCode, "errorCode is null");
    }

    public AggFuncErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isConfigurationError() {
        return errorCode.getKind() == AggFuncErrorCode.ErrorKind.CONFIGURATION;
    }

    @Override
    public String toString() {
        return String.format("%s[%s]: %s", getClass().getSimpleName(), errorCode, getMessage());
    }
}
