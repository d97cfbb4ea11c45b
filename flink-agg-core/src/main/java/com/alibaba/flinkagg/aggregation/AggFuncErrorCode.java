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

/** Error codes reported by {@link AggFuncException}. */
public enum AggFuncErrorCode {
    INCOMPATIBLE_ARGUMENTS(1, ErrorKind.CONFIGURATION),
    PARAMETERS_NOT_ALLOWED(2, ErrorKind.CONFIGURATION),
    INVALID_PARAMETERS(3, ErrorKind.CONFIGURATION),
    ARGUMENTS_NOT_SET(4, ErrorKind.CONFIGURATION),
    TYPE_MISMATCH(17, ErrorKind.OPERATIONAL),
    CORRUPT_STATE(18, ErrorKind.OPERATIONAL);

    private static final int ERROR_CODE_MASK = 0x0AF0_0000;

    private final int code;
    private final ErrorKind kind;

    AggFuncErrorCode(int code, ErrorKind kind) {
        this.code = code + ERROR_CODE_MASK;
        this.kind = kind;
    }

    public int getCode() {
        return code;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Whether the error is raised while an aggregate function is set up, or while it processes
     * data. Neither kind is recoverable for the function instance that raised it.
     */
    public enum ErrorKind {
        CONFIGURATION,
        OPERATIONAL
    }
}
