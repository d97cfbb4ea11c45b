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

import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;

import java.io.IOException;

/**
 * Writes and reads the non-null values held by accumulator states. Implementations never allocate
 * more memory than the bytes they have actually read justify, so that a forged length ends in an
 * {@link java.io.EOFException} instead of an allocation failure.
 */
public interface StateValueSerializer {

    void serialize(Object value, DataOutputView out) throws IOException;

    /**
     * @throws AggFuncException with {@link AggFuncErrorCode#CORRUPT_STATE} if the encoded value is
     *     malformed.
     */
    Object deserialize(DataInputView in) throws IOException;
}
