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
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;

import java.io.IOException;
import java.util.List;

/**
 * Interface of aggregation function. An aggregation function instance holds the accumulator state
 * of exactly one group. It consumes any number of rows, merges with partial states computed
 * elsewhere and finally produces one result.
 *
 * <p>The lifecycle of an instance is: {@link #cloneEmpty()}, then {@link #setArguments(List)}
 * exactly once, optionally followed by {@link #setParameters(Row)}, then any number of {@link
 * #add(Row)}, {@link #merge(AggFunc)} and {@link #deserializeMerge(DataInputView)} calls, and
 * {@link #getResult()} at the end.
 *
 * <p>Instances are not thread-safe. Each instance must be driven by a single thread at a time;
 * parallel aggregation uses one instance per partition and merges them afterwards.
 */
public interface AggFunc {

    /** @return The name of the function, available before the function is configured. */
    String getName();

    /**
     * @return A key from which a registry can construct an equivalent empty function, e.g. {@code
     *     sum_BIGINT}.
     */
    String getTypeID();

    /**
     * Creates a new function of the same kind with empty state. Argument types and parameters
     * are not copied, the caller must configure the clone again.
     */
    AggFunc cloneEmpty();

    /**
     * Sets the argument types. Must be called exactly once, before any other call that touches
     * the accumulator state.
     *
     * @throws AggFuncException with {@link AggFuncErrorCode#INCOMPATIBLE_ARGUMENTS} if the
     *     function cannot be applied to the given types.
     */
    void setArguments(List<DataType> argumentTypes);

    /**
     * Sets the parameters of a parametric function. Must be called after {@link
     * #setArguments(List)} and before any data is aggregated, or not at all.
     *
     * @throws AggFuncException with {@link AggFuncErrorCode#PARAMETERS_NOT_ALLOWED} if the
     *     function takes no parameters, or {@link AggFuncErrorCode#INVALID_PARAMETERS} if the
     *     parameters are not acceptable.
     */
    default void setParameters(Row parameters) {
        throw new AggFuncException(
                AggFuncErrorCode.PARAMETERS_NOT_ALLOWED,
                String.format("Aggregate function %s doesn't allow parameters.", getName()));
    }

    /** @return The DataType of the aggregation result. */
    DataType getReturnType();

    /** Adds the argument values of one input row to the accumulator state. */
    void add(Row row);

    /**
     * Merges the state of the given function into this function. The other function must be of
     * the same kind and configured with the same arguments and parameters.
     *
     * @throws AggFuncException with {@link AggFuncErrorCode#TYPE_MISMATCH} otherwise.
     */
    void merge(AggFunc other);

    /** Writes the accumulator state, e.g. to send it over network. */
    void serialize(DataOutputView out) throws IOException;

    /**
     * Reads an accumulator state written by {@link #serialize(DataOutputView)} of an equally
     * configured function and merges it into this function.
     *
     * @throws AggFuncException with {@link AggFuncErrorCode#CORRUPT_STATE} if the input is
     *     malformed or truncated. The state of this function is left unchanged in that case.
     */
    void deserializeMerge(DataInputView in) throws IOException;

    /** @return The aggregation result. Calling this method does not change the state. */
    Object getResult();

    /**
     * @return Whether the result depends on the order in which values are added and states are
     *     merged.
     */
    default boolean isOrderSensitive() {
        return false;
    }
}
