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

package com.alibaba.flinkagg.aggregation.quantile;

import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;
import org.apache.flink.table.api.DataTypes;
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;

import com.alibaba.flinkagg.aggregation.AbstractAggFunc;
import com.alibaba.flinkagg.aggregation.AggFuncErrorCode;
import com.alibaba.flinkagg.aggregation.AggFuncException;
import com.alibaba.flinkagg.aggregation.AggFuncUtils;
import com.alibaba.flinkagg.aggregation.StateSerializationUtils;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Aggregate function that calculates the exact quantile of numeric values. It takes the level of
 * the quantile as its only parameter, which defaults to 0.5 (the median).
 *
 * <p>The result is the element at index {@code floor(level * n)} of the n sorted non-null values,
 * or the largest value if the level is 1. The quantile of no value is null.
 */
public class QuantileAggFunc extends AbstractAggFunc<QuantileAggFunc> {

    public static final String NAME = "quantile";

    public static final double DEFAULT_LEVEL = 0.5;

    private static final int INITIAL_CAPACITY = 16;

    private double level = DEFAULT_LEVEL;

    private double[] samples = new double[0];

    private int size;

    public QuantileAggFunc() {
        super(NAME);
    }

    @Override
    public QuantileAggFunc cloneEmpty() {
        return new QuantileAggFunc();
    }

    @Override
    protected void doSetArguments(List<DataType> argumentTypes) {
        AggFuncUtils.checkArgumentCount(NAME, argumentTypes, 1, 1);
        final DataType valueType = argumentTypes.get(0);
        if (!AggFuncUtils.isNumeric(valueType)) {
            throw AggFuncUtils.incompatibleArgument(NAME, valueType);
        }
    }

    @Override
    protected boolean acceptsParameters() {
        return true;
    }

    @Override
    protected void doSetParameters(Row parameters) {
        if (parameters.getArity() != 1) {
            throw new AggFuncException(
                    AggFuncErrorCode.INVALID_PARAMETERS,
                    String.format(
                            "Aggregate function %s requires exactly one parameter, but got %s.",
                            NAME, parameters));
        }
        final Object parameter = parameters.getField(0);
        if (!(parameter instanceof Number)) {
            throw new AggFuncException(
                    AggFuncErrorCode.INVALID_PARAMETERS,
                    String.format(
                            "The level of aggregate function %s must be a number, but got %s.",
                            NAME, parameter));
        }
        final double newLevel = ((Number) parameter).doubleValue();
        if (!(newLevel >= 0.0 && newLevel <= 1.0)) {
            throw new AggFuncException(
                    AggFuncErrorCode.INVALID_PARAMETERS,
                    String.format(
                            "The level of aggregate function %s must be in [0, 1], but got %s.",
                            NAME, parameter));
        }
        level = newLevel;
    }

    @Override
    protected DataType deriveReturnType() {
        return DataTypes.DOUBLE();
    }

    @Override
    protected void addValues(Row row) {
        final Number value = (Number) row.getField(0);
        if (value != null) {
            append(value.doubleValue());
        }
    }

    @Override
    protected void mergeState(QuantileAggFunc other) {
        ensureCapacity(size + other.size);
        System.arraycopy(other.samples, 0, samples, size, other.size);
        size += other.size;
    }

    @Override
    protected void writeState(DataOutputView out) throws IOException {
        final double[] sorted = sortedSamples();
        StateSerializationUtils.writeSize(sorted.length, out);
        for (double sample : sorted) {
            out.writeDouble(sample);
        }
    }

    @Override
    protected void readState(DataInputView in) throws IOException {
        final int n = StateSerializationUtils.readSize(NAME, in);
        for (int i = 0; i < n; i++) {
            append(in.readDouble());
        }
    }

    @Override
    protected Double computeResult() {
        if (size == 0) {
            return null;
        }
        final double[] sorted = sortedSamples();
        final int index = level < 1.0 ? (int) (level * size) : size - 1;
        return sorted[index];
    }

    private double[] sortedSamples() {
        final double[] sorted = Arrays.copyOf(samples, size);
        Arrays.sort(sorted);
        return sorted;
    }

    private void append(double sample) {
        ensureCapacity(size + 1);
        samples[size++] = sample;
    }

    private void ensureCapacity(int capacity) {
        if (capacity > samples.length) {
            final int newCapacity =
                    Math.max(capacity, Math.max(INITIAL_CAPACITY, samples.length * 2));
            samples = Arrays.copyOf(samples, newCapacity);
        }
    }
}
