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

package com.alibaba.flinkagg.aggregation.sum;

import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;
import org.apache.flink.table.api.DataTypes;
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;

import com.alibaba.flinkagg.aggregation.AbstractAggFunc;
import com.alibaba.flinkagg.aggregation.AggFuncUtils;

import java.io.IOException;
import java.util.List;

/**
 * Aggregation function that calculates the sum of numeric values. Integral values are summed as
 * BIGINT, wrapping around on overflow, and floating point values as DOUBLE. Null values are
 * ignored and the sum of no value is 0.
 */
public class SumAggFunc extends AbstractAggFunc<SumAggFunc> {

    public static final String NAME = "sum";

    private boolean isIntegral;

    private long longSum;

    private double doubleSum;

    public SumAggFunc() {
        super(NAME);
    }

    @Override
    public SumAggFunc cloneEmpty() {
        return new SumAggFunc();
    }

    @Override
    protected void doSetArguments(List<DataType> argumentTypes) {
        AggFuncUtils.checkArgumentCount(NAME, argumentTypes, 1, 1);
        final DataType valueType = argumentTypes.get(0);
        if (!AggFuncUtils.isNumeric(valueType)) {
            throw AggFuncUtils.incompatibleArgument(NAME, valueType);
        }
        isIntegral = AggFuncUtils.isIntegral(valueType);
    }

    @Override
    protected DataType deriveReturnType() {
        return isIntegral ? DataTypes.BIGINT().notNull() : DataTypes.DOUBLE().notNull();
    }

    @Override
    protected void addValues(Row row) {
        final Number value = (Number) row.getField(0);
        if (value == null) {
            return;
        }
        if (isIntegral) {
            longSum += value.longValue();
        } else {
            doubleSum += value.doubleValue();
        }
    }

    @Override
    protected void mergeState(SumAggFunc other) {
        longSum += other.longSum;
        doubleSum += other.doubleSum;
    }

    @Override
    protected void writeState(DataOutputView out) throws IOException {
        if (isIntegral) {
            out.writeLong(longSum);
        } else {
            out.writeDouble(doubleSum);
        }
    }

    @Override
    protected void readState(DataInputView in) throws IOException {
        if (isIntegral) {
            longSum = in.readLong();
        } else {
            doubleSum = in.readDouble();
        }
    }

    @Override
    protected Object computeResult() {
        if (isIntegral) {
            return longSum;
        }
        return doubleSum;
    }
}
