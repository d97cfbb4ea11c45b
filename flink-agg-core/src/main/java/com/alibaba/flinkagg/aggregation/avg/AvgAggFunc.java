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

package com.alibaba.flinkagg.aggregation.avg;

import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;
import org.apache.flink.table.api.DataTypes;
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;

import com.alibaba.flinkagg.aggregation.AbstractAggFunc;
import com.alibaba.flinkagg.aggregation.AggFuncUtils;
import com.alibaba.flinkagg.aggregation.StateSerializationUtils;

import java.io.IOException;
import java.util.List;

/**
 * Aggregation function that calculates the average of numeric values with sum and count. Null
 * values are ignored and the average of no value is null.
 */
public class AvgAggFunc extends AbstractAggFunc<AvgAggFunc> {

    public static final String NAME = "avg";

    private boolean isIntegral;

    private long cnt;

    private long longSum;

    private double doubleSum;

    public AvgAggFunc() {
        super(NAME);
    }

    @Override
    public AvgAggFunc cloneEmpty() {
        return new AvgAggFunc();
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
        return DataTypes.DOUBLE();
    }

    @Override
    protected void addValues(Row row) {
        final Number value = (Number) row.getField(0);
        if (value == null) {
            return;
        }
        cnt += 1;
        if (isIntegral) {
            longSum += value.longValue();
        } else {
            doubleSum += value.doubleValue();
        }
    }

    @Override
    protected void mergeState(AvgAggFunc other) {
        cnt += other.cnt;
        longSum += other.longSum;
        doubleSum += other.doubleSum;
    }

    @Override
    protected void writeState(DataOutputView out) throws IOException {
        out.writeLong(cnt);
        if (isIntegral) {
            out.writeLong(longSum);
        } else {
            out.writeDouble(doubleSum);
        }
    }

    @Override
    protected void readState(DataInputView in) throws IOException {
        cnt = StateSerializationUtils.readCount(NAME, in);
        if (isIntegral) {
            longSum = in.readLong();
        } else {
            doubleSum = in.readDouble();
        }
        if (cnt == 0 && (longSum != 0 || doubleSum != 0.0)) {
            throw StateSerializationUtils.corruptState(NAME, "non-zero sum of zero values");
        }
    }

    @Override
    protected Double computeResult() {
        if (cnt == 0) {
            return null;
        }
        if (isIntegral) {
            return ((double) longSum) / cnt;
        }
        return doubleSum / cnt;
    }
}
