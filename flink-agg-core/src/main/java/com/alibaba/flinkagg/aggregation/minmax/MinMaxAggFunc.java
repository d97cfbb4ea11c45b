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

package com.alibaba.flinkagg.aggregation.minmax;

import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;

import com.alibaba.flinkagg.aggregation.AbstractAggFunc;
import com.alibaba.flinkagg.aggregation.AggFuncUtils;
import com.alibaba.flinkagg.aggregation.StateSerializationUtils;
import com.alibaba.flinkagg.aggregation.StateValueSerializer;

import javax.annotation.Nullable;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;

/** Aggregate function that get the min or max. Null values are ignored. */
public class MinMaxAggFunc extends AbstractAggFunc<MinMaxAggFunc> {

    public static final String MIN_NAME = "min";
    public static final String MAX_NAME = "max";

    private static final Comparator<Object> COMPARATOR = AggFuncUtils.valueComparator();

    private final boolean isMin;

    private DataType valueType;

    private StateValueSerializer valueSerializer;

    @Nullable private Object value;

    public MinMaxAggFunc(boolean isMin) {
        super(isMin ? MIN_NAME : MAX_NAME);
        this.isMin = isMin;
    }

    @Override
    public MinMaxAggFunc cloneEmpty() {
        return new MinMaxAggFunc(isMin);
    }

    @Override
    protected void doSetArguments(List<DataType> argumentTypes) {
        AggFuncUtils.checkArgumentCount(getName(), argumentTypes, 1, 1);
        final DataType type = argumentTypes.get(0);
        if (!AggFuncUtils.isComparable(type)) {
            throw AggFuncUtils.incompatibleArgument(getName(), type);
        }
        valueType = type;
        valueSerializer = StateSerializationUtils.getValueSerializer(type);
    }

    @Override
    protected DataType deriveReturnType() {
        return valueType.nullable();
    }

    @Override
    protected void addValues(Row row) {
        accept(row.getField(0));
    }

    @Override
    protected void mergeState(MinMaxAggFunc other) {
        accept(other.value);
    }

    private void accept(@Nullable Object candidate) {
        if (candidate == null) {
            return;
        }
        if (value == null) {
            value = candidate;
            return;
        }
        final int cmp = COMPARATOR.compare(candidate, value);
        if ((isMin && cmp < 0) || (!isMin && cmp > 0)) {
            value = candidate;
        }
    }

    @Override
    protected void writeState(DataOutputView out) throws IOException {
        StateSerializationUtils.writeNullable(valueSerializer, value, out);
    }

    @Override
    protected void readState(DataInputView in) throws IOException {
        value = StateSerializationUtils.readNullable(getName(), valueSerializer, in);
    }

    @Override
    protected Object computeResult() {
        return value;
    }
}
