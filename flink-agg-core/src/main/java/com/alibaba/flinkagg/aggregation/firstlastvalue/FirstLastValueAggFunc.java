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

package com.alibaba.flinkagg.aggregation.firstlastvalue;

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
import java.util.List;

/**
 * Aggregate function that get the first or last non-null value.
 *
 * <p>The result depends on the order in which values are added and functions are merged: merging
 * {@code b} into {@code a} treats all values of {@code a} as earlier than those of {@code b}.
 */
public class FirstLastValueAggFunc extends AbstractAggFunc<FirstLastValueAggFunc> {

    public static final String FIRST_VALUE_NAME = "first_value";
    public static final String LAST_VALUE_NAME = "last_value";

    private final boolean isFirstValue;

    private DataType valueType;

    private StateValueSerializer valueSerializer;

    @Nullable private Object value;

    public FirstLastValueAggFunc(boolean isFirstValue) {
        super(isFirstValue ? FIRST_VALUE_NAME : LAST_VALUE_NAME);
        this.isFirstValue = isFirstValue;
    }

    @Override
    public FirstLastValueAggFunc cloneEmpty() {
        return new FirstLastValueAggFunc(isFirstValue);
    }

    @Override
    public boolean isOrderSensitive() {
        return true;
    }

    @Override
    protected void doSetArguments(List<DataType> argumentTypes) {
        AggFuncUtils.checkArgumentCount(getName(), argumentTypes, 1, 1);
        final DataType type = argumentTypes.get(0);
        if (!StateSerializationUtils.isSerializable(type)) {
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
    protected void mergeState(FirstLastValueAggFunc other) {
        accept(other.value);
    }

    private void accept(@Nullable Object candidate) {
        if (candidate == null) {
            return;
        }
        if (!isFirstValue || value == null) {
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
