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

package com.alibaba.flinkagg.aggregation.uniq;

import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;
import org.apache.flink.table.api.DataTypes;
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;

import com.alibaba.flinkagg.aggregation.AbstractAggFunc;
import com.alibaba.flinkagg.aggregation.AggFuncUtils;
import com.alibaba.flinkagg.aggregation.StateSerializationUtils;
import com.alibaba.flinkagg.aggregation.StateValueSerializer;

import java.io.IOException;
import java.util.List;
import java.util.TreeSet;

/** Aggregate function that counts the number of distinct non-null values exactly. */
public class UniqAggFunc extends AbstractAggFunc<UniqAggFunc> {

    public static final String NAME = "uniq";

    private final TreeSet<Object> values = new TreeSet<>(AggFuncUtils.valueComparator());

    private StateValueSerializer valueSerializer;

    public UniqAggFunc() {
        super(NAME);
    }

    @Override
    public UniqAggFunc cloneEmpty() {
        return new UniqAggFunc();
    }

    @Override
    protected void doSetArguments(List<DataType> argumentTypes) {
        AggFuncUtils.checkArgumentCount(NAME, argumentTypes, 1, 1);
        final DataType valueType = argumentTypes.get(0);
        if (!AggFuncUtils.isComparable(valueType)) {
            throw AggFuncUtils.incompatibleArgument(NAME, valueType);
        }
        valueSerializer = StateSerializationUtils.getValueSerializer(valueType);
    }

    @Override
    protected DataType deriveReturnType() {
        return DataTypes.BIGINT().notNull();
    }

    @Override
    protected void addValues(Row row) {
        final Object value = row.getField(0);
        if (value != null) {
            values.add(value);
        }
    }

    @Override
    protected void mergeState(UniqAggFunc other) {
        values.addAll(other.values);
    }

    @Override
    protected void writeState(DataOutputView out) throws IOException {
        StateSerializationUtils.writeSize(values.size(), out);
        for (Object value : values) {
            valueSerializer.serialize(value, out);
        }
    }

    @Override
    protected void readState(DataInputView in) throws IOException {
        final int n = StateSerializationUtils.readSize(NAME, in);
        for (int i = 0; i < n; i++) {
            final Object value = valueSerializer.deserialize(in);
            if (value == null || !values.add(value)) {
                throw StateSerializationUtils.corruptState(
                        NAME, String.format("unexpected value %s at position %s", value, i));
            }
        }
    }

    @Override
    protected Long computeResult() {
        return (long) values.size();
    }
}
