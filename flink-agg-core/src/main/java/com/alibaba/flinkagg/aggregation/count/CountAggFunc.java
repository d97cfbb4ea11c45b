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

package com.alibaba.flinkagg.aggregation.count;

import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;
import org.apache.flink.table.api.DataTypes;
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;
import org.apache.flink.util.Preconditions;

import com.alibaba.flinkagg.aggregation.AbstractAggFunc;
import com.alibaba.flinkagg.aggregation.AggFuncUtils;
import com.alibaba.flinkagg.aggregation.StateSerializationUtils;

import java.io.IOException;
import java.util.List;

/**
 * Aggregation function that counts the number of rows. With one argument only rows whose argument
 * is not null are counted.
 */
public class CountAggFunc extends AbstractAggFunc<CountAggFunc> {

    public static final String NAME = "count";

    private boolean countRows;

    private long cnt;

    public CountAggFunc() {
        super(NAME);
    }

    @Override
    public CountAggFunc cloneEmpty() {
        return new CountAggFunc();
    }

    @Override
    protected void doSetArguments(List<DataType> argumentTypes) {
        AggFuncUtils.checkArgumentCount(NAME, argumentTypes, 0, 1);
        countRows = argumentTypes.isEmpty();
    }

    @Override
    protected void validateRow(Row row) {
        if (countRows) {
            Preconditions.checkNotNull(row);
            return;
        }
        super.validateRow(row);
    }

    @Override
    protected DataType deriveReturnType() {
        return DataTypes.BIGINT().notNull();
    }

    @Override
    protected void addValues(Row row) {
        if (countRows || row.getField(0) != null) {
            cnt += 1;
        }
    }

    @Override
    protected void mergeState(CountAggFunc other) {
        cnt += other.cnt;
    }

    @Override
    protected void writeState(DataOutputView out) throws IOException {
        out.writeLong(cnt);
    }

    @Override
    protected void readState(DataInputView in) throws IOException {
        cnt = StateSerializationUtils.readCount(NAME, in);
    }

    @Override
    protected Long computeResult() {
        return cnt;
    }
}
