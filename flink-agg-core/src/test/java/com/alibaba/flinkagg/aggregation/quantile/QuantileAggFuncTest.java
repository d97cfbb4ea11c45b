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

import org.apache.flink.table.api.DataTypes;
import org.apache.flink.types.Row;

import com.alibaba.flinkagg.aggregation.AggFuncErrorCode;
import org.junit.jupiter.api.Test;

import static com.alibaba.flinkagg.aggregation.AggFuncTestUtils.addAll;
import static com.alibaba.flinkagg.aggregation.AggFuncTestUtils.assertErrorCode;
import static com.alibaba.flinkagg.aggregation.AggFuncTestUtils.configure;
import static com.alibaba.flinkagg.aggregation.AggFuncTestUtils.deserializeMerge;
import static com.alibaba.flinkagg.aggregation.AggFuncTestUtils.serialize;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link QuantileAggFunc}. */
class QuantileAggFuncTest {
    @Test
    void testDefaultLevelIsMedian() {
        final QuantileAggFunc func = configure(new QuantileAggFunc(), DataTypes.INT());
        assertThat(func.getResult()).isNull();
        addAll(func, 5, 1, null, 4, 2, 3);
        assertThat(func.getResult()).isEqualTo(3.0);
        assertThat(func.getTypeID()).isEqualTo("quantile_INTEGER");
    }

    @Test
    void testLevels() {
        innerTest(0.0, 1.0);
        innerTest(0.25, 3.0);
        innerTest(0.9, 10.0);
        innerTest(1, 10.0);
    }

    private void innerTest(Object level, Double expectedResult) {
        final QuantileAggFunc func = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        func.setParameters(Row.of(level));
        addAll(func, 10.0, 9.0, 8.0, 7.0, 6.0, 5.0, 4.0, 3.0, 2.0, 1.0);
        assertThat(func.getResult()).isEqualTo(expectedResult);
    }

    @Test
    void testTypeIdContainsLevel() {
        final QuantileAggFunc func = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        func.setParameters(Row.of(0.9));
        assertThat(func.getTypeID()).isEqualTo("quantile_0.9_DOUBLE");
    }

    @Test
    void testInvalidParameters() {
        final QuantileAggFunc func = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        assertErrorCode(
                () -> func.setParameters(Row.of(0.1, 0.2)), AggFuncErrorCode.INVALID_PARAMETERS);
        assertErrorCode(() -> func.setParameters(Row.of()), AggFuncErrorCode.INVALID_PARAMETERS);
        assertErrorCode(
                () -> func.setParameters(Row.of("0.5")), AggFuncErrorCode.INVALID_PARAMETERS);
        assertErrorCode(
                () -> func.setParameters(Row.of(1.5)), AggFuncErrorCode.INVALID_PARAMETERS);
        assertErrorCode(
                () -> func.setParameters(Row.of(-0.1)), AggFuncErrorCode.INVALID_PARAMETERS);
        assertErrorCode(
                () -> func.setParameters(Row.of(Double.NaN)),
                AggFuncErrorCode.INVALID_PARAMETERS);

        // Rejected parameters leave the function usable.
        func.setParameters(Row.of(0.0));
        addAll(func, 2.0, 1.0);
        assertThat(func.getResult()).isEqualTo(1.0);
    }

    @Test
    void testSetParametersOutOfOrder() {
        assertErrorCode(
                () -> new QuantileAggFunc().setParameters(Row.of(0.5)),
                AggFuncErrorCode.ARGUMENTS_NOT_SET);

        final QuantileAggFunc func = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        addAll(func, 1.0);
        assertThatThrownBy(() -> func.setParameters(Row.of(0.5)))
                .isInstanceOf(IllegalStateException.class);

        final QuantileAggFunc configured = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        configured.setParameters(Row.of(0.5));
        assertThatThrownBy(() -> configured.setParameters(Row.of(0.5)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testMergeRequiresSameLevel() {
        final QuantileAggFunc median = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        median.setParameters(Row.of(0.5));
        final QuantileAggFunc p90 = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        p90.setParameters(Row.of(0.9));
        assertErrorCode(() -> median.merge(p90), AggFuncErrorCode.TYPE_MISMATCH);
    }

    @Test
    void testSerializationKeepsLevel() throws Exception {
        final QuantileAggFunc func = configure(new QuantileAggFunc(), DataTypes.BIGINT());
        func.setParameters(Row.of(0.75));
        addAll(func, 4L, 3L, 2L, 1L);

        final QuantileAggFunc other = configure(func.cloneEmpty(), DataTypes.BIGINT());
        other.setParameters(Row.of(0.75));
        addAll(other, 8L, 7L, 6L, 5L);

        deserializeMerge(other, serialize(func));
        assertThat(other.getResult()).isEqualTo(7.0);
    }

    @Test
    void testSerializationIsIndependentOfInsertionOrder() throws Exception {
        final QuantileAggFunc func = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        addAll(func, 3.0, 1.0, 2.0);
        final QuantileAggFunc other = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        addAll(other, 2.0, 3.0, 1.0);

        assertThat(serialize(func)).isEqualTo(serialize(other));
    }

    @Test
    void testNegativeSizeIsCorrupt() {
        final QuantileAggFunc func = configure(new QuantileAggFunc(), DataTypes.DOUBLE());
        assertErrorCode(
                () -> deserializeMerge(func, new byte[] {-128, 0, 0, 0}),
                AggFuncErrorCode.CORRUPT_STATE);
    }
}
