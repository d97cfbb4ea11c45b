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

import org.apache.flink.configuration.Configuration;
import org.apache.flink.core.memory.DataInputDeserializer;
import org.apache.flink.core.memory.DataOutputSerializer;
import org.apache.flink.table.api.DataTypes;
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;

import com.alibaba.flinkagg.aggregation.count.CountAggFunc;
import com.alibaba.flinkagg.aggregation.quantile.QuantileAggFunc;
import com.alibaba.flinkagg.aggregation.sum.SumAggFunc;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.alibaba.flinkagg.aggregation.AggFuncTestUtils.addAll;
import static com.alibaba.flinkagg.aggregation.AggFuncTestUtils.assertErrorCode;
import static com.alibaba.flinkagg.aggregation.AggFuncTestUtils.configure;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Test for {@link GroupedAggFunc}. */
class GroupedAggFuncTest {

    private static final List<DataType> INT_ARGUMENT = Collections.singletonList(DataTypes.INT());

    @Test
    void testAggregatePerGroup() {
        final GroupedAggFunc grouped = newGroupedSum(new Configuration());
        assertThat(grouped.getName()).isEqualTo("sum");
        assertThat(grouped.getReturnType()).isEqualTo(DataTypes.BIGINT().notNull());
        assertThat(grouped.getNumGroups()).isEqualTo(0);

        grouped.add(0, Row.of(1));
        grouped.add(2, Row.of(10));
        grouped.add(0, Row.of(2));
        grouped.add(2, Row.of(20));

        assertThat(grouped.getNumGroups()).isEqualTo(3);
        assertThat(grouped.getResult(0)).isEqualTo(3L);
        assertThat(grouped.getResult(1)).isEqualTo(0L);
        assertThat(grouped.getResult(2)).isEqualTo(30L);
    }

    @Test
    void testGrowBeyondInitialCapacity() {
        final Configuration config = new Configuration();
        config.set(AggFuncOptions.INITIAL_CAPACITY, 1);
        final GroupedAggFunc grouped = newGroupedSum(config);

        for (int groupId = 0; groupId < 100; groupId++) {
            grouped.add(groupId, Row.of(groupId));
        }
        assertThat(grouped.getNumGroups()).isEqualTo(100);
        assertThat(grouped.getResult(99)).isEqualTo(99L);
    }

    @Test
    void testEnsureGroups() {
        final GroupedAggFunc grouped = newGroupedSum(new Configuration());
        grouped.ensureGroups(5);
        assertThat(grouped.getNumGroups()).isEqualTo(5);
        assertThat(grouped.getResult(4)).isEqualTo(0L);

        grouped.ensureGroups(2);
        assertThat(grouped.getNumGroups()).isEqualTo(5);
    }

    @Test
    void testMergePartial() {
        final GroupedAggFunc grouped = newGroupedSum(new Configuration());
        grouped.add(1, Row.of(5));

        final SumAggFunc partial = configure(new SumAggFunc(), DataTypes.INT());
        addAll(partial, 1, 2);
        grouped.merge(1, partial);
        grouped.merge(0, partial);

        assertThat(grouped.getResult(0)).isEqualTo(3L);
        assertThat(grouped.getResult(1)).isEqualTo(8L);
        assertThat(partial.getResult()).isEqualTo(3L);
    }

    @Test
    void testMergeAll() {
        final GroupedAggFunc grouped = newGroupedSum(new Configuration());
        grouped.add(0, Row.of(1));

        final GroupedAggFunc other = newGroupedSum(new Configuration());
        other.add(0, Row.of(2));
        other.add(3, Row.of(4));

        grouped.mergeAll(other);
        assertThat(grouped.getNumGroups()).isEqualTo(4);
        assertThat(grouped.getResult(0)).isEqualTo(3L);
        assertThat(grouped.getResult(2)).isEqualTo(0L);
        assertThat(grouped.getResult(3)).isEqualTo(4L);

        assertThatThrownBy(() -> grouped.mergeAll(grouped))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testMergeAllOfDifferentFunctions() {
        final GroupedAggFunc sum = newGroupedSum(new Configuration());
        final GroupedAggFunc count =
                new GroupedAggFunc(new CountAggFunc(), INT_ARGUMENT, null, new Configuration());
        count.add(0, Row.of(1));

        assertErrorCode(() -> sum.mergeAll(count), AggFuncErrorCode.TYPE_MISMATCH);
    }

    @Test
    void testFailedMergeAllLeavesGroupsUnchanged() {
        final GroupedAggFunc grouped = newGroupedSum(new Configuration());
        grouped.add(0, Row.of(5));

        final GroupedAggFunc other =
                new GroupedAggFunc(
                        new SumAggFunc(),
                        Collections.singletonList(DataTypes.BIGINT()),
                        null,
                        new Configuration());
        other.add(1, Row.of(1L));
        other.add(3, Row.of(3L));

        assertErrorCode(() -> grouped.mergeAll(other), AggFuncErrorCode.TYPE_MISMATCH);
        assertThat(grouped.getNumGroups()).isEqualTo(1);
        assertThat(grouped.getResult(0)).isEqualTo(5L);
    }

    @Test
    void testSerializeAndDeserializeMergeGroups() throws Exception {
        final GroupedAggFunc grouped = newGroupedSum(new Configuration());
        grouped.add(0, Row.of(7));

        final DataOutputSerializer out = new DataOutputSerializer(64);
        grouped.serialize(0, out);
        grouped.serialize(0, out);

        final GroupedAggFunc other = newGroupedSum(new Configuration());
        final DataInputDeserializer in = new DataInputDeserializer(out.getCopyOfBuffer());
        other.deserializeMerge(1, in);
        other.deserializeMerge(2, in);

        assertThat(other.getResult(0)).isEqualTo(0L);
        assertThat(other.getResult(1)).isEqualTo(7L);
        assertThat(other.getResult(2)).isEqualTo(7L);
    }

    @Test
    void testParametersArePassedToGroups() {
        final GroupedAggFunc grouped =
                new GroupedAggFunc(
                        new QuantileAggFunc(),
                        Collections.singletonList(DataTypes.DOUBLE()),
                        Row.of(1.0),
                        new Configuration());
        grouped.add(0, Row.of(3.0));
        grouped.add(0, Row.of(1.0));

        assertThat(grouped.getResult(0)).isEqualTo(3.0);
        assertThat(grouped.getReturnType()).isEqualTo(DataTypes.DOUBLE());
    }

    @Test
    void testTemplateIsUntouched() {
        final SumAggFunc template = new SumAggFunc();
        final GroupedAggFunc grouped =
                new GroupedAggFunc(template, INT_ARGUMENT, null, new Configuration());
        grouped.add(0, Row.of(1));

        // The template was never configured.
        template.setArguments(Collections.singletonList(DataTypes.BIGINT()));
        assertThat(template.getResult()).isEqualTo(0L);
    }

    @Test
    void testInvalidConfiguration() {
        assertErrorCode(
                () ->
                        new GroupedAggFunc(
                                new SumAggFunc(),
                                Collections.singletonList(DataTypes.STRING()),
                                null,
                                new Configuration()),
                AggFuncErrorCode.INCOMPATIBLE_ARGUMENTS);
        assertErrorCode(
                () ->
                        new GroupedAggFunc(
                                new SumAggFunc(), INT_ARGUMENT, Row.of(0.5), new Configuration()),
                AggFuncErrorCode.PARAMETERS_NOT_ALLOWED);

        final Configuration config = new Configuration();
        config.set(AggFuncOptions.INITIAL_CAPACITY, 0);
        assertThatThrownBy(() -> newGroupedSum(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(AggFuncOptions.INITIAL_CAPACITY.key());
    }

    @Test
    void testMaxGroups() {
        final Configuration config = new Configuration();
        config.set(AggFuncOptions.MAX_GROUPS, 2);
        final GroupedAggFunc grouped = newGroupedSum(config);

        grouped.add(1, Row.of(1));
        assertThatThrownBy(() -> grouped.add(2, Row.of(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> grouped.add(-1, Row.of(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> grouped.ensureGroups(3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(grouped.getNumGroups()).isEqualTo(2);
    }

    @Test
    void testReadUnknownGroup() {
        final GroupedAggFunc grouped = newGroupedSum(new Configuration());
        grouped.add(0, Row.of(1));

        assertThatThrownBy(() -> grouped.getResult(1))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> grouped.serialize(-1, new DataOutputSerializer(8)))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    private static GroupedAggFunc newGroupedSum(Configuration config) {
        return new GroupedAggFunc(new SumAggFunc(), INT_ARGUMENT, null, config);
    }
}
