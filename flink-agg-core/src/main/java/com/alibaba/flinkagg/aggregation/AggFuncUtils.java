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

import org.apache.flink.table.types.DataType;
import org.apache.flink.table.types.logical.LogicalType;
import org.apache.flink.table.types.logical.LogicalTypeFamily;
import org.apache.flink.table.types.logical.LogicalTypeRoot;
import org.apache.flink.types.Row;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/** Utility of aggregation functions. */
public class AggFuncUtils {

    private static final Set<LogicalTypeRoot> COMPARABLE_TYPE_ROOTS =
            EnumSet.of(
                    LogicalTypeRoot.BOOLEAN,
                    LogicalTypeRoot.TINYINT,
                    LogicalTypeRoot.SMALLINT,
                    LogicalTypeRoot.INTEGER,
                    LogicalTypeRoot.BIGINT,
                    LogicalTypeRoot.FLOAT,
                    LogicalTypeRoot.DOUBLE,
                    LogicalTypeRoot.CHAR,
                    LogicalTypeRoot.VARCHAR,
                    LogicalTypeRoot.DATE,
                    LogicalTypeRoot.TIMESTAMP_WITHOUT_TIME_ZONE);

    private AggFuncUtils() {}

    /** @return Whether values of the type can be summed by the aggregation functions. */
    public static boolean isNumeric(DataType dataType) {
        final LogicalType logicalType = dataType.getLogicalType();
        return isIntegral(dataType)
                || logicalType.getTypeRoot().getFamilies()
                        .contains(LogicalTypeFamily.APPROXIMATE_NUMERIC);
    }

    /** @return Whether the type is one of TINYINT, SMALLINT, INTEGER and BIGINT. */
    public static boolean isIntegral(DataType dataType) {
        return dataType.getLogicalType()
                .getTypeRoot()
                .getFamilies()
                .contains(LogicalTypeFamily.INTEGER_NUMERIC);
    }

    /**
     * @return Whether values of the type have a total order consistent with equals, so that the
     *     aggregation result does not depend on which of two equal values is kept.
     */
    public static boolean isComparable(DataType dataType) {
        return COMPARABLE_TYPE_ROOTS.contains(dataType.getLogicalType().getTypeRoot());
    }

    /**
     * @return The natural order of values of a type for which {@link #isComparable(DataType)}
     *     holds.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Comparator<Object> valueComparator() {
        return (Comparator) Comparator.naturalOrder();
    }

    /**
     * Checks the number of argument types given to a function.
     *
     * @throws AggFuncException with {@link AggFuncErrorCode#INCOMPATIBLE_ARGUMENTS} on mismatch.
     */
    public static void checkArgumentCount(
            String funcName, List<DataType> argumentTypes, int minCount, int maxCount) {
        final int count = argumentTypes.size();
        if (count < minCount || count > maxCount) {
            final String expected =
                    minCount == maxCount
                            ? String.valueOf(minCount)
                            : String.format("%s to %s", minCount, maxCount);
            throw new AggFuncException(
                    AggFuncErrorCode.INCOMPATIBLE_ARGUMENTS,
                    String.format(
                            "Aggregate function %s requires %s arguments, but %s were given.",
                            funcName, expected, count));
        }
    }

    public static AggFuncException incompatibleArgument(String funcName, DataType argumentType) {
        return new AggFuncException(
                AggFuncErrorCode.INCOMPATIBLE_ARGUMENTS,
                String.format(
                        "Unsupported argument type %s for aggregate function %s.",
                        argumentType, funcName));
    }

    /**
     * Checks that the row has one field per argument and that every field is either null, for
     * nullable arguments, or an instance of the conversion class of its argument type.
     */
    public static void checkRow(String funcName, List<DataType> argumentTypes, Row row) {
        if (row == null || row.getArity() != argumentTypes.size()) {
            throw new AggFuncException(
                    AggFuncErrorCode.INCOMPATIBLE_ARGUMENTS,
                    String.format(
                            "Aggregate function %s expects rows with %s fields, but got %s.",
                            funcName, argumentTypes.size(), row));
        }
        for (int i = 0; i < argumentTypes.size(); i++) {
            final DataType argumentType = argumentTypes.get(i);
            final Object value = row.getField(i);
            if (value == null) {
                if (!argumentType.getLogicalType().isNullable()) {
                    throw new AggFuncException(
                            AggFuncErrorCode.INCOMPATIBLE_ARGUMENTS,
                            String.format(
                                    "Argument %s of aggregate function %s is %s but got null.",
                                    i, funcName, argumentType));
                }
            } else if (!argumentType.getConversionClass().isInstance(value)) {
                throw new AggFuncException(
                        AggFuncErrorCode.INCOMPATIBLE_ARGUMENTS,
                        String.format(
                                "Argument %s of aggregate function %s is %s but got %s of class %s.",
                                i, funcName, argumentType, value, value.getClass().getName()));
            }
        }
    }
}
