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

import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;

/** Configurations used by {@link GroupedAggFunc}. */
public class AggFuncOptions {

    public static final ConfigOption<Integer> INITIAL_CAPACITY =
            ConfigOptions.key("aggregation.grouped.initial-capacity")
                    .intType()
                    .defaultValue(16)
                    .withDescription(
                            "The number of groups for which slots are allocated up front.");

    public static final ConfigOption<Integer> MAX_GROUPS =
            ConfigOptions.key("aggregation.grouped.max-groups")
                    .intType()
                    .defaultValue(Integer.MAX_VALUE)
                    .withDescription(
                            "The maximum number of groups. Accessing a group id beyond this "
                                    + "limit fails, which bounds the memory used by one "
                                    + "aggregation.");
}
