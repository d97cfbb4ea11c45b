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

import org.apache.flink.configuration.ReadableConfig;
import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;
import org.apache.flink.util.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Holds one {@link AggFunc} per group, addressed by a dense group id. The function of a group is
 * cloned from a template and configured the first time the group is accessed.
 *
 * <p>Like the functions it holds, this class is not thread-safe.
 */
public class GroupedAggFunc {

    private static final Logger LOG = LoggerFactory.getLogger(GroupedAggFunc.class);

    private final AggFunc template;

    private final List<DataType> argumentTypes;

    @Nullable private final Row parameters;

    private final int maxGroups;

    private final ArrayList<AggFunc> groups;

    private final AggFunc emptyFunc;

    /**
     * @param template The function from which the functions of the groups are cloned. Its state
     *     is never touched.
     * @param argumentTypes The argument types passed to every function.
     * @param parameters The parameters passed to every function, or null for none.
     * @param config The configuration, see {@link AggFuncOptions}.
     */
    public GroupedAggFunc(
            AggFunc template,
            List<DataType> argumentTypes,
            @Nullable Row parameters,
            ReadableConfig config) {
        this.template = Preconditions.checkNotNull(template);
        this.argumentTypes = Collections.unmodifiableList(new ArrayList<>(argumentTypes));
        this.parameters = parameters == null ? null : Row.copy(parameters);

        final int initialCapacity = config.get(AggFuncOptions.INITIAL_CAPACITY);
        Preconditions.checkArgument(
                initialCapacity > 0,
                "%s must be positive, but is %s.",
                AggFuncOptions.INITIAL_CAPACITY.key(),
                initialCapacity);
        this.maxGroups = config.get(AggFuncOptions.MAX_GROUPS);
        Preconditions.checkArgument(
                maxGroups > 0,
                "%s must be positive, but is %s.",
                AggFuncOptions.MAX_GROUPS.key(),
                maxGroups);
        this.groups = new ArrayList<>(Math.min(initialCapacity, maxGroups));

        // Validates the configuration eagerly and serves the results of untouched groups.
        this.emptyFunc = newFunc();
    }

    public String getName() {
        return template.getName();
    }

    public DataType getReturnType() {
        return emptyFunc.getReturnType();
    }

    /** @return The number of groups, i.e. one more than the largest group id accessed so far. */
    public int getNumGroups() {
        return groups.size();
    }

    /** Makes sure the groups with ids in {@code [0, numGroups)} exist. */
    public void ensureGroups(int numGroups) {
        Preconditions.checkArgument(
                numGroups <= maxGroups,
                "Cannot hold %s groups, the limit is %s.",
                numGroups,
                maxGroups);
        if (numGroups <= groups.size()) {
            return;
        }
        LOG.debug(
                "Growing aggregate function {} from {} to {} groups.",
                template.getTypeID(),
                groups.size(),
                numGroups);
        groups.ensureCapacity(numGroups);
        while (groups.size() < numGroups) {
            groups.add(null);
        }
    }

    public void add(int groupId, Row row) {
        getOrCreate(groupId).add(row);
    }

    /** Merges a partial aggregation of the group, computed elsewhere, into the group. */
    public void merge(int groupId, AggFunc partial) {
        getOrCreate(groupId).merge(partial);
    }

    /** Merges every group of the other grouped function into the group with the same id. */
    public void mergeAll(GroupedAggFunc other) {
        Preconditions.checkArgument(other != this, "Cannot merge grouped function into itself.");
        // Fails before any group is touched if the functions cannot be merged.
        newFunc().merge(other.emptyFunc);
        ensureGroups(other.getNumGroups());
        for (int groupId = 0; groupId < other.getNumGroups(); groupId++) {
            final AggFunc partial = other.groups.get(groupId);
            if (partial != null) {
                getOrCreate(groupId).merge(partial);
            }
        }
        LOG.debug(
                "Merged {} groups of aggregate function {}.",
                other.getNumGroups(),
                template.getTypeID());
    }

    public void serialize(int groupId, DataOutputView out) throws IOException {
        get(groupId).serialize(out);
    }

    public void deserializeMerge(int groupId, DataInputView in) throws IOException {
        getOrCreate(groupId).deserializeMerge(in);
    }

    public Object getResult(int groupId) {
        return get(groupId).getResult();
    }

    private AggFunc get(int groupId) {
        Preconditions.checkElementIndex(groupId, groups.size());
        final AggFunc func = groups.get(groupId);
        return func == null ? emptyFunc : func;
    }

    private AggFunc getOrCreate(int groupId) {
        Preconditions.checkArgument(
                groupId >= 0 && groupId < maxGroups,
                "Group id %s is out of the range [0, %s).",
                groupId,
                maxGroups);
        ensureGroups(groupId + 1);
        AggFunc func = groups.get(groupId);
        if (func == null) {
            func = newFunc();
            groups.set(groupId, func);
        }
        return func;
    }

    private AggFunc newFunc() {
        final AggFunc func = template.cloneEmpty();
        func.setArguments(argumentTypes);
        if (parameters != null) {
            func.setParameters(parameters);
        }
        return func;
    }
}
