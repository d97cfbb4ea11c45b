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

import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;
import org.apache.flink.table.types.DataType;
import org.apache.flink.types.Row;
import org.apache.flink.util.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of {@link AggFunc}s which enforces the lifecycle of the function. Subclasses only
 * implement the handling of their accumulator state.
 *
 * @param <F> The concrete type of the function.
 */
public abstract class AbstractAggFunc<F extends AbstractAggFunc<F>> implements AggFunc {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractAggFunc.class);

    private final String name;

    @Nullable private List<DataType> argumentTypes;

    @Nullable private Row parameters;

    private boolean hasData;

    protected AbstractAggFunc(String name) {
        this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getTypeID() {
        final StringBuilder typeId = new StringBuilder(name);
        if (parameters != null) {
            for (int i = 0; i < parameters.getArity(); i++) {
                typeId.append('_').append(parameters.getField(i));
            }
        }
        if (argumentTypes != null) {
            for (DataType argumentType : argumentTypes) {
                typeId.append('_').append(argumentType.getLogicalType().getTypeRoot());
            }
        }
        return typeId.toString();
    }

    @Override
    public abstract F cloneEmpty();

    @Override
    public final void setArguments(List<DataType> argumentTypes) {
        Preconditions.checkNotNull(argumentTypes);
        Preconditions.checkState(
                this.argumentTypes == null,
                "Arguments of aggregate function %s are already set.",
                name);
        doSetArguments(argumentTypes);
        this.argumentTypes = Collections.unmodifiableList(new ArrayList<>(argumentTypes));
        LOG.debug("Aggregate function {} is configured with arguments {}.", name, argumentTypes);
    }

    @Override
    public final void setParameters(Row parameters) {
        if (!acceptsParameters()) {
            AggFunc.super.setParameters(parameters);
        }
        Preconditions.checkNotNull(parameters);
        ensureArgumentsSet();
        Preconditions.checkState(
                this.parameters == null,
                "Parameters of aggregate function %s are already set.",
                name);
        Preconditions.checkState(
                !hasData,
                "Parameters of aggregate function %s must be set before aggregating data.",
                name);
        doSetParameters(parameters);
        this.parameters = Row.copy(parameters);
    }

    @Override
    public final DataType getReturnType() {
        ensureArgumentsSet();
        return deriveReturnType();
    }

    @Override
    public final void add(Row row) {
        ensureArgumentsSet();
        validateRow(row);
        hasData = true;
        addValues(row);
    }

    @Override
    public final void merge(AggFunc other) {
        ensureArgumentsSet();
        final F typedOther = checkCompatible(other);
        hasData = true;
        mergeState(typedOther);
    }

    @Override
    public final void serialize(DataOutputView out) throws IOException {
        ensureArgumentsSet();
        writeState(out);
    }

    @Override
    public final void deserializeMerge(DataInputView in) throws IOException {
        ensureArgumentsSet();
        final F partial = newConfiguredClone();
        try {
            partial.readState(in);
        } catch (EOFException e) {
            throw new AggFuncException(
                    AggFuncErrorCode.CORRUPT_STATE,
                    String.format("Truncated state of aggregate function %s.", getTypeID()),
                    e);
        } catch (AggFuncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AggFuncException(
                    AggFuncErrorCode.CORRUPT_STATE,
                    String.format("Malformed state of aggregate function %s.", getTypeID()),
                    e);
        }
        hasData = true;
        mergeState(partial);
    }

    @Override
    public final Object getResult() {
        ensureArgumentsSet();
        return computeResult();
    }

    /**
     * Validates the argument types and prepares the function for them.
     *
     * @throws AggFuncException with {@link AggFuncErrorCode#INCOMPATIBLE_ARGUMENTS} if the
     *     function is not applicable.
     */
    protected abstract void doSetArguments(List<DataType> argumentTypes);

    /** @return Whether this function accepts parameters. */
    protected boolean acceptsParameters() {
        return false;
    }

    /**
     * Validates the parameters and prepares the function for them. Only called if {@link
     * #acceptsParameters()} returns true.
     */
    protected void doSetParameters(Row parameters) {
        throw new UnsupportedOperationException();
    }

    /** Checks that the row matches the argument types before its values are added. */
    protected void validateRow(Row row) {
        AggFuncUtils.checkRow(name, argumentTypes, row);
    }

    protected abstract DataType deriveReturnType();

    protected abstract void addValues(Row row);

    /** Merges the state of a function that is known to be compatible with this one. */
    protected abstract void mergeState(F other);

    protected abstract void writeState(DataOutputView out) throws IOException;

    /** Reads a state into this function, which is empty and configured. */
    protected abstract void readState(DataInputView in) throws IOException;

    protected abstract Object computeResult();

    private F newConfiguredClone() {
        final F clone = cloneEmpty();
        clone.setArguments(argumentTypes);
        if (parameters != null) {
            clone.setParameters(parameters);
        }
        return clone;
    }

    @SuppressWarnings("unchecked")
    private F checkCompatible(AggFunc other) {
        Preconditions.checkNotNull(other);
        if (other.getClass() != getClass()) {
            throw new AggFuncException(
                    AggFuncErrorCode.TYPE_MISMATCH,
                    String.format(
                            "Cannot merge aggregate function %s into %s.",
                            other.getTypeID(), getTypeID()));
        }
        final AbstractAggFunc<?> sameClassOther = (AbstractAggFunc<?>) other;
        if (!name.equals(sameClassOther.name)
                || !Objects.equals(argumentTypes, sameClassOther.argumentTypes)
                || !Objects.equals(parameters, sameClassOther.parameters)) {
            throw new AggFuncException(
                    AggFuncErrorCode.TYPE_MISMATCH,
                    String.format(
                            "Cannot merge aggregate function %s into %s, "
                                    + "names, arguments or parameters differ.",
                            other.getTypeID(), getTypeID()));
        }
        return (F) other;
    }

    private void ensureArgumentsSet() {
        if (argumentTypes == null) {
            throw new AggFuncException(
                    AggFuncErrorCode.ARGUMENTS_NOT_SET,
                    String.format(
                            "Arguments of aggregate function %s must be set first.", name));
        }
    }
}
