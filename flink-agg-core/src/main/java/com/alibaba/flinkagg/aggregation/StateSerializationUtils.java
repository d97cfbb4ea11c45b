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

import org.apache.flink.api.common.typeutils.TypeSerializer;
import org.apache.flink.api.common.typeutils.base.BooleanSerializer;
import org.apache.flink.api.common.typeutils.base.ByteSerializer;
import org.apache.flink.api.common.typeutils.base.DoubleSerializer;
import org.apache.flink.api.common.typeutils.base.FloatSerializer;
import org.apache.flink.api.common.typeutils.base.IntSerializer;
import org.apache.flink.api.common.typeutils.base.LocalDateSerializer;
import org.apache.flink.api.common.typeutils.base.LocalDateTimeSerializer;
import org.apache.flink.api.common.typeutils.base.LongSerializer;
import org.apache.flink.api.common.typeutils.base.ShortSerializer;
import org.apache.flink.core.memory.DataInputView;
import org.apache.flink.core.memory.DataOutputView;
import org.apache.flink.table.types.DataType;

import javax.annotation.Nullable;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * Helpers shared by the accumulator state encodings. All numbers are written in big-endian byte
 * order, as defined by {@link java.io.DataOutput}. Nullable values are prefixed by a presence
 * byte and collections by their size, so that every encoding is self-delimiting.
 */
public class StateSerializationUtils {

    private static final byte ABSENT = 0;
    private static final byte PRESENT = 1;

    private static final int MAX_INITIAL_BUFFER_SIZE = 64;

    private StateSerializationUtils() {}

    /** @return Whether values of the type can be written by {@link #getValueSerializer}. */
    public static boolean isSerializable(DataType dataType) {
        return findValueSerializer(dataType) != null;
    }

    /**
     * Returns the serializer of values of the given type's conversion class.
     *
     * @throws IllegalArgumentException if values of the type cannot be serialized.
     */
    public static StateValueSerializer getValueSerializer(DataType dataType) {
        final StateValueSerializer serializer = findValueSerializer(dataType);
        if (serializer == null) {
            throw new IllegalArgumentException(
                    String.format("Unsupported type for state serialization %s.", dataType));
        }
        return serializer;
    }

    @Nullable
    private static StateValueSerializer findValueSerializer(DataType dataType) {
        switch (dataType.getLogicalType().getTypeRoot()) {
            case BOOLEAN:
                return new FixedWidthValueSerializer(BooleanSerializer.INSTANCE);
            case TINYINT:
                return new FixedWidthValueSerializer(ByteSerializer.INSTANCE);
            case SMALLINT:
                return new FixedWidthValueSerializer(ShortSerializer.INSTANCE);
            case INTEGER:
                return new FixedWidthValueSerializer(IntSerializer.INSTANCE);
            case BIGINT:
                return new FixedWidthValueSerializer(LongSerializer.INSTANCE);
            case FLOAT:
                return new FixedWidthValueSerializer(FloatSerializer.INSTANCE);
            case DOUBLE:
                return new FixedWidthValueSerializer(DoubleSerializer.INSTANCE);
            case DATE:
                return new FixedWidthValueSerializer(LocalDateSerializer.INSTANCE);
            case TIMESTAMP_WITHOUT_TIME_ZONE:
                return new FixedWidthValueSerializer(LocalDateTimeSerializer.INSTANCE);
            case CHAR:
            case VARCHAR:
                return StringValueSerializer.INSTANCE;
            case DECIMAL:
                return DecimalValueSerializer.INSTANCE;
            default:
                return null;
        }
    }

    public static void writeNullable(
            StateValueSerializer serializer, @Nullable Object value, DataOutputView out)
            throws IOException {
        if (value == null) {
            out.writeByte(ABSENT);
        } else {
            out.writeByte(PRESENT);
            serializer.serialize(value, out);
        }
    }

    @Nullable
    public static Object readNullable(
            String funcName, StateValueSerializer serializer, DataInputView in)
            throws IOException {
        final byte flag = in.readByte();
        if (flag == ABSENT) {
            return null;
        }
        if (flag != PRESENT) {
            throw corruptState(funcName, String.format("unknown presence flag %s", flag));
        }
        final Object value = serializer.deserialize(in);
        if (value == null) {
            throw corruptState(funcName, "present value decoded as null");
        }
        return value;
    }

    public static void writeSize(int size, DataOutputView out) throws IOException {
        out.writeInt(size);
    }

    public static int readSize(String funcName, DataInputView in) throws IOException {
        final int size = in.readInt();
        if (size < 0) {
            throw corruptState(funcName, String.format("negative size %s", size));
        }
        return size;
    }

    public static long readCount(String funcName, DataInputView in) throws IOException {
        final long count = in.readLong();
        if (count < 0) {
            throw corruptState(funcName, String.format("negative count %s", count));
        }
        return count;
    }

    public static AggFuncException corruptState(String funcName, String detail) {
        return new AggFuncException(
                AggFuncErrorCode.CORRUPT_STATE,
                String.format("Malformed state of aggregate function %s: %s.", funcName, detail));
    }

    private static int readLength(String typeName, DataInputView in) throws IOException {
        final int length = in.readInt();
        if (length < 0) {
            throw new AggFuncException(
                    AggFuncErrorCode.CORRUPT_STATE,
                    String.format(
                            "Malformed %s value in state: negative length %s.",
                            typeName, length));
        }
        return length;
    }

    /** Delegates to a Flink serializer whose encoding has a fixed width. */
    private static class FixedWidthValueSerializer implements StateValueSerializer {

        private final TypeSerializer<Object> serializer;

        @SuppressWarnings("unchecked")
        private FixedWidthValueSerializer(TypeSerializer<?> serializer) {
            this.serializer = (TypeSerializer<Object>) serializer;
        }

        @Override
        public void serialize(Object value, DataOutputView out) throws IOException {
            serializer.serialize(value, out);
        }

        @Override
        public Object deserialize(DataInputView in) throws IOException {
            return serializer.deserialize(in);
        }
    }

    /** Writes the number of chars followed by the chars. */
    private static class StringValueSerializer implements StateValueSerializer {

        private static final StringValueSerializer INSTANCE = new StringValueSerializer();

        @Override
        public void serialize(Object value, DataOutputView out) throws IOException {
            final String str = (String) value;
            out.writeInt(str.length());
            out.writeChars(str);
        }

        @Override
        public Object deserialize(DataInputView in) throws IOException {
            final int length = readLength("string", in);
            final StringBuilder builder =
                    new StringBuilder(Math.min(length, MAX_INITIAL_BUFFER_SIZE));
            for (int i = 0; i < length; i++) {
                builder.append(in.readChar());
            }
            return builder.toString();
        }
    }

    /** Writes the scale, the length of the unscaled value and its two's-complement bytes. */
    private static class DecimalValueSerializer implements StateValueSerializer {

        private static final DecimalValueSerializer INSTANCE = new DecimalValueSerializer();

        @Override
        public void serialize(Object value, DataOutputView out) throws IOException {
            final BigDecimal decimal = (BigDecimal) value;
            final byte[] unscaled = decimal.unscaledValue().toByteArray();
            out.writeInt(decimal.scale());
            out.writeInt(unscaled.length);
            out.write(unscaled);
        }

        @Override
        public Object deserialize(DataInputView in) throws IOException {
            final int scale = in.readInt();
            final int length = readLength("decimal", in);
            if (length == 0) {
                throw new AggFuncException(
                        AggFuncErrorCode.CORRUPT_STATE,
                        "Malformed decimal value in state: empty unscaled value.");
            }
            // The buffer grows with the bytes actually read.
            byte[] bytes = new byte[Math.min(length, MAX_INITIAL_BUFFER_SIZE)];
            int read = 0;
            while (read < length) {
                if (read == bytes.length) {
                    bytes = Arrays.copyOf(bytes, (int) Math.min(length, 2L * bytes.length));
                }
                final int chunk = bytes.length - read;
                in.readFully(bytes, read, chunk);
                read += chunk;
            }
            return new BigDecimal(new BigInteger(bytes), scale);
        }
    }
}
