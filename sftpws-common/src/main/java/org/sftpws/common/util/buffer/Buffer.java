/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.sftpws.common.util.buffer;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.sftpws.common.util.ValidateUtils;

/**
 * Provides an abstract big-endian message buffer. Every read checks the remaining bytes before moving the read
 * position, and every write checks the remaining capacity before touching the data, so a failed operation leaves the
 * buffer exactly as it was.
 */
public abstract class Buffer {
    protected final byte[] workBuf = new byte[Long.BYTES];

    protected Buffer() {
        super();
    }

    /**
     * @return Current reading position
     */
    public abstract int rpos();

    /**
     * @param rpos Set current reading position
     */
    public abstract void rpos(int rpos);

    /**
     * @return Current writing position
     */
    public abstract int wpos();

    /**
     * @param wpos Set current writing position
     */
    public abstract void wpos(int wpos);

    /**
     * @return Number of bytes available for reading
     */
    public abstract int available();

    /**
     * @return Number of bytes that can still be written
     */
    public abstract int capacity();

    /**
     * @return The <U>raw</U> underlying data bytes
     */
    public abstract byte[] array();

    /**
     * Copies bytes starting at the current read position without moving it.
     *
     * @param offset Offset relative to the read position
     * @param buf    Target array
     * @param pos    Position in the target array
     * @param len    Number of bytes
     */
    protected abstract void copyRawBytes(int offset, byte[] buf, int pos, int len);

    /**
     * Creates a buffer that shares this buffer's backing array, covering {@code len} bytes from {@code off}.
     *
     * @param  off Absolute offset in {@link #array()}
     * @param  len Number of bytes
     * @return     The view
     */
    protected abstract Buffer createView(int off, int len);

    public String toHex() {
        return BufferUtils.toHex(array(), rpos(), available());
    }

    /*
     * ====================== Read methods ======================
     */

    public int getUByte() {
        return getByte() & 0xFF;
    }

    public byte getByte() {
        ensureAvailable(Byte.BYTES);
        getRawBytes(workBuf, 0, Byte.BYTES);
        return workBuf[0];
    }

    public int getUShort() {
        ensureAvailable(Short.BYTES);
        getRawBytes(workBuf, 0, Short.BYTES);
        return ((workBuf[0] << Byte.SIZE) & 0xFF00) | (workBuf[1] & 0xFF);
    }

    public short getShort() {
        return (short) getUShort();
    }

    public int getInt() {
        return (int) getUInt();
    }

    public long getUInt() {
        ensureAvailable(Integer.BYTES);
        getRawBytes(workBuf, 0, Integer.BYTES);
        return BufferUtils.getUInt(workBuf, 0, Integer.BYTES);
    }

    /**
     * Reads a 64-bit value encoded as two consecutive 32-bit words, high word first.
     *
     * @return The value as a two's complement {@code long}
     */
    public long getLong() {
        ensureAvailable(Long.BYTES);
        long high = getUInt();
        long low = getUInt();
        return (high << Integer.SIZE) | low;
    }

    /**
     * Reads an unsigned 64-bit value.
     *
     * @return                     The value
     * @throws ArithmeticException If the value does not fit into a {@code long} - the read position is left unchanged
     */
    public long getUInt64() {
        int rpos = rpos();
        long value = getLong();
        if (value < 0L) {
            rpos(rpos);
            throw new ArithmeticException("Unsigned 64-bit value exceeds supported range: " + Long.toUnsignedString(value));
        }
        return value;
    }

    /**
     * @return Reads a UTF-8 encoded string
     */
    public String getString() {
        return getString(StandardCharsets.UTF_8);
    }

    public String getString(Charset charset) {
        Objects.requireNonNull(charset, "No charset specified");

        int rpos = rpos();
        int len = getInt();
        try {
            ensureAvailable(len);
        } catch (BufferException e) {
            rpos(rpos);
            throw e;
        }

        byte[] data = new byte[len];
        getRawBytes(data, 0, len);
        return new String(data, charset);
    }

    public void skipString() {
        getBufferView();
    }

    /**
     * Reads length-prefixed opaque data into a newly allocated array that the caller owns.
     *
     * @return The data bytes
     */
    public byte[] getBytes() {
        Buffer view = getBufferView();
        byte[] data = new byte[view.available()];
        view.getRawBytes(data, 0, data.length);
        return data;
    }

    /**
     * Reads length-prefixed opaque data <U>without</U> copying it. The returned buffer shares this buffer's backing
     * array, so it is only valid as long as the source data is not modified.
     *
     * @return A read-only view over the data bytes
     */
    public Buffer getBufferView() {
        int rpos = rpos();
        int len = getInt();
        try {
            ensureAvailable(len);
        } catch (BufferException e) {
            rpos(rpos);
            throw e;
        }

        Buffer view = createView(rpos(), len);
        rpos(rpos() + len);
        return view;
    }

    public void getRawBytes(byte[] buf) {
        getRawBytes(buf, 0, buf.length);
    }

    public void getRawBytes(byte[] buf, int off, int len) {
        ensureAvailable(len);
        copyRawBytes(0, buf, off, len);
        rpos(rpos() + len);
    }

    /**
     * Makes sure the buffer contains enough data to accommodate the requested length
     *
     * @param  reqLen          Requested data in bytes
     * @return                 Same as input if validation successful
     * @throws BufferException If negative length or beyond available requested
     */
    public int ensureAvailable(int reqLen) throws BufferException {
        if (reqLen < 0) {
            throw new BufferException("Bad item length: " + reqLen);
        }

        int availLen = available();
        if (availLen < reqLen) {
            throw new BufferException("Unexpected end of packet: requested=" + reqLen + ", available=" + availLen);
        }

        return reqLen;
    }

    /*
     * ====================== Write methods ======================
     */

    public void putByte(byte b) {
        ensureCapacity(Byte.BYTES);
        workBuf[0] = b;
        putRawBytes(workBuf, 0, Byte.BYTES);
    }

    public void putShort(int i) {
        ensureCapacity(Short.BYTES);
        workBuf[0] = (byte) (i >> 8);
        workBuf[1] = (byte) i;
        putRawBytes(workBuf, 0, Short.BYTES);
    }

    public void putInt(long i) {
        BufferUtils.putUInt(i, workBuf, 0, Integer.BYTES);
        putRawBytes(workBuf, 0, Integer.BYTES);
    }

    public void putUInt(long i) {
        ValidateUtils.checkTrue(BufferUtils.isValidUint32Value(i), "Invalid UINT32 value: %d", i);
        putInt(i);
    }

    /**
     * Writes a 64-bit value as two consecutive 32-bit words, high word first.
     *
     * @param i The value
     */
    public void putLong(long i) {
        ensureCapacity(Long.BYTES);
        putInt(i >>> Integer.SIZE);
        putInt(i & BufferUtils.MAX_UINT32_VALUE);
    }

    public void putString(String string) {
        putString(string, StandardCharsets.UTF_8);
    }

    public void putString(String string, Charset charset) {
        byte[] bytes = Objects.requireNonNull(string, "No string value").getBytes(charset);
        putBytes(bytes);
    }

    public void putBytes(byte[] b) {
        putBytes(b, 0, b.length);
    }

    public void putBytes(byte[] b, int off, int len) {
        ensureCapacity(Integer.BYTES + len);
        putInt(len);
        putRawBytes(b, off, len);
    }

    public void putRawBytes(byte[] d) {
        putRawBytes(d, 0, d.length);
    }

    public abstract void putRawBytes(byte[] d, int off, int len);

    /**
     * @param  capacity                 The requested number of bytes
     * @throws BufferCapacityException If fewer bytes than requested can still be written
     */
    public abstract void ensureCapacity(int capacity);

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[rpos=" + rpos()
               + ", wpos=" + wpos()
               + ", size=" + array().length
               + "]";
    }
}
