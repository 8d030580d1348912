/*
 * Copyright 2026 The v6net Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.v6net.packets;

import java.math.BigInteger;
import java.nio.ByteBuffer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLongs;

/**
 * An IPv6 address: an unsigned 128-bit integer, kept as two 64-bit words.
 *
 * The same value can be read as an integer ({@link #toBigInteger()}) or as
 * eight 16-bit hextets ({@link #hextet(int)}), most significant first.
 * Instances are immutable; arithmetic and masking return new addresses and
 * fail rather than wrap around when the result leaves [0, 2^128 - 1].
 */
public final class IPv6Addr implements Comparable<IPv6Addr> {

    public static final int ADDRESS_LENGTH = 16;
    public static final int HEXTETS = 8;

    public static final BigInteger MAX_VALUE =
        BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    /** The unspecified address, "::". */
    public static final IPv6Addr ANY = new IPv6Addr(0L, 0L);

    /** ffff:ffff:ffff:ffff:ffff:ffff:ffff:ffff */
    public static final IPv6Addr MAX = new IPv6Addr(~0L, ~0L);

    private final long upperWord;
    private final long lowerWord;
    private String sAddr = null; // lazy init

    public IPv6Addr(long upperWord, long lowerWord) {
        this.upperWord = upperWord;
        this.lowerWord = lowerWord;
    }

    public static IPv6Addr fromLongs(long upperWord, long lowerWord) {
        return new IPv6Addr(upperWord, lowerWord);
    }

    /**
     * Parses an address such as "2001:db8::8:800:200c:417a". Hex digits
     * are accepted in either case; a "/prefix" is not accepted.
     *
     * @throws IPv6AddrException if the text is not a valid address.
     */
    @JsonCreator
    public static IPv6Addr fromString(String str) {
        return IPv6AddrParser.parse(str, IPv6AddrParser.PrefixPolicy.FORBIDDEN)
                             .toAddr();
    }

    /**
     * @throws IPv6AddrException of kind OUT_OF_RANGE unless
     *         0 &lt;= value &lt;= 2^128 - 1.
     */
    public static IPv6Addr fromBigInteger(BigInteger value) {
        Preconditions.checkNotNull(value);
        if (value.signum() < 0 || value.bitLength() > 128)
            throw outOfRange(value);
        return new IPv6Addr(value.shiftRight(64).longValue(),
                            value.longValue());
    }

    /**
     * @param bytes 16 bytes in network order.
     */
    public static IPv6Addr fromBytes(byte[] bytes) {
        Preconditions.checkArgument(bytes.length == ADDRESS_LENGTH,
                                    "IPv6 address must be 16 bytes, got %s",
                                    bytes.length);
        ByteBuffer bb = ByteBuffer.wrap(bytes);
        return new IPv6Addr(bb.getLong(), bb.getLong());
    }

    public byte[] toBytes() {
        return ByteBuffer.allocate(ADDRESS_LENGTH)
                         .putLong(upperWord)
                         .putLong(lowerWord)
                         .array();
    }

    public long upperWord() {
        return upperWord;
    }

    public long lowerWord() {
        return lowerWord;
    }

    public BigInteger toBigInteger() {
        return new BigInteger(1, toBytes());
    }

    /**
     * @param index 0 for the leftmost hextet, 7 for the rightmost.
     */
    public int hextet(int index) {
        Preconditions.checkElementIndex(index, HEXTETS);
        long word = index < 4 ? upperWord : lowerWord;
        return (int) ((word >>> ((3 - (index & 3)) * 16)) & 0xffff);
    }

    public int[] hextets() {
        int[] hextets = new int[HEXTETS];
        for (int i = 0; i < HEXTETS; i++)
            hextets[i] = hextet(i);
        return hextets;
    }

    public IPv6Addr add(long delta) {
        return add(BigInteger.valueOf(delta));
    }

    /**
     * @throws IPv6AddrException of kind OUT_OF_RANGE if the sum falls
     *         outside the address space.
     */
    public IPv6Addr add(BigInteger delta) {
        Preconditions.checkNotNull(delta);
        if (delta.signum() == 0)
            return this;
        return fromBigInteger(toBigInteger().add(delta));
    }

    public IPv6Addr subtract(long delta) {
        return subtract(BigInteger.valueOf(delta));
    }

    public IPv6Addr subtract(BigInteger delta) {
        Preconditions.checkNotNull(delta);
        return add(delta.negate());
    }

    public IPv6Addr and(IPv6Addr mask) {
        return new IPv6Addr(upperWord & mask.upperWord,
                            lowerWord & mask.lowerWord);
    }

    public IPv6Addr or(IPv6Addr mask) {
        return new IPv6Addr(upperWord | mask.upperWord,
                            lowerWord | mask.lowerWord);
    }

    /**
     * @throws IPv6AddrException of kind OUT_OF_RANGE if the mask is not a
     *         128-bit unsigned value.
     */
    public IPv6Addr and(BigInteger mask) {
        return and(fromBigInteger(mask));
    }

    public IPv6Addr or(BigInteger mask) {
        return or(fromBigInteger(mask));
    }

    /**
     * Renders the address in canonical form, e.g. "2001:db8::1".
     */
    @JsonValue
    @Override
    public String toString() {
        if (sAddr == null)
            sAddr = IPv6Format.SHORT.format(hextets());
        return sAddr;
    }

    public String toString(IPv6Format format) {
        if (IPv6Format.SHORT.equals(format))
            return toString();
        return format.format(hextets());
    }

    /**
     * Renders the address using format flags, see
     * {@link IPv6Format#fromFlags(String)}.
     */
    public String format(String flags) {
        return toString(IPv6Format.fromFlags(flags));
    }

    @Override
    public int compareTo(IPv6Addr that) {
        int c = UnsignedLongs.compare(upperWord, that.upperWord);
        return c != 0 ? c : UnsignedLongs.compare(lowerWord, that.lowerWord);
    }

    @Override
    public boolean equals(Object rhs) {
        if (this == rhs)
            return true;
        if (!(rhs instanceof IPv6Addr))
            return false;
        IPv6Addr that = (IPv6Addr) rhs;
        return upperWord == that.upperWord && lowerWord == that.lowerWord;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(upperWord) + Long.hashCode(lowerWord);
    }

    private static IPv6AddrException outOfRange(BigInteger value) {
        return new IPv6AddrException(
            IPv6AddrException.Kind.OUT_OF_RANGE,
            "IPv6 address value must be between 0 and 2^128 - 1 but was " +
            value);
    }
}
