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
import java.util.Iterator;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An IPv6 subnet: a base address and a prefix length in [0, 128].
 *
 * The base address is kept exactly as given, host bits included. Use
 * {@link #toNetworkAddress()} for the address with the host bits cleared.
 * Indexing and iteration count from the base address as given.
 *
 * Iterating a subnet walks every one of its {@link #numAddresses()}
 * addresses in ascending order; each call to {@link #iterator()} starts a
 * new walk. {@link #slice} gives stepped or bounded walks.
 */
public final class IPv6Subnet implements Iterable<IPv6Addr> {

    private static final Logger log =
        LoggerFactory.getLogger(IPv6Subnet.class);

    public static final int MAX_PREFIX_LEN = 128;

    private final IPv6Addr address;
    private final int prefixLength;
    private String string = null;

    public IPv6Subnet(IPv6Addr address, int prefixLen) {
        Preconditions.checkNotNull(address);
        if (prefixLen < 0 || prefixLen > MAX_PREFIX_LEN)
            throw new IPv6AddrException(
                IPv6AddrException.Kind.INVALID_PREFIX_LENGTH,
                "prefix length must be between 0 and 128 but was " +
                prefixLen);
        this.address = address;
        this.prefixLength = prefixLen;
        if (log.isDebugEnabled() && !address.equals(toNetworkAddress()))
            log.debug("Subnet {}/{} has host bits set", address, prefixLen);
    }

    public IPv6Subnet(String address, int prefixLen) {
        this(IPv6Addr.fromString(address), prefixLen);
    }

    public IPv6Subnet(BigInteger address, int prefixLen) {
        this(IPv6Addr.fromBigInteger(address), prefixLen);
    }

    public IPv6Subnet(byte[] address, int prefixLen) {
        this(IPv6Addr.fromBytes(address), prefixLen);
    }

    /**
     * Construct an IPv6Subnet from a CIDR notation string, e.g.
     * "2001:db8::/32". Unlike a plain address the prefix length is
     * mandatory.
     *
     * @throws IPv6AddrException if the string is not valid CIDR notation,
     *         with kind MISSING_PREFIX_LENGTH if "/prefix" is absent.
     */
    @JsonCreator
    public static IPv6Subnet fromCidr(String cidr) {
        Preconditions.checkNotNull(cidr, "CIDR text");
        IPv6AddrParser.Result parsed = IPv6AddrParser.parse(
            StringUtils.trim(cidr), IPv6AddrParser.PrefixPolicy.REQUIRED);
        return new IPv6Subnet(parsed.toAddr(), parsed.prefixLength());
    }

    public IPv6Addr getAddress() {
        return address;
    }

    public int getPrefixLen() {
        return prefixLength;
    }

    /**
     * @return the mask with the top prefix length bits set.
     */
    public BigInteger prefixMask() {
        return maskAddr().toBigInteger();
    }

    /**
     * @return 2^(128 - prefix length)
     */
    public BigInteger numAddresses() {
        return BigInteger.ONE.shiftLeft(MAX_PREFIX_LEN - prefixLength);
    }

    /**
     * @return the highest index accepted by {@link #addressAt(BigInteger)}.
     */
    public BigInteger maxIndex() {
        return numAddresses().subtract(BigInteger.ONE);
    }

    public IPv6Addr toNetworkAddress() {
        IPv6Addr network = address.and(maskAddr());
        return network.equals(address) ? address : network;
    }

    public IPv6Addr toBroadcastAddress() {
        IPv6Addr mask = maskAddr();
        return address.or(new IPv6Addr(~mask.upperWord(), ~mask.lowerWord()));
    }

    /**
     * Tells whether the address shares this subnet's prefix, i.e. whether
     * both are equal once their host bits are cleared.
     */
    public boolean containsAddress(IPv6Addr that) {
        if (that == null)
            return false;
        if (prefixLength == 0)
            return true;

        long upperMask = upperMask(prefixLength);
        long lowerMask = lowerMask(prefixLength);
        return (address.upperWord() & upperMask) ==
               (that.upperWord() & upperMask) &&
               (address.lowerWord() & lowerMask) ==
               (that.lowerWord() & lowerMask);
    }

    public IPv6Addr addressAt(long index) {
        return addressAt(BigInteger.valueOf(index));
    }

    /**
     * @return the base address plus index.
     * @throws IPv6AddrException of kind INDEX_OUT_OF_RANGE unless
     *         0 &lt;= index &lt;= {@link #maxIndex()}.
     */
    public IPv6Addr addressAt(BigInteger index) {
        Preconditions.checkNotNull(index);
        if (index.signum() < 0 || index.compareTo(maxIndex()) > 0)
            throw new IPv6AddrException(
                IPv6AddrException.Kind.INDEX_OUT_OF_RANGE,
                "index " + index + " is outside [0, " + maxIndex() +
                "] for subnet " + this);
        return address.add(index);
    }

    @Override
    public Iterator<IPv6Addr> iterator() {
        return slice(null, null).iterator();
    }

    /**
     * Same as {@code slice(start, stop, 1)}.
     */
    public IPv6AddrRange slice(Bound start, Bound stop) {
        return slice(start, stop, BigInteger.ONE);
    }

    public IPv6AddrRange slice(Bound start, Bound stop, long step) {
        return slice(start, stop, BigInteger.valueOf(step));
    }

    /**
     * Addresses from start (inclusive) towards stop (exclusive), step
     * apart. A null start means the base address and a null stop the
     * address just past the last one of the subnet. With a negative step
     * the same window is walked from its top end downwards.
     *
     * @throws IPv6AddrException of kind INVALID_STEP if step is zero.
     */
    public IPv6AddrRange slice(Bound start, Bound stop, BigInteger step) {
        BigInteger base = address.toBigInteger();
        BigInteger from = start == null ? base : start.resolve(base);
        BigInteger to = stop == null ? base.add(numAddresses())
                                     : stop.resolve(base);
        return new IPv6AddrRange(from, to, step);
    }

    private IPv6Addr maskAddr() {
        return new IPv6Addr(upperMask(prefixLength), lowerMask(prefixLength));
    }

    // A shift by 64 is a no-op on a long, so /0 and /64 are special cased.
    private static long upperMask(int prefixLen) {
        if (prefixLen == 0)
            return 0L;
        if (prefixLen >= 64)
            return ~0L;
        return ~0L << (64 - prefixLen);
    }

    private static long lowerMask(int prefixLen) {
        if (prefixLen <= 64)
            return 0L;
        return ~0L << (MAX_PREFIX_LEN - prefixLen);
    }

    @JsonValue
    @Override
    public String toString() {
        if (string == null)
            string = address.toString() + "/" + prefixLength;
        return string;
    }

    public String toString(IPv6Format format) {
        return address.toString(format) + "/" + prefixLength;
    }

    public String toUnicastString() {
        return address.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass())
            return false;

        IPv6Subnet that = (IPv6Subnet) o;
        return prefixLength == that.prefixLength &&
               Objects.equals(address, that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, prefixLength);
    }

    /**
     * One end of a slice: either an offset from the subnet's base address
     * or an absolute address.
     */
    public static final class Bound {

        private final BigInteger offset;
        private final IPv6Addr address;

        private Bound(BigInteger offset, IPv6Addr address) {
            this.offset = offset;
            this.address = address;
        }

        public static Bound offset(long offset) {
            return offset(BigInteger.valueOf(offset));
        }

        public static Bound offset(BigInteger offset) {
            return new Bound(Preconditions.checkNotNull(offset), null);
        }

        public static Bound at(IPv6Addr address) {
            return new Bound(null, Preconditions.checkNotNull(address));
        }

        BigInteger resolve(BigInteger base) {
            return address != null ? address.toBigInteger()
                                   : base.add(offset);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Bound)) return false;
            Bound that = (Bound) o;
            return Objects.equals(offset, that.offset) &&
                   Objects.equals(address, that.address);
        }

        @Override
        public int hashCode() {
            return Objects.hash(offset, address);
        }

        @Override
        public String toString() {
            return address != null ? address.toString() : "+" + offset;
        }
    }
}
