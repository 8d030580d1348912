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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Assert;
import org.junit.Test;

import org.v6net.packets.IPv6AddrException.Kind;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

public class TestIPv6Addr {

    private static final BigInteger TWO_128 = BigInteger.ONE.shiftLeft(128);

    private static void assertKind(Kind kind, Runnable r) {
        try {
            r.run();
            Assert.fail("Expected " + kind);
        } catch (IPv6AddrException e) {
            Assert.assertEquals(kind, e.getKind());
        }
    }

    @Test
    public void testFromStringToBigInteger() {
        Assert.assertEquals(
            new BigInteger("abcdef0123456789abcdef0123456789", 16),
            IPv6Addr.fromString("ABCD:EF01:2345:6789:ABCD:EF01:2345:6789")
                    .toBigInteger());
        Assert.assertEquals(
            IPv6Addr.fromString("2001:DB8:0:0:8:800:200C:417A"),
            IPv6Addr.fromString("2001:DB8::8:800:200C:417A"));
    }

    @Test
    public void testHextetsAgreeWithValue() {
        IPv6Addr addr = IPv6Addr.fromString("2001:db8::8:800:200c:417a");
        int[] hextets = addr.hextets();
        Assert.assertArrayEquals(new int[] {
            0x2001, 0x0db8, 0, 0, 0x8, 0x800, 0x200c, 0x417a }, hextets);
        BigInteger sum = BigInteger.ZERO;
        for (int i = 0; i < hextets.length; i++)
            sum = sum.or(BigInteger.valueOf(hextets[i])
                                   .shiftLeft(16 * (7 - i)));
        Assert.assertEquals(addr.toBigInteger(), sum);
        Assert.assertEquals(0x417a, addr.hextet(7));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testHextetIndex() {
        IPv6Addr.ANY.hextet(8);
    }

    @Test
    public void testFromBigIntegerRange() {
        Assert.assertEquals(IPv6Addr.MAX,
            IPv6Addr.fromBigInteger(TWO_128.subtract(BigInteger.ONE)));
        Assert.assertEquals(IPv6Addr.ANY,
            IPv6Addr.fromBigInteger(BigInteger.ZERO));
        assertKind(Kind.OUT_OF_RANGE,
                   () -> IPv6Addr.fromBigInteger(TWO_128));
        assertKind(Kind.OUT_OF_RANGE,
                   () -> IPv6Addr.fromBigInteger(BigInteger.valueOf(-1)));
    }

    @Test
    public void testWordsAndBigInteger() {
        IPv6Addr addr = new IPv6Addr(0x8000000000000000L, 1L);
        Assert.assertEquals(BigInteger.ONE.shiftLeft(127).add(BigInteger.ONE),
                            addr.toBigInteger());
        Assert.assertEquals(addr,
                            IPv6Addr.fromBigInteger(addr.toBigInteger()));
        Assert.assertEquals("8000::1", addr.toString());
    }

    @Test
    public void testArithmetic() {
        Assert.assertEquals(IPv6Addr.fromString("2001:db8::5"),
                            IPv6Addr.fromString("2001:db8::4").add(1));
        Assert.assertEquals(IPv6Addr.fromString("2001:db8::4"),
                            IPv6Addr.fromString("2001:db8::5").add(-1));
        Assert.assertEquals(IPv6Addr.fromString("2001:db8::5"),
                            IPv6Addr.fromString("2001:db8::4").subtract(-1));
        Assert.assertEquals(IPv6Addr.fromString("2001:db8::4"),
                            IPv6Addr.fromString("2001:db8::5").subtract(1));
        // carry across the word boundary
        Assert.assertEquals(IPv6Addr.fromString("0:0:0:1::"),
            IPv6Addr.fromString("::ffff:ffff:ffff:ffff").add(1));
        Assert.assertEquals(IPv6Addr.fromString("::ffff:ffff:ffff:ffff"),
            IPv6Addr.fromString("0:0:0:1::").subtract(1));
        Assert.assertEquals(IPv6Addr.MAX,
            IPv6Addr.ANY.add(TWO_128.subtract(BigInteger.ONE)));
    }

    @Test
    public void testArithmeticBoundaries() {
        assertKind(Kind.OUT_OF_RANGE, () -> IPv6Addr.MAX.add(1));
        assertKind(Kind.OUT_OF_RANGE, () -> IPv6Addr.ANY.subtract(1));
        assertKind(Kind.OUT_OF_RANGE, () -> IPv6Addr.ANY.add(-1));
        assertKind(Kind.OUT_OF_RANGE, () -> IPv6Addr.MAX.subtract(-1));
        Assert.assertSame(IPv6Addr.MAX, IPv6Addr.MAX.add(0));
    }

    @Test
    public void testMasks() {
        IPv6Addr addr = IPv6Addr.fromString("2001:db8:1:2:3:4:5:6");
        BigInteger mask = new BigInteger("ffffffffffffffff0000000000000000",
                                         16);
        Assert.assertEquals(IPv6Addr.fromString("2001:db8:1:2::"),
                            addr.and(mask));
        Assert.assertEquals(IPv6Addr.fromString("ffff:ffff:ffff:ffff:3:4:5:6"),
                            addr.or(mask));
        Assert.assertEquals(addr.and(mask),
                            addr.and(IPv6Addr.fromBigInteger(mask)));
        assertKind(Kind.OUT_OF_RANGE, () -> addr.and(TWO_128));
        assertKind(Kind.OUT_OF_RANGE, () -> addr.or(BigInteger.valueOf(-1)));
    }

    @Test
    public void testBytes() {
        IPv6Addr addr = IPv6Addr.fromString("2001:db8::1");
        byte[] bytes = addr.toBytes();
        Assert.assertEquals(16, bytes.length);
        Assert.assertEquals((byte) 0x20, bytes[0]);
        Assert.assertEquals((byte) 0xb8, bytes[3]);
        Assert.assertEquals((byte) 0x01, bytes[15]);
        Assert.assertEquals(addr, IPv6Addr.fromBytes(bytes));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShortBytes() {
        IPv6Addr.fromBytes(new byte[4]);
    }

    @Test
    public void testOrdering() {
        IPv6Addr low = IPv6Addr.fromString("::ffff");
        IPv6Addr high = IPv6Addr.fromString("8000::");
        assertThat(low.compareTo(high), lessThan(0));
        assertThat(high.compareTo(low), greaterThan(0));
        assertThat(IPv6Addr.MAX.compareTo(IPv6Addr.ANY), greaterThan(0));
        assertThat(low.compareTo(IPv6Addr.fromString("0::ffff")), is(0));
    }

    @Test
    public void testEquality() {
        IPv6Addr a = IPv6Addr.fromString("fe80::1");
        IPv6Addr b = IPv6Addr.fromLongs(0xfe80000000000000L, 1L);
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertNotEquals(a, IPv6Addr.fromString("fe80::2"));
        Assert.assertNotEquals(a, "fe80::1");
    }

    @Test
    public void testParseErrors() {
        assertKind(Kind.MULTIPLE_ELISION, () -> IPv6Addr.fromString("a::b::c"));
        assertKind(Kind.MALFORMED_HEXTET, () -> IPv6Addr.fromString("abcde::"));
        assertKind(Kind.UNEXPECTED_PREFIX_LENGTH,
                   () -> IPv6Addr.fromString("2001:db8::/32"));
    }

    @Test(expected = NullPointerException.class)
    public void testNullString() {
        IPv6Addr.fromString(null);
    }

    @Test
    public void testJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        IPv6Addr addr = IPv6Addr.fromString("2001:DB8:0:0:8:800:200C:417A");
        String json = mapper.writeValueAsString(addr);
        Assert.assertEquals("\"2001:db8::8:800:200c:417a\"", json);
        Assert.assertEquals(addr, mapper.readValue(json, IPv6Addr.class));
    }
}
