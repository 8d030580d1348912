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
import java.util.NoSuchElementException;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A lazily walked run of addresses from start (inclusive) to stop
 * (exclusive), step apart. Bounds are absolute 128-bit values; they are
 * not clamped to any subnet, and reaching a value outside the address
 * space fails with OUT_OF_RANGE.
 *
 * A negative step walks the window [start, stop) from its top: the walk
 * begins at stop - 1 and ends before reaching start - 1.
 */
public final class IPv6AddrRange implements Iterable<IPv6Addr> {

    private final BigInteger start;
    private final BigInteger stop;
    private final BigInteger step;

    public IPv6AddrRange(BigInteger start, BigInteger stop, BigInteger step) {
        Preconditions.checkNotNull(start);
        Preconditions.checkNotNull(stop);
        Preconditions.checkNotNull(step);
        if (step.signum() == 0)
            throw new IPv6AddrException(IPv6AddrException.Kind.INVALID_STEP,
                                        "step cannot be 0");
        this.start = start;
        this.stop = stop;
        this.step = step;
    }

    public IPv6AddrRange(IPv6Addr start, IPv6Addr stop, long step) {
        this(start.toBigInteger(), stop.toBigInteger(),
             BigInteger.valueOf(step));
    }

    public BigInteger start() {
        return start;
    }

    public BigInteger stop() {
        return stop;
    }

    public BigInteger step() {
        return step;
    }

    @Override
    public Iterator<IPv6Addr> iterator() {
        if (step.signum() < 0)
            return new AddrIterator(stop.subtract(BigInteger.ONE),
                                    start.subtract(BigInteger.ONE), step);
        return new AddrIterator(start, stop, step);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("start", start)
            .add("stop", stop)
            .add("step", step)
            .toString();
    }

    private static class AddrIterator implements Iterator<IPv6Addr> {
        private BigInteger current;
        private final BigInteger end;
        private final BigInteger step;
        private final boolean ascending;

        AddrIterator(BigInteger from, BigInteger end, BigInteger step) {
            this.current = from;
            this.end = end;
            this.step = step;
            this.ascending = step.signum() > 0;
        }

        @Override
        public boolean hasNext() {
            int c = current.compareTo(end);
            return ascending ? c < 0 : c > 0;
        }

        @Override
        public IPv6Addr next() {
            if (!hasNext())
                throw new NoSuchElementException("No more addresses.");
            IPv6Addr addr = IPv6Addr.fromBigInteger(current);
            current = current.add(step);
            return addr;
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException(
                "Can't remove addresses from a range.");
        }
    }
}
