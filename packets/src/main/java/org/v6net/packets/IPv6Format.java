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

import java.util.Objects;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.apache.commons.lang3.StringUtils;

/**
 * Text rendering options for IPv6 addresses. Two independent axes:
 * whether the longest run of zero hextets is replaced by "::", and whether
 * each hextet is zero padded to four digits.
 *
 * <pre>
 *   SHORT (compress, trim)   2001:db8::1
 *   LONG  (expand, pad)      2001:0db8:0000:0000:0000:0000:0000:0001
 * </pre>
 */
public final class IPv6Format {

    public enum Compression { COMPRESS, EXPAND }

    public enum Padding { PAD, TRIM }

    public static final IPv6Format SHORT =
        new IPv6Format(Compression.COMPRESS, Padding.TRIM);

    public static final IPv6Format LONG =
        new IPv6Format(Compression.EXPAND, Padding.PAD);

    /** A single zero hextet is written as "0", never as "::". */
    static final int MIN_ELIDED_RUN = 2;

    private static final int HEXTETS = 8;
    private static final int SENTINEL = 0x10000;

    private final Compression compression;
    private final Padding padding;

    private IPv6Format(Compression compression, Padding padding) {
        this.compression = compression;
        this.padding = padding;
    }

    public static IPv6Format of(Compression compression, Padding padding) {
        Preconditions.checkNotNull(compression);
        Preconditions.checkNotNull(padding);
        if (compression == Compression.COMPRESS && padding == Padding.TRIM)
            return SHORT;
        if (compression == Compression.EXPAND && padding == Padding.PAD)
            return LONG;
        return new IPv6Format(compression, padding);
    }

    /**
     * Builds a format from single character flags, applied left to right
     * so that a later flag overrides an earlier one on the same axis:
     *
     * <ul>
     *   <li>'s': short, same as "ct"</li>
     *   <li>'l': long, same as "ep"</li>
     *   <li>'c' / 'e': compress / expand zero runs</li>
     *   <li>'p' / 't': pad / trim hextets</li>
     * </ul>
     *
     * A null or empty string gives {@link #SHORT}.
     *
     * @throws IPv6AddrException for any other character.
     */
    public static IPv6Format fromFlags(String flags) {
        Compression c = SHORT.compression;
        Padding p = SHORT.padding;
        if (flags == null)
            return SHORT;
        for (int i = 0; i < flags.length(); i++) {
            char flag = flags.charAt(i);
            switch (flag) {
                case 's':
                    c = Compression.COMPRESS;
                    p = Padding.TRIM;
                    break;
                case 'l':
                    c = Compression.EXPAND;
                    p = Padding.PAD;
                    break;
                case 'c':
                    c = Compression.COMPRESS;
                    break;
                case 'e':
                    c = Compression.EXPAND;
                    break;
                case 'p':
                    p = Padding.PAD;
                    break;
                case 't':
                    p = Padding.TRIM;
                    break;
                default:
                    throw new IPv6AddrException(
                        IPv6AddrException.Kind.INVALID_FORMAT_FLAG,
                        "unknown format flag '" + flag + "'", flags);
            }
        }
        return of(c, p);
    }

    public Compression compression() {
        return compression;
    }

    public Padding padding() {
        return padding;
    }

    public IPv6Format withCompression(Compression compression) {
        return of(compression, padding);
    }

    public IPv6Format withPadding(Padding padding) {
        return of(compression, padding);
    }

    /**
     * Renders eight hextets, most significant first.
     */
    public String format(int[] hextets) {
        Preconditions.checkArgument(hextets.length == HEXTETS,
                                    "expected 8 hextets, got %s",
                                    hextets.length);
        int elideStart = -1;
        int elideLength = 0;
        if (compression == Compression.COMPRESS) {
            int[] run = longestZeroRun(hextets);
            elideStart = run[0];
            elideLength = run[1];
        }

        StringBuilder sb = new StringBuilder(39);
        boolean needSeparator = false;
        int i = 0;
        while (i < HEXTETS) {
            if (i == elideStart) {
                sb.append("::");
                needSeparator = false;
                i += elideLength;
                continue;
            }
            if (needSeparator)
                sb.append(':');
            String digits = Integer.toHexString(hextets[i]);
            sb.append(padding == Padding.PAD
                      ? StringUtils.leftPad(digits, 4, '0') : digits);
            needSeparator = true;
            i++;
        }
        return sb.toString();
    }

    /**
     * Finds the leftmost longest run of zero hextets that is at least
     * {@link #MIN_ELIDED_RUN} long.
     *
     * @return {start, length}, or {-1, 0} if there is no such run.
     */
    @VisibleForTesting
    static int[] longestZeroRun(int[] hextets) {
        int bestStart = -1;
        int bestLength = MIN_ELIDED_RUN - 1;
        int runStart = 0;
        for (int i = 1; i <= HEXTETS; i++) {
            int value = i < HEXTETS ? hextets[i] : SENTINEL;
            if (value == hextets[runStart])
                continue;
            int runLength = i - runStart;
            if (hextets[runStart] == 0 && runLength > bestLength) {
                bestStart = runStart;
                bestLength = runLength;
            }
            runStart = i;
        }
        return bestStart < 0 ? new int[] {-1, 0}
                             : new int[] {bestStart, bestLength};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IPv6Format)) return false;
        IPv6Format that = (IPv6Format) o;
        return compression == that.compression && padding == that.padding;
    }

    @Override
    public int hashCode() {
        return Objects.hash(compression, padding);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("compression", compression)
            .add("padding", padding)
            .toString();
    }
}
