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

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.v6net.packets.IPv6AddrException.Kind;

/**
 * Folds the token stream of one IPv6 address, optionally followed by a
 * "/prefix", into a 128-bit value.
 *
 * Hextets seen before the "::" are placed left to right into the high
 * lanes. Hextets seen after it are shifted in from the right, so the size
 * of the gap never needs to be known; the lanes in between stay zero.
 *
 * A parser instance holds the state of a single parse and is discarded
 * afterwards. Use {@link #parse(String, PrefixPolicy)}.
 */
public final class IPv6AddrParser {

    private static final Logger log =
        LoggerFactory.getLogger(IPv6AddrParser.class);

    static final int MAX_HEXTET_DIGITS = 4;
    static final int HEXTETS = 8;
    static final int MAX_PREFIX_LEN = 128;

    public enum PrefixPolicy {
        /** A plain address, "/prefix" is an error. */
        FORBIDDEN,
        /** "/prefix" may or may not be present. */
        OPTIONAL,
        /** CIDR notation, "/prefix" must be present. */
        REQUIRED
    }

    /** The outcome of a successful parse. */
    public static final class Result {
        private final long upperWord;
        private final long lowerWord;
        private final Integer prefixLength;

        Result(long upperWord, long lowerWord, Integer prefixLength) {
            this.upperWord = upperWord;
            this.lowerWord = lowerWord;
            this.prefixLength = prefixLength;
        }

        public long upperWord() {
            return upperWord;
        }

        public long lowerWord() {
            return lowerWord;
        }

        /** @return the parsed prefix length, or null if there was none. */
        public Integer prefixLength() {
            return prefixLength;
        }

        public IPv6Addr toAddr() {
            return new IPv6Addr(upperWord, lowerWord);
        }
    }

    private final String input;
    private final PrefixPolicy policy;

    private long hiUpper = 0;
    private long hiLower = 0;
    private long loUpper = 0;
    private long loLower = 0;
    private int hiCount = 0;
    private int loCount = 0;
    private boolean elided = false;
    private Integer prefixLength = null;

    private IPv6AddrParser(String input, PrefixPolicy policy) {
        this.input = input;
        this.policy = policy;
    }

    /**
     * Parses an IPv6 address, with or without prefix length depending on
     * the policy.
     *
     * @throws IPv6AddrException if the text is not a valid address under
     *         the given policy.
     */
    public static Result parse(String input, PrefixPolicy policy) {
        Preconditions.checkNotNull(input, "address text");
        Preconditions.checkNotNull(policy);
        return new IPv6AddrParser(input, policy).run();
    }

    private Result run() {
        int pos = 0;
        while (pos < input.length()) {
            IPv6AddrToken token = IPv6AddrTokenizer.next(input, pos);
            if (prefixLength != null)
                throw fail(Kind.TRAILING_DATA_AFTER_PREFIX,
                           "unexpected '" + token.text() +
                           "' after prefix length");
            token.kind().feed(this, token);
            pos = token.end();
        }

        int count = hiCount + loCount;
        if (elided && count > HEXTETS - 1)
            throw fail(Kind.WRONG_HEXTET_COUNT,
                       "address with '::' must have at most 7 hextets");
        if (!elided && count != HEXTETS)
            throw fail(Kind.WRONG_HEXTET_COUNT,
                       "address must have 8 hextets or use '::'");
        if (policy == PrefixPolicy.REQUIRED && prefixLength == null)
            throw fail(Kind.MISSING_PREFIX_LENGTH, "no prefix length specified");

        return new Result(hiUpper | loUpper, hiLower | loLower, prefixLength);
    }

    void onHextet(IPv6AddrToken token) {
        String digits = token.text();
        if (digits.length() > MAX_HEXTET_DIGITS)
            throw fail(Kind.MALFORMED_HEXTET,
                       "hextet must be 4 digits or less");
        long value;
        try {
            value = Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw fail(Kind.MALFORMED_HEXTET,
                       "hextet '" + digits + "' is not hexadecimal");
        }

        int count = hiCount + loCount;
        if (count >= (elided ? HEXTETS - 1 : HEXTETS))
            throw fail(Kind.WRONG_HEXTET_COUNT, elided ?
                       "address with '::' must have at most 7 hextets" :
                       "address must have 8 hextets or use '::'");

        if (elided) {
            loUpper = (loUpper << 16) | (loLower >>> 48);
            loLower = (loLower << 16) | value;
            loCount++;
        } else {
            int lane = hiCount;
            if (lane < 4)
                hiUpper |= value << ((3 - lane) * 16);
            else
                hiLower |= value << ((7 - lane) * 16);
            hiCount++;
        }
    }

    void onElision(IPv6AddrToken token) {
        if (elided)
            throw fail(Kind.MULTIPLE_ELISION,
                       "address can only have one '::'");
        elided = true;
    }

    void onSeparator(IPv6AddrToken token) {
        // ':' only separates hextets
    }

    void onPrefixLength(IPv6AddrToken token) {
        if (policy == PrefixPolicy.FORBIDDEN)
            throw fail(Kind.UNEXPECTED_PREFIX_LENGTH,
                       "prefix length not allowed here");
        int len;
        try {
            len = Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw fail(Kind.INVALID_PREFIX_LENGTH,
                       "prefix length '" + token.text() + "' is too large");
        }
        if (len > MAX_PREFIX_LEN)
            throw fail(Kind.INVALID_PREFIX_LENGTH,
                       "prefix length must be between 0 and 128");
        prefixLength = len;
    }

    void onUnrecognized(IPv6AddrToken token) {
        throw fail(Kind.UNRECOGNIZED_TOKEN,
                   "unrecognized '" + token.text() + "' at offset " +
                   token.start());
    }

    private IPv6AddrException fail(Kind kind, String message) {
        log.debug("Rejecting IPv6 address \"{}\": {}", input, message);
        return new IPv6AddrException(kind, message, input);
    }
}
