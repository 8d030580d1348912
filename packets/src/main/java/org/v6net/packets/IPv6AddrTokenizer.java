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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

/**
 * Splits IPv6 address text into {@link IPv6AddrToken}s.
 */
public final class IPv6AddrTokenizer {

    /**
     * Alternatives are tried left to right, so "::" must come before ":".
     * The last alternative swallows anything that cannot start one of the
     * others, or a '/' that is not followed by digits.
     */
    private static final String TOKEN_PATTERN =
        "(?<elision>::)" +
        "|(?<separator>:)" +
        "|(?<hextet>[0-9a-zA-Z]+)" +
        "|(?:/(?<prefixlen>[0-9]+))" +
        "|(?<junk>[^0-9a-zA-Z:/]+|/)";

    private static final Pattern tokenPattern = Pattern.compile(TOKEN_PATTERN);

    private IPv6AddrTokenizer() {}

    /**
     * Returns the token that starts at the given offset.
     *
     * @param input  address text
     * @param offset position of the token, in [0, input.length())
     */
    public static IPv6AddrToken next(String input, int offset) {
        Preconditions.checkNotNull(input);
        Preconditions.checkElementIndex(offset, input.length());

        Matcher m = tokenPattern.matcher(input);
        m.region(offset, input.length());
        if (!m.lookingAt())
            throw new IllegalStateException(
                "No token at offset " + offset + " of " + input);

        if (m.group("elision") != null)
            return token(IPv6AddrToken.Kind.ELISION, m, "elision");
        if (m.group("separator") != null)
            return token(IPv6AddrToken.Kind.SEPARATOR, m, "separator");
        if (m.group("hextet") != null)
            return token(IPv6AddrToken.Kind.HEXTET, m, "hextet");
        if (m.group("prefixlen") != null)
            return token(IPv6AddrToken.Kind.PREFIX_LENGTH, m, "prefixlen");
        return token(IPv6AddrToken.Kind.UNRECOGNIZED, m, "junk");
    }

    /**
     * Tokenizes the whole input.
     */
    public static List<IPv6AddrToken> tokenize(String input) {
        List<IPv6AddrToken> tokens = new ArrayList<>();
        int pos = 0;
        while (pos < input.length()) {
            IPv6AddrToken token = next(input, pos);
            tokens.add(token);
            pos = token.end();
        }
        return tokens;
    }

    private static IPv6AddrToken token(IPv6AddrToken.Kind kind, Matcher m,
                                       String group) {
        return new IPv6AddrToken(kind, m.group(group), m.start(), m.end());
    }
}
