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

/**
 * Thrown when an IPv6 address, subnet, slice or format specification is
 * rejected. The {@link Kind} tells the caller which rule was broken; the
 * input, when there is one, is the text that was being parsed.
 */
public class IPv6AddrException extends IllegalArgumentException {

    private static final long serialVersionUID = 5217786040394186253L;

    public enum Kind {
        /** A hextet longer than 4 characters or not in base 16. */
        MALFORMED_HEXTET,
        /** More than one "::" in a single address. */
        MULTIPLE_ELISION,
        /** Text that matches no part of the address grammar. */
        UNRECOGNIZED_TOKEN,
        /** Anything after the "/prefix" part. */
        TRAILING_DATA_AFTER_PREFIX,
        /** A CIDR string without "/prefix". */
        MISSING_PREFIX_LENGTH,
        /** A "/prefix" where only a plain address is accepted. */
        UNEXPECTED_PREFIX_LENGTH,
        /** A prefix length outside [0, 128]. */
        INVALID_PREFIX_LENGTH,
        /** Not 8 hextets without "::", or more than 7 with it. */
        WRONG_HEXTET_COUNT,
        /** A value outside [0, 2^128 - 1]. */
        OUT_OF_RANGE,
        /** A slice step of zero. */
        INVALID_STEP,
        /** A subnet index outside [0, numAddresses - 1]. */
        INDEX_OUT_OF_RANGE,
        /** An unknown format flag character. */
        INVALID_FORMAT_FLAG
    }

    private final Kind kind;
    private final String input;

    public IPv6AddrException(Kind kind, String message) {
        this(kind, message, null);
    }

    public IPv6AddrException(Kind kind, String message, String input) {
        super(input == null ? message : message + ": " + input);
        this.kind = kind;
        this.input = input;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the text being parsed when the error was detected, or null
     *         if the error did not come from parsing.
     */
    public String getInput() {
        return input;
    }
}
