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

/**
 * A lexeme of IPv6 address text, as produced by {@link IPv6AddrTokenizer}.
 */
public final class IPv6AddrToken {

    /**
     * Token kinds. Each kind hands itself to the matching parser action, so
     * a new kind does not compile until the parser knows what to do with
     * it.
     */
    public enum Kind {
        HEXTET {
            @Override
            void feed(IPv6AddrParser parser, IPv6AddrToken token) {
                parser.onHextet(token);
            }
        },
        ELISION {
            @Override
            void feed(IPv6AddrParser parser, IPv6AddrToken token) {
                parser.onElision(token);
            }
        },
        SEPARATOR {
            @Override
            void feed(IPv6AddrParser parser, IPv6AddrToken token) {
                parser.onSeparator(token);
            }
        },
        PREFIX_LENGTH {
            @Override
            void feed(IPv6AddrParser parser, IPv6AddrToken token) {
                parser.onPrefixLength(token);
            }
        },
        UNRECOGNIZED {
            @Override
            void feed(IPv6AddrParser parser, IPv6AddrToken token) {
                parser.onUnrecognized(token);
            }
        };

        abstract void feed(IPv6AddrParser parser, IPv6AddrToken token);
    }

    private final Kind kind;
    private final String text;
    private final int start;
    private final int end;

    IPv6AddrToken(Kind kind, String text, int start, int end) {
        this.kind = kind;
        this.text = text;
        this.start = start;
        this.end = end;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The significant text of the token. For {@link Kind#PREFIX_LENGTH}
     * this is the digits only, without the leading '/'.
     */
    public String text() {
        return text;
    }

    /** Offset of the first character of the token in the input. */
    public int start() {
        return start;
    }

    /** Offset just past the last character of the token. */
    public int end() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IPv6AddrToken)) return false;
        IPv6AddrToken that = (IPv6AddrToken) o;
        return kind == that.kind && start == that.start && end == that.end
               && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, start, end);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + start;
    }
}
