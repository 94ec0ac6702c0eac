/*
 * Copyright 2024 The Glue Python Client Authors
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

package io.gluepython.sdk.client.scan;

import java.util.Locale;
import java.util.Optional;
import lombok.experimental.UtilityClass;

/**
 * Decodes Python string literal tokens into their constant value.
 */
@UtilityClass
class PythonStrings {
    /**
     * @param literal a complete STRING token, prefix and quotes included
     * @return the literal's value, or empty for bytes and f-strings, which are not string constants
     */
    static Optional<String> decode(String literal) {
        int quote = 0;
        while (quote < literal.length() && literal.charAt(quote) != '\'' && literal.charAt(quote) != '"') {
            quote++;
        }
        final String prefix = literal.substring(0, quote).toLowerCase(Locale.ROOT);
        if (prefix.indexOf('b') >= 0 || prefix.indexOf('f') >= 0) {
            return Optional.empty();
        }

        final String quoted = literal.substring(quote);
        final int width = quoted.startsWith("\"\"\"") || quoted.startsWith("'''") ? 3 : 1;
        final String body = quoted.substring(width, quoted.length() - width);
        if (prefix.indexOf('r') >= 0) {
            return Optional.of(body);
        }
        return Optional.of(unescape(body));
    }

    private static String unescape(String body) {
        final StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            final char ch = body.charAt(i);
            if (ch != '\\' || i + 1 >= body.length()) {
                out.append(ch);
                i++;
                continue;
            }

            final char escape = body.charAt(i + 1);
            i += 2;
            switch (escape) {
                case '\n':
                    break;
                case '\r':
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                    break;
                case '\\':
                case '\'':
                case '"':
                    out.append(escape);
                    break;
                case 'a':
                    out.append('\u0007');
                    break;
                case 'b':
                    out.append('\b');
                    break;
                case 'f':
                    out.append('\f');
                    break;
                case 'n':
                    out.append('\n');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case 'v':
                    out.append('\u000B');
                    break;
                case 'x':
                    i = appendCodePoint(out, body, i, 2, escape);
                    break;
                case 'u':
                    i = appendCodePoint(out, body, i, 4, escape);
                    break;
                case 'U':
                    i = appendCodePoint(out, body, i, 8, escape);
                    break;
                default:
                    if (escape >= '0' && escape <= '7') {
                        int end = i - 1;
                        while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        out.append((char) Integer.parseInt(body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        // unknown escapes are kept verbatim
                        out.append('\\').append(escape);
                    }
            }
        }
        return out.toString();
    }

    private static int appendCodePoint(StringBuilder out, String body, int start, int digits, char escape) {
        final int end = start + digits;
        if (end <= body.length()) {
            try {
                out.appendCodePoint(Integer.parseInt(body.substring(start, end), 16));
                return end;
            } catch (IllegalArgumentException e) {
                // not a valid escape, fall through to the verbatim copy
            }
        }
        out.append('\\').append(escape);
        return start;
    }
}
