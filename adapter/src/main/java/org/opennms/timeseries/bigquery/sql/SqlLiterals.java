/*******************************************************************************
 * This file is part of OpenNMS(R).
 *
 * Copyright (C) 2021 The OpenNMS Group, Inc.
 * OpenNMS(R) is Copyright (C) 1999-2021 The OpenNMS Group, Inc.
 *
 * OpenNMS(R) is a registered trademark of The OpenNMS Group, Inc.
 *
 * OpenNMS(R) is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License,
 * or (at your option) any later version.
 *
 * OpenNMS(R) is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with OpenNMS(R).  If not, see:
 *      http://www.gnu.org/licenses/
 *
 * For more information contact:
 *     OpenNMS(R) Licensing <license@opennms.org>
 *     http://www.opennms.org/
 *     http://www.opennms.com/
 *******************************************************************************/

package org.opennms.timeseries.bigquery.sql;

/**
 * Escaping of values embedded into generated GoogleSQL text.
 */
public final class SqlLiterals {

    private SqlLiterals() {
    }

    /**
     * Escapes a value for use inside a single quoted string literal.
     */
    public static String escapeStringLiteral(final String value) {
        final StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\'':
                    sb.append("\\'");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String quote(final String value) {
        return "'" + escapeStringLiteral(value) + "'";
    }

    /**
     * Escapes a regular expression for use inside a raw string literal ({@code r'...'}).
     * Escape sequences are not processed in raw literals, so an escaped character reaches the
     * regex engine unchanged: existing escape pairs are kept as they are, an unescaped quote
     * becomes {@code \'} (a literal quote for RE2) and line breaks become {@code \n} / {@code \r}.
     * A dangling backslash at the end is doubled so it cannot swallow the closing quote.
     */
    public static String escapeRegexLiteral(final String regex) {
        final StringBuilder sb = new StringBuilder(regex.length() + 8);
        for (int i = 0; i < regex.length(); i++) {
            char c = regex.charAt(i);
            if (c == '\\') {
                if (i + 1 == regex.length()) {
                    sb.append("\\\\");
                } else {
                    char next = regex.charAt(++i);
                    sb.append('\\');
                    sb.append(escapeLineBreak(next));
                }
            } else if (c == '\'') {
                sb.append("\\'");
            } else if (c == '\n' || c == '\r') {
                sb.append('\\').append(escapeLineBreak(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static char escapeLineBreak(char c) {
        if (c == '\n') {
            return 'n';
        } else if (c == '\r') {
            return 'r';
        }
        return c;
    }

    public static String quoteRegex(final String regex) {
        return "r'" + escapeRegexLiteral(regex) + "'";
    }

    /**
     * Quotes a table path with backticks, escaping backticks and backslashes it contains.
     */
    public static String quoteIdentifier(final String identifier) {
        return "`" + identifier.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }
}
