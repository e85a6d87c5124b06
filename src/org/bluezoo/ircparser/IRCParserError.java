/*
 * IRCParserError.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of ircparser, a reentrant IRC message tokenizer.
 * For more information please visit https://www.nongnu.org/gumdrop/
 *
 * ircparser is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ircparser is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with ircparser.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.ircparser;

/**
 * Error conditions reported by an {@link IRCParser}.
 *
 * <p>Each error other than {@link #NONE} has a diagnostic message taken
 * from the package resource bundle.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see IRCParser#getError()
 * @see IRCParser#getErrorString()
 */
public enum IRCParserError {

    /** No error. */
    NONE(null),

    /**
     * Grammar violation: a byte that is not allowed in the current token,
     * an empty prefix part or command, or a CR not followed by LF.
     */
    PARSE("err.parse"),

    /** The message exceeded the configured maximum length. */
    LENGTH("err.length"),

    /** A bound callback returned a non-zero value. */
    USER("err.user");

    private final String key;

    IRCParserError(String key) {
        this.key = key;
    }

    /**
     * Returns the diagnostic message for this error.
     *
     * @return the message, or null for {@link #NONE}
     */
    public String getMessage() {
        return (key == null) ? null : IRCParser.L10N.getString(key);
    }

}
