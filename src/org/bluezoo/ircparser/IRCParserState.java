/*
 * IRCParserState.java
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
 * Position of an {@link IRCParser} within the IRC message grammar.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum IRCParserState {

    /** Start of a message, nothing examined yet. */
    INIT,

    /** Reading the nick of the prefix, after the leading colon. */
    NICK,

    /** Reading the user part of the prefix, after '!'. */
    NAME,

    /** Reading the host part of the prefix, after '@'. */
    HOST,

    /** Reading the command token. */
    COMMAND,

    /** Between or inside middle parameters. */
    PARAMS,

    /** Reading the trailing parameter, after " :". */
    TRAILING,

    /** Saw CR, waiting for the LF that ends the message. */
    END,

    /** A parse, length or user error occurred. Sticky until reset. */
    ERROR
}
