/*
 * IRCTokenHandler.java
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

import java.nio.ByteBuffer;

/**
 * Receives every kind of token recognised by an {@link IRCParser}.
 *
 * <p>This is an alternative to binding the six callbacks individually:
 * {@link IRCParser#setHandler(IRCTokenHandler)} binds each of them to the
 * corresponding method here. Implementations override only the methods
 * for the tokens they are interested in.
 *
 * <p>The buffers passed to these methods follow the contract of
 * {@link IRCParser.Callback#token}: they are read-only views valid only
 * for the duration of the call. Each method returns 0 to continue parsing
 * or any other value to abort it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface IRCTokenHandler {

    /**
     * Called with the nick part of the message prefix.
     *
     * @param parser the parser
     * @param token the nick
     * @return 0 to continue, non-zero to abort
     */
    default int nick(IRCParser parser, ByteBuffer token) {
        return 0;
    }

    /**
     * Called with the user name part of the message prefix.
     *
     * @param parser the parser
     * @param token the user name
     * @return 0 to continue, non-zero to abort
     */
    default int name(IRCParser parser, ByteBuffer token) {
        return 0;
    }

    /**
     * Called with the host part of the message prefix.
     *
     * @param parser the parser
     * @param token the host
     * @return 0 to continue, non-zero to abort
     */
    default int host(IRCParser parser, ByteBuffer token) {
        return 0;
    }

    /**
     * Called with the command.
     *
     * @param parser the parser
     * @param token the command
     * @return 0 to continue, non-zero to abort
     */
    default int command(IRCParser parser, ByteBuffer token) {
        return 0;
    }

    /**
     * Called with each parameter, middle or trailing, in order.
     *
     * @param parser the parser
     * @param token the parameter
     * @return 0 to continue, non-zero to abort
     */
    default int param(IRCParser parser, ByteBuffer token) {
        return 0;
    }

    /**
     * Called when the CRLF terminating a message has been seen.
     *
     * @param parser the parser
     * @param token an empty buffer
     * @return 0 to continue, non-zero to abort
     */
    default int end(IRCParser parser, ByteBuffer token) {
        return 0;
    }

}
