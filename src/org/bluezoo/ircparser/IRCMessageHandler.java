/*
 * IRCMessageHandler.java
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
 * Receives complete messages from an {@link IRCMessageCollector}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
@FunctionalInterface
public interface IRCMessageHandler {

    /**
     * Called when a complete message has been received.
     *
     * @param message the message
     */
    void messageReceived(IRCMessage message);

}
