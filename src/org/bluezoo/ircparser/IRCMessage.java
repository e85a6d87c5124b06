/*
 * IRCMessage.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An IRC message assembled from parser tokens by an
 * {@link IRCMessageCollector}.
 *
 * <p>The prefix parts are null when absent. Middle and trailing parameters
 * appear in the parameter list in the order they were received.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class IRCMessage {

    private final String nick;
    private final String user;
    private final String host;
    private final String command;
    private final List<String> params;

    IRCMessage(String nick, String user, String host, String command, List<String> params) {
        this.nick = nick;
        this.user = user;
        this.host = host;
        this.command = command;
        this.params = Collections.unmodifiableList(new ArrayList<String>(params));
    }

    /**
     * Returns true if the message had a prefix.
     *
     * @return true if a nick was present
     */
    public boolean hasPrefix() {
        return nick != null;
    }

    /**
     * Returns the prefix in the form {@code nick[!user][@host]}.
     *
     * @return the prefix, or null if the message had none
     */
    public String getPrefix() {
        if (nick == null) {
            return null;
        }
        StringBuilder buf = new StringBuilder(nick);
        if (user != null) {
            buf.append('!').append(user);
        }
        if (host != null) {
            buf.append('@').append(host);
        }
        return buf.toString();
    }

    /**
     * Returns the nick (or server name) of the prefix.
     *
     * @return the nick, or null
     */
    public String getNick() {
        return nick;
    }

    /**
     * Returns the user name of the prefix.
     *
     * @return the user name, or null
     */
    public String getUser() {
        return user;
    }

    /**
     * Returns the host of the prefix.
     *
     * @return the host, or null
     */
    public String getHost() {
        return host;
    }

    /**
     * Returns the command, as received.
     *
     * @return the command or numeric reply code
     */
    public String getCommand() {
        return command;
    }

    /**
     * Returns the parameters.
     *
     * @return an unmodifiable list of parameters
     */
    public List<String> getParams() {
        return params;
    }

    /**
     * Returns the number of parameters.
     *
     * @return the parameter count
     */
    public int getParamCount() {
        return params.size();
    }

    /**
     * Returns the parameter at the specified index.
     *
     * @param index the parameter index
     * @return the parameter, or null if there is no such parameter
     */
    public String getParam(int index) {
        return (index >= 0 && index < params.size()) ? params.get(index) : null;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("IRCMessage[");
        if (nick != null) {
            buf.append("prefix=").append(getPrefix()).append(", ");
        }
        buf.append("command=").append(command);
        buf.append(", params=").append(params);
        buf.append(']');
        return buf.toString();
    }

}
