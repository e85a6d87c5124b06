/*
 * IRCMessageCollector.java
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
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assembles parser tokens into {@link IRCMessage} objects.
 *
 * <p>Each token is decoded as it arrives, so nothing refers to the
 * parser's buffers once the callback returns. Malformed or unmappable
 * byte sequences are replaced with the charset's replacement string.
 *
 * <pre>
 * IRCParser parser = new IRCParser();
 * IRCMessageCollector collector = new IRCMessageCollector(message -&gt; {
 *     if ("PING".equals(message.getCommand())) {
 *         pong(message.getParam(0));
 *     }
 * });
 * parser.setHandler(collector);
 * </pre>
 *
 * <p>After recovering the parser from an error with
 * {@link IRCParser#reset()}, call {@link #reset()} here as well to discard
 * the tokens of the failed message.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class IRCMessageCollector implements IRCTokenHandler {

    private static final Logger LOGGER =
            Logger.getLogger(IRCMessageCollector.class.getName());

    /**
     * Maximum number of parameters defined by RFC 2812.
     */
    public static final int DEFAULT_MAX_PARAMS = 15;

    private final IRCMessageHandler handler;
    private Charset charset = StandardCharsets.UTF_8;
    private int maxParams = DEFAULT_MAX_PARAMS;

    private String nick;
    private String user;
    private String host;
    private String command;
    private final List<String> params = new ArrayList<String>();

    /**
     * Creates a collector delivering messages to the specified handler.
     *
     * @param handler the message handler
     */
    public IRCMessageCollector(IRCMessageHandler handler) {
        if (handler == null) {
            throw new NullPointerException("handler");
        }
        this.handler = handler;
    }

    /**
     * Returns the charset used to decode tokens.
     *
     * @return the charset
     */
    public Charset getCharset() {
        return charset;
    }

    /**
     * Sets the charset used to decode tokens. The default is UTF-8.
     *
     * @param charset the charset
     */
    public void setCharset(Charset charset) {
        if (charset == null) {
            throw new NullPointerException("charset");
        }
        this.charset = charset;
    }

    /**
     * Returns the maximum number of parameters accepted in a message.
     *
     * @return the maximum parameter count
     */
    public int getMaxParams() {
        return maxParams;
    }

    /**
     * Sets the maximum number of parameters accepted in a message.
     * A message with more parameters aborts parsing with
     * {@link IRCParserError#USER}.
     *
     * @param maxParams the maximum parameter count
     * @throws IllegalArgumentException if maxParams is not positive
     */
    public void setMaxParams(int maxParams) {
        if (maxParams <= 0) {
            String msg = MessageFormat.format(IRCParser.L10N.getString("err.bad_max_params"), maxParams);
            throw new IllegalArgumentException(msg);
        }
        this.maxParams = maxParams;
    }

    /**
     * Discards any partially assembled message.
     */
    public void reset() {
        nick = null;
        user = null;
        host = null;
        command = null;
        params.clear();
    }

    @Override
    public int nick(IRCParser parser, ByteBuffer token) {
        nick = decode(token);
        return 0;
    }

    @Override
    public int name(IRCParser parser, ByteBuffer token) {
        user = decode(token);
        return 0;
    }

    @Override
    public int host(IRCParser parser, ByteBuffer token) {
        host = decode(token);
        return 0;
    }

    @Override
    public int command(IRCParser parser, ByteBuffer token) {
        command = decode(token);
        return 0;
    }

    @Override
    public int param(IRCParser parser, ByteBuffer token) {
        if (params.size() >= maxParams) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(IRCParser.L10N.getString("log.too_many_params"), maxParams);
                LOGGER.fine(msg);
            }
            return 1;
        }
        params.add(decode(token));
        return 0;
    }

    @Override
    public int end(IRCParser parser, ByteBuffer token) {
        IRCMessage message = new IRCMessage(nick, user, host, command, params);
        reset();
        handler.messageReceived(message);
        return 0;
    }

    private String decode(ByteBuffer token) {
        return charset.decode(token).toString();
    }

}
