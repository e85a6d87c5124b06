/*
 * package-info.java
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

/**
 * Reentrant, incremental tokenizer for IRC protocol messages.
 *
 * <p>An {@link org.bluezoo.ircparser.IRCParser} holds all of its progress
 * in explicit fields, so a stream can be fed to it in chunks of any size
 * and alignment as they arrive from the network. Tokens are delivered to
 * callbacks as soon as their end is seen.
 *
 * <h2>Message Grammar</h2>
 *
 * <table border="1" cellpadding="5">
 *   <caption>Message parts</caption>
 *   <tr><th>Part</th><th>Syntax</th><th>Callback</th></tr>
 *   <tr><td>Nick</td><td>{@code :nick}</td><td>{@code onNick}</td></tr>
 *   <tr><td>User name</td><td>{@code !user}</td><td>{@code onName}</td></tr>
 *   <tr><td>Host</td><td>{@code @host}</td><td>{@code onHost}</td></tr>
 *   <tr><td>Command</td><td>{@code PRIVMSG}, {@code 001}</td><td>{@code onCommand}</td></tr>
 *   <tr><td>Middle parameter</td><td>{@code #channel}</td><td>{@code onParam}</td></tr>
 *   <tr><td>Trailing parameter</td><td>{@code :hello world}</td><td>{@code onParam}</td></tr>
 *   <tr><td>Terminator</td><td>{@code CR LF}</td><td>{@code onEnd}</td></tr>
 * </table>
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.ircparser.IRCParser} - The state machine and its context</li>
 *   <li>{@link org.bluezoo.ircparser.IRCParserState} - Positions in the grammar</li>
 *   <li>{@link org.bluezoo.ircparser.IRCParserError} - Error kinds and diagnostics</li>
 *   <li>{@link org.bluezoo.ircparser.IRCTokenHandler} - Handler for all token kinds</li>
 *   <li>{@link org.bluezoo.ircparser.IRCMessageCollector} - Assembles tokens into messages</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Parsers and collectors are not thread-safe and should be used from a
 * single thread (typically the thread reading the connection). Separate
 * instances share no mutable state.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see <a href="https://www.rfc-editor.org/rfc/rfc1459#section-2.3.1">RFC 1459 Message format</a>
 */
package org.bluezoo.ircparser;
