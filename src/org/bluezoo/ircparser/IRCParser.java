/*
 * IRCParser.java
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
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reentrant push-parser for CRLF-terminated IRC messages.
 *
 * <p>The parser is fed raw bytes in arbitrarily sized chunks through
 * {@link #execute(ByteBuffer)}. As it recognises the parts of a message
 * it invokes the bound callbacks:
 * <pre>
 * [':' nick ['!' name] ['@' host] SPACE] command [SPACE param]* [SPACE ':' trailing] CR LF
 * </pre>
 * Middle and trailing parameters are both delivered to the param callback.
 * When the LF of the terminator is seen the end callback is invoked and the
 * parser re-arms itself for the next message.
 *
 * <h3>Usage</h3>
 * <pre>
 * IRCParser parser = new IRCParser();
 * parser.onCommand((p, token) -&gt; {
 *     // token is a read-only view of the command bytes
 *     return 0;
 * });
 * parser.onParam(this::param);
 * parser.onEnd(this::messageEnd);
 *
 * public void receive(ByteBuffer data) {
 *     parser.execute(data);
 *     if (parser.hasError()) {
 *         LOGGER.warning(parser.getErrorString());
 *         parser.reset();
 *     }
 * }
 * </pre>
 *
 * <h3>Buffer Contract</h3>
 * <p>The input buffer must be in read mode. After {@link #execute} returns
 * the buffer's position has advanced past the consumed bytes. A token
 * buffer passed to a callback is a read-only view with position at the
 * start of the token and limit at its end; it is only valid until the
 * callback returns. Tokens lying wholly within the current chunk are views
 * of the caller's buffer. A token that began in an earlier chunk is a view
 * of the parser's internal storage, which retains the bytes of the message
 * in progress.
 *
 * <h3>Errors</h3>
 * <p>Errors are reported by result rather than by exception. If
 * {@link #execute} returns less than the number of bytes supplied, the
 * parser is in the {@link IRCParserState#ERROR ERROR} state and the byte
 * at the returned offset caused it. The error state is sticky: further
 * calls consume nothing until {@link #reset()} is called.
 *
 * <p>Instances are not thread-safe. Use one parser per stream.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see IRCTokenHandler
 */
public class IRCParser {

    static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.ircparser.L10N");

    private static final Logger LOGGER =
            Logger.getLogger(IRCParser.class.getName());

    /**
     * Maximum message length, excluding CRLF, defined by RFC 1459.
     */
    public static final int DEFAULT_MAX_LENGTH = 512;

    private static final byte CR = (byte) '\r';
    private static final byte LF = (byte) '\n';
    private static final byte SPACE = (byte) ' ';
    private static final byte COLON = (byte) ':';
    private static final byte BANG = (byte) '!';
    private static final byte AT = (byte) '@';
    private static final byte NUL = (byte) 0;

    /**
     * Receives a token recognised by the parser.
     */
    @FunctionalInterface
    public interface Callback {

        /**
         * Called when a token has been recognised.
         *
         * <p>The buffer is a read-only view positioned at the start of the
         * token with its limit at the end. It must not be retained after
         * this method returns.
         *
         * @param parser the parser invoking the callback
         * @param token the token bytes
         * @return 0 to continue parsing, any other value to abort
         */
        int token(IRCParser parser, ByteBuffer token);
    }

    private final int maxLength;
    private final byte[] raw;
    private final ByteBuffer rawView;

    private IRCParserState state;
    private IRCParserError error;
    private int length;
    private int last;
    private int mark; // message offset of current token start, -1 if none

    private Callback nickCallback;
    private Callback nameCallback;
    private Callback hostCallback;
    private Callback commandCallback;
    private Callback paramCallback;
    private Callback endCallback;

    // Only set during execute
    private ByteBuffer source;
    private ByteBuffer view;
    private int chunkStart;
    private int origin;

    /**
     * Creates a parser accepting messages of up to
     * {@value #DEFAULT_MAX_LENGTH} bytes.
     */
    public IRCParser() {
        this(DEFAULT_MAX_LENGTH);
    }

    /**
     * Creates a parser with the specified maximum message length.
     *
     * @param maxLength the maximum number of bytes in a message,
     *        excluding the CRLF terminator
     * @throws IllegalArgumentException if maxLength is not positive
     */
    public IRCParser(int maxLength) {
        if (maxLength <= 0) {
            String msg = MessageFormat.format(L10N.getString("err.bad_max_length"), maxLength);
            throw new IllegalArgumentException(msg);
        }
        this.maxLength = maxLength;
        raw = new byte[maxLength];
        rawView = ByteBuffer.wrap(raw).asReadOnlyBuffer();
        init();
    }

    /**
     * Returns to the initial state and unbinds all callbacks.
     */
    public void init() {
        nickCallback = null;
        nameCallback = null;
        hostCallback = null;
        commandCallback = null;
        paramCallback = null;
        endCallback = null;
        reset();
    }

    /**
     * Discards the message in progress and clears any error, keeping the
     * bound callbacks. Use this to recover from the error state.
     */
    public void reset() {
        Arrays.fill(raw, 0, length, (byte) 0);
        state = IRCParserState.INIT;
        error = IRCParserError.NONE;
        length = 0;
        last = 0;
        mark = -1;
    }

    // -- Callback binding --

    /**
     * Binds the callback for the nick part of the prefix.
     *
     * @param callback the callback, or null to unbind
     */
    public void onNick(Callback callback) {
        nickCallback = callback;
    }

    /**
     * Binds the callback for the user name part of the prefix.
     *
     * @param callback the callback, or null to unbind
     */
    public void onName(Callback callback) {
        nameCallback = callback;
    }

    /**
     * Binds the callback for the host part of the prefix.
     *
     * @param callback the callback, or null to unbind
     */
    public void onHost(Callback callback) {
        hostCallback = callback;
    }

    /**
     * Binds the callback for the command.
     *
     * @param callback the callback, or null to unbind
     */
    public void onCommand(Callback callback) {
        commandCallback = callback;
    }

    /**
     * Binds the callback for each middle or trailing parameter.
     *
     * @param callback the callback, or null to unbind
     */
    public void onParam(Callback callback) {
        paramCallback = callback;
    }

    /**
     * Binds the callback for the end of a message. The token passed to
     * this callback is always empty.
     *
     * @param callback the callback, or null to unbind
     */
    public void onEnd(Callback callback) {
        endCallback = callback;
    }

    /**
     * Binds all six callbacks to the given handler.
     *
     * @param handler the handler, or null to unbind all callbacks
     */
    public void setHandler(IRCTokenHandler handler) {
        if (handler == null) {
            nickCallback = null;
            nameCallback = null;
            hostCallback = null;
            commandCallback = null;
            paramCallback = null;
            endCallback = null;
            return;
        }
        nickCallback = handler::nick;
        nameCallback = handler::name;
        hostCallback = handler::host;
        commandCallback = handler::command;
        paramCallback = handler::param;
        endCallback = handler::end;
    }

    // -- Status --

    /**
     * Returns true if the parser is in the error state.
     *
     * @return true if an error occurred
     */
    public boolean hasError() {
        return state == IRCParserState.ERROR;
    }

    /**
     * Returns the current error.
     *
     * @return the error, {@link IRCParserError#NONE} if none
     */
    public IRCParserError getError() {
        return error;
    }

    /**
     * Returns the diagnostic message for the current error.
     *
     * @return the message, or null if there is no error
     */
    public String getErrorString() {
        return error.getMessage();
    }

    /**
     * Returns the current position in the grammar.
     *
     * @return the parser state
     */
    public IRCParserState getState() {
        return state;
    }

    /**
     * Returns the number of bytes of the message in progress,
     * excluding any terminator bytes seen.
     *
     * @return the accumulated message length
     */
    public int getLength() {
        return length;
    }

    /**
     * Returns the maximum message length.
     *
     * @return the maximum length in bytes, excluding CRLF
     */
    public int getMaxLength() {
        return maxLength;
    }

    // -- Parsing --

    /**
     * Parses the specified region of a byte array.
     *
     * @param data the data
     * @param offset the offset of the first byte to parse
     * @param length the number of bytes to parse
     * @return the number of bytes consumed
     * @throws IndexOutOfBoundsException if the region is out of bounds
     * @see #execute(ByteBuffer)
     */
    public int execute(byte[] data, int offset, int length) {
        if (offset < 0 || length < 0 || offset > data.length - length) {
            String msg = MessageFormat.format(L10N.getString("err.bad_range"),
                    offset, length, data.length);
            throw new IndexOutOfBoundsException(msg);
        }
        return execute(ByteBuffer.wrap(data, offset, length));
    }

    /**
     * Parses the remaining bytes of the buffer, invoking callbacks as
     * tokens are recognised.
     *
     * <p>On return the buffer's position has advanced by the number of
     * bytes consumed. If that is less than the number of bytes remaining
     * on entry, the parser is in the error state.
     *
     * @param data the data in read mode
     * @return the number of bytes consumed
     */
    public int execute(ByteBuffer data) {
        if (state == IRCParserState.ERROR) {
            return 0;
        }
        int start = data.position();
        int end = data.limit();
        source = data;
        chunkStart = start;
        origin = start - length;
        try {
            for (int pos = start; pos < end; pos++) {
                byte c = data.get(pos);
                if (!step(c, pos - origin)) {
                    data.position(pos);
                    return pos - start;
                }
                if (state == IRCParserState.INIT) {
                    // message complete, the next byte starts a new one
                    origin = pos + 1;
                }
                last = c;
            }
        } finally {
            source = null;
            view = null;
        }
        data.position(end);
        return end - start;
    }

    /**
     * Examines one byte.
     *
     * @param c the byte
     * @param offset the offset of the byte within the current message
     * @return false if the parser entered the error state
     */
    private boolean step(byte c, int offset) {
        if (state != IRCParserState.END && c != CR) {
            if (length >= maxLength) {
                return fail(IRCParserError.LENGTH, offset);
            }
            raw[length++] = c;
        }
        switch (state) {
            case INIT:
                if (c == COLON) {
                    state = IRCParserState.NICK;
                    mark = offset + 1;
                    return true;
                }
                state = IRCParserState.COMMAND;
                mark = offset;
                // fall through
            case COMMAND:
                if (c == SPACE || c == CR) {
                    if (offset == mark) {
                        return fail(IRCParserError.PARSE, offset);
                    }
                    if (!emit(commandCallback, mark, offset)) {
                        return false;
                    }
                    mark = -1;
                    state = (c == SPACE) ? IRCParserState.PARAMS : IRCParserState.END;
                    return true;
                }
                return isControl(c) ? fail(IRCParserError.PARSE, offset) : true;
            case NICK:
                if (c == BANG || c == AT || c == SPACE) {
                    if (!endPrefixPart(nickCallback, offset)) {
                        return false;
                    }
                    if (c == BANG) {
                        state = IRCParserState.NAME;
                    } else if (c == AT) {
                        state = IRCParserState.HOST;
                    } else {
                        state = IRCParserState.COMMAND;
                    }
                    return true;
                }
                return isControl(c) ? fail(IRCParserError.PARSE, offset) : true;
            case NAME:
                if (c == AT || c == SPACE) {
                    if (!endPrefixPart(nameCallback, offset)) {
                        return false;
                    }
                    state = (c == AT) ? IRCParserState.HOST : IRCParserState.COMMAND;
                    return true;
                }
                return isControl(c) ? fail(IRCParserError.PARSE, offset) : true;
            case HOST:
                if (c == SPACE) {
                    if (!endPrefixPart(hostCallback, offset)) {
                        return false;
                    }
                    state = IRCParserState.COMMAND;
                    return true;
                }
                return isControl(c) ? fail(IRCParserError.PARSE, offset) : true;
            case PARAMS:
                if (c == SPACE || c == CR) {
                    if (mark >= 0) {
                        if (!emit(paramCallback, mark, offset)) {
                            return false;
                        }
                        mark = -1;
                    }
                    if (c == CR) {
                        state = IRCParserState.END;
                    }
                    return true;
                }
                if (c == NUL || c == LF) {
                    return fail(IRCParserError.PARSE, offset);
                }
                if (mark < 0) {
                    if (c == COLON) {
                        state = IRCParserState.TRAILING;
                        mark = offset + 1;
                    } else {
                        mark = offset;
                    }
                }
                return true;
            case TRAILING:
                if (c == CR) {
                    // may be empty
                    if (!emit(paramCallback, mark, offset)) {
                        return false;
                    }
                    mark = -1;
                    state = IRCParserState.END;
                    return true;
                }
                return (c == NUL || c == LF) ? fail(IRCParserError.PARSE, offset) : true;
            case END:
                if (c != LF || last != CR) {
                    return fail(IRCParserError.PARSE, offset);
                }
                if (!emit(endCallback, offset, offset)) {
                    return false;
                }
                state = IRCParserState.INIT;
                length = 0;
                mark = -1;
                return true;
            default:
                return fail(IRCParserError.PARSE, offset);
        }
    }

    /**
     * Ends a nick, name or host token at the specified delimiter.
     * The next token starts after the delimiter.
     */
    private boolean endPrefixPart(Callback callback, int offset) {
        if (offset == mark) {
            return fail(IRCParserError.PARSE, offset);
        }
        if (!emit(callback, mark, offset)) {
            return false;
        }
        mark = offset + 1;
        return true;
    }

    /**
     * Delivers the token between the given message offsets to a callback.
     */
    private boolean emit(Callback callback, int from, int to) {
        if (callback == null) {
            return true;
        }
        ByteBuffer token;
        if (origin + from >= chunkStart) {
            if (view == null) {
                view = source.asReadOnlyBuffer();
            }
            token = view;
            token.clear();
            token.position(origin + from);
            token.limit(origin + to);
        } else {
            // began in an earlier chunk
            token = rawView;
            token.clear();
            token.position(from);
            token.limit(to);
        }
        if (callback.token(this, token) != 0) {
            return fail(IRCParserError.USER, to);
        }
        return true;
    }

    private boolean fail(IRCParserError err, int offset) {
        state = IRCParserState.ERROR;
        error = err;
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("log.error"),
                    offset, err.getMessage());
            LOGGER.fine(msg);
        }
        return false;
    }

    private static boolean isControl(byte c) {
        return (c >= 0 && c < 0x20) || c == 0x7f;
    }

}
