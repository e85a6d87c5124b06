/*
 * IRCMessageCollectorTest.java
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

import org.junit.Before;
import org.junit.Test;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link IRCMessageCollector} and {@link IRCMessage}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class IRCMessageCollectorTest {

    private IRCParser parser;
    private IRCMessageCollector collector;
    private List<IRCMessage> messages;

    @Before
    public void setUp() {
        messages = new ArrayList<IRCMessage>();
        parser = new IRCParser();
        collector = new IRCMessageCollector(messages::add);
        parser.setHandler(collector);
    }

    private int execute(String data) {
        return parser.execute(ByteBuffer.wrap(data.getBytes(StandardCharsets.UTF_8)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Assembly
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testFullMessage() {
        execute(":alice!ally@example.org PRIVMSG #chan :hello world\r\n");

        assertEquals(1, messages.size());
        IRCMessage message = messages.get(0);
        assertTrue(message.hasPrefix());
        assertEquals("alice", message.getNick());
        assertEquals("ally", message.getUser());
        assertEquals("example.org", message.getHost());
        assertEquals("alice!ally@example.org", message.getPrefix());
        assertEquals("PRIVMSG", message.getCommand());
        assertEquals(Arrays.asList("#chan", "hello world"), message.getParams());
        assertEquals(2, message.getParamCount());
        assertEquals("#chan", message.getParam(0));
        assertEquals("hello world", message.getParam(1));
        assertNull(message.getParam(2));
        assertNull(message.getParam(-1));
    }

    @Test
    public void testNoPrefix() {
        execute("PING :irc.example.org\r\n");

        IRCMessage message = messages.get(0);
        assertFalse(message.hasPrefix());
        assertNull(message.getPrefix());
        assertNull(message.getNick());
        assertEquals("PING", message.getCommand());
        assertEquals("irc.example.org", message.getParam(0));
    }

    @Test
    public void testPartialPrefixes() {
        execute(":server.example.org NOTICE * :hi\r\n:bob@host QUIT\r\n");

        assertEquals("server.example.org", messages.get(0).getPrefix());
        assertNull(messages.get(0).getUser());
        assertNull(messages.get(0).getHost());
        assertEquals("bob@host", messages.get(1).getPrefix());
        assertNull(messages.get(1).getUser());
    }

    @Test
    public void testPrefixDoesNotLeakIntoNextMessage() {
        execute(":a!b@c PRIVMSG #x :hi\r\nPING :srv\r\n");

        assertEquals(2, messages.size());
        assertTrue(messages.get(0).hasPrefix());
        assertFalse(messages.get(1).hasPrefix());
        assertEquals(Arrays.asList("srv"), messages.get(1).getParams());
    }

    @Test
    public void testByteAtATime() {
        byte[] data = ":alice!ally@example.org PRIVMSG #chan :hello\r\nQUIT\r\n"
                .getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < data.length; i++) {
            assertEquals(1, parser.execute(data, i, 1));
        }

        assertEquals(2, messages.size());
        assertEquals("alice!ally@example.org", messages.get(0).getPrefix());
        assertEquals(Arrays.asList("#chan", "hello"), messages.get(0).getParams());
        assertEquals("QUIT", messages.get(1).getCommand());
    }

    @Test
    public void testParamsUnmodifiable() {
        execute("JOIN #chan\r\n");

        try {
            messages.get(0).getParams().add("x");
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    @Test
    public void testToString() {
        execute(":n!u@h CMD a\r\n");

        String s = messages.get(0).toString();
        assertTrue(s.contains("n!u@h"));
        assertTrue(s.contains("CMD"));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Decoding
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testUtf8Decoding() {
        execute("PRIVMSG #chan :héllo 世界\r\n");

        assertEquals("héllo 世界", messages.get(0).getParam(1));
    }

    @Test
    public void testUtf8SplitAcrossChunks() {
        byte[] data = "PRIVMSG #chan :é\r\n".getBytes(StandardCharsets.UTF_8);
        int split = data.length - 3; // between the two bytes of the e-acute
        parser.execute(data, 0, split);
        parser.execute(data, split, data.length - split);

        assertEquals("é", messages.get(0).getParam(1));
    }

    @Test
    public void testMalformedInputReplaced() {
        byte[] data = {'P', 'R', 'I', 'V', ' ', ':', (byte) 0xff, 'x', '\r', '\n'};
        parser.execute(data, 0, data.length);

        assertFalse(parser.hasError());
        assertEquals("\uFFFDx", messages.get(0).getParam(0));
    }

    @Test
    public void testLatin1Charset() {
        collector.setCharset(StandardCharsets.ISO_8859_1);
        assertEquals(StandardCharsets.ISO_8859_1, collector.getCharset());
        byte[] data = {'P', 'R', 'I', 'V', ' ', ':', (byte) 0xe9, '\r', '\n'};
        parser.execute(data, 0, data.length);

        assertEquals("é", messages.get(0).getParam(0));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Parameter limit
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testDefaultMaxParams() {
        assertEquals(IRCMessageCollector.DEFAULT_MAX_PARAMS, collector.getMaxParams());
        execute("CMD 1 2 3 4 5 6 7 8 9 10 11 12 13 14 :15\r\n");

        assertFalse(parser.hasError());
        assertEquals(15, messages.get(0).getParamCount());
    }

    @Test
    public void testTooManyParamsAborts() {
        collector.setMaxParams(2);
        execute("CMD a b c\r\n");

        assertTrue(parser.hasError());
        assertEquals(IRCParserError.USER, parser.getError());
        assertTrue(messages.isEmpty());

        parser.reset();
        collector.reset();
        execute("PING x\r\n");

        assertEquals(1, messages.size());
        assertEquals("PING", messages.get(0).getCommand());
        assertEquals(Arrays.asList("x"), messages.get(0).getParams());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveMaxParams() {
        collector.setMaxParams(0);
    }

    @Test(expected = NullPointerException.class)
    public void testNullHandler() {
        new IRCMessageCollector(null);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Recovery
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testResetDiscardsPartialMessage() {
        execute(":alice!a@h PRIVMSG #chan :hi\rX");
        assertTrue(parser.hasError());

        parser.reset();
        collector.reset();
        execute("QUIT\r\n");

        IRCMessage message = messages.get(0);
        assertFalse(message.hasPrefix());
        assertEquals("QUIT", message.getCommand());
        assertEquals(0, message.getParamCount());
    }

}
