package org.muma.mini.kv.command;

import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.protocol.*;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CommandDispatcherTest {

    private StorageEngine storage;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        dispatcher = new CommandDispatcher(storage);
    }

    // --- Helpers: build requests ---
    private RedisArray args(String... args) {
        RedisMessage[] msgs = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            msgs[i] = new BulkString(args[i]);
        }
        return new RedisArray(msgs);
    }

    private String asString(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof SimpleString s) return s.content();
        if (msg instanceof ErrorMessage e) return e.content();
        return null;
    }

    private long asLong(RedisMessage msg) {
        if (msg instanceof RedisInteger i) return i.value();
        throw new AssertionError("Not an integer: " + msg);
    }

    // Decode -> dispatch -> encode, as a connection does it
    private String roundTrip(String request) {
        RespParser parser = new RespParser(32, 1000, 1024, 1024);
        ParseResult parsed = parser.parse(Unpooled.wrappedBuffer(request.getBytes(StandardCharsets.UTF_8)));
        assertTrue(parsed.isComplete());
        RedisMessage response = dispatcher.dispatch(parsed.message());
        return new String(RespSerializer.encode(response), StandardCharsets.UTF_8);
    }

    @Test
    void testPingScenario() {
        assertEquals("+PONG\r\n", roundTrip("*1\r\n$4\r\nPING\r\n"));
    }

    @Test
    void testEchoScenario() {
        assertEquals("$3\r\nhey\r\n", roundTrip("*2\r\n$4\r\nECHO\r\n$3\r\nhey\r\n"));
    }

    @Test
    void testSetThenGetScenario() {
        assertEquals("+OK\r\n", roundTrip("*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"));
        assertEquals("$3\r\nbar\r\n", roundTrip("*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n"));
    }

    @Test
    void testGetMissingScenario() {
        assertEquals("$-1\r\n", roundTrip("*2\r\n$3\r\nGET\r\n$7\r\nmissing\r\n"));
    }

    @Test
    void testCommandNamesAreCaseInsensitive() {
        assertEquals(SimpleString.PONG, dispatcher.dispatch(args("pInG")));
        assertEquals(SimpleString.OK, dispatcher.dispatch(args("set", "k", "v")));
        assertEquals("v", asString(dispatcher.dispatch(args("GeT", "k"))));
    }

    @Test
    void testSimpleStringCommandName() {
        RedisArray request = RedisArray.of(new SimpleString("PING"));
        assertEquals(SimpleString.PONG, dispatcher.dispatch(request));
    }

    @Test
    void testPingWithArgumentEchoesIt() {
        assertEquals(new BulkString("hello"), dispatcher.dispatch(args("PING", "hello")));
        assertEquals("ERR wrong number of arguments for 'ping' command",
                asString(dispatcher.dispatch(args("PING", "a", "b"))));
    }

    @Test
    void testSetOverwrites() {
        dispatcher.dispatch(args("SET", "k", "v1"));
        dispatcher.dispatch(args("SET", "k", "v2"));
        assertEquals("v2", asString(dispatcher.dispatch(args("GET", "k"))));
        assertEquals(1, storage.size());
    }

    @Test
    void testUnexpectedCommandFormat() {
        String expected = "ERR unexpected command format";
        assertEquals(expected, asString(dispatcher.dispatch(new SimpleString("PING"))));
        assertEquals(expected, asString(dispatcher.dispatch(RedisArray.EMPTY)));
        assertEquals(expected, asString(dispatcher.dispatch(RedisArray.NULL)));
        assertEquals(expected, asString(dispatcher.dispatch(RedisArray.of(new RedisInteger(1)))));
        assertEquals(expected, asString(dispatcher.dispatch(RedisArray.of(BulkString.NULL))));
    }

    @Test
    void testUnknownCommandIsRecoverable() {
        assertEquals("ERR unknown command 'FLUSHALL'", asString(dispatcher.dispatch(args("FLUSHALL"))));
        // Line breaks in the echoed name would corrupt the reply
        assertEquals("ERR unknown command 'a  b'", asString(dispatcher.dispatch(args("a\r\nb"))));
        // Dispatcher keeps working
        assertEquals(SimpleString.PONG, dispatcher.dispatch(args("PING")));
    }

    @Test
    void testWrongArity() {
        assertEquals("ERR wrong number of arguments for 'echo' command", asString(dispatcher.dispatch(args("ECHO"))));
        assertEquals("ERR wrong number of arguments for 'get' command", asString(dispatcher.dispatch(args("GET"))));
        assertEquals("ERR wrong number of arguments for 'set' command", asString(dispatcher.dispatch(args("SET", "k"))));
        assertEquals("ERR syntax error", asString(dispatcher.dispatch(args("SET", "k", "v", "EX", "10"))));
    }

    @Test
    void testNonBulkArgumentIsRejected() {
        RedisArray request = RedisArray.of(new BulkString("SET"), new RedisInteger(1), new BulkString("v"));
        assertEquals("ERR wrong type of argument for 'set' command", asString(dispatcher.dispatch(request)));

        RedisArray nullKey = RedisArray.of(new BulkString("GET"), BulkString.NULL);
        assertEquals("ERR wrong type of argument for 'get' command", asString(dispatcher.dispatch(nullKey)));
        assertEquals(0, storage.size());
    }

    @Test
    void testBinaryValueIsStoredUnchanged() {
        byte[] value = {0x00, (byte) 0xfe, (byte) 0xff, '\r', '\n'};
        RedisArray set = RedisArray.of(new BulkString("SET"), new BulkString("bin"), new BulkString(value));
        dispatcher.dispatch(set);

        RedisMessage got = dispatcher.dispatch(args("GET", "bin"));
        assertArrayEquals(value, ((BulkString) got).content());
    }

    @Test
    void testDelExistsDbSize() {
        dispatcher.dispatch(args("SET", "a", "1"));
        dispatcher.dispatch(args("SET", "b", "2"));

        assertEquals(2, asLong(dispatcher.dispatch(args("DBSIZE"))));
        assertEquals(3, asLong(dispatcher.dispatch(args("EXISTS", "a", "a", "b", "nope"))));
        assertEquals(1, asLong(dispatcher.dispatch(args("DEL", "a", "nope"))));
        assertEquals(0, asLong(dispatcher.dispatch(args("EXISTS", "a"))));
        assertEquals(1, asLong(dispatcher.dispatch(args("DBSIZE"))));
        assertEquals("ERR wrong number of arguments for 'del' command", asString(dispatcher.dispatch(args("DEL"))));
    }

    @Test
    void testQuitRequestsClose() {
        RedisContext context = new RedisContext("test");
        assertEquals(SimpleString.OK, dispatcher.dispatch(args("QUIT"), context));
        assertTrue(context.isCloseRequested());
    }

    @Test
    void testCommandReturnsEmptyArray() {
        assertEquals(RedisArray.EMPTY, dispatcher.dispatch(args("COMMAND", "DOCS")));
    }

    @Test
    void testDelWithBadArgumentDeletesNothing() {
        dispatcher.dispatch(args("SET", "a", "1"));

        RedisArray request = RedisArray.of(new BulkString("DEL"), new BulkString("a"), new RedisInteger(1));
        assertEquals("ERR wrong type of argument for 'del' command", asString(dispatcher.dispatch(request)));
        assertEquals(1, asLong(dispatcher.dispatch(args("EXISTS", "a"))));

        RedisArray exists = RedisArray.of(new BulkString("EXISTS"), new BulkString("a"), BulkString.NULL);
        assertEquals("ERR wrong type of argument for 'exists' command", asString(dispatcher.dispatch(exists)));
    }

    @Test
    void testBinaryKeysStayDistinct() {
        BulkString ff = new BulkString(new byte[]{(byte) 0xff});
        BulkString fe = new BulkString(new byte[]{(byte) 0xfe});

        dispatcher.dispatch(RedisArray.of(new BulkString("SET"), ff, new BulkString("one")));

        assertEquals(BulkString.NULL, dispatcher.dispatch(RedisArray.of(new BulkString("GET"), fe)));
        assertEquals(new BulkString("one"), dispatcher.dispatch(RedisArray.of(new BulkString("GET"), ff)));

        dispatcher.dispatch(RedisArray.of(new BulkString("SET"), fe, new BulkString("two")));
        assertEquals(2, storage.size());
    }
}
