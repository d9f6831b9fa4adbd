package org.muma.mini.kv.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Store failures and rejected requests, checked against a mocked store.
 */
class CommandFailureTest {

    private StorageEngine storage;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        storage = mock(StorageEngine.class);
        dispatcher = new CommandDispatcher(storage);
    }

    @Test
    void testRejectedRequestsNeverTouchTheStore() {
        dispatcher.dispatch(RedisArray.of(new BulkString("SET"), new BulkString("k")));
        dispatcher.dispatch(RedisArray.of(new BulkString("SET"), new BulkString("k"), new RedisInteger(3)));
        dispatcher.dispatch(RedisArray.of(new BulkString("GET"), new SimpleString("k")));
        dispatcher.dispatch(RedisArray.of(new BulkString("NOPE"), new BulkString("k")));
        // A bad argument after valid keys still leaves the store alone
        dispatcher.dispatch(RedisArray.of(new BulkString("DEL"), new BulkString("a"), new RedisInteger(1)));
        dispatcher.dispatch(RedisArray.of(new BulkString("EXISTS"), new BulkString("a"), BulkString.NULL));

        verifyNoInteractions(storage);
    }

    @Test
    void testStoreFailureBecomesErrorReply() {
        when(storage.get("boom")).thenThrow(new IllegalStateException("disk on fire"));

        RedisMessage response = dispatcher.dispatch(RedisArray.of(new BulkString("GET"), new BulkString("boom")));
        assertEquals(new ErrorMessage("ERR internal server error"), response);
    }

    @Test
    void testGetDelegatesToStore() {
        when(storage.get("k")).thenReturn(Optional.of(new byte[]{'v'}));

        RedisMessage response = dispatcher.dispatch(RedisArray.of(new BulkString("GET"), new BulkString("k")));
        assertEquals(new BulkString("v"), response);
        verify(storage).get("k");
    }
}
