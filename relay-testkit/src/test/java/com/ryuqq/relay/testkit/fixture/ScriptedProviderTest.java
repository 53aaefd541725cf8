package com.ryuqq.relay.testkit.fixture;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScriptedProviderTest {

    @Test
    void testCall_FollowsScriptThenRepeatsLastStep() throws Exception {
        IOException timeout = new IOException("timeout");
        ScriptedProvider<String, String> provider = ScriptedProvider.<String, String>create()
            .thenThrow(timeout)
            .thenReturn("ok");

        IOException thrown = assertThrows(IOException.class, () -> provider.call("a"));
        assertSame(timeout, thrown);
        assertEquals("ok", provider.call("b"));
        assertEquals("ok", provider.call("c"));

        assertEquals(3, provider.getCallCount());
        assertEquals(Arrays.asList("a", "b", "c"), provider.getPayloads());
    }

    @Test
    void testThenAnswer_ReceivesPayload() throws Exception {
        ScriptedProvider<String, Integer> provider = ScriptedProvider.<String, Integer>create()
            .thenAnswer(String::length);

        assertEquals(5, provider.call("hello"));
    }

    @Test
    void testGetPayloads_AllowsNullPayload() throws Exception {
        ScriptedProvider<String, String> provider = ScriptedProvider.alwaysReturning("ok");

        provider.call(null);

        assertEquals(Arrays.asList((String) null), provider.getPayloads());
    }

    @Test
    void testCall_WithoutSteps_Throws() {
        ScriptedProvider<String, String> provider = ScriptedProvider.create();

        assertThrows(IllegalStateException.class, () -> provider.call("a"));
    }
}
