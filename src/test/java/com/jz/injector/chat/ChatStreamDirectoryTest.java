package com.jz.injector.chat;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatStreamDirectoryTest {

    @Test
    void shouldTreatUnknownStreamsAsPrivate() {
        ChatStreamDirectory d = new ChatStreamDirectory();

        assertFalse(d.isGroupChat("nope"));
        assertFalse(d.isGroupChat(null));
    }

    @Test
    void shouldRememberLatestClassification() {
        ChatStreamDirectory d = new ChatStreamDirectory();
        d.register("s1", true);
        d.register("", true);

        assertTrue(d.isGroupChat("s1"));
        d.register("s1", false);
        assertFalse(d.isGroupChat("s1"));
    }

    @Test
    void shouldEvictLeastRecentlyUsedStreamBeyondCapacity() {
        ChatStreamDirectory d = new ChatStreamDirectory(2);
        d.register("s1", true);
        d.register("s2", true);
        assertTrue(d.isGroupChat("s1"));

        d.register("s3", true);

        assertEquals(2, d.size());
        assertTrue(d.isGroupChat("s1"));
        assertTrue(d.isGroupChat("s3"));
        assertFalse(d.isGroupChat("s2"));
    }
}
