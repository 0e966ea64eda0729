package com.jz.injector.chat;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 记录聊天流是群聊还是私聊，供调试命令判断。没见过的流按私聊处理。
 * 最多保留 {@link #DEFAULT_CAPACITY} 个流，超出时淘汰最久未访问的。
 */
@Component
public class ChatStreamDirectory {

    static final int DEFAULT_CAPACITY = 10_000;

    private final Map<String, Boolean> groupByStream;

    public ChatStreamDirectory() {
        this(DEFAULT_CAPACITY);
    }

    ChatStreamDirectory(int capacity) {
        int max = Math.max(1, capacity);
        this.groupByStream = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > max;
            }
        };
    }

    public synchronized void register(String streamId, boolean groupChat) {
        if (streamId == null || streamId.isBlank()) return;
        groupByStream.put(streamId, groupChat);
    }

    public synchronized boolean isGroupChat(String streamId) {
        if (streamId == null) return false;
        return groupByStream.getOrDefault(streamId, Boolean.FALSE);
    }

    synchronized int size() {
        return groupByStream.size();
    }
}
