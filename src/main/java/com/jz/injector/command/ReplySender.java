package com.jz.injector.command;

/** 命令向当前聊天流回发文本 */
@FunctionalInterface
public interface ReplySender {

    /**
     * @param storageMessage 是否作为聊天记录保存
     */
    void sendText(String text, boolean storageMessage);
}
