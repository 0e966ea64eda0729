package com.jz.injector.handler;

import java.util.concurrent.CompletableFuture;

/**
 * 宿主消息管线上的挂载点。返回的 future 完成前，宿主可以继续处理其他消息。
 */
public interface MessageEventHandler {

    EventType eventType();

    String handlerName();

    String handlerDescription();

    /** 数值越大越先执行 */
    int weight();

    CompletableFuture<HandlerResult> execute(InboundMessage message);
}
