package com.jz.injector.handler;

/** 宿主在消息管线中开放的事件点 */
public enum EventType {
    ON_MESSAGE
}
