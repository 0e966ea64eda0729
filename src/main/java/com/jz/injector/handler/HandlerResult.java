package com.jz.injector.handler;

/**
 * 事件处理结果。
 *
 * @param success            本处理器是否执行成功
 * @param continueProcessing 是否继续后续处理器/主流程
 */
public record HandlerResult(boolean success, boolean continueProcessing) {

    public static HandlerResult proceed() {
        return new HandlerResult(true, true);
    }
}
