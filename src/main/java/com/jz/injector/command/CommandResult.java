package com.jz.injector.command;

/**
 * 命令执行结果。
 *
 * @param success        是否执行成功
 * @param message        给宿主的状态说明
 * @param interceptLevel 拦截级别，2 表示拦截消息不再交给后续流程
 */
public record CommandResult(boolean success, String message, int interceptLevel) {
}
