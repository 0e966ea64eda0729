package com.jz.injector.command;

import java.util.regex.Pattern;

/** 宿主命令解析器匹配到 {@link #pattern()} 后调用 {@link #execute} */
public interface PluginCommand {

    String commandName();

    String commandDescription();

    Pattern pattern();

    CommandResult execute(CommandInvocation invocation);
}
