package com.jz.injector.command;

import com.jz.injector.affinity.AffinityRecord;
import com.jz.injector.affinity.AffinityRecordStore;
import com.jz.injector.chat.ChatStreamDirectory;
import com.jz.injector.config.PlannerInjectorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * /debug [chatid]：查看发起人当前缓存的好感度，以及聊天流是否群聊。
 * 需要同时打开 plugin.enabled 和 plugin.user-debug。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DebugCommand implements PluginCommand {

    static final int INTERCEPT_LEVEL = 2;
    private static final Pattern PATTERN = Pattern.compile("^/debug( (?<chatid>\\w+))?$");

    private final AffinityRecordStore store;
    private final ChatStreamDirectory streams;
    private final PlannerInjectorProperties props;

    @Override
    public String commandName() {
        return "debug";
    }

    @Override
    public String commandDescription() {
        return "测试命令，用于调试";
    }

    @Override
    public Pattern pattern() {
        return PATTERN;
    }

    @Override
    public CommandResult execute(CommandInvocation inv) {
        PlannerInjectorProperties.Plugin plugin = props.getPlugin();
        if (!plugin.isUserDebug() || !plugin.isEnabled()) {
            return new CommandResult(false, "该功能已关闭", INTERCEPT_LEVEL);
        }

        String streamId = inv.group("chatid");
        if (streamId == null || streamId.isBlank()) {
            streamId = inv.getStreamId();
        }
        boolean groupChat = streams.isGroupChat(streamId);

        ReplySender out = inv.getReplySender();
        if (!groupChat) {
            AffinityRecord impression = store.get(inv.getUserId()).orElse(null);
            out.sendText("impression:" + impression, false);
        }
        out.sendText("is_group_chat:" + groupChat, false);
        log.debug("debug command, userId={}, streamId={}, group={}", inv.getUserId(), streamId, groupChat);
        return new CommandResult(true, "你输入的ID是：" + streamId, INTERCEPT_LEVEL);
    }
}
