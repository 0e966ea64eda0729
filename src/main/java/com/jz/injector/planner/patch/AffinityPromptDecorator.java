package com.jz.injector.planner.patch;

import com.jz.injector.affinity.AffinityRecord;
import com.jz.injector.affinity.AffinityRecordStore;
import com.jz.injector.planner.ActionInfo;
import com.jz.injector.planner.PlannerMessage;
import com.jz.injector.planner.PlannerPrompt;
import com.jz.injector.planner.PlannerPromptBuilder;
import com.jz.injector.planner.TargetPersonInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 包装宿主的 planner 提示词构建：先原样调用被包装的实现，
 * 再按私聊对象查缓存，命中则在提示词末尾追加一句好感度说明。
 * 未命中（或群聊无私聊对象）时输出与原实现完全一致。
 */
@Slf4j
public class AffinityPromptDecorator implements PlannerPromptBuilder {

    private static final String AFFINITY_TEMPLATE =
            "\n你对当前用户的好感度是%d，态度是%s，好感度越高，选择reply的概率越大。好感度>50则有75%%的概率reply。";

    private final PlannerPromptBuilder original;
    private final AffinityRecordStore store;

    public AffinityPromptDecorator(PlannerPromptBuilder original, AffinityRecordStore store) {
        if (original instanceof AffinityPromptDecorator) {
            throw new IllegalArgumentException("planner prompt builder is already decorated");
        }
        this.original = original;
        this.store = store;
    }

    @Override
    public PlannerPrompt build(String chatId,
                               TargetPersonInfo chatTargetInfo,
                               Map<String, ActionInfo> currentAvailableActions,
                               List<PlannerMessage> messageIdList,
                               String chatContentBlock,
                               String interest,
                               String promptKey) {
        PlannerPrompt result = original.build(chatId, chatTargetInfo, currentAvailableActions,
                messageIdList, chatContentBlock, interest, promptKey);

        if (chatTargetInfo == null || chatTargetInfo.getUserId() == null) {
            return result;
        }
        Optional<AffinityRecord> record = store.get(String.valueOf(chatTargetInfo.getUserId()));
        if (record.isEmpty()) {
            return result;
        }

        String prompt = result.getPrompt() + affinitySentence(record.get());
        log.info("成功为{}...注入好感度提示", abbreviate(chatId));
        return new PlannerPrompt(prompt, result.getMessageIdList());
    }

    public PlannerPromptBuilder getOriginal() {
        return original;
    }

    static String affinitySentence(AffinityRecord r) {
        return String.format(AFFINITY_TEMPLATE, r.getImpression(), r.getAttitude());
    }

    private static String abbreviate(String chatId) {
        if (chatId == null) return "";
        return chatId.length() <= 5 ? chatId : chatId.substring(0, 5);
    }
}
