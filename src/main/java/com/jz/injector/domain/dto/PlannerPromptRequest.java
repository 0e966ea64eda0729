package com.jz.injector.domain.dto;

import com.jz.injector.planner.ActionInfo;
import com.jz.injector.planner.PlannerMessage;
import com.jz.injector.planner.TargetPersonInfo;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class PlannerPromptRequest {
    private String chatId;
    private TargetPersonInfo chatTargetInfo;
    private List<ActionInfo> availableActions = new ArrayList<>();
    private List<PlannerMessage> messageIdList = new ArrayList<>();
    private String chatContentBlock = "";
    private String interest = "";
    private String promptKey;
}
