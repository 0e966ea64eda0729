package com.jz.injector.planner;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** planner 可选择的一个动作，如 reply / no_reply */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionInfo {
    private String name;
    private String description;
}
