package com.jz.injector.affinity;

import lombok.Value;

/**
 * 某个用户的好感度快照，创建后不再修改；刷新时整体替换。
 */
@Value
public class AffinityRecord {
    String userId;
    int impression;
    String attitude;
}
