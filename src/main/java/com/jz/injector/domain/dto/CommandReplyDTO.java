package com.jz.injector.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommandReplyDTO {
    private boolean success;
    private String message;
    private int interceptLevel;
    /** 命令执行过程中回发的文本 */
    private List<String> replies;
}
