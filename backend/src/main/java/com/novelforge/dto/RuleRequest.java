package com.novelforge.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import java.util.List;

@Data
public class RuleRequest {

    @NotBlank(message = "key不能为空")
    private String key;

    @NotBlank(message = "description不能为空")
    private String description;

    /**
     * 规则禁止的动作
     */
    private List<String> forbiddenActions;
}
