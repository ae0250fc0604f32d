package com.novelforge.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import java.util.Map;

/**
 * 角色/地点设定请求
 */
@Data
public class CharacterRequest {

    @NotBlank(message = "key不能为空")
    private String key;

    private Map<String, Object> attributes;

    private String description;
}
