package com.novelforge.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import java.util.Map;

/**
 * 关系写入请求，端点格式为 type:key
 */
@Data
public class EdgeRequest {

    @NotBlank(message = "source不能为空")
    private String source;

    @NotBlank(message = "target不能为空")
    private String target;

    @NotBlank(message = "relation不能为空")
    private String relation;

    private Map<String, Object> attributes;
}
