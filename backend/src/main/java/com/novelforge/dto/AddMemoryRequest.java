package com.novelforge.dto;

import com.novelforge.model.MemoryKind;
import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.util.Map;

/**
 * 新增记忆请求
 */
@Data
public class AddMemoryRequest {

    @NotNull(message = "kind不能为空")
    private MemoryKind kind;

    @NotBlank(message = "content不能为空")
    private String content;

    private Map<String, Object> metadata;

    /**
     * 可选，调用方已算好的向量
     */
    private float[] embedding;
}
