package com.novelforge.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;
import java.util.Map;

/**
 * 追加新版本请求
 */
@Data
public class UpdateMemoryRequest {

    @NotBlank(message = "content不能为空")
    private String content;

    /**
     * 合并到上一版本元数据上的变更
     */
    private Map<String, Object> metadataChanges;
}
