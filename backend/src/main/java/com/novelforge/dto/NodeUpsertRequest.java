package com.novelforge.dto;

import com.novelforge.model.NodeType;
import lombok.Data;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.util.Map;

/**
 * 节点写入请求；属性值为 null 表示删除该属性
 */
@Data
public class NodeUpsertRequest {

    @NotNull(message = "type不能为空")
    private NodeType type;

    @NotBlank(message = "key不能为空")
    private String key;

    private Map<String, Object> attributes;
}
