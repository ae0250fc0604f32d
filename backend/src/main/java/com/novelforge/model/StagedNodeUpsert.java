package com.novelforge.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * 待提交的节点写入
 *
 * baseVersion 为请求开始快照中该节点的版本，节点不存在时为 null
 */
@Data
@AllArgsConstructor
public class StagedNodeUpsert {

    private NodeRef ref;

    private Map<String, Object> attributes;

    private Integer baseVersion;
}
