package com.novelforge.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.common.exception.NovelMemoryException;
import com.novelforge.common.exception.ValidationException;
import com.novelforge.model.NodeRef;
import com.novelforge.model.NodeType;
import com.novelforge.model.fact.CandidateFact;
import com.novelforge.model.fact.CharacterStateFact;
import com.novelforge.model.fact.EventFact;
import com.novelforge.model.fact.FactKind;
import com.novelforge.model.fact.LocationChangeFact;
import com.novelforge.model.fact.RelationFact;
import com.novelforge.model.fact.RuleInvocationFact;
import com.novelforge.model.fact.UnrecognizedFact;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析抽取模型返回的 JSON 事实列表
 *
 * 支持 {"facts":[...]} 或直接数组，允许外层包裹 ```json 代码块；
 * 无法识别或缺少必要字段的事实解析为 UnrecognizedFact
 */
@Component
public class CandidateFactParser {

    private static final Logger logger = LoggerFactory.getLogger(CandidateFactParser.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public CandidateFactParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<CandidateFact> parse(String raw, long defaultSequence) {
        if (StringUtils.isBlank(raw)) {
            return Collections.emptyList();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripFence(raw));
        } catch (JsonProcessingException e) {
            throw new NovelMemoryException("抽取结果不是合法JSON: " + e.getOriginalMessage(), "EXTRACTION_ERROR", e);
        }
        JsonNode facts = root.isArray() ? root : root.path("facts");
        if (!facts.isArray()) {
            throw new NovelMemoryException("抽取结果缺少 facts 数组", "EXTRACTION_ERROR");
        }

        List<CandidateFact> result = new ArrayList<>();
        for (JsonNode node : facts) {
            result.add(parseFact(node, defaultSequence));
        }
        logger.debug("解析候选事实 {} 条", result.size());
        return result;
    }

    private CandidateFact parseFact(JsonNode node, long defaultSequence) {
        String rawKind = text(node, "kind");
        long sequence = node.hasNonNull("sequence") ? node.get("sequence").asLong() : defaultSequence;
        boolean flashback = node.path("flashback").asBoolean(false);
        String evidence = text(node, "evidence");

        FactKind kind = FactKind.fromLabel(rawKind);
        switch (kind) {
            case CHARACTER_STATE: {
                String character = text(node, "character");
                Map<String, Object> attributes = map(node.get("attributes"));
                if (character == null || attributes.isEmpty()) {
                    break;
                }
                return new CharacterStateFact(character, attributes, sequence, flashback, evidence);
            }
            case LOCATION_CHANGE: {
                String character = text(node, "character");
                String location = text(node, "location");
                if (character == null || location == null) {
                    break;
                }
                return new LocationChangeFact(character, location, sequence, flashback, evidence);
            }
            case RULE_INVOCATION: {
                String rule = text(node, "rule");
                if (rule == null) {
                    break;
                }
                return new RuleInvocationFact(rule, text(node, "actor"), text(node, "action"),
                    sequence, flashback, evidence);
            }
            case EVENT: {
                String key = text(node, "key");
                String type = text(node, "type");
                if (key == null || type == null) {
                    break;
                }
                List<String> participants = new ArrayList<>();
                node.path("participants").forEach(p -> participants.add(p.asText()));
                return new EventFact(key, type, participants, text(node, "subject"), text(node, "location"),
                    text(node, "description"), sequence, flashback, evidence);
            }
            case RELATION: {
                String source = text(node, "source");
                String target = text(node, "target");
                String relation = text(node, "relation");
                if (source == null || target == null || relation == null) {
                    break;
                }
                try {
                    return new RelationFact(toRef(source), toRef(target), relation, map(node.get("attributes")),
                        sequence, flashback, evidence);
                } catch (ValidationException e) {
                    logger.warn("关系端点无法解析，按未识别事实处理: source={}, target={}, reason={}",
                        source, target, e.getMessage());
                    break;
                }
            }
            default:
                break;
        }
        return new UnrecognizedFact(rawKind, map(node), evidence);
    }

    /**
     * 未带类型前缀的端点按角色处理
     */
    private NodeRef toRef(String value) {
        if (NodeRef.isQualified(value)) {
            return NodeRef.parse(value);
        }
        return NodeRef.of(NodeType.CHARACTER, value);
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return StringUtils.isBlank(text) ? null : text.trim();
    }

    private Map<String, Object> map(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private String stripFence(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int lastFence = text.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                text = text.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return text;
    }
}
