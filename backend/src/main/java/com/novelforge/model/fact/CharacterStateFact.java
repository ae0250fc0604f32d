package com.novelforge.model.fact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 角色状态变化，例如 alive=false、realm=筑基
 */
public class CharacterStateFact extends CandidateFact {

    private final String characterKey;
    private final Map<String, Object> attributes;

    public CharacterStateFact(String characterKey, Map<String, Object> attributes,
                              Long sequence, boolean flashback, String evidence) {
        super(sequence, flashback, evidence);
        this.characterKey = characterKey;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public FactKind getKind() {
        return FactKind.CHARACTER_STATE;
    }

    @Override
    public String describe() {
        return "character:" + characterKey + " " + attributes;
    }

    public String getCharacterKey() {
        return characterKey;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }
}
