package com.novelforge.model.fact;

/**
 * 角色移动到新地点
 */
public class LocationChangeFact extends CandidateFact {

    private final String characterKey;
    private final String locationKey;

    public LocationChangeFact(String characterKey, String locationKey,
                              Long sequence, boolean flashback, String evidence) {
        super(sequence, flashback, evidence);
        this.characterKey = characterKey;
        this.locationKey = locationKey;
    }

    @Override
    public FactKind getKind() {
        return FactKind.LOCATION_CHANGE;
    }

    @Override
    public String describe() {
        return "character:" + characterKey + " -> location:" + locationKey;
    }

    public String getCharacterKey() {
        return characterKey;
    }

    public String getLocationKey() {
        return locationKey;
    }
}
