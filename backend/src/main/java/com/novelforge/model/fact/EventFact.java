package com.novelforge.model.fact;

import java.util.Collections;
import java.util.List;

/**
 * 叙事事件，例如 death(lihang, seq=1)、speech(lihang, seq=2)
 *
 * subjectKey 为事件主体（死亡事件中死去的角色），为空时取第一个参与者
 */
public class EventFact extends CandidateFact {

    private final String eventKey;
    private final String eventType;
    private final List<String> participants;
    private final String subjectKey;
    private final String locationKey;
    private final String description;

    public EventFact(String eventKey, String eventType, List<String> participants, String subjectKey,
                     String locationKey, String description, Long sequence, boolean flashback, String evidence) {
        super(sequence, flashback, evidence);
        this.eventKey = eventKey;
        this.eventType = eventType;
        this.participants = participants != null ? Collections.unmodifiableList(participants) : Collections.emptyList();
        this.subjectKey = subjectKey;
        this.locationKey = locationKey;
        this.description = description;
    }

    @Override
    public FactKind getKind() {
        return FactKind.EVENT;
    }

    @Override
    public String describe() {
        return "event:" + eventKey + " " + eventType + participants;
    }

    public String getEventKey() {
        return eventKey;
    }

    public String getEventType() {
        return eventType;
    }

    public List<String> getParticipants() {
        return participants;
    }

    public String getSubjectKey() {
        if (subjectKey != null && !subjectKey.isEmpty()) {
            return subjectKey;
        }
        return participants.isEmpty() ? null : participants.get(0);
    }

    public String getLocationKey() {
        return locationKey;
    }

    public String getDescription() {
        return description;
    }
}
