package com.novelforge.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.common.exception.NovelMemoryException;
import com.novelforge.model.NodeRef;
import com.novelforge.model.fact.CandidateFact;
import com.novelforge.model.fact.CharacterStateFact;
import com.novelforge.model.fact.EventFact;
import com.novelforge.model.fact.FactKind;
import com.novelforge.model.fact.LocationChangeFact;
import com.novelforge.model.fact.RelationFact;
import com.novelforge.model.fact.RuleInvocationFact;
import com.novelforge.model.fact.UnrecognizedFact;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateFactParserTest {

    private final CandidateFactParser parser = new CandidateFactParser(new ObjectMapper());

    @Test
    void parsesEveryKnownKindFromFencedObject() {
        String raw = "```json\n{\"facts\":[\n"
            + "{\"kind\":\"character_state\",\"character\":\"lihang\",\"attributes\":{\"realm\":\"筑基\"},\"sequence\":12},\n"
            + "{\"kind\":\"location_change\",\"character\":\"lihang\",\"location\":\"tianyin\"},\n"
            + "{\"kind\":\"rule_invocation\",\"rule\":\"no_flight\",\"actor\":\"lihang\",\"action\":\"步行\"},\n"
            + "{\"kind\":\"event\",\"key\":\"duel\",\"type\":\"death\",\"participants\":[\"lihang\",\"zhangsan\"],"
            + "\"location\":\"qingyun\",\"flashback\":true,\"evidence\":\"李航倒下\"},\n"
            + "{\"kind\":\"relation\",\"source\":\"lihang\",\"target\":\"location:qingyun\",\"relation\":\"MEMBER_OF\"}\n"
            + "]}\n```";

        List<CandidateFact> facts = parser.parse(raw, 5L);

        assertThat(facts).extracting(CandidateFact::getKind).containsExactly(
            FactKind.CHARACTER_STATE, FactKind.LOCATION_CHANGE, FactKind.RULE_INVOCATION,
            FactKind.EVENT, FactKind.RELATION);

        CharacterStateFact state = (CharacterStateFact) facts.get(0);
        assertThat(state.getCharacterKey()).isEqualTo("lihang");
        assertThat(state.getAttributes()).containsEntry("realm", "筑基");
        assertThat(state.getSequence()).isEqualTo(12L);

        LocationChangeFact move = (LocationChangeFact) facts.get(1);
        assertThat(move.getLocationKey()).isEqualTo("tianyin");
        assertThat(move.getSequence()).isEqualTo(5L);

        RuleInvocationFact invocation = (RuleInvocationFact) facts.get(2);
        assertThat(invocation.getRuleKey()).isEqualTo("no_flight");
        assertThat(invocation.getAction()).isEqualTo("步行");

        EventFact event = (EventFact) facts.get(3);
        assertThat(event.getParticipants()).containsExactly("lihang", "zhangsan");
        assertThat(event.getLocationKey()).isEqualTo("qingyun");
        assertThat(event.isFlashback()).isTrue();
        assertThat(event.getEvidence()).isEqualTo("李航倒下");

        RelationFact relation = (RelationFact) facts.get(4);
        assertThat(relation.getSource()).isEqualTo(NodeRef.parse("character:lihang"));
        assertThat(relation.getTarget()).isEqualTo(NodeRef.parse("location:qingyun"));
    }

    @Test
    void acceptsBareArray() {
        List<CandidateFact> facts = parser.parse(
            "[{\"kind\":\"event\",\"key\":\"e1\",\"type\":\"battle\",\"participants\":[\"lihang\"]}]", 3L);

        assertThat(facts).hasSize(1);
        assertThat(facts.get(0).getSequence()).isEqualTo(3L);
    }

    @Test
    void unknownKindOrMissingFieldsBecomeUnrecognized() {
        List<CandidateFact> facts = parser.parse("{\"facts\":["
            + "{\"kind\":\"teleport\",\"character\":\"lihang\"},"
            + "{\"kind\":\"event\",\"key\":\"e1\"}]}", 1L);

        assertThat(facts).allMatch(f -> f.getKind() == FactKind.UNRECOGNIZED);
        UnrecognizedFact teleport = (UnrecognizedFact) facts.get(0);
        assertThat(teleport.getRawKind()).isEqualTo("teleport");
        assertThat(teleport.getPayload()).containsEntry("character", "lihang");
        assertThat(((UnrecognizedFact) facts.get(1)).getRawKind()).isEqualTo("event");
    }

    @Test
    void relationWithEmptyEndpointKeyBecomesUnrecognizedWithoutLosingTheBatch() {
        List<CandidateFact> facts = parser.parse("{\"facts\":["
            + "{\"kind\":\"event\",\"key\":\"e1\",\"type\":\"battle\",\"participants\":[\"lihang\"]},"
            + "{\"kind\":\"relation\",\"source\":\"lihang\",\"target\":\"location:\",\"relation\":\"LOCATED_IN\"},"
            + "{\"kind\":\"relation\",\"source\":\"item:  \",\"target\":\"lihang\",\"relation\":\"OWNED_BY\"}]}", 1L);

        assertThat(facts).extracting(CandidateFact::getKind).containsExactly(
            FactKind.EVENT, FactKind.UNRECOGNIZED, FactKind.UNRECOGNIZED);
        UnrecognizedFact badTarget = (UnrecognizedFact) facts.get(1);
        assertThat(badTarget.getRawKind()).isEqualTo("relation");
        assertThat(badTarget.getPayload()).containsEntry("target", "location:");
        assertThat(((UnrecognizedFact) facts.get(2)).getPayload()).containsEntry("source", "item:  ");
    }

    @Test
    void blankOutputMeansNoFacts() {
        assertThat(parser.parse("  ", 1L)).isEmpty();
    }

    @Test
    void malformedOutputIsRejected() {
        assertThatThrownBy(() -> parser.parse("这不是JSON", 1L)).isInstanceOf(NovelMemoryException.class);
        assertThatThrownBy(() -> parser.parse("{\"items\":[]}", 1L))
            .isInstanceOf(NovelMemoryException.class)
            .hasMessageContaining("facts");
    }
}
