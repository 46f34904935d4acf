package com.hearth.actionparser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hearth.actionmodel.error.ActionParseException;
import com.hearth.actionmodel.error.InvalidActionException;
import com.hearth.actionmodel.node.ActionKind;
import com.hearth.actionmodel.node.ActionNode;
import com.hearth.actionmodel.node.ActionTrees;
import com.hearth.actionmodel.node.ChooseNode;
import com.hearth.actionmodel.node.DelayNode;
import com.hearth.actionmodel.node.ParallelNode;
import com.hearth.actionmodel.node.RepeatNode;
import com.hearth.actionmodel.node.SequenceNode;
import com.hearth.actionmodel.node.ServiceCallNode;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionParserTest {

    private final ActionParser parser = new ActionParser();

    private static String resource(String name) throws IOException {
        try (InputStream in = ActionParserTest.class.getResourceAsStream("/automations/" + name)) {
            assertNotNull(in, name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void parsesEveningRoutine() throws IOException {
        List<ActionNode> nodes = parser.parseYaml(resource("evening.yaml"));

        assertEquals(List.of(ActionKind.SERVICE_CALL, ActionKind.DELAY, ActionKind.PARALLEL, ActionKind.CHOOSE,
                ActionKind.REPEAT), nodes.stream().map(ActionNode::getKind).toList());

        ServiceCallNode on = (ServiceCallNode) nodes.get(0);
        assertEquals("Kitchen on", on.getAlias());
        assertEquals("light", on.getDomain());
        assertEquals("turn_on", on.getService());
        assertEquals(Set.of("light.kitchen"), on.getTarget());
        assertEquals(Map.of("brightness", "{{ brightness }}"), on.getData());

        assertEquals(Duration.ofSeconds(2), ((DelayNode) nodes.get(1)).getDuration());

        ParallelNode parallel = (ParallelNode) nodes.get(2);
        assertEquals(2, parallel.getChildren().size());
        SequenceNode nested = assertInstanceOf(SequenceNode.class, parallel.getChildren().get(1));
        assertEquals(parallel.getId(), nested.getParentId());
        assertEquals(Duration.ofMillis(500), ((DelayNode) nested.getChildren().get(1)).getDuration());

        ChooseNode choose = (ChooseNode) nodes.get(3);
        assertEquals("{{ guests }}", choose.getBranches().get(0).condition());
        ServiceCallNode fallback = (ServiceCallNode) choose.getDefaultBranch();
        assertEquals(List.of("light.kitchen", "light.hallway"), List.copyOf(fallback.getTarget()));

        RepeatNode repeat = (RepeatNode) nodes.get(4);
        assertEquals(2, repeat.getCount());
        assertEquals(Set.of("switch.fan"), ((ServiceCallNode) repeat.getTemplate()).getTarget());
    }

    @Test
    void parsingTwiceGivesSameStructureWithNewIds() throws IOException {
        String yaml = resource("evening.yaml");
        List<ActionNode> first = parser.parseYaml(yaml);
        List<ActionNode> second = parser.parseYaml(yaml);

        assertEquals(first.stream().map(ActionNode::toStructureMap).toList(),
                second.stream().map(ActionNode::toStructureMap).toList());
        Set<String> firstIds = new HashSet<>();
        ActionTrees.walk(first, n -> firstIds.add(n.getId()));
        ActionTrees.walk(second, n -> assertFalse(firstIds.contains(n.getId())));
    }

    @Test
    void childrenPointToTheirParent() throws IOException {
        List<ActionNode> nodes = parser.parseYaml(resource("evening.yaml"));
        ActionTrees.walk(nodes, n -> {
            for (ActionNode child : n.getChildren()) {
                assertEquals(n.getId(), child.getParentId(), child.describe());
            }
        });
        nodes.forEach(n -> assertNull(n.getParentId()));
    }

    @Test
    void delayFormsAreEquivalent() {
        Duration clock = ((DelayNode) parser.parse(List.of(Map.of("delay", "00:00:02"))).get(0)).getDuration();
        Duration mapping = ((DelayNode) parser.parse(List.of(Map.of("delay", Map.of("seconds", 2)))).get(0)).getDuration();
        Duration number = ((DelayNode) parser.parse(List.of(Map.of("delay", 2))).get(0)).getDuration();
        assertEquals(Duration.ofSeconds(2), clock);
        assertEquals(clock, mapping);
        assertEquals(clock, number);
    }

    @Test
    void delayVariants() {
        assertEquals(Duration.ofSeconds(90), DelayParser.parse("01:30", "f"));
        assertEquals(Duration.ofMillis(1500), DelayParser.parse("00:00:01.5", "f"));
        assertEquals(Duration.ofMinutes(61).plusSeconds(5),
                DelayParser.parse(Map.of("hours", 1, "minutes", 1, "seconds", "5"), "f"));
        assertEquals(Duration.ofMillis(250), DelayParser.parse(0.25, "f"));
    }

    @Test
    void invalidDelaysAreRejected() {
        assertThrows(InvalidActionException.class, () -> DelayParser.parse("soon", "f"));
        assertThrows(InvalidActionException.class, () -> DelayParser.parse(-3, "f"));
        assertThrows(InvalidActionException.class, () -> DelayParser.parse(Map.of("weeks", 1), "f"));
        assertThrows(InvalidActionException.class, () -> DelayParser.parse("{{ wait }}", "f"));
        assertThrows(InvalidActionException.class, () -> DelayParser.parse(true, "f"));
    }

    @Test
    void oversizedDelaysAreRejected() {
        assertThrows(InvalidActionException.class, () -> DelayParser.parse(1e30, "f"));
        assertThrows(InvalidActionException.class, () -> DelayParser.parse("99999999999999999999:00:00", "f"));
        assertThrows(InvalidActionException.class, () -> DelayParser.parse(Map.of("hours", "1e20"), "f"));
        assertThrows(InvalidActionException.class, () -> parser.parseYaml("- delay: 1e30\n"));
        assertThrows(InvalidActionException.class,
                () -> parser.parseYaml("- delay: \"99999999999999999999:00:00\"\n"));
        assertEquals(Duration.ofHours(100_000), DelayParser.parse("100000:00:00", "f"));
    }

    @Test
    void legacyServiceKeysAndTargetAlternates() {
        List<ActionNode> nodes = parser.parse(List.of(
                Map.of("service", "light.turn_off", "entity_id", "light.a,light.b",
                        "service_data", Map.of("transition", 3, "entity_id", List.of("light.c"))),
                Map.of("action", "light.turn_on", "target", Map.of("area_id", "kitchen"))));

        ServiceCallNode legacy = (ServiceCallNode) nodes.get(0);
        assertEquals(List.of("light.a", "light.b", "light.c"), List.copyOf(legacy.getTarget()));
        assertEquals(Map.of("transition", 3), legacy.getData());

        ServiceCallNode byArea = (ServiceCallNode) nodes.get(1);
        assertTrue(byArea.getTarget().isEmpty());
        assertEquals(Map.of("area_id", "kitchen"), byArea.getData());
    }

    @Test
    void documentShapes() {
        Map<String, Object> call = Map.of("action", "light.turn_on");
        assertEquals(1, parser.parse(Map.of("actions", List.of(call))).size());
        assertEquals(1, parser.parse(Map.of("action", List.of(call))).size());
        assertEquals(1, parser.parse(Map.of("sequence", List.of(call))).size());
        assertEquals(1, parser.parse(call).size());
        assertEquals(1, parser.parse(new ObjectMapper().valueToTree(List.of(call))).size());
        assertEquals(1, parser.parseJson("[{\"action\": \"light.turn_on\"}]").size());
    }

    @Test
    void unrecognizedDocumentsFail() {
        assertThrows(ActionParseException.class, () -> parser.parse(Map.of("trigger", List.of())));
        assertThrows(ActionParseException.class, () -> parser.parse(42));
        assertThrows(ActionParseException.class, () -> parser.parse((Object) null));
        assertThrows(ActionParseException.class, () -> parser.parseJson("[{\"action\": "));
        assertThrows(ActionParseException.class, () -> parser.parseYaml("just words"));
    }

    @Test
    void invalidStepsNameTheFragment() {
        InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> parser.parse(List.of(Map.of("action", "lightturn_on"))));
        assertTrue(e.getFragment().contains("lightturn_on"));

        assertThrows(InvalidActionException.class, () -> parser.parse(List.of(Map.of("action", "light."))));
        assertThrows(InvalidActionException.class, () -> parser.parse(List.of(Map.of("action", 5))));
        assertThrows(InvalidActionException.class, () -> parser.parse(List.of(Map.of("wait_template", "x"))));
        assertThrows(InvalidActionException.class, () -> parser.parse(List.of("light.turn_on")));
        assertThrows(InvalidActionException.class,
                () -> parser.parse(List.of(Map.of("action", "light.turn_on", "data", List.of(1)))));
    }

    @Test
    void invalidRepeatsAreRejected() {
        Map<String, Object> body = Map.of("action", "light.toggle");
        assertThrows(InvalidActionException.class,
                () -> parser.parse(List.of(Map.of("repeat", Map.of("count", 0, "sequence", List.of(body))))));
        assertThrows(InvalidActionException.class,
                () -> parser.parse(List.of(Map.of("repeat", Map.of("sequence", List.of(body))))));
        assertThrows(InvalidActionException.class,
                () -> parser.parse(List.of(Map.of("repeat", Map.of("count", 2)))));
        assertThrows(InvalidActionException.class,
                () -> parser.parse(List.of(Map.of("repeat", Map.of("count", 2, "while", true, "sequence", List.of(body))))));
    }

    @Test
    void repeatWithSeveralStepsWrapsThemInASequence() {
        RepeatNode repeat = (RepeatNode) parser.parse(List.of(Map.of("repeat", Map.of(
                "until", "{{ done }}",
                "sequence", List.of(Map.of("action", "light.toggle"), Map.of("delay", 1)))))).get(0);
        assertEquals("{{ done }}", repeat.getUntilCondition());
        SequenceNode body = assertInstanceOf(SequenceNode.class, repeat.getTemplate());
        assertEquals(2, body.getChildren().size());
        assertEquals(repeat.getId(), body.getParentId());

        RepeatNode counted = (RepeatNode) parser.parse(List.of(Map.of("repeat", Map.of(
                "count", "3", "sequence", List.of(Map.of("delay", 1)))))).get(0);
        assertEquals(3, counted.getCount());
    }

    @Test
    void commonKeys() {
        List<ActionNode> nodes = parser.parse(List.of(
                Map.of("action", "light.turn_on", "continue_on_error", true, "alias", "optional"),
                Map.of("action", "light.turn_off", "enabled", false)));
        assertEquals(1, nodes.size());
        assertFalse(nodes.get(0).isRequired());
        assertEquals("optional", nodes.get(0).getAlias());
    }
}
