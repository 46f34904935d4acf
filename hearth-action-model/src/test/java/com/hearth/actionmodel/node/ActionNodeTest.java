package com.hearth.actionmodel.node;

import com.hearth.actionmodel.state.ExecutionState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionNodeTest {

    private static SequenceNode lightsSequence() {
        String seqId = ActionNode.newId();
        ServiceCallNode on = new ServiceCallNode(null, "Lights on", seqId, false,
                "light", "turn_on", List.of("light.kitchen"), Map.of("brightness", 200));
        DelayNode pause = new DelayNode(null, null, seqId, false, Duration.ofSeconds(2));
        ServiceCallNode off = new ServiceCallNode(null, null, seqId, true,
                "light", "turn_off", List.of("light.kitchen"), Map.of());
        return new SequenceNode(seqId, "evening", null, false, List.of(on, pause, off));
    }

    @Test
    void copyGivesNewIdsEverywhereAndSameStructure() {
        SequenceNode original = lightsSequence();
        SequenceNode copy = original.copyWithNewIds(null);

        assertEquals(original.toStructureMap(), copy.toStructureMap());
        Set<String> originalIds = new HashSet<>();
        ActionTrees.walk(List.of(original), n -> originalIds.add(n.getId()));
        ActionTrees.walk(List.of(copy), n -> assertFalse(originalIds.contains(n.getId()), n.describe()));
        for (ActionNode child : copy.getChildren()) {
            assertEquals(copy.getId(), child.getParentId());
        }
    }

    @Test
    void copyResetsRuntimeState() {
        SequenceNode original = lightsSequence();
        ActionNode first = original.getChildren().get(0);
        first.getStateMachine().transition(ExecutionState.EXECUTING);
        first.incrementAttemptCount();

        ActionNode copied = original.copyWithNewIds(null).getChildren().get(0);
        assertEquals(ExecutionState.QUEUED, copied.getState());
        assertEquals(0, copied.getAttemptCount());
    }

    @Test
    void continueOnErrorMakesNodeOptional() {
        SequenceNode seq = lightsSequence();
        assertTrue(seq.getChildren().get(0).isRequired());
        assertFalse(seq.getChildren().get(2).isRequired());
        assertEquals(Boolean.TRUE, seq.getChildren().get(2).toStructureMap().get("continueOnError"));
    }

    @Test
    void serviceCallExposesActionAndTarget() {
        ServiceCallNode call = new ServiceCallNode(null, "  ", null, false, "switch", "toggle",
                List.of("switch.a", "switch.b", "switch.a"), null);
        assertEquals("switch.toggle", call.getAction());
        assertEquals(List.of("switch.a", "switch.b"), List.copyOf(call.getTarget()));
        assertTrue(call.getData().isEmpty());
        assertNull(call.getAlias());
        assertTrue(call.isLeaf());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DelayNode(null, null, null, false, Duration.ofMillis(-1)));
    }

    @Test
    void repeatIterationsAreIndependentCopies() {
        String repeatId = ActionNode.newId();
        DelayNode body = new DelayNode(null, null, repeatId, false, Duration.ZERO);
        RepeatNode repeat = RepeatNode.count(repeatId, null, null, false, 3, body);

        ActionNode first = repeat.newIteration();
        ActionNode second = repeat.newIteration();
        assertNotEquals(first.getId(), second.getId());
        assertNotEquals(body.getId(), first.getId());
        assertEquals(repeat.getId(), first.getParentId());
        assertEquals(body.toStructureMap(), second.toStructureMap());
    }

    @Test
    void repeatNeedsExactlyOneMode() {
        DelayNode body = new DelayNode(null, null, null, false, Duration.ZERO);
        assertThrows(IllegalArgumentException.class, () -> RepeatNode.count(null, null, null, false, 0, body));
        RepeatNode until = RepeatNode.untilLoop(null, null, null, false, "{{ done }}", body);
        assertNull(until.getCount());
        assertNull(until.getWhileCondition());
        assertEquals("{{ done }}", until.getUntilCondition());
    }

    @Test
    void chooseChildrenIncludeDefaultLast() {
        String chooseId = ActionNode.newId();
        DelayNode a = new DelayNode(null, null, chooseId, false, Duration.ZERO);
        DelayNode fallback = new DelayNode(null, "fallback", chooseId, false, Duration.ZERO);
        ChooseNode choose = new ChooseNode(chooseId, null, null, false,
                List.of(new ChooseNode.ChooseBranch(true, a)), fallback);

        assertEquals(List.of(a, fallback), choose.getChildren());
        ChooseNode copy = choose.copyWithNewIds(null);
        assertEquals("fallback", copy.getDefaultBranch().getAlias());
        assertEquals(Boolean.TRUE, copy.getBranches().get(0).condition());
    }

    @Test
    void leavesAndFindById() {
        SequenceNode seq = lightsSequence();
        List<ActionNode> leaves = ActionTrees.leaves(List.of(seq));
        assertEquals(3, leaves.size());
        assertEquals(4, ActionTrees.flatten(List.of(seq)).size());
        assertEquals(leaves.get(1), ActionTrees.findById(List.of(seq), leaves.get(1).getId()).orElseThrow());
        assertTrue(ActionTrees.findById(List.of(seq), "missing").isEmpty());
    }
}
