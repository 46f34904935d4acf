package com.hearth.actionmodel.state;

import com.hearth.actionmodel.error.IllegalStateTransitionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionStateMachineTest {

    @Test
    void startsQueued() {
        ExecutionStateMachine sm = new ExecutionStateMachine("n1");
        assertEquals(ExecutionState.QUEUED, sm.getState());
        assertFalse(sm.isTerminal());
    }

    @Test
    void retryCycleIsRecordedInHistory() {
        ExecutionStateMachine sm = new ExecutionStateMachine("n1");
        sm.transition(ExecutionState.EXECUTING);
        sm.transition(ExecutionState.RETRYING);
        sm.transition(ExecutionState.EXECUTING);
        sm.transition(ExecutionState.SUCCESS);
        assertEquals(List.of(ExecutionState.QUEUED, ExecutionState.EXECUTING, ExecutionState.RETRYING,
                ExecutionState.EXECUTING, ExecutionState.SUCCESS), sm.getHistory());
        assertTrue(sm.isTerminal());
    }

    @Test
    void terminalStatesRejectEveryTransition() {
        for (ExecutionState terminal : List.of(ExecutionState.SUCCESS, ExecutionState.FAILED, ExecutionState.CANCELLED)) {
            for (ExecutionState target : ExecutionState.values()) {
                assertFalse(ExecutionStateMachine.canTransition(terminal, target), terminal + " -> " + target);
                ExecutionStateMachine sm = new ExecutionStateMachine("n", terminal);
                assertThrows(IllegalStateTransitionException.class, () -> sm.transition(target));
            }
        }
    }

    @Test
    void queuedCannotSkipToSuccess() {
        ExecutionStateMachine sm = new ExecutionStateMachine("n1");
        IllegalStateTransitionException e = assertThrows(IllegalStateTransitionException.class,
                () -> sm.transition(ExecutionState.SUCCESS));
        assertEquals(ExecutionState.QUEUED, e.getFrom());
        assertEquals(ExecutionState.SUCCESS, e.getTo());
        assertEquals(ExecutionState.QUEUED, sm.getState());
    }

    @Test
    void retryingCannotFailDirectly() {
        assertFalse(ExecutionStateMachine.canTransition(ExecutionState.RETRYING, ExecutionState.FAILED));
        assertTrue(ExecutionStateMachine.canTransition(ExecutionState.RETRYING, ExecutionState.CANCELLED));
    }

    @Test
    void cancelIsNoOpOnceTerminal() {
        ExecutionStateMachine sm = new ExecutionStateMachine("n1");
        sm.transition(ExecutionState.EXECUTING);
        sm.transition(ExecutionState.FAILED);
        assertFalse(sm.cancel());
        assertFalse(sm.transitionIfActive(ExecutionState.SUCCESS));
        assertEquals(ExecutionState.FAILED, sm.getState());
    }

    @Test
    void everyNonTerminalStateCanBeCancelled() {
        for (ExecutionState s : ExecutionState.values()) {
            if (!s.isTerminal()) {
                ExecutionStateMachine sm = new ExecutionStateMachine("n", s);
                assertTrue(sm.cancel());
                assertEquals(ExecutionState.CANCELLED, sm.getState());
            }
        }
    }
}
