package com.hearth.actionmodel.node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/** Traversal helpers over action trees. */
public final class ActionTrees {

    private ActionTrees() {
    }

    /** Pre-order, depth-first walk over every root and its descendants. */
    public static void walk(List<? extends ActionNode> roots, Consumer<ActionNode> visitor) {
        Deque<ActionNode> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            stack.push(roots.get(i));
        }
        while (!stack.isEmpty()) {
            ActionNode node = stack.pop();
            visitor.accept(node);
            List<ActionNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    public static List<ActionNode> flatten(List<? extends ActionNode> roots) {
        List<ActionNode> out = new ArrayList<>();
        walk(roots, out::add);
        return out;
    }

    public static List<ActionNode> leaves(List<? extends ActionNode> roots) {
        List<ActionNode> out = new ArrayList<>();
        walk(roots, n -> {
            if (n.isLeaf()) out.add(n);
        });
        return out;
    }

    public static Optional<ActionNode> findById(List<? extends ActionNode> roots, String id) {
        for (ActionNode n : flatten(roots)) {
            if (n.getId().equals(id)) return Optional.of(n);
        }
        return Optional.empty();
    }
}
