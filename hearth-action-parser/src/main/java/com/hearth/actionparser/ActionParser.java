package com.hearth.actionparser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hearth.actionmodel.error.ActionParseException;
import com.hearth.actionmodel.error.InvalidActionException;
import com.hearth.actionmodel.node.ActionNode;
import com.hearth.actionmodel.node.ChooseNode;
import com.hearth.actionmodel.node.DelayNode;
import com.hearth.actionmodel.node.ParallelNode;
import com.hearth.actionmodel.node.RepeatNode;
import com.hearth.actionmodel.node.SequenceNode;
import com.hearth.actionmodel.node.ServiceCallNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts an automation document into an ordered list of action node trees.
 * <p>
 * Accepted documents: a list of steps; a mapping holding the list under {@code actions}, {@code action}
 * or {@code sequence}; or a single step mapping. Every call assigns fresh ids, so parsing the same document twice
 * yields structurally equal trees with different ids. No I/O, template rendering or entity validation happens here.
 */
public final class ActionParser {

    private static final Logger log = LoggerFactory.getLogger(ActionParser.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final int MAX_FRAGMENT_LENGTH = 300;

    private static final List<String> DOCUMENT_KEYS = List.of("actions", "action", "sequence");
    private static final List<String> STEP_KEYS =
            List.of("action", "service", "delay", "sequence", "parallel", "repeat", "choose");

    /**
     * Parses an already-loaded document: a {@link List}, a {@link Map}, a Jackson {@link JsonNode}
     * or YAML/JSON text.
     *
     * @throws ActionParseException   if the document is not a recognized automation shape
     * @throws InvalidActionException if a step is structurally invalid
     */
    public List<ActionNode> parse(Object definition) {
        if (definition instanceof String text) {
            return parseDocument(load(YAML, text));
        }
        if (definition instanceof JsonNode node) {
            return parseDocument(JSON.convertValue(node, Object.class));
        }
        return parseDocument(definition);
    }

    /** Loads YAML text (JSON is accepted too) and parses it. */
    public List<ActionNode> parseYaml(String text) {
        return parseDocument(load(YAML, text));
    }

    /** Loads JSON text and parses it. */
    public List<ActionNode> parseJson(String text) {
        return parseDocument(load(JSON, text));
    }

    private List<ActionNode> parseDocument(Object document) {
        if (document == null) {
            throw new ActionParseException("", "Automation document is empty");
        }
        List<?> steps = extractSteps(document);
        List<ActionNode> nodes = parseSteps(steps, null);
        if (log.isDebugEnabled()) {
            log.debug("Parsed automation | topLevelNodes={} | steps={}", nodes.size(), steps.size());
        }
        return nodes;
    }

    private static Object load(ObjectMapper mapper, String text) {
        if (text == null || text.isBlank()) {
            throw new ActionParseException("", "Automation document is empty");
        }
        try {
            Object loaded = mapper.readValue(text, Object.class);
            if (loaded == null) {
                throw new ActionParseException(snippet(text), "Automation document is empty");
            }
            return loaded;
        } catch (JsonProcessingException e) {
            throw new ActionParseException(snippet(text), "Malformed document: " + e.getOriginalMessage(), e);
        }
    }

    private List<?> extractSteps(Object definition) {
        if (definition instanceof List<?> list) {
            return list;
        }
        if (!(definition instanceof Map<?, ?> map)) {
            throw new ActionParseException(fragment(definition),
                    "Automation document must be a list or a mapping, got " + definition.getClass().getSimpleName());
        }
        for (String key : DOCUMENT_KEYS) {
            Object value = map.get(key);
            if (value instanceof List<?> list) {
                return list;
            }
            if ("actions".equals(key) && value instanceof Map<?, ?>) {
                return List.of(value);
            }
        }
        if (isStep(map)) {
            return List.of(map);
        }
        throw new ActionParseException(fragment(definition),
                "No actions found: expected one of " + DOCUMENT_KEYS + " or a single action step");
    }

    private static boolean isStep(Map<?, ?> map) {
        for (String key : STEP_KEYS) {
            if (map.containsKey(key)) return true;
        }
        return false;
    }

    private List<ActionNode> parseSteps(List<?> steps, String parentId) {
        List<ActionNode> out = new ArrayList<>(steps.size());
        for (Object step : steps) {
            ActionNode node = parseStep(step, parentId);
            if (node != null) out.add(node);
        }
        return out;
    }

    /** Returns null for a disabled step. */
    private ActionNode parseStep(Object raw, String parentId) {
        if (!(raw instanceof Map<?, ?> step)) {
            throw new InvalidActionException(fragment(raw), "Action step must be a mapping");
        }
        if (!flag(step, "enabled", true)) {
            log.debug("Skipping disabled step | step={}", fragment(step));
            return null;
        }
        String alias = step.get("alias") != null ? String.valueOf(step.get("alias")) : null;
        boolean continueOnError = flag(step, "continue_on_error", false);
        String id = ActionNode.newId();

        ActionNode node;
        if (step.containsKey("action") || step.containsKey("service")) {
            node = parseServiceCall(step, id, alias, parentId, continueOnError);
        } else if (step.containsKey("delay")) {
            node = new DelayNode(id, alias, parentId, continueOnError, DelayParser.parse(step.get("delay"), fragment(step)));
        } else if (step.containsKey("parallel")) {
            node = parseParallel(step, id, alias, parentId, continueOnError);
        } else if (step.containsKey("repeat")) {
            node = parseRepeat(step, id, alias, parentId, continueOnError);
        } else if (step.containsKey("choose")) {
            node = parseChoose(step, id, alias, parentId, continueOnError);
        } else if (step.containsKey("sequence")) {
            Object children = step.get("sequence");
            if (!(children instanceof List<?> list)) {
                throw new InvalidActionException(fragment(step), "'sequence' must be a list of steps");
            }
            node = new SequenceNode(id, alias, parentId, continueOnError, parseSteps(list, id));
        } else {
            throw new InvalidActionException(fragment(step), "Unrecognized action step");
        }
        if (log.isDebugEnabled()) {
            log.debug("Parsed step | kind={} | id={} | parentId={}", node.getKind().getTypeName(), node.getId(), parentId);
        }
        return node;
    }

    private ServiceCallNode parseServiceCall(Map<?, ?> step, String id, String alias, String parentId,
                                             boolean continueOnError) {
        String fragment = fragment(step);
        Object action = step.containsKey("action") ? step.get("action") : step.get("service");
        if (!(action instanceof String actionName)) {
            throw new InvalidActionException(fragment, "Service action must be a string 'domain.service'");
        }
        int dot = actionName.indexOf('.');
        String domain = dot > 0 ? actionName.substring(0, dot).trim() : "";
        String service = dot > 0 ? actionName.substring(dot + 1).trim() : "";
        if (domain.isEmpty() || service.isEmpty()) {
            throw new InvalidActionException(fragment, "Service action must be 'domain.service', got '" + actionName + "'");
        }

        Object rawData = step.containsKey("data") ? step.get("data") : step.get("service_data");
        Map<String, Object> data = new LinkedHashMap<>();
        if (rawData instanceof Map<?, ?> dataMap) {
            for (Map.Entry<?, ?> e : dataMap.entrySet()) {
                data.put(String.valueOf(e.getKey()), e.getValue());
            }
        } else if (rawData != null) {
            throw new InvalidActionException(fragment, "Service data must be a mapping");
        }

        TargetExtractor.ServiceTarget target = TargetExtractor.extract(step, data, fragment);
        return new ServiceCallNode(id, alias, parentId, continueOnError, domain, service,
                target.entityIds(), target.data());
    }

    private ParallelNode parseParallel(Map<?, ?> step, String id, String alias, String parentId,
                                       boolean continueOnError) {
        Object value = step.get("parallel");
        if (!(value instanceof List<?> items)) {
            throw new InvalidActionException(fragment(step), "'parallel' must be a list");
        }
        List<ActionNode> children = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof List<?> nested) {
                String seqId = ActionNode.newId();
                children.add(new SequenceNode(seqId, null, id, false, parseSteps(nested, seqId)));
            } else {
                ActionNode child = parseStep(item, id);
                if (child != null) children.add(child);
            }
        }
        return new ParallelNode(id, alias, parentId, continueOnError, children);
    }

    private RepeatNode parseRepeat(Map<?, ?> step, String id, String alias, String parentId,
                                   boolean continueOnError) {
        String fragment = fragment(step);
        if (!(step.get("repeat") instanceof Map<?, ?> repeat)) {
            throw new InvalidActionException(fragment, "'repeat' must be a mapping");
        }
        int modes = (repeat.containsKey("count") ? 1 : 0) + (repeat.containsKey("while") ? 1 : 0)
                + (repeat.containsKey("until") ? 1 : 0);
        if (modes != 1) {
            throw new InvalidActionException(fragment, "'repeat' needs exactly one of count, while, until");
        }
        ActionNode body = parseBody(repeat.get("sequence"), id, fragment, "repeat");
        if (repeat.containsKey("count")) {
            return RepeatNode.count(id, alias, parentId, continueOnError, count(repeat.get("count"), fragment), body);
        }
        if (repeat.containsKey("while")) {
            return RepeatNode.whileLoop(id, alias, parentId, continueOnError, condition(repeat.get("while"), fragment), body);
        }
        return RepeatNode.untilLoop(id, alias, parentId, continueOnError, condition(repeat.get("until"), fragment), body);
    }

    private ChooseNode parseChoose(Map<?, ?> step, String id, String alias, String parentId,
                                   boolean continueOnError) {
        String fragment = fragment(step);
        Object value = step.get("choose");
        List<?> rawBranches;
        if (value instanceof List<?> list) {
            rawBranches = list;
        } else if (value instanceof Map<?, ?>) {
            rawBranches = List.of(value);
        } else if (value == null) {
            rawBranches = List.of();
        } else {
            throw new InvalidActionException(fragment, "'choose' must be a list of branches");
        }
        List<ChooseNode.ChooseBranch> branches = new ArrayList<>(rawBranches.size());
        for (Object raw : rawBranches) {
            if (!(raw instanceof Map<?, ?> branch)) {
                throw new InvalidActionException(fragment, "Choose branch must be a mapping");
            }
            Object condition = branch.containsKey("conditions") ? branch.get("conditions") : branch.get("condition");
            branches.add(new ChooseNode.ChooseBranch(condition(condition, fragment),
                    parseBody(branch.get("sequence"), id, fragment, "choose branch")));
        }
        ActionNode defaultBranch = step.get("default") != null
                ? parseBody(step.get("default"), id, fragment, "choose default")
                : null;
        if (branches.isEmpty() && defaultBranch == null) {
            throw new InvalidActionException(fragment, "'choose' has no branches and no default");
        }
        return new ChooseNode(id, alias, parentId, continueOnError, branches, defaultBranch);
    }

    /** A single-step body is used as is; several steps are wrapped in a sequence. */
    private ActionNode parseBody(Object body, String parentId, String fragment, String owner) {
        if (body instanceof Map<?, ?>) {
            body = List.of(body);
        }
        if (!(body instanceof List<?> steps) || steps.isEmpty()) {
            throw new InvalidActionException(fragment, "'" + owner + "' needs a non-empty 'sequence'");
        }
        if (steps.size() == 1) {
            ActionNode only = parseStep(steps.get(0), parentId);
            if (only == null) {
                throw new InvalidActionException(fragment, "'" + owner + "' has only disabled steps");
            }
            return only;
        }
        String seqId = ActionNode.newId();
        return new SequenceNode(seqId, null, parentId, false, parseSteps(steps, seqId));
    }

    private static int count(Object raw, String fragment) {
        BigDecimal value;
        try {
            value = raw instanceof Number || raw instanceof String ? new BigDecimal(raw.toString().trim()) : null;
        } catch (NumberFormatException e) {
            throw new InvalidActionException(fragment, "Repeat count is not a number: " + raw, e);
        }
        if (value == null || value.signum() <= 0 || value.stripTrailingZeros().scale() > 0
                || value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            throw new InvalidActionException(fragment, "Repeat count must be a positive integer, got " + raw);
        }
        return value.intValueExact();
    }

    private static Object condition(Object raw, String fragment) {
        if (raw == null) {
            throw new InvalidActionException(fragment, "Missing condition");
        }
        return raw;
    }

    private static boolean flag(Map<?, ?> step, String key, boolean defaultValue) {
        Object value = step.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean b) return b;
        return Boolean.parseBoolean(String.valueOf(value).trim());
    }

    private static String fragment(Object value) {
        try {
            return snippet(JSON.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            return snippet(String.valueOf(value));
        }
    }

    private static String snippet(String text) {
        String trimmed = text.trim();
        return trimmed.length() > MAX_FRAGMENT_LENGTH
                ? trimmed.substring(0, MAX_FRAGMENT_LENGTH) + "...[truncated length=" + trimmed.length() + "]"
                : trimmed;
    }
}
