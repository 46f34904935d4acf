package com.hearth.actionmodel.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Leaf that invokes {@code domain.service} on the target platform.
 * {@code data} values may still hold template expressions; they are rendered just before dispatch.
 */
public final class ServiceCallNode extends ActionNode {

    private final String domain;
    private final String service;
    private final Set<String> target;
    private final Map<String, Object> data;

    public ServiceCallNode(String id, String alias, String parentId, boolean continueOnError,
                           String domain, String service, Collection<String> target, Map<String, Object> data) {
        super(id, alias, parentId, continueOnError);
        this.domain = Objects.requireNonNull(domain, "domain");
        this.service = Objects.requireNonNull(service, "service");
        this.target = target != null ? Collections.unmodifiableSet(new LinkedHashSet<>(target)) : Set.of();
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    @Override
    public ActionKind getKind() {
        return ActionKind.SERVICE_CALL;
    }

    @Override
    public List<ActionNode> getChildren() {
        return List.of();
    }

    @Override
    public ServiceCallNode copyWithNewIds(String newParentId) {
        return new ServiceCallNode(newId(), getAlias(), newParentId, isContinueOnError(), domain, service, target, data);
    }

    @Override
    protected void describeFields(Map<String, Object> out) {
        out.put("action", getAction());
        out.put("target", new ArrayList<>(target));
        out.put("data", data);
    }

    public String getDomain() {
        return domain;
    }

    public String getService() {
        return service;
    }

    /** {@code domain.service}, as written in the document. */
    public String getAction() {
        return domain + "." + service;
    }

    /** Entity ids to act on, in document order. Empty when the service takes no target. */
    public Set<String> getTarget() {
        return target;
    }

    /** Unrendered service data. Unmodifiable; values may be null. */
    public Map<String, Object> getData() {
        return data;
    }
}
