package com.hearth.gateway;

import java.util.Map;
import java.util.Set;

/**
 * Performs one service call on the smart-home platform. Implementations must be safe for concurrent use;
 * the executor calls them from several threads at once and may interrupt a call that overruns its timeout.
 */
public interface ServiceCallGateway {

    /**
     * @param domain  service domain, e.g. {@code light}
     * @param service service name, e.g. {@code turn_on}
     * @param target  entity ids; may be empty
     * @param data    rendered service data; may be empty
     * @return outcome of the call; failures are reported through the outcome, not thrown
     */
    GatewayOutcome invoke(String domain, String service, Set<String> target, Map<String, Object> data);
}
