package com.hearth.executor;

import com.hearth.gateway.GatewayOutcome;
import com.hearth.gateway.ServiceCallGateway;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/** Records calls and answers through a pluggable responder; succeeds by default. */
final class FakeGateway implements ServiceCallGateway {

    record Call(String domain, String service, Set<String> target, Map<String, Object> data, long nanoTime) {
        String action() {
            return domain + "." + service;
        }
    }

    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
    private volatile Function<Call, GatewayOutcome> responder = call -> GatewayOutcome.success(List.of(), 200);

    FakeGateway respondWith(Function<Call, GatewayOutcome> responder) {
        this.responder = responder;
        return this;
    }

    @Override
    public GatewayOutcome invoke(String domain, String service, Set<String> target, Map<String, Object> data) {
        Call call = new Call(domain, service, target, data, System.nanoTime());
        calls.add(call);
        return responder.apply(call);
    }

    List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    /** Sleeps inside a responder; an interrupt (abandoned call) becomes a retryable failure. */
    static GatewayOutcome sleepThen(long ms, GatewayOutcome outcome) {
        try {
            Thread.sleep(ms);
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GatewayOutcome.failure(true, "interrupted");
        }
    }
}
