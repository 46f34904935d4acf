package com.hearth.actionmodel.error;

/**
 * Thrown (or recorded) when the target platform deterministically rejects a service call,
 * e.g. unknown service or malformed parameters. Never retried.
 */
public final class ServiceCallException extends ActionExecutionException {

    private final String domain;
    private final String service;
    private final String responseDetail;

    public ServiceCallException(String domain, String service, String responseDetail) {
        super(String.format("Service call failed: %s.%s (%s)", domain, service,
                responseDetail != null ? responseDetail : "no detail"));
        this.domain = domain;
        this.service = service;
        this.responseDetail = responseDetail;
    }

    public String getDomain() {
        return domain;
    }

    public String getService() {
        return service;
    }

    /** Platform response text or status description; may be null. */
    public String getResponseDetail() {
        return responseDetail;
    }
}
