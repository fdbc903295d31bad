package com.dburyak.jsonrpc2;

import java.util.Locale;

/**
 * What to do with the outcome of a notification (a request without id). Successful notifications never get a
 * response, this only decides the fate of failed ones.
 */
public enum NotificationPolicy {
    /**
     * Failed notifications produce an error response with a null id, the transport decides whether to deliver it.
     */
    SURFACE_ERRORS,

    /**
     * Notifications never produce a response.
     */
    NEVER_RESPOND;

    /**
     * Decides whether the outcome of a dispatch is owed to the caller. Successful responses without id are never
     * delivered, error responses to notifications are delivered unless the policy says otherwise.
     */
    public boolean shouldRespond(JsonRpcRequest req, JsonRpcResponse resp) {
        if (resp.isSuccess() && resp.getId() == null) {
            return false;
        }
        return !(req.isNotification() && this == NEVER_RESPOND);
    }

    public static NotificationPolicy parse(String value) {
        var normalized = value.strip().replace('-', '_').toUpperCase(Locale.ROOT);
        for (var policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("unknown notification policy: " + value);
    }
}
