package io.agentrelay.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of envelope purposes together with their JSON-RPC method names.
 *
 * <p>The method mapping is a bijection over every kind except {@link #ERROR}, which encodes
 * to {@link #UNKNOWN_METHOD} and is also what any unrecognized inbound method decodes to.
 */
public enum MessageKind {
    CAPABILITY_QUERY("CapabilityQuery", "capability_query"),
    CAPABILITY_RESPONSE("CapabilityResponse", "capability_response"),
    SERVICE_REQUEST("ServiceRequest", "service_request"),
    SERVICE_OFFER("ServiceOffer", "service_offer"),
    TASK_DELEGATION("TaskDelegation", "task_delegation"),
    TASK_ACCEPTANCE("TaskAcceptance", "task_acceptance"),
    TASK_REJECTION("TaskRejection", "task_rejection"),
    TASK_UPDATE("TaskUpdate", "task_update"),
    TASK_COMPLETION("TaskCompletion", "task_completion"),
    PAYMENT_REQUEST("PaymentRequest", "payment_request"),
    PAYMENT_CONFIRMATION("PaymentConfirmation", "payment_confirmation"),
    PAYMENT_REJECTION("PaymentRejection", "payment_rejection"),
    NEGOTIATION_START("NegotiationStart", "negotiation_start"),
    NEGOTIATION_OFFER("NegotiationOffer", "negotiation_offer"),
    NEGOTIATION_ACCEPT("NegotiationAccept", "negotiation_accept"),
    NEGOTIATION_REJECT("NegotiationReject", "negotiation_reject"),
    PING("Ping", "ping"),
    PONG("Pong", "pong"),
    ERROR("Error", null);

    public static final String UNKNOWN_METHOD = "unknown_method";

    private static final Map<String, MessageKind> BY_METHOD = new HashMap<>();

    static {
        for (MessageKind kind : values()) {
            if (kind.method != null) {
                BY_METHOD.put(kind.method, kind);
            }
        }
    }

    private final String displayName;
    private final String method;

    MessageKind(String displayName, String method) {
        this.displayName = displayName;
        this.method = method;
    }

    public String displayName() {
        return displayName;
    }

    public String method() {
        return method == null ? UNKNOWN_METHOD : method;
    }

    public static MessageKind fromMethod(String method) {
        if (method == null) {
            return ERROR;
        }
        return BY_METHOD.getOrDefault(method, ERROR);
    }
}
