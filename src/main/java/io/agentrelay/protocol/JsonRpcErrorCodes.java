package io.agentrelay.protocol;

/**
 * Standard JSON-RPC 2.0 codes plus the agent protocol's application range.
 */
public final class JsonRpcErrorCodes {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    public static final int AGENT_NOT_FOUND = -32001;
    public static final int SERVICE_NOT_FOUND = -32002;
    public static final int TASK_NOT_FOUND = -32003;
    public static final int PAYMENT_FAILED = -32004;
    public static final int INSUFFICIENT_FUNDS = -32005;
    public static final int MESSAGE_NOT_FOUND = -32006;

    private JsonRpcErrorCodes() {
    }
}
