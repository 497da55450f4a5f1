package io.agentrelay.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Inbound or outbound JSON-RPC 2.0 request. {@code id} keeps the wire type (string, number or
 * null) so responses echo it unchanged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRequest(String jsonrpc, String method, Map<String, Object> params, Object id) {
    public static final String VERSION = "2.0";

    public static JsonRpcRequest of(String method, Map<String, Object> params, Object id) {
        return new JsonRpcRequest(VERSION, method, params, id);
    }
}
