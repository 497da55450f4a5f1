package io.agentrelay.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON-RPC 2.0 response carrying either {@code result} or {@code error}; the absent member is
 * omitted from the serialized form.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @JsonInclude(JsonInclude.Include.NON_NULL) Object result,
        @JsonInclude(JsonInclude.Include.NON_NULL) JsonRpcError error,
        Object id
) {
    public static JsonRpcResponse success(Object id, Object result) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, result, null, id);
    }

    public static JsonRpcResponse failure(Object id, JsonRpcError error) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, null, error, id);
    }

    public static JsonRpcResponse failure(Object id, int code, String message) {
        return failure(id, JsonRpcError.of(code, message));
    }

    public boolean hasError() {
        return error != null;
    }
}
