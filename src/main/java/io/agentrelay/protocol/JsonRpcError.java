package io.agentrelay.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(
        int code,
        String message,
        @JsonInclude(JsonInclude.Include.NON_NULL) Object data
) {
    public static JsonRpcError of(int code, String message) {
        return new JsonRpcError(code, message, null);
    }
}
