package io.agentrelay.model;

public record BusError(
        ErrorKind kind,
        String message
) {
    public static BusError of(ErrorKind kind, String message) {
        return new BusError(kind, message);
    }
}
