package io.agentrelay.model;

public enum ErrorKind {
    UNKNOWN_AGENT,
    NOT_AN_AGENT,
    NOT_FOUND,
    INVALID_TRANSITION,
    DUPLICATE_MESSAGE,
    MAILBOX_FULL,
    PROTOCOL_ERROR,
    INTERNAL_ERROR
}
