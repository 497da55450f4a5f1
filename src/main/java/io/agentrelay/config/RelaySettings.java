package io.agentrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tunables read from {@code agentrelay-settings.json}. Missing or out-of-range values fall back to
 * (or are clamped against) {@link #defaults()}.
 */
public record RelaySettings(
        int mailboxCapacity,
        long expiredRetentionMs,
        long completionReward,
        long failurePenalty,
        String paymentCurrency,
        String rpcEndpoint,
        String agentVersion
) {
    public static final int DEFAULT_MAILBOX_CAPACITY = 0;
    public static final long DEFAULT_EXPIRED_RETENTION_MS = 60L * 60L * 1000L;
    public static final long DEFAULT_COMPLETION_REWARD = 10L;
    public static final long DEFAULT_FAILURE_PENALTY = 5L;
    public static final String DEFAULT_PAYMENT_CURRENCY = "SOL";
    public static final String DEFAULT_RPC_ENDPOINT = "http://localhost:8088/rpc";
    public static final String DEFAULT_AGENT_VERSION = "1.0.0";

    public static RelaySettings defaults() {
        return new RelaySettings(
                DEFAULT_MAILBOX_CAPACITY,
                DEFAULT_EXPIRED_RETENTION_MS,
                DEFAULT_COMPLETION_REWARD,
                DEFAULT_FAILURE_PENALTY,
                DEFAULT_PAYMENT_CURRENCY,
                DEFAULT_RPC_ENDPOINT,
                DEFAULT_AGENT_VERSION
        );
    }

    public static RelaySettings fromFile(SettingsFile file, RelaySettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new RelaySettings(
                sanitizeInt(file.mailboxCapacity(), defaults.mailboxCapacity(), 0),
                sanitizeLong(file.expiredRetentionMs(), defaults.expiredRetentionMs(), 0L),
                sanitizeLong(file.completionReward(), defaults.completionReward(), 0L),
                sanitizeLong(file.failurePenalty(), defaults.failurePenalty(), 0L),
                sanitizeText(file.paymentCurrency(), defaults.paymentCurrency()),
                sanitizeText(file.rpcEndpoint(), defaults.rpcEndpoint()),
                sanitizeText(file.agentVersion(), defaults.agentVersion())
        );
    }

    public List<String> changedFields(RelaySettings other) {
        List<String> out = new ArrayList<>();
        if (other == null) {
            return out;
        }
        if (mailboxCapacity != other.mailboxCapacity) {
            out.add("mailboxCapacity");
        }
        if (expiredRetentionMs != other.expiredRetentionMs) {
            out.add("expiredRetentionMs");
        }
        if (completionReward != other.completionReward) {
            out.add("completionReward");
        }
        if (failurePenalty != other.failurePenalty) {
            out.add("failurePenalty");
        }
        if (!Objects.equals(paymentCurrency, other.paymentCurrency)) {
            out.add("paymentCurrency");
        }
        if (!Objects.equals(rpcEndpoint, other.rpcEndpoint)) {
            out.add("rpcEndpoint");
        }
        if (!Objects.equals(agentVersion, other.agentVersion)) {
            out.add("agentVersion");
        }
        return out;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SettingsFile(
            Integer mailboxCapacity,
            Long expiredRetentionMs,
            Long completionReward,
            Long failurePenalty,
            String paymentCurrency,
            String rpcEndpoint,
            String agentVersion
    ) {
    }
}
