package io.agentrelay.bus;

import io.agentrelay.agent.AgentChecks;
import io.agentrelay.agent.IdentityValidator;
import io.agentrelay.mailbox.MailboxStore;
import io.agentrelay.model.BusError;
import io.agentrelay.model.BusResult;
import io.agentrelay.model.Envelope;
import io.agentrelay.model.ErrorKind;
import io.agentrelay.model.MessageKind;
import io.agentrelay.model.Priority;
import io.agentrelay.observability.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Public entry point for agent-to-agent messaging: validates identities, stamps envelopes,
 * enqueues them into the recipient's mailbox and emits a best-effort notification.
 *
 * <p>Message ids are unique among live envelopes. A send whose id is still pending anywhere is
 * refused with {@link ErrorKind#DUPLICATE_MESSAGE}, which makes a retried send with the same id
 * harmless. An id becomes reusable once its envelope is acknowledged or compacted.
 */
public final class MessageBus {
    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);
    public static final String DEFAULT_PAYMENT_CURRENCY = "SOL";
    private static final Pattern MESSAGE_ID = Pattern.compile(
            "(msg_)?[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final MailboxStore mailboxes;
    private final IdentityValidator identities;
    private final NotificationSink notifications;
    private final Clock clock;
    private final ConcurrentMap<String, String> liveIds = new ConcurrentHashMap<>();
    private final AtomicLong sentTotal = new AtomicLong(0L);
    private final AtomicLong rejectedTotal = new AtomicLong(0L);
    private final AtomicLong acknowledgedTotal = new AtomicLong(0L);
    private final AtomicLong notifyFailedTotal = new AtomicLong(0L);
    private final AtomicLong compactedTotal = new AtomicLong(0L);
    private volatile String paymentCurrency = DEFAULT_PAYMENT_CURRENCY;

    public MessageBus(MailboxStore mailboxes, IdentityValidator identities, NotificationSink notifications, Clock clock) {
        this.mailboxes = mailboxes;
        this.identities = identities;
        this.notifications = notifications;
        this.clock = clock;
    }

    public void paymentCurrency(String currency) {
        this.paymentCurrency = currency == null || currency.isBlank() ? DEFAULT_PAYMENT_CURRENCY : currency.trim();
    }

    public BusResult<Envelope> send(Envelope envelope) {
        if (envelope == null) {
            return reject(BusError.of(ErrorKind.PROTOCOL_ERROR, "Envelope is required"));
        }
        BusError senderError = AgentChecks.requireAgent(identities, envelope.from(), "Sender");
        if (senderError != null) {
            return reject(senderError);
        }
        BusError recipientError = AgentChecks.requireAgent(identities, envelope.to(), "Recipient");
        if (recipientError != null) {
            return reject(recipientError);
        }

        long nowMs = clock.millis();
        String id = envelope.hasId() ? envelope.id() : newMessageId();
        long createdAtMs = envelope.createdAtMs() > 0L ? envelope.createdAtMs() : nowMs;
        Envelope finalized = envelope.stamped(id, createdAtMs);

        if (liveIds.putIfAbsent(id, finalized.to()) != null) {
            return reject(BusError.of(ErrorKind.DUPLICATE_MESSAGE, "Message " + id + " is already pending"));
        }
        BusResult<Envelope> enqueued = mailboxes.enqueue(finalized.to(), finalized, nowMs);
        if (enqueued.isError()) {
            liveIds.remove(id, finalized.to());
            return reject(enqueued.error());
        }
        sentTotal.incrementAndGet();
        log.debug("Enqueued {} {} from {} to {}", finalized.kind().displayName(), id, finalized.from(), finalized.to());

        notifyRecipient(finalized);
        return BusResult.ok(finalized);
    }

    public List<Envelope> listPending(String agentId) {
        return mailboxes.listPending(agentId, clock.millis());
    }

    public BusResult<Envelope> acknowledge(String agentId, String messageId) {
        BusResult<Envelope> removed = mailboxes.acknowledge(agentId, messageId);
        if (removed.success()) {
            liveIds.remove(messageId);
            acknowledgedTotal.incrementAndGet();
        }
        return removed;
    }

    public BusResult<Envelope> sendServiceRequest(
            String fromAgentId,
            String toAgentId,
            String serviceName,
            Map<String, Object> serviceParameters
    ) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("serviceName", serviceName);
        payload.put("parameters", serviceParameters == null ? Map.of() : serviceParameters);
        return send(Envelope.builder()
                .from(fromAgentId)
                .to(toAgentId)
                .kind(MessageKind.SERVICE_REQUEST)
                .content("Request for service: " + serviceName)
                .payload(payload)
                .priority(Priority.NORMAL)
                .build());
    }

    public BusResult<Envelope> sendPaymentRequest(
            String fromAgentId,
            String toAgentId,
            BigDecimal amount,
            String description,
            String transactionRef
    ) {
        String currency = paymentCurrency;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("amount", amount);
        payload.put("description", description);
        payload.put("currency", currency);
        return send(Envelope.builder()
                .from(fromAgentId)
                .to(toAgentId)
                .kind(MessageKind.PAYMENT_REQUEST)
                .content("Payment request: " + (amount == null ? "0" : amount.toPlainString())
                        + " " + currency + " for " + description)
                .payload(payload)
                .transactionRef(transactionRef)
                .priority(Priority.HIGH)
                .build());
    }

    /**
     * Sends {@code kind} back to the sender of {@code original}, linked through
     * {@code inResponseTo}.
     */
    public BusResult<Envelope> reply(Envelope original, MessageKind kind, String content, Map<String, Object> payload) {
        if (original == null || !original.hasId()) {
            return reject(BusError.of(ErrorKind.PROTOCOL_ERROR, "Reply requires a delivered envelope"));
        }
        return send(Envelope.builder()
                .from(original.to())
                .to(original.from())
                .kind(kind)
                .content(content)
                .payload(payload)
                .priority(original.priority())
                .inResponseTo(original.id())
                .transactionRef(original.transactionRef())
                .build());
    }

    public int compactExpired(long retentionMs) {
        List<Envelope> removed = mailboxes.compactExpired(clock.millis(), retentionMs);
        for (Envelope envelope : removed) {
            liveIds.remove(envelope.id());
        }
        compactedTotal.addAndGet(removed.size());
        return removed.size();
    }

    public BusStats stats() {
        return new BusStats(
                sentTotal.get(),
                rejectedTotal.get(),
                acknowledgedTotal.get(),
                notifyFailedTotal.get(),
                compactedTotal.get(),
                mailboxes.mailboxCount(),
                mailboxes.totalDepth()
        );
    }

    private void notifyRecipient(Envelope envelope) {
        try {
            notifications.notify(envelope.from(), envelope.to(), "A2A Message: " + envelope.kind().displayName());
        } catch (RuntimeException e) {
            notifyFailedTotal.incrementAndGet();
            log.warn("Delivery notification failed for message {} to {}: {}", envelope.id(), envelope.to(), e.getMessage());
        }
    }

    private BusResult<Envelope> reject(BusError error) {
        rejectedTotal.incrementAndGet();
        log.debug("Send rejected: {} {}", error.kind(), error.message());
        return BusResult.fail(error);
    }

    /**
     * True for ids this bus hands out ({@code msg_<uuid>}) and for bare UUIDs.
     */
    public static boolean isMessageId(String candidate) {
        return candidate != null && MESSAGE_ID.matcher(candidate).matches();
    }

    private static String newMessageId() {
        return "msg_" + UUID.randomUUID();
    }

    public record BusStats(
            long sentTotal,
            long rejectedTotal,
            long acknowledgedTotal,
            long notifyFailedTotal,
            long compactedTotal,
            int mailboxes,
            long pendingDepth
    ) {
    }
}
