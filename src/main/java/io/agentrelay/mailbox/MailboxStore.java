package io.agentrelay.mailbox;

import io.agentrelay.model.BusResult;
import io.agentrelay.model.Envelope;
import io.agentrelay.model.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-agent mailboxes, created lazily on the first envelope addressed to an agent.
 *
 * <p>Locking is per mailbox. The store never calls out to collaborators, so nothing here
 * waits on I/O while a mailbox monitor is held.
 */
public final class MailboxStore {
    public static final int UNBOUNDED = 0;

    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private volatile int capacity;

    public MailboxStore() {
        this(UNBOUNDED);
    }

    public MailboxStore(int capacity) {
        this.capacity = Math.max(UNBOUNDED, capacity);
    }

    public void capacity(int capacity) {
        this.capacity = Math.max(UNBOUNDED, capacity);
    }

    public int capacity() {
        return capacity;
    }

    public BusResult<Envelope> enqueue(String agentId, Envelope envelope, long nowMs) {
        if (agentId == null || envelope == null || !envelope.hasId()) {
            return BusResult.fail(ErrorKind.PROTOCOL_ERROR, "Envelope must carry an id and a recipient");
        }
        Mailbox mailbox = mailboxes.computeIfAbsent(agentId, ignored -> new Mailbox());
        if (!mailbox.offer(envelope, capacity, nowMs)) {
            return BusResult.fail(ErrorKind.MAILBOX_FULL,
                    "Mailbox for agent " + agentId + " is full (capacity=" + capacity + ")");
        }
        return BusResult.ok(envelope);
    }

    public List<Envelope> listPending(String agentId, long nowMs) {
        Mailbox mailbox = agentId == null ? null : mailboxes.get(agentId);
        if (mailbox == null) {
            return List.of();
        }
        return List.copyOf(mailbox.pending(nowMs));
    }

    public BusResult<Envelope> acknowledge(String agentId, String messageId) {
        Mailbox mailbox = agentId == null ? null : mailboxes.get(agentId);
        if (mailbox == null) {
            return BusResult.fail(ErrorKind.NOT_FOUND, "No message queue found for agent " + agentId);
        }
        Envelope removed = messageId == null ? null : mailbox.remove(messageId);
        if (removed == null) {
            return BusResult.fail(ErrorKind.NOT_FOUND, "Message " + messageId + " not found in queue");
        }
        return BusResult.ok(removed);
    }

    /**
     * Drops envelopes that expired at or before {@code nowMs - retentionMs}. Expired envelopes
     * are already invisible to listing; this only reclaims memory.
     */
    public List<Envelope> compactExpired(long nowMs, long retentionMs) {
        long cutoff = nowMs - Math.max(0L, retentionMs);
        List<Envelope> removed = new ArrayList<>();
        for (Mailbox mailbox : mailboxes.values()) {
            removed.addAll(mailbox.removeExpiredBefore(cutoff));
        }
        return removed;
    }

    public int depth(String agentId) {
        Mailbox mailbox = agentId == null ? null : mailboxes.get(agentId);
        return mailbox == null ? 0 : mailbox.size();
    }

    public long totalDepth() {
        long total = 0L;
        for (Mailbox mailbox : mailboxes.values()) {
            total += mailbox.size();
        }
        return total;
    }

    public int mailboxCount() {
        return mailboxes.size();
    }
}
