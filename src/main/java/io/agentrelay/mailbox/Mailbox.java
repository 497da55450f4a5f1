package io.agentrelay.mailbox;

import io.agentrelay.model.Envelope;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Pending envelopes for one agent. Every method holds this mailbox's monitor, so enqueue,
 * acknowledge and listing on the same agent are serialized while other mailboxes proceed.
 */
final class Mailbox {
    static final Comparator<Envelope> DELIVERY_ORDER = Comparator
            .comparing(Envelope::priority)
            .thenComparingLong(Envelope::createdAtMs);

    private final List<Envelope> entries = new ArrayList<>();

    synchronized boolean offer(Envelope envelope, int capacity, long nowMs) {
        if (capacity > 0 && countVisible(nowMs) >= capacity) {
            return false;
        }
        entries.add(envelope);
        return true;
    }

    synchronized List<Envelope> pending(long nowMs) {
        List<Envelope> visible = new ArrayList<>(entries.size());
        for (Envelope envelope : entries) {
            if (!envelope.isExpiredAt(nowMs)) {
                visible.add(envelope);
            }
        }
        // List.sort is stable: equal priority and timestamp keep insertion order.
        visible.sort(DELIVERY_ORDER);
        return visible;
    }

    synchronized Envelope remove(String messageId) {
        Iterator<Envelope> it = entries.iterator();
        while (it.hasNext()) {
            Envelope envelope = it.next();
            if (envelope.id().equals(messageId)) {
                it.remove();
                return envelope;
            }
        }
        return null;
    }

    synchronized List<Envelope> removeExpiredBefore(long cutoffMs) {
        List<Envelope> removed = new ArrayList<>();
        Iterator<Envelope> it = entries.iterator();
        while (it.hasNext()) {
            Envelope envelope = it.next();
            if (envelope.expiresAtMs() != null && envelope.expiresAtMs() <= cutoffMs) {
                it.remove();
                removed.add(envelope);
            }
        }
        return removed;
    }

    synchronized int size() {
        return entries.size();
    }

    private int countVisible(long nowMs) {
        int count = 0;
        for (Envelope envelope : entries) {
            if (!envelope.isExpiredAt(nowMs)) {
                count++;
            }
        }
        return count;
    }
}
