package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.DocumentOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Local ops in submission order, from the moment they are applied locally until their echo
 * comes back from the ordering service.
 * <p>
 * Ops are sent right away while the connection is up and only queued while it is down; either
 * way they stay queued until acknowledged, so a reconnect can regenerate all of them.
 */
public class OpSequencer {

    private static final Logger logger = LoggerFactory.getLogger(OpSequencer.class);

    private final DeltaConnection connection;
    private final Deque<PendingOp> pending = new ArrayDeque<>();

    public OpSequencer(DeltaConnection connection) {
        this.connection = connection;
    }

    /**
     * Queues the op and sends it if connected.
     *
     * @param refSeq last sequence number the local replica processed
     */
    public void submit(PendingOp op, int refSeq) {
        pending.addLast(op);
        if (connection.isConnected()) {
            connection.submit(new DocumentMessage(connection.getClientId(), refSeq, op.contents()));
        } else {
            logger.trace("Client {} queues {} while offline", connection.getClientId(), op.contents());
        }
    }

    /**
     * Matches the echo of a local op against the head of the queue.
     *
     * @return the queued op, which carries the local metadata
     * @throws IllegalStateException if the echo is not the oldest pending op
     */
    public PendingOp acknowledge(DocumentOp echo) {
        PendingOp head = pending.peekFirst();
        if (head == null) {
            throw new IllegalStateException("ack of " + echo + " without pending op");
        }
        if (!sameOp(head.contents(), echo)) {
            throw new IllegalStateException("ack of " + echo + " does not match pending " + head.contents());
        }
        return pending.removeFirst();
    }

    // the echo went through JSON, so property values may differ in their Java type
    private static boolean sameOp(DocumentOp queued, DocumentOp echo) {
        if (queued.getClass() != echo.getClass()) {
            return false;
        }
        if (queued instanceof IntervalOp queuedOp && echo instanceof IntervalOp echoOp) {
            return queuedOp.id().equals(echoOp.id()) && queuedOp.label().equals(echoOp.label());
        }
        return true;
    }

    /**
     * Takes every pending op out of the queue, oldest first, for regeneration.
     */
    public List<PendingOp> drain() {
        List<PendingOp> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }
}
