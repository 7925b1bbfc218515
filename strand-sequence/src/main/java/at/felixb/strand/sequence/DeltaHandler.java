package at.felixb.strand.sequence;

/**
 * Receiving side of a {@link DeltaConnection}.
 */
public interface DeltaHandler {

    void process(SequencedDocumentMessage message);

    /**
     * Called after the transport lost or regained its connection. On reconnect every sequenced
     * message missed while offline has been delivered before this call.
     */
    void setConnectionState(boolean connected);
}
