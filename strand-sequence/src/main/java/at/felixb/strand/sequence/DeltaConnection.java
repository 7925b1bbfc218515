package at.felixb.strand.sequence;

/**
 * Transport to the ordering service, supplied by the embedder.
 */
public interface DeltaConnection {

    /** Stable for the lifetime of the replica, also across reconnects. */
    int getClientId();

    boolean isConnected();

    void submit(DocumentMessage message);

    void attach(DeltaHandler handler);
}
