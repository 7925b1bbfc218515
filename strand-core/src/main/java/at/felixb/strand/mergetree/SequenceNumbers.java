package at.felixb.strand.mergetree;

/**
 * Reserved sequence numbers and client ids used to stamp segments.
 */
public final class SequenceNumbers {

    /** Content every client knows about, e.g. loaded from a snapshot or compacted. */
    public static final int UNIVERSAL_SEQ = 0;

    /** Local content whose op has not been sequenced yet. */
    public static final int UNASSIGNED_SEQ = -1;

    public static final int NOT_REMOVED = -2;

    /** Author of universal content. */
    public static final int NON_COLLAB_CLIENT = -2;

    /** Resolved position of a reference that lost its content. */
    public static final int DETACHED_POSITION = -1;

    private SequenceNumbers() {
    }
}
