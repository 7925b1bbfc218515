package at.felixb.strand.mergetree;

/**
 * Whose view of the sequence a length or position is measured in.
 */
public interface Perspective {

    int lengthOf(Segment segment);

    /** Whether the block's cached local length is also its length in this perspective. */
    boolean usesCachedLength(MergeBlock block);

    /**
     * Whether an insert arriving at the gap right before this zero-length segment may go in front
     * of it. Inserts always go behind the last acknowledged zero-length segment of a run.
     */
    default boolean insertsBefore(Segment zeroLengthSegment) {
        return false;
    }

    static Perspective local() {
        return LocalPerspective.INSTANCE;
    }

    /** The view of {@code clientId} after applying every op up to {@code refSeq}. */
    static Perspective remote(int refSeq, int clientId) {
        return new RemotePerspective(refSeq, clientId);
    }
}
