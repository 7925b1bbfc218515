package at.felixb.strand.mergetree;

/**
 * A position that follows its content: a (segment, offset) pair that moves with the character
 * it was created on when the tree splits, merges or compacts segments.
 * <p>
 * A reference without segment marks the start of the document. An offset equal to the host's
 * length marks the position after the host's last element.
 */
public final class LocalReference {

    private final ReferenceType refType;

    Segment segment;
    int offset;
    boolean detached;

    LocalReference(ReferenceType refType) {
        this.refType = refType;
    }

    public Segment getSegment() {
        return segment;
    }

    public int getOffset() {
        return offset;
    }

    public ReferenceType getRefType() {
        return refType;
    }

    public boolean isDetached() {
        return detached;
    }

    void detach() {
        this.segment = null;
        this.offset = 0;
        this.detached = true;
    }

    @Override
    public String toString() {
        return "LocalReference{" + refType + ", offset=" + offset + (detached ? ", detached" : "") + '}';
    }
}
