package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.ReferenceType;

public enum IntervalType {
    /** Bounds detach when their content is removed. */
    SIMPLE(ReferenceType.SIMPLE),
    /** Bounds slide to the next live content when their content is removed. */
    SLIDE_ON_REMOVE(ReferenceType.SLIDE_ON_REMOVE);

    private final ReferenceType referenceType;

    IntervalType(ReferenceType referenceType) {
        this.referenceType = referenceType;
    }

    public ReferenceType referenceType() {
        return referenceType;
    }
}
