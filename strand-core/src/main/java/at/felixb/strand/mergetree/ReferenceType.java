package at.felixb.strand.mergetree;

public enum ReferenceType {
    /** Detaches when its content is removed. */
    SIMPLE,
    /** Slides to the next live content when its content is removed. */
    SLIDE_ON_REMOVE
}
