package at.felixb.strand.mergetree;

/**
 * Merges {@code props} into every segment of {@code [start, end)}; null values delete keys.
 */
public record AnnotateOp(int start, int end, PropertySet props) implements MergeTreeOp {
}
