package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.DocumentOp;

/**
 * A local op waiting for its echo. {@code localMetadata} is the segment group of a merge tree
 * op and null for interval ops.
 */
public record PendingOp(DocumentOp contents, Object localMetadata) {
}
