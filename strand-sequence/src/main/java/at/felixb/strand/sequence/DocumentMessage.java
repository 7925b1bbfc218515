package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.DocumentOp;

/**
 * An op on its way to the ordering service. {@code referenceSequenceNumber} is the last sequence
 * number the author had processed when it made the op.
 */
public record DocumentMessage(int clientId, int referenceSequenceNumber, DocumentOp contents) {
}
