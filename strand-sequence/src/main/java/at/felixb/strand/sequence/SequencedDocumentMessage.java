package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.DocumentOp;

/**
 * An op as delivered by the ordering service, in strict sequence number order.
 * {@code minimumSequenceNumber} is the lowest reference sequence number any later op may carry.
 */
public record SequencedDocumentMessage(int sequenceNumber,
                                       int minimumSequenceNumber,
                                       int clientId,
                                       int referenceSequenceNumber,
                                       DocumentOp contents) {
}
