package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.PropertySet;

/**
 * Callbacks fire synchronously after the collection changed; {@code local} tells whether the
 * change was made on this replica or came in as a sequenced remote op.
 */
public interface IntervalCollectionListener {

    default void intervalAdded(SequenceInterval interval, boolean local) {
    }

    default void intervalChanged(SequenceInterval interval, boolean local) {
    }

    default void intervalDeleted(SequenceInterval interval, boolean local) {
    }

    /**
     * @param deltas the keys that were written, null values for deleted keys
     */
    default void propertiesChanged(SequenceInterval interval, PropertySet deltas, boolean local) {
    }
}
