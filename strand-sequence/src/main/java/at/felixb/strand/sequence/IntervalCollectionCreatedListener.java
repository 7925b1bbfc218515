package at.felixb.strand.sequence;

@FunctionalInterface
public interface IntervalCollectionCreatedListener {

    void intervalCollectionCreated(String label, boolean local);
}
