package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.PropertySet;

import java.util.List;
import java.util.Optional;

/**
 * Labelled set of intervals on one {@link SharedString}. Obtained with
 * {@link SharedString#getIntervalCollection(String)}.
 */
public interface IntervalCollection extends Iterable<SequenceInterval> {

    /** Props key whose String value becomes the id of an added interval. */
    String INTERVAL_ID_KEY = "intervalId";

    String getLabel();

    /**
     * Adds an interval on the local view. The id comes from {@link #INTERVAL_ID_KEY} in
     * {@code props} or is a random UUID.
     *
     * @throws IndexOutOfBoundsException unless {@code 0 <= start <= end <= length}
     */
    SequenceInterval add(int start, int end, IntervalType intervalType, PropertySet props);

    /**
     * Moves the supplied bounds; a null bound stays where it is.
     *
     * @return the changed interval, or empty for an unknown id
     */
    Optional<SequenceInterval> change(String id, Integer start, Integer end);

    /**
     * Merges {@code patch} into the interval's properties; null values delete their key.
     */
    Optional<SequenceInterval> changeProperties(String id, PropertySet patch);

    Optional<SequenceInterval> removeIntervalById(String id);

    Optional<SequenceInterval> getIntervalById(String id);

    /**
     * Intervals with {@code start <= rangeEnd && end >= rangeStart}, detached ones left out.
     */
    List<SequenceInterval> findOverlappingIntervals(int rangeStart, int rangeEnd);

    /** All intervals ordered by start position, then id. */
    List<SequenceInterval> getIntervals();

    int size();

    void addListener(IntervalCollectionListener listener);

    void removeListener(IntervalCollectionListener listener);
}
