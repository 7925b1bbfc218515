package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.Client;
import at.felixb.strand.mergetree.LocalReference;
import at.felixb.strand.mergetree.PropertySet;

import java.util.HashMap;
import java.util.Map;

import static at.felixb.strand.mergetree.SequenceNumbers.DETACHED_POSITION;

/**
 * A range of the sequence whose bounds are anchored on the characters at its start and end
 * position, so it moves with its content. An end at the length of the sequence is anchored
 * behind the last character.
 */
public final class SequenceInterval {

    private final String id;
    private final IntervalType intervalType;
    private final Client client;
    private final PropertySet properties;

    LocalReference start;
    LocalReference end;

    // local changes not yet sequenced; remote writes to the same bound or key lose against them
    int pendingStartChanges;
    int pendingEndChanges;
    final Map<String, Integer> pendingPropertyChanges = new HashMap<>();

    SequenceInterval(String id, IntervalType intervalType, LocalReference start, LocalReference end,
                     PropertySet properties, Client client) {
        this.id = id;
        this.intervalType = intervalType;
        this.start = start;
        this.end = end;
        this.properties = properties == null ? new PropertySet() : properties;
        this.client = client;
    }

    public String getIntervalId() {
        return id;
    }

    public IntervalType getIntervalType() {
        return intervalType;
    }

    public LocalReference getStart() {
        return start;
    }

    public LocalReference getEnd() {
        return end;
    }

    public int getStartPosition() {
        return client.localReferencePositionToPosition(start);
    }

    public int getEndPosition() {
        return client.localReferencePositionToPosition(end);
    }

    /** True once a bound lost its content, see {@link IntervalType#SIMPLE}. */
    public boolean isDetached() {
        return getStartPosition() == DETACHED_POSITION || getEndPosition() == DETACHED_POSITION;
    }

    public boolean overlaps(int rangeStart, int rangeEnd) {
        int startPos = getStartPosition();
        int endPos = getEndPosition();
        if (startPos == DETACHED_POSITION || endPos == DETACHED_POSITION) {
            return false;
        }
        return startPos <= rangeEnd && endPos >= rangeStart;
    }

    public PropertySet getProperties() {
        return properties.copy();
    }

    PropertySet properties() {
        return properties;
    }

    boolean hasPendingChange(String key) {
        return pendingPropertyChanges.getOrDefault(key, 0) > 0;
    }

    void addPendingChange(String key) {
        pendingPropertyChanges.merge(key, 1, Integer::sum);
    }

    void releasePendingChange(String key) {
        pendingPropertyChanges.computeIfPresent(key, (k, count) -> count > 1 ? count - 1 : null);
    }

    @Override
    public String toString() {
        return "SequenceInterval{" + id + " [" + getStartPosition() + ", " + getEndPosition() + "] "
                + intervalType + " " + properties + '}';
    }
}
