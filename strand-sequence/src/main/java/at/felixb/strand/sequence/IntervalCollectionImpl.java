package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.Client;
import at.felixb.strand.mergetree.LocalReference;
import at.felixb.strand.mergetree.Perspective;
import at.felixb.strand.mergetree.PropertySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static at.felixb.strand.mergetree.SequenceNumbers.DETACHED_POSITION;

class IntervalCollectionImpl implements IntervalCollection {

    private static final Logger logger = LoggerFactory.getLogger(IntervalCollectionImpl.class);

    private static final Comparator<SequenceInterval> BY_START_THEN_ID =
            Comparator.comparingInt(SequenceInterval::getStartPosition)
                    .thenComparing(SequenceInterval::getIntervalId);

    private final String label;
    private final SharedStringImpl owner;
    private final Client client;
    private final Map<String, SequenceInterval> intervals = new LinkedHashMap<>();
    private final List<IntervalCollectionListener> listeners = new ArrayList<>();

    IntervalCollectionImpl(String label, SharedStringImpl owner) {
        this.label = label;
        this.owner = owner;
        this.client = owner.client();
    }

    @Override
    public String getLabel() {
        return label;
    }

    // #### Local ops

    @Override
    public SequenceInterval add(int start, int end, IntervalType intervalType, PropertySet props) {
        Objects.requireNonNull(intervalType, "intervalType");
        int length = client.getLength();
        if (start < 0 || start > end || end > length) {
            throw new IndexOutOfBoundsException("interval [" + start + ", " + end + "], length: " + length);
        }
        String id = props != null && props.get(INTERVAL_ID_KEY) instanceof String given
                ? given
                : UUID.randomUUID().toString();
        if (intervals.containsKey(id)) {
            throw new IllegalArgumentException("duplicate interval id: " + id);
        }
        PropertySet stored = withoutIntervalId(props);

        LocalReference startRef = client.createLocalReferencePosition(start, intervalType.referenceType());
        LocalReference endRef = client.createLocalReferencePosition(end, intervalType.referenceType());
        SequenceInterval interval = new SequenceInterval(id, intervalType, startRef, endRef, stored, client);
        intervals.put(id, interval);

        owner.submitLocalOp(new IntervalAddOp(label, id, start, end, intervalType,
                stored.isEmpty() ? null : stored.copy()));
        for (IntervalCollectionListener listener : List.copyOf(listeners)) {
            listener.intervalAdded(interval, true);
        }
        return interval;
    }

    @Override
    public Optional<SequenceInterval> change(String id, Integer start, Integer end) {
        SequenceInterval interval = intervals.get(id);
        if (interval == null) {
            return Optional.empty();
        }
        if (start == null && end == null) {
            return Optional.of(interval);
        }
        int length = client.getLength();
        if ((start != null && (start < 0 || start > length))
                || (end != null && (end < 0 || end > length))
                || (start != null && end != null && start > end)) {
            throw new IndexOutOfBoundsException("interval [" + start + ", " + end + "], length: " + length);
        }

        if (start != null) {
            interval.start = replaceReference(interval, interval.start, start, Perspective.local());
            interval.pendingStartChanges++;
        }
        if (end != null) {
            interval.end = replaceReference(interval, interval.end, end, Perspective.local());
            interval.pendingEndChanges++;
        }

        owner.submitLocalOp(new IntervalChangeOp(label, id, start, end, null));
        for (IntervalCollectionListener listener : List.copyOf(listeners)) {
            listener.intervalChanged(interval, true);
        }
        return Optional.of(interval);
    }

    @Override
    public Optional<SequenceInterval> changeProperties(String id, PropertySet patch) {
        SequenceInterval interval = intervals.get(id);
        if (interval == null) {
            return Optional.empty();
        }
        PropertySet deltas = withoutIntervalId(patch);
        if (deltas.isEmpty()) {
            return Optional.of(interval);
        }

        interval.properties().merge(deltas);
        for (String key : deltas.keySet()) {
            interval.addPendingChange(key);
        }

        owner.submitLocalOp(new IntervalChangeOp(label, id, null, null, deltas.copy()));
        for (IntervalCollectionListener listener : List.copyOf(listeners)) {
            listener.propertiesChanged(interval, deltas, true);
        }
        return Optional.of(interval);
    }

    @Override
    public Optional<SequenceInterval> removeIntervalById(String id) {
        SequenceInterval interval = intervals.remove(id);
        if (interval == null) {
            return Optional.empty();
        }
        unlink(interval);
        owner.submitLocalOp(new IntervalDeleteOp(label, id));
        for (IntervalCollectionListener listener : List.copyOf(listeners)) {
            listener.intervalDeleted(interval, true);
        }
        return Optional.of(interval);
    }

    // #### Queries

    @Override
    public Optional<SequenceInterval> getIntervalById(String id) {
        return Optional.ofNullable(intervals.get(id));
    }

    @Override
    public List<SequenceInterval> findOverlappingIntervals(int rangeStart, int rangeEnd) {
        List<SequenceInterval> found = new ArrayList<>();
        for (SequenceInterval interval : intervals.values()) {
            if (interval.overlaps(rangeStart, rangeEnd)) {
                found.add(interval);
            }
        }
        found.sort(BY_START_THEN_ID);
        return found;
    }

    @Override
    public List<SequenceInterval> getIntervals() {
        List<SequenceInterval> sorted = new ArrayList<>(intervals.values());
        sorted.sort(BY_START_THEN_ID);
        return sorted;
    }

    @Override
    public Iterator<SequenceInterval> iterator() {
        return getIntervals().iterator();
    }

    @Override
    public int size() {
        return intervals.size();
    }

    @Override
    public void addListener(IntervalCollectionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(IntervalCollectionListener listener) {
        listeners.remove(listener);
    }

    // -------------------------------------------------
    //  Sequenced ops
    // -------------------------------------------------

    /**
     * Applies an op of another client. Positions in the op are resolved in the author's
     * perspective at {@code refSeq}.
     */
    void applyRemoteOp(IntervalOp op, int clientId, int refSeq) {
        Perspective perspective = Perspective.remote(refSeq, clientId);
        if (op instanceof IntervalAddOp addOp) {
            applyRemoteAdd(addOp, perspective);
        } else if (op instanceof IntervalChangeOp changeOp) {
            applyRemoteChange(changeOp, perspective);
        } else if (op instanceof IntervalDeleteOp deleteOp) {
            applyRemoteDelete(deleteOp);
        }
    }

    private void applyRemoteAdd(IntervalAddOp op, Perspective perspective) {
        if (intervals.containsKey(op.id())) {
            logger.warn("Collection '{}' ignores add of existing interval {}", label, op.id());
            return;
        }
        IntervalType type = op.intervalType();
        LocalReference startRef = createReference(op.start(), type, perspective);
        LocalReference endRef = createReference(op.end(), type, perspective);
        PropertySet props = op.props() == null ? new PropertySet() : op.props().copy();
        SequenceInterval interval = new SequenceInterval(op.id(), type, startRef, endRef, props, client);
        intervals.put(op.id(), interval);
        for (IntervalCollectionListener listener : List.copyOf(listeners)) {
            listener.intervalAdded(interval, false);
        }
    }

    private void applyRemoteChange(IntervalChangeOp op, Perspective perspective) {
        SequenceInterval interval = intervals.get(op.id());
        if (interval == null) {
            logger.trace("Collection '{}' ignores change of unknown interval {}", label, op.id());
            return;
        }

        boolean moved = false;
        if (op.start() != null && interval.pendingStartChanges == 0) {
            interval.start = replaceReference(interval, interval.start, op.start(), perspective);
            moved = true;
        }
        if (op.end() != null && interval.pendingEndChanges == 0) {
            interval.end = replaceReference(interval, interval.end, op.end(), perspective);
            moved = true;
        }

        PropertySet applied = new PropertySet();
        if (op.changesProperties()) {
            for (String key : op.props().keySet()) {
                if (!interval.hasPendingChange(key)) {
                    applied.put(key, op.props().get(key));
                }
            }
            interval.properties().merge(applied);
        }

        if (moved) {
            for (IntervalCollectionListener listener : List.copyOf(listeners)) {
                listener.intervalChanged(interval, false);
            }
        }
        if (!applied.isEmpty()) {
            for (IntervalCollectionListener listener : List.copyOf(listeners)) {
                listener.propertiesChanged(interval, applied, false);
            }
        }
    }

    private void applyRemoteDelete(IntervalDeleteOp op) {
        SequenceInterval interval = intervals.remove(op.id());
        if (interval == null) {
            return;
        }
        unlink(interval);
        for (IntervalCollectionListener listener : List.copyOf(listeners)) {
            listener.intervalDeleted(interval, false);
        }
    }

    /**
     * The echo of a local op. The local state already reflects it; only the pending counters
     * that shield it from older remote writes are released.
     */
    void ackLocalOp(IntervalOp op) {
        if (!(op instanceof IntervalChangeOp changeOp)) {
            return;
        }
        SequenceInterval interval = intervals.get(changeOp.id());
        if (interval == null) {
            return;
        }
        releasePending(interval, changeOp);
    }

    private static void releasePending(SequenceInterval interval, IntervalChangeOp op) {
        if (op.start() != null) {
            interval.pendingStartChanges--;
        }
        if (op.end() != null) {
            interval.pendingEndChanges--;
        }
        if (op.changesProperties()) {
            for (String key : op.props().keySet()) {
                interval.releasePendingChange(key);
            }
        }
    }

    // -------------------------------------------------
    //  Resubmission
    // -------------------------------------------------

    /**
     * Recomputes a pending op after a reconnect. Bounds are re-read from the anchors in the
     * resubmit perspective and the anchors re-created there, so they sit where peers will put them.
     *
     * @return the op to send, or empty if the interval no longer exists
     */
    Optional<IntervalOp> regenerateLocalOp(IntervalOp op, Perspective perspective) {
        SequenceInterval interval = intervals.get(op.id());
        if (op instanceof IntervalDeleteOp) {
            return Optional.of(op);
        }
        if (interval == null) {
            logger.warn("Collection '{}' drops resubmitted op on interval {}: interval no longer exists", label, op.id());
            return Optional.empty();
        }
        if (op instanceof IntervalAddOp addOp) {
            int start = rebaseStart(interval, perspective);
            int end = rebaseEnd(interval, perspective);
            return Optional.of(new IntervalAddOp(label, addOp.id(), start, end, addOp.intervalType(), addOp.props()));
        }
        IntervalChangeOp changeOp = (IntervalChangeOp) op;
        Integer start = changeOp.start() == null ? null : rebaseStart(interval, perspective);
        Integer end = changeOp.end() == null ? null : rebaseEnd(interval, perspective);
        return Optional.of(new IntervalChangeOp(label, changeOp.id(), start, end, changeOp.props()));
    }

    private int rebaseStart(SequenceInterval interval, Perspective perspective) {
        int pos = client.localReferencePositionToPosition(interval.start, perspective);
        if (pos != DETACHED_POSITION) {
            interval.start = replaceReference(interval, interval.start, pos, perspective);
        }
        return pos;
    }

    private int rebaseEnd(SequenceInterval interval, Perspective perspective) {
        int pos = client.localReferencePositionToPosition(interval.end, perspective);
        if (pos != DETACHED_POSITION) {
            interval.end = replaceReference(interval, interval.end, pos, perspective);
        }
        return pos;
    }

    // -------------------------------------------------
    //  Snapshots
    // -------------------------------------------------

    void restore(String id, IntervalType intervalType, LocalReference start, LocalReference end, PropertySet props) {
        intervals.put(id, new SequenceInterval(id, intervalType, start, end, props, client));
    }

    Collection<SequenceInterval> intervalsInInsertionOrder() {
        return Collections.unmodifiableCollection(intervals.values());
    }

    boolean hasPendingChanges() {
        for (SequenceInterval interval : intervals.values()) {
            if (interval.pendingStartChanges > 0 || interval.pendingEndChanges > 0
                    || !interval.pendingPropertyChanges.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    // -------------------------------------------------
    //  Helpers
    // -------------------------------------------------

    private LocalReference replaceReference(SequenceInterval interval, LocalReference old, int pos, Perspective perspective) {
        LocalReference created = createReference(pos, interval.getIntervalType(), perspective);
        client.removeLocalReferencePosition(old);
        return created;
    }

    private LocalReference createReference(int pos, IntervalType type, Perspective perspective) {
        if (pos == DETACHED_POSITION) {
            return client.createDetachedReference(type.referenceType());
        }
        return client.createLocalReferencePosition(pos, type.referenceType(), perspective);
    }

    private void unlink(SequenceInterval interval) {
        client.removeLocalReferencePosition(interval.start);
        client.removeLocalReferencePosition(interval.end);
    }

    private static PropertySet withoutIntervalId(PropertySet props) {
        if (props == null) {
            return new PropertySet();
        }
        PropertySet copy = props.copy();
        if (copy.containsKey(INTERVAL_ID_KEY)) {
            copy.merge(PropertySet.of(INTERVAL_ID_KEY, null));
        }
        return copy;
    }
}
