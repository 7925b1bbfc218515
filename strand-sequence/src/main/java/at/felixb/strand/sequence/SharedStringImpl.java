package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Pattern;

class SharedStringImpl implements SharedString, DeltaHandler {

    private static final Logger logger = LoggerFactory.getLogger(SharedStringImpl.class);

    private final DeltaConnection connection;
    private final Client client;
    private final OpSequencer sequencer;
    private final Map<String, IntervalCollectionImpl> intervalCollections = new LinkedHashMap<>();
    private final List<IntervalCollectionCreatedListener> collectionCreatedListeners = new ArrayList<>();

    private HandleResolver handleResolver;

    SharedStringImpl(DeltaConnection connection, MergeTreeOptions options) {
        this.connection = connection;
        this.client = new Client(connection.getClientId(), options);
        this.sequencer = new OpSequencer(connection);
    }

    Client client() {
        return client;
    }

    // -------------------------------------------------
    //  Edits
    // -------------------------------------------------

    @Override
    public void insertText(int pos, String text) {
        insertText(pos, text, null);
    }

    @Override
    public void insertText(int pos, String text, PropertySet props) {
        submitLocalEdit(client.insertTextLocal(pos, text, props));
    }

    @Override
    public void insertMarker(int pos, PropertySet props) {
        submitLocalEdit(client.insertMarkerLocal(pos, props));
    }

    @Override
    public void removeText(int start, int end) {
        submitLocalEdit(client.removeRangeLocal(start, end));
    }

    @Override
    public void annotateRange(int start, int end, PropertySet props) {
        submitLocalEdit(client.annotateRangeLocal(start, end, props));
    }

    private void submitLocalEdit(LocalEdit edit) {
        // empty ranges produce no op
        if (edit == null) {
            return;
        }
        sequencer.submit(new PendingOp(edit.op(), edit.segmentGroup()), client.getCurrentSeq());
    }

    void submitLocalOp(IntervalOp op) {
        sequencer.submit(new PendingOp(op, null), client.getCurrentSeq());
    }

    // -------------------------------------------------
    //  Queries
    // -------------------------------------------------

    @Override
    public String getText() {
        return client.getText();
    }

    @Override
    public String getText(int start, int end) {
        return client.getText(start, end);
    }

    @Override
    public String getTextWithPlaceholders() {
        return client.getTextWithPlaceholders();
    }

    @Override
    public int getLength() {
        return client.getLength();
    }

    @Override
    public Optional<SegmentOffset> getContainingSegment(int pos) {
        return client.getContainingSegment(pos);
    }

    @Override
    public Optional<SearchResult> searchFromPos(int pos, Pattern pattern) {
        return client.searchFromPos(pos, pattern);
    }

    @Override
    public LocalReference createLocalReferencePosition(int pos, ReferenceType refType) {
        return client.createLocalReferencePosition(pos, refType);
    }

    @Override
    public int localReferencePositionToPosition(LocalReference ref) {
        return client.localReferencePositionToPosition(ref);
    }

    @Override
    public void removeLocalReferencePosition(LocalReference ref) {
        client.removeLocalReferencePosition(ref);
    }

    // -------------------------------------------------
    //  Interval collections
    // -------------------------------------------------

    @Override
    public IntervalCollection getIntervalCollection(String label) {
        return collection(label, true);
    }

    private IntervalCollectionImpl collection(String label, boolean local) {
        IntervalCollectionImpl collection = intervalCollections.get(label);
        if (collection != null) {
            return collection;
        }
        collection = new IntervalCollectionImpl(Objects.requireNonNull(label, "label"), this);
        intervalCollections.put(label, collection);
        for (IntervalCollectionCreatedListener listener : List.copyOf(collectionCreatedListeners)) {
            listener.intervalCollectionCreated(label, local);
        }
        return collection;
    }

    @Override
    public List<String> getIntervalCollectionLabels() {
        return List.copyOf(intervalCollections.keySet());
    }

    @Override
    public void addIntervalCollectionCreatedListener(IntervalCollectionCreatedListener listener) {
        collectionCreatedListeners.add(listener);
    }

    // -------------------------------------------------
    //  Delta handling
    // -------------------------------------------------

    @Override
    public void process(SequencedDocumentMessage message) {
        DocumentOp contents = message.contents();
        if (message.clientId() == client.getClientId()) {
            PendingOp pending = sequencer.acknowledge(contents);
            acknowledge(pending, message.sequenceNumber());
        } else {
            applyRemote(message);
        }
        client.updateSeqNumbers(message.sequenceNumber(), message.minimumSequenceNumber());
    }

    private void acknowledge(PendingOp pending, int seq) {
        if (pending.contents() instanceof MergeTreeOp op) {
            client.ackPendingOp(op, (SegmentGroup) pending.localMetadata(), seq);
        } else if (pending.contents() instanceof IntervalOp op) {
            collection(op.label(), true).ackLocalOp(op);
        }
        logger.trace("Client {} acknowledged {} at seq {}", client.getClientId(), pending.contents(), seq);
    }

    private void applyRemote(SequencedDocumentMessage message) {
        DocumentOp contents = message.contents();
        logger.trace("Client {} applies {} of client {} at seq {}", client.getClientId(), contents,
                message.clientId(), message.sequenceNumber());
        if (contents instanceof MergeTreeOp op) {
            client.applyRemoteOp(op, message.sequenceNumber(), message.clientId(), message.referenceSequenceNumber());
        } else if (contents instanceof IntervalOp op) {
            collection(op.label(), false).applyRemoteOp(op, message.clientId(), message.referenceSequenceNumber());
        } else {
            throw new IllegalArgumentException("Unsupported op type: " + contents.getClass());
        }
    }

    @Override
    public void setConnectionState(boolean connected) {
        if (!connected) {
            logger.debug("Client {} disconnected with {} pending ops", client.getClientId(), sequencer.size());
            return;
        }
        List<PendingOp> pending = sequencer.drain();
        logger.debug("Client {} reconnected at seq {}, regenerating {} pending ops", client.getClientId(),
                client.getCurrentSeq(), pending.size());
        if (pending.isEmpty()) {
            return;
        }

        // --- regenerate in the original order, each op against the ones regenerated before it ---
        client.startResubmitPass();
        try {
            for (PendingOp op : pending) {
                resubmit(op);
            }
        } finally {
            client.endResubmitPass();
        }
    }

    private void resubmit(PendingOp pending) {
        int refSeq = client.getCurrentSeq();
        if (pending.contents() instanceof MergeTreeOp op) {
            for (LocalEdit edit : client.regeneratePendingOp(op, (SegmentGroup) pending.localMetadata())) {
                sequencer.submit(new PendingOp(edit.op(), edit.segmentGroup()), refSeq);
            }
        } else if (pending.contents() instanceof IntervalOp op) {
            IntervalCollectionImpl collection = collection(op.label(), true);
            collection.regenerateLocalOp(op, client.resubmitPerspective())
                    .ifPresent(regenerated -> sequencer.submit(new PendingOp(regenerated, null), refSeq));
        }
    }

    // -------------------------------------------------
    //  Summaries
    // -------------------------------------------------

    @Override
    public SharedStringSnapshot summarize() {
        if (!sequencer.isEmpty()) {
            throw new IllegalStateException("cannot summarize with " + sequencer.size() + " pending ops");
        }
        List<Segment> segments = client.getSegments();
        Map<Segment, Integer> indexes = new IdentityHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            indexes.put(segments.get(i), i);
        }

        Map<String, List<IntervalSnapshot>> collections = new LinkedHashMap<>();
        intervalCollections.forEach((label, collection) -> {
            List<IntervalSnapshot> intervals = new ArrayList<>();
            for (SequenceInterval interval : collection.intervalsInInsertionOrder()) {
                PropertySet props = interval.getProperties();
                intervals.add(new IntervalSnapshot(interval.getIntervalId(), interval.getIntervalType(),
                        anchorOf(interval.getStart(), indexes), anchorOf(interval.getEnd(), indexes),
                        props.isEmpty() ? null : props));
            }
            collections.put(label, intervals);
        });

        return new SharedStringSnapshot(client.getCurrentSeq(), client.getMinSeq(), client.serializeSegments(),
                collections);
    }

    private static IntervalSnapshot.Anchor anchorOf(LocalReference ref, Map<Segment, Integer> indexes) {
        if (ref.isDetached()) {
            return new IntervalSnapshot.Anchor(IntervalSnapshot.Anchor.DETACHED, 0);
        }
        if (ref.getSegment() == null) {
            return new IntervalSnapshot.Anchor(IntervalSnapshot.Anchor.START_OF_DOCUMENT, 0);
        }
        return new IntervalSnapshot.Anchor(indexes.get(ref.getSegment()), ref.getOffset());
    }

    void loadSnapshot(SharedStringSnapshot snapshot) {
        client.load(snapshot.segments(), snapshot.sequenceNumber(), snapshot.minimumSequenceNumber());
        List<Segment> segments = client.getSegments();

        snapshot.intervalCollections().forEach((label, intervals) -> {
            IntervalCollectionImpl collection = new IntervalCollectionImpl(label, this);
            intervalCollections.put(label, collection);
            for (IntervalSnapshot interval : intervals) {
                ReferenceType refType = interval.intervalType().referenceType();
                collection.restore(interval.id(), interval.intervalType(),
                        referenceAt(interval.start(), refType, segments),
                        referenceAt(interval.end(), refType, segments),
                        interval.props() == null ? new PropertySet() : interval.props().copy());
            }
        });
        logger.debug("Client {} loaded snapshot at seq {} with {} segments", client.getClientId(),
                snapshot.sequenceNumber(), segments.size());
    }

    private LocalReference referenceAt(IntervalSnapshot.Anchor anchor, ReferenceType refType, List<Segment> segments) {
        return switch (anchor.segment()) {
            case IntervalSnapshot.Anchor.DETACHED -> client.createDetachedReference(refType);
            case IntervalSnapshot.Anchor.START_OF_DOCUMENT -> client.getMergeTree().createStartOfDocumentReference(refType);
            default -> {
                if (anchor.segment() < 0 || anchor.segment() >= segments.size()) {
                    throw new IllegalArgumentException("anchor outside of snapshot: " + anchor);
                }
                yield client.getMergeTree().createLocalReference(segments.get(anchor.segment()), anchor.offset(), refType);
            }
        };
    }

    // -------------------------------------------------
    //  Handles
    // -------------------------------------------------

    @Override
    public Set<ObjectHandle> getReferencedHandles() {
        Set<ObjectHandle> handles = new LinkedHashSet<>();
        for (Segment segment : client.getSegments()) {
            if (!segment.isRemoved()) {
                handles.addAll(segment.getProperties().handles());
            }
        }
        for (IntervalCollectionImpl collection : intervalCollections.values()) {
            for (SequenceInterval interval : collection.intervalsInInsertionOrder()) {
                handles.addAll(interval.properties().handles());
            }
        }
        return handles;
    }

    @Override
    public Optional<Object> resolveHandle(ObjectHandle handle) {
        if (handleResolver == null) {
            throw new IllegalStateException("no handle resolver set");
        }
        return handleResolver.resolve(handle);
    }

    @Override
    public void setHandleResolver(HandleResolver resolver) {
        this.handleResolver = resolver;
    }

    // -------------------------------------------------
    //  State
    // -------------------------------------------------

    @Override
    public void addDeltaListener(MergeTreeDeltaListener listener) {
        client.addDeltaListener(listener);
    }

    @Override
    public int getClientId() {
        return client.getClientId();
    }

    @Override
    public boolean isConnected() {
        return connection.isConnected();
    }

    @Override
    public boolean hasPendingOps() {
        return !sequencer.isEmpty();
    }

    @Override
    public int getCurrentSeq() {
        return client.getCurrentSeq();
    }

    @Override
    public int getMinSeq() {
        return client.getMinSeq();
    }
}
