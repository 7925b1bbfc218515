package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.*;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A collaboratively edited string with markers, character properties and interval collections.
 * <p>
 * Edits apply to the local replica at once and are sent through the {@link DeltaConnection};
 * sequenced ops of other clients arrive through the same connection. Replicas that processed the
 * same sequenced ops show the same content.
 */
public interface SharedString {

    static SharedString create(DeltaConnection connection) {
        return create(connection, MergeTreeOptions.DEFAULT);
    }

    static SharedString create(DeltaConnection connection, MergeTreeOptions options) {
        SharedStringImpl sharedString = new SharedStringImpl(connection, options);
        connection.attach(sharedString);
        return sharedString;
    }

    /**
     * A replica starting from a summary. The connection must deliver the ops sequenced after
     * {@link SharedStringSnapshot#sequenceNumber()}.
     */
    static SharedString load(DeltaConnection connection, SharedStringSnapshot snapshot) {
        return load(connection, snapshot, MergeTreeOptions.DEFAULT);
    }

    static SharedString load(DeltaConnection connection, SharedStringSnapshot snapshot, MergeTreeOptions options) {
        SharedStringImpl sharedString = new SharedStringImpl(connection, options);
        sharedString.loadSnapshot(snapshot);
        connection.attach(sharedString);
        return sharedString;
    }

    // #### Edits

    void insertText(int pos, String text);

    void insertText(int pos, String text, PropertySet props);

    void insertMarker(int pos, PropertySet props);

    /** Removes {@code [start, end)}. */
    void removeText(int start, int end);

    void annotateRange(int start, int end, PropertySet props);

    // #### Queries

    String getText();

    String getText(int start, int end);

    String getTextWithPlaceholders();

    int getLength();

    Optional<SegmentOffset> getContainingSegment(int pos);

    Optional<SearchResult> searchFromPos(int pos, Pattern pattern);

    // #### References

    LocalReference createLocalReferencePosition(int pos, ReferenceType refType);

    int localReferencePositionToPosition(LocalReference ref);

    void removeLocalReferencePosition(LocalReference ref);

    // #### Intervals

    /**
     * The collection named {@code label}, created on first use.
     */
    IntervalCollection getIntervalCollection(String label);

    /** Labels in the order their collections were created. */
    List<String> getIntervalCollectionLabels();

    void addIntervalCollectionCreatedListener(IntervalCollectionCreatedListener listener);

    // #### Lifecycle

    /**
     * @throws IllegalStateException while local ops wait for their acknowledgement
     */
    SharedStringSnapshot summarize();

    Set<ObjectHandle> getReferencedHandles();

    /**
     * @throws IllegalStateException if no {@link HandleResolver} was set
     */
    Optional<Object> resolveHandle(ObjectHandle handle);

    void setHandleResolver(HandleResolver resolver);

    void addDeltaListener(MergeTreeDeltaListener listener);

    int getClientId();

    boolean isConnected();

    boolean hasPendingOps();

    int getCurrentSeq();

    int getMinSeq();
}
