package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SharedStringTest {

    private DeltaConnection connection;
    private SharedString sharedString;

    @BeforeEach
    void setUp() {
        connection = mock(DeltaConnection.class);
        when(connection.getClientId()).thenReturn(3);
        when(connection.isConnected()).thenReturn(true);
        sharedString = SharedString.create(connection);
    }

    private DeltaHandler handler() {
        return (DeltaHandler) sharedString;
    }

    @Test
    void create_attachesToConnection() {
        verify(connection).attach(handler());
        assertEquals(3, sharedString.getClientId());
    }

    @Test
    void insertText_appliesLocallyAndSubmits() {
        sharedString.insertText(0, "abc");

        assertEquals("abc", sharedString.getText());
        assertTrue(sharedString.hasPendingOps());
        verify(connection).submit(new DocumentMessage(3, 0, new InsertOp(0, "abc", false, null)));
    }

    @Test
    void ownEcho_acknowledgesPendingOp() {
        sharedString.insertText(0, "abc");

        handler().process(new SequencedDocumentMessage(1, 0, 3, 0, new InsertOp(0, "abc", false, null)));

        assertFalse(sharedString.hasPendingOps());
        assertEquals(1, sharedString.getCurrentSeq());
        assertEquals("abc", sharedString.getText());
    }

    @Test
    void ownEcho_ofOtherOp_throws() {
        sharedString.insertText(0, "abc");

        assertThrows(IllegalStateException.class,
                () -> handler().process(new SequencedDocumentMessage(1, 0, 3, 0, new RemoveOp(0, 1))));
    }

    @Test
    void ownEcho_withoutPendingOp_throws() {
        assertThrows(IllegalStateException.class,
                () -> handler().process(new SequencedDocumentMessage(1, 0, 3, 0, new RemoveOp(0, 1))));
    }

    @Test
    void remoteOp_isAppliedInAuthorsPerspective() {
        handler().process(new SequencedDocumentMessage(1, 0, 5, 0, new InsertOp(0, "hello", false, null)));
        sharedString.insertText(5, "!");
        // made by client 5 before it saw the "!"
        handler().process(new SequencedDocumentMessage(2, 0, 5, 1, new InsertOp(5, " world", false, null)));

        assertEquals("hello world!", sharedString.getText());
        assertEquals(2, sharedString.getCurrentSeq());
    }

    @Test
    void removeText_ofEmptyRange_sendsNothing() {
        sharedString.removeText(0, 0);

        verify(connection, never()).submit(any());
        assertFalse(sharedString.hasPendingOps());
    }

    @Test
    void whileOffline_opsAreQueuedNotSent() {
        when(connection.isConnected()).thenReturn(false);

        sharedString.insertText(0, "abc");
        sharedString.annotateRange(0, 2, PropertySet.of("bold", true));

        verify(connection, never()).submit(any());
        assertTrue(sharedString.hasPendingOps());
        assertFalse(sharedString.isConnected());
    }

    @Test
    void reconnect_resendsQueuedOpsInOrder() {
        when(connection.isConnected()).thenReturn(false);
        sharedString.insertText(0, "abc");
        sharedString.insertMarker(3, PropertySet.of("kind", "para"));

        when(connection.isConnected()).thenReturn(true);
        handler().setConnectionState(true);

        var inOrder = inOrder(connection);
        inOrder.verify(connection).submit(new DocumentMessage(3, 0, new InsertOp(0, "abc", false, null)));
        inOrder.verify(connection).submit(
                new DocumentMessage(3, 0, new InsertOp(3, null, true, PropertySet.of("kind", "para"))));
    }

    @Test
    void markers_renderAsPlaceholder() {
        sharedString.insertText(0, "ab");
        sharedString.insertMarker(1, null);

        assertEquals("ab", sharedString.getText());
        assertEquals("a" + Marker.PLACEHOLDER + "b", sharedString.getTextWithPlaceholders());
        assertEquals(3, sharedString.getLength());
    }

    @Test
    void searchFromPos_findsMatch() {
        sharedString.insertText(0, "find the needle here");

        Optional<SearchResult> result = sharedString.searchFromPos(3, Pattern.compile("needle"));

        assertTrue(result.isPresent());
        assertEquals(9, result.get().pos());
    }

    @Test
    void deltaListener_seesLocalEdits() {
        List<MergeTreeDeltaEvent> events = new ArrayList<>();
        sharedString.addDeltaListener(events::add);

        sharedString.insertText(0, "abc");
        sharedString.removeText(1, 2);

        assertEquals(2, events.size());
    }

    @Test
    void localReference_followsItsCharacter() {
        sharedString.insertText(0, "world");
        LocalReference ref = sharedString.createLocalReferencePosition(1, ReferenceType.SLIDE_ON_REMOVE);

        sharedString.insertText(0, "hello ");

        assertEquals(7, sharedString.localReferencePositionToPosition(ref));
        sharedString.removeLocalReferencePosition(ref);
    }

    @Test
    void summarize_withPendingOps_throws() {
        sharedString.insertText(0, "abc");

        assertThrows(IllegalStateException.class, sharedString::summarize);
    }

    @Test
    void getReferencedHandles_collectsSegmentAndIntervalHandles() {
        ObjectHandle image = ObjectHandle.of("/images/1");
        ObjectHandle comment = ObjectHandle.of("/comments/7");
        sharedString.insertText(0, "abc", PropertySet.of("image", image));
        sharedString.insertText(3, "def");
        sharedString.getIntervalCollection("comments").add(0, 2, IntervalType.SLIDE_ON_REMOVE,
                PropertySet.of("thread", comment));

        Set<ObjectHandle> handles = sharedString.getReferencedHandles();

        assertEquals(Set.of(image, comment), handles);
    }

    @Test
    void getReferencedHandles_skipsRemovedContent() {
        sharedString.insertText(0, "abc", PropertySet.of("image", ObjectHandle.of("/images/1")));
        sharedString.removeText(0, 3);

        assertTrue(sharedString.getReferencedHandles().isEmpty());
    }

    @Test
    void resolveHandle_delegatesToResolver() {
        ObjectHandle handle = ObjectHandle.of("/images/1");
        HandleResolver resolver = mock(HandleResolver.class);
        when(resolver.resolve(handle)).thenReturn(Optional.of("image"));

        assertThrows(IllegalStateException.class, () -> sharedString.resolveHandle(handle));

        sharedString.setHandleResolver(resolver);
        assertEquals(Optional.of("image"), sharedString.resolveHandle(handle));
    }
}
