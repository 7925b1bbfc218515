package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.PropertySet;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class IntervalCollectionConvergenceTest {

    private static final int CLIENTS = 3;
    private static final String LABEL = "fuzz";

    @RepeatedTest(10)
    void randomEditsIntervalOpsAndReconnects_converge(RepetitionInfo repetition) {
        Random random = new Random(5000L + repetition.getCurrentRepetition());
        MockOrderingService service = new MockOrderingService();
        List<MockOrderingService.Connection> connections = new ArrayList<>();
        List<SharedString> sharedStrings = new ArrayList<>();
        for (int i = 0; i < CLIENTS; i++) {
            MockOrderingService.Connection connection = service.connect();
            connections.add(connection);
            sharedStrings.add(SharedString.create(connection));
        }

        for (int round = 0; round < 100; round++) {
            int client = random.nextInt(CLIENTS);
            SharedString sharedString = sharedStrings.get(client);
            IntervalCollection collection = sharedString.getIntervalCollection(LABEL);
            int length = sharedString.getLength();
            List<SequenceInterval> intervals = collection.getIntervals();
            int action = random.nextInt(12);

            if (action == 0) {
                MockOrderingService.Connection connection = connections.get(client);
                if (connection.isConnected()) {
                    connection.disconnect();
                } else {
                    connection.reconnect();
                }
            } else if (action <= 3 || length == 0) {
                sharedString.insertText(random.nextInt(length + 1), "c" + client + "r" + round);
            } else if (action <= 5) {
                int start = random.nextInt(length);
                sharedString.removeText(start, start + 1 + random.nextInt(Math.min(5, length - start)));
            } else if (action <= 7 || intervals.isEmpty()) {
                int start = random.nextInt(length + 1);
                int end = start + random.nextInt(length - start + 1);
                IntervalType type = random.nextBoolean() ? IntervalType.SLIDE_ON_REMOVE : IntervalType.SIMPLE;
                collection.add(start, end, type, PropertySet.of("round", round));
            } else {
                String id = intervals.get(random.nextInt(intervals.size())).getIntervalId();
                if (action == 8) {
                    int start = random.nextInt(length + 1);
                    int end = start + random.nextInt(length - start + 1);
                    collection.change(id, random.nextInt(4) == 0 ? null : start, end);
                } else if (action == 9) {
                    collection.changeProperties(id, PropertySet.of("k", random.nextBoolean() ? round : null));
                } else {
                    collection.removeIntervalById(id);
                }
            }

            int toProcess = random.nextInt(service.pendingMessages() + 1);
            for (int i = 0; i < toProcess; i++) {
                service.processOneMessage();
            }
        }

        for (MockOrderingService.Connection connection : connections) {
            if (!connection.isConnected()) {
                connection.reconnect();
            }
        }
        service.processAllMessages();

        assertConverged(sharedStrings);
    }

    private static void assertConverged(List<SharedString> sharedStrings) {
        SharedString reference = sharedStrings.get(0);
        Map<String, String> expected = describe(reference);
        for (SharedString sharedString : sharedStrings) {
            assertFalse(sharedString.hasPendingOps());
            assertEquals(reference.getText(), sharedString.getText());
            assertEquals(expected, describe(sharedString), "intervals of client " + sharedString.getClientId());
        }
    }

    private static Map<String, String> describe(SharedString sharedString) {
        Map<String, String> described = new TreeMap<>();
        for (SequenceInterval interval : sharedString.getIntervalCollection(LABEL)) {
            described.put(interval.getIntervalId(), interval.getStartPosition() + ".." + interval.getEndPosition()
                    + " " + interval.getIntervalType() + " " + new TreeMap<>(interval.getProperties().asMap()));
        }
        return described;
    }
}
