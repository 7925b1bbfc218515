package at.felixb.strand.sequence;

import java.util.*;

/**
 * In-memory ordering service: stamps submitted messages with sequence numbers and delivers them to
 * every connected client in that order. Messages travel as JSON both ways.
 */
class MockOrderingService {

    private final List<Connection> connections = new ArrayList<>();
    private final Deque<String> submitted = new ArrayDeque<>();
    private final List<String> sequenced = new ArrayList<>();

    private int sequenceNumber = 0;
    private int minimumSequenceNumber = 0;

    Connection connect() {
        Connection connection = new Connection(connections.size(), sequenceNumber);
        connections.add(connection);
        return connection;
    }

    SharedString createSharedString() {
        return SharedString.create(connect());
    }

    int pendingMessages() {
        return submitted.size();
    }

    int getSequenceNumber() {
        return sequenceNumber;
    }

    int getMinimumSequenceNumber() {
        return minimumSequenceNumber;
    }

    void processOneMessage() {
        String json = submitted.pollFirst();
        if (json == null) {
            throw new IllegalStateException("no message to process");
        }
        DocumentMessage message = MessageCodec.decodeDocumentMessage(json);
        sequenceNumber++;
        minimumSequenceNumber = Math.max(minimumSequenceNumber, lowestReferenceSequenceNumber(message));

        String out = MessageCodec.encode(new SequencedDocumentMessage(sequenceNumber, minimumSequenceNumber,
                message.clientId(), message.referenceSequenceNumber(), message.contents()));
        sequenced.add(out);
        for (Connection connection : connections) {
            if (connection.connected) {
                connection.deliverUpTo(sequenced.size());
            }
        }
    }

    void processAllMessages() {
        while (!submitted.isEmpty()) {
            processOneMessage();
        }
    }

    // queued messages and connected clients still may reference older state
    private int lowestReferenceSequenceNumber(DocumentMessage current) {
        int lowest = current.referenceSequenceNumber();
        for (String json : submitted) {
            lowest = Math.min(lowest, MessageCodec.decodeDocumentMessage(json).referenceSequenceNumber());
        }
        for (Connection connection : connections) {
            if (connection.connected) {
                lowest = Math.min(lowest, connection.delivered);
            }
        }
        return lowest;
    }

    final class Connection implements DeltaConnection {

        private final int clientId;
        private DeltaHandler handler;
        private boolean connected = true;
        private int delivered;

        private Connection(int clientId, int delivered) {
            this.clientId = clientId;
            this.delivered = delivered;
        }

        @Override
        public int getClientId() {
            return clientId;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public void submit(DocumentMessage message) {
            if (!connected) {
                throw new IllegalStateException("client " + clientId + " is offline");
            }
            submitted.addLast(MessageCodec.encode(message));
        }

        @Override
        public void attach(DeltaHandler handler) {
            this.handler = handler;
        }

        /** Unsequenced messages of this client are lost. */
        void disconnect() {
            connected = false;
            submitted.removeIf(json -> MessageCodec.decodeDocumentMessage(json).clientId() == clientId);
            handler.setConnectionState(false);
        }

        /** Delivers the messages missed while offline, then signals the connection. */
        void reconnect() {
            deliverUpTo(sequenced.size());
            connected = true;
            handler.setConnectionState(true);
        }

        private void deliverUpTo(int count) {
            while (delivered < count) {
                String json = sequenced.get(delivered++);
                handler.process(MessageCodec.decodeSequencedMessage(json));
            }
        }
    }
}
