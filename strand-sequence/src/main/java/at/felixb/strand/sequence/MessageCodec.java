package at.felixb.strand.sequence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.NamedType;

/**
 * JSON form of op messages and snapshots. Ops carry a {@code type} discriminator; the interval
 * ops are registered here on top of the merge tree ops.
 */
public final class MessageCodec {

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static {
        mapper.registerSubtypes(
                new NamedType(IntervalAddOp.class, "intervalAdd"),
                new NamedType(IntervalChangeOp.class, "intervalChange"),
                new NamedType(IntervalDeleteOp.class, "intervalDelete"));
    }

    private MessageCodec() {
    }

    public static String encode(DocumentMessage message) {
        return write(message);
    }

    public static String encode(SequencedDocumentMessage message) {
        return write(message);
    }

    public static String encode(SharedStringSnapshot snapshot) {
        return write(snapshot);
    }

    /**
     * @throws IllegalArgumentException if the JSON is not a document message
     */
    public static DocumentMessage decodeDocumentMessage(String json) {
        return read(json, DocumentMessage.class);
    }

    public static SequencedDocumentMessage decodeSequencedMessage(String json) {
        return read(json, SequencedDocumentMessage.class);
    }

    public static SharedStringSnapshot decodeSnapshot(String json) {
        return read(json, SharedStringSnapshot.class);
    }

    private static String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
