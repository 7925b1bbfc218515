package at.felixb.strand.mergetree;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Contents of an op message. Modules built on the merge tree register further subtypes with
 * their JSON mapper.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InsertOp.class, name = "insert"),
        @JsonSubTypes.Type(value = RemoveOp.class, name = "remove"),
        @JsonSubTypes.Type(value = AnnotateOp.class, name = "annotate")
})
public interface DocumentOp {
}
