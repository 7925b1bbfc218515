package at.felixb.strand.mergetree;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Inserts a text run or, with {@code marker} set, a marker at {@code pos}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InsertOp(int pos, String text, boolean marker, PropertySet props) implements MergeTreeOp {

    public InsertOp {
        if (!marker && (text == null || text.isEmpty())) {
            throw new IllegalArgumentException("insert of empty text");
        }
    }
}
