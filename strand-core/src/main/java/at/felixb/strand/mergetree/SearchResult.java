package at.felixb.strand.mergetree;

/**
 * A regex match in the visible text.
 *
 * @param text the matched text
 * @param pos  absolute position of the first matched element
 */
public record SearchResult(String text, int pos) {
}
