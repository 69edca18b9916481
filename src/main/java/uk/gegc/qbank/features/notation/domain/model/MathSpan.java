package uk.gegc.qbank.features.notation.domain.model;

/**
 * Location of one math span in the scanned text. {@code start} is the offset of the opener,
 * {@code end} the offset just past the closer.
 */
public record MathSpan(int start, int end, boolean block) {

    public int delimiterLength() {
        return block ? 2 : 1;
    }

    public int contentStart() {
        return start + delimiterLength();
    }

    public int contentEnd() {
        return end - delimiterLength();
    }
}
