package uk.gegc.qbank.features.notation.domain.model;

/**
 * Math delimiter dialect expected by a downstream renderer.
 */
public enum TargetDialect {
    /**
     * Canvas LMS: inline math as {@code \(...\)}, display math left as {@code $$...$$}.
     */
    CANVAS("\\(", "\\)", "$$", "$$"),

    /**
     * Plain MathJax bracket delimiters for both inline and display math.
     */
    MATHJAX_BRACKETS("\\(", "\\)", "\\[", "\\]");

    private final String inlineOpen;
    private final String inlineClose;
    private final String blockOpen;
    private final String blockClose;

    TargetDialect(String inlineOpen, String inlineClose, String blockOpen, String blockClose) {
        this.inlineOpen = inlineOpen;
        this.inlineClose = inlineClose;
        this.blockOpen = blockOpen;
        this.blockClose = blockClose;
    }

    public String inlineOpen() {
        return inlineOpen;
    }

    public String inlineClose() {
        return inlineClose;
    }

    public String blockOpen() {
        return blockOpen;
    }

    public String blockClose() {
        return blockClose;
    }
}
