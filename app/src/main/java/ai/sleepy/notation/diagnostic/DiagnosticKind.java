package ai.sleepy.notation.diagnostic;

/**
 * Error taxonomy for structural problems in notation text.
 */
public enum DiagnosticKind {
    /** A character sequence the scanner could only keep as a raw literal, such as an unterminated string. */
    LEX_ERROR("LexError"),
    /** An opening bracket without a close, a close without an opening, or a close of the wrong kind. */
    BRACKET_MISMATCH_ERROR("BracketMismatchError"),
    /** Well-bracketed text whose items do not fit the element grammar. */
    UNEXPECTED_STRUCTURE_ERROR("UnexpectedStructureError"),
    /** Content after the last top-level closing bracket that does not start a declaration. */
    TRAILING_CONTENT_ERROR("TrailingContentError");

    private final String displayName;

    DiagnosticKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
