package ai.sleepy.notation.classify;

/**
 * Highlighting categories, declared from highest to lowest precedence.
 */
public enum SpanCategory {
    SECTION_KEYWORD("SectionKeyword"),
    CONTROL_FLOW_KEYWORD("ControlFlowKeyword"),
    DATA_BINDING("DataBinding"),
    STYLE_VARIANT("StyleVariant"),
    HTTP_VERB("HttpVerb"),
    HTTP_PATH("HttpPath"),
    ELEMENT_NAME("ElementName"),
    PLAIN_VALUE("PlainValue");

    private final String displayName;

    SpanCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
