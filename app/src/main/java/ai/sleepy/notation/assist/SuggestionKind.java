package ai.sleepy.notation.assist;

public enum SuggestionKind {
    SECTION,
    CONTROL_FLOW,
    COMPONENT,
    STYLE_VARIANT,
    BINDING
}
