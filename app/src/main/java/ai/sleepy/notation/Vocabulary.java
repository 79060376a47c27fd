package ai.sleepy.notation;

import java.util.Set;

/**
 * Reserved words of the notation. The sets are fixed; classification, analysis and
 * formatting all read them from here.
 */
public final class Vocabulary {

    public static final Set<String> SECTION_KEYWORDS = Set.of(
            "styles", "frontend", "api", "database", "security", "deployment");

    public static final Set<String> CONTROL_FLOW_KEYWORDS = Set.of("forEach", "if", "unless", "else");

    public static final Set<String> HTTP_VERBS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");

    public static final Set<String> BINDING_ROOTS = Set.of("api", "item", "db", "response");

    public static final Set<String> UI_ELEMENTS = Set.of(
            "card", "button", "input", "column", "row",
            "h1", "h2", "h3", "h4", "h5", "h6",
            "p", "img", "div", "span", "form", "list", "grid", "table",
            "header", "footer", "nav", "modal");

    public static final Set<String> STYLING_PROPERTIES = Set.of(
            "display", "flexDirection", "justifyContent", "alignItems", "padding", "margin",
            "width", "height", "backgroundColor", "color", "fontSize", "borderRadius",
            "border", "boxShadow", "position", "zIndex", "overflow", "opacity", "visibility",
            "font", "background", "transition", "transform", "gap", "inset", "gridTemplateColumns");

    public static final Set<String> STYLE_VARIANTS = Set.of(
            "primary", "secondary", "ghost", "dark", "light", "hover");

    private Vocabulary() {
    }

    public static boolean isSectionKeyword(String word) {
        return SECTION_KEYWORDS.contains(word);
    }

    public static boolean isControlFlowKeyword(String word) {
        return CONTROL_FLOW_KEYWORDS.contains(word);
    }

    public static boolean isHttpVerb(String word) {
        return HTTP_VERBS.contains(word);
    }

    public static boolean isBindingRoot(String word) {
        return BINDING_ROOTS.contains(word);
    }

    public static boolean isUiElement(String word) {
        return UI_ELEMENTS.contains(word);
    }

    public static boolean isStylingProperty(String word) {
        return STYLING_PROPERTIES.contains(word);
    }
}
