package ai.sleepy.notation.assist;

import ai.sleepy.notation.ast.BindingExpression;
import java.util.Map;
import java.util.Optional;

/**
 * Short reference text for reserved words, binding paths and style variants.
 */
public final class KeywordDocumentation {

    private static final Map<String, String> KEYWORDS = Map.of(
            "styles", "Styles section: styling rules for components. Example: button:(padding:(8px 16px), color:white)",
            "frontend", "Frontend section: UI pages and components. Example: login:(column:[input, button])",
            "api", "API section: backend endpoints and their logic. Example: POST:/auth/login:(body:(email, password))",
            "database", "Database section: data schema, one entry per table. Example: users:(id:uuid_primary, name:string_required)",
            "security", "Security section: authentication and security settings. Example: jwt:(secret:env.JWT_SECRET, expiry:24h)",
            "deployment", "Deployment section: hosting and build settings. Example: frontend:(platform:vercel, build:npm_run_build)",
            "forEach", "Loop: repeats the template for every item of a collection. Syntax: forEach:api.items:[template]",
            "if", "Conditional: renders the content when the condition holds. Syntax: if:api.condition:[content]",
            "unless", "Negative conditional: renders the content when the condition is false. Syntax: unless:api.condition:[content]",
            "else", "Alternative branch of the preceding if or unless. Syntax: else:[content]");

    private KeywordDocumentation() {
    }

    public static Optional<String> describe(String word) {
        if (word == null || word.isEmpty()) {
            return Optional.empty();
        }
        String doc = KEYWORDS.get(word);
        if (doc != null) {
            return Optional.of(doc);
        }
        Optional<BindingExpression> binding = BindingExpression.parse(word);
        if (binding.isPresent()) {
            return Optional.of("Data binding: value read from '" + binding.get().path() + "' ("
                    + binding.get().root() + " data)");
        }
        if (word.length() > 1 && word.charAt(0) == '$') {
            return Optional.of("Style variant: applies the '" + word.substring(1) + "' presentation");
        }
        return Optional.empty();
    }
}
