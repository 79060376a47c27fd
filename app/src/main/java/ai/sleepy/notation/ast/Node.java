package ai.sleepy.notation.ast;

import ai.sleepy.notation.lex.BracketKind;
import ai.sleepy.notation.lex.Position;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A non-terminal unit of the tree. A node either owns a bracket body ({@link #openKind()}
 * present) or is a colon chain / variant-carrying name without one.
 *
 * @param name element name, possibly dotted; empty for anonymous groups
 * @param namePosition where the name starts; equals {@code start} for unbraced nodes
 * @param styleVariants {@code $variant} suffixes in source order
 * @param arguments value segments of the colon chain written before the body
 * @param openKind bracket variety of the body
 * @param children body items in source order
 * @param trailing value segments written after the body
 * @param braced whether the node was written as a {@code {name:...}} declaration
 * @param valueList whether the body is a compact styling-property value list
 */
public record Node(String name,
                   Position namePosition,
                   List<StyleVariant> styleVariants,
                   List<Leaf> arguments,
                   Optional<BracketKind> openKind,
                   List<Element> children,
                   List<Leaf> trailing,
                   boolean braced,
                   boolean valueList,
                   Position start,
                   Position end) implements Element {

    public Node {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(namePosition, "namePosition");
        styleVariants = List.copyOf(Objects.requireNonNull(styleVariants, "styleVariants"));
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
        openKind = openKind == null ? Optional.empty() : openKind;
        children = List.copyOf(Objects.requireNonNull(children, "children"));
        trailing = List.copyOf(Objects.requireNonNull(trailing, "trailing"));
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static Node anonymous(BracketKind kind, List<Element> children, Position start, Position end) {
        return new Node("", start, List.of(), List.of(), Optional.of(kind), children, List.of(), false, false, start, end);
    }

    /**
     * The document-level container used when a parse yields zero or several roots.
     */
    public static Node document(List<Element> roots, Position end) {
        return new Node("", Position.START, List.of(), List.of(), Optional.empty(), roots, List.of(), false, false,
                Position.START, end);
    }

    public Node asBraced(Position bracedStart, Position bracedEnd) {
        return new Node(name, namePosition, styleVariants, arguments, openKind, children, trailing, true, valueList,
                bracedStart, bracedEnd);
    }

    public static Node fromLeaf(Leaf leaf) {
        return new Node(leaf.name(), leaf.start(), List.of(), List.of(Leaf.bare(leaf.value(), leaf.binding(),
                leaf.valueStart(), leaf.end())), Optional.empty(), List.of(), List.of(), false, false,
                leaf.start(), leaf.end());
    }

    public boolean isAnonymous() {
        return name.isEmpty();
    }

    public List<String> styleVariantNames() {
        return styleVariants.stream().map(StyleVariant::name).toList();
    }

    /**
     * The dotted name when it is itself a binding, otherwise the first binding argument.
     */
    public Optional<BindingExpression> bindingExpression() {
        Optional<BindingExpression> fromName = BindingExpression.parse(name);
        if (fromName.isPresent()) {
            return fromName;
        }
        return arguments.stream()
                .map(Leaf::binding)
                .flatMap(Optional::stream)
                .findFirst();
    }
}
