package ai.sleepy.notation.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over parsed trees.
 */
public final class NotationTrees {

    private NotationTrees() {
    }

    /**
     * Compares two trees ignoring source positions.
     */
    public static boolean sameStructure(Element left, Element right) {
        if (left instanceof Leaf a && right instanceof Leaf b) {
            return a.name().equals(b.name()) && a.value().equals(b.value()) && a.binding().equals(b.binding());
        }
        if (left instanceof Node a && right instanceof Node b) {
            return a.name().equals(b.name())
                    && a.styleVariantNames().equals(b.styleVariantNames())
                    && a.openKind().equals(b.openKind())
                    && a.braced() == b.braced()
                    && a.valueList() == b.valueList()
                    && sameElements(a.arguments(), b.arguments())
                    && sameElements(a.children(), b.children())
                    && sameElements(a.trailing(), b.trailing());
        }
        return false;
    }

    private static boolean sameElements(List<? extends Element> left, List<? extends Element> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!sameStructure(left.get(i), right.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Finds the innermost element whose span contains the location, or empty when the
     * location lies outside {@code root}.
     */
    public static Optional<Element> nodeAt(Node root, int line, int column) {
        if (!root.contains(line, column)) {
            return Optional.empty();
        }
        Element found = root;
        boolean descended = true;
        while (descended && found instanceof Node node) {
            descended = false;
            for (Element child : members(node)) {
                if (child.contains(line, column)) {
                    found = child;
                    descended = true;
                    break;
                }
            }
        }
        return Optional.of(found);
    }

    /**
     * Finds the innermost node with a bracket body whose span contains the location.
     */
    public static Optional<Node> enclosingBody(Node root, int line, int column) {
        Node owner = null;
        Element current = root;
        while (current instanceof Node node && node.contains(line, column)) {
            if (node.openKind().isPresent()) {
                owner = node;
            }
            Element next = null;
            for (Element child : node.children()) {
                if (child.contains(line, column)) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                break;
            }
            current = next;
        }
        return Optional.ofNullable(owner);
    }

    private static List<Element> members(Node node) {
        if (node.arguments().isEmpty() && node.trailing().isEmpty()) {
            return node.children();
        }
        List<Element> all = new ArrayList<>(node.arguments());
        all.addAll(node.children());
        all.addAll(node.trailing());
        return all;
    }
}
