package ai.sleepy.notation.ast;

import static org.assertj.core.api.Assertions.assertThat;

import ai.sleepy.notation.lex.Tokenizer;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class NotationTreesTest {

    private static final String CARD = "card$primary:(column:[img:api.user.avatar,h3:api.user.name])";

    private static Node parse(String text) {
        return new NotationParser().parse(Tokenizer.tokenize(text)).root();
    }

    @Test
    void nodeAtReturnsInnermostElement() {
        Node root = parse(CARD);

        Optional<Element> avatar = NotationTrees.nodeAt(root, 0, 30);
        assertThat(avatar).get().extracting(Element::name).isEqualTo("img");

        assertThat(NotationTrees.nodeAt(root, 0, 43)).get().extracting(Element::name).isEqualTo("h3");
        assertThat(NotationTrees.nodeAt(root, 0, 20)).get().extracting(Element::name).isEqualTo("column");
        assertThat(NotationTrees.nodeAt(root, 0, 0)).get().extracting(Element::name).isEqualTo("card");
    }

    @Test
    void nodeAtOutsideRootIsEmpty() {
        Node root = parse(CARD);

        assertThat(NotationTrees.nodeAt(root, 3, 0)).isEmpty();
        assertThat(NotationTrees.nodeAt(root, 0, CARD.length())).isEmpty();
    }

    @Test
    void enclosingBodySkipsLeaves() {
        Node root = parse(CARD);

        assertThat(NotationTrees.enclosingBody(root, 0, 30)).get().extracting(Node::name).isEqualTo("column");
        assertThat(NotationTrees.enclosingBody(root, 0, 14)).get().extracting(Node::name).isEqualTo("column");
        assertThat(NotationTrees.enclosingBody(root, 0, 13)).get().extracting(Node::name).isEqualTo("card");
    }

    @Test
    void sameStructureIgnoresLayout() {
        Node compact = parse(CARD);
        Node spread = parse("card$primary: (\n  column: [\n    img: api.user.avatar,\n    h3: api.user.name\n  ]\n)");

        assertThat(NotationTrees.sameStructure(compact, spread)).isTrue();
    }

    @Test
    void sameStructureDetectsDifferences() {
        Node root = parse(CARD);

        assertThat(NotationTrees.sameStructure(root, parse("card$ghost:(column:[img:api.user.avatar,h3:api.user.name])"))).isFalse();
        assertThat(NotationTrees.sameStructure(root, parse("card$primary:(column:(img:api.user.avatar,h3:api.user.name))"))).isFalse();
        assertThat(NotationTrees.sameStructure(root, parse("card$primary:(column:[h3:api.user.name,img:api.user.avatar])"))).isFalse();
    }

    @Test
    void bindingExpressionRequiresKnownRootAndPath() {
        assertThat(BindingExpression.parse("item.price")).map(BindingExpression::segments)
                .contains(List.of("item", "price"));
        assertThat(BindingExpression.parse("api")).isEmpty();
        assertThat(BindingExpression.parse("user.name")).isEmpty();
        assertThat(BindingExpression.parse("api..name")).isEmpty();
    }
}
