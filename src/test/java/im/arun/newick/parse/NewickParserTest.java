package im.arun.newick.parse;

import im.arun.newick.config.NewickConfig;
import im.arun.newick.model.Forest;
import im.arun.newick.model.Node;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NewickParserTest {

    private final NewickParser parser = new NewickParser();

    @Test
    void parsesNamesAndLengths() {
        Node root = parser.parseTree("(A:1,B:2)C;");

        assertEquals("C", root.getName());
        assertNull(root.getLength());
        assertNull(root.getParent());
        assertEquals(2, root.getChildCount());

        Node a = root.getChildren().get(0);
        Node b = root.getChildren().get(1);
        assertEquals("A", a.getName());
        assertEquals(new BigDecimal("1"), a.getLength());
        assertEquals("B", b.getName());
        assertEquals(new BigDecimal("2"), b.getLength());
        assertSame(root, a.getParent());
        assertSame(root, b.getParent());
    }

    @Test
    void terminatorIsOptional() {
        Node root = parser.parseTree("(A,B)C");
        assertEquals(List.of("A", "B"), root.getLeafNames());
    }

    @Test
    void skipsWhitespace() {
        Node root = parser.parseTree("  ( A :1 ,\n\tB:2.5 )  C  ;  \n");

        assertEquals("C", root.getName());
        assertEquals(List.of("A", "B"), root.getLeafNames());
        assertEquals(new BigDecimal("2.5"), root.getChildren().get(1).getLength());
    }

    @Test
    void namesAreTrimmedAndBlankNamesAreAbsent() {
        Node root = parser.parseTree("( Homo sapiens ,  ,(x,y))");

        assertEquals("Homo sapiens", root.getChildren().get(0).getName());
        assertNull(root.getChildren().get(1).getName());
        assertNull(root.getName());
        assertNull(root.getChildren().get(2).getName());
    }

    @Test
    void capturesComments() {
        Node root = parser.parseTree("(A[&&NHX:S=human]:1,B [note] :2)C[root];");

        Node a = root.getChildren().get(0);
        assertEquals("A", a.getName());
        assertEquals("&&NHX:S=human", a.getComment());
        assertEquals(new BigDecimal("1"), a.getLength());

        Node b = root.getChildren().get(1);
        assertEquals("B", b.getName());
        assertEquals("note", b.getComment());
        assertEquals(new BigDecimal("2"), b.getLength());

        assertEquals("root", root.getComment());
    }

    @Test
    void lengthKeepsItsTextualForm() {
        Node root = parser.parseTree("(A:1.50,B:.5,C:5.)D:0;");

        assertEquals("1.50", root.getChildren().get(0).getLength().toPlainString());
        assertEquals(0, new BigDecimal("0.5").compareTo(root.getChildren().get(1).getLength()));
        assertEquals(0, new BigDecimal("5").compareTo(root.getChildren().get(2).getLength()));
        assertEquals(BigDecimal.ZERO, root.getLength());
    }

    @Test
    void singleLeaf() {
        Node root = parser.parseTree("A;");
        assertEquals("A", root.getName());
        assertTrue(root.isLeaf());
    }

    @Test
    void missingSeparatorIsSyntaxError() {
        NewickSyntaxException e = assertThrows(NewickSyntaxException.class,
            () -> parser.parseTree("(A:1.2.3,B)"));
        assertEquals(6, e.getOffset());
        assertEquals(".3,B)", e.getContext());
    }

    @Test
    void unclosedListIsSyntaxError() {
        NewickSyntaxException e = assertThrows(NewickSyntaxException.class,
            () -> parser.parseTree("(A,B"));
        assertEquals(4, e.getOffset());
    }

    @Test
    void syntaxErrorContextIsBounded() {
        String tail = "x".repeat(500);
        NewickSyntaxException e = assertThrows(NewickSyntaxException.class,
            () -> parser.parseTree("(A:1:" + tail + ")"));
        assertEquals(4, e.getOffset());
        assertEquals(100, e.getContext().length());
    }

    @Test
    void unterminatedCommentIsSyntaxError() {
        assertThrows(NewickSyntaxException.class, () -> parser.parseTree("(A[comment,B)C;"));
    }

    @Test
    void missingTerminatorIsFormatError() {
        NewickFormatException e = assertThrows(NewickFormatException.class,
            () -> parser.parseTree("(A,B)C)D;"));
        assertEquals(6, e.getOffset());
    }

    @Test
    void emptyLengthIsFormatError() {
        NewickFormatException e = assertThrows(NewickFormatException.class,
            () -> parser.parseTree("(A:,B)C;"));
        assertEquals(3, e.getOffset());
        assertInstanceOf(NumberFormatException.class, e.getCause());

        assertThrows(NewickFormatException.class, () -> parser.parseTree("(A:.,B)C;"));
    }

    @Test
    void emptyTextIsFormatError() {
        assertThrows(NewickFormatException.class, () -> parser.parseTree("   "));
    }

    @Test
    void trailingTextIsToleratedByDefault() {
        Node root = parser.parseTree("(A,B)C; trailing");
        assertEquals("C", root.getName());
    }

    @Test
    void trailingTextFailsInStrictMode() {
        NewickConfig config = new NewickConfig();
        config.setStrictTrailingText(true);
        NewickParser strict = new NewickParser(config);

        NewickFormatException e = assertThrows(NewickFormatException.class,
            () -> strict.parseTree("(A,B)C; trailing"));
        assertEquals(8, e.getOffset());
        assertEquals("C", strict.parseTree("(A,B)C;  ").getName());
    }

    @Test
    void longTrailingTextIsReportedWithBoundedContext() {
        String text = "(A,B)C; " + "x".repeat(5000);
        assertEquals("C", parser.parseTree(text).getName());

        NewickConfig config = new NewickConfig();
        config.setStrictTrailingText(true);
        NewickFormatException e = assertThrows(NewickFormatException.class,
            () -> new NewickParser(config).parseTree(text));
        assertTrue(e.getMessage().startsWith("5000 chars unread from input"));
        assertTrue(e.getMessage().length() < 200, e.getMessage());
    }

    @Test
    void parsesForest() {
        Forest forest = parser.parseForest("(A,B)C;\n(D,E)F;\n\n;  G;");

        assertEquals(3, forest.size());
        assertEquals("C", forest.get(0).getName());
        assertEquals("F", forest.get(1).getName());
        assertEquals("G", forest.get(2).getName());
        assertTrue(parser.parseForest(" ;; ").isEmpty());
    }

    @Test
    void grammarRulesReportConsumedCharacters() {
        NewickParser.Parsed<String> name = parser.parseName("  foo bar :1", 0);
        assertEquals("foo bar", name.getValue());
        assertEquals(10, name.getConsumed());

        NewickParser.Parsed<String> comment = parser.parseComment("x [c] y", 1);
        assertEquals("c", comment.getValue());
        assertEquals(4, comment.getConsumed());

        NewickParser.Parsed<BigDecimal> length = parser.parseLength(" :12.5,", 0);
        assertEquals(new BigDecimal("12.5"), length.getValue());
        assertEquals(6, length.getConsumed());

        NewickParser.Parsed<BigDecimal> none = parser.parseLength("  ,", 0);
        assertNull(none.getValue());
        assertEquals(2, none.getConsumed());

        NewickParser.Parsed<Node> subtree = parser.parseSubtree("x;((A,B)C,D)E;y", 2);
        assertEquals("E", subtree.getValue().getName());
        assertEquals(11, subtree.getConsumed());
    }

    @Test
    void deepNestingDoesNotOverflowTheStack() {
        int depth = 100_000;
        String text = "(".repeat(depth) + "A" + ")".repeat(depth) + ";";

        Node root = parser.parseTree(text);

        int count = 0;
        for (Node ignored : root.walk()) {
            count++;
        }
        assertEquals(depth + 1, count);
        assertEquals(text.substring(0, text.length() - 1), root.toNewick());
    }
}
