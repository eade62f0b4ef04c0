package im.arun.newick.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ForestTest {

    @Test
    void keepsOrderOfTrees() {
        Node first = new Node("first");
        Node second = new Node("second");
        Forest forest = new Forest(List.of(first, second));

        assertEquals(2, forest.size());
        assertSame(first, forest.get(0));

        List<Node> seen = new ArrayList<>();
        forest.forEach(seen::add);
        assertEquals(List.of(first, second), seen);
    }

    @Test
    void serializesEveryTree() {
        Forest forest = new Forest();
        assertTrue(forest.isEmpty());
        forest.add(new Node("A"));
        forest.add(new Node("B"));

        assertEquals("A;\nB;", forest.toNewick());
    }
}
