package im.arun.newick.model;

import im.arun.newick.format.NewickWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered list of independent trees, as read from one Newick text.
 */
public class Forest implements Iterable<Node> {

    private final List<Node> trees;

    public Forest() {
        this.trees = new ArrayList<>();
    }

    public Forest(List<Node> trees) {
        this.trees = new ArrayList<>(trees);
    }

    public List<Node> getTrees() {
        return Collections.unmodifiableList(trees);
    }

    public void add(Node root) {
        trees.add(root);
    }

    public Node get(int index) {
        return trees.get(index);
    }

    public int size() {
        return trees.size();
    }

    public boolean isEmpty() {
        return trees.isEmpty();
    }

    @Override
    public Iterator<Node> iterator() {
        return getTrees().iterator();
    }

    /**
     * Serialize all trees, each terminated by a semicolon.
     */
    public String toNewick() {
        return NewickWriter.toNewick(this);
    }
}
