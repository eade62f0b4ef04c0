package im.arun.newick.render;

import im.arun.newick.config.NewickConfig;
import im.arun.newick.model.Node;
import im.arun.newick.tree.TraversalOrder;
import im.arun.newick.tree.TreeWalker;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Draws a tree with box-drawing characters, root on the left and leaves on the right.
 *
 * <pre>
 *         /-A
 *     /---|
 *     |   \-B
 * ----|       /-D
 *     |   /---|
 *     |   |   \-E
 *     \---|
 *         |-G
 *         \-H
 * </pre>
 */
public class AsciiArtRenderer {

    static final char HORIZONTAL = '─';
    static final char VERTICAL = '│';
    static final char DOWN_RIGHT = '┌';
    static final char UP_RIGHT = '└';
    static final char VERTICAL_RIGHT = '├';
    static final char VERTICAL_LEFT = '┤';
    static final char CROSS = '┼';

    private static final Map<Character, Character> STRICT_MAP = Map.of(
        HORIZONTAL, '-',
        VERTICAL, '|',
        DOWN_RIGHT, '/',
        UP_RIGHT, '\\',
        VERTICAL_RIGHT, '|',
        VERTICAL_LEFT, '|',
        CROSS, '+'
    );

    private static final Pattern GAP_BEFORE_BRANCH =
        Pattern.compile("(?<=" + VERTICAL + ")(\\s+)(?=[" + DOWN_RIGHT + UP_RIGHT + VERTICAL + "])");

    private final NewickConfig config;

    public AsciiArtRenderer() {
        this(new NewickConfig());
    }

    public AsciiArtRenderer(NewickConfig config) {
        this.config = config;
    }

    public String render(Node root) {
        return render(root, config.isStrictAscii(), config.isShowInternal());
    }

    /**
     * @param root Tree to draw
     * @param strict Use plain ASCII characters for the tree symbols
     * @param showInternal Show the names of internal nodes
     * @return Drawing, one line per row without a trailing newline
     */
    public String render(Node root, boolean strict, boolean showInternal) {
        int width = labelWidth(root, showInternal);
        Block block = layout(root, showInternal, width);

        return block.lines.stream()
            .filter(line -> !isConnectorOnly(line))
            .map(line -> normalize(line, strict))
            .collect(Collectors.joining("\n"));
    }

    private int labelWidth(Node root, boolean showInternal) {
        int longest = 0;
        for (Node n : TreeWalker.walk(root)) {
            if (n.getName() != null && (showInternal || n.isLeaf())) {
                longest = Math.max(longest, n.getName().length());
            }
        }
        return Math.max(2, longest + config.getLabelMargin());
    }

    /**
     * Lays out all subtrees bottom-up. Every block is built with a plain
     * horizontal glyph in the first column of its anchor row; the parent puts
     * the corner glyph there once it knows the child's position.
     */
    private Block layout(Node root, boolean showInternal, int width) {
        String pad = " ".repeat(width - 1);
        Map<Node, Block> blocks = new IdentityHashMap<>();

        for (Node n : TreeWalker.walk(root, TraversalOrder.POSTORDER)) {
            String nameStr = HORIZONTAL + (n.getName() == null ? "" : n.getName());
            if (n.isLeaf()) {
                List<String> lines = new ArrayList<>();
                lines.add(HORIZONTAL + nameStr);
                blocks.put(n, new Block(lines, 0));
                continue;
            }

            List<Node> children = n.getChildren();
            List<String> result = new ArrayList<>();
            List<Integer> mids = new ArrayList<>();
            for (int i = 0; i < children.size(); i++) {
                Block child = blocks.remove(children.get(i));
                String anchor = child.lines.get(child.mid);
                child.lines.set(child.mid, branchGlyph(i, children.size()) + anchor.substring(1));
                mids.add(child.mid + result.size());
                result.addAll(child.lines);
                result.add("");
            }
            result.remove(result.size() - 1);

            int lo = mids.get(0);
            int hi = mids.get(mids.size() - 1);
            int mid = (lo + hi) / 2;
            for (int row = 0; row < result.size(); row++) {
                String prefix = row > lo && row < hi ? pad + VERTICAL : pad;
                if (row == mid) {
                    prefix = HORIZONTAL + String.valueOf(HORIZONTAL).repeat(Math.max(0, prefix.length() - 2))
                        + prefix.charAt(prefix.length() - 1);
                }
                result.set(row, prefix + result.get(row));
            }

            if (showInternal) {
                String stem = result.get(mid);
                int tail = Math.min(stem.length(), nameStr.length() + 1);
                result.set(mid, stem.charAt(0) + nameStr + stem.substring(tail));
            }
            blocks.put(n, new Block(result, mid));
        }
        return blocks.get(root);
    }

    private static char branchGlyph(int index, int count) {
        if (count == 1) {
            return HORIZONTAL;
        } else if (index == 0) {
            return DOWN_RIGHT;
        } else if (index == count - 1) {
            return UP_RIGHT;
        }
        return HORIZONTAL;
    }

    /**
     * Rows made of nothing but spaces and vertical bars carry no information.
     */
    private static boolean isConnectorOnly(String line) {
        boolean space = false;
        boolean bar = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                space = true;
            } else if (c == VERTICAL) {
                bar = true;
            } else {
                return false;
            }
        }
        return space && bar;
    }

    static String normalize(String line, boolean strict) {
        line = GAP_BEFORE_BRANCH.matcher(line).replaceAll(m -> m.group(1).substring(1));
        line = line.replace("" + HORIZONTAL + VERTICAL, "" + HORIZONTAL + VERTICAL_LEFT);
        line = line.replace("" + VERTICAL + HORIZONTAL, "" + VERTICAL_RIGHT);
        line = line.replace("" + VERTICAL_LEFT + HORIZONTAL, "" + CROSS);
        if (strict) {
            StringBuilder sb = new StringBuilder(line.length());
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                sb.append(STRICT_MAP.getOrDefault(c, c));
            }
            line = sb.toString();
        }
        return line;
    }

    private static final class Block {
        final List<String> lines;
        final int mid;

        Block(List<String> lines, int mid) {
            this.lines = lines;
            this.mid = mid;
        }
    }
}
