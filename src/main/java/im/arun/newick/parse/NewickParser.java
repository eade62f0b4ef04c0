package im.arun.newick.parse;

import im.arun.newick.config.NewickConfig;
import im.arun.newick.model.Forest;
import im.arun.newick.model.Node;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Reads trees in the Newick format.
 *
 * <p>Every grammar rule is a method that reads from a given offset and returns
 * the parsed value with the number of characters it consumed. Nested
 * descendant lists are tracked on an explicit stack instead of by recursion.
 *
 * <pre>
 * subtree  := children? name? comment? length?
 * children := '(' subtree (',' subtree)* ')'
 * comment  := '[' chars-without-']' ']'
 * length   := ':' digit* ('.' digit*)?
 * </pre>
 */
public class NewickParser {
    private static final Logger logger = LoggerFactory.getLogger(NewickParser.class);

    static final String RESERVED_PUNCTUATION = ":;,()";
    private static final int CONTEXT_LENGTH = 100;

    private final NewickConfig config;

    public NewickParser() {
        this(new NewickConfig());
    }

    public NewickParser(NewickConfig config) {
        this.config = config;
    }

    /**
     * Parse a single tree. The tree may be followed by a {@code ;}; anything
     * after that is logged and ignored unless strict trailing text is configured.
     *
     * @param s Newick text
     * @return Root node of the tree
     */
    public Node parseTree(String s) {
        if (s == null || s.isBlank()) {
            throw new NewickFormatException("Newick text is empty", 0);
        }

        Parsed<Node> subtree = parseSubtree(s, 0);
        int count = subtree.getConsumed();
        count += countSpaces(s, count);

        if (count < s.length()) {
            if (s.charAt(count) != ';') {
                throw new NewickFormatException(
                    "Newick could not be parsed (expected \";\") from '" + context(s, count) + "'", count);
            }
            count++;
            count += countSpaces(s, count);
            if (count != s.length()) {
                if (config.isStrictTrailingText()) {
                    throw new NewickFormatException(
                        (s.length() - count) + " chars unread from input: '" + context(s, count) + "'", count);
                }
                logger.warn("{} chars unread from input: '{}'", s.length() - count, context(s, count));
            }
        }

        return subtree.getValue();
    }

    /**
     * Parse a list of trees, each terminated by {@code ;}.
     */
    public Forest parseForest(String s) {
        Forest forest = new Forest();
        for (String segment : s.split(";")) {
            String trimmed = segment.strip();
            if (!trimmed.isEmpty()) {
                forest.add(parseTree(trimmed));
            }
        }
        logger.debug("Parsed {} tree(s)", forest.size());
        return forest;
    }

    Parsed<Node> parseSubtree(String s, int offset) {
        Deque<Node> open = new ArrayDeque<>();
        int count = 0;

        while (true) {
            // Descend through any opening parentheses
            count += countSpaces(s, offset + count);
            if (offset + count < s.length() && s.charAt(offset + count) == '(') {
                open.push(new Node());
                count++;
                continue;
            }

            Node completed = new Node();
            count += parseLabel(s, offset + count, completed);

            // Attach to the enclosing lists, closing as many as the text closes
            while (true) {
                if (open.isEmpty()) {
                    return new Parsed<>(completed, count);
                }
                Node parent = open.peek();
                parent.addChild(completed);

                count += countSpaces(s, offset + count);
                int position = offset + count;
                if (position >= s.length()) {
                    throw new NewickSyntaxException("In descendants, expected ',' or ')' but input ended",
                        position, "");
                }
                char c = s.charAt(position);
                if (c == ',') {
                    count++;
                    break;
                } else if (c == ')') {
                    count++;
                    open.pop();
                    count += parseLabel(s, offset + count, parent);
                    completed = parent;
                } else {
                    throw new NewickSyntaxException("In descendants, could not parse", position,
                        context(s, position));
                }
            }
        }
    }

    /**
     * Name, comment and length following a leaf or a closing parenthesis.
     */
    private int parseLabel(String s, int offset, Node node) {
        int count = 0;

        Parsed<String> name = parseName(s, offset);
        count += name.getConsumed();
        Parsed<String> comment = parseComment(s, offset + count);
        count += comment.getConsumed();
        Parsed<BigDecimal> length = parseLength(s, offset + count);
        count += length.getConsumed();

        node.setName(name.getValue());
        node.setComment(comment.getValue());
        node.setLength(length.getValue());
        return count;
    }

    Parsed<String> parseName(String s, int offset) {
        int count = countSpaces(s, offset);
        while (offset + count < s.length()) {
            char c = s.charAt(offset + count);
            if (RESERVED_PUNCTUATION.indexOf(c) >= 0 || c == '[') {
                break;
            }
            count++;
        }
        String name = s.substring(offset, offset + count).strip();
        return new Parsed<>(name.isEmpty() ? null : name, count);
    }

    Parsed<String> parseComment(String s, int offset) {
        int count = countSpaces(s, offset);
        int start = offset + count;
        if (start >= s.length() || s.charAt(start) != '[') {
            return new Parsed<>(null, count);
        }
        int end = s.indexOf(']', start + 1);
        if (end < 0) {
            throw new NewickSyntaxException("Unterminated comment", start, context(s, start));
        }
        count += end + 1 - start;
        return new Parsed<>(s.substring(start + 1, end), count);
    }

    Parsed<BigDecimal> parseLength(String s, int offset) {
        int count = countSpaces(s, offset);
        if (offset + count >= s.length() || s.charAt(offset + count) != ':') {
            return new Parsed<>(null, count);
        }
        count++;

        int start = offset + count;
        boolean seenDot = false;
        while (offset + count < s.length()) {
            char c = s.charAt(offset + count);
            if (c >= '0' && c <= '9') {
                count++;
            } else if (c == '.' && !seenDot) {
                seenDot = true;
                count++;
            } else {
                break;
            }
        }

        String digits = s.substring(start, offset + count);
        try {
            return new Parsed<>(new BigDecimal(digits), count);
        } catch (NumberFormatException e) {
            throw new NewickFormatException("Invalid branch length '" + digits + "'", start, e);
        }
    }

    static int countSpaces(String s, int offset) {
        int count = 0;
        while (offset + count < s.length() && Character.isWhitespace(s.charAt(offset + count))) {
            count++;
        }
        return count;
    }

    private static String context(String s, int offset) {
        return s.substring(offset, Math.min(s.length(), offset + CONTEXT_LENGTH));
    }

    /**
     * A parsed value and the number of characters read to produce it.
     */
    @Value
    static class Parsed<T> {
        T value;
        int consumed;
    }
}
