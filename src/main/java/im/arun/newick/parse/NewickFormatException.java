package im.arun.newick.parse;

/**
 * The text around a tree, or a branch length, is not in the expected form.
 */
public class NewickFormatException extends NewickException {

    public NewickFormatException(String message, int offset) {
        super(message, offset);
    }

    public NewickFormatException(String message, int offset, Throwable cause) {
        super(message, offset, cause);
    }
}
