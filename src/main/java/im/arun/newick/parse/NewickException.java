package im.arun.newick.parse;

import lombok.Getter;

/**
 * Base class for errors raised while reading Newick text.
 */
@Getter
public class NewickException extends RuntimeException {

    /**
     * Offset into the parsed text where the problem was found, or -1 if unknown.
     */
    private final int offset;

    public NewickException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public NewickException(String message, int offset, Throwable cause) {
        super(message, cause);
        this.offset = offset;
    }
}
