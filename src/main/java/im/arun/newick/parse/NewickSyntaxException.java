package im.arun.newick.parse;

import lombok.Getter;

/**
 * A descendant list or comment is malformed.
 */
@Getter
public class NewickSyntaxException extends NewickException {

    private final String context;

    public NewickSyntaxException(String message, int offset, String context) {
        super(String.format("%s at offset %d: '%s'", message, offset, context), offset);
        this.context = context;
    }
}
