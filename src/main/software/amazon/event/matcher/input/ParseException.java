package software.amazon.event.matcher.input;

/**
 * A RuntimeException that indicates an error parsing a pattern's value.
 */
public class ParseException extends RuntimeException {

    public ParseException(String msg) {
        super(msg);
    }

}
