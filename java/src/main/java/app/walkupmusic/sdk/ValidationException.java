package app.walkupmusic.sdk;

/**
 * Caller supplied an argument outside its documented range.
 */
public final class ValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }
}
