package io.timeline.core;

/** Raised when a string is not a canonical {@link Hlc}. */
public class MalformedIdentifierException extends IllegalArgumentException {
    private final String input;

    public MalformedIdentifierException(String input, String reason) {
        super("Malformed identifier '" + input + "': " + reason);
        this.input = input;
    }

    public String input() { return input; }
}
