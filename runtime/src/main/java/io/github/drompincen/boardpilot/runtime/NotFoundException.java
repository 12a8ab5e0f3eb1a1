package io.github.drompincen.boardpilot.runtime;

/**
 * A referenced record does not exist. Extends {@link IllegalArgumentException} so callers
 * treating bad ids as bad arguments keep working; controllers map it to 404.
 */
public class NotFoundException extends IllegalArgumentException {

    public NotFoundException(String what, String id) {
        super(what + " not found: " + id);
    }
}
