package com.ownding.camera.common;

/**
 * Recoverable failure categories surfaced by the registry. Transport code decides how each one is rendered.
 */
public enum ErrorKind {
    /** A referenced camera or feed does not exist. */
    NOT_FOUND,
    /** A uniqueness rule would be broken, or an IP range bound could not be parsed. */
    CONFLICT,
    /** A field-level business rule beyond plain type and range checks failed. */
    VALIDATION
}
