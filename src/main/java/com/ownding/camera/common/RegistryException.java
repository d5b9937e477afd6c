package com.ownding.camera.common;

public class RegistryException extends RuntimeException {
    private final ErrorKind kind;

    public RegistryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static RegistryException notFound(String message) {
        return new RegistryException(ErrorKind.NOT_FOUND, message);
    }

    public static RegistryException conflict(String message) {
        return new RegistryException(ErrorKind.CONFLICT, message);
    }

    public static RegistryException validation(String message) {
        return new RegistryException(ErrorKind.VALIDATION, message);
    }

    public ErrorKind getKind() {
        return kind;
    }
}
