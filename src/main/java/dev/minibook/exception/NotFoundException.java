package dev.minibook.exception;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String what) {
        return new NotFoundException(what + " not found");
    }
}
