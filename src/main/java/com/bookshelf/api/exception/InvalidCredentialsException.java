package com.bookshelf.api.exception;

/**
 * Thrown for both an unknown email and a wrong password so callers cannot probe which
 * addresses are registered.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Invalid email or password");
    }
}
