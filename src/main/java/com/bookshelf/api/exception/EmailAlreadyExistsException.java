package com.bookshelf.api.exception;

public class EmailAlreadyExistsException extends RuntimeException {

    public EmailAlreadyExistsException() {
        super("User with this email already exists");
    }
}
