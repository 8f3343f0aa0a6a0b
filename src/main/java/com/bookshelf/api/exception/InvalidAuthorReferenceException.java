package com.bookshelf.api.exception;

public class InvalidAuthorReferenceException extends RuntimeException {

    public InvalidAuthorReferenceException(Long authorId) {
        super("Author with id " + authorId + " does not exist");
    }
}
