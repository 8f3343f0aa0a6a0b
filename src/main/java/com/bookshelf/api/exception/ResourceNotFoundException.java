package com.bookshelf.api.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String entityName, Long id) {
        super(entityName + " not found with id " + id);
    }

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException bookOfAuthor(Long bookId, Long authorId) {
        return new ResourceNotFoundException(
            "Book not found with id " + bookId + " for author " + authorId);
    }
}
