package com.bookshelf.api.exception;

public class IdMismatchException extends RuntimeException {

    public IdMismatchException(String entityName, Long pathId, Long bodyId) {
        super(entityName + " ID mismatch: path id " + pathId + " does not match body id " + bodyId);
    }
}
