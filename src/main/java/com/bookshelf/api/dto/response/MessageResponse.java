package com.bookshelf.api.dto.response;

public record MessageResponse(String message) {}
