package com.bookshelf.api.dto.response;

import java.time.LocalDate;
import java.util.List;

public record AuthorResponse(
    Long id,
    String name,
    String bio,
    LocalDate dateOfBirth,
    List<BookSummary> books
) {
    public record BookSummary(Long id, String title, LocalDate publishDate) {}
}
