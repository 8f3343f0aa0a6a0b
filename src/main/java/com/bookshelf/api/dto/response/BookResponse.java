package com.bookshelf.api.dto.response;

import java.time.LocalDate;

public record BookResponse(
    Long id,
    String title,
    LocalDate publishDate,
    Long authorId,
    String authorName
) {}
