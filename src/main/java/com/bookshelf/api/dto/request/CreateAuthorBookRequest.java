package com.bookshelf.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Body of {@code POST /api/authors/{authorId}/books}. The author comes from the path.
 */
public record CreateAuthorBookRequest(

    @NotBlank(message = "Title must not be blank")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    String title,

    @NotNull(message = "Publish date is required")
    LocalDate publishDate
) {}
