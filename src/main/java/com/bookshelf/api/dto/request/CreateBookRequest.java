package com.bookshelf.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreateBookRequest(

    @NotBlank(message = "Title must not be blank")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    String title,

    @NotNull(message = "Publish date is required")
    LocalDate publishDate,

    @NotNull(message = "Author ID is required")
    Long authorId
) {}
