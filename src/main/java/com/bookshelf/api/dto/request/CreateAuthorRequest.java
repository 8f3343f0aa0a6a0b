package com.bookshelf.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreateAuthorRequest(

    @NotBlank(message = "Name must not be blank")
    @Size(max = 200, message = "Name must not exceed 200 characters")
    String name,

    @Size(max = 5000, message = "Bio must not exceed 5000 characters")
    String bio,

    @NotNull(message = "Date of birth is required")
    @Past(message = "Date of birth must be in the past")
    LocalDate dateOfBirth
) {}
