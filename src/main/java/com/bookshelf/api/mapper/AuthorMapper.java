package com.bookshelf.api.mapper;

import com.bookshelf.api.dto.request.CreateAuthorRequest;
import com.bookshelf.api.dto.request.UpdateAuthorRequest;
import com.bookshelf.api.dto.response.AuthorResponse;
import com.bookshelf.api.entity.Author;

import java.util.Collections;
import java.util.List;

public final class AuthorMapper {

    private AuthorMapper() {}

    public static Author toEntity(CreateAuthorRequest request) {
        Author author = new Author();
        author.setName(request.name());
        author.setBio(request.bio());
        author.setDateOfBirth(request.dateOfBirth());
        return author;
    }

    public static AuthorResponse toResponse(Author author) {
        List<AuthorResponse.BookSummary> books = author.getBooks() != null
            ? author.getBooks().stream()
                .map(book -> new AuthorResponse.BookSummary(
                    book.getId(), book.getTitle(), book.getPublishDate()))
                .toList()
            : Collections.emptyList();

        return new AuthorResponse(
            author.getId(),
            author.getName(),
            author.getBio(),
            author.getDateOfBirth(),
            books
        );
    }

    /** Overwrites every mutable field; a null bio clears the stored one. */
    public static void updateEntity(Author author, UpdateAuthorRequest request) {
        author.setName(request.name());
        author.setBio(request.bio());
        author.setDateOfBirth(request.dateOfBirth());
    }
}
