package com.bookshelf.api.mapper;

import com.bookshelf.api.dto.request.CreateAuthorBookRequest;
import com.bookshelf.api.dto.request.CreateBookRequest;
import com.bookshelf.api.dto.request.UpdateAuthorBookRequest;
import com.bookshelf.api.dto.request.UpdateBookRequest;
import com.bookshelf.api.dto.response.BookResponse;
import com.bookshelf.api.entity.Author;
import com.bookshelf.api.entity.Book;

import java.time.LocalDate;

public final class BookMapper {

    private BookMapper() {}

    public static Book toEntity(CreateBookRequest request, Author author) {
        return newBook(request.title(), request.publishDate(), author);
    }

    public static Book toEntity(CreateAuthorBookRequest request, Author author) {
        return newBook(request.title(), request.publishDate(), author);
    }

    public static BookResponse toResponse(Book book) {
        Author author = book.getAuthor();
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getPublishDate(),
            author != null ? author.getId() : null,
            author != null ? author.getName() : null
        );
    }

    public static void updateEntity(Book book, UpdateBookRequest request, Author author) {
        book.setTitle(request.title());
        book.setPublishDate(request.publishDate());
        book.setAuthor(author);
    }

    public static void updateEntity(Book book, UpdateAuthorBookRequest request) {
        book.setTitle(request.title());
        book.setPublishDate(request.publishDate());
    }

    private static Book newBook(String title, LocalDate publishDate, Author author) {
        Book book = new Book();
        book.setTitle(title);
        book.setPublishDate(publishDate);
        book.setAuthor(author);
        return book;
    }
}
