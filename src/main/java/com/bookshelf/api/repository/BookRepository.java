package com.bookshelf.api.repository;

import com.bookshelf.api.entity.Book;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface BookRepository extends JpaRepository<Book, Long> {

    @Query("SELECT b FROM Book b JOIN FETCH b.author ORDER BY b.id")
    List<Book> findAllWithAuthor();

    @Query("SELECT b FROM Book b JOIN FETCH b.author WHERE b.id = :id")
    Optional<Book> findByIdWithAuthor(@Param("id") Long id);

    @Query("SELECT b FROM Book b JOIN FETCH b.author a WHERE a.id = :authorId ORDER BY b.id")
    List<Book> findAllByAuthorId(@Param("authorId") Long authorId);

    @Query("SELECT b FROM Book b JOIN FETCH b.author a WHERE b.id = :bookId AND a.id = :authorId")
    Optional<Book> findByIdAndAuthorId(@Param("bookId") Long bookId, @Param("authorId") Long authorId);
}
