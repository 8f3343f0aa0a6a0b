package com.bookshelf.api.service;

import com.bookshelf.api.dto.request.CreateAuthorBookRequest;
import com.bookshelf.api.dto.request.CreateBookRequest;
import com.bookshelf.api.dto.request.UpdateAuthorBookRequest;
import com.bookshelf.api.dto.request.UpdateBookRequest;
import com.bookshelf.api.dto.response.BookResponse;
import com.bookshelf.api.entity.Author;
import com.bookshelf.api.entity.Book;
import com.bookshelf.api.exception.IdMismatchException;
import com.bookshelf.api.exception.InvalidAuthorReferenceException;
import com.bookshelf.api.exception.ResourceNotFoundException;
import com.bookshelf.api.mapper.BookMapper;
import com.bookshelf.api.repository.AuthorRepository;
import com.bookshelf.api.repository.BookRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Book operations, both on the flat {@code /api/books} collection (author given in the
 * body) and scoped under an author ({@code /api/authors/{authorId}/books}).
 *
 * <p>An unknown author referenced from a request body is a client input error
 * ({@link InvalidAuthorReferenceException}). An unknown author in the path is a missing
 * parent resource ({@link ResourceNotFoundException}).
 */
@Service
@RequiredArgsConstructor
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    private final BookRepository bookRepository;
    private final AuthorRepository authorRepository;
    private final EntityManager entityManager;

    @Transactional(readOnly = true)
    public List<BookResponse> findAll() {
        return bookRepository.findAllWithAuthor().stream()
            .map(BookMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public BookResponse findById(Long id) {
        Book book = bookRepository.findByIdWithAuthor(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
        return BookMapper.toResponse(book);
    }

    @Transactional
    public BookResponse create(CreateBookRequest request) {
        Author author = authorRepository.findById(request.authorId())
            .orElseThrow(() -> new InvalidAuthorReferenceException(request.authorId()));
        Book saved = bookRepository.save(BookMapper.toEntity(request, author));
        log.info("Created book {} for author {}", saved.getId(), author.getId());
        return BookMapper.toResponse(saved);
    }

    @Transactional
    public void update(Long id, UpdateBookRequest request) {
        if (!id.equals(request.id())) {
            throw new IdMismatchException("Book", id, request.id());
        }

        Book book = bookRepository.findByIdWithAuthor(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
        Author author = book.getAuthor().getId().equals(request.authorId())
            ? book.getAuthor()
            : authorRepository.findById(request.authorId())
                .orElseThrow(() -> new InvalidAuthorReferenceException(request.authorId()));

        BookMapper.updateEntity(book, request, author);
        flushUpdate(book);
        log.info("Updated book {}", id);
    }

    @Transactional
    public void delete(Long id) {
        Book book = bookRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
        bookRepository.delete(book);
        log.info("Deleted book {}", id);
    }

    @Transactional
    public BookResponse createForAuthor(Long authorId, CreateAuthorBookRequest request) {
        Author author = requireAuthor(authorId);
        Book saved = bookRepository.save(BookMapper.toEntity(request, author));
        log.info("Created book {} for author {}", saved.getId(), authorId);
        return BookMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<BookResponse> findAllForAuthor(Long authorId) {
        requireAuthorExists(authorId);
        return bookRepository.findAllByAuthorId(authorId).stream()
            .map(BookMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public BookResponse findForAuthor(Long authorId, Long bookId) {
        requireAuthorExists(authorId);
        return BookMapper.toResponse(requireBookOfAuthor(authorId, bookId));
    }

    @Transactional
    public void updateForAuthor(Long authorId, Long bookId, UpdateAuthorBookRequest request) {
        requireAuthorExists(authorId);
        Book book = requireBookOfAuthor(authorId, bookId);
        BookMapper.updateEntity(book, request);
        flushUpdate(book);
        log.info("Updated book {} of author {}", bookId, authorId);
    }

    @Transactional
    public void deleteForAuthor(Long authorId, Long bookId) {
        requireAuthorExists(authorId);
        Book book = requireBookOfAuthor(authorId, bookId);
        bookRepository.delete(book);
        log.info("Deleted book {} of author {}", bookId, authorId);
    }

    private Author requireAuthor(Long authorId) {
        return authorRepository.findById(authorId)
            .orElseThrow(() -> new ResourceNotFoundException("Author", authorId));
    }

    private void requireAuthorExists(Long authorId) {
        if (!authorRepository.existsById(authorId)) {
            throw new ResourceNotFoundException("Author", authorId);
        }
    }

    private Book requireBookOfAuthor(Long authorId, Long bookId) {
        return bookRepository.findByIdAndAuthorId(bookId, authorId)
            .orElseThrow(() -> ResourceNotFoundException.bookOfAuthor(bookId, authorId));
    }

    private void flushUpdate(Book book) {
        try {
            bookRepository.saveAndFlush(book);
        } catch (ObjectOptimisticLockingFailureException ex) {
            // The row vanished between load and flush; any other cause is re-thrown.
            entityManager.detach(book);
            if (!bookRepository.existsById(book.getId())) {
                throw new ResourceNotFoundException("Book", book.getId());
            }
            throw ex;
        }
    }
}
