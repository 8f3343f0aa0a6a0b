package com.bookshelf.api.unit.service;

import com.bookshelf.api.dto.request.CreateAuthorRequest;
import com.bookshelf.api.dto.request.UpdateAuthorRequest;
import com.bookshelf.api.dto.response.AuthorResponse;
import com.bookshelf.api.entity.Author;
import com.bookshelf.api.entity.Book;
import com.bookshelf.api.exception.IdMismatchException;
import com.bookshelf.api.exception.ResourceNotFoundException;
import com.bookshelf.api.repository.AuthorRepository;
import com.bookshelf.api.service.AuthorService;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthorServiceTest {

    @Mock
    private AuthorRepository authorRepository;

    @Mock
    private EntityManager entityManager;

    @InjectMocks
    private AuthorService authorService;

    @Test
    void create_returnsResponseWithGeneratedIdAndNoBooks() {
        when(authorRepository.save(any(Author.class))).thenAnswer(invocation -> {
            Author saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 1L);
            return saved;
        });

        AuthorResponse response = authorService.create(
            new CreateAuthorRequest("George Orwell", "Essayist", LocalDate.of(1903, 6, 25)));

        assertThat(response.id()).isEqualTo(1L);
        assertThat(response.name()).isEqualTo("George Orwell");
        assertThat(response.bio()).isEqualTo("Essayist");
        assertThat(response.books()).isEmpty();
    }

    @Test
    void findById_mapsBooksToSummaries() {
        Author author = createTestAuthor(1L, "George Orwell");
        author.getBooks().add(createTestBook(10L, "1984", author));
        when(authorRepository.findByIdWithBooks(1L)).thenReturn(Optional.of(author));

        AuthorResponse response = authorService.findById(1L);

        assertThat(response.books()).hasSize(1);
        assertThat(response.books().get(0).id()).isEqualTo(10L);
        assertThat(response.books().get(0).title()).isEqualTo("1984");
    }

    @Test
    void findById_whenNotFound_throwsResourceNotFoundException() {
        when(authorRepository.findByIdWithBooks(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authorService.findById(99L))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("Author not found with id 99");
    }

    @Test
    void findAll_mapsEveryAuthor() {
        when(authorRepository.findAllWithBooks()).thenReturn(List.of(
            createTestAuthor(1L, "George Orwell"), createTestAuthor(2L, "Aldous Huxley")));

        assertThat(authorService.findAll())
            .extracting(AuthorResponse::name)
            .containsExactly("George Orwell", "Aldous Huxley");
    }

    @Test
    void update_overwritesAllFields() {
        Author author = createTestAuthor(1L, "Old Name");
        author.setBio("Old bio");
        when(authorRepository.findById(1L)).thenReturn(Optional.of(author));

        authorService.update(1L, new UpdateAuthorRequest(1L, "New Name", null, LocalDate.of(1950, 2, 3)));

        assertThat(author.getName()).isEqualTo("New Name");
        assertThat(author.getBio()).isNull();
        assertThat(author.getDateOfBirth()).isEqualTo(LocalDate.of(1950, 2, 3));
        verify(authorRepository).saveAndFlush(author);
    }

    @Test
    void update_withIdMismatch_throwsBeforeLoading() {
        var request = new UpdateAuthorRequest(2L, "Name", null, LocalDate.of(1950, 1, 1));

        assertThatThrownBy(() -> authorService.update(1L, request))
            .isInstanceOf(IdMismatchException.class)
            .hasMessageContaining("1")
            .hasMessageContaining("2");

        verify(authorRepository, never()).findById(any());
        verify(authorRepository, never()).saveAndFlush(any());
    }

    @Test
    void update_whenNotFound_throwsResourceNotFoundException() {
        when(authorRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authorService.update(5L,
                new UpdateAuthorRequest(5L, "Name", null, LocalDate.of(1950, 1, 1))))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void update_whenRowDeletedConcurrently_throwsResourceNotFoundException() {
        Author author = createTestAuthor(1L, "Name");
        when(authorRepository.findById(1L)).thenReturn(Optional.of(author));
        when(authorRepository.saveAndFlush(author))
            .thenThrow(new ObjectOptimisticLockingFailureException(Author.class, 1L));
        when(authorRepository.existsById(1L)).thenReturn(false);

        assertThatThrownBy(() -> authorService.update(1L,
                new UpdateAuthorRequest(1L, "Name", null, LocalDate.of(1950, 1, 1))))
            .isInstanceOf(ResourceNotFoundException.class);

        verify(entityManager).detach(author);
    }

    @Test
    void update_whenLockFailsButRowStillExists_rethrows() {
        Author author = createTestAuthor(1L, "Name");
        when(authorRepository.findById(1L)).thenReturn(Optional.of(author));
        when(authorRepository.saveAndFlush(author))
            .thenThrow(new ObjectOptimisticLockingFailureException(Author.class, 1L));
        when(authorRepository.existsById(1L)).thenReturn(true);

        assertThatThrownBy(() -> authorService.update(1L,
                new UpdateAuthorRequest(1L, "Name", null, LocalDate.of(1950, 1, 1))))
            .isInstanceOf(ObjectOptimisticLockingFailureException.class);
    }

    @Test
    void delete_removesLoadedAuthor() {
        Author author = createTestAuthor(1L, "George Orwell");
        author.getBooks().add(createTestBook(10L, "1984", author));
        when(authorRepository.findByIdWithBooks(1L)).thenReturn(Optional.of(author));

        authorService.delete(1L);

        verify(authorRepository).delete(author);
    }

    @Test
    void delete_whenNotFound_throwsResourceNotFoundException() {
        when(authorRepository.findByIdWithBooks(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authorService.delete(99L))
            .isInstanceOf(ResourceNotFoundException.class);

        verify(authorRepository, never()).delete(any());
    }

    private Author createTestAuthor(Long id, String name) {
        Author author = new Author();
        ReflectionTestUtils.setField(author, "id", id);
        author.setName(name);
        author.setDateOfBirth(LocalDate.of(1900, 1, 1));
        return author;
    }

    private Book createTestBook(Long id, String title, Author author) {
        Book book = new Book();
        ReflectionTestUtils.setField(book, "id", id);
        book.setTitle(title);
        book.setPublishDate(LocalDate.of(1949, 6, 8));
        book.setAuthor(author);
        return book;
    }
}
