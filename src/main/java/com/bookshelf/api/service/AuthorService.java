package com.bookshelf.api.service;

import com.bookshelf.api.dto.request.CreateAuthorRequest;
import com.bookshelf.api.dto.request.UpdateAuthorRequest;
import com.bookshelf.api.dto.response.AuthorResponse;
import com.bookshelf.api.entity.Author;
import com.bookshelf.api.exception.IdMismatchException;
import com.bookshelf.api.exception.ResourceNotFoundException;
import com.bookshelf.api.mapper.AuthorMapper;
import com.bookshelf.api.repository.AuthorRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class AuthorService {

    private static final Logger log = LoggerFactory.getLogger(AuthorService.class);

    private final AuthorRepository authorRepository;
    private final EntityManager entityManager;

    @Transactional(readOnly = true)
    public List<AuthorResponse> findAll() {
        return authorRepository.findAllWithBooks().stream()
            .map(AuthorMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public AuthorResponse findById(Long id) {
        Author author = authorRepository.findByIdWithBooks(id)
            .orElseThrow(() -> new ResourceNotFoundException("Author", id));
        return AuthorMapper.toResponse(author);
    }

    @Transactional
    public AuthorResponse create(CreateAuthorRequest request) {
        Author saved = authorRepository.save(AuthorMapper.toEntity(request));
        log.info("Created author {}", saved.getId());
        return AuthorMapper.toResponse(saved);
    }

    @Transactional
    public void update(Long id, UpdateAuthorRequest request) {
        if (!id.equals(request.id())) {
            throw new IdMismatchException("Author", id, request.id());
        }

        Author author = authorRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Author", id));
        AuthorMapper.updateEntity(author, request);

        try {
            authorRepository.saveAndFlush(author);
        } catch (ObjectOptimisticLockingFailureException ex) {
            // The row vanished between load and flush; any other cause is re-thrown.
            entityManager.detach(author);
            if (!authorRepository.existsById(id)) {
                throw new ResourceNotFoundException("Author", id);
            }
            throw ex;
        }
        log.info("Updated author {}", id);
    }

    /**
     * Deletes the author and, through {@code CascadeType.REMOVE}, every book it owns in
     * the same transaction.
     */
    @Transactional
    public void delete(Long id) {
        Author author = authorRepository.findByIdWithBooks(id)
            .orElseThrow(() -> new ResourceNotFoundException("Author", id));
        int bookCount = author.getBooks().size();
        authorRepository.delete(author);
        log.info("Deleted author {} together with {} book(s)", id, bookCount);
    }
}
