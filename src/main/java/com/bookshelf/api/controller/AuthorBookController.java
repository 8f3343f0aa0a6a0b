package com.bookshelf.api.controller;

import com.bookshelf.api.dto.request.CreateAuthorBookRequest;
import com.bookshelf.api.dto.request.UpdateAuthorBookRequest;
import com.bookshelf.api.dto.response.BookResponse;
import com.bookshelf.api.dto.response.MessageResponse;
import com.bookshelf.api.service.BookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/authors/{authorId}/books")
@RequiredArgsConstructor
@Tag(name = "Author books", description = "Books scoped to a single author")
@SecurityRequirement(name = "bearerAuth")
public class AuthorBookController {

    private final BookService bookService;

    @PostMapping
    @Operation(summary = "Add a book to an author")
    @ApiResponse(responseCode = "201", description = "Book created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Author not found")
    public ResponseEntity<BookResponse> create(@PathVariable Long authorId,
                                               @Valid @RequestBody CreateAuthorBookRequest request) {
        BookResponse created = bookService.createForAuthor(authorId, request);
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{bookId}")
            .buildAndExpand(created.id())
            .toUri();
        return ResponseEntity.created(location).body(created);
    }

    @GetMapping
    @Operation(summary = "List an author's books")
    @ApiResponse(responseCode = "200", description = "Books found")
    @ApiResponse(responseCode = "404", description = "Author not found")
    public ResponseEntity<List<BookResponse>> findAll(@PathVariable Long authorId) {
        return ResponseEntity.ok(bookService.findAllForAuthor(authorId));
    }

    @GetMapping("/{bookId}")
    @Operation(summary = "Get one of an author's books")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Author not found, or book not found for this author")
    public ResponseEntity<BookResponse> findById(@PathVariable Long authorId, @PathVariable Long bookId) {
        return ResponseEntity.ok(bookService.findForAuthor(authorId, bookId));
    }

    @PutMapping("/{bookId}")
    @Operation(summary = "Replace one of an author's books", description = "Full overwrite of title and publish date.")
    @ApiResponse(responseCode = "204", description = "Book updated")
    @ApiResponse(responseCode = "404", description = "Author not found, or book not found for this author")
    public ResponseEntity<Void> update(@PathVariable Long authorId, @PathVariable Long bookId,
                                       @Valid @RequestBody UpdateAuthorBookRequest request) {
        bookService.updateForAuthor(authorId, bookId, request);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{bookId}")
    @Operation(summary = "Delete one of an author's books")
    @ApiResponse(responseCode = "200", description = "Book deleted")
    @ApiResponse(responseCode = "404", description = "Author not found, or book not found for this author")
    public ResponseEntity<MessageResponse> delete(@PathVariable Long authorId, @PathVariable Long bookId) {
        bookService.deleteForAuthor(authorId, bookId);
        return ResponseEntity.ok(new MessageResponse("Book deleted successfully"));
    }
}
