package com.bookshelf.api.entity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity representing a book author.
 *
 * <p><strong>Ownership</strong>: Author is the parent of a one-to-many relationship.
 * The {@code books.author_id} foreign key is owned by {@link Book#getAuthor()}; this
 * collection is the inverse side and is only read when building responses.
 *
 * <p><strong>Cascade delete</strong>: {@code CascadeType.REMOVE} makes Hibernate delete
 * every child {@link Book} before the author row itself, inside the same transaction.
 * The {@code ON DELETE CASCADE} clause on the foreign key (migration V1) covers rows
 * removed outside of Hibernate.
 *
 * <p>No {@code @ToString}: the default Lombok output would traverse {@code books} and
 * trigger a lazy load outside a transaction.
 */
@Entity
@Table(name = "authors")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
public class Author {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "bio", columnDefinition = "TEXT")
    private String bio;

    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    @OneToMany(mappedBy = "author", fetch = FetchType.LAZY, cascade = CascadeType.REMOVE)
    @OrderBy("id ASC")
    private List<Book> books = new ArrayList<>();
}
