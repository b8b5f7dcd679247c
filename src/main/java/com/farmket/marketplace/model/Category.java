package com.farmket.marketplace.model;

import com.farmket.marketplace.util.Slugs;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;

@Entity
@Table(name = "categories", indexes = {
        @Index(name = "idx_category_slug", columnList = "slug"),
        @Index(name = "idx_category_active", columnList = "active")
})
@Data
public class Category {

    public static final int MAX_NAME_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = MAX_NAME_LENGTH)
    private String name;

    @Column(unique = true, nullable = false, length = Product.MAX_SLUG_LENGTH)
    private String slug;

    @Column(columnDefinition = "text")
    private String description;

    // Subcategories go with their parent
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Category parent;

    private String image; // e.g. category_images/fruit.png

    private boolean active = true;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        assignSlug();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        assignSlug();
    }

    /**
     * Derives the slug from the name when none was given. There is no collision suffixing here,
     * a clash is left to the unique constraint on {@code slug}.
     */
    public void assignSlug() {
        if (Slugs.isBlank(slug)) {
            slug = Slugs.slugify(name);
        }
    }

    public Long getParentId() {
        return parent != null ? parent.getId() : null;
    }
}
