package com.furniro.store.domain.category;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Category 도메인 엔티티
 *
 * 상품은 categoryIds로 카테고리를 참조합니다. 카테고리 이름은 대소문자를 구분하여 유일합니다.
 */
@Entity
@Table(name = "categories", uniqueConstraints = {
    @UniqueConstraint(columnNames = "name")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Category {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "category_id")
    private Long categoryId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "image", length = 1000)
    private String image;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Category createCategory(String name, String image, String description) {
        validateName(name);
        LocalDateTime now = LocalDateTime.now();
        return Category.builder()
                .name(name.trim())
                .image(image)
                .description(description)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 부분 수정 (null 필드는 유지)
     */
    public void update(String name, String image, String description) {
        if (name != null) {
            validateName(name);
            this.name = name.trim();
        }
        if (image != null) {
            this.image = image;
        }
        if (description != null) {
            this.description = description;
        }
        this.updatedAt = LocalDateTime.now();
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new DomainException(ErrorCode.CATEGORY_INVALID_NAME);
        }
    }
}
