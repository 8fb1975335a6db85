package com.furniro.store.domain.category;

import com.furniro.store.common.exception.DomainException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Category 도메인 테스트")
class CategoryTest {

    @Test
    @DisplayName("생성 - 이름 공백 제거, 빈 이름은 예외")
    void testCreateCategory() {
        Category category = Category.createCategory("  Dining ", "dining.png", null);

        assertEquals("Dining", category.getName());
        assertNotNull(category.getCreatedAt());
        assertThrows(DomainException.class, () -> Category.createCategory(" ", null, null));
    }

    @Test
    @DisplayName("부분 수정 - null 필드는 유지")
    void testUpdate() {
        Category category = Category.createCategory("Dining", "dining.png", "Tables");

        category.update(null, null, "Tables and chairs");

        assertEquals("Dining", category.getName());
        assertEquals("dining.png", category.getImage());
        assertEquals("Tables and chairs", category.getDescription());
    }
}
