package com.furniro.store.presentation.category;

import com.furniro.store.application.category.CategoryService;
import com.furniro.store.application.category.dto.CategoryCommand;
import com.furniro.store.application.category.dto.CategoryListQuery;
import com.furniro.store.application.category.dto.CategoryListResult;
import com.furniro.store.application.category.dto.CategoryResult;
import com.furniro.store.domain.category.DuplicateCategoryException;
import com.furniro.store.presentation.category.mapper.CategoryMapper;
import com.furniro.store.presentation.common.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CategoryController 단위 테스트")
class CategoryControllerTest {

    private MockMvc mockMvc;

    @Mock
    private CategoryService categoryService;

    @BeforeEach
    void setup() {
        CategoryController controller = new CategoryController(categoryService, new CategoryMapper());
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private CategoryResult dining() {
        return CategoryResult.builder()
                .categoryId(1L)
                .name("Dining")
                .productCount(4L)
                .createdAt(LocalDateTime.of(2025, 1, 1, 0, 0))
                .build();
    }

    @Test
    @DisplayName("목록 - 페이지 정보와 상품 수")
    void testGetCategories() throws Exception {
        // Given
        when(categoryService.getCategories(any(CategoryListQuery.class)))
                .thenReturn(new CategoryListResult(List.of(dining()), 1, 1, 1L));

        // When
        mockMvc.perform(get("/categories")
                .param("search_query", "din")
                .param("sort_by", "name")
                .param("sort_order", "asc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories[0].id").value(1))
                .andExpect(jsonPath("$.categories[0].product_count").value(4))
                .andExpect(jsonPath("$.total_categories").value(1))
                .andExpect(jsonPath("$.current_page").value(1));

        // Then
        ArgumentCaptor<CategoryListQuery> captor = ArgumentCaptor.forClass(CategoryListQuery.class);
        verify(categoryService).getCategories(captor.capture());
        assertEquals("din", captor.getValue().getSearchQuery());
        assertEquals("asc", captor.getValue().getSortOrder());
    }

    @Test
    @DisplayName("등록 - 201 / 이름 중복은 400")
    void testCreateCategory() throws Exception {
        when(categoryService.createCategory(any(CategoryCommand.class)))
                .thenReturn(dining())
                .thenThrow(new DuplicateCategoryException("Dining"));

        mockMvc.perform(post("/categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Dining\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Dining"));
        mockMvc.perform(post("/categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Dining\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CATEGORY_DUPLICATE"));
    }

    @Test
    @DisplayName("삭제 - 204")
    void testDeleteCategory() throws Exception {
        mockMvc.perform(delete("/categories/{categoryId}", 1L))
                .andExpect(status().isNoContent());

        verify(categoryService).deleteCategory(1L);
    }
}
