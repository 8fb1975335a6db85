package com.furniro.store.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 상품 목록 항목 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSummaryResponse {

    @JsonProperty("id")
    private Long productId;

    private String name;

    private String subtitle;

    private String image;

    private BigDecimal price;

    private Integer sale;

    @JsonProperty("effective_price")
    private BigDecimal effectivePrice;

    private Integer quantity;

    @JsonProperty("main_color")
    private String mainColorHex;

    @JsonProperty("category_ids")
    private List<Long> categoryIds;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
