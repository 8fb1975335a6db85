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
 * 상품 상세 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductDetailResponse {

    @JsonProperty("id")
    private Long productId;

    private String name;

    private String subtitle;

    private String description;

    private String brand;

    @JsonProperty("additional_information")
    private String additionalInformation;

    private BigDecimal price;

    private Integer sale;

    @JsonProperty("effective_price")
    private BigDecimal effectivePrice;

    private List<ProductColorResponse> colors;

    @JsonProperty("category_ids")
    private List<Long> categoryIds;

    private List<String> categories;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
