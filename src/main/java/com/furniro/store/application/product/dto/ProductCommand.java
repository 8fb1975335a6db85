package com.furniro.store.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 상품 생성/수정 커맨드 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductCommand {
    private String name;
    private String subtitle;
    private String description;
    private String brand;
    private String additionalInformation;
    private BigDecimal price;
    private Integer sale;
    private List<ProductColorCommand> colors;
    private List<Long> categoryIds;
}
