package com.furniro.store.application.product.dto;

import com.furniro.store.domain.product.ProductColor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Builder
@AllArgsConstructor
public class ProductColorResult {
    private Long colorId;
    private String name;
    private String hex;
    private Integer quantity;
    private List<String> imageUrls;

    public static ProductColorResult from(ProductColor color) {
        return ProductColorResult.builder()
                .colorId(color.getColorId())
                .name(color.getName())
                .hex(color.getHex())
                .quantity(color.getQuantity())
                .imageUrls(new ArrayList<>(color.getImageUrls()))
                .build();
    }
}
