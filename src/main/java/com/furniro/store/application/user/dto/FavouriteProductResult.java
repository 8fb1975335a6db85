package com.furniro.store.application.user.dto;

import com.furniro.store.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class FavouriteProductResult {
    private Long productId;
    private String name;
    private String subtitle;
    private String image;

    public static FavouriteProductResult from(Product product) {
        return new FavouriteProductResult(product.getProductId(), product.getName(),
                product.getSubtitle(), product.getMainImageUrl());
    }
}
