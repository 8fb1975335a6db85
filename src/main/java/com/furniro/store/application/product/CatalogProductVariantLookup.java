package com.furniro.store.application.product;

import com.furniro.store.domain.product.InvalidColorException;
import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.ProductColor;
import com.furniro.store.domain.product.ProductNotFoundException;
import com.furniro.store.domain.product.ProductRepository;
import com.furniro.store.domain.product.ProductVariantLookup;
import com.furniro.store.domain.product.VariantInfo;
import org.springframework.stereotype.Component;

/**
 * CatalogProductVariantLookup - 상품 카탈로그 기반 변형 조회
 *
 * 장바구니와 주문이 동일한 규칙으로 (상품, 색상)을 해석하도록 단일 진입점을 제공합니다.
 * - 삭제되었거나 없는 상품: ProductNotFoundException
 * - 색상이 하나도 없거나 일치하는 색상이 없음: InvalidColorException
 */
@Component
public class CatalogProductVariantLookup implements ProductVariantLookup {

    private final ProductRepository productRepository;

    public CatalogProductVariantLookup(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    @Override
    public VariantInfo resolve(Long productId, String color) {
        Product product = productRepository.findById(productId)
                .filter(p -> !p.isDeleted())
                .orElseThrow(() -> new ProductNotFoundException(productId));

        if (!product.hasColors()) {
            throw new InvalidColorException(productId);
        }

        ProductColor productColor = product.findColor(color)
                .orElseThrow(() -> new InvalidColorException(productId, color));

        return VariantInfo.of(product, productColor);
    }
}
