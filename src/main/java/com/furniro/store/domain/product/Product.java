package com.furniro.store.domain.product;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Product 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 상품 기본 정보(이름, 부제, 브랜드, 설명) 관리
 * - 정가와 할인율 관리, 실 판매가 계산
 * - 색상(ProductColor)별 재고 관리
 * - 카테고리 참조 관리
 * - 소프트 삭제
 *
 * 핵심 비즈니스 규칙:
 * - 가격은 0 이상, 할인율은 0~100
 * - 색상은 순서가 있으며 첫 번째 색상이 기본 색상
 * - 삭제된 상품은 조회/장바구니/주문 대상에서 제외
 */
@Entity
@Table(name = "products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "subtitle")
    private String subtitle;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "brand")
    private String brand;

    @Column(name = "additional_information", length = 4000)
    private String additionalInformation;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "sale", nullable = false)
    private Integer sale;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id")
    @OrderColumn(name = "color_order")
    @Builder.Default
    private List<ProductColor> colors = new ArrayList<>();

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "product_categories", joinColumns = @JoinColumn(name = "product_id"))
    @Column(name = "category_id", nullable = false)
    @Builder.Default
    private Set<Long> categoryIds = new LinkedHashSet<>();

    /**
     * 상품 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 상품명은 필수
     * - 가격은 0 이상
     * - 할인율은 0~100 (null이면 0)
     * - 색상은 최소 1개
     */
    public static Product createProduct(String name, String subtitle, BigDecimal price, Integer sale,
                                        List<ProductColor> colors, Collection<Long> categoryIds) {
        validateName(name);
        validatePrice(price);
        int normalizedSale = normalizeSale(sale);
        validateColors(colors);

        LocalDateTime now = LocalDateTime.now();
        Product product = Product.builder()
                .name(name)
                .subtitle(subtitle)
                .price(price)
                .sale(normalizedSale)
                .deleted(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
        product.colors.addAll(colors);
        if (categoryIds != null) {
            product.categoryIds.addAll(categoryIds);
        }
        return product;
    }

    /**
     * 부가 정보(설명, 브랜드, 추가 정보) 갱신
     */
    public void describe(String description, String brand, String additionalInformation) {
        this.description = description;
        this.brand = brand;
        this.additionalInformation = additionalInformation;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 상품 정보 수정
     *
     * 생성 시와 동일한 검증 규칙을 적용하며, 색상과 카테고리는 전체 교체됩니다.
     */
    public void update(String name, String subtitle, BigDecimal price, Integer sale,
                       List<ProductColor> colors, Collection<Long> categoryIds) {
        validateName(name);
        validatePrice(price);
        int normalizedSale = normalizeSale(sale);
        validateColors(colors);

        this.name = name;
        this.subtitle = subtitle;
        this.price = price;
        this.sale = normalizedSale;
        this.colors.clear();
        this.colors.addAll(colors);
        this.categoryIds.clear();
        if (categoryIds != null) {
            this.categoryIds.addAll(categoryIds);
        }
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 실 판매가 (할인 적용, 반올림 전)
     */
    public BigDecimal getEffectivePrice() {
        return ProductPricing.effectivePrice(this.price, this.sale);
    }

    /**
     * 색상 찾기
     *
     * @param colorKey hex 코드 또는 색상명 (대소문자 무시). null/공백이면 첫 번째 색상
     */
    public Optional<ProductColor> findColor(String colorKey) {
        if (colorKey == null || colorKey.isBlank()) {
            return getFirstColor();
        }
        return this.colors.stream()
                .filter(color -> color.matches(colorKey))
                .findFirst();
    }

    public Optional<ProductColor> getFirstColor() {
        return this.colors.isEmpty() ? Optional.empty() : Optional.of(this.colors.get(0));
    }

    /**
     * 대표 이미지 (첫 번째 색상의 첫 번째 이미지)
     */
    public String getMainImageUrl() {
        return getFirstColor().map(ProductColor::getFirstImageUrl).orElse(null);
    }

    public boolean hasColors() {
        return !this.colors.isEmpty();
    }

    public boolean belongsTo(Long categoryId) {
        return this.categoryIds.contains(categoryId);
    }

    /**
     * 카테고리 참조 제거 (카테고리 삭제 시)
     *
     * @return 제거되었으면 true
     */
    public boolean removeCategory(Long categoryId) {
        boolean removed = this.categoryIds.remove(categoryId);
        if (removed) {
            this.updatedAt = LocalDateTime.now();
        }
        return removed;
    }

    /**
     * 소프트 삭제
     */
    public void softDelete() {
        this.deleted = true;
        this.updatedAt = LocalDateTime.now();
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new DomainException(ErrorCode.INVALID_PRODUCT, ProductConstants.MSG_NAME_REQUIRED);
        }
    }

    private static void validatePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new DomainException(ErrorCode.INVALID_PRODUCT, ProductConstants.MSG_INVALID_PRICE);
        }
    }

    private static int normalizeSale(Integer sale) {
        int value = sale == null ? ProductConstants.MIN_SALE : sale;
        if (value < ProductConstants.MIN_SALE || value > ProductConstants.MAX_SALE) {
            throw new DomainException(ErrorCode.INVALID_PRODUCT, ProductConstants.MSG_INVALID_SALE);
        }
        return value;
    }

    private static void validateColors(List<ProductColor> colors) {
        if (colors == null || colors.isEmpty()) {
            throw new DomainException(ErrorCode.INVALID_PRODUCT, ProductConstants.MSG_COLORS_REQUIRED);
        }
    }
}
