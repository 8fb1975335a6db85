package com.furniro.store.domain.product;

import com.furniro.store.common.exception.DomainException;
import com.furniro.store.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * ProductColor 도메인 엔티티
 *
 * 책임:
 * - 상품의 색상 변형(이름, hex 코드) 정보
 * - 색상별 재고 수량
 * - 색상별 이미지 URL 목록 (순서 유지)
 *
 * 핵심 비즈니스 규칙:
 * - 재고는 음수가 될 수 없음 (>= 0)
 * - 재고 차감은 DB 조건부 UPDATE(quantity >= 요청 수량)로만 수행
 */
@Entity
@Table(name = "product_colors")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductColor {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "color_id")
    private Long colorId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "hex", nullable = false, length = 16)
    private String hex;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "product_color_images", joinColumns = @JoinColumn(name = "color_id"))
    @OrderColumn(name = "image_order")
    @Column(name = "url", nullable = false, length = 1000)
    @Builder.Default
    private List<String> imageUrls = new ArrayList<>();

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 색상 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 색상명, hex 코드는 필수
     * - 초기 재고는 0 이상
     */
    public static ProductColor createColor(String name, String hex, Integer quantity, List<String> imageUrls) {
        if (name == null || name.isBlank()) {
            throw new DomainException(ErrorCode.INVALID_PRODUCT, "색상명은 필수입니다");
        }
        if (hex == null || hex.isBlank()) {
            throw new DomainException(ErrorCode.INVALID_PRODUCT, "색상 hex 코드는 필수입니다");
        }
        if (quantity == null || quantity < 0) {
            throw new DomainException(ErrorCode.INVALID_PRODUCT, "재고는 0 이상이어야 합니다");
        }

        ProductColor color = ProductColor.builder()
                .name(name)
                .hex(hex)
                .quantity(quantity)
                .updatedAt(LocalDateTime.now())
                .build();
        if (imageUrls != null) {
            color.imageUrls.addAll(imageUrls);
        }
        return color;
    }

    /**
     * hex 코드 또는 색상명 일치 여부 (대소문자 무시)
     */
    public boolean matches(String colorKey) {
        return this.hex.equalsIgnoreCase(colorKey) || this.name.equalsIgnoreCase(colorKey);
    }

    public boolean hasStock(int requested) {
        return this.quantity >= requested;
    }

    public String getFirstImageUrl() {
        return this.imageUrls.isEmpty() ? null : this.imageUrls.get(0);
    }
}
