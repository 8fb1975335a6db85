package com.furniro.store.domain.product;

/**
 * ProductVariantLookup - 상품 색상 변형 조회 Port
 *
 * 장바구니와 주문이 상품 카탈로그에 접근하는 유일한 통로입니다.
 * 구현체는 항상 최신 가격/재고를 반환해야 합니다.
 */
public interface ProductVariantLookup {

    /**
     * 상품 ID와 색상으로 변형 정보 조회
     *
     * @param productId 상품 ID
     * @param color hex 코드 또는 색상명. null/공백이면 첫 번째 색상
     * @return 실 판매가, 가용 재고, 표시명, 대표 이미지
     * @throws ProductNotFoundException 상품이 없거나 삭제됨
     * @throws InvalidColorException 색상이 없거나 일치하는 색상이 없음
     */
    VariantInfo resolve(Long productId, String color);
}
