package com.furniro.store.domain.cart;

import com.furniro.store.domain.product.InvalidColorException;
import com.furniro.store.domain.product.ProductNotFoundException;
import com.furniro.store.domain.product.ProductPricing;
import com.furniro.store.domain.product.ProductVariantLookup;
import com.furniro.store.domain.product.VariantInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CartPriceCalculator - 장바구니 가격 계산 Domain Service
 *
 * 책임:
 * - 저장용 합계 재계산 (recomputeTotals): 모든 변경 작업 후, 저장 전에 호출
 * - 조회용 가격 산출 (priceForDisplay): 현재 재고로 수량을 제한한 뷰
 *
 * 설계 원칙:
 * - 상품 정보는 ProductVariantLookup을 통해서만 조회 (저장된 가격을 신뢰하지 않음)
 * - Repository 의존성 없음, DomainServiceConfig에서 Bean 등록
 */
public class CartPriceCalculator {

    private static final Logger log = LoggerFactory.getLogger(CartPriceCalculator.class);

    /**
     * 장바구니 합계 재계산
     *
     * 알고리즘:
     * 1. 각 항목을 현재 카탈로그로 조회
     * 2. 조회 불가 항목(상품 삭제, 색상 제거)은 WARN 로그 후 장바구니에서 제거
     * 3. 항목 소계 = round(실 판매가 × 수량)
     * 4. totalPrice = Σ 항목 소계
     *
     * @return 같은 Cart 인스턴스 (항목 소계와 합계가 갱신됨)
     */
    public Cart recomputeTotals(Cart cart, ProductVariantLookup lookup) {
        BigDecimal total = BigDecimal.ZERO;

        for (CartItem item : new ArrayList<>(cart.getItems())) {
            Optional<VariantInfo> variant = tryResolve(item, lookup);
            if (variant.isEmpty()) {
                log.warn("장바구니 항목 제거 (상품 조회 불가): userId={}, productId={}, colorHex={}",
                        cart.getUserId(), item.getProductId(), item.getColorHex());
                cart.removeItem(item);
                continue;
            }

            BigDecimal subtotal = ProductPricing.round(
                    ProductPricing.lineTotal(variant.get().getUnitPrice(), item.getQuantity()));
            item.applySubtotal(subtotal);
            total = total.add(subtotal);
        }

        cart.applyTotals(ProductPricing.round(total));
        return cart;
    }

    /**
     * 조회용 가격 산출
     *
     * 표시 수량 = min(담은 수량, 현재 재고), 소계 = round(표시 수량 × 현재 실 판매가).
     * 장바구니 자체는 변경하지 않으며, 조회 불가 항목은 결과에서 제외합니다.
     */
    public CartPricing priceForDisplay(Cart cart, ProductVariantLookup lookup) {
        List<PricedCartLine> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (CartItem item : cart.getItems()) {
            Optional<VariantInfo> variant = tryResolve(item, lookup);
            if (variant.isEmpty()) {
                continue;
            }

            VariantInfo info = variant.get();
            int shownQuantity = Math.max(0, Math.min(item.getQuantity(), info.getAvailableQuantity()));
            BigDecimal subtotal = ProductPricing.round(ProductPricing.lineTotal(info.getUnitPrice(), shownQuantity));
            lines.add(new PricedCartLine(info, shownQuantity, subtotal));
            total = total.add(subtotal);
        }

        return new CartPricing(lines, ProductPricing.round(total));
    }

    private Optional<VariantInfo> tryResolve(CartItem item, ProductVariantLookup lookup) {
        try {
            return Optional.of(lookup.resolve(item.getProductId(), item.getColorHex()));
        } catch (ProductNotFoundException | InvalidColorException e) {
            log.debug("장바구니 항목 조회 실패: productId={}, colorHex={}, reason={}",
                    item.getProductId(), item.getColorHex(), e.getMessage());
            return Optional.empty();
        }
    }
}
