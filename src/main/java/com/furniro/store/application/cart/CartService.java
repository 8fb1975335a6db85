package com.furniro.store.application.cart;

import com.furniro.store.application.cart.dto.AddCartItemCommand;
import com.furniro.store.application.cart.dto.CartResult;
import com.furniro.store.application.cart.dto.UpdateCartItemCommand;
import com.furniro.store.domain.cart.*;
import com.furniro.store.domain.product.ProductVariantLookup;
import com.furniro.store.domain.product.VariantInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CartService - Application 계층
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository 인터페이스에만 의존 (Port)
 * - 상품 정보는 ProductVariantLookup으로만 조회
 * - 모든 변경 작업은 저장 전에 CartPriceCalculator.recomputeTotals 호출
 *
 * 응답은 항상 조회용 가격(priceForDisplay)으로 구성합니다.
 */
@Service
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final CartRepository cartRepository;
    private final ProductVariantLookup variantLookup;
    private final CartPriceCalculator cartPriceCalculator;

    public CartService(CartRepository cartRepository,
                       ProductVariantLookup variantLookup,
                       CartPriceCalculator cartPriceCalculator) {
        this.cartRepository = cartRepository;
        this.variantLookup = variantLookup;
        this.cartPriceCalculator = cartPriceCalculator;
    }

    /**
     * 사용자의 장바구니 조회
     *
     * 표시 수량은 현재 재고로 제한되며 장바구니 자체는 변경하지 않습니다.
     */
    @Transactional(readOnly = true)
    public CartResult getCart(Long userId) {
        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartNotFoundException(userId));
        return CartResult.from(cartPriceCalculator.priceForDisplay(cart, variantLookup));
    }

    /**
     * 장바구니에 상품 담기 (여러 항목)
     *
     * 처리 순서:
     * 1. 모든 요청 항목 검증 (하나라도 실패하면 아무것도 변경하지 않음)
     * 2. 항목별 병합: 재고로 수량 제한, 재고 0이면 건너뜀, 기존 항목이면 누적 후 다시 재고로 제한
     * 3. 합계 재계산 후 저장
     */
    @Transactional
    public CartResult addItems(Long userId, List<AddCartItemCommand> commands) {
        if (commands == null || commands.isEmpty()) {
            throw new InvalidCartItemException("담을 상품이 없습니다");
        }

        List<ResolvedAddition> additions = new ArrayList<>();
        for (AddCartItemCommand command : commands) {
            additions.add(resolveAddition(command));
        }

        Cart cart = cartRepository.findByUserId(userId)
                .orElseGet(() -> Cart.createCart(userId));

        for (ResolvedAddition addition : additions) {
            mergeInto(cart, addition);
        }

        cartPriceCalculator.recomputeTotals(cart, variantLookup);
        Cart saved = cartRepository.save(cart);
        return CartResult.from(cartPriceCalculator.priceForDisplay(saved, variantLookup));
    }

    /**
     * 장바구니 항목 수량 수정
     *
     * - 0: 항목 제거
     * - 1 이상: 수량 교체 (재고 상한을 적용하지 않음, 주문 시점에 재고를 검증)
     */
    @Transactional
    public CartResult updateItem(Long userId, UpdateCartItemCommand command) {
        if (command.getProductId() == null) {
            throw new InvalidCartItemException("상품 ID는 필수입니다");
        }
        if (command.getQuantity() == null || command.getQuantity() < CartConstants.MIN_UPDATE_QUANTITY) {
            throw new InvalidQuantityException(CartConstants.MSG_INVALID_UPDATE_QUANTITY);
        }

        VariantInfo variant = variantLookup.resolve(command.getProductId(), command.getColor());

        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartNotFoundException(userId));
        CartItem item = cart.findItem(variant.getProductId(), variant.getColorHex())
                .orElseThrow(() -> new CartItemNotFoundException(variant.getProductId(), variant.getColorHex()));

        if (command.getQuantity() == 0) {
            cart.removeItem(item);
        } else {
            item.changeQuantity(command.getQuantity());
        }

        cartPriceCalculator.recomputeTotals(cart, variantLookup);
        Cart saved = cartRepository.save(cart);
        return CartResult.from(cartPriceCalculator.priceForDisplay(saved, variantLookup));
    }

    private ResolvedAddition resolveAddition(AddCartItemCommand command) {
        if (command == null || command.getProductId() == null) {
            throw new InvalidCartItemException("상품 ID는 필수입니다");
        }
        if (command.getQuantity() == null || command.getQuantity() < CartConstants.MIN_ADD_QUANTITY) {
            throw new InvalidQuantityException(CartConstants.MSG_INVALID_ADD_QUANTITY);
        }
        VariantInfo variant = variantLookup.resolve(command.getProductId(), command.getColorHex());
        return new ResolvedAddition(variant, command.getQuantity());
    }

    private void mergeInto(Cart cart, ResolvedAddition addition) {
        VariantInfo variant = addition.variant;
        int stock = variant.getAvailableQuantity();
        int clamped = Math.min(addition.quantity, stock);

        if (clamped <= 0) {
            log.warn("재고 없음으로 장바구니 담기 제외: userId={}, productId={}, colorHex={}",
                    cart.getUserId(), variant.getProductId(), variant.getColorHex());
            return;
        }

        Optional<CartItem> existing = cart.findItem(variant.getProductId(), variant.getColorHex());
        if (existing.isPresent()) {
            existing.get().increaseQuantity(clamped, stock);
        } else {
            cart.addItem(CartItem.createItem(variant.getProductId(), variant.getColorName(), variant.getColorHex(), clamped));
        }
    }

    private static class ResolvedAddition {
        private final VariantInfo variant;
        private final int quantity;

        private ResolvedAddition(VariantInfo variant, int quantity) {
            this.variant = variant;
            this.quantity = quantity;
        }
    }
}
