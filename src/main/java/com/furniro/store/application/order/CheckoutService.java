package com.furniro.store.application.order;

import com.furniro.store.application.order.dto.OrderResult;
import com.furniro.store.application.order.dto.PlaceOrderCommand;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.common.exception.SystemException;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.domain.cart.Cart;
import com.furniro.store.domain.cart.CartItem;
import com.furniro.store.domain.cart.CartRepository;
import com.furniro.store.domain.cart.EmptyCartException;
import com.furniro.store.domain.order.Order;
import com.furniro.store.domain.order.OrderItem;
import com.furniro.store.domain.order.OrderRepository;
import com.furniro.store.domain.product.InsufficientStockException;
import com.furniro.store.domain.product.ProductRepository;
import com.furniro.store.domain.product.ProductVariantLookup;
import com.furniro.store.domain.product.VariantInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * CheckoutService - 장바구니를 주문으로 전환 (Application 계층)
 *
 * 하나의 트랜잭션에서 다음을 처리합니다:
 * 1. 장바구니 조회 (없거나 비어 있으면 CART_EMPTY)
 * 2. 항목별 현재 재고 검증 (부족하면 INSUFFICIENT_STOCK)
 * 3. 주문 항목 스냅샷 생성 및 주문 저장
 * 4. 색상별 조건부 재고 차감 (0행 갱신이면 INSUFFICIENT_STOCK, 전체 롤백)
 * 5. 장바구니 삭제
 *
 * 동시성 제어:
 * - 재고 차감은 "quantity >= n" 조건의 단일 UPDATE로 수행되므로
 *   마지막 재고를 동시에 주문하면 하나만 성공합니다.
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final CartRepository cartRepository;
    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final ProductVariantLookup variantLookup;
    private final OrderNumberGenerator orderNumberGenerator;
    private final StoreProperties storeProperties;

    public CheckoutService(CartRepository cartRepository,
                           OrderRepository orderRepository,
                           ProductRepository productRepository,
                           ProductVariantLookup variantLookup,
                           OrderNumberGenerator orderNumberGenerator,
                           StoreProperties storeProperties) {
        this.cartRepository = cartRepository;
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.variantLookup = variantLookup;
        this.orderNumberGenerator = orderNumberGenerator;
        this.storeProperties = storeProperties;
    }

    /**
     * 주문 생성
     *
     * @throws EmptyCartException 장바구니 없음 또는 빈 장바구니
     * @throws InsufficientStockException 항목 수량이 현재 색상 재고보다 많음
     * @throws SystemException ORDER_CREATION_FAILED 저장 중 예기치 못한 DB 오류
     * @throws ObjectOptimisticLockingFailureException 주문 처리 중 장바구니가 동시에 수정됨 (CART_CONFLICT)
     */
    @Transactional
    public OrderResult placeOrder(Long userId, PlaceOrderCommand command) {
        Cart cart = cartRepository.findByUserId(userId)
                .filter(c -> !c.isEmpty())
                .orElseThrow(() -> new EmptyCartException(userId));

        List<StockDeduction> deductions = new ArrayList<>();
        List<OrderItem> orderItems = new ArrayList<>();
        for (CartItem item : cart.getItems()) {
            VariantInfo variant = variantLookup.resolve(item.getProductId(), item.getColorHex());
            if (item.getQuantity() > variant.getAvailableQuantity()) {
                log.warn("재고 부족으로 주문 거절: userId={}, productId={}, color={}, available={}, requested={}",
                        userId, variant.getProductId(), variant.getColorName(),
                        variant.getAvailableQuantity(), item.getQuantity());
                throw new InsufficientStockException(variant.getProductName(), variant.getColorName(),
                        variant.getAvailableQuantity(), item.getQuantity());
            }
            orderItems.add(OrderItem.snapshot(variant, item.getQuantity()));
            deductions.add(new StockDeduction(variant, item.getQuantity()));
        }

        Order order = Order.createOrder(userId, orderNumberGenerator.generate(),
                command.getShippingAddress(), command.getPaymentMethod(), command.getTransactionId(), orderItems);

        try {
            Order saved = orderRepository.save(order);

            for (StockDeduction deduction : deductions) {
                deductStock(userId, deduction);
            }

            cartRepository.delete(cart);
            // 커밋 시점의 오류(장바구니 버전 충돌 등)도 여기서 처리되도록 즉시 반영
            cartRepository.flush();

            log.info("주문 생성 완료: userId={}, orderNumber={}, totalAmount={}",
                    userId, saved.getOrderNumber(), saved.getTotalAmount());
            return OrderResult.from(saved);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.error("주문 중 장바구니 동시 수정 감지: userId={}, orderNumber={}", userId, order.getOrderNumber(), e);
            throw e;
        } catch (DataAccessException e) {
            log.error("주문 저장 실패: userId={}, orderNumber={}", userId, order.getOrderNumber(), e);
            throw new SystemException(ErrorCode.ORDER_CREATION_FAILED, "사용자 ID: " + userId, e);
        }
    }

    private void deductStock(Long userId, StockDeduction deduction) {
        VariantInfo variant = deduction.variant;
        int updated = productRepository.decreaseColorStock(variant.getColorId(), deduction.quantity);
        if (updated == 0) {
            // 검증 이후 다른 주문이 먼저 재고를 차감한 경우
            log.warn("재고 차감 실패 (동시 주문): userId={}, productId={}, colorId={}, requested={}",
                    userId, variant.getProductId(), variant.getColorId(), deduction.quantity);
            throw new InsufficientStockException(variant.getProductName(), variant.getColorName(),
                    variant.getAvailableQuantity(), deduction.quantity);
        }

        int remaining = variant.getAvailableQuantity() - deduction.quantity;
        if (remaining < storeProperties.getLowStockWarnThreshold()) {
            log.warn("재고 부족 임박: productId={}, color={}, remaining={}",
                    variant.getProductId(), variant.getColorName(), remaining);
        }
    }

    private static class StockDeduction {
        private final VariantInfo variant;
        private final int quantity;

        private StockDeduction(VariantInfo variant, int quantity) {
            this.variant = variant;
            this.quantity = quantity;
        }
    }
}
