package com.furniro.store.application.order;

import com.furniro.store.application.cart.CartService;
import com.furniro.store.application.cart.dto.AddCartItemCommand;
import com.furniro.store.application.cart.dto.UpdateCartItemCommand;
import com.furniro.store.application.order.dto.OrderResult;
import com.furniro.store.application.order.dto.PlaceOrderCommand;
import com.furniro.store.application.product.CatalogProductVariantLookup;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.common.exception.SystemException;
import com.furniro.store.config.StoreProperties;
import com.furniro.store.config.TestDataFactory;
import com.furniro.store.domain.cart.Cart;
import com.furniro.store.domain.cart.CartPriceCalculator;
import com.furniro.store.domain.cart.EmptyCartException;
import com.furniro.store.domain.order.Order;
import com.furniro.store.domain.order.OrderRepository;
import com.furniro.store.domain.order.OrderStatus;
import com.furniro.store.domain.product.InsufficientStockException;
import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.ProductNotFoundException;
import com.furniro.store.infrastructure.persistence.cart.InMemoryCartRepository;
import com.furniro.store.infrastructure.persistence.order.InMemoryOrderRepository;
import com.furniro.store.infrastructure.persistence.product.InMemoryProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * CheckoutServiceTest - Application 계층 단위 테스트
 *
 * 테스트 대상: CheckoutService.placeOrder
 * - 장바구니 → 주문 변환 (합계, 스냅샷, 재고 차감, 장바구니 삭제)
 * - 빈 장바구니 / 재고 부족 / 동시 차감 실패 / DB 오류
 */
@DisplayName("CheckoutService 단위 테스트")
class CheckoutServiceTest {

    private static final Long TEST_USER_ID = 1L;

    private InMemoryCartRepository cartRepository;
    private InMemoryOrderRepository orderRepository;
    private InMemoryProductRepository productRepository;
    private CatalogProductVariantLookup variantLookup;
    private CartService cartService;
    private CheckoutService checkoutService;

    private Product chair;

    @BeforeEach
    void setup() {
        cartRepository = new InMemoryCartRepository();
        orderRepository = new InMemoryOrderRepository();
        productRepository = new InMemoryProductRepository();
        variantLookup = new CatalogProductVariantLookup(productRepository);
        cartService = new CartService(cartRepository, variantLookup, new CartPriceCalculator());
        checkoutService = newCheckoutService(productRepository, orderRepository);

        // 정가 100, 할인 10% -> 90, 재고 3
        chair = productRepository.save(TestDataFactory.product(null, "Syltherine", "100", 10,
                TestDataFactory.color("White", "#FFFFFF", 3)));
    }

    private CheckoutService newCheckoutService(InMemoryProductRepository products, OrderRepository orders) {
        return new CheckoutService(cartRepository, orders, products, variantLookup,
                new OrderNumberGenerator(), new StoreProperties());
    }

    private PlaceOrderCommand command() {
        return PlaceOrderCommand.builder()
                .shippingAddress(TestDataFactory.shippingAddress())
                .paymentMethod("card")
                .transactionId("tx-0001")
                .build();
    }

    private void addToCart(int quantity) {
        cartService.addItems(TEST_USER_ID, List.of(AddCartItemCommand.builder()
                .productId(chair.getProductId()).quantity(quantity).colorHex("#FFFFFF").build()));
    }

    private int stockOfChair() {
        return productRepository.findById(chair.getProductId()).orElseThrow().getColors().get(0).getQuantity();
    }

    @Test
    @DisplayName("주문 생성 - 합계, 항목 스냅샷, 재고 차감, 장바구니 삭제")
    void testPlaceOrder_Success() {
        // Given
        addToCart(5);

        // When
        OrderResult result = checkoutService.placeOrder(TEST_USER_ID, command());

        // Then
        assertNotNull(result.getOrderId());
        assertTrue(result.getOrderNumber().matches("ORD-\\d{8}-[0-9A-F]{8}"));
        assertEquals(OrderStatus.PENDING, result.getStatus());
        assertEquals(new BigDecimal("270.00"), result.getTotalAmount());
        assertEquals(1, result.getItems().size());
        assertEquals(3, result.getItems().get(0).getQuantity());
        assertEquals(new BigDecimal("90.00"), result.getItems().get(0).getUnitPrice());
        assertEquals("White", result.getItems().get(0).getColorName());
        assertEquals("card", result.getPaymentMethod());
        assertEquals("Seoul", result.getShippingAddress().getCity());

        assertEquals(0, stockOfChair());
        assertTrue(cartRepository.findByUserId(TEST_USER_ID).isEmpty());
        assertEquals(1, orderRepository.size());
    }

    @Test
    @DisplayName("주문 생성 - 장바구니 없음")
    void testPlaceOrder_NoCart() {
        assertThrows(EmptyCartException.class, () -> checkoutService.placeOrder(TEST_USER_ID, command()));
        assertEquals(0, orderRepository.size());
    }

    @Test
    @DisplayName("주문 생성 - 빈 장바구니")
    void testPlaceOrder_EmptyCart() {
        // Given: 담았다가 수량 0으로 제거
        addToCart(1);
        cartService.updateItem(TEST_USER_ID, UpdateCartItemCommand.builder()
                .productId(chair.getProductId()).quantity(0).color("#FFFFFF").build());

        // When & Then
        assertThrows(EmptyCartException.class, () -> checkoutService.placeOrder(TEST_USER_ID, command()));
    }

    @Test
    @DisplayName("주문 생성 - 수량 수정으로 재고를 초과하면 재고 부족, 상태 변경 없음")
    void testPlaceOrder_InsufficientStock() {
        // Given: 수정은 재고 상한을 적용하지 않음
        addToCart(1);
        cartService.updateItem(TEST_USER_ID, UpdateCartItemCommand.builder()
                .productId(chair.getProductId()).quantity(10).color("#FFFFFF").build());

        // When
        InsufficientStockException e = assertThrows(InsufficientStockException.class,
                () -> checkoutService.placeOrder(TEST_USER_ID, command()));

        // Then
        assertEquals(ErrorCode.INSUFFICIENT_STOCK, e.getErrorCode());
        assertEquals(3, stockOfChair());
        assertTrue(cartRepository.findByUserId(TEST_USER_ID).isPresent());
        assertEquals(0, orderRepository.size());
    }

    @Test
    @DisplayName("주문 생성 - 장바구니 상품이 삭제되면 주문 불가")
    void testPlaceOrder_ProductDeleted() {
        addToCart(1);
        productRepository.findById(chair.getProductId()).orElseThrow().softDelete();

        assertThrows(ProductNotFoundException.class, () -> checkoutService.placeOrder(TEST_USER_ID, command()));
        assertEquals(0, orderRepository.size());
    }

    @Test
    @DisplayName("주문 생성 - 검증 이후 다른 주문이 먼저 차감하면 조건부 차감 실패로 재고 부족")
    void testPlaceOrder_ConcurrentDeductionLost() {
        // Given: 차감 시점에 재고가 이미 소진된 상황
        InMemoryProductRepository racingRepository = new InMemoryProductRepository() {
            @Override
            public synchronized int decreaseColorStock(Long colorId, int quantity) {
                return 0;
            }
        };
        racingRepository.save(chair);
        variantLookup = new CatalogProductVariantLookup(racingRepository);
        cartService = new CartService(cartRepository, variantLookup, new CartPriceCalculator());
        checkoutService = newCheckoutService(racingRepository, orderRepository);
        addToCart(2);

        // When & Then
        assertThrows(InsufficientStockException.class, () -> checkoutService.placeOrder(TEST_USER_ID, command()));
        assertTrue(cartRepository.findByUserId(TEST_USER_ID).isPresent());
    }

    @Test
    @DisplayName("주문 생성 - 저장 중 DB 오류는 ORDER_CREATION_FAILED")
    void testPlaceOrder_DatabaseError() {
        // Given
        OrderRepository failingOrderRepository = mock(OrderRepository.class);
        when(failingOrderRepository.save(any(Order.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate order_number"));
        checkoutService = newCheckoutService(productRepository, failingOrderRepository);
        addToCart(1);

        // When
        SystemException e = assertThrows(SystemException.class,
                () -> checkoutService.placeOrder(TEST_USER_ID, command()));

        // Then
        assertEquals(ErrorCode.ORDER_CREATION_FAILED, e.getErrorCode());
        assertEquals(500, e.getStatusCode());
        assertEquals(3, stockOfChair());
    }

    @Test
    @DisplayName("주문 생성 - 장바구니 삭제 반영 중 DB 오류도 ORDER_CREATION_FAILED")
    void testPlaceOrder_CartFlushError() {
        // Given: 커밋 직전 반영 단계에서 실패하는 장바구니 저장소
        cartRepository = new InMemoryCartRepository() {
            @Override
            public void flush() {
                throw new DataIntegrityViolationException("cart delete failed");
            }
        };
        cartService = new CartService(cartRepository, variantLookup, new CartPriceCalculator());
        checkoutService = newCheckoutService(productRepository, orderRepository);
        addToCart(1);

        // When
        SystemException e = assertThrows(SystemException.class,
                () -> checkoutService.placeOrder(TEST_USER_ID, command()));

        // Then
        assertEquals(ErrorCode.ORDER_CREATION_FAILED, e.getErrorCode());
    }

    @Test
    @DisplayName("주문 생성 - 장바구니 버전 충돌은 그대로 전파되어 CART_CONFLICT로 응답")
    void testPlaceOrder_CartVersionConflict() {
        // Given
        cartRepository = new InMemoryCartRepository() {
            @Override
            public void flush() {
                throw new ObjectOptimisticLockingFailureException(Cart.class, 1L);
            }
        };
        cartService = new CartService(cartRepository, variantLookup, new CartPriceCalculator());
        checkoutService = newCheckoutService(productRepository, orderRepository);
        addToCart(1);

        // When & Then
        assertThrows(ObjectOptimisticLockingFailureException.class,
                () -> checkoutService.placeOrder(TEST_USER_ID, command()));
    }
}
