package com.furniro.store.domain.order;

import com.furniro.store.config.TestDataFactory;
import com.furniro.store.domain.product.Product;
import com.furniro.store.domain.product.VariantInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order / OrderItem 도메인 엔티티 단위 테스트
 * - 주문 항목 스냅샷
 * - 주문 생성 (합계, 초기 상태)
 * - 상태 변경, 소유자 확인
 */
@DisplayName("Order 도메인 엔티티 테스트")
class OrderTest {

    private static final Long TEST_USER_ID = 7L;

    private VariantInfo variant(String price, int sale) {
        Product product = TestDataFactory.product(1L, "Asgaard sofa", price, sale,
                TestDataFactory.color(11L, "Olive", "#808000", 10));
        return VariantInfo.of(product, product.getColors().get(0));
    }

    @Test
    @DisplayName("주문 항목 스냅샷 - 단가와 라인 합계를 반올림하여 저장")
    void testSnapshot() {
        // Given: 19.99 * 0.85 = 16.9915
        VariantInfo variant = variant("19.99", 15);

        // When
        OrderItem item = OrderItem.snapshot(variant, 3);

        // Then
        assertEquals(1L, item.getProductId());
        assertEquals("Asgaard sofa", item.getProductName());
        assertEquals("Olive", item.getColorName());
        assertEquals("#808000", item.getColorHex());
        assertEquals(new BigDecimal("16.99"), item.getUnitPrice());
        assertEquals(new BigDecimal("50.97"), item.getLineTotal());
    }

    @Test
    @DisplayName("주문 항목 스냅샷 - 수량 0 불가")
    void testSnapshot_ZeroQuantity() {
        assertThrows(IllegalArgumentException.class, () -> OrderItem.snapshot(variant("10", 0), 0));
    }

    @Test
    @DisplayName("주문 생성 - 합계는 라인 합계의 합, 상태 PENDING")
    void testCreateOrder() {
        // Given
        List<OrderItem> items = List.of(
                OrderItem.snapshot(variant("100", 10), 3),
                OrderItem.snapshot(variant("40", 0), 2));

        // When
        Order order = Order.createOrder(TEST_USER_ID, "ORD-20250101-ABCDEF12", TestDataFactory.shippingAddress(),
                "card", "tx-1", items);

        // Then
        assertEquals(OrderStatus.PENDING, order.getStatus());
        assertEquals(new BigDecimal("350.00"), order.getTotalAmount());
        assertEquals(2, order.getOrderItemCount());
        assertEquals(5, order.getTotalQuantity());
        assertEquals("Seoul", order.getShippingAddress().getCity());
        assertTrue(order.isOwnedBy(TEST_USER_ID));
        assertFalse(order.isOwnedBy(8L));
    }

    @Test
    @DisplayName("주문 생성 - 항목 없음")
    void testCreateOrder_NoItems() {
        assertThrows(IllegalArgumentException.class, () -> Order.createOrder(TEST_USER_ID, "ORD-1",
                TestDataFactory.shippingAddress(), "card", null, List.of()));
    }

    @Test
    @DisplayName("상태 변경 - 전환 순서 제한 없음")
    void testChangeStatus() {
        Order order = Order.createOrder(TEST_USER_ID, "ORD-1", TestDataFactory.shippingAddress(), "card", null,
                List.of(OrderItem.snapshot(variant("10", 0), 1)));

        order.changeStatus(OrderStatus.DELIVERED);
        order.changeStatus(OrderStatus.PROCESSING);

        assertEquals(OrderStatus.PROCESSING, order.getStatus());
    }

    @Test
    @DisplayName("상태 문자열 변환 - 대소문자 무시, 알 수 없는 값은 예외")
    void testOrderStatusFromString() {
        assertEquals(OrderStatus.SHIPPED, OrderStatus.fromString("shipped"));
        assertThrows(InvalidOrderStatusException.class, () -> OrderStatus.fromString("LOST"));
        assertThrows(InvalidOrderStatusException.class, () -> OrderStatus.fromString(null));
    }
}
