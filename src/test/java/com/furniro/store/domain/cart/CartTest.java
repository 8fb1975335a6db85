package com.furniro.store.domain.cart;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cart / CartItem 도메인 엔티티 단위 테스트
 * - 장바구니 생성
 * - (상품, 색상) 단위 항목 관리
 * - 수량 변경 규칙
 */
@DisplayName("Cart 도메인 엔티티 테스트")
class CartTest {

    private static final Long TEST_USER_ID = 1L;

    @Test
    @DisplayName("Cart 생성 - 빈 장바구니, 합계 0")
    void testCreateCart() {
        // When
        Cart cart = Cart.createCart(TEST_USER_ID);

        // Then
        assertEquals(TEST_USER_ID, cart.getUserId());
        assertTrue(cart.isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(cart.getTotalPrice()));
    }

    @Test
    @DisplayName("Cart 생성 - 사용자 ID 누락")
    void testCreateCart_NullUser() {
        assertThrows(IllegalArgumentException.class, () -> Cart.createCart(null));
    }

    @Test
    @DisplayName("항목 조회 - 상품 ID와 색상 hex(대소문자 무시)로 식별")
    void testFindItem() {
        // Given
        Cart cart = Cart.createCart(TEST_USER_ID);
        cart.addItem(CartItem.createItem(10L, "White", "#FFFFFF", 2));
        cart.addItem(CartItem.createItem(10L, "Black", "#000000", 1));

        // Then
        assertEquals(2, cart.getItemCount());
        assertEquals(2, cart.findItem(10L, "#ffffff").orElseThrow().getQuantity());
        assertTrue(cart.findItem(11L, "#FFFFFF").isEmpty());
    }

    @Test
    @DisplayName("항목 추가 - 같은 (상품, 색상) 중복 불가")
    void testAddItem_Duplicate() {
        Cart cart = Cart.createCart(TEST_USER_ID);
        cart.addItem(CartItem.createItem(10L, "White", "#FFFFFF", 2));

        assertThrows(IllegalStateException.class,
                () -> cart.addItem(CartItem.createItem(10L, "White", "#FFFFFF", 1)));
    }

    @Test
    @DisplayName("항목 목록은 외부에서 수정할 수 없음")
    void testGetItems_Unmodifiable() {
        Cart cart = Cart.createCart(TEST_USER_ID);
        CartItem item = CartItem.createItem(10L, "White", "#FFFFFF", 2);

        assertThrows(UnsupportedOperationException.class, () -> cart.getItems().add(item));
    }

    @Test
    @DisplayName("항목 생성 - 수량 1 미만")
    void testCreateItem_InvalidQuantity() {
        assertThrows(InvalidQuantityException.class, () -> CartItem.createItem(10L, "White", "#FFFFFF", 0));
    }

    @Test
    @DisplayName("수량 누적 - 상한으로 제한")
    void testIncreaseQuantity_Capped() {
        // Given
        CartItem item = CartItem.createItem(10L, "White", "#FFFFFF", 3);

        // When
        item.increaseQuantity(2, 4);

        // Then
        assertEquals(4, item.getQuantity());
    }

    @Test
    @DisplayName("수량 변경 - 상한 없음, 1 미만 불가")
    void testChangeQuantity() {
        CartItem item = CartItem.createItem(10L, "White", "#FFFFFF", 3);

        item.changeQuantity(50);

        assertEquals(50, item.getQuantity());
        assertThrows(InvalidQuantityException.class, () -> item.changeQuantity(0));
    }

    @Test
    @DisplayName("항목 제거")
    void testRemoveItem() {
        Cart cart = Cart.createCart(TEST_USER_ID);
        CartItem item = CartItem.createItem(10L, "White", "#FFFFFF", 2);
        cart.addItem(item);

        cart.removeItem(item);

        assertTrue(cart.isEmpty());
    }
}
