package com.furniro.store.infrastructure.persistence.cart;

import com.furniro.store.domain.cart.Cart;
import com.furniro.store.domain.cart.CartRepository;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * InMemoryCartRepository - 테스트용 Cart 저장소 (사용자당 1개)
 */
public class InMemoryCartRepository implements CartRepository {

    private final ConcurrentHashMap<Long, Cart> cartsByUserId = new ConcurrentHashMap<>();
    private final AtomicLong cartIdSequence = new AtomicLong(0L);

    @Override
    public Optional<Cart> findByUserId(Long userId) {
        return Optional.ofNullable(cartsByUserId.get(userId));
    }

    @Override
    public Cart save(Cart cart) {
        if (cart.getCartId() == null) {
            ReflectionTestUtils.setField(cart, "cartId", cartIdSequence.incrementAndGet());
        }
        cartsByUserId.put(cart.getUserId(), cart);
        return cart;
    }

    @Override
    public void delete(Cart cart) {
        cartsByUserId.remove(cart.getUserId());
    }

    @Override
    public void flush() {
        // 메모리 저장소는 변경이 즉시 반영됨
    }
}
