package com.furniro.store.infrastructure.persistence.cart;

import com.furniro.store.domain.cart.Cart;
import com.furniro.store.domain.cart.CartRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * CartItem은 Cart의 cascade로 함께 저장/삭제되므로 별도 Repository를 두지 않습니다.
 */
@Repository
public class MySQLCartRepository implements CartRepository {

    private final CartJpaRepository cartJpaRepository;

    public MySQLCartRepository(CartJpaRepository cartJpaRepository) {
        this.cartJpaRepository = cartJpaRepository;
    }

    @Override
    public Optional<Cart> findByUserId(Long userId) {
        return cartJpaRepository.findByUserIdWithItems(userId);
    }

    @Override
    public Cart save(Cart cart) {
        return cartJpaRepository.save(cart);
    }

    @Override
    public void delete(Cart cart) {
        cartJpaRepository.delete(cart);
    }

    @Override
    public void flush() {
        cartJpaRepository.flush();
    }
}
