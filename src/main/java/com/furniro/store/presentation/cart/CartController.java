package com.furniro.store.presentation.cart;

import com.furniro.store.application.cart.CartService;
import com.furniro.store.application.cart.dto.CartResult;
import com.furniro.store.presentation.cart.mapper.CartMapper;
import com.furniro.store.presentation.cart.request.AddCartItemRequest;
import com.furniro.store.presentation.cart.request.UpdateCartItemRequest;
import com.furniro.store.presentation.cart.response.CartResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리
 */
@RestController
@RequestMapping("/carts")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * GET /carts - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") Long userId) {
        CartResult result = cartService.getCart(userId);
        return ResponseEntity.ok(cartMapper.toCartResponse(result));
    }

    /**
     * POST /carts/items - 장바구니 담기 (여러 항목)
     */
    @PostMapping("/items")
    public ResponseEntity<CartResponse> addCartItems(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestBody List<AddCartItemRequest> request) {
        CartResult result = cartService.addItems(userId, cartMapper.toAddCartItemCommands(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(cartMapper.toCartResponse(result));
    }

    /**
     * PUT /carts/items - 장바구니 항목 수량 수정 (0이면 제거)
     */
    @PutMapping("/items")
    public ResponseEntity<CartResponse> updateCartItem(
            @RequestHeader("X-USER-ID") Long userId,
            @Valid @RequestBody UpdateCartItemRequest request) {
        CartResult result = cartService.updateItem(userId, cartMapper.toUpdateCartItemCommand(request));
        return ResponseEntity.ok(cartMapper.toCartResponse(result));
    }
}
