package com.furniro.store.presentation.cart.mapper;

import com.furniro.store.application.cart.dto.AddCartItemCommand;
import com.furniro.store.application.cart.dto.CartLineResult;
import com.furniro.store.application.cart.dto.CartResult;
import com.furniro.store.application.cart.dto.UpdateCartItemCommand;
import com.furniro.store.presentation.cart.request.AddCartItemRequest;
import com.furniro.store.presentation.cart.request.UpdateCartItemRequest;
import com.furniro.store.presentation.cart.response.CartProductResponse;
import com.furniro.store.presentation.cart.response.CartResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * CartMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - Presentation Request DTO → Application Command 변환
 * - Application Result → Presentation Response DTO 변환
 */
@Component
public class CartMapper {

    /**
     * 요청 배열 → 커맨드 목록 (null 항목은 그대로 전달하여 서비스에서 검증)
     */
    public List<AddCartItemCommand> toAddCartItemCommands(List<AddCartItemRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        return requests.stream()
                .map(request -> request == null ? null : AddCartItemCommand.builder()
                        .productId(request.getProductId())
                        .quantity(request.getQuantity())
                        .colorHex(request.getColorHex())
                        .build())
                .collect(Collectors.toList());
    }

    public UpdateCartItemCommand toUpdateCartItemCommand(UpdateCartItemRequest request) {
        return UpdateCartItemCommand.builder()
                .productId(request.getProductId())
                .quantity(request.getQuantity())
                .color(request.getColor())
                .build();
    }

    public CartResponse toCartResponse(CartResult result) {
        return CartResponse.builder()
                .products(result.getLines().stream()
                        .map(this::toCartProductResponse)
                        .collect(Collectors.toList()))
                .totalPrice(result.getTotalPrice())
                .build();
    }

    private CartProductResponse toCartProductResponse(CartLineResult line) {
        return CartProductResponse.builder()
                .productId(line.getProductId())
                .productName(line.getProductName())
                .colorName(line.getColorName())
                .colorHex(line.getColorHex())
                .imageUrl(line.getImageUrl())
                .unitPrice(line.getUnitPrice())
                .quantity(line.getQuantity())
                .availableQuantity(line.getAvailableQuantity())
                .subtotal(line.getSubtotal())
                .build();
    }
}
