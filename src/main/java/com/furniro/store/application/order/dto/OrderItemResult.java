package com.furniro.store.application.order.dto;

import com.furniro.store.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 주문 항목 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@AllArgsConstructor
public class OrderItemResult {
    private Long orderItemId;
    private Long productId;
    private String productName;
    private String colorName;
    private String colorHex;
    private Integer quantity;
    private BigDecimal unitPrice;
    private BigDecimal lineTotal;

    public static OrderItemResult from(OrderItem item) {
        return OrderItemResult.builder()
                .orderItemId(item.getOrderItemId())
                .productId(item.getProductId())
                .productName(item.getProductName())
                .colorName(item.getColorName())
                .colorHex(item.getColorHex())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .lineTotal(item.getLineTotal())
                .build();
    }
}
