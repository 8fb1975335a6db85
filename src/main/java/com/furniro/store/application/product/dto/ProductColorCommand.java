package com.furniro.store.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductColorCommand {
    private String name;
    private String hex;
    private Integer quantity;
    private List<String> imageUrls;
}
