package com.furniro.store.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductColorResponse {

    @JsonProperty("color_id")
    private Long colorId;

    private String name;

    private String hex;

    private Integer quantity;

    @JsonProperty("image_urls")
    private List<String> imageUrls;
}
