package com.furniro.store.presentation.product.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductColorRequest {

    @NotBlank(message = "색상 이름은 필수입니다")
    private String name;

    private String hex;

    @NotNull(message = "재고 수량은 필수입니다")
    @Min(value = 0, message = "재고 수량은 0 이상이어야 합니다")
    private Integer quantity;

    @NotNull(message = "이미지 목록은 필수입니다")
    @JsonProperty("image_urls")
    private List<String> imageUrls;
}
