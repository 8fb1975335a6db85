package com.furniro.store.presentation.user.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToggleFavouriteRequest {

    @NotNull(message = "상품 ID는 필수입니다")
    @JsonProperty("id")
    private Long productId;
}
