package com.furniro.store.presentation.user.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FavouriteProductResponse {

    @JsonProperty("id")
    private Long productId;

    private String name;

    private String subtitle;

    private String image;
}
