package com.furniro.store.presentation.user.response;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 관심 상품 토글 결과 (변경 후 상품 ID 목록)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class FavouritesResponse {
    private List<Long> favourites;
}
