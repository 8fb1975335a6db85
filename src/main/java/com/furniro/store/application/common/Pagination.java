package com.furniro.store.application.common;

import com.furniro.store.common.exception.ApplicationException;
import com.furniro.store.common.exception.ErrorCode;
import com.furniro.store.config.StoreProperties;
import lombok.Getter;

import java.util.List;

/**
 * Pagination - 1부터 시작하는 페이지 요청 값
 *
 * - page < 1 또는 limit < 1: INVALID_PAGINATION
 * - limit 미지정: furniro.store.default-page-size
 * - limit 초과: furniro.store.max-page-size로 제한
 */
@Getter
public final class Pagination {

    private final int page;
    private final int limit;

    private Pagination(int page, int limit) {
        this.page = page;
        this.limit = limit;
    }

    public static Pagination of(Integer page, Integer limit, StoreProperties properties) {
        int resolvedPage = page == null ? 1 : page;
        int resolvedLimit = limit == null ? properties.getDefaultPageSize() : limit;

        if (resolvedPage < 1 || resolvedLimit < 1) {
            throw new ApplicationException(ErrorCode.INVALID_PAGINATION,
                    String.format("page: %s, limit: %s", page, limit));
        }
        return new Pagination(resolvedPage, Math.min(resolvedLimit, properties.getMaxPageSize()));
    }

    public long getOffset() {
        return (long) (page - 1) * limit;
    }

    public int totalPages(long total) {
        return (int) ((total + limit - 1) / limit);
    }

    /**
     * 메모리 목록에서 현재 페이지 구간 추출
     */
    public <T> List<T> slice(List<T> items) {
        int from = (int) Math.min(getOffset(), items.size());
        int to = Math.min(from + limit, items.size());
        return items.subList(from, to);
    }
}
