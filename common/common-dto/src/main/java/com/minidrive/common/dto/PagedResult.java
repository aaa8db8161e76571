package com.minidrive.common.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * 페이지 조회 결과.
 *
 * <p>totalPages, hasPreviousPage, hasNextPage 는 저장하지 않고 계산한다.
 * Jackson 이 record accessor 를 그대로 직렬화하므로 JSON 에도 함께 나간다.</p>
 */
public record PagedResult<T>(
        List<T> items,
        int pageNumber,
        int pageSize,
        long totalCount
) {

    public PagedResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static <T> PagedResult<T> from(Page<T> page) {
        return new PagedResult<>(page.getContent(),
                page.getNumber() + 1, page.getSize(), page.getTotalElements());
    }

    public int totalPages() {
        if (pageSize <= 0) {
            return 0;
        }
        return (int) Math.ceil((double) totalCount / pageSize);
    }

    public boolean hasPreviousPage() {
        return pageNumber > 1;
    }

    public boolean hasNextPage() {
        return pageNumber < totalPages();
    }

    public <R> PagedResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PagedResult<>(mapped, pageNumber, pageSize, totalCount);
    }
}
