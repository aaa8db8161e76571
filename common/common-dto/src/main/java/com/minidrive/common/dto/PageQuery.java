package com.minidrive.common.dto;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * 페이지 조회 조건 (Pagination input)
 *
 * <p>클라이언트가 보낸 pageNumber/pageSize 를 안전한 범위로 보정한다.
 * 1-based 페이지 번호를 사용하며, Spring Data 의 0-based {@link Pageable} 로 변환할 수 있다.</p>
 *
 * <pre>
 *   pageNumber &lt; 1   → 1
 *   pageSize   &lt; 1   → 20 (기본값)
 *   pageSize   &gt; 100 → 100 (상한)
 * </pre>
 */
public record PageQuery(int pageNumber, int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    public PageQuery {
        if (pageNumber < 1) {
            pageNumber = 1;
        }
        if (pageSize < 1) {
            pageSize = DEFAULT_PAGE_SIZE;
        } else if (pageSize > MAX_PAGE_SIZE) {
            pageSize = MAX_PAGE_SIZE;
        }
    }

    /** null 허용 쿼리 파라미터로부터 생성 (컨트롤러용) */
    public static PageQuery of(Integer pageNumber, Integer pageSize) {
        return new PageQuery(
                pageNumber != null ? pageNumber : 1,
                pageSize != null ? pageSize : DEFAULT_PAGE_SIZE);
    }

    public int offset() {
        return (pageNumber - 1) * pageSize;
    }

    public Pageable toPageable(Sort sort) {
        return PageRequest.of(pageNumber - 1, pageSize, sort);
    }
}
