package com.minidrive.common.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PagedResultTest {

    @Test
    @DisplayName("페이지 조건 보정 - 범위를 벗어난 값은 기본값/상한으로 조정")
    void pageQuery_ClampsOutOfRangeValues() {
        assertThat(new PageQuery(0, 0)).isEqualTo(new PageQuery(1, 20));
        assertThat(new PageQuery(-3, 500)).isEqualTo(new PageQuery(1, 100));
        assertThat(PageQuery.of(null, null)).isEqualTo(new PageQuery(1, 20));
        assertThat(new PageQuery(3, 10).offset()).isEqualTo(20);
    }

    @Test
    @DisplayName("Pageable 변환 - 1-based 페이지 번호가 0-based 로 바뀜")
    void pageQuery_ToPageable() {
        Pageable pageable = new PageQuery(2, 15).toPageable(Sort.by("name"));

        assertThat(pageable.getPageNumber()).isEqualTo(1);
        assertThat(pageable.getPageSize()).isEqualTo(15);
        assertThat(pageable.getSort().getOrderFor("name")).isNotNull();
    }

    @Test
    @DisplayName("총 페이지 수와 이전/다음 페이지 여부 계산")
    void pagedResult_DerivedFields() {
        PagedResult<String> first = new PagedResult<>(List.of("a", "b"), 1, 2, 5);
        PagedResult<String> last = new PagedResult<>(List.of("e"), 3, 2, 5);

        assertThat(first.totalPages()).isEqualTo(3);
        assertThat(first.hasPreviousPage()).isFalse();
        assertThat(first.hasNextPage()).isTrue();
        assertThat(last.hasPreviousPage()).isTrue();
        assertThat(last.hasNextPage()).isFalse();
    }

    @Test
    @DisplayName("빈 결과 - totalPages 0, 다음 페이지 없음")
    void pagedResult_Empty() {
        PagedResult<String> empty = new PagedResult<>(null, 1, 20, 0);

        assertThat(empty.items()).isEmpty();
        assertThat(empty.totalPages()).isZero();
        assertThat(empty.hasNextPage()).isFalse();
    }

    @Test
    @DisplayName("Spring Data Page 변환 후 map 으로 항목 변환")
    void pagedResult_FromPageAndMap() {
        PageImpl<Integer> page = new PageImpl<>(List.of(1, 2), PageRequest.of(1, 2), 6);

        PagedResult<String> result = PagedResult.from(page).map(i -> "#" + i);

        assertThat(result.items()).containsExactly("#1", "#2");
        assertThat(result.pageNumber()).isEqualTo(2);
        assertThat(result.totalCount()).isEqualTo(6);
        assertThat(result.totalPages()).isEqualTo(3);
    }
}
