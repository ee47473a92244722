package com.taskboard.backend.global.web;

import java.util.List;
import java.util.function.Function;

import org.springframework.data.domain.Page;

public record PageResponse<T>(
        List<T> items,
        long totalCount,
        int page,
        int size,
        int totalPages
) {

    public static <E, T> PageResponse<T> from(Page<E> page, Function<? super E, ? extends T> mapper) {
        List<T> items = page.getContent().stream()
                .<T>map(mapper)
                .toList();
        return of(page, items);
    }

    public static <T> PageResponse<T> of(Page<?> page, List<T> items) {
        return new PageResponse<>(items, page.getTotalElements(), page.getNumber(), page.getSize(), page.getTotalPages());
    }
}
