package com.creator.settlement.api;

import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Stable JSON shape for paged listings, independent of Spring Data's Page serialization.
 */
@Value
public class PageDto<T> {

    List<T> items;
    int page;
    int size;
    long total;
    int totalPages;

    public static <E, T> PageDto<T> from(Page<E> page, Function<E, T> mapper) {
        return new PageDto<>(page.map(mapper).getContent(), page.getNumber(), page.getSize(),
                page.getTotalElements(), page.getTotalPages());
    }
}
