package com.collabim.domain.dto;

import java.util.List;

/**
 * 页码分页结果。page 从 1 开始。
 */
public record PageResult<T>(
        List<T> records,
        long page,
        int pageSize,
        long total,
        long totalPages,
        boolean hasNext,
        boolean hasPrevious
) {

    public static <T> PageResult<T> of(List<T> records, long page, int pageSize, long total) {
        long totalPages = pageSize <= 0 ? 0 : (total + pageSize - 1) / pageSize;
        return new PageResult<>(records, page, pageSize, total, totalPages, page < totalPages, page > 1);
    }

}
