package org.drive.metadata.store;

import org.drive.metadata.DriveException;

/**
 * 分页参数（offset + limit）。
 *
 * @param offset 从 0 开始的偏移量
 * @param limit  本页最大条数
 */
public record PageRequest(long offset, int limit) {

    private static final PageRequest UNPAGED = new PageRequest(0, Integer.MAX_VALUE);

    public PageRequest {
        if (offset < 0) {
            throw DriveException.invalidInput("offset 不能为负数：" + offset);
        }
        if (limit < 1) {
            throw DriveException.invalidInput("limit 必须大于 0：" + limit);
        }
    }

    public static PageRequest unpaged() {
        return UNPAGED;
    }

    /**
     * 按页号构造分页参数：页号从 1 开始，{@code offset = (page - 1) * pageSize}。
     */
    public static PageRequest ofPage(int page, int pageSize) {
        if (page < 1) {
            throw DriveException.invalidInput("page 必须从 1 开始：" + page);
        }
        if (pageSize < 1) {
            throw DriveException.invalidInput("pageSize 必须大于 0：" + pageSize);
        }
        return new PageRequest((long) (page - 1) * pageSize, pageSize);
    }

    /**
     * 总页数：{@code ceil(total / limit)}。
     */
    public static int totalPages(long total, int pageSize) {
        if (total <= 0) {
            return 0;
        }
        return (int) ((total + pageSize - 1) / pageSize);
    }
}
