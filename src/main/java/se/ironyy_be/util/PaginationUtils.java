package se.ironyy_be.util;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.HashMap;
import java.util.Map;

public class PaginationUtils {

    private PaginationUtils() {
    }

    // Queue queries carry their own ORDER BY, so no Sort is attached here.
    public static Pageable createPageable(int page, int size) {
        return PageRequest.of(safePage(page), safeSize(size));
    }

    public static Map<String, Object> createFilters(String bucket) {
        Map<String, Object> filters = new HashMap<>();
        if (bucket != null) filters.put("bucket", bucket);
        return filters;
    }

    private static int safePage(int page) {
        return Math.max(0, Math.min(page, 10000));
    }

    private static int safeSize(int size) {
        return Math.max(1, Math.min(size, 100));
    }
}
