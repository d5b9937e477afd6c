package com.ownding.camera.camera;

import java.util.List;

final class Pages {

    private Pages() {
    }

    /**
     * Returns page {@code page} (1-indexed) of {@code items}, clipped to what is available.
     */
    static <T> List<T> slice(List<T> items, int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            return List.of();
        }
        long start = (long) (page - 1) * pageSize;
        if (start >= items.size()) {
            return List.of();
        }
        int end = (int) Math.min(start + pageSize, items.size());
        return List.copyOf(items.subList((int) start, end));
    }
}
