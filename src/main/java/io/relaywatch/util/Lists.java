package io.relaywatch.util;

import java.util.ArrayList;
import java.util.List;

public final class Lists {
    private Lists() {
    }

    public static <T> List<List<T>> chunk(List<T> items, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be greater than 0");
        }
        List<List<T>> out = new ArrayList<>();
        if (items == null) {
            return out;
        }
        for (int i = 0; i < items.size(); i += chunkSize) {
            out.add(new ArrayList<>(items.subList(i, Math.min(items.size(), i + chunkSize))));
        }
        return out;
    }
}
