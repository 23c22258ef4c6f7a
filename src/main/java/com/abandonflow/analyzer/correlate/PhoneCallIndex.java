package com.abandonflow.analyzer.correlate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 按号码分桶的日志索引。桶内保持日志原始顺序，
 * 回访匹配依赖这个顺序决定“第一次尝试”。
 */
public class PhoneCallIndex<T> {

    private final Map<String, List<T>> buckets = new LinkedHashMap<>();

    public PhoneCallIndex(List<T> calls, Function<T, String> phoneOf) {
        if (calls == null) {
            return;
        }
        for (T call : calls) {
            buckets.computeIfAbsent(phoneOf.apply(call), k -> new ArrayList<>()).add(call);
        }
    }

    public List<T> callsFor(String phone) {
        return buckets.getOrDefault(phone, List.of());
    }
}
