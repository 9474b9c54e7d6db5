package com.calai.goals.algorithm;

import java.util.Locale;

/**
 * key 解析：接受 enum 名稱（MIFFLIN_ST_JEOR）或顯示 key（Mifflin-St Jeor），不分大小寫。
 */
final class AlgorithmKeys {
    private AlgorithmKeys() {}

    static <E extends Enum<E> & AlgorithmId> E resolve(Class<E> type, AlgorithmCategory category, String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnknownAlgorithmException(category, String.valueOf(raw));
        }
        String wanted = normalize(raw);
        for (E e : type.getEnumConstants()) {
            if (normalize(e.name()).equals(wanted) || normalize(e.key()).equals(wanted)) {
                return e;
            }
        }
        throw new UnknownAlgorithmException(category, raw);
    }

    private static String normalize(String s) {
        return s.trim()
                .toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }
}
