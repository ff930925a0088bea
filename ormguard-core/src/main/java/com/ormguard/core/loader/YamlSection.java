package com.ormguard.core.loader;

import com.ormguard.api.exception.InvalidPolicyException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * YAML 映射节点的类型化读取
 * <p>
 * 记录已读取的键，{@link #finish()} 时拒绝未知键，拼写错误不会被静默忽略。
 * </p>
 */
final class YamlSection {

    private final String path;
    private final Map<String, Object> values;
    private final Set<String> consumed = new HashSet<>();

    YamlSection(String path, Map<String, Object> values) {
        this.path = path;
        this.values = values == null ? Map.of() : values;
    }

    @SuppressWarnings("unchecked")
    static YamlSection of(String path, Object node) {
        if (node == null) {
            return new YamlSection(path, Map.of());
        }
        if (!(node instanceof Map)) {
            throw new InvalidPolicyException(path, node, "Expected a mapping at '" + path + "'");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<Object, Object>) node).forEach((k, v) -> copy.put(String.valueOf(k), v));
        return new YamlSection(path, copy);
    }

    boolean has(String key) {
        return values.containsKey(key);
    }

    Object raw(String key) {
        consumed.add(key);
        return values.get(key);
    }

    String child(String key) {
        return path.isEmpty() ? key : path + "." + key;
    }

    String getString(String key) {
        Object value = raw(key);
        return value == null ? null : String.valueOf(value);
    }

    Boolean getBoolean(String key) {
        Object value = raw(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new InvalidPolicyException(child(key), value, "Expected a boolean at '" + child(key) + "'");
    }

    Integer getInt(String key) {
        Object value = raw(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        throw new InvalidPolicyException(child(key), value, "Expected an integer at '" + child(key) + "'");
    }

    List<String> getStringList(String key) {
        Object value = raw(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List)) {
            throw new InvalidPolicyException(child(key), value, "Expected a list at '" + child(key) + "'");
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    YamlSection getSection(String key) {
        Object value = raw(key);
        return value == null ? null : of(child(key), value);
    }

    YamlSection getSectionOrEmpty(String key) {
        return of(child(key), raw(key));
    }

    /**
     * 子映射的键（保持文档顺序）
     */
    Set<String> keys() {
        return values.keySet();
    }

    String getPath() {
        return path;
    }

    void finish() {
        Set<String> unknown = new TreeSet<>(values.keySet());
        unknown.removeAll(consumed);
        if (!unknown.isEmpty()) {
            String where = path.isEmpty() ? "policy root" : "'" + path + "'";
            throw new InvalidPolicyException(path, unknown, "Unknown keys " + unknown + " at " + where);
        }
    }
}
