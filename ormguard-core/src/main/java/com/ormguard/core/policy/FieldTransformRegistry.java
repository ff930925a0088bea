package com.ormguard.core.policy;

import com.ormguard.api.exception.InvalidPolicyException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * 本地注册的字段变换
 * <p>
 * 策略文档中只出现变换名，函数本身在每个进程内注册。
 * 引擎只决定"哪个字段用哪个变换"，执行由下游存储适配器调用 {@link #apply}。
 * </p>
 */
@Slf4j
public class FieldTransformRegistry {

    private final Map<String, UnaryOperator<Object>> transforms = new ConcurrentHashMap<>();

    public static FieldTransformRegistry empty() {
        return new FieldTransformRegistry();
    }

    public FieldTransformRegistry register(String name, UnaryOperator<Object> transform) {
        if (name == null || name.isBlank()) {
            throw new InvalidPolicyException("transform", name, "Transform name cannot be blank");
        }
        if (transform == null) {
            throw new InvalidPolicyException("transform", name, "Transform function cannot be null");
        }
        UnaryOperator<Object> previous = transforms.put(name, transform);
        if (previous != null) {
            log.warn("[Policy] Field transform '{}' replaced", name);
        } else {
            log.debug("[Policy] Field transform '{}' registered", name);
        }
        return this;
    }

    public boolean contains(String name) {
        return name != null && transforms.containsKey(name);
    }

    public Optional<UnaryOperator<Object>> get(String name) {
        return Optional.ofNullable(name == null ? null : transforms.get(name));
    }

    public Object apply(String name, Object value) {
        UnaryOperator<Object> transform = transforms.get(name);
        if (transform == null) {
            throw new InvalidPolicyException("transform", name, "Unknown field transform: " + name);
        }
        return transform.apply(value);
    }

    public Set<String> names() {
        return new TreeSet<>(transforms.keySet());
    }
}
