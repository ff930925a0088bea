package com.ormguard.api.dsl;

import com.ormguard.api.exception.ValidationException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 过滤操作符（封闭集合）
 */
public enum FilterOp {
    EQ("eq"),
    NE("ne"),
    LT("lt"),
    LE("le"),
    GT("gt"),
    GE("ge"),
    IN("in"),
    NOT_IN("not_in"),
    CONTAINS("contains"),
    STARTSWITH("startswith"),
    ENDSWITH("endswith"),
    IS_NULL("is_null"),
    BETWEEN("between");

    private static final Map<String, FilterOp> LOOKUP = new HashMap<>();

    static {
        for (FilterOp op : values()) {
            LOOKUP.put(op.value, op);
        }
        LOOKUP.put("lte", LE);
        LOOKUP.put("gte", GE);
        LOOKUP.put("nin", NOT_IN);
        LOOKUP.put("isnull", IS_NULL);
        LOOKUP.put("neq", NE);
    }

    private final String value;

    FilterOp(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 是否为范围比较
     */
    public boolean isRange() {
        return this == LT || this == LE || this == GT || this == GE || this == BETWEEN;
    }

    public boolean isStringMatch() {
        return this == CONTAINS || this == STARTSWITH || this == ENDSWITH;
    }

    /**
     * 不区分大小写解析，支持 lte/gte/nin/isnull 等别名
     */
    public static FilterOp fromValue(String value) {
        FilterOp op = value == null ? null : LOOKUP.get(value.trim().toLowerCase(Locale.ROOT));
        if (op == null) {
            throw new ValidationException("Unknown filter operator: " + value, "op");
        }
        return op;
    }
}
