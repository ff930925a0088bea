package com.ormguard.core.policy;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 字段名 glob 匹配（不区分大小写，支持 * 与 ?）
 * <p>
 * 模式在构造时一次性编译，实例不可变，可并发使用。
 * </p>
 */
public final class GlobMatcher {

    private final List<Pattern> patterns;

    public GlobMatcher(List<String> globs) {
        this.patterns = globs == null ? List.of()
                : globs.stream().map(GlobMatcher::compile).collect(Collectors.toUnmodifiableList());
    }

    public boolean matches(String name) {
        if (name == null) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(name).matches()) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                flush(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        flush(regex, literal);
        regex.append('$');
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static void flush(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
