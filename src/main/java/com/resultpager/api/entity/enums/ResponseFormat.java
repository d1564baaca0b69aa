package com.resultpager.api.entity.enums;

import java.util.Locale;

/**
 * 分页返回格式：渲染好的文本表格，或结构化的 PageView。
 */
public enum ResponseFormat {
    TEXT("table"),
    STRUCTURED("json");

    private final String alias;

    ResponseFormat(String alias) {
        this.alias = alias;
    }

    /**
     * 解析 format 参数，大小写不敏感，可用别名 table / json；无法识别时返回 STRUCTURED
     */
    public static ResponseFormat from(String value) {
        if (value == null || value.isBlank()) {
            return STRUCTURED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ResponseFormat format : values()) {
            if (format.alias.equals(normalized) || format.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return format;
            }
        }
        return STRUCTURED;
    }
}
