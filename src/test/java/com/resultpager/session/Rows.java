package com.resultpager.session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Rows {

    private Rows() {
    }

    /**
     * 生成 employee 风格的测试数据，id 从 1 开始
     */
    static List<Map<String, Object>> employees(int count) {
        List<Map<String, Object>> rows = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", i);
            row.put("name", "employee-" + i);
            row.put("salary", 1000.5 * i);
            rows.add(row);
        }
        return rows;
    }
}
