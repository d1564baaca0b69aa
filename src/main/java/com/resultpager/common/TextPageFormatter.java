package com.resultpager.common;

import com.google.common.base.Ascii;
import com.resultpager.session.PageView;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 文本分页格式化器：表格 + 翻页信息页脚
 */
public class TextPageFormatter implements PageFormatter {

    public static final int MAX_CELL_WIDTH = 40;

    private static final String NULL_TEXT = "NULL";

    @Override
    public byte[] format(PageView view) {
        StringBuilder sb = new StringBuilder();
        if (view.getRows().isEmpty() || view.getColumns().isEmpty()) {
            sb.append("Empty set");
        } else {
            sb.append(TextTableFormatter.format(view.getColumns(), toCells(view)));
        }
        sb.append("\n");
        sb.append(footer(view));
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private List<List<String>> toCells(PageView view) {
        List<String> columns = view.getColumns();
        List<List<String>> cells = new ArrayList<>(view.getRows().size());
        for (Map<String, Object> row : view.getRows()) {
            List<String> line = new ArrayList<>(columns.size());
            for (String column : columns) {
                line.add(cell(row.get(column)));
            }
            cells.add(line);
        }
        return cells;
    }

    private String cell(Object value) {
        if (value == null) {
            return NULL_TEXT;
        }
        return Ascii.truncate(String.valueOf(value), MAX_CELL_WIDTH, "");
    }

    private String footer(PageView view) {
        return "Page " + view.getPage() + " of " + view.getTotalPages()
                + " (" + view.getTotalRows() + (view.getTotalRows() == 1 ? " total row" : " total rows") + ")"
                + ", showing " + view.getShowing() + "\n"
                + "Session: " + view.getSessionId()
                + " | next: " + availability(view.hasNext())
                + " | prev: " + availability(view.hasPrev());
    }

    private String availability(boolean available) {
        return available ? "available" : "none";
    }
}
