package com.resultpager.common;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Test;

import com.google.common.base.Ticker;
import com.resultpager.api.config.PagerProperties;
import com.resultpager.session.PageView;
import com.resultpager.session.SessionIdGenerator;
import com.resultpager.session.SessionRegistry;

import static org.junit.Assert.*;

public class TextPageFormatterTest {

    private final SessionRegistry registry =
            new SessionRegistry(new PagerProperties().getSession(), Ticker.systemTicker(), new SessionIdGenerator());
    private final TextPageFormatter formatter = new TextPageFormatter();

    @After
    public void tearDown() {
        registry.destroy();
    }

    private static List<Map<String, Object>> rows(int count) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", i);
            row.put("name", "emp" + i);
            rows.add(row);
        }
        return rows;
    }

    private String render(PageView view) {
        return new String(formatter.format(view), StandardCharsets.UTF_8);
    }

    @Test
    public void testFirstPageTableAndFooter() {
        String id = registry.createSession("SELECT * FROM employee", rows(23), 20).getId();
        String text = render(registry.currentPage(id).orElseThrow());

        String[] lines = text.split("\n");
        assertEquals("+----+-------+", lines[0]);
        assertEquals("| id | name  |", lines[1]);
        assertEquals("+----+-------+", lines[2]);
        assertEquals("| 1  | emp1  |", lines[3]);
        assertEquals("| 20 | emp20 |", lines[22]);
        assertEquals("+----+-------+", lines[23]);
        assertEquals("Page 1 of 2 (23 total rows), showing 1-20 of 23", lines[24]);
        assertEquals("Session: " + id + " | next: available | prev: none", lines[25]);
        assertEquals(26, lines.length);
    }

    @Test
    public void testLastPageFooter() {
        String id = registry.createSession("SELECT * FROM employee", rows(23), 20).getId();
        String text = render(registry.nextPage(id).orElseThrow());

        assertTrue(text.contains("| 21 | emp21 |"));
        assertTrue(text.contains("| 23 | emp23 |"));
        assertFalse(text.contains("| 20 |"));
        assertTrue(text.contains("Page 2 of 2 (23 total rows), showing 21-23 of 23"));
        assertTrue(text.endsWith("next: none | prev: available"));
    }

    @Test
    public void testCellsTruncatedToFortyCharacters() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("note", "x".repeat(45) + "TAIL");
        row.put("missing", null);
        String id = registry.createSession("SELECT note FROM t", Collections.singletonList(row), 10).getId();

        String text = render(registry.currentPage(id).orElseThrow());
        assertTrue(text.contains("| " + "x".repeat(40) + " | NULL    |"));
        assertFalse(text.contains("x".repeat(41)));
        assertFalse(text.contains("TAIL"));
        assertTrue(text.contains("(1 total row)"));
    }

    @Test
    public void testEmptyPage() {
        String id = registry.createSession("SELECT * FROM employee WHERE 1 = 0", Collections.emptyList(), 20).getId();
        String text = render(registry.currentPage(id).orElseThrow());

        assertEquals("Empty set\n"
                + "Page 1 of 1 (0 total rows), showing 0-0 of 0\n"
                + "Session: " + id + " | next: none | prev: none", text);
    }

    @Test
    public void testTableFormatterPadsShortRows() {
        List<List<String>> data = new ArrayList<>();
        data.add(Collections.singletonList("a"));
        String table = TextTableFormatter.format(List.of("c1", "c2"), data);
        assertEquals("+----+----+\n"
                + "| c1 | c2 |\n"
                + "+----+----+\n"
                + "| a  |    |\n"
                + "+----+----+", table);
    }
}
