package com.resultpager.api.entity.request;

import javax.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;

public class CreateSessionRequest {

    /**
     * 原始查询文本，仅用于展示；未提交 rows 时交给执行器执行
     */
    @NotBlank(message = "query 不能为空")
    private String query;

    /**
     * 已物化的行数据，可选；列表本身可省略，但其中的行不能为 null
     */
    private List<Map<String, Object>> rows;

    /**
     * 每页行数，超出 [10, 50] 时自动限幅
     */
    private Integer pageSize;

    /**
     * 首页的返回格式：TEXT 或 STRUCTURED（默认）
     */
    private String format;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public void setRows(List<Map<String, Object>> rows) {
        this.rows = rows;
    }

    public Integer getPageSize() {
        return pageSize;
    }

    public void setPageSize(Integer pageSize) {
        this.pageSize = pageSize;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }
}
