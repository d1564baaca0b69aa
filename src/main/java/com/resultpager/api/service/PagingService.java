package com.resultpager.api.service;

import com.resultpager.api.entity.enums.ResponseFormat;
import com.resultpager.api.entity.request.CreateSessionRequest;
import com.resultpager.api.entity.response.SessionCreateResponse;
import com.resultpager.api.exception.SessionNotFoundException;
import com.resultpager.api.executor.QueryExecutor;
import com.resultpager.common.PageFormatter;
import com.resultpager.common.TextPageFormatter;
import com.resultpager.session.PageView;
import com.resultpager.session.PagedResultSet;
import com.resultpager.session.SessionRegistry;
import com.resultpager.session.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Service
public class PagingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PagingService.class);

    private final SessionRegistry sessionRegistry;
    private final QueryExecutor queryExecutor;
    private final PageFormatter formatter = new TextPageFormatter();

    public PagingService(SessionRegistry sessionRegistry, QueryExecutor queryExecutor) {
        this.sessionRegistry = sessionRegistry;
        this.queryExecutor = queryExecutor;
    }

    /**
     * 创建分页会话并返回首页。请求中带 rows 时直接缓存，否则先交给执行器执行查询。
     */
    public SessionCreateResponse createSession(CreateSessionRequest request) {
        List<Map<String, Object>> rows = request.getRows();
        if (rows == null) {
            LOGGER.debug("执行查询: {}", request.getQuery());
            rows = queryExecutor.query(request.getQuery());
        }
        if (rows.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("rows must not contain null");
        }
        PagedResultSet session = sessionRegistry.createSession(request.getQuery(), rows, request.getPageSize());
        // 直接从返回的会话取首页，并发删除不影响本次响应
        PageView firstPage = session.getPage();
        return new SessionCreateResponse(
                session.getId(),
                session.getCreatedAtMillis(),
                session.getTotalRows(),
                render(firstPage, ResponseFormat.from(request.getFormat())));
    }

    public Object currentPage(String sessionId, ResponseFormat format) {
        return render(required(sessionId, sessionRegistry.currentPage(sessionId)), format);
    }

    public Object nextPage(String sessionId, ResponseFormat format) {
        return render(required(sessionId, sessionRegistry.nextPage(sessionId)), format);
    }

    public Object prevPage(String sessionId, ResponseFormat format) {
        return render(required(sessionId, sessionRegistry.prevPage(sessionId)), format);
    }

    public Object gotoPage(String sessionId, int page, ResponseFormat format) {
        return render(required(sessionId, sessionRegistry.gotoPage(sessionId, page)), format);
    }

    public boolean deleteSession(String sessionId) {
        return sessionRegistry.deleteSession(sessionId);
    }

    public List<SessionSummary> listSessions() {
        return sessionRegistry.listSessions();
    }

    private PageView required(String sessionId, Optional<PageView> view) {
        return view.orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private Object render(PageView view, ResponseFormat format) {
        // 返回文本化结果
        if (format == ResponseFormat.TEXT) {
            return new String(formatter.format(view), StandardCharsets.UTF_8);
        }
        return view;
    }
}
