package com.resultpager.api.controller;

import com.resultpager.api.entity.enums.ResponseFormat;
import com.resultpager.api.entity.request.CreateSessionRequest;
import com.resultpager.api.entity.response.PagerResponse;
import com.resultpager.api.entity.response.SessionCreateResponse;
import com.resultpager.api.exception.ExecutorUnavailableException;
import com.resultpager.api.exception.QueryExecutionException;
import com.resultpager.api.exception.SessionNotFoundException;
import com.resultpager.api.service.PagingService;
import com.resultpager.session.SessionSummary;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.List;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/sessions")
@Validated
public class SessionController {

    private final PagingService pagingService;

    public SessionController(PagingService pagingService) {
        this.pagingService = pagingService;
    }

    @PostMapping
    public ResponseEntity<PagerResponse<SessionCreateResponse>> createSession(@Valid @RequestBody CreateSessionRequest request) {
        try {
            return ResponseEntity.ok(PagerResponse.success(pagingService.createSession(request)));
        } catch (ExecutorUnavailableException ex) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(PagerResponse.failure(ex.getMessage()));
        } catch (QueryExecutionException | IllegalArgumentException ex) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(PagerResponse.failure(ex.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<PagerResponse<List<SessionSummary>>> listSessions() {
        return ResponseEntity.ok(PagerResponse.success(pagingService.listSessions()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<PagerResponse<Object>> currentPage(@PathVariable String sessionId,
                                                             @RequestParam(required = false) String format) {
        return page(() -> pagingService.currentPage(sessionId, ResponseFormat.from(format)));
    }

    @PostMapping("/{sessionId}/next")
    public ResponseEntity<PagerResponse<Object>> nextPage(@PathVariable String sessionId,
                                                          @RequestParam(required = false) String format) {
        return page(() -> pagingService.nextPage(sessionId, ResponseFormat.from(format)));
    }

    @PostMapping("/{sessionId}/prev")
    public ResponseEntity<PagerResponse<Object>> prevPage(@PathVariable String sessionId,
                                                          @RequestParam(required = false) String format) {
        return page(() -> pagingService.prevPage(sessionId, ResponseFormat.from(format)));
    }

    @GetMapping("/{sessionId}/pages/{page}")
    public ResponseEntity<PagerResponse<Object>> gotoPage(@PathVariable String sessionId,
                                                          @PathVariable int page,
                                                          @RequestParam(required = false) String format) {
        return page(() -> pagingService.gotoPage(sessionId, page, ResponseFormat.from(format)));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
        boolean removed = pagingService.deleteSession(sessionId);
        if (removed) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
    }

    private ResponseEntity<PagerResponse<Object>> page(Supplier<Object> operation) {
        try {
            return ResponseEntity.ok(PagerResponse.success(operation.get()));
        } catch (SessionNotFoundException ex) {
            // 会话过期后由调用方重新执行查询
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(PagerResponse.failure(ex.getMessage()));
        }
    }
}
