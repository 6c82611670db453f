package in.fundpulse.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.fundpulse.domain.error.ErrorKind;
import in.fundpulse.domain.error.FetchException;
import in.fundpulse.domain.fund.Fund;
import in.fundpulse.infrastructure.resilience.RetryExecutor;
import in.fundpulse.service.refresh.RefreshScheduler;
import in.fundpulse.service.watchlist.WatchlistService;
import in.fundpulse.transport.event.LatestValuationView;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP API for status, watchlist editing, manual refresh and metrics.
 *
 * - GET    /api/status           - scheduler status and last terminal error
 * - GET    /api/funds            - stored funds with their latest persisted numbers
 * - GET    /api/errors           - recent terminal fetch failures (oldest first)
 * - POST   /api/refresh          - run one refresh now, ignoring market hours
 * - GET    /api/watchlist        - tracked funds
 * - PUT    /api/watchlist        - replace the watchlist with a JSON array of funds
 * - POST   /api/watchlist        - add one fund
 * - DELETE /api/watchlist        - clear the watchlist
 * - DELETE /api/watchlist/{code} - remove one fund
 * - GET    /metrics              - Prometheus text format
 *
 * JSON responses use the {"success":..,"data":..,"error":..} envelope.
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private static final TypeReference<List<Fund>> FUND_LIST = new TypeReference<>() {};

    private static final String JSON_SUCCESS = "success";
    private static final String JSON_DATA = "data";
    private static final String JSON_ERROR = "error";

    private final RefreshScheduler scheduler;
    private final LatestValuationView view;
    private final WatchlistService watchlist;
    private final RetryExecutor retryExecutor;
    private final CollectorRegistry registry;

    public ApiHandlers(
        RefreshScheduler scheduler,
        LatestValuationView view,
        WatchlistService watchlist,
        RetryExecutor retryExecutor,
        CollectorRegistry registry
    ) {
        this.scheduler = scheduler;
        this.view = view;
        this.watchlist = watchlist;
        this.retryExecutor = retryExecutor;
        this.registry = registry;
    }

    /**
     * GET /api/status
     */
    public void status(HttpServerExchange exchange) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scheduler", scheduler.getStatus());
        data.put("config", scheduler.getConfig());
        view.getLastError().ifPresent(notice -> data.put("lastNotice", notice));
        sendSuccess(exchange, data);
    }

    /**
     * GET /api/funds
     *
     * Every cycle persists before it is published, so the store is never behind the last
     * refresh and also serves funds before the first cycle has run.
     */
    public void funds(HttpServerExchange exchange) {
        try {
            sendSuccess(exchange, watchlist.list());
        } catch (RuntimeException e) {
            handleWatchlistFailure(exchange, "load funds", e);
        }
    }

    /**
     * GET /api/watchlist
     */
    public void getWatchlist(HttpServerExchange exchange) {
        funds(exchange);
    }

    /**
     * PUT /api/watchlist
     */
    public void replaceWatchlist(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                List<Fund> funds = MAPPER.readValue(body, FUND_LIST);
                sendSuccess(ex, watchlist.replace(funds));
            } catch (JsonProcessingException e) {
                sendFailure(ex, StatusCodes.BAD_REQUEST, "Invalid watchlist body: " + e.getOriginalMessage());
            } catch (RuntimeException e) {
                handleWatchlistFailure(ex, "save watchlist", e);
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/watchlist
     */
    public void addFund(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((ex, body) -> {
            try {
                Fund fund = MAPPER.readValue(body, Fund.class);
                sendSuccess(ex, watchlist.add(fund));
            } catch (JsonProcessingException e) {
                sendFailure(ex, StatusCodes.BAD_REQUEST, "Invalid fund body: " + e.getOriginalMessage());
            } catch (RuntimeException e) {
                handleWatchlistFailure(ex, "add fund", e);
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * DELETE /api/watchlist/{code}
     */
    public void removeFund(HttpServerExchange exchange) {
        String code = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY)
            .getParameters().get("code");
        try {
            watchlist.remove(code);
            sendSuccess(exchange, null);
        } catch (RuntimeException e) {
            handleWatchlistFailure(exchange, "remove fund " + code, e);
        }
    }

    /**
     * DELETE /api/watchlist
     */
    public void clearWatchlist(HttpServerExchange exchange) {
        try {
            watchlist.clear();
            sendSuccess(exchange, null);
        } catch (RuntimeException e) {
            handleWatchlistFailure(exchange, "clear watchlist", e);
        }
    }

    /**
     * GET /api/errors
     */
    public void errors(HttpServerExchange exchange) {
        sendSuccess(exchange, retryExecutor.getErrorHistory());
    }

    /**
     * POST /api/refresh
     *
     * Responds once the cycle has finished. The exchange is dispatched off the IO thread first.
     */
    public void refresh(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> refresh(exchange));
            return;
        }

        try {
            var funds = scheduler.refresh().join();
            sendSuccess(exchange, funds);
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[API] Manual refresh failed: {}", cause.getMessage());
            sendFailure(exchange, StatusCodes.SERVICE_UNAVAILABLE, cause.getMessage());
        }
    }

    /**
     * GET /metrics
     */
    public void metrics(HttpServerExchange exchange) {
        try {
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            exchange.getResponseSender().send(writer.toString(), StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("[API] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage(), StandardCharsets.UTF_8);
        }
    }

    private void handleWatchlistFailure(HttpServerExchange exchange, String action, RuntimeException e) {
        if (e instanceof IllegalArgumentException) {
            sendFailure(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } else if (e instanceof IllegalStateException) {
            sendFailure(exchange, StatusCodes.CONFLICT, e.getMessage());
        } else if (e instanceof FetchException fetch && fetch.getKind() == ErrorKind.NOT_FOUND) {
            sendFailure(exchange, StatusCodes.NOT_FOUND, e.getMessage());
        } else {
            log.error("[API] Failed to {}: {}", action, e.getMessage(), e);
            sendFailure(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to " + action);
        }
    }

    private void sendSuccess(HttpServerExchange exchange, Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(JSON_SUCCESS, true);
        body.put(JSON_DATA, data);
        send(exchange, StatusCodes.OK, body);
    }

    private void sendFailure(HttpServerExchange exchange, int statusCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(JSON_SUCCESS, false);
        body.put(JSON_ERROR, message);
        send(exchange, statusCode, body);
    }

    private void send(HttpServerExchange exchange, int statusCode, Object body) {
        try {
            String json = MAPPER.writeValueAsString(body);
            exchange.setStatusCode(statusCode);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("[API] Failed to serialize response: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send("Failed to serialize response", StandardCharsets.UTF_8);
        }
    }
}
