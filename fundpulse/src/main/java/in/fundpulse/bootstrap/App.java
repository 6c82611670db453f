package in.fundpulse.bootstrap;

import in.fundpulse.application.port.output.FundRepository;
import in.fundpulse.application.port.output.QuoteProvider;
import in.fundpulse.application.port.output.ValuationProvider;
import in.fundpulse.config.RefreshConfig;
import in.fundpulse.infrastructure.metrics.PrometheusRefreshMetrics;
import in.fundpulse.infrastructure.persistence.JsonFileFundRepository;
import in.fundpulse.infrastructure.provider.HttpQuoteProvider;
import in.fundpulse.infrastructure.provider.HttpValuationProvider;
import in.fundpulse.infrastructure.resilience.BatchExecutor;
import in.fundpulse.infrastructure.resilience.DelayScheduler;
import in.fundpulse.infrastructure.resilience.ErrorClassifier;
import in.fundpulse.infrastructure.resilience.ErrorHistory;
import in.fundpulse.infrastructure.resilience.RetryExecutor;
import in.fundpulse.service.market.MarketHoursGate;
import in.fundpulse.service.refresh.CycleTimer;
import in.fundpulse.service.refresh.ExecutorCycleTimer;
import in.fundpulse.service.refresh.RefreshOrchestrator;
import in.fundpulse.service.refresh.RefreshScheduler;
import in.fundpulse.service.valuation.ValuationCalculator;
import in.fundpulse.service.watchlist.WatchlistService;
import in.fundpulse.transport.event.CompositeValuationListener;
import in.fundpulse.transport.event.LatestValuationView;
import in.fundpulse.transport.event.LoggingValuationListener;
import in.fundpulse.transport.http.ApiHandlers;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Composition root. Every component is constructed here and handed its collaborators.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== FundPulse Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        RefreshConfig config = StartupConfigValidator.load();

        Clock utc = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        PrometheusRefreshMetrics metrics = new PrometheusRefreshMetrics(registry);

        // ═══════════════════════════════════════════════════════════════
        // Collaborators
        // ═══════════════════════════════════════════════════════════════
        FundRepository repository = new JsonFileFundRepository(config.dataFile());
        ValuationProvider valuationProvider = new HttpValuationProvider(config.providerUrl(), config.httpTimeout(), utc);
        QuoteProvider quoteProvider = new HttpQuoteProvider(config.providerUrl(), config.httpTimeout());

        LatestValuationView view = new LatestValuationView(utc);
        CompositeValuationListener listener = new CompositeValuationListener(
            List.of(view, new LoggingValuationListener()));

        // ═══════════════════════════════════════════════════════════════
        // Refresh pipeline
        // ═══════════════════════════════════════════════════════════════
        RetryExecutor retryExecutor = new RetryExecutor(
            config.retry(), new ErrorClassifier(), DelayScheduler.async(), new ErrorHistory(), metrics, utc);

        RefreshOrchestrator orchestrator = new RefreshOrchestrator(
            valuationProvider,
            quoteProvider,
            repository,
            new ValuationCalculator(utc),
            new BatchExecutor(),
            retryExecutor,
            metrics,
            config.fetchConcurrency(),
            config.quoteBatchSize()
        );

        CycleTimer timer = new ExecutorCycleTimer();
        RefreshScheduler scheduler = new RefreshScheduler(
            orchestrator,
            new MarketHoursGate(Clock.system(config.marketZone())),
            listener,
            timer,
            config.scheduler(),
            metrics,
            utc
        );

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        ApiHandlers api = new ApiHandlers(scheduler, view, new WatchlistService(repository), retryExecutor, registry);
        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(buildRoutes(api))
            .build();
        server.start();
        log.info("✓ HTTP API listening on port {}", config.port());

        scheduler.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            scheduler.stop();
            timer.shutdown();
            server.stop();
            log.info("Shutdown complete");
        }, "shutdown"));
    }

    static RoutingHandler buildRoutes(ApiHandlers api) {
        return Handlers.routing()
            .get("/metrics", api::metrics)
            .get("/api/status", api::status)
            .get("/api/funds", api::funds)
            .get("/api/errors", api::errors)
            .post("/api/refresh", api::refresh)
            .get("/api/watchlist", api::getWatchlist)
            .put("/api/watchlist", api::replaceWatchlist)
            .post("/api/watchlist", api::addFund)
            .delete("/api/watchlist", api::clearWatchlist)
            .delete("/api/watchlist/{code}", api::removeFund)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "FundPulse\n\n" +
                    "API: GET /api/status, /api/funds, /api/errors, POST /api/refresh\n" +
                    "Watchlist: GET, PUT, POST, DELETE /api/watchlist, DELETE /api/watchlist/{code}\n" +
                    "Metrics: GET /metrics\n"
                );
            });
    }

    private App() {}
}
