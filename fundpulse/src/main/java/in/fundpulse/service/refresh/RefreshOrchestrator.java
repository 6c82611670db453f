package in.fundpulse.service.refresh;

import in.fundpulse.application.port.output.FundRepository;
import in.fundpulse.application.port.output.QuoteProvider;
import in.fundpulse.application.port.output.ValuationProvider;
import in.fundpulse.domain.fund.Fund;
import in.fundpulse.domain.fund.Holding;
import in.fundpulse.domain.market.Quote;
import in.fundpulse.domain.valuation.FundValuation;
import in.fundpulse.domain.valuation.Valuation;
import in.fundpulse.infrastructure.metrics.RefreshMetrics;
import in.fundpulse.infrastructure.resilience.BatchExecutor;
import in.fundpulse.infrastructure.resilience.RetryExecutor;
import in.fundpulse.infrastructure.resilience.RetryResult;
import in.fundpulse.service.valuation.ValuationCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Refresh Orchestrator - one valuation refresh cycle over the tracked fund set.
 *
 * Cycle:
 * 1. Fetch primary valuations for all funds (bounded batch, each call retried)
 * 2. Stop unless some valuation reports a live trading session
 * 3. Fetch quotes for the union of holding codes (bounded batch of pages)
 * 4. Merge: primary valuation first, holdings-based estimate second, stale data last
 * 5. Persist the merged set, reconciled with watchlist edits made during the cycle
 *
 * Provider failures never fail the cycle: a fund without a valuation and a
 * quote page that could not be fetched simply keep their previous data. Only a
 * repository failure propagates to the caller.
 */
public final class RefreshOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RefreshOrchestrator.class);

    public static final int DEFAULT_QUOTE_BATCH_SIZE = 50;

    private final ValuationProvider valuationProvider;
    private final QuoteProvider quoteProvider;
    private final FundRepository fundRepository;
    private final ValuationCalculator calculator;
    private final BatchExecutor batchExecutor;
    private final RetryExecutor retryExecutor;
    private final RefreshMetrics metrics;

    private final int concurrency;
    private final int quoteBatchSize;

    public RefreshOrchestrator(
        ValuationProvider valuationProvider,
        QuoteProvider quoteProvider,
        FundRepository fundRepository,
        ValuationCalculator calculator,
        BatchExecutor batchExecutor,
        RetryExecutor retryExecutor,
        RefreshMetrics metrics
    ) {
        this(valuationProvider, quoteProvider, fundRepository, calculator, batchExecutor, retryExecutor,
            metrics, BatchExecutor.DEFAULT_CONCURRENCY, DEFAULT_QUOTE_BATCH_SIZE);
    }

    public RefreshOrchestrator(
        ValuationProvider valuationProvider,
        QuoteProvider quoteProvider,
        FundRepository fundRepository,
        ValuationCalculator calculator,
        BatchExecutor batchExecutor,
        RetryExecutor retryExecutor,
        RefreshMetrics metrics,
        int concurrency,
        int quoteBatchSize
    ) {
        if (concurrency < 1 || quoteBatchSize < 1) {
            throw new IllegalArgumentException("Concurrency and quote batch size must be positive");
        }
        this.valuationProvider = valuationProvider;
        this.quoteProvider = quoteProvider;
        this.fundRepository = fundRepository;
        this.calculator = calculator;
        this.batchExecutor = batchExecutor;
        this.retryExecutor = retryExecutor;
        this.metrics = metrics;
        this.concurrency = concurrency;
        this.quoteBatchSize = quoteBatchSize;
    }

    /**
     * Refresh the tracked set currently held by the repository.
     */
    public CompletableFuture<List<Fund>> refreshAll() {
        List<Fund> tracked;
        try {
            tracked = fundRepository.load();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return refreshAll(tracked);
    }

    /**
     * Refresh the given tracked set and persist the result.
     *
     * @return the merged set, index aligned with {@code trackedFunds}
     */
    public CompletableFuture<List<Fund>> refreshAll(List<Fund> trackedFunds) {
        if (trackedFunds.isEmpty()) {
            log.debug("[Refresh] No tracked funds, nothing to refresh");
            return CompletableFuture.completedFuture(List.of());
        }

        List<Fund> tracked = List.copyOf(trackedFunds);

        return batchExecutor.execute(tracked, this::fetchValuation, concurrency)
            .thenCompose(valuations -> {
                boolean tradingSession = valuations.stream()
                    .anyMatch(valuation -> valuation.map(FundValuation::tradingSession).orElse(false));

                if (!tradingSession) {
                    log.info("[Refresh] No live trading session reported, keeping {} funds unchanged", tracked.size());
                    return CompletableFuture.completedFuture(tracked);
                }

                return fetchQuotes(collectHoldingCodes(tracked))
                    .thenApply(quotes -> mergeAndSave(tracked, valuations, quotes));
            });
    }

    private CompletableFuture<Optional<FundValuation>> fetchValuation(Fund fund) {
        return retryExecutor.execute(() -> valuationProvider.getValuation(fund.code()), "valuation", fund.code())
            .thenApply(result -> {
                if (!result.isSuccess()) {
                    log.warn("[Refresh] No valuation for {}: {}", fund.code(), result.error().getMessage());
                    return Optional.<FundValuation>empty();
                }
                return result.value() == null ? Optional.<FundValuation>empty() : result.value();
            });
    }

    /**
     * Fetch quotes page by page. A failed page contributes nothing.
     */
    private CompletableFuture<Map<String, Quote>> fetchQuotes(Set<String> codes) {
        if (codes.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }

        List<Set<String>> pages = partition(codes, quoteBatchSize);

        return batchExecutor.execute(pages, this::fetchQuotePage, concurrency)
            .thenApply(results -> {
                Map<String, Quote> quoteByCode = new LinkedHashMap<>();
                for (List<Quote> page : results) {
                    for (Quote quote : page) {
                        quoteByCode.put(quote.code(), quote);
                    }
                }
                log.debug("[Refresh] Received {} quotes for {} codes", quoteByCode.size(), codes.size());
                return quoteByCode;
            });
    }

    private CompletableFuture<List<Quote>> fetchQuotePage(Set<String> page) {
        return retryExecutor.execute(() -> quoteProvider.getQuotes(page), "quotes", "(" + page.size() + " codes)")
            .thenApply((RetryResult<List<Quote>> result) -> {
                if (!result.isSuccess()) {
                    log.warn("[Refresh] Quote page of {} codes unavailable: {}", page.size(), result.error().getMessage());
                    return List.<Quote>of();
                }
                return result.value() == null ? List.<Quote>of() : result.value();
            });
    }

    private List<Fund> mergeAndSave(List<Fund> tracked, List<Optional<FundValuation>> valuations, Map<String, Quote> quoteByCode) {
        boolean hasQuotes = !quoteByCode.isEmpty();
        List<Fund> merged = new ArrayList<>(tracked.size());
        int primary = 0;
        int fallback = 0;
        int unchanged = 0;

        for (int i = 0; i < tracked.size(); i++) {
            Fund fund = tracked.get(i);
            Optional<FundValuation> valuation = valuations.get(i);

            List<Holding> holdings = hasQuotes ? applyQuotes(fund.holdings(), quoteByCode) : fund.holdings();

            if (valuation.isPresent()) {
                merged.add(fund.withPrimaryValuation(valuation.get(), holdings));
                primary++;
            } else if (hasQuotes) {
                Valuation estimate = calculator.calculateValuation(fund, quoteByCode);
                if (!estimate.complete()) {
                    log.debug("[Refresh] Estimate for {} is based on partial holdings data", fund.code());
                }
                merged.add(fund.withEstimatedValuation(estimate, holdings));
                fallback++;
            } else {
                merged.add(fund);
                unchanged++;
            }
        }

        fundRepository.update(current -> reconcile(current, merged));

        log.info("[Refresh] Updated {} funds: {} primary, {} estimated from holdings, {} unchanged",
            merged.size(), primary, fallback, unchanged);

        if (metrics != null) {
            metrics.recordFundValuations("primary", primary);
            metrics.recordFundValuations("fallback", fallback);
            metrics.recordFundValuations("unchanged", unchanged);
        }

        return List.copyOf(merged);
    }

    /**
     * Apply refreshed funds onto the set as stored now. Funds added while the cycle ran
     * are kept as they are and funds removed while it ran stay removed.
     */
    private static List<Fund> reconcile(List<Fund> current, List<Fund> refreshed) {
        Map<String, Fund> refreshedByCode = new HashMap<>();
        for (Fund fund : refreshed) {
            refreshedByCode.put(fund.code(), fund);
        }
        List<Fund> result = new ArrayList<>(current.size());
        for (Fund fund : current) {
            result.add(refreshedByCode.getOrDefault(fund.code(), fund));
        }
        return result;
    }

    private static List<Holding> applyQuotes(List<Holding> holdings, Map<String, Quote> quoteByCode) {
        List<Holding> updated = new ArrayList<>(holdings.size());
        for (Holding holding : holdings) {
            updated.add(holding.withQuote(quoteByCode.get(holding.stockCode())));
        }
        return updated;
    }

    private static Set<String> collectHoldingCodes(List<Fund> funds) {
        Set<String> codes = new LinkedHashSet<>();
        for (Fund fund : funds) {
            for (Holding holding : fund.holdings()) {
                codes.add(holding.stockCode());
            }
        }
        return codes;
    }

    private static List<Set<String>> partition(Set<String> codes, int size) {
        List<Set<String>> pages = new ArrayList<>();
        Set<String> current = new LinkedHashSet<>();
        for (String code : codes) {
            current.add(code);
            if (current.size() == size) {
                pages.add(current);
                current = new LinkedHashSet<>();
            }
        }
        if (!current.isEmpty()) {
            pages.add(current);
        }
        return pages;
    }
}
