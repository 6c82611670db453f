package in.fundpulse.service.watchlist;

import in.fundpulse.application.port.output.FundRepository;
import in.fundpulse.domain.error.ErrorKind;
import in.fundpulse.domain.error.FetchException;
import in.fundpulse.domain.fund.Fund;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Edits the tracked fund set. Every change goes through {@link FundRepository#update}
 * so it cannot interleave with the save of a refresh cycle.
 *
 * Fund codes are unique within the watchlist.
 */
public final class WatchlistService {
    private static final Logger log = LoggerFactory.getLogger(WatchlistService.class);

    private final FundRepository repository;

    public WatchlistService(FundRepository repository) {
        this.repository = repository;
    }

    public List<Fund> list() {
        return repository.load();
    }

    /**
     * Replace the whole watchlist.
     *
     * @throws IllegalStateException if two funds share a code
     */
    public List<Fund> replace(List<Fund> funds) {
        if (funds == null) {
            throw new IllegalArgumentException("Watchlist body must be a JSON array of funds");
        }
        requireUniqueCodes(funds);
        List<Fund> saved = repository.update(current -> funds);
        log.info("[Watchlist] Replaced watchlist with {} funds", saved.size());
        return saved;
    }

    /**
     * Append a fund at the end of the watchlist.
     *
     * @throws IllegalStateException if the code is already tracked
     */
    public Fund add(Fund fund) {
        if (fund == null) {
            throw new IllegalArgumentException("Fund body is required");
        }
        repository.update(current -> {
            if (current.stream().anyMatch(f -> f.code().equals(fund.code()))) {
                throw new IllegalStateException("Fund " + fund.code() + " is already in the watchlist");
            }
            List<Fund> next = new ArrayList<>(current);
            next.add(fund);
            return next;
        });
        log.info("[Watchlist] Added fund {}", fund.code());
        return fund;
    }

    /**
     * @throws FetchException of kind NOT_FOUND if the code is not tracked
     */
    public void remove(String code) {
        repository.update(current -> {
            List<Fund> next = new ArrayList<>(current);
            if (!next.removeIf(f -> f.code().equals(code))) {
                throw new FetchException(ErrorKind.NOT_FOUND, "Fund " + code + " is not in the watchlist");
            }
            return next;
        });
        log.info("[Watchlist] Removed fund {}", code);
    }

    public void clear() {
        repository.update(current -> List.of());
        log.info("[Watchlist] Cleared watchlist");
    }

    private static void requireUniqueCodes(List<Fund> funds) {
        Set<String> seen = new HashSet<>();
        for (Fund fund : funds) {
            if (fund == null) {
                throw new IllegalArgumentException("Watchlist entries cannot be null");
            }
            if (!seen.add(fund.code())) {
                throw new IllegalStateException("Fund " + fund.code() + " is already in the watchlist");
            }
        }
    }
}
