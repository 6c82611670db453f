package in.fundpulse.infrastructure.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.fundpulse.application.port.output.FundRepository;
import in.fundpulse.domain.error.StorageException;
import in.fundpulse.domain.fund.Fund;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Watchlist stored as one JSON document.
 *
 * <pre>
 * {"version":1,"funds":[{"code":"161725","name":"...","holdings":[...]}]}
 * </pre>
 *
 * Writes go to a sibling temp file that then replaces the document, so readers
 * never observe a half-written set. A missing file is an empty watchlist.
 */
public final class JsonFileFundRepository implements FundRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileFundRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    static final int VERSION = 1;

    private final Path file;

    public JsonFileFundRepository(Path file) {
        this.file = file;
    }

    @Override
    public synchronized List<Fund> load() {
        if (!Files.exists(file)) {
            log.info("[FundRepository] No watchlist at {}, starting empty", file);
            return List.of();
        }
        try {
            WatchlistDocument document = MAPPER.readValue(file.toFile(), WatchlistDocument.class);
            List<Fund> funds = document.funds() == null ? List.of() : List.copyOf(document.funds());
            log.debug("[FundRepository] Loaded {} funds from {}", funds.size(), file);
            return funds;
        } catch (IOException e) {
            throw new StorageException("Failed to read watchlist file " + file, e);
        }
    }

    @Override
    public synchronized void save(List<Fund> funds) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new WatchlistDocument(VERSION, funds));
            replace(temp);
            log.debug("[FundRepository] Saved {} funds to {}", funds.size(), file);
        } catch (IOException e) {
            throw new StorageException("Failed to write watchlist file " + file, e);
        }
    }

    private void replace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public synchronized List<Fund> update(UnaryOperator<List<Fund>> change) {
        List<Fund> next = List.copyOf(change.apply(load()));
        save(next);
        return next;
    }

    record WatchlistDocument(int version, List<Fund> funds) {}
}
