package in.fundpulse.infrastructure.persistence;

import in.fundpulse.domain.error.ErrorKind;
import in.fundpulse.domain.error.StorageException;
import in.fundpulse.domain.fund.Fund;
import in.fundpulse.domain.fund.Holding;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileFundRepositoryTest {

    @TempDir
    Path dir;

    private static Fund sampleFund() {
        return new Fund(
            "161725",
            "Liquor Index",
            1.2345,
            LocalDate.of(2024, 3, 1),
            1.2401,
            0.45,
            Instant.parse("2024-03-04T06:30:00Z"),
            false,
            List.of(
                new Holding("600519", "Kweichow Moutai", 15.2, 1.25, 1688.0),
                new Holding("000858", "Wuliangye", 14.8, -0.3, 150.2)
            )
        );
    }

    @Test
    void testMissingFileIsEmptyWatchlist() {
        JsonFileFundRepository repository = new JsonFileFundRepository(dir.resolve("watchlist.json"));

        assertTrue(repository.load().isEmpty());
    }

    @Test
    void testSaveThenLoad() {
        Path file = dir.resolve("nested/data/watchlist.json");
        JsonFileFundRepository repository = new JsonFileFundRepository(file);
        Fund fund = sampleFund();

        repository.save(List.of(fund));

        assertTrue(Files.exists(file), "Parent directories are created");
        assertFalse(Files.exists(file.resolveSibling("watchlist.json.tmp")), "Temp file is moved into place");
        assertEquals(List.of(fund), new JsonFileFundRepository(file).load());
    }

    @Test
    void testSaveReplacesPreviousDocument() {
        JsonFileFundRepository repository = new JsonFileFundRepository(dir.resolve("watchlist.json"));
        Fund fund = sampleFund();

        repository.save(List.of(fund, new Fund("000001", "Growth Mix", 1.0, null, 1.0, 0, null, true, List.of())));
        repository.save(List.of(fund));

        assertEquals(1, repository.load().size());
    }

    @Test
    void testDocumentIsVersioned() throws Exception {
        Path file = dir.resolve("watchlist.json");
        new JsonFileFundRepository(file).save(List.of(sampleFund()));

        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"version\" : 1"), json);
        assertTrue(json.contains("\"netValueDate\" : \"2024-03-01\""), json);
    }

    @Test
    void testUnknownFieldsAreIgnored() throws Exception {
        Path file = dir.resolve("watchlist.json");
        Files.writeString(file,
            "{\"version\":1,\"extra\":true,\"funds\":[{\"code\":\"000001\",\"name\":\"Growth Mix\",\"color\":\"red\"}]}");

        List<Fund> funds = new JsonFileFundRepository(file).load();

        assertEquals(1, funds.size());
        assertEquals("000001", funds.get(0).code());
        assertTrue(funds.get(0).holdings().isEmpty());
    }

    @Test
    void testCorruptFileRaisesStorageError() throws Exception {
        Path file = dir.resolve("watchlist.json");
        Files.writeString(file, "{not json");

        StorageException thrown = assertThrows(StorageException.class,
            () -> new JsonFileFundRepository(file).load());
        assertEquals(ErrorKind.STORAGE, thrown.getKind());
        assertTrue(thrown.isRetryable());
    }

    @Test
    void testUpdateAppliesChangeToStoredSet() {
        JsonFileFundRepository repository = new JsonFileFundRepository(dir.resolve("watchlist.json"));
        Fund fund = sampleFund();
        Fund other = new Fund("000001", "Growth Mix", 1.0, null, 1.0, 0, null, true, List.of());
        repository.save(List.of(fund));

        List<Fund> saved = repository.update(current -> {
            assertEquals(List.of(fund), current);
            return List.of(fund, other);
        });

        assertEquals(List.of(fund, other), saved);
        assertEquals(List.of(fund, other), repository.load());
    }

    @Test
    void testUpdateThatThrowsLeavesFileUntouched() {
        JsonFileFundRepository repository = new JsonFileFundRepository(dir.resolve("watchlist.json"));
        repository.save(List.of(sampleFund()));

        assertThrows(IllegalStateException.class, () -> repository.update(current -> {
            throw new IllegalStateException("rejected");
        }));

        assertEquals(List.of(sampleFund()), repository.load());
    }
}
