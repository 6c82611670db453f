package in.fundpulse.application.port.output;

import in.fundpulse.domain.fund.Fund;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Storage of the tracked fund set. The whole set is read and written at once.
 *
 * All operations throw {@link in.fundpulse.domain.error.StorageException} on failure.
 */
public interface FundRepository {
    List<Fund> load();

    void save(List<Fund> funds);

    /**
     * Load, apply {@code change} and save, with no other write of this repository in between.
     *
     * @return the set that was saved
     */
    List<Fund> update(UnaryOperator<List<Fund>> change);
}
