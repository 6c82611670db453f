package in.fundpulse.application.port.output;

import in.fundpulse.domain.fund.Fund;

import java.util.List;

/**
 * Fire-and-forget notifications towards the UI.
 */
public interface ValuationListener {
    void onValuationUpdated(List<Fund> funds);

    void onError(String message);
}
