package in.fundpulse.transport.event;

import in.fundpulse.application.port.output.ValuationListener;
import in.fundpulse.domain.fund.Fund;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class LoggingValuationListener implements ValuationListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingValuationListener.class);

    @Override
    public void onValuationUpdated(List<Fund> funds) {
        for (Fund fund : funds) {
            log.debug("[Valuation] {} {} est={} ({}%) real={}",
                fund.code(), fund.name(), fund.estimatedValue(), fund.estimatedChange(), fund.realValue());
        }
        log.info("[Valuation] Published {} funds", funds.size());
    }

    @Override
    public void onError(String message) {
        log.warn("[Valuation] {}", message);
    }
}
