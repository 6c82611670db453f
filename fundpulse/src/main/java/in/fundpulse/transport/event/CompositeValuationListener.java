package in.fundpulse.transport.event;

import in.fundpulse.application.port.output.ValuationListener;
import in.fundpulse.domain.fund.Fund;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans notifications out to several listeners. One failing listener does not starve the others.
 */
public final class CompositeValuationListener implements ValuationListener {
    private static final Logger log = LoggerFactory.getLogger(CompositeValuationListener.class);

    private final List<ValuationListener> listeners;

    public CompositeValuationListener(List<ValuationListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    @Override
    public void onValuationUpdated(List<Fund> funds) {
        for (ValuationListener listener : listeners) {
            try {
                listener.onValuationUpdated(funds);
            } catch (RuntimeException e) {
                log.warn("[Listener] {} failed on update: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void onError(String message) {
        for (ValuationListener listener : listeners) {
            try {
                listener.onError(message);
            } catch (RuntimeException e) {
                log.warn("[Listener] {} failed on error notice: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
