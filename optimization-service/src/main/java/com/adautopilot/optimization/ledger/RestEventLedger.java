package com.adautopilot.optimization.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST implementation of {@link EventLedger}: HTTP POST to the ledger service,
 * subscribed and forgotten. Errors are logged at WARN and go nowhere else.
 */
@Component
public class RestEventLedger implements EventLedger {

    private static final Logger log = LoggerFactory.getLogger(RestEventLedger.class);

    private final WebClient ledgerClient;

    public RestEventLedger(@Qualifier("ledgerClient") WebClient ledgerClient) {
        this.ledgerClient = ledgerClient;
    }

    @Override
    public void publish(LedgerEvent event) {
        try {
            ledgerClient.post()
                .uri("/api/v1/ledger/events")
                .bodyValue(event)
                .retrieve()
                .toBodilessEntity()
                .subscribe(
                    r   -> log.info("Ledger event published. type={} actionId={} status={}",
                                    event.eventType(), event.actionId(), r.getStatusCode()),
                    err -> log.warn("Ledger event publish failed (non-critical). type={} actionId={}",
                                    event.eventType(), event.actionId(), err)
                );
        } catch (RuntimeException e) {
            log.warn("Ledger event could not be dispatched (non-critical). type={} actionId={}",
                     event.eventType(), event.actionId(), e);
        }
    }
}
