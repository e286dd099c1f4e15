package in.spreadarb.service.position;

import in.spreadarb.domain.market.Quote;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.domain.trade.Position;
import in.spreadarb.service.scanner.OpportunityScanner;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Exit rules for an open position, checked in priority order; the first match wins.
 *
 * <ol>
 *   <li>either quote missing or older than maxQuoteAge: QUOTE_UNAVAILABLE</li>
 *   <li>current spread at or below the position's target: TARGET_SPREAD</li>
 *   <li>stop-loss breached: STOP_LOSS</li>
 *   <li>take-profit reached: TAKE_PROFIT</li>
 *   <li>held longer than maxHoldDuration: MAX_HOLD_TIME</li>
 * </ol>
 */
public final class ExitRuleEvaluator {
    private final Duration maxQuoteAge;
    private final Duration maxHoldDuration;

    public ExitRuleEvaluator(Duration maxQuoteAge, Duration maxHoldDuration) {
        this.maxQuoteAge = maxQuoteAge;
        this.maxHoldDuration = maxHoldDuration;
    }

    public Optional<ExitReason> evaluate(Position position, Quote referenceQuote, Quote comparisonQuote, Instant now) {
        if (referenceQuote == null || comparisonQuote == null
                || referenceQuote.isStale(now, maxQuoteAge) || comparisonQuote.isStale(now, maxQuoteAge)) {
            return Optional.of(ExitReason.QUOTE_UNAVAILABLE);
        }

        BigDecimal ref = referenceQuote.price();
        BigDecimal currentSpread = OpportunityScanner.spreadPercent(ref, comparisonQuote.price());

        if (currentSpread.compareTo(position.targetSpread()) <= 0) {
            return Optional.of(ExitReason.TARGET_SPREAD);
        }
        if (position.isStopLossBreached(ref)) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        if (position.isTakeProfitReached(ref)) {
            return Optional.of(ExitReason.TAKE_PROFIT);
        }
        if (position.isHeldLongerThan(maxHoldDuration, now)) {
            return Optional.of(ExitReason.MAX_HOLD_TIME);
        }
        return Optional.empty();
    }
}
