package in.spreadarb.service.engine;

import in.spreadarb.domain.signal.Opportunity;
import in.spreadarb.service.position.CloseResult;
import in.spreadarb.service.position.EntryDecision;

import java.util.List;

/**
 * What happened during one tick.
 */
public record TickResult(
    int referenceQuotes,
    int comparisonQuotes,
    List<Opportunity> opportunities,
    List<EntryDecision> entries,
    List<CloseResult> exits
) {
    public long opened() {
        return entries.stream().filter(EntryDecision::isOpened).count();
    }
}
