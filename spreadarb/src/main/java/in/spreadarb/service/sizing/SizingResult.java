package in.spreadarb.service.sizing;

import java.math.BigDecimal;

/**
 * Output of a position sizer.
 *
 * {@code size} is in base-currency units, already rounded. A zero size with a non-null
 * {@code rejection} means the entry must be skipped.
 */
public record SizingResult(BigDecimal size, BigDecimal notionalUsd, String rejection) {

    public static SizingResult of(BigDecimal size, BigDecimal notionalUsd) {
        return new SizingResult(size, notionalUsd, size.signum() > 0 ? null : "size rounds to zero");
    }

    public static SizingResult rejected(String reason) {
        return new SizingResult(BigDecimal.ZERO, BigDecimal.ZERO, reason);
    }

    public boolean isTradable() {
        return rejection == null && size.signum() > 0;
    }
}
