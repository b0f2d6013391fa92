package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.dto.request.AdCampaign;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Currency conversions between major units and the platforms' minor units.
 */
public final class BudgetUnits {

    private static final BigDecimal MICROS = BigDecimal.valueOf(1_000_000L);

    private BudgetUnits() {
    }

    /** 12.345 -> 1235 */
    public static long toCents(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /** 12.5 -> 12500000 */
    public static long toMicros(BigDecimal amount) {
        return amount.movePointRight(6).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public static BigDecimal fromMicros(BigDecimal micros) {
        return micros.divide(MICROS, 6, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    /** Number of days the campaign runs, both ends included, at least 1 */
    public static long runDays(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            return 1;
        }
        return Math.max(1, ChronoUnit.DAYS.between(startDate, endDate) + 1);
    }

    /** Daily budget when set, otherwise the total budget spread over the run */
    public static BigDecimal dailyAmount(AdCampaign campaign) {
        if (campaign.hasDailyBudget()) {
            return campaign.getDailyBudget();
        }
        long days = runDays(campaign.getStartDate(), campaign.getEndDate());
        return campaign.getBudget().divide(BigDecimal.valueOf(days), 2, RoundingMode.HALF_UP);
    }
}
