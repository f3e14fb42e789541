package com.ledgersync.domain.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Account valuation fields mirrored from the venue. Each field maps one venue tag to a
 * column of the account_summary table.
 */
@Getter
@RequiredArgsConstructor
public enum AccountSummaryField {
    NET_LIQUIDATION("NetLiquidation"),
    TOTAL_CASH_VALUE("TotalCashValue"),
    AVAILABLE_FUNDS("AvailableFunds"),
    EXCESS_LIQUIDITY("ExcessLiquidity"),
    INIT_MARGIN_REQ("InitMarginReq"),
    MAINT_MARGIN_REQ("MaintMarginReq"),
    GROSS_POSITION_VALUE("GrossPositionValue"),
    SHORT_MARKET_VALUE("ShortMarketValue");

    private final String venueTag;

    public static Optional<AccountSummaryField> fromVenueTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(f -> f.venueTag.equals(tag)).findFirst();
    }

    /** Tags to request when subscribing to the venue's account summary. */
    public static List<String> venueTags() {
        return Arrays.stream(values()).map(AccountSummaryField::getVenueTag).toList();
    }
}
