package com.hargapangan.audit;

/**
 * Action names written to audit_logs.
 */
public final class AuditActions {

    public static final String PRICE_OVERRIDE = "price_override";
    public static final String OVERRIDE_APPROVED = "override_approved";
    public static final String OVERRIDE_REJECTED = "override_rejected";
    public static final String OVERRIDE_DELETED = "override_deleted";
    public static final String OVERRIDE_EXPIRED = "override_expired";
    public static final String OVERRIDE_REJECTED_REQUEST = "override_rejected_request";
    public static final String SYNC_COMPLETED = "sync_completed";
    public static final String SYNC_ERROR = "sync_error";
    public static final String COMMODITY_CREATED = "commodity_created";
    public static final String COMMODITY_UPDATED = "commodity_updated";
    public static final String COMMODITY_DEACTIVATED = "commodity_deactivated";
    public static final String MARKET_PRICE_CREATED = "market_price_created";
    public static final String MARKET_PRICE_UPDATED = "market_price_updated";
    public static final String MARKET_PRICE_VERIFIED = "market_price_verified";
    public static final String MARKET_PRICE_DELETED = "market_price_deleted";
    public static final String MARKET_PRICE_IMPORTED = "market_price_imported";
    public static final String CUSTOM_COMMODITY_CREATED = "custom_commodity_created";
    public static final String CUSTOM_COMMODITY_UPDATED = "custom_commodity_updated";
    public static final String CUSTOM_COMMODITY_DEACTIVATED = "custom_commodity_deactivated";
    public static final String CACHE_INVALIDATED = "cache_invalidated";

    /** Actor id used for entries written by scheduled jobs. */
    public static final String SYSTEM_ACTOR = "system";

    private AuditActions() {
    }
}
