package org.rgen.runtime.events;

/**
 * Typed event kinds published on the {@link EventBus}. Payloads stay open; {@link #CUSTOM} lets
 * external code publish kinds of its own, named in the payload under {@code "type"}.
 */
public enum EventKind {
    WORLD_CREATED,
    NPC_SPAWNED,
    ENTITY_REMOVED,
    NPC_STATE_CHANGED,
    ITEM_CRAFTED,
    NPC_ATE,
    NPC_SOCIALIZED,
    TRAVEL_STARTED,
    LOCATION_EXITED,
    LOCATION_ENTERED,
    TRAVEL_COMPLETED,
    MARKET_OPENED,
    MARKET_CLOSED,
    WEATHER_CHANGED,
    HOUR_PASSED,
    DAY_PASSED,
    MONTH_PASSED,
    SEASON_CHANGED,
    YEAR_PASSED,
    ERROR,
    CUSTOM
}
