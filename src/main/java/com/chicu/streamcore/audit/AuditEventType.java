package com.chicu.streamcore.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;

/**
 * Типы событий аудита. wireName: имя в экспорте и в API.
 */
public enum AuditEventType {

    ORDER_PLACED("order_placed"),
    ORDER_FILLED("order_filled"),
    ORDER_CANCELLED("order_cancelled"),
    POSITION_OPENED("position_opened"),
    POSITION_CLOSED("position_closed"),
    BALANCE_CHANGED("balance_changed"),
    SETTING_CHANGED("setting_changed"),
    WALLET_CONNECTED("wallet_connected"),
    WALLET_DISCONNECTED("wallet_disconnected"),
    TRADE_EXECUTED("trade_executed"),
    CONNECTION_STATE_CHANGED("connection_state_changed");

    private final String wireName;

    AuditEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Принимает и order_placed, и ORDER_PLACED.
     */
    public static AuditEventType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("event type is empty");
        }
        String s = raw.trim();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(s) || t.name().equalsIgnoreCase(s))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown event type: " + raw));
    }

    /**
     * Человекочитаемое описание для CSV-экспорта.
     */
    public String describe(JsonNode p) {
        return switch (this) {
            case ORDER_PLACED -> "Order %s placed: %s %s %s at %s".formatted(
                    text(p, "orderId"), text(p, "side"), text(p, "quantity"), text(p, "symbol"),
                    p.hasNonNull("price") ? p.get("price").asText() : "market price");
            case ORDER_FILLED -> "Order %s filled: %s units at %s".formatted(
                    text(p, "orderId"), text(p, "filledQuantity"), text(p, "fillPrice"));
            case ORDER_CANCELLED -> "Order %s cancelled: %s".formatted(
                    text(p, "orderId"), text(p, "reason"));
            case POSITION_OPENED -> "Position %s opened: %s %s at %s".formatted(
                    text(p, "positionId"), text(p, "quantity"), text(p, "symbol"), text(p, "entryPrice"));
            case POSITION_CLOSED -> "Position %s closed at %s (P&L: %s)".formatted(
                    text(p, "positionId"), text(p, "exitPrice"), text(p, "pnl"));
            case BALANCE_CHANGED -> "Balance changed for %s %s: %s -> %s (%s)".formatted(
                    text(p, "wallet"), text(p, "token"), text(p, "oldBalance"), text(p, "newBalance"), text(p, "reason"));
            case SETTING_CHANGED -> "Setting '%s' changed: %s -> %s".formatted(
                    text(p, "key"), text(p, "oldValue"), text(p, "newValue"));
            case WALLET_CONNECTED -> "Wallet %s (%s) connected".formatted(
                    text(p, "walletAddress"), text(p, "walletType"));
            case WALLET_DISCONNECTED -> "Wallet %s disconnected".formatted(text(p, "walletAddress"));
            case TRADE_EXECUTED -> "Trade %s executed: %s %s -> %s %s at %s".formatted(
                    text(p, "tradeId"), text(p, "fromAmount"), text(p, "fromToken"),
                    text(p, "toAmount"), text(p, "toToken"), text(p, "price"));
            case CONNECTION_STATE_CHANGED -> "Provider %s: %s -> %s (%s)".formatted(
                    text(p, "provider"), text(p, "from"), text(p, "to"), text(p, "reason"));
        };
    }

    private static String text(JsonNode p, String field) {
        return p != null && p.hasNonNull(field) ? p.get(field).asText() : "";
    }
}
