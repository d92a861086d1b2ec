package com.chicu.streamcore.orders;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Ордер, записанный внешним исполнителем. Ядро только читает закрытые ордера для компрессии.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "order_record",
        indexes = {
                @Index(name = "ix_order_record_status_created", columnList = "status,created_at"),
                @Index(name = "ix_order_record_wallet", columnList = "wallet")
        }
)
public class OrderRecordEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "wallet", length = 64)
    private String wallet;

    @Column(name = "symbol", nullable = false, length = 64)
    private String symbol;

    @Column(name = "side", length = 8)
    private String side; // BUY/SELL

    @Column(name = "order_type", length = 16)
    private String orderType; // MARKET/LIMIT

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private OrderStatus status;

    // ========== числа ==========
    @Column(name = "quantity", precision = 28, scale = 12)
    private BigDecimal quantity;

    @Column(name = "price", precision = 28, scale = 12)
    private BigDecimal price;

    @Column(name = "filled_quantity", precision = 28, scale = 12)
    private BigDecimal filledQuantity;

    @Column(name = "avg_fill_price", precision = 28, scale = 12)
    private BigDecimal avgFillPrice;

    @Column(name = "tx_signature", length = 128)
    private String txSignature;

    @Column(name = "error_message", length = 512)
    private String errorMessage;

    // ========== время ==========
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
        if (symbol != null) symbol = symbol.trim().toUpperCase();
        if (side != null) side = side.trim().toUpperCase();
    }
}
