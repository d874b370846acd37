package com.fintech.candlesync.storage.timescaledb;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only row of the data collection log.
 */
@Entity
@Table(
    name = "data_collection_logs",
    indexes = {
        @Index(name = "idx_logs_logged_at", columnList = "logged_at"),
        @Index(name = "idx_logs_level", columnList = "level")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "logged_at", nullable = false)
    private Instant loggedAt;

    @Column(nullable = false, length = 16)
    private String level;

    @Column(length = 64)
    private String instrument;

    @Column(length = 8)
    private String timeframe;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(columnDefinition = "TEXT")
    private String details;
}
