package com.healthtrack.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alerts_user", columnList = "user_id"),
        @Index(name = "idx_alerts_status", columnList = "status"),
        @Index(name = "idx_alerts_priority", columnList = "priority_rank"),
        @Index(name = "idx_alerts_created", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(length = 1000)
    private String message;

    @Convert(converter = AlertStatus.JpaConverter.class)
    @Column(nullable = false, length = 20)
    private AlertStatus status = AlertStatus.ACTIVE;

    @Convert(converter = AlertPriority.JpaConverter.class)
    @Column(nullable = false, length = 20)
    private AlertPriority priority = AlertPriority.MEDIUM;

    // Mirrors priority.rank() so the store can sort by severity.
    @Setter(AccessLevel.NONE)
    @Column(name = "priority_rank", nullable = false)
    private int priorityRank = AlertPriority.MEDIUM.rank();

    @Convert(converter = AlertType.JpaConverter.class)
    @Column(nullable = false, length = 50)
    private AlertType type = AlertType.GENERAL;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Instant acknowledgedAt;

    private Instant resolvedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void setPriority(AlertPriority priority) {
        this.priority = priority;
        this.priorityRank = priority.rank();
    }

    /**
     * Shallow merge: keys in {@code changes} overwrite, all other keys survive.
     */
    public void mergeMetadata(Map<String, Object> changes) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (metadata != null) {
            merged.putAll(metadata);
        }
        merged.putAll(changes);
        this.metadata = merged;
    }
}
