package com.mobifone.updatecenter.entity;

import com.mobifone.updatecenter.entity.enumeration.ActivityPhase;
import com.mobifone.updatecenter.entity.enumeration.ActivityType;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Immutable
@Table(name = "activity_log",
        uniqueConstraints = @UniqueConstraint(name = "uk_activity_batch_seq", columnNames = {"batch_request_id", "seq_no"}))
public class ActivityLogEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    String id;

    @Column(name = "batch_request_id", nullable = false)
    String batchRequestId;

    String batchItemId;          // null for batch-level entries
    String packageName;

    @Column(name = "seq_no", nullable = false)
    Long sequence;

    @Column(name = "logged_at", nullable = false)
    LocalDateTime timestamp;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    ActivityType activityType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    ActivityPhase phase;

    @Column(columnDefinition = "TEXT")
    String message;

    @Column(columnDefinition = "TEXT")
    String details;

    Integer progressPercent;
}
