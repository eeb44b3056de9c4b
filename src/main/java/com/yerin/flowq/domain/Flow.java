package com.yerin.flowq.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * 큐 밖에서 관리되는 플로우 레코드. 마이그레이션은 schedule 만 채운다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "flow", indexes = {
        @Index(name = "idx_flow_published_version", columnList = "published_version_id")
})
@DynamicUpdate
public class Flow {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "project_id", nullable = false, length = 64)
    private String projectId;

    @Column(name = "published_version_id", length = 64)
    private String publishedVersionId;

    @Embedded
    private FlowSchedule schedule;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() { updatedAt = Instant.now(); }
}
