package com.openforge.identity.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Canonical audit columns shared by every identity table.
 *
 * - create_time  : set once on INSERT from the application Clock
 * - update_time  : refreshed on every UPDATE
 * - version      : JPA @Version; two writers flushing the same row
 *                  (e.g. racing code verifications) cannot both win.
 *                  Null until the first persist: Spring Data's save() treats
 *                  a null version as new and persists instead of merging.
 */
@Getter
@Setter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private LocalDateTime createTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private LocalDateTime updateTime;

    @Version
    @Column(nullable = false)
    private Integer version;
}
