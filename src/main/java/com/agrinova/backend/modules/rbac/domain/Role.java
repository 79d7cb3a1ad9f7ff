package com.agrinova.backend.modules.rbac.domain;

import java.util.UUID;

import com.agrinova.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Operational role such as {@code MANDOR} or {@code COMPANY_ADMIN}.
 * System roles are seeded and only a super admin changes their baselines. Custom roles are managed by
 * administrators whose level is above the role's.
 */
@Entity
@Table(name = "role")
public class Role extends AbstractTimestampedEntity {

    public static final String SUPER_ADMIN = "SUPER_ADMIN";
    public static final int HIGHEST_LEVEL = 1;
    public static final int LOWEST_LEVEL = 99;
    public static final int DEFAULT_LEVEL = 10;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 50)
    private String name;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "is_system", nullable = false)
    private boolean system;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "no_access", nullable = false)
    private boolean noAccess;

    @Column(name = "level", nullable = false)
    private int level = DEFAULT_LEVEL;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isSystem() {
        return system;
    }

    public void setSystem(boolean system) {
        this.system = system;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isNoAccess() {
        return noAccess;
    }

    public void setNoAccess(boolean noAccess) {
        this.noAccess = noAccess;
    }

    /**
     * Hierarchy level, {@value #HIGHEST_LEVEL} being the highest authority.
     */
    public int getLevel() {
        return level;
    }

    public void setLevel(int level) {
        this.level = level;
    }

    public boolean isSuperAdmin() {
        return SUPER_ADMIN.equals(name);
    }
}
