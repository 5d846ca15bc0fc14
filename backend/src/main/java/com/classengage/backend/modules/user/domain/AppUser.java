package com.classengage.backend.modules.user.domain;

import com.classengage.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A person known only by display name. Created on first sighting and never changed.
 */
@Entity
@Table(name = "users")
public class AppUser extends AbstractCreatedEntity {

    public static final int MAX_DISPLAY_NAME_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "display_name", nullable = false, unique = true, updatable = false,
            length = MAX_DISPLAY_NAME_LENGTH)
    private String displayName;

    protected AppUser() {
    }

    public AppUser(String displayName) {
        this.displayName = displayName;
    }

    public Long getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }
}
