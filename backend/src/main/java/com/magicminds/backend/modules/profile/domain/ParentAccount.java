package com.magicminds.backend.modules.profile.domain;


import com.magicminds.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;


@Entity
@Table(name = "parent_profiles")
public class ParentAccount extends AbstractTimestampedEntity {

    @Column(name = "auth0_user_id", nullable = false, unique = true, updatable = false)
    private String auth0UserId;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "name", length = 120)
    private String name;

    protected ParentAccount() {
    }

    public ParentAccount(String auth0UserId, String email, String name) {
        this.auth0UserId = auth0UserId;
        this.email = email;
        this.name = name;
    }

    public String getAuth0UserId() {
        return auth0UserId;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
