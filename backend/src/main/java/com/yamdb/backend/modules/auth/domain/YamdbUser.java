package com.yamdb.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.yamdb.backend.global.jpa.AbstractTimestampedEntity;
import com.yamdb.backend.modules.policy.domain.Role;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Registered account. A pending confirmation code is stored only as a hash.
 */
@Entity
@Table(name = "app_user")
public class YamdbUser extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "username", nullable = false, unique = true, length = 150)
    private String username;

    @Column(name = "email", nullable = false, length = 254)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private Role role = Role.USER;

    @Column(name = "first_name", length = 150)
    private String firstName;

    @Column(name = "last_name", length = 150)
    private String lastName;

    @Column(name = "bio")
    private String bio;

    @Column(name = "confirmation_code_hash", length = 100)
    private String confirmationCodeHash;

    @Column(name = "confirmation_code_expires_at")
    private OffsetDateTime confirmationCodeExpiresAt;

    public UUID getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        if (role == null || !role.isAssignable()) {
            throw new IllegalArgumentException("Role cannot be stored on an account: " + role);
        }
        this.role = role;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getBio() {
        return bio;
    }

    public void setBio(String bio) {
        this.bio = bio;
    }

    public String getConfirmationCodeHash() {
        return confirmationCodeHash;
    }

    public OffsetDateTime getConfirmationCodeExpiresAt() {
        return confirmationCodeExpiresAt;
    }

    public boolean hasPendingCode() {
        return confirmationCodeHash != null;
    }

    public void assignConfirmationCode(String codeHash, OffsetDateTime expiresAt) {
        this.confirmationCodeHash = codeHash;
        this.confirmationCodeExpiresAt = expiresAt;
    }

    public void clearConfirmationCode() {
        this.confirmationCodeHash = null;
        this.confirmationCodeExpiresAt = null;
    }
}
