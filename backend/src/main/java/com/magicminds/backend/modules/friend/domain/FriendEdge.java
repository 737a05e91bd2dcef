package com.magicminds.backend.modules.friend.domain;

import java.util.UUID;

import com.magicminds.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;


/**
 * Friendship between two children. There is at most one edge per unordered pair; the database enforces it
 * with a unique index over {@code (least(requester, addressee), greatest(requester, addressee))}.
 */
@Entity
@Table(name = "friends")
public class FriendEdge extends AbstractTimestampedEntity {

    @Column(name = "requester_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID requesterId;

    @Column(name = "addressee_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID addresseeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private FriendEdgeStatus status = FriendEdgeStatus.PENDING;

    protected FriendEdge() {
    }

    public FriendEdge(UUID requesterId, UUID addresseeId) {
        if (requesterId.equals(addresseeId)) {
            throw new IllegalArgumentException("A child cannot befriend itself");
        }
        this.requesterId = requesterId;
        this.addresseeId = addresseeId;
    }

    public UUID getRequesterId() {
        return requesterId;
    }

    public UUID getAddresseeId() {
        return addresseeId;
    }

    public FriendEdgeStatus getStatus() {
        return status;
    }

    public boolean isPending() {
        return status == FriendEdgeStatus.PENDING;
    }

    public void accept() {
        if (!isPending()) {
            throw new IllegalStateException("Only pending requests can be accepted");
        }
        this.status = FriendEdgeStatus.ACCEPTED;
    }

    public boolean involves(UUID childId) {
        return requesterId.equals(childId) || addresseeId.equals(childId);
    }
}
