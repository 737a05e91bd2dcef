package com.magicminds.backend.modules.profile.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.magicminds.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.DynamicUpdate;

/**
 * A child playing under a parent account.
 *
 * <p>{@code currentRoomId} is owned by the room lifecycle and only ever changes through the conditional
 * updates in {@code ChildProfileRepository}; dynamic updates keep profile edits from rewriting it. It is non-null exactly while the child holds a seat in a
 * waiting or playing room.</p>
 */
@Entity
@DynamicUpdate
@Table(name = "children_profiles")
public class ChildProfile extends AbstractTimestampedEntity {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "parent_id", nullable = false, updatable = false)
    private ParentAccount parent;

    @Column(name = "name", nullable = false, length = 80)
    private String name;

    @Column(name = "age_group", nullable = false, length = 32)
    private String ageGroup;

    @Column(name = "avatar")
    private String avatar;

    @Column(name = "voice_clone_enabled", nullable = false)
    private boolean voiceCloneEnabled;

    @Column(name = "voice_clone_url")
    private String voiceCloneUrl;

    @Column(name = "is_online", nullable = false)
    private boolean online;

    @Column(name = "last_seen_at")
    private OffsetDateTime lastSeenAt;

    @Column(name = "current_room_id", columnDefinition = "uuid")
    private UUID currentRoomId;

    protected ChildProfile() {
    }

    public ChildProfile(ParentAccount parent, String name, String ageGroup, String avatar) {
        this.parent = parent;
        this.name = name;
        this.ageGroup = ageGroup;
        this.avatar = avatar;
    }

    public ParentAccount getParent() {
        return parent;
    }

    public UUID getParentId() {
        return parent.getId();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAgeGroup() {
        return ageGroup;
    }

    public void setAgeGroup(String ageGroup) {
        this.ageGroup = ageGroup;
    }

    public String getAvatar() {
        return avatar;
    }

    public void setAvatar(String avatar) {
        this.avatar = avatar;
    }

    public boolean isVoiceCloneEnabled() {
        return voiceCloneEnabled;
    }

    public void setVoiceCloneEnabled(boolean voiceCloneEnabled) {
        this.voiceCloneEnabled = voiceCloneEnabled;
    }

    public String getVoiceCloneUrl() {
        return voiceCloneUrl;
    }

    public void setVoiceCloneUrl(String voiceCloneUrl) {
        this.voiceCloneUrl = voiceCloneUrl;
    }

    public boolean isOnline() {
        return online;
    }

    public void setOnline(boolean online) {
        this.online = online;
    }

    public OffsetDateTime getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(OffsetDateTime lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    public UUID getCurrentRoomId() {
        return currentRoomId;
    }

    public boolean isInRoom() {
        return currentRoomId != null;
    }
}
