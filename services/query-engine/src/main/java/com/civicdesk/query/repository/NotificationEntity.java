package com.civicdesk.query.repository;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import com.civicdesk.query.domain.AssignmentNotificationEvent;

/**
 * In-app notification row read by the portal's notification bell.
 */
@Table("notifications")
public class NotificationEntity {

    @Id
    private Long id;

    private String type;

    @Column("recipient_id")
    private String recipientId;

    @Column("sender_id")
    private String senderId;

    @Column("sender_name")
    private String senderName;

    @Column("query_id")
    private String queryId;

    @Column("query_title")
    private String queryTitle;

    @Column("query_description")
    private String queryDescription;

    @Column("is_read")
    private boolean read;

    @Column("created_at")
    private OffsetDateTime createdAt;

    public NotificationEntity() {
        // default constructor required by Spring Data
    }

    public static NotificationEntity from(AssignmentNotificationEvent event) {
        NotificationEntity entity = new NotificationEntity();
        entity.setType(event.type());
        entity.setRecipientId(event.recipientId());
        entity.setSenderId(event.senderId());
        entity.setSenderName(event.senderName());
        entity.setQueryId(event.queryId());
        entity.setQueryTitle(event.queryTitle());
        entity.setQueryDescription(event.queryDescription());
        entity.setRead(event.read());
        entity.setCreatedAt(OffsetDateTime.ofInstant(event.createdAt(), ZoneOffset.UTC));
        return entity;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getRecipientId() {
        return recipientId;
    }

    public void setRecipientId(String recipientId) {
        this.recipientId = recipientId;
    }

    public String getSenderId() {
        return senderId;
    }

    public void setSenderId(String senderId) {
        this.senderId = senderId;
    }

    public String getSenderName() {
        return senderName;
    }

    public void setSenderName(String senderName) {
        this.senderName = senderName;
    }

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public String getQueryTitle() {
        return queryTitle;
    }

    public void setQueryTitle(String queryTitle) {
        this.queryTitle = queryTitle;
    }

    public String getQueryDescription() {
        return queryDescription;
    }

    public void setQueryDescription(String queryDescription) {
        this.queryDescription = queryDescription;
    }

    public boolean isRead() {
        return read;
    }

    public void setRead(boolean read) {
        this.read = read;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
