package com.civicdesk.query.repository;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import com.civicdesk.query.store.QueryDocument;
import com.civicdesk.query.store.QueryField;

/**
 * Relational row of a query. Values are stored as written; validation happens
 * when the row is turned into a {@link QueryDocument} and mapped by the engine.
 */
@Table("queries")
public class QueryEntity {

    @Id
    private String id;

    @Column("reference_id")
    private String referenceId;

    @Column("account_number")
    private String accountNumber;

    @Column("customer_name")
    private String customerName;

    @Column("contact_number")
    private String contactNumber;

    private String description;

    @Column("query_type")
    private String queryType;

    @Column("submission_date")
    private OffsetDateTime submissionDate;

    private String status;

    @Column("assigned_to")
    private String assignedTo;

    @Column("assigned_to_name")
    private String assignedToName;

    @Column("assigned_by")
    private String assignedBy;

    @Column("assigned_at")
    private OffsetDateTime assignedAt;

    @Column("resolution_message")
    private String resolutionMessage;

    @Column("resolution_date")
    private OffsetDateTime resolutionDate;

    @Column("resolved_by")
    private String resolvedBy;

    @Column("last_updated")
    private OffsetDateTime lastUpdated;

    @Column("updated_by")
    private String updatedBy;

    /**
     * Incremented by every merge; rows inserted elsewhere start at 1.
     */
    private Long revision;

    public QueryEntity() {
        // default constructor required by Spring Data
    }

    public static QueryEntity submitted(String id, String referenceId, String customerName,
                                        String description, OffsetDateTime submissionDate) {
        QueryEntity entity = new QueryEntity();
        entity.setId(id);
        entity.setReferenceId(referenceId);
        entity.setCustomerName(customerName);
        entity.setDescription(description);
        entity.setSubmissionDate(submissionDate);
        entity.setStatus("Open");
        entity.setRevision(1L);
        return entity;
    }

    public QueryDocument toDocument() {
        Map<String, Object> fields = new LinkedHashMap<>();
        put(fields, QueryField.REFERENCE_ID, referenceId);
        put(fields, QueryField.ACCOUNT_NUMBER, accountNumber);
        put(fields, QueryField.CUSTOMER_NAME, customerName);
        put(fields, QueryField.CONTACT_NUMBER, contactNumber);
        put(fields, QueryField.DESCRIPTION, description);
        put(fields, QueryField.QUERY_TYPE, queryType);
        put(fields, QueryField.SUBMISSION_DATE, submissionDate);
        put(fields, QueryField.STATUS, status);
        put(fields, QueryField.ASSIGNED_TO, assignedTo);
        put(fields, QueryField.ASSIGNED_TO_NAME, assignedToName);
        put(fields, QueryField.ASSIGNED_BY, assignedBy);
        put(fields, QueryField.ASSIGNED_AT, assignedAt);
        put(fields, QueryField.RESOLUTION_MESSAGE, resolutionMessage);
        put(fields, QueryField.RESOLUTION_DATE, resolutionDate);
        put(fields, QueryField.RESOLVED_BY, resolvedBy);
        put(fields, QueryField.LAST_UPDATED, lastUpdated);
        put(fields, QueryField.UPDATED_BY, updatedBy);
        return new QueryDocument(id, fields, revision == null ? QueryDocument.UNVERSIONED : revision);
    }

    private static void put(Map<String, Object> fields, QueryField field, Object value) {
        if (value != null) {
            fields.put(field.key(), value);
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public void setReferenceId(String referenceId) {
        this.referenceId = referenceId;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public void setAccountNumber(String accountNumber) {
        this.accountNumber = accountNumber;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
    }

    public String getContactNumber() {
        return contactNumber;
    }

    public void setContactNumber(String contactNumber) {
        this.contactNumber = contactNumber;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getQueryType() {
        return queryType;
    }

    public void setQueryType(String queryType) {
        this.queryType = queryType;
    }

    public OffsetDateTime getSubmissionDate() {
        return submissionDate;
    }

    public void setSubmissionDate(OffsetDateTime submissionDate) {
        this.submissionDate = submissionDate;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public void setAssignedTo(String assignedTo) {
        this.assignedTo = assignedTo;
    }

    public String getAssignedToName() {
        return assignedToName;
    }

    public void setAssignedToName(String assignedToName) {
        this.assignedToName = assignedToName;
    }

    public String getAssignedBy() {
        return assignedBy;
    }

    public void setAssignedBy(String assignedBy) {
        this.assignedBy = assignedBy;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public void setAssignedAt(OffsetDateTime assignedAt) {
        this.assignedAt = assignedAt;
    }

    public String getResolutionMessage() {
        return resolutionMessage;
    }

    public void setResolutionMessage(String resolutionMessage) {
        this.resolutionMessage = resolutionMessage;
    }

    public OffsetDateTime getResolutionDate() {
        return resolutionDate;
    }

    public void setResolutionDate(OffsetDateTime resolutionDate) {
        this.resolutionDate = resolutionDate;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public void setResolvedBy(String resolvedBy) {
        this.resolvedBy = resolvedBy;
    }

    public OffsetDateTime getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(OffsetDateTime lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public void setUpdatedBy(String updatedBy) {
        this.updatedBy = updatedBy;
    }

    public Long getRevision() {
        return revision;
    }

    public void setRevision(Long revision) {
        this.revision = revision;
    }
}
