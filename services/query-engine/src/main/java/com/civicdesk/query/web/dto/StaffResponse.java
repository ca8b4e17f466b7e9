package com.civicdesk.query.web.dto;

/**
 * Entry of the assignee picker.
 */
public record StaffResponse(String id, String name, String email, String department, String role) {
}
