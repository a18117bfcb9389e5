package com.demo.degree.service;

/**
 * Published after an audit entry has been appended. {@code entry} is either a
 * {@link com.demo.degree.model.VerificationEvent} or a {@link com.demo.degree.model.RevocationEvent}.
 */
public record AuditEventRecorded(String degreeId, Object entry) {}
