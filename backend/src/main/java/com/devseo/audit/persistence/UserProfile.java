package com.devseo.audit.persistence;

public record UserProfile(String userId, int credits, int totalAudits) {
}
