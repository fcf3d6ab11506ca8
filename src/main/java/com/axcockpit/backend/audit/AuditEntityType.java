package com.axcockpit.backend.audit;

public enum AuditEntityType { PROJECT, STRATEGY, MONTHLY_EVENT, SNAPSHOT }
