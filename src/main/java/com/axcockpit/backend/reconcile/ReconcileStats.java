package com.axcockpit.backend.reconcile;

public record ReconcileStats(int projectsCreated,
                             int projectsUpdated,
                             int strategiesCreated,
                             int eventsCreated,
                             int eventsUpdated) {}
