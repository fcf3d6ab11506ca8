package com.axcockpit.backend.audit;

public enum ChangeKind { CREATE, UPDATE, DELETE }
