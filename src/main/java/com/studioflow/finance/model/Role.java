package com.studioflow.finance.model;

public enum Role {
    ADMIN,
    ARCHITECT,
    SENIOR_ARCHITECT,
    JUNIOR_ARCHITECT,
    MANAGING_DIRECTOR,
    SITE_ENGINEER,
    SENIOR_CIVIL_ENGINEER,
    JUNIOR_CIVIL_ENGINEER,
    FINANCE,
    ACCOUNTANT,
    PROJECT_MANAGER,
    DESIGNER,
    SENIOR_INTERIOR_DESIGNER,
    JUNIOR_INTERIOR_DESIGNER,
    DRAUGHTSMAN,
    VISUALISER_3D,
    QS,
    PROCUREMENT,
    CLIENT_LIAISON,
    INTERN,
    VIEWER
}
