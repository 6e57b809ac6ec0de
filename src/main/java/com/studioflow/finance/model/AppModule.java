package com.studioflow.finance.model;

public enum AppModule {
    CLIENTS, LEADS, PROJECTS, SITE_VISITS, FINANCE, INVOICES, DOCS, TEAM, USERS, SETTINGS
}
