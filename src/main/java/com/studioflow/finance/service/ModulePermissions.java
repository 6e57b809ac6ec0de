package com.studioflow.finance.service;

import com.studioflow.finance.model.AppModule;
import com.studioflow.finance.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable role to module lookup, resolved once at startup.
 *
 * <p>Resolution for a role: its configured override, then its base role's override,
 * then its built-in default, then its base role's default. Roles that resolve to
 * nothing get no modules. Viewers never see documents.
 */
public final class ModulePermissions {

    private static final Map<Role, Set<AppModule>> DEFAULTS = new EnumMap<>(Role.class);
    private static final Map<Role, Role> ALIASES = new EnumMap<>(Role.class);

    static {
        DEFAULTS.put(Role.ADMIN, EnumSet.allOf(AppModule.class));
        DEFAULTS.put(Role.MANAGING_DIRECTOR, EnumSet.of(AppModule.CLIENTS, AppModule.LEADS, AppModule.PROJECTS,
                AppModule.SITE_VISITS, AppModule.DOCS, AppModule.TEAM, AppModule.FINANCE));
        DEFAULTS.put(Role.ARCHITECT, EnumSet.of(AppModule.CLIENTS, AppModule.LEADS, AppModule.PROJECTS,
                AppModule.SITE_VISITS, AppModule.DOCS, AppModule.TEAM));
        DEFAULTS.put(Role.SITE_ENGINEER, EnumSet.of(AppModule.PROJECTS, AppModule.SITE_VISITS));
        DEFAULTS.put(Role.FINANCE, EnumSet.of(AppModule.CLIENTS, AppModule.PROJECTS, AppModule.DOCS,
                AppModule.FINANCE, AppModule.INVOICES));
        DEFAULTS.put(Role.ACCOUNTANT, EnumSet.of(AppModule.CLIENTS, AppModule.PROJECTS, AppModule.DOCS,
                AppModule.FINANCE, AppModule.INVOICES));
        DEFAULTS.put(Role.PROJECT_MANAGER, EnumSet.of(AppModule.CLIENTS, AppModule.LEADS, AppModule.PROJECTS,
                AppModule.SITE_VISITS, AppModule.DOCS, AppModule.TEAM));
        DEFAULTS.put(Role.DESIGNER, EnumSet.of(AppModule.PROJECTS, AppModule.DOCS));
        DEFAULTS.put(Role.DRAUGHTSMAN, EnumSet.of(AppModule.PROJECTS, AppModule.DOCS));
        DEFAULTS.put(Role.VIEWER, EnumSet.of(AppModule.CLIENTS, AppModule.LEADS, AppModule.PROJECTS,
                AppModule.SITE_VISITS));

        ALIASES.put(Role.SENIOR_ARCHITECT, Role.ARCHITECT);
        ALIASES.put(Role.JUNIOR_ARCHITECT, Role.ARCHITECT);
        ALIASES.put(Role.SENIOR_CIVIL_ENGINEER, Role.SITE_ENGINEER);
        ALIASES.put(Role.JUNIOR_CIVIL_ENGINEER, Role.SITE_ENGINEER);
        ALIASES.put(Role.SENIOR_INTERIOR_DESIGNER, Role.DESIGNER);
        ALIASES.put(Role.JUNIOR_INTERIOR_DESIGNER, Role.DESIGNER);
        ALIASES.put(Role.VISUALISER_3D, Role.DESIGNER);
        ALIASES.put(Role.ACCOUNTANT, Role.FINANCE);
    }

    private final Map<Role, Set<AppModule>> table;

    private ModulePermissions(Map<Role, Set<AppModule>> table) {
        this.table = table;
    }

    public static ModulePermissions defaults() {
        return withOverrides(Map.of());
    }

    public static ModulePermissions withOverrides(Map<Role, Set<AppModule>> overrides) {
        Map<Role, Set<AppModule>> resolved = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            Set<AppModule> modules = EnumSet.noneOf(AppModule.class);
            Set<AppModule> found = lookup(role, overrides);
            if (found != null) {
                modules.addAll(found);
            }
            if (role == Role.VIEWER) {
                modules.remove(AppModule.DOCS);
            }
            resolved.put(role, Collections.unmodifiableSet(modules));
        }
        return new ModulePermissions(Collections.unmodifiableMap(resolved));
    }

    private static Set<AppModule> lookup(Role role, Map<Role, Set<AppModule>> overrides) {
        Role base = ALIASES.get(role);
        if (overrides.containsKey(role))
            return overrides.get(role);
        if (base != null && overrides.containsKey(base))
            return overrides.get(base);
        if (DEFAULTS.containsKey(role))
            return DEFAULTS.get(role);
        return base != null ? DEFAULTS.get(base) : null;
    }

    public boolean isAllowed(Role role, AppModule module) {
        if (role == null || module == null)
            return false;
        return table.get(role).contains(module);
    }

    public Set<AppModule> allowedModules(Role role) {
        return role == null ? Set.of() : table.get(role);
    }

    public int roleCount() {
        return table.size();
    }
}
