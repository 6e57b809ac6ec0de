package com.studioflow.finance.service;

import com.studioflow.finance.model.AppModule;
import com.studioflow.finance.model.Role;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModulePermissionsTest {

    @Test
    void defaults_ShouldGrantAdminEverything() {
        ModulePermissions permissions = ModulePermissions.defaults();

        assertEquals(EnumSet.allOf(AppModule.class), permissions.allowedModules(Role.ADMIN));
        assertEquals(Role.values().length, permissions.roleCount());
    }

    @Test
    void aliasedRoles_ShouldInheritBaseRoleModules() {
        ModulePermissions permissions = ModulePermissions.defaults();

        assertEquals(permissions.allowedModules(Role.ARCHITECT), permissions.allowedModules(Role.JUNIOR_ARCHITECT));
        assertEquals(permissions.allowedModules(Role.DESIGNER), permissions.allowedModules(Role.VISUALISER_3D));
        assertTrue(permissions.isAllowed(Role.SENIOR_CIVIL_ENGINEER, AppModule.SITE_VISITS));
        assertFalse(permissions.isAllowed(Role.SENIOR_CIVIL_ENGINEER, AppModule.FINANCE));
    }

    @Test
    void unmappedRole_ShouldGetNoModules() {
        ModulePermissions permissions = ModulePermissions.defaults();

        assertTrue(permissions.allowedModules(Role.INTERN).isEmpty());
        assertFalse(permissions.isAllowed(Role.INTERN, AppModule.PROJECTS));
        assertFalse(permissions.isAllowed(null, AppModule.PROJECTS));
    }

    @Test
    void baseRoleOverride_ShouldApplyToAliases() {
        ModulePermissions permissions = ModulePermissions.withOverrides(
                Map.of(Role.DESIGNER, EnumSet.of(AppModule.PROJECTS, AppModule.DOCS, AppModule.SITE_VISITS)));

        assertTrue(permissions.isAllowed(Role.JUNIOR_INTERIOR_DESIGNER, AppModule.SITE_VISITS));
        assertFalse(permissions.isAllowed(Role.ARCHITECT, AppModule.FINANCE));
    }

    @Test
    void viewer_ShouldNeverSeeDocs() {
        ModulePermissions permissions = ModulePermissions.withOverrides(
                Map.of(Role.VIEWER, EnumSet.of(AppModule.CLIENTS, AppModule.DOCS)));

        assertEquals(Set.of(AppModule.CLIENTS), permissions.allowedModules(Role.VIEWER));
    }

    @Test
    void resolvedTable_ShouldBeImmutable() {
        Set<AppModule> modules = ModulePermissions.defaults().allowedModules(Role.FINANCE);

        assertThrows(UnsupportedOperationException.class, () -> modules.add(AppModule.USERS));
    }
}
