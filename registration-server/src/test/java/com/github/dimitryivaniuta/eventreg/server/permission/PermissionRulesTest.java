package com.github.dimitryivaniuta.eventreg.server.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import com.github.dimitryivaniuta.eventreg.common.query.QueryRenderer;
import com.github.dimitryivaniuta.eventreg.common.query.RenderedQuery;
import com.github.dimitryivaniuta.eventreg.server.event.EventField;
import java.util.List;
import org.junit.jupiter.api.Test;

class PermissionRulesTest {

    private static final String GRANT = "(p.user_id = ? AND p.role = ?)";
    private static final String ORG_GRANT = "(p.user_id = ? AND p.role = ? AND p.organization_id = ?)";
    private static final String EVENT_GRANT = "(p.user_id = ? AND p.role = ? AND p.event_id = ?)";

    @Test
    void serverCapabilityOnlyAcceptsServerAdmins() {
        RenderedQuery r = QueryRenderer.render(
                PermissionRules.authorize("u1", Capability.server(Access.ADMIN), PermissionField.GRANTS));

        assertThat(r.expression()).isEqualTo("(" + GRANT + ")");
        assertThat(r.bindValues()).containsExactly("u1", "SERVER_ADMIN");
    }

    @Test
    void organizationReadAddsViewers() {
        RenderedQuery r = QueryRenderer.render(PermissionRules.authorize("u1",
                Capability.organization(Access.READ, "org-1"), PermissionField.GRANTS));

        assertThat(r.expression()).isEqualTo("(" + GRANT + " OR " + ORG_GRANT + " OR " + ORG_GRANT + ")");
        assertThat(r.bindValues()).containsExactly(
                "u1", "SERVER_ADMIN",
                "u1", "ORGANIZATION_ADMIN", "org-1",
                "u1", "ORGANIZATION_VIEWER", "org-1");
    }

    @Test
    void organizationEditIsAdminOnly() {
        RenderedQuery r = QueryRenderer.render(PermissionRules.authorize("u1",
                Capability.organization(Access.EDIT, "org-1"), PermissionField.GRANTS));

        assertThat(r.bindValues()).doesNotContain("ORGANIZATION_VIEWER")
                .contains("ORGANIZATION_ADMIN");
    }

    @Test
    void eventAdminIncludesParentOrganizationAdmin() {
        RenderedQuery r = QueryRenderer.render(PermissionRules.authorize("u1",
                Capability.event(Access.ADMIN, "org-1", "ev-1"), PermissionField.GRANTS));

        assertThat(r.expression()).isEqualTo("(" + GRANT + " OR " + EVENT_GRANT + " OR " + ORG_GRANT + ")");
        assertThat(r.bindValues()).containsExactly(
                "u1", "SERVER_ADMIN",
                "u1", "EVENT_ADMIN", "ev-1",
                "u1", "ORGANIZATION_ADMIN", "org-1");
    }

    @Test
    void eventEditAddsEditorsButNotViewers() {
        List<Object> binds = QueryRenderer.render(PermissionRules.authorize("u1",
                Capability.event(Access.EDIT, "org-1", "ev-1"), PermissionField.GRANTS)).bindValues();

        assertThat(binds).contains("EVENT_EDITOR").doesNotContain("EVENT_VIEWER", "ORGANIZATION_VIEWER");
    }

    @Test
    void eventReadAcceptsEveryEventRoleAndOrganizationViewers() {
        List<Object> binds = QueryRenderer.render(PermissionRules.authorize("u1",
                Capability.event(Access.READ, "org-1", "ev-1"), PermissionField.GRANTS)).bindValues();

        assertThat(binds).contains("SERVER_ADMIN", "EVENT_ADMIN", "EVENT_EDITOR", "EVENT_VIEWER",
                "ORGANIZATION_ADMIN", "ORGANIZATION_VIEWER");
    }

    @Test
    void rowScopedCapabilityOmitsResourceLeavesAndUsesEntityColumns() {
        RenderedQuery r = QueryRenderer.render(PermissionRules.authorize("u1",
                Capability.rowScoped(ResourceType.EVENT, Access.READ), EventField.GRANTS));

        assertThat(r.expression()).doesNotContain("p.event_id", "p.organization_id");
        assertThat(r.bindValues()).hasSize(12);
    }

    @Test
    void subjectIsBoundNeverInlined() {
        String hostile = "x' OR '1'='1";
        RenderedQuery r = QueryRenderer.render(
                PermissionRules.authorize(hostile, Capability.server(Access.READ), PermissionField.GRANTS));

        assertThat(r.expression()).doesNotContain(hostile);
        assertThat(r.bindValues()).contains(hostile);
    }

    @Test
    void roleRequiresResourceForScopedVariants() {
        assertThatThrownBy(() -> Role.of(RoleType.EVENT_VIEWER, " "))
                .isInstanceOf(ValidationException.class)
                .hasMessage("eventId cannot be empty");
        assertThat(Role.of(RoleType.SERVER_ADMIN, "ignored").resourceId()).isNull();
        assertThat(Role.of(RoleType.ORGANIZATION_ADMIN, "o1").organizationId()).isEqualTo("o1");
    }

    @Test
    void permissionDtoRejectsUnknownRole() {
        assertThatThrownBy(() -> new PermissionDto(null, "u1", "OWNER", null, null).toPermission())
                .isInstanceOf(ValidationException.class)
                .hasMessage("role contains invalid enum value");
    }
}
