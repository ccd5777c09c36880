package com.configline.backend.permission;

import com.configline.backend.project.ProjectRole;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PermissionPolicyTest {

    private static final ChangeSet VALUE_ONLY = new ChangeSet(true, false, false, false, false, false, false);
    private static final ChangeSet SCHEMA_ONLY = new ChangeSet(false, false, false, true, false, false, false);
    private static final ChangeSet MEMBERS_AND_VALUE = new ChangeSet(true, false, false, false, false, true, false);

    @Test
    void requiredAccess_isTheMaximumOverChangedFields() {
        assertEquals(ConfigAccess.NONE, PermissionPolicy.requiredAccess(ChangeSet.NONE));
        assertEquals(ConfigAccess.EDITOR, PermissionPolicy.requiredAccess(VALUE_ONLY));
        assertEquals(ConfigAccess.MAINTAINER, PermissionPolicy.requiredAccess(SCHEMA_ONLY));
        assertEquals(ConfigAccess.MAINTAINER, PermissionPolicy.requiredAccess(MEMBERS_AND_VALUE));
        assertEquals(ConfigAccess.MAINTAINER, PermissionPolicy.requiredAccess(ChangeSet.deletion()));
    }

    @Test
    void requiredForCommit_neverDropsBelowEditor() {
        assertEquals(ConfigAccess.EDITOR, PermissionPolicy.requiredForCommit(ChangeSet.NONE));
        assertEquals(ConfigAccess.MAINTAINER, PermissionPolicy.requiredForCommit(SCHEMA_ONLY));
    }

    @Test
    void accessOf_combinesProjectAndConfigRoles() {
        assertEquals(ConfigAccess.MAINTAINER, PermissionPolicy.accessOf(Optional.of(ProjectRole.ADMIN), Optional.empty()));
        assertEquals(ConfigAccess.MAINTAINER, PermissionPolicy.accessOf(Optional.of(ProjectRole.VIEWER), Optional.of(ConfigMemberRole.MAINTAINER)));
        assertEquals(ConfigAccess.EDITOR, PermissionPolicy.accessOf(Optional.of(ProjectRole.EDITOR), Optional.empty()));
        assertEquals(ConfigAccess.EDITOR, PermissionPolicy.accessOf(Optional.empty(), Optional.of(ConfigMemberRole.EDITOR)));
        assertEquals(ConfigAccess.NONE, PermissionPolicy.accessOf(Optional.of(ProjectRole.VIEWER), Optional.empty()));
    }

    @Test
    void canApply_editorCannotChangeSchema() {
        assertTrue(PermissionPolicy.canApply(ConfigAccess.EDITOR, VALUE_ONLY));
        assertFalse(PermissionPolicy.canApply(ConfigAccess.EDITOR, SCHEMA_ONLY));
        assertTrue(PermissionPolicy.canApply(ConfigAccess.MAINTAINER, SCHEMA_ONLY));
    }

    @Test
    void canApply_emptyCommitStillNeedsEditor() {
        assertFalse(PermissionPolicy.canApply(ConfigAccess.NONE, ChangeSet.NONE));
        assertTrue(PermissionPolicy.canApply(ConfigAccess.EDITOR, ChangeSet.NONE));
    }
}
