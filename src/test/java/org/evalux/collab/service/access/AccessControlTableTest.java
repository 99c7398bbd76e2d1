package org.evalux.collab.service.access;

import org.evalux.collab.model.AccessRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class AccessControlTableTest {

    UUID doc;
    UUID owner;
    AccessControlTable acl;

    @BeforeEach
    void init() {
        doc = UUID.randomUUID();
        owner = UUID.randomUUID();
        acl = AccessControlTable.ownedBy(doc, owner);
    }

    // --------------------------------------------------------------
    // AccessRole.satisfies()
    // --------------------------------------------------------------
    @Test
    void satisfies_ownerCouvreTout() {
        assertThat(AccessRole.OWNER.satisfies(AccessRole.OWNER)).isTrue();
        assertThat(AccessRole.OWNER.satisfies(AccessRole.EDITOR)).isTrue();
        assertThat(AccessRole.OWNER.satisfies(AccessRole.VIEWER)).isTrue();
    }

    @Test
    void satisfies_editorCouvreEditorEtViewer() {
        assertThat(AccessRole.EDITOR.satisfies(AccessRole.OWNER)).isFalse();
        assertThat(AccessRole.EDITOR.satisfies(AccessRole.EDITOR)).isTrue();
        assertThat(AccessRole.EDITOR.satisfies(AccessRole.VIEWER)).isTrue();
    }

    @Test
    void satisfies_viewerSeulementViewer() {
        assertThat(AccessRole.VIEWER.satisfies(AccessRole.OWNER)).isFalse();
        assertThat(AccessRole.VIEWER.satisfies(AccessRole.EDITOR)).isFalse();
        assertThat(AccessRole.VIEWER.satisfies(AccessRole.VIEWER)).isTrue();
    }

    // --------------------------------------------------------------
    // ownedBy() / grant() / allows()
    // --------------------------------------------------------------
    @Test
    void ownedBy_createurSeulEnOwner() {
        assertThat(acl.getDocumentId()).isEqualTo(doc);
        assertThat(acl.entries()).containsExactly(entry(owner, AccessRole.OWNER));
    }

    @Test
    void allows_utilisateurInconnu_false() {
        assertThat(acl.allows(UUID.randomUUID(), AccessRole.VIEWER)).isFalse();
        assertThat(acl.roleOf(UUID.randomUUID())).isEmpty();
    }

    @Test
    void grant_remplaceLeRoleExistant() {
        UUID bob = UUID.randomUUID();
        acl.grant(bob, AccessRole.EDITOR);
        acl.grant(bob, AccessRole.VIEWER);

        assertThat(acl.roleOf(bob)).contains(AccessRole.VIEWER);
        assertThat(acl.allows(bob, AccessRole.EDITOR)).isFalse();
        assertThat(acl.entries()).hasSize(2);
    }

    @Test
    void grant_roleNull_exception() {
        assertThatThrownBy(() -> acl.grant(UUID.randomUUID(), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("role");
    }

    @Test
    void entries_copieNonModifiable() {
        assertThatThrownBy(() -> acl.entries().put(UUID.randomUUID(), AccessRole.OWNER))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
