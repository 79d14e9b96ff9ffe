package com.hcltech.rebac.graph;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.rebac.graph.TestGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class MemoryRelationGraphTest {

    private final RelationGraph graph = new MemoryRelationGraph();

    @Nested
    class Scenarios {
        @Test
        void directGrant() {
            graph.grant(ALICE, FOO_READ);

            assertTrue(graph.exists(ALICE, FOO_READ));
            assertTrue(graph.isPermitted(ALICE, FOO_READ));
        }

        @Test
        void chainedGrantIsPermittedButDoesNotExist() {
            graph.grant(ALICE, FOO_READ);
            graph.grant(FOO_READ, BAR_READ);

            assertTrue(graph.isPermitted(ALICE, BAR_READ));
            assertFalse(graph.exists(ALICE, BAR_READ));
        }

        @Test
        void wildcardGrant() {
            graph.grant(ALICE, ANY_FILE_READ);

            assertTrue(graph.isPermitted(ALICE, RANDOM_READ));
        }

        @Test
        void revokeLeavesWildcardPermissionInPlace() {
            graph.grant(ALICE, FOO_READ);
            graph.grant(ALICE, ANY_FILE_READ);
            graph.revoke(ALICE, FOO_READ);

            assertFalse(graph.exists(ALICE, FOO_READ));
            assertTrue(graph.isPermitted(ALICE, FOO_READ));
        }

        @Test
        void expandAfterDirectGrant() {
            graph.grant(ALICE, FOO_READ);

            assertEquals(List.of(expanded(ALICE, FOO_READ)), graph.expand(FOO_READ));
        }
    }

    @Test
    void grantAndRevokeAreIdempotent() {
        assertTrue(graph.grant(ALICE, FOO_READ));
        assertFalse(graph.grant(ALICE, FOO_READ));
        assertEquals(1, graph.edgeCount());
        assertEquals(2, graph.nodeCount());

        assertTrue(graph.revoke(ALICE, FOO_READ));
        assertFalse(graph.revoke(ALICE, FOO_READ));
        assertEquals(0, graph.edgeCount());
        assertFalse(graph.exists(ALICE, FOO_READ));
    }

    @Test
    void starInsideAnIdIsNotAWildcard() {
        PermissionSet report = new PermissionSet("files", "report*2024.pdf", "read");

        assertTrue(graph.grant(ALICE, report));

        assertTrue(graph.exists(ALICE, report));
        assertTrue(graph.isPermitted(ALICE, report));
        assertFalse(graph.isPermitted(ALICE, FOO_READ));
    }

    @Test
    void grantRevokeSequence() {
        graph.grant(ALICE, FOO_READ);
        graph.grant(BOB, BAR_READ);

        assertTrue(graph.isPermitted(ALICE, FOO_READ));
        assertFalse(graph.isPermitted(ALICE, BAR_READ));
        assertFalse(graph.isPermitted(BOB, FOO_READ));
        assertTrue(graph.isPermitted(BOB, BAR_READ));
        assertFalse(graph.isPermitted(CHARLIE, FOO_READ));

        graph.revoke(ALICE, FOO_READ);
        graph.revoke(ALICE, BAR_READ);
        assertFalse(graph.isPermitted(ALICE, FOO_READ));
        assertFalse(graph.isPermitted(ALICE, BAR_READ));

        graph.grant(CHARLIE, FOO_READ);
        graph.grant(CHARLIE, BAR_READ);
        assertTrue(graph.isPermitted(CHARLIE, FOO_READ));
        assertTrue(graph.isPermitted(CHARLIE, BAR_READ));
    }

    @Test
    void depthLimitedCheck() {
        graph.grant(ALICE, ADMINS);
        graph.grant(ADMINS, STAFF);

        assertFalse(graph.isPermitted(ALICE, STAFF, 1));
        assertTrue(graph.isPermitted(ALICE, STAFF, 2));
    }

    @Test
    void separateGraphsDoNotInterfere() {
        RelationGraph other = new MemoryRelationGraph();
        graph.grant(ALICE, FOO_READ);

        assertFalse(other.exists(ALICE, FOO_READ));
        assertEquals(0, other.edgeCount());
    }

    @Nested
    class InvalidArguments {
        @Test
        void emptyFieldsAreRejectedBeforeTouchingTheGraph() {
            var ex = assertThrows(InvalidArgumentException.class,
                    () -> graph.grant(new Entity("users", ""), FOO_READ));

            assertEquals(List.of("src.id must be set"), ex.errors());
            assertEquals(0, graph.edgeCount());
        }

        @Test
        void queriesValidateToo() {
            PermissionSet bad = new PermissionSet("files", "foo.pdf", "");
            assertThrows(InvalidArgumentException.class, () -> graph.exists(ALICE, bad));
            assertThrows(InvalidArgumentException.class, () -> graph.isPermitted(ALICE, bad));
            assertThrows(InvalidArgumentException.class, () -> graph.revoke(ALICE, bad));
            assertThrows(InvalidArgumentException.class, () -> graph.expand(bad));
        }

        @Test
        void nullsAreRejected() {
            assertThrows(NullPointerException.class, () -> graph.grant(null, FOO_READ));
            assertThrows(NullPointerException.class, () -> graph.grant(ALICE, null));
            assertThrows(NullPointerException.class, () -> graph.expand(null));
        }
    }
}
