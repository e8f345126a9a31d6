package com.forecastplatform.common.tree;

import com.forecastplatform.common.exception.DuplicateNodeIdException;
import com.forecastplatform.common.exception.InvariantViolationException;
import com.forecastplatform.common.exception.NodeNotFoundException;
import com.forecastplatform.common.model.NodeView;
import com.forecastplatform.common.model.ProcessingStatus;
import com.forecastplatform.common.model.TreeSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeStoreTest {

    private TreeStore store;
    private ScenarioNode root;

    @BeforeEach
    void setUp() {
        store = TreeStore.seeded("Federal Reserve announces emergency rate cut");
        root  = store.root();
    }

    private ScenarioNode child(ScenarioNode parent, String event, double p) {
        return ScenarioNode.child(parent, event, p, 0, "Justification for " + event, List.of());
    }

    @Nested
    @DisplayName("seeding")
    class Seeding {

        @Test
        @DisplayName("root has depth 0, probability 1.0, no parent, status PENDING")
        void rootShape() {
            assertEquals(0, root.depth());
            assertEquals(1.0, root.probability());
            assertNull(root.parentId());
            assertEquals(ProcessingStatus.PENDING, root.status());
            assertEquals(1, store.size());
            assertEquals(root.id(), store.rootId());
        }

        @Test
        @DisplayName("a non-root node cannot seed a store")
        void nonRootRejected() {
            ScenarioNode nonRoot = child(root, "Markets rally on the news", 1.0);
            assertThrows(IllegalArgumentException.class, () -> new TreeStore(nonRoot));
        }
    }

    @Nested
    @DisplayName("register() / get()")
    class RegisterAndGet {

        @Test
        @DisplayName("duplicate id → DuplicateNodeIdException")
        void duplicate() {
            assertThrows(DuplicateNodeIdException.class, () -> store.register(root));
        }

        @Test
        @DisplayName("unknown id → NodeNotFoundException carrying the id")
        void notFound() {
            NodeNotFoundException ex = assertThrows(NodeNotFoundException.class, () -> store.get("missing"));
            assertEquals("missing", ex.getNodeId());
            assertTrue(store.find("missing").isEmpty());
            assertFalse(store.contains("missing"));
        }

        @Test
        @DisplayName("null id → NodeNotFoundException, not NPE")
        void nullId() {
            assertThrows(NodeNotFoundException.class, () -> store.get(null));
        }
    }

    @Nested
    @DisplayName("attachChildren()")
    class AttachChildren {

        @Test
        @DisplayName("commits children in order and completes the parent")
        void happyPath() {
            root.markProcessing();
            ScenarioNode a = child(root, "Equities rally sharply", 0.6);
            ScenarioNode b = child(root, "Bond yields collapse", 0.4);

            store.attachChildren(root.id(), List.of(a, b));

            assertEquals(ProcessingStatus.COMPLETED, root.status());
            assertEquals(List.of(a.id(), b.id()), root.childIds());
            assertEquals(List.of(a, b), store.children(root.id()));
            assertEquals(root, store.parentOf(a.id()).orElseThrow());
            assertTrue(store.parentOf(root.id()).isEmpty());
            assertEquals(3, store.size());
        }

        @Test
        @DisplayName("sibling sum off by more than tolerance → InvariantViolationException, nothing committed")
        void sumMismatch() {
            root.markProcessing();
            ScenarioNode a = child(root, "Equities rally sharply", 0.6);
            ScenarioNode b = child(root, "Bond yields collapse", 0.6);

            assertThrows(InvariantViolationException.class, () -> store.attachChildren(root.id(), List.of(a, b)));
            assertEquals(1, store.size());
            assertFalse(root.hasChildren());
            assertEquals(ProcessingStatus.PROCESSING, root.status());
        }

        @Test
        @DisplayName("child naming a different parent → InvariantViolationException")
        void wrongParent() {
            root.markProcessing();
            ScenarioNode a = child(root, "Equities rally sharply", 1.0);
            store.attachChildren(root.id(), List.of(a));
            a.markProcessing();
            ScenarioNode stray = child(root, "Bond yields collapse", 1.0);

            assertThrows(InvariantViolationException.class, () -> store.attachChildren(a.id(), List.of(stray)));
        }

        @Test
        @DisplayName("empty sibling set → InvariantViolationException")
        void emptySet() {
            root.markProcessing();
            assertThrows(InvariantViolationException.class, () -> store.attachChildren(root.id(), List.of()));
        }

        @Test
        @DisplayName("second attach to a completed parent → IllegalStateException")
        void alreadyCompleted() {
            root.markProcessing();
            store.attachChildren(root.id(), List.of(child(root, "Equities rally sharply", 1.0)));

            assertThrows(IllegalStateException.class,
                () -> store.attachChildren(root.id(), List.of(child(root, "Bond yields collapse", 1.0))));
        }

        @Test
        @DisplayName("failed parent rejects children")
        void failedParent() {
            root.markProcessing();
            root.markFailed();
            assertThrows(IllegalStateException.class,
                () -> store.attachChildren(root.id(), List.of(child(root, "Equities rally sharply", 1.0))));
        }

        @Test
        @DisplayName("unknown parent → NodeNotFoundException")
        void unknownParent() {
            assertThrows(NodeNotFoundException.class,
                () -> store.attachChildren("nope", List.of(child(root, "Equities rally sharply", 1.0))));
        }
    }

    @Nested
    @DisplayName("status transitions")
    class StatusTransitions {

        @Test
        @DisplayName("PENDING → PROCESSING → FAILED is allowed")
        void forward() {
            root.markProcessing();
            assertEquals(ProcessingStatus.PROCESSING, root.status());
            root.markFailed();
            assertEquals(ProcessingStatus.FAILED, root.status());
        }

        @Test
        @DisplayName("claiming a node twice → IllegalStateException")
        void doubleClaim() {
            root.markProcessing();
            assertThrows(IllegalStateException.class, root::markProcessing);
        }

        @Test
        @DisplayName("FAILED never moves again")
        void failedIsTerminal() {
            root.markProcessing();
            root.markFailed();
            assertThrows(IllegalStateException.class, root::markProcessing);
            assertThrows(IllegalStateException.class, root::markFailed);
        }
    }

    @Nested
    @DisplayName("snapshot()")
    class Snapshot {

        @Test
        @DisplayName("nodes ordered by depth then insertion; children referenced by id")
        void ordering() {
            TreeStore tree = TreeFixtures.fullTree("Oil supply shock in the Gulf", 2, 0.5, 0.5);

            TreeSnapshot snapshot = tree.snapshot();

            assertEquals(tree.rootId(), snapshot.rootId());
            assertEquals(7, snapshot.nodes().size());
            int previousDepth = 0;
            for (NodeView view : snapshot.nodes()) {
                assertTrue(view.depth() >= previousDepth);
                previousDepth = view.depth();
            }
            NodeView rootView = snapshot.nodes().get(0);
            assertEquals(List.of(snapshot.nodes().get(1).id(), snapshot.nodes().get(2).id()), rootView.childIds());
            assertNotNull(snapshot.capturedAt());
        }

        @Test
        @DisplayName("nodesAtDepth() returns exactly one layer")
        void layer() {
            TreeStore tree = TreeFixtures.fullTree("Oil supply shock in the Gulf", 2, 0.5, 0.3, 0.2);

            assertEquals(1, tree.nodesAtDepth(0).size());
            assertEquals(3, tree.nodesAtDepth(1).size());
            assertEquals(9, tree.nodesAtDepth(2).size());
            assertTrue(tree.nodesAtDepth(3).isEmpty());
        }

        @Test
        @DisplayName("nodes() stays ordered while another thread registers nodes")
        void orderingUnderConcurrentRegistration() throws InterruptedException {
            int count = 2_000;
            Thread writer = new Thread(() -> {
                for (int i = 0; i < count; i++) {
                    store.register(child(root, "Concurrent scenario " + i, 0.5));
                }
            });
            writer.start();

            List<ScenarioNode> listing = store.nodes();
            while (writer.isAlive()) {
                listing = store.nodes();
                assertInRegistrationOrder(listing);
            }
            writer.join();

            listing = store.nodes();
            assertEquals(count + 1, listing.size());
            assertInRegistrationOrder(listing);
        }

        private void assertInRegistrationOrder(List<ScenarioNode> listing) {
            assertSame(root, listing.get(0));
            for (int i = 1; i < listing.size(); i++) {
                assertEquals("Concurrent scenario " + (i - 1), listing.get(i).event());
            }
        }
    }
}
