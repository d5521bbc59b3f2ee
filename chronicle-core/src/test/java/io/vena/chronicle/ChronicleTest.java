package io.vena.chronicle;

import io.vena.chronicle.commands.Command;
import io.vena.chronicle.commands.CommandListener;
import io.vena.chronicle.commands.PropertyCommand;
import io.vena.chronicle.exceptions.DanglingReferenceException;
import io.vena.chronicle.serialization.SerializedDocument;
import io.vena.chronicle.state.TestDocument;
import io.vena.chronicle.state.TestNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChronicleTest extends AbstractChronicleTest {
	Chronicle chronicle;

	@BeforeEach
	void setup() {
		chronicle = new Chronicle("test");
		chronicle.registerType("Document", TestDocument.class, TestDocument::new);
		chronicle.registerType("Node", TestNode.class, TestNode::new);
	}

	@Test
	void editUndoSaveLoad() {
		TestDocument doc = new TestDocument();
		chronicle.beginInit();
		chronicle.execute(new PropertyCommand(doc, TestDocument.TITLE, "Untitled"));
		chronicle.endInit();
		assertFalse(chronicle.canUndo());

		chronicle.beginCompound("Set up");
		chronicle.execute(new PropertyCommand(doc, TestDocument.TITLE, "Report"));
		chronicle.execute(new PropertyCommand(doc, TestDocument.ROOT_NODE, TestNode.named("root")));
		chronicle.endCompound();
		assertTrue(chronicle.canUndo());

		Identifier id = chronicle.register(doc);
		SerializedDocument saved = chronicle.serialize(doc);

		assertTrue(chronicle.undo());
		assertEquals("Untitled", doc.title());
		assertTrue(chronicle.canRedo());

		TestDocument loaded = (TestDocument) chronicle.deserialize(saved).get(0);
		assertEquals("Report", loaded.title());
		assertEquals("root", loaded.rootNode().name());
		assertSame(loaded, chronicle.resolve(id, TestDocument.class).get());
	}

	@Test
	void load_replacesObjectsAndClearsHistory() {
		TestDocument doc = new TestDocument();
		chronicle.execute(new PropertyCommand(doc, TestDocument.TITLE, "First"));
		chronicle.execute(new PropertyCommand(doc, TestDocument.TITLE, "Second"));
		SerializedDocument saved = chronicle.serialize(doc);
		chronicle.undo();
		assertTrue(chronicle.canUndo());
		assertTrue(chronicle.canRedo());

		TestDocument loaded = (TestDocument) chronicle.load(saved).get(0);

		assertEquals("Second", loaded.title());
		assertSame(loaded, chronicle.resolve(doc.id()).get());
		assertFalse(chronicle.canUndo());
		assertFalse(chronicle.canRedo());
		assertFalse(chronicle.undo());
	}

	@Test
	void deserialize_keepsHistory() {
		TestDocument doc = new TestDocument();
		chronicle.execute(new PropertyCommand(doc, TestDocument.TITLE, "Kept"));
		chronicle.deserialize(chronicle.serialize(TestNode.named("extra")));
		assertTrue(chronicle.canUndo());
	}

	@Test
	void load_invalidDocument_keepsHistory() {
		chronicle.execute(new PropertyCommand(TestNode.named("a"), TestNode.NAME, "b"));
		SerializedDocument dangling = new SerializedDocument(emptyList(), singletonList(Identifier.from("ghost")));
		assertThrows(DanglingReferenceException.class, () -> chronicle.load(dangling));
		assertTrue(chronicle.canUndo());
	}

	@Test
	void load_duringCompound_throws() {
		SerializedDocument saved = chronicle.serialize(TestNode.named("a"));
		chronicle.beginCompound("Open");
		assertThrows(IllegalStateException.class, () -> chronicle.load(saved));
		chronicle.abortCompound();
		assertEquals(1, chronicle.load(saved).size());
	}

	@Test
	void listenersAreForwarded() {
		List<String> names = new ArrayList<>();
		CommandListener listener = new CommandListener() {
			@Override
			public void afterExecute(Command command, boolean success) {
				names.add(command.name());
			}
		};
		chronicle.addListener(listener);
		chronicle.execute(new PropertyCommand(TestNode.named("a"), TestNode.NAME, "b"));
		assertTrue(chronicle.removeListener(listener));
		assertEquals(singletonList("Set name"), names);
	}

	@Test
	void concurrentExecutes_allRecorded() throws Exception {
		int threads = 4;
		int perThread = 50;
		TestNode node = TestNode.named("start");
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int t = 0; t < threads; t++) {
				int thread = t;
				futures.add(executor.submit(() -> {
					start.await();
					for (int i = 0; i < perThread; i++) {
						chronicle.execute(new PropertyCommand(node, TestNode.NAME, "t" + thread + "-" + i));
					}
					return null;
				}));
			}
			start.countDown();
			for (Future<?> future: futures) {
				future.get(30, TimeUnit.SECONDS);
			}
		} finally {
			executor.shutdownNow();
		}
		assertEquals(threads * perThread, chronicle.locked(() -> chronicle.commands().history().undoDepth()));
	}

	@Test
	void lockedIsReentrant() {
		TestNode node = TestNode.named("a");
		String result = chronicle.locked(() -> {
			chronicle.execute(new PropertyCommand(node, TestNode.NAME, "b"));
			return node.name();
		});
		assertEquals("b", result);
	}
}
