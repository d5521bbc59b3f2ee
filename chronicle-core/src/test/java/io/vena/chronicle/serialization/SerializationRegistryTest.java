package io.vena.chronicle.serialization;

import io.vena.chronicle.exceptions.SerializationTypeException;
import io.vena.chronicle.state.TestDocument;
import io.vena.chronicle.state.TestLeaf;
import io.vena.chronicle.state.TestNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SerializationRegistryTest {
	SerializationRegistry registry;

	@BeforeEach
	void setup() {
		registry = new SerializationRegistry();
	}

	@Test
	void registerAndLookUp() {
		TypeRegistration<TestNode> registration = registry.registerType("Node", TestNode.class, TestNode::new);
		assertSame(registration, registry.registrationFor("Node"));
		assertEquals("Node", registry.typeNameFor(new TestNode()));
		assertTrue(registry.isRegistered("Node"));
		assertFalse(registry.isRegistered("Document"));
	}

	@Test
	void duplicateName_throws() {
		registry.registerType("Node", TestNode.class, TestNode::new);
		assertThrows(IllegalArgumentException.class, () -> registry.registerType("Node", TestDocument.class, TestDocument::new));
	}

	@Test
	void duplicateClass_throws() {
		registry.registerType("Node", TestNode.class, TestNode::new);
		assertThrows(IllegalArgumentException.class, () -> registry.registerType("OtherNode", TestNode.class, TestNode::new));
	}

	@Test
	void unknownName_throws() {
		assertThrows(SerializationTypeException.class, () -> registry.registrationFor("Nothing"));
	}

	@Test
	void unregisteredClass_throws() {
		assertThrows(SerializationTypeException.class, () -> registry.typeNameFor(new TestDocument()));
	}

	@Test
	void subclass_usesNearestRegisteredSuperclass() {
		registry.registerType("Node", TestNode.class, TestNode::new);
		assertEquals("Node", registry.typeNameFor(new TestLeaf()));
	}

	@Test
	void subclass_exactRegistrationWins() {
		registry.registerType("Node", TestNode.class, TestNode::new);
		registry.registerType("Leaf", TestLeaf.class, TestLeaf::new);
		assertEquals("Leaf", registry.typeNameFor(new TestLeaf()));
		assertEquals("Node", registry.typeNameFor(new TestNode()));
	}
}
