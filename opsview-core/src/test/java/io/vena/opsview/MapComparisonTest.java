package io.vena.opsview;

import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MapComparisonTest {

	@Test
	void partitionsKeys() {
		ConfigObjectMap<TestObject> local = ConfigObjectMap.of(obj("a"), obj("b"), obj("c"));
		ConfigObjectMap<TestObject> remote = ConfigObjectMap.of(obj("b"), obj("c"), obj("d"));

		MapComparison comparison = MapComparison.of(local, remote);

		assertEquals(Set.of("a"), comparison.onlyInFirst());
		assertEquals(Set.of("d"), comparison.onlyInSecond());
		assertEquals(Set.of("b", "c"), comparison.inBoth());
		assertFalse(comparison.sameKeys());
	}

	@Test
	void refsAndObjectsCompareByKey() {
		ConfigObjectMap<TestObject> objects = ConfigObjectMap.of(obj("a"), obj("b"));
		ConfigRefMap<TestObjectRef> refs = ConfigRefMap.from(objects, TestObjectRef::from);
		assertTrue(MapComparison.of(objects, refs).sameKeys());
	}

	private static TestObject obj(String name) {
		return new TestObject(name, null, null, null);
	}
}
