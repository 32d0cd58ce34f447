package flint.roaring;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

class TestcaseChunkIndex {

	private static ArrayContainer array(int... lows) {
		ArrayContainer ac = new ArrayContainer();
		for (int v : lows) ac.add((short) v);
		return ac;
	}

	@Test
	void insertOrGetKeepsKeysAscending() {
		ChunkIndex index = new ChunkIndex();
		for (int key : new int[] { 9, 0xFFFF, 3, 0, 7, 3 }) index.insertOrGet(key).add((short) key);
		assertEquals(5, index.size());
		int prev = -1;
		for (ChunkIndex.Chunk chunk : index) {
			assertTrue(chunk.key() > prev);
			prev = chunk.key();
		}
		assertEquals(0xFFFF, index.keyAt(index.size() - 1));
		assertSame(index.get(7), index.insertOrGet(7));
		assertNull(index.get(8));
	}

	@Test
	void indexOfReturnsInsertionPoint() {
		ChunkIndex index = new ChunkIndex();
		index.append(2, array(1));
		index.append(5, array(1));
		assertEquals(0, index.indexOf(2));
		assertEquals(1, index.indexOf(5));
		assertEquals(-1, index.indexOf(0));
		assertEquals(-2, index.indexOf(3));
		assertEquals(-3, index.indexOf(6));
	}

	@Test
	void removeIfEmptyOnlyDropsEmptyContainers() {
		ChunkIndex index = new ChunkIndex();
		index.insertOrGet(4).add((short) 1);
		index.insertOrGet(6);
		assertFalse(index.removeIfEmpty(4));
		assertTrue(index.removeIfEmpty(6));
		assertFalse(index.removeIfEmpty(6));
		assertEquals(1, index.size());

		index.containerAt(0).remove((short) 1);
		assertTrue(index.removeIfEmpty(4));
		assertTrue(index.isEmpty());
	}

	@Test
	void appendSkipsEmptyAndRejectsDisorder() {
		ChunkIndex index = new ChunkIndex(1);
		index.append(1, array(5));
		index.append(2, new ArrayContainer());
		index.append(3, array(6, 7));
		assertEquals(2, index.size());
		assertEquals(3L, index.cardinality());
		assertThrows(IllegalStateException.class, () -> index.append(3, array(1)));
		assertThrows(IllegalStateException.class, () -> index.append(0, array(1)));
	}

	@Test
	void setOrRemoveDropsEmptySlot() {
		ChunkIndex index = new ChunkIndex();
		index.append(1, array(5));
		index.append(2, array(6));
		index.setOrRemove(0, new ArrayContainer());
		assertEquals(1, index.size());
		assertEquals(2, index.keyAt(0));
		index.setOrRemove(0, array(1, 2));
		assertEquals(2, index.containerAt(0).cardinality());
	}

	@Test
	void copyIsDeep() {
		ChunkIndex index = new ChunkIndex();
		index.append(1, array(5));
		ChunkIndex copy = index.copy();
		copy.containerAt(0).add((short) 6);
		copy.insertOrGet(9).add((short) 1);
		assertEquals(1, index.size());
		assertEquals(1, index.containerAt(0).cardinality());

		index.clear();
		assertTrue(index.isEmpty());
		assertEquals(2, copy.size());
	}

	@Test
	void iteratorIsRestartable() {
		ChunkIndex index = new ChunkIndex();
		index.append(1, array(5));
		index.append(4, array(6));
		for (int round = 0; round < 2; round++) {
			List<Integer> keys = new ArrayList<>();
			for (ChunkIndex.Chunk chunk : index) keys.add(chunk.key());
			assertEquals(List.of(1, 4), keys);
		}
		Iterator<ChunkIndex.Chunk> it = new ChunkIndex().iterator();
		assertFalse(it.hasNext());
		assertThrows(NoSuchElementException.class, it::next);
	}
}
