/**
 * RoaringIterator.java
 */
package flint.roaring;

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Ascending iterator over the unsigned values of a bitmap, one container cursor at a time.
 * Not valid across mutations of the bitmap it came from.
 */
final class RoaringIterator implements PrimitiveIterator.OfInt {
	private final ChunkIndex index;
	private int chunk = 0;
	private PrimitiveIterator.OfInt current;

	RoaringIterator(ChunkIndex index) {
		this.index = index;
		advance();
	}

	private void advance() {
		while (chunk < index.size()) {
			PrimitiveIterator.OfInt it = index.containerAt(chunk).intIterator(index.keyAt(chunk));
			chunk++;
			if (it.hasNext()) {
				current = it;
				return;
			}
		}
		current = null;
	}

	@Override
	public boolean hasNext() {
		return current != null;
	}

	@Override
	public int nextInt() {
		if (current == null) throw new NoSuchElementException();
		int v = current.nextInt();
		if (!current.hasNext()) advance();
		return v;
	}
}
