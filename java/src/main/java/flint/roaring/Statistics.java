/**
 * Statistics.java
 */
package flint.roaring;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Container census of a bitmap: how many containers of each kind, how many values they
 * hold, and how many payload bytes they use.
 */
public final class Statistics {
	private static final Gson GSON = new GsonBuilder().create();

	private final long cardinality;
	private final long containers;

	private final long arrayContainers;
	private final long arrayContainerValues;
	private final long arrayContainerBytes;

	private final long bitmapContainers;
	private final long bitmapContainerValues;
	private final long bitmapContainerBytes;

	private final long runContainers;
	private final long runContainerValues;
	private final long runContainerBytes;

	Statistics(long cardinality, long containers, //
			long arrayContainers, long arrayContainerValues, long arrayContainerBytes, //
			long bitmapContainers, long bitmapContainerValues, long bitmapContainerBytes, //
			long runContainers, long runContainerValues, long runContainerBytes) {
		this.cardinality = cardinality;
		this.containers = containers;
		this.arrayContainers = arrayContainers;
		this.arrayContainerValues = arrayContainerValues;
		this.arrayContainerBytes = arrayContainerBytes;
		this.bitmapContainers = bitmapContainers;
		this.bitmapContainerValues = bitmapContainerValues;
		this.bitmapContainerBytes = bitmapContainerBytes;
		this.runContainers = runContainers;
		this.runContainerValues = runContainerValues;
		this.runContainerBytes = runContainerBytes;
	}

	static Statistics of(ChunkIndex index) {
		long[] count = new long[4], values = new long[4], bytes = new long[4];
		long cardinality = 0;
		for (ChunkIndex.Chunk chunk : index) {
			Container c = chunk.container();
			int t = c.type();
			int card = c.cardinality();
			count[t]++;
			values[t] += card;
			bytes[t] += c.sizeInBytes();
			cardinality += card;
		}
		return new Statistics(cardinality, index.size(), //
				count[Container.ARRAY], values[Container.ARRAY], bytes[Container.ARRAY], //
				count[Container.BITMAP], values[Container.BITMAP], bytes[Container.BITMAP], //
				count[Container.RUN], values[Container.RUN], bytes[Container.RUN]);
	}

	public long getCardinality() {
		return cardinality;
	}

	public long getContainers() {
		return containers;
	}

	public long getArrayContainers() {
		return arrayContainers;
	}

	public long getArrayContainerValues() {
		return arrayContainerValues;
	}

	public long getArrayContainerBytes() {
		return arrayContainerBytes;
	}

	public long getBitmapContainers() {
		return bitmapContainers;
	}

	public long getBitmapContainerValues() {
		return bitmapContainerValues;
	}

	public long getBitmapContainerBytes() {
		return bitmapContainerBytes;
	}

	public long getRunContainers() {
		return runContainers;
	}

	public long getRunContainerValues() {
		return runContainerValues;
	}

	public long getRunContainerBytes() {
		return runContainerBytes;
	}

	/**
	 * Flat view with the key names used by the C library's statistics
	 *
	 * @return insertion-ordered map, every key always present
	 */
	public Map<String, Long> toMap() {
		final Map<String, Long> m = new LinkedHashMap<>();
		m.put("cardinality", cardinality);
		m.put("n_containers", containers);
		m.put("n_array_containers", arrayContainers);
		m.put("n_run_containers", runContainers);
		m.put("n_bitmap_containers", bitmapContainers);
		m.put("n_values_array_containers", arrayContainerValues);
		m.put("n_values_run_containers", runContainerValues);
		m.put("n_values_bitmap_containers", bitmapContainerValues);
		m.put("n_bytes_array_containers", arrayContainerBytes);
		m.put("n_bytes_run_containers", runContainerBytes);
		m.put("n_bytes_bitmap_containers", bitmapContainerBytes);
		return m;
	}

	public String toJson() {
		return GSON.toJson(this);
	}

	public static Statistics fromJson(String json) {
		return GSON.fromJson(json, Statistics.class);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Statistics)) return false;
		Statistics s = (Statistics) o;
		return cardinality == s.cardinality && containers == s.containers //
				&& arrayContainers == s.arrayContainers && arrayContainerValues == s.arrayContainerValues && arrayContainerBytes == s.arrayContainerBytes //
				&& bitmapContainers == s.bitmapContainers && bitmapContainerValues == s.bitmapContainerValues && bitmapContainerBytes == s.bitmapContainerBytes //
				&& runContainers == s.runContainers && runContainerValues == s.runContainerValues && runContainerBytes == s.runContainerBytes;
	}

	@Override
	public int hashCode() {
		return toMap().hashCode();
	}

	@Override
	public String toString() {
		return toJson();
	}
}
