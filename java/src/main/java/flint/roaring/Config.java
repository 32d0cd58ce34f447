/**
 * Config.java
 */
package flint.roaring;

/**
 * Process-wide settings read once from system properties.
 */
final class Config {
	static final String PRODUCT_NAME_LC = "flint.roaring";

	/** "default" routes through java.util.logging, "null" drops everything but errors */
	static final String LOGGER = System.getProperty(PRODUCT_NAME_LC + ".logger", "default");

	/** Maximum values rendered by RoaringBitmap.toString(), 0 for no limit */
	static final int TOSTRING_LIMIT = Integer.parseInt(System.getProperty(PRODUCT_NAME_LC + ".tostring.limit", "0"));

	private Config() {
	}
}
