package flint.roaring;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.junit.jupiter.api.Test;

class TestcaseErrors {

	@Test
	void codesClassifyDecodingFailures() {
		assertTrue(new RoaringException(ErrorCode.MALFORMED_INPUT, "keys").isMalformedInput());
		assertTrue(new RoaringException(ErrorCode.UNKNOWN_COOKIE, "0x1234").isMalformedInput());
		assertTrue(new RoaringException(ErrorCode.TRUNCATED_INPUT, "header").isMalformedInput());
		assertFalse(new RoaringException(ErrorCode.INSUFFICIENT_BUFFER, "22 bytes").isMalformedInput());
		assertFalse(new RoaringException(ErrorCode.INTERNAL_ERROR, "pair").isMalformedInput());

		RoaringException ex = new RoaringException(ErrorCode.INSUFFICIENT_BUFFER, "need 22 bytes");
		assertEquals(ErrorCode.INSUFFICIENT_BUFFER, ex.getErrorCode());
		assertEquals("Insufficient buffer - need 22 bytes", ex.getMessage());
	}

	@Test
	void rejectedInputIsLoggedAsError() {
		java.util.logging.Logger jul = java.util.logging.Logger.getLogger(PortableCodec.class.getName());
		List<LogRecord> records = new ArrayList<>();
		Handler capture = new Handler() {
			@Override
			public void publish(LogRecord record) {
				records.add(record);
			}

			@Override
			public void flush() {
			}

			@Override
			public void close() {
			}
		};
		jul.addHandler(capture);
		try {
			byte[] data = RoaringBitmap.of(1).toByteArray();
			data[0] = 0x11;
			assertThrows(RoaringException.class, () -> RoaringBitmap.read(data));
		} finally {
			jul.removeHandler(capture);
		}
		assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.SEVERE && r.getMessage().contains("rejected")), records.toString());
	}

	@Test
	void preconditionsUseErrorMessages() {
		RoaringBitmap empty = new RoaringBitmap();
		assertEquals(ErrorCode.EMPTY_SET.getMessage(), assertThrows(NoSuchElementException.class, empty::minimum).getMessage());
		assertEquals(ErrorCode.EMPTY_SET.getMessage(), assertThrows(NoSuchElementException.class, empty::maximum).getMessage());
		String msg = assertThrows(IllegalArgumentException.class, () -> empty.addRange(-1, 5)).getMessage();
		assertTrue(msg.startsWith(ErrorCode.INVALID_RANGE.getMessage()), msg);
		assertEquals(RoaringBitmap.NOT_FOUND, empty.select(0));
		assertEquals(-1, RoaringBitmap.NOT_FOUND);
	}

	@Test
	void loggerFollowsConfig() {
		Logger log = Logger.of(RoaringBitmap.class.getName());
		assertEquals("default", Config.LOGGER);
		assertTrue(log instanceof Logger.DefaultLogger);
		log.log("fine %d", 1);
		new Logger.NullLogger().log("dropped %s", "x");
	}
}
