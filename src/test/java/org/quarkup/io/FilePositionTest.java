package org.quarkup.io;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link FilePosition#of(CharSequence, int, int)} */
public class FilePositionTest {
	private static final String TEXT = "ab\ncd\r\nef\rg\th";

	/** Any of the three line terminators ends a line */
	@Test
	public void testLines() {
		assertPosition(FilePosition.of(TEXT, 0, 4), 0, 0);
		assertPosition(FilePosition.of(TEXT, 4, 4), 1, 1);
		assertPosition(FilePosition.of(TEXT, 7, 4), 2, 0);
		assertPosition(FilePosition.of(TEXT, 10, 4), 3, 0);
	}

	/** Tabs count for the tab length */
	@Test
	public void testTabs() {
		assertPosition(FilePosition.of(TEXT, 12, 4), 3, 5);
		assertPosition(FilePosition.of(TEXT, 12, 1), 3, 2);
		Assert.assertEquals("L4,C6", FilePosition.of(TEXT, 12, 4).toString());
		assertPosition(FilePosition.of(TEXT, TEXT.length(), 4), 3, 6);
	}

	/** Advancing from a position gives the same result as locating from the start, even between a \r and a \n */
	@Test
	public void testAdvance() {
		for (int from = 0; from <= TEXT.length(); from++) {
			FilePosition start = FilePosition.of(TEXT, from, 4);
			for (int to = from; to <= TEXT.length(); to++) {
				FilePosition expected = FilePosition.of(TEXT, to, 4);
				FilePosition advanced = start.advance(TEXT, to, 4);
				Assert.assertEquals(expected.getPosition(), advanced.getPosition());
				assertPosition(advanced, expected.getLineNumber(), expected.getCharNumber());
			}
		}
		assertPosition(FilePosition.of(TEXT, 6, 4).advance(TEXT, 7, 4), 2, 0);
	}

	/** Positions cannot be advanced backward */
	@Test(expected = IllegalArgumentException.class)
	public void testAdvanceBackward() {
		FilePosition.of(TEXT, 5, 4).advance(TEXT, 4, 4);
	}

	/** Offsets outside the text are rejected */
	@Test(expected = IndexOutOfBoundsException.class)
	public void testOutOfBounds() {
		FilePosition.of(TEXT, TEXT.length() + 1, 4);
	}

	private static void assertPosition(FilePosition position, int line, int ch) {
		Assert.assertEquals(line, position.getLineNumber());
		Assert.assertEquals(ch, position.getCharNumber());
	}
}
