package org.quarkup.io;

/** Notified by a {@link MarkupPushReader} each time it skips a character of malformed markup */
@FunctionalInterface
public interface ParseErrorHandler {
	/** @param position The position of the character that could not be recognized and is being skipped */
	void handleParseError(FilePosition position);
}
