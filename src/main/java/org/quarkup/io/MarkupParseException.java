package org.quarkup.io;

import java.text.ParseException;

/** Thrown by strict parse operations when markup text is malformed */
public class MarkupParseException extends ParseException {
	private final FilePosition thePosition;

	/**
	 * @param s The message for the exception
	 * @param position The position of the malformed markup in the text
	 */
	public MarkupParseException(String s, FilePosition position) {
		super(s, position == null ? 0 : position.getPosition());
		thePosition = position;
	}

	/**
	 * @param s The message for the exception
	 * @param position The position of the malformed markup in the text
	 * @param cause The cause of the exception
	 */
	public MarkupParseException(String s, FilePosition position, Throwable cause) {
		super(s, position == null ? 0 : position.getPosition());
		initCause(cause);
		thePosition = position;
	}

	/** @return The position of the source of the error in the text */
	public FilePosition getPosition() {
		return thePosition;
	}

	/** @return The line number of the error in the text, offset from zero */
	public int getLineNumber() {
		return thePosition.getLineNumber();
	}

	/** @return The character number of the error in the line, offset from zero */
	public int getColumnNumber() {
		return thePosition.getCharNumber();
	}

	@Override
	public String toString() {
		if (thePosition != null)
			return new StringBuilder().append(thePosition).append(":\n").append(super.toString()).toString();
		else
			return super.toString();
	}
}
