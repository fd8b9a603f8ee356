package org.quarkup.io;

/** The position of a single character in a text document */
public class FilePosition {
	private final int thePosition;
	private final int theLineNumber;
	private final int theCharNumber;

	/**
	 * @param position The absolute character position in the document
	 * @param lineNumber The line number in the document, indexed from zero
	 * @param charNumber The character number (within the line) in the document, indexed from zero
	 */
	public FilePosition(int position, int lineNumber, int charNumber) {
		thePosition = position;
		theLineNumber = lineNumber;
		theCharNumber = charNumber;
	}

	/**
	 * Locates a character offset in a document. Any of <code>\n</code>, <code>\r\n</code> or a lone <code>\r</code> ends a line.
	 * 
	 * @param text The document text
	 * @param offset The absolute character offset to locate, between zero and the length of the text
	 * @param tabLength The number of characters a tab counts for in the character number
	 * @return The position of the given offset in the document
	 */
	public static FilePosition of(CharSequence text, int offset, int tabLength) {
		return new FilePosition(0, 0, 0).advance(text, offset, tabLength);
	}

	/**
	 * Locates a character offset in a document by scanning forward from this position, which must be a position in the same document
	 * 
	 * @param text The document text
	 * @param offset The absolute character offset to locate, between this position and the length of the text
	 * @param tabLength The number of characters a tab counts for in the character number
	 * @return The position of the given offset in the document
	 * @see #of(CharSequence, int, int)
	 */
	public FilePosition advance(CharSequence text, int offset, int tabLength) {
		if (offset < 0 || offset > text.length())
			throw new IndexOutOfBoundsException(offset + " of " + text.length());
		else if (offset < thePosition)
			throw new IllegalArgumentException("Cannot advance backward from " + thePosition + " to " + offset);
		int line = theLineNumber, ch = theCharNumber;
		for (int i = thePosition; i < offset; i++) {
			switch (text.charAt(i)) {
			case '\r':
				if (i + 1 < text.length() && text.charAt(i + 1) == '\n')
					break; // The '\n' will end the line
				line++;
				ch = 0;
				break;
			case '\n':
				line++;
				ch = 0;
				break;
			case '\t':
				ch += tabLength;
				break;
			default:
				ch++;
			}
		}
		return new FilePosition(offset, line, ch);
	}

	/** @return The absolute character position in the document */
	public int getPosition() {
		return thePosition;
	}

	/** @return The line number in the document, indexed from zero */
	public int getLineNumber() {
		return theLineNumber;
	}

	/** @return The character number (within the line) in the document, indexed from zero */
	public int getCharNumber() {
		return theCharNumber;
	}

	@Override
	public int hashCode() {
		return thePosition;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FilePosition && thePosition == ((FilePosition) obj).thePosition;
	}

	@Override
	public String toString() {
		return new StringBuilder("L").append(theLineNumber + 1).append(",C").append(theCharNumber + 1).toString();
	}
}
