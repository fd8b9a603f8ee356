package org.quarkup.io;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.log4j.Logger;
import org.quarkup.MarkupAttribute;
import org.quarkup.QualifiedName;
import org.quarkup.io.MarkupGrammar.EndTag;
import org.quarkup.io.MarkupGrammar.Match;
import org.quarkup.io.MarkupGrammar.ProcessingInstructionToken;
import org.quarkup.io.MarkupGrammar.StartTag;

import com.google.common.base.CharMatcher;

/**
 * <p>
 * A push-style reader over markup text. Each call to {@link #read()} advances over exactly one structure in the text and exposes it
 * through this reader's accessors, similar to .NET's XmlReader.
 * </p>
 * <p>
 * The reader never aborts on malformed markup. A character which cannot begin any recognized structure is reported to the
 * {@link ParseErrorHandler} (if any) and skipped, and reading continues with the next character.
 * </p>
 * <p>
 * Depth is calculated as follows:
 * <ul>
 * <li>Every {@link NodeType#ELEMENT} increments the depth by 1.</li>
 * <li>Every {@link NodeType#END_ELEMENT} decrements the depth by 1.</li>
 * <li>A self-closing element (e.g. <code>&lt;element /></code>) increments the depth by 1 while it is current, and the depth is
 * decremented by 1 on the next call to {@link #read()}. No {@link NodeType#END_ELEMENT} is produced for a self-closing element.</li>
 * </ul>
 * </p>
 * <p>
 * This class is not thread-safe.
 * </p>
 */
public class MarkupPushReader {
	private static final Logger log = Logger.getLogger(MarkupPushReader.class);

	/** The types of nodes a {@link MarkupPushReader} may be positioned at */
	public enum NodeType {
		/** Character data between structures, with entity references decoded */
		TEXT,
		/** A CDATA section */
		CDATA,
		/** An element's start tag, possibly self-closing */
		ELEMENT,
		/** An element's end tag */
		END_ELEMENT,
		/** A comment */
		COMMENT,
		/** A processing instruction */
		PROCESSING_INSTRUCTION,
		/** A document type declaration */
		DOCUMENT_TYPE;
	}

	private final CharSequence theText;
	private final boolean isIgnoringWhitespace;
	private final ParseErrorHandler theErrorHandler;
	private final MarkupGrammar theGrammar;
	private int theTabLength = 4;
	private FilePosition theLastErrorPosition;

	private int thePosition;
	private NodeType theNodeType;
	private QualifiedName theName;
	private String theValue;
	private String theProcessingInstructionTarget;
	private List<MarkupAttribute> theAttributes = Collections.emptyList();
	private int theDepth;
	private boolean isSelfClosing;
	private boolean isEof;

	/**
	 * Creates a reader that ignores white space (see {@link #isIgnoringWhitespace()}) and silently skips malformed markup
	 *
	 * @param text The text to read
	 */
	public MarkupPushReader(CharSequence text) {
		this(text, true);
	}

	/**
	 * Creates a reader that silently skips malformed markup
	 *
	 * @param text The text to read
	 * @param ignoreWhitespace Whether text should be trimmed, skipping text consisting only of white space
	 */
	public MarkupPushReader(CharSequence text, boolean ignoreWhitespace) {
		this(text, ignoreWhitespace, null);
	}

	/**
	 * @param text The text to read
	 * @param ignoreWhitespace Whether text should be trimmed, skipping text consisting only of white space
	 * @param onParseError The handler to notify of malformed markup, or null to skip malformed markup silently
	 */
	public MarkupPushReader(CharSequence text, boolean ignoreWhitespace, ParseErrorHandler onParseError) {
		this(text, ignoreWhitespace, onParseError, MarkupGrammar.STANDARD);
	}

	/**
	 * @param text The text to read
	 * @param ignoreWhitespace Whether text should be trimmed, skipping text consisting only of white space
	 * @param onParseError The handler to notify of malformed markup, or null to skip malformed markup silently
	 * @param grammar The grammar to recognize structures in the text with
	 */
	public MarkupPushReader(CharSequence text, boolean ignoreWhitespace, ParseErrorHandler onParseError, MarkupGrammar grammar) {
		theText = Objects.requireNonNull(text, "Text cannot be null");
		isIgnoringWhitespace = ignoreWhitespace;
		theErrorHandler = onParseError;
		theGrammar = Objects.requireNonNull(grammar, "Grammar cannot be null");
	}

	/** @return The number of spaces to interpret tabs as in the character numbers of error positions. The default is 4. */
	public int getTabLength() {
		return theTabLength;
	}

	/**
	 * @param tabLength The number of spaces to interpret tabs as in the character numbers of error positions
	 * @return This reader
	 */
	public MarkupPushReader setTabLength(int tabLength) {
		if (tabLength < 0)
			throw new IllegalArgumentException("Tab length cannot be negative: " + tabLength);
		theTabLength = tabLength;
		theLastErrorPosition = null;
		return this;
	}

	/**
	 * @return Whether this reader ignores white space: text is trimmed of leading and trailing white space, and text consisting only of
	 *         white space is skipped
	 */
	public boolean isIgnoringWhitespace() {
		return isIgnoringWhitespace;
	}

	/** @return The type of the node this reader is positioned at, or null before the first read and after the end of the text */
	public NodeType getNodeType() {
		return theNodeType;
	}

	/** @return The name of the current node if it is an {@link NodeType#ELEMENT element} or {@link NodeType#END_ELEMENT end element} */
	public QualifiedName getName() {
		return theName;
	}

	/**
	 * @return The value of the current node: the decoded text of a {@link NodeType#TEXT}, the raw content of a {@link NodeType#CDATA},
	 *         {@link NodeType#COMMENT} or {@link NodeType#DOCUMENT_TYPE}, or the text of a {@link NodeType#PROCESSING_INSTRUCTION}. Null for
	 *         elements.
	 */
	public String getValue() {
		return theValue;
	}

	/** @return The target of the current node if it is a {@link NodeType#PROCESSING_INSTRUCTION processing instruction} */
	public String getProcessingInstructionTarget() {
		return theProcessingInstructionTarget;
	}

	/** @return The attributes of the current node if it is an {@link NodeType#ELEMENT element}, or an empty list */
	public List<MarkupAttribute> getAttributes() {
		return theAttributes;
	}

	/** @return The depth of the reader, zero outside of any element */
	public int getDepth() {
		return theDepth;
	}

	/** @return Whether the current node is an {@link NodeType#ELEMENT element} that is self-closing, e.g. <code>&lt;element /></code> */
	public boolean isSelfClosing() {
		return isSelfClosing;
	}

	/** @return Whether this reader has reached the end of its text */
	public boolean isEof() {
		return isEof;
	}

	/** @return The position in the text just after the current node */
	public int getPosition() {
		return thePosition;
	}

	/**
	 * Advances this reader to the next node in the text
	 *
	 * @return True if this reader is now positioned at a new node, false if the end of the text has been reached
	 */
	public boolean read() {
		if (isEof)
			return false;
		if (isSelfClosing) {
			theDepth--;
			isSelfClosing = false;
		}
		theNodeType = null;
		theName = null;
		theValue = null;
		theProcessingInstructionTarget = null;
		theAttributes = Collections.emptyList();

		while (true) {
			if (readNode())
				return true;
			if (thePosition >= theText.length()) {
				isEof = true;
				if (log.isTraceEnabled())
					log.trace("End of text reached at depth " + theDepth);
				return false;
			}
			// Nothing here is recognizable, so skip a character and try again
			if (log.isDebugEnabled())
				log.debug("Skipping unrecognized character '" + theText.charAt(thePosition) + "' at " + thePosition);
			if (theErrorHandler != null)
				theErrorHandler.handleParseError(errorPosition());
			thePosition++;
		}
	}

	/** @return Whether a node was recognized at the current position. If false, the position is unchanged. */
	private boolean readNode() {
		while (true) {
			Match<String> text = theGrammar.characterData().recognize(theText, thePosition);
			if (!text.isSuccess())
				break;
			thePosition = text.getPosition();
			if (!isIgnoringWhitespace)
				return found(NodeType.TEXT, text.getValue());
			String trimmed = CharMatcher.whitespace().trimFrom(text.getValue());
			if (!trimmed.isEmpty())
				return found(NodeType.TEXT, trimmed);
			// White space-only text is skipped entirely
		}

		Match<StartTag> start = theGrammar.elementStart().recognize(theText, thePosition);
		if (start.isSuccess()) {
			thePosition = start.getPosition();
			theDepth++;
			theName = start.getValue().getName();
			theAttributes = start.getValue().getAttributes();
			isSelfClosing = start.getValue().isSelfClosing();
			return found(NodeType.ELEMENT, null);
		}

		Match<EndTag> end = theGrammar.elementEnd().recognize(theText, thePosition);
		if (end.isSuccess()) {
			thePosition = end.getPosition();
			theDepth--;
			theName = end.getValue().getName();
			return found(NodeType.END_ELEMENT, null);
		}

		Match<String> comment = theGrammar.comment().recognize(theText, thePosition);
		if (comment.isSuccess()) {
			thePosition = comment.getPosition();
			return found(NodeType.COMMENT, comment.getValue());
		}

		Match<String> cdata = theGrammar.cdata().recognize(theText, thePosition);
		if (cdata.isSuccess()) {
			thePosition = cdata.getPosition();
			return found(NodeType.CDATA, cdata.getValue());
		}

		Match<ProcessingInstructionToken> pi = theGrammar.processingInstruction().recognize(theText, thePosition);
		if (pi.isSuccess()) {
			thePosition = pi.getPosition();
			theProcessingInstructionTarget = pi.getValue().getTarget();
			return found(NodeType.PROCESSING_INSTRUCTION, pi.getValue().getText());
		}

		Match<String> doctype = theGrammar.doctype().recognize(theText, thePosition);
		if (doctype.isSuccess()) {
			thePosition = doctype.getPosition();
			return found(NodeType.DOCUMENT_TYPE, doctype.getValue());
		}
		return false;
	}

	private boolean found(NodeType type, String value) {
		theNodeType = type;
		theValue = value;
		if (log.isTraceEnabled())
			log.trace(this);
		return true;
	}

	/** Error positions only move forward, so each is located from the last one */
	private FilePosition errorPosition() {
		if (theLastErrorPosition == null)
			theLastErrorPosition = FilePosition.of(theText, thePosition, theTabLength);
		else
			theLastErrorPosition = theLastErrorPosition.advance(theText, thePosition, theTabLength);
		return theLastErrorPosition;
	}

	@Override
	public String toString() {
		if (isEof)
			return "MarkupPushReader{EOF}";
		StringBuilder str = new StringBuilder("MarkupPushReader{").append(theDepth).append(' ').append(theNodeType);
		if (theName != null)
			str.append(' ').append(theName);
		if (theProcessingInstructionTarget != null)
			str.append(' ').append(theProcessingInstructionTarget);
		if (theValue != null)
			str.append(" '").append(theValue).append('\'');
		if (!theAttributes.isEmpty())
			str.append(' ').append(theAttributes);
		return str.append('}').toString();
	}
}
