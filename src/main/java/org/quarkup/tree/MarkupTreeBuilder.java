package org.quarkup.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;
import org.quarkup.MarkupAttribute;
import org.quarkup.QualifiedName;
import org.quarkup.io.FilePosition;
import org.quarkup.io.MarkupEventDispatcher;
import org.quarkup.io.MarkupEventHandler;
import org.quarkup.io.MarkupParseException;

/**
 * <p>
 * A {@link MarkupEventHandler} that builds a {@link MarkupTree} with a {@link MarkupNodeType#DOCUMENT document} root from the events of a
 * {@link MarkupEventDispatcher}. CDATA sections become {@link MarkupNodeType#TEXT text} nodes.
 * </p>
 * <p>
 * Mismatched end tags are recovered from: an end tag naming an element that is open further up closes every element above it as well, and
 * an end tag naming no open element is dropped. Elements still open at the end of the text are closed.
 * </p>
 */
public class MarkupTreeBuilder implements MarkupEventHandler {
	private static final Logger log = Logger.getLogger(MarkupTreeBuilder.class);

	private MarkupTree.Builder theBuilder;
	private final Deque<QualifiedName> theStack;
	private MarkupTree theTree;
	private int theParseErrorCount;
	private FilePosition theFirstParseError;

	/** Creates a tree builder to be given to a {@link MarkupEventDispatcher} */
	public MarkupTreeBuilder() {
		theStack = new ArrayDeque<>();
	}

	/**
	 * @return The tree built from the last document dispatched to this handler
	 * @throws IllegalStateException If no document has been completely dispatched to this handler
	 */
	public MarkupTree getTree() {
		if (theTree == null)
			throw new IllegalStateException("No document has been parsed");
		return theTree;
	}

	/** @return The number of characters of malformed markup skipped in the last document */
	public int getParseErrorCount() {
		return theParseErrorCount;
	}

	/** @return The position of the first character of malformed markup skipped in the last document, or null if there was none */
	public FilePosition getFirstParseError() {
		return theFirstParseError;
	}

	@Override
	public void handleStartDocument() {
		theBuilder = MarkupTree.buildDocument();
		theStack.clear();
		theTree = null;
		theParseErrorCount = 0;
		theFirstParseError = null;
	}

	@Override
	public void handleEndDocument() {
		if (!theStack.isEmpty() && log.isDebugEnabled())
			log.debug("Closing " + theStack.size() + " element(s) left open at the end of the text: " + theStack);
		while (!theStack.isEmpty()) {
			theStack.removeLast();
			theBuilder.endElement();
		}
		theTree = theBuilder.build();
		theBuilder = null;
	}

	@Override
	public void handleStartElement(QualifiedName name, List<MarkupAttribute> attributes) {
		theBuilder.startElement(name);
		for (MarkupAttribute attr : attributes)
			theBuilder.attribute(attr.getQualifiedName(), attr.getValue());
		theStack.add(name);
	}

	@Override
	public void handleEndElement(QualifiedName name) {
		int toClose = 0;
		boolean found = false;
		Iterator<QualifiedName> open = theStack.descendingIterator();
		while (open.hasNext()) {
			toClose++;
			if (open.next().equals(name)) {
				found = true;
				break;
			}
		}
		if (!found) {
			if (log.isDebugEnabled())
				log.debug("Dropping end tag </" + name + "> which matches no open element");
			return;
		}
		if (toClose > 1 && log.isDebugEnabled())
			log.debug("End tag </" + name + "> closes " + (toClose - 1) + " unclosed element(s)");
		for (int i = 0; i < toClose; i++) {
			theStack.removeLast();
			theBuilder.endElement();
		}
	}

	@Override
	public void handleCharacterData(String text) {
		theBuilder.text(text);
	}

	@Override
	public void handleProcessingInstruction(String target, String text) {
		theBuilder.processingInstruction(target, text);
	}

	@Override
	public void handleDoctype(String text) {
		theBuilder.doctype(text);
	}

	@Override
	public void handleComment(String comment) {
		theBuilder.comment(comment);
	}

	@Override
	public void handleParseError(FilePosition position) {
		if (theFirstParseError == null)
			theFirstParseError = position;
		theParseErrorCount++;
	}

	/**
	 * Parses markup text into a tree, recovering from any malformed markup. Text is trimmed, and text consisting only of white space is
	 * left out.
	 *
	 * @param text The text to parse
	 * @return The parsed tree
	 */
	public static MarkupTree parse(CharSequence text) {
		return parse(text, true);
	}

	/**
	 * Parses markup text into a tree, recovering from any malformed markup
	 *
	 * @param text The text to parse
	 * @param ignoreWhitespace Whether text should be trimmed, leaving text consisting only of white space out of the tree
	 * @return The parsed tree
	 */
	public static MarkupTree parse(CharSequence text, boolean ignoreWhitespace) {
		return dispatch(text, ignoreWhitespace).getTree();
	}

	/**
	 * Parses markup text into a tree, failing if any of it is malformed. Text is trimmed, and text consisting only of white space is left
	 * out.
	 *
	 * @param text The text to parse
	 * @return The parsed tree
	 * @throws MarkupParseException If the text contains any malformed markup
	 */
	public static MarkupTree parseStrict(CharSequence text) throws MarkupParseException {
		MarkupTreeBuilder builder = dispatch(text, true);
		if (builder.getFirstParseError() != null)
			throw new MarkupParseException("Malformed markup (" + builder.getParseErrorCount() + " character(s) skipped)",
				builder.getFirstParseError());
		return builder.getTree();
	}

	private static MarkupTreeBuilder dispatch(CharSequence text, boolean ignoreWhitespace) {
		MarkupTreeBuilder builder = new MarkupTreeBuilder();
		new MarkupEventDispatcher(builder).setIgnoreWhitespace(ignoreWhitespace).dispatch(text);
		return builder;
	}
}
