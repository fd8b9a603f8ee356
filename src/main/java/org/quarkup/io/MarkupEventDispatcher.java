package org.quarkup.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import org.apache.log4j.Logger;

/**
 * Drives a {@link MarkupPushReader} over markup text, turning each node it reads into {@link MarkupEvent}s which are delivered to a
 * {@link MarkupEventHandler}. This is the SAX-style counterpart of the push reader.
 */
public class MarkupEventDispatcher {
	private static final Logger log = Logger.getLogger(MarkupEventDispatcher.class);

	private final MarkupEventHandler theHandler;
	private final MarkupEvent.Visitor<Void> theDelivery;
	private boolean isIgnoringWhitespace;
	private MarkupGrammar theGrammar = MarkupGrammar.STANDARD;
	private int theTabLength = 4;

	/** Creates a dispatcher with no handler, for use with {@link #events(CharSequence)} */
	public MarkupEventDispatcher() {
		this(new MarkupEventHandler() {
		});
	}

	/** @param handler The handler to deliver events to */
	public MarkupEventDispatcher(MarkupEventHandler handler) {
		theHandler = Objects.requireNonNull(handler, "Handler cannot be null");
		theDelivery = new HandlerDelivery(handler);
	}

	/** @return The handler this dispatcher delivers events to */
	public MarkupEventHandler getHandler() {
		return theHandler;
	}

	/** @return Whether text is trimmed and text consisting only of white space is skipped. False by default. */
	public boolean isIgnoringWhitespace() {
		return isIgnoringWhitespace;
	}

	/**
	 * @param ignoreWhitespace Whether text should be trimmed, skipping text consisting only of white space
	 * @return This dispatcher
	 */
	public MarkupEventDispatcher setIgnoreWhitespace(boolean ignoreWhitespace) {
		isIgnoringWhitespace = ignoreWhitespace;
		return this;
	}

	/** @return The grammar used to recognize structures in the text */
	public MarkupGrammar getGrammar() {
		return theGrammar;
	}

	/**
	 * @param grammar The grammar to recognize structures in the text with
	 * @return This dispatcher
	 */
	public MarkupEventDispatcher setGrammar(MarkupGrammar grammar) {
		theGrammar = Objects.requireNonNull(grammar, "Grammar cannot be null");
		return this;
	}

	/**
	 * @param tabLength The number of spaces to interpret tabs as in the character numbers of error positions
	 * @return This dispatcher
	 */
	public MarkupEventDispatcher setTabLength(int tabLength) {
		if (tabLength < 0)
			throw new IllegalArgumentException("Tab length cannot be negative: " + tabLength);
		theTabLength = tabLength;
		return this;
	}

	/**
	 * Reads the text completely, delivering each event to this dispatcher's handler as it occurs
	 *
	 * @param text The text to parse
	 */
	public void dispatch(CharSequence text) {
		generate(text, event -> event.accept(theDelivery));
	}

	/**
	 * Reads the text completely, collecting the events instead of delivering them to this dispatcher's handler
	 *
	 * @param text The text to parse
	 * @return All events for the text, in order
	 */
	public List<MarkupEvent> events(CharSequence text) {
		List<MarkupEvent> events = new ArrayList<>();
		generate(text, events::add);
		return events;
	}

	private void generate(CharSequence text, Consumer<MarkupEvent> events) {
		MarkupPushReader reader = new MarkupPushReader(text, isIgnoringWhitespace,
			position -> events.accept(new MarkupEvent.ParseError(position)), theGrammar)//
				.setTabLength(theTabLength);
		events.accept(MarkupEvent.StartDocument.INSTANCE);
		int count = 0;
		while (reader.read()) {
			count++;
			switch (reader.getNodeType()) {
			case TEXT:
				events.accept(new MarkupEvent.Characters(reader.getValue(), false));
				break;
			case CDATA:
				events.accept(new MarkupEvent.Characters(reader.getValue(), true));
				break;
			case ELEMENT:
				events.accept(new MarkupEvent.StartElement(reader.getName(), reader.getAttributes(), reader.isSelfClosing(),
					reader.getDepth()));
				if (reader.isSelfClosing())
					events.accept(new MarkupEvent.EndElement(reader.getName(), reader.getDepth() - 1, true));
				break;
			case END_ELEMENT:
				events.accept(new MarkupEvent.EndElement(reader.getName(), reader.getDepth(), false));
				break;
			case COMMENT:
				events.accept(new MarkupEvent.Comment(reader.getValue()));
				break;
			case PROCESSING_INSTRUCTION:
				events.accept(new MarkupEvent.ProcessingInstruction(reader.getProcessingInstructionTarget(), reader.getValue()));
				break;
			case DOCUMENT_TYPE:
				events.accept(new MarkupEvent.Doctype(reader.getValue()));
				break;
			default:
				throw new IllegalStateException("Unrecognized node type: " + reader.getNodeType());
			}
		}
		events.accept(MarkupEvent.EndDocument.INSTANCE);
		if (log.isDebugEnabled())
			log.debug("Dispatched " + count + " nodes from " + text.length() + " characters");
	}

	private static class HandlerDelivery implements MarkupEvent.Visitor<Void> {
		private final MarkupEventHandler theHandler;

		HandlerDelivery(MarkupEventHandler handler) {
			theHandler = handler;
		}

		@Override
		public Void visitStartDocument(MarkupEvent.StartDocument event) {
			theHandler.handleStartDocument();
			return null;
		}

		@Override
		public Void visitEndDocument(MarkupEvent.EndDocument event) {
			theHandler.handleEndDocument();
			return null;
		}

		@Override
		public Void visitStartElement(MarkupEvent.StartElement event) {
			theHandler.handleStartElement(event.getName(), event.getAttributes());
			return null;
		}

		@Override
		public Void visitEndElement(MarkupEvent.EndElement event) {
			theHandler.handleEndElement(event.getName());
			return null;
		}

		@Override
		public Void visitCharacters(MarkupEvent.Characters event) {
			theHandler.handleCharacterData(event.getValue());
			return null;
		}

		@Override
		public Void visitProcessingInstruction(MarkupEvent.ProcessingInstruction event) {
			theHandler.handleProcessingInstruction(event.getTarget(), event.getValue());
			return null;
		}

		@Override
		public Void visitDoctype(MarkupEvent.Doctype event) {
			theHandler.handleDoctype(event.getValue());
			return null;
		}

		@Override
		public Void visitComment(MarkupEvent.Comment event) {
			theHandler.handleComment(event.getValue());
			return null;
		}

		@Override
		public Void visitParseError(MarkupEvent.ParseError event) {
			theHandler.handleParseError(event.getPosition());
			return null;
		}
	}
}
