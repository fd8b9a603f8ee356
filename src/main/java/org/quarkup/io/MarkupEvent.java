package org.quarkup.io;

import java.util.List;

import org.quarkup.MarkupAttribute;
import org.quarkup.QualifiedName;

/**
 * An event produced by a {@link MarkupEventDispatcher}. The set of event types is closed: every event is one of the nested classes of this
 * type, and {@link #accept(Visitor)} dispatches to the matching method of a {@link Visitor}, all of which must be implemented.
 */
public abstract class MarkupEvent {
	/**
	 * Matches each type of {@link MarkupEvent}
	 *
	 * @param <R> The type of result produced
	 */
	public interface Visitor<R> {
		/**
		 * @param event The start document event
		 * @return The result for the event
		 */
		R visitStartDocument(StartDocument event);

		/**
		 * @param event The end document event
		 * @return The result for the event
		 */
		R visitEndDocument(EndDocument event);

		/**
		 * @param event The start element event
		 * @return The result for the event
		 */
		R visitStartElement(StartElement event);

		/**
		 * @param event The end element event
		 * @return The result for the event
		 */
		R visitEndElement(EndElement event);

		/**
		 * @param event The character data event
		 * @return The result for the event
		 */
		R visitCharacters(Characters event);

		/**
		 * @param event The processing instruction event
		 * @return The result for the event
		 */
		R visitProcessingInstruction(ProcessingInstruction event);

		/**
		 * @param event The document type event
		 * @return The result for the event
		 */
		R visitDoctype(Doctype event);

		/**
		 * @param event The comment event
		 * @return The result for the event
		 */
		R visitComment(Comment event);

		/**
		 * @param event The parse error event
		 * @return The result for the event
		 */
		R visitParseError(ParseError event);
	}

	private MarkupEvent() {
	}

	/**
	 * @param <R> The type of result produced by the visitor
	 * @param visitor The visitor to dispatch this event to
	 * @return The visitor's result for this event
	 */
	public abstract <R> R accept(Visitor<R> visitor);

	/** Produced once before any other event */
	public static final class StartDocument extends MarkupEvent {
		/** The singleton start document event */
		public static final StartDocument INSTANCE = new StartDocument();

		private StartDocument() {
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStartDocument(this);
		}

		@Override
		public String toString() {
			return "startDocument";
		}
	}

	/** Produced once after all other events */
	public static final class EndDocument extends MarkupEvent {
		/** The singleton end document event */
		public static final EndDocument INSTANCE = new EndDocument();

		private EndDocument() {
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitEndDocument(this);
		}

		@Override
		public String toString() {
			return "endDocument";
		}
	}

	/** Produced for an element's start tag */
	public static final class StartElement extends MarkupEvent {
		private final QualifiedName theName;
		private final List<MarkupAttribute> theAttributes;
		private final boolean isSelfClosing;
		private final int theDepth;

		/**
		 * @param name The name of the element
		 * @param attributes The element's attributes
		 * @param selfClosing Whether the element is self-closing
		 * @param depth The depth of the element, 1 for a root element
		 */
		public StartElement(QualifiedName name, List<MarkupAttribute> attributes, boolean selfClosing, int depth) {
			theName = name;
			theAttributes = attributes;
			isSelfClosing = selfClosing;
			theDepth = depth;
		}

		/** @return The name of the element */
		public QualifiedName getName() {
			return theName;
		}

		/** @return The element's attributes, in declaration order */
		public List<MarkupAttribute> getAttributes() {
			return theAttributes;
		}

		/** @return Whether the element is self-closing, in which case an {@link EndElement} follows immediately */
		public boolean isSelfClosing() {
			return isSelfClosing;
		}

		/** @return The depth of the element, 1 for a root element */
		public int getDepth() {
			return theDepth;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStartElement(this);
		}

		@Override
		public String toString() {
			return "start(" + theName + ")@" + theDepth;
		}
	}

	/** Produced for an element's end tag, or directly after the {@link StartElement} of a self-closing element */
	public static final class EndElement extends MarkupEvent {
		private final QualifiedName theName;
		private final int theDepth;
		private final boolean isSynthetic;

		/**
		 * @param name The name of the element
		 * @param depth The depth after the element is closed, i.e. the depth of its parent
		 * @param synthetic Whether this event closes a self-closing element rather than representing an end tag
		 */
		public EndElement(QualifiedName name, int depth, boolean synthetic) {
			theName = name;
			theDepth = depth;
			isSynthetic = synthetic;
		}

		/** @return The name of the element */
		public QualifiedName getName() {
			return theName;
		}

		/** @return The depth after the element is closed, i.e. the depth of its parent */
		public int getDepth() {
			return theDepth;
		}

		/** @return Whether this event closes a self-closing element rather than representing an end tag */
		public boolean isSynthetic() {
			return isSynthetic;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitEndElement(this);
		}

		@Override
		public String toString() {
			return "end(" + theName + ")@" + theDepth;
		}
	}

	/** Produced for text and CDATA sections */
	public static final class Characters extends MarkupEvent {
		private final String theValue;
		private final boolean isCData;

		/**
		 * @param value The character data
		 * @param cdata Whether the data came from a CDATA section
		 */
		public Characters(String value, boolean cdata) {
			theValue = value;
			isCData = cdata;
		}

		/** @return The character data */
		public String getValue() {
			return theValue;
		}

		/** @return Whether the data came from a CDATA section */
		public boolean isCData() {
			return isCData;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCharacters(this);
		}

		@Override
		public String toString() {
			return (isCData ? "cdata('" : "text('") + theValue + "')";
		}
	}

	/** Produced for a processing instruction */
	public static final class ProcessingInstruction extends MarkupEvent {
		private final String theTarget;
		private final String theValue;

		/**
		 * @param target The processing instruction's target
		 * @param value The processing instruction's text
		 */
		public ProcessingInstruction(String target, String value) {
			theTarget = target;
			theValue = value;
		}

		/** @return The processing instruction's target */
		public String getTarget() {
			return theTarget;
		}

		/** @return The processing instruction's text, empty if there was none */
		public String getValue() {
			return theValue;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitProcessingInstruction(this);
		}

		@Override
		public String toString() {
			return "pi(" + theTarget + ", '" + theValue + "')";
		}
	}

	/** Produced for a document type declaration */
	public static final class Doctype extends MarkupEvent {
		private final String theValue;

		/** @param value The content of the declaration */
		public Doctype(String value) {
			theValue = value;
		}

		/** @return The content of the declaration */
		public String getValue() {
			return theValue;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitDoctype(this);
		}

		@Override
		public String toString() {
			return "doctype('" + theValue + "')";
		}
	}

	/** Produced for a comment */
	public static final class Comment extends MarkupEvent {
		private final String theValue;

		/** @param value The text of the comment */
		public Comment(String value) {
			theValue = value;
		}

		/** @return The text of the comment */
		public String getValue() {
			return theValue;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitComment(this);
		}

		@Override
		public String toString() {
			return "comment('" + theValue + "')";
		}
	}

	/** Produced for each character of malformed markup that is skipped */
	public static final class ParseError extends MarkupEvent {
		private final FilePosition thePosition;

		/** @param position The position of the skipped character */
		public ParseError(FilePosition position) {
			thePosition = position;
		}

		/** @return The position of the skipped character */
		public FilePosition getPosition() {
			return thePosition;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitParseError(this);
		}

		@Override
		public String toString() {
			return "error@" + thePosition.getPosition();
		}
	}
}
