package org.quarkup.io;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import org.quarkup.MarkupAttribute;
import org.quarkup.QualifiedName;

/** A handler to be notified for each item of content in markup text by a {@link MarkupEventDispatcher}. All methods default to no-ops. */
public interface MarkupEventHandler {
	/** Called once before anything else */
	default void handleStartDocument() {
	}

	/** Called once after everything else */
	default void handleEndDocument() {
	}

	/**
	 * Called when an element's start tag is encountered. For a self-closing element, {@link #handleEndElement(QualifiedName)} is called
	 * immediately afterward.
	 *
	 * @param name The name of the element
	 * @param attributes The element's attributes, in declaration order
	 */
	default void handleStartElement(QualifiedName name, List<MarkupAttribute> attributes) {
	}

	/**
	 * Called when an element is closed
	 *
	 * @param name The name of the element
	 */
	default void handleEndElement(QualifiedName name) {
	}

	/**
	 * Called for text and for the content of CDATA sections
	 *
	 * @param text The character data
	 */
	default void handleCharacterData(String text) {
	}

	/**
	 * Called when a processing instruction is encountered: <code>&lt;?TARGET?></code> or <code>&lt;?TARGET TEXT?></code>.
	 *
	 * @param target The processing instruction's target
	 * @param text The processing instruction's text, empty if there was none
	 */
	default void handleProcessingInstruction(String target, String text) {
	}

	/**
	 * Called when a document type declaration is encountered
	 *
	 * @param text The content of the declaration
	 */
	default void handleDoctype(String text) {
	}

	/**
	 * Called when a comment is encountered
	 *
	 * @param comment The text of the comment
	 */
	default void handleComment(String comment) {
	}

	/**
	 * Called for each character of malformed markup that is skipped
	 *
	 * @param position The position of the skipped character
	 */
	default void handleParseError(FilePosition position) {
	}

	/** @return A builder to assemble a handler from functions */
	static Builder build() {
		return new Builder();
	}

	/** Assembles a {@link MarkupEventHandler} from functions. Any function not given is a no-op. */
	class Builder {
		private Runnable theStartDocument;
		private Runnable theEndDocument;
		private BiConsumer<? super QualifiedName, ? super List<MarkupAttribute>> theStartElement;
		private Consumer<? super QualifiedName> theEndElement;
		private Consumer<? super String> theCharacterData;
		private BiConsumer<? super String, ? super String> theProcessingInstruction;
		private Consumer<? super String> theDoctype;
		private Consumer<? super String> theComment;
		private Consumer<? super FilePosition> theParseError;

		Builder() {
		}

		/**
		 * @param onStartDocument Called before anything else
		 * @return This builder
		 */
		public Builder onStartDocument(Runnable onStartDocument) {
			theStartDocument = onStartDocument;
			return this;
		}

		/**
		 * @param onEndDocument Called after everything else
		 * @return This builder
		 */
		public Builder onEndDocument(Runnable onEndDocument) {
			theEndDocument = onEndDocument;
			return this;
		}

		/**
		 * @param onStartElement Accepts the name and attributes of each element start
		 * @return This builder
		 */
		public Builder onStartElement(BiConsumer<? super QualifiedName, ? super List<MarkupAttribute>> onStartElement) {
			theStartElement = onStartElement;
			return this;
		}

		/**
		 * @param onEndElement Accepts the name of each element end
		 * @return This builder
		 */
		public Builder onEndElement(Consumer<? super QualifiedName> onEndElement) {
			theEndElement = onEndElement;
			return this;
		}

		/**
		 * @param onCharacterData Accepts text and CDATA content
		 * @return This builder
		 */
		public Builder onCharacterData(Consumer<? super String> onCharacterData) {
			theCharacterData = onCharacterData;
			return this;
		}

		/**
		 * @param onProcessingInstruction Accepts the target and text of each processing instruction
		 * @return This builder
		 */
		public Builder onProcessingInstruction(BiConsumer<? super String, ? super String> onProcessingInstruction) {
			theProcessingInstruction = onProcessingInstruction;
			return this;
		}

		/**
		 * @param onDoctype Accepts the content of each document type declaration
		 * @return This builder
		 */
		public Builder onDoctype(Consumer<? super String> onDoctype) {
			theDoctype = onDoctype;
			return this;
		}

		/**
		 * @param onComment Accepts the text of each comment
		 * @return This builder
		 */
		public Builder onComment(Consumer<? super String> onComment) {
			theComment = onComment;
			return this;
		}

		/**
		 * @param onParseError Accepts the position of each skipped character of malformed markup
		 * @return This builder
		 */
		public Builder onParseError(Consumer<? super FilePosition> onParseError) {
			theParseError = onParseError;
			return this;
		}

		/** @return The assembled handler */
		public MarkupEventHandler build() {
			Runnable startDocument = theStartDocument;
			Runnable endDocument = theEndDocument;
			BiConsumer<? super QualifiedName, ? super List<MarkupAttribute>> startElement = theStartElement;
			Consumer<? super QualifiedName> endElement = theEndElement;
			Consumer<? super String> characterData = theCharacterData;
			BiConsumer<? super String, ? super String> processingInstruction = theProcessingInstruction;
			Consumer<? super String> doctype = theDoctype;
			Consumer<? super String> comment = theComment;
			Consumer<? super FilePosition> parseError = theParseError;
			return new MarkupEventHandler() {
				@Override
				public void handleStartDocument() {
					if (startDocument != null)
						startDocument.run();
				}

				@Override
				public void handleEndDocument() {
					if (endDocument != null)
						endDocument.run();
				}

				@Override
				public void handleStartElement(QualifiedName name, List<MarkupAttribute> attributes) {
					if (startElement != null)
						startElement.accept(name, attributes);
				}

				@Override
				public void handleEndElement(QualifiedName name) {
					if (endElement != null)
						endElement.accept(name);
				}

				@Override
				public void handleCharacterData(String text) {
					if (characterData != null)
						characterData.accept(text);
				}

				@Override
				public void handleProcessingInstruction(String target, String text) {
					if (processingInstruction != null)
						processingInstruction.accept(target, text);
				}

				@Override
				public void handleDoctype(String text) {
					if (doctype != null)
						doctype.accept(text);
				}

				@Override
				public void handleComment(String text) {
					if (comment != null)
						comment.accept(text);
				}

				@Override
				public void handleParseError(FilePosition position) {
					if (parseError != null)
						parseError.accept(position);
				}
			};
		}
	}
}
