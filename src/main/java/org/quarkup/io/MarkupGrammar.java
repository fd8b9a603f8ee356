package org.quarkup.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.quarkup.MarkupAttribute;
import org.quarkup.QualifiedName;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * <p>
 * The lexical grammar of markup text, expressed as a set of {@link Recognizer recognizers}. Each recognizer is given a buffer and a
 * position and either matches the structure starting exactly at that position or fails. Recognizers never throw for malformed input and
 * never look behind the given position.
 * </p>
 * <p>
 * This grammar is deliberately lenient about where structures may occur (e.g. text before the root element, several root elements). It
 * does not resolve namespaces and it does not support parsed entities or external references of any kind.
 * </p>
 * <p>
 * Grammars are immutable. {@link #withNamedEntity(String, String)} and {@link #withNamedEntities(Map)} return modified copies.
 * </p>
 */
public final class MarkupGrammar {
	/** Constant for the declaration of the beginning of an element start tag */
	public static final String ELEMENT_START = "<";
	/** Constant for the declaration of the beginning of an element end tag */
	public static final String ELEMENT_END_START = "</";
	/** Constant for the declaration of the end of a start or end tag */
	public static final String TAG_END = ">";
	/** Constant for the declaration of the end of a self-closing element's tag */
	public static final String SELF_CLOSING_END = "/>";
	/** Constant for the declaration of the beginning of a comment */
	public static final String COMMENT_START = "<!--";
	/** Constant for the declaration of the end of a comment */
	public static final String COMMENT_END = "-->";
	/** Constant for the declaration of the beginning of a CDATA section */
	public static final String CDATA_START = "<![CDATA[";
	/** Constant for the declaration of the end of a CDATA section */
	public static final String CDATA_END = "]]>";
	/** Constant for the declaration of the beginning of a processing instruction */
	public static final String PROCESSING_INSTRUCTION_BEGIN = "<?";
	/** Constant for the declaration of the end of a processing instruction */
	public static final String PROCESSING_INSTRUCTION_END = "?>";
	/** Constant for the declaration of the beginning of a document type declaration */
	public static final String DOCTYPE_START = "<!DOCTYPE";
	/** Constant for the declaration of a named entity */
	public static final String NAMED_ENTITY_PREFIX = "&";
	/** Constant for the declaration of a numerically-specified character in decimal notation */
	public static final String DECIMAL_ENTITY_PREFIX = "&#";
	/** Constant for the declaration of a numerically-specified character in hexadecimal notation */
	public static final String HEX_ENTITY_PREFIX = "&#x";
	/** Constant for the termination of any entity reference */
	public static final char ENTITY_END = ';';
	/** Standard named entities in XML by their representation (e.g. "amp" for "&amp;", specified by "&amp;amp;") */
	public static final Map<String, String> STANDARD_NAMED_ENTITIES = ImmutableMap.<String, String> builder()//
		.put("quot", "\"")//
		.put("amp", "&")//
		.put("apos", "'")//
		.put("gt", ">")//
		.put("lt", "<")//
		.build();

	/** A grammar recognizing only the {@link #STANDARD_NAMED_ENTITIES standard named entities} */
	public static final MarkupGrammar STANDARD = new MarkupGrammar(STANDARD_NAMED_ENTITIES);

	/**
	 * The result of a {@link Recognizer}: either a structured value with the position just after the recognized structure, or a failure
	 *
	 * @param <T> The type of the structured value
	 */
	public static final class Match<T> {
		private static final Match<?> FAILURE = new Match<>(null, -1);

		private final T theValue;
		private final int thePosition;

		private Match(T value, int position) {
			theValue = value;
			thePosition = position;
		}

		/**
		 * @param <T> The type of the value
		 * @param value The structured value recognized
		 * @param position The position just after the recognized structure
		 * @return A successful match
		 */
		public static <T> Match<T> success(T value, int position) {
			return new Match<>(Objects.requireNonNull(value, "Value cannot be null"), position);
		}

		/**
		 * @param <T> The type of the value
		 * @return The failed match
		 */
		public static <T> Match<T> failure() {
			return (Match<T>) FAILURE;
		}

		/** @return Whether the structure was recognized */
		public boolean isSuccess() {
			return thePosition >= 0;
		}

		/** @return The structured value recognized, or null for a failure */
		public T getValue() {
			return theValue;
		}

		/** @return The position just after the recognized structure, or -1 for a failure */
		public int getPosition() {
			return thePosition;
		}

		@Override
		public String toString() {
			return isSuccess() ? theValue + "@" + thePosition : "failure";
		}
	}

	/**
	 * Recognizes a single kind of markup structure
	 *
	 * @param <T> The type of the structured value produced
	 */
	@FunctionalInterface
	public interface Recognizer<T> {
		/**
		 * @param buffer The text to recognize the structure in
		 * @param position The position at which the structure must start
		 * @return The match, or {@link Match#failure()} if the structure does not start at the given position
		 */
		Match<T> recognize(CharSequence buffer, int position);
	}

	/** An element's start tag, e.g. <code>&lt;element attr="value"></code> or <code>&lt;element /></code> */
	public static final class StartTag {
		private final QualifiedName theName;
		private final List<MarkupAttribute> theAttributes;
		private final boolean isSelfClosing;

		/**
		 * @param name The name of the element
		 * @param attributes The attributes declared in the tag, in declaration order
		 * @param selfClosing Whether the tag ended with <code>/></code>
		 */
		public StartTag(QualifiedName name, List<MarkupAttribute> attributes, boolean selfClosing) {
			theName = name;
			theAttributes = ImmutableList.copyOf(attributes);
			isSelfClosing = selfClosing;
		}

		/** @return The name of the element */
		public QualifiedName getName() {
			return theName;
		}

		/** @return The attributes declared in the tag, in declaration order */
		public List<MarkupAttribute> getAttributes() {
			return theAttributes;
		}

		/** @return Whether the tag ended with <code>/></code> */
		public boolean isSelfClosing() {
			return isSelfClosing;
		}

		@Override
		public String toString() {
			return "<" + theName + (theAttributes.isEmpty() ? "" : " " + theAttributes) + (isSelfClosing ? "/>" : ">");
		}
	}

	/** An element's end tag, e.g. <code>&lt;/element></code> */
	public static final class EndTag {
		private final QualifiedName theName;

		/** @param name The name of the element */
		public EndTag(QualifiedName name) {
			theName = name;
		}

		/** @return The name of the element */
		public QualifiedName getName() {
			return theName;
		}

		@Override
		public String toString() {
			return "</" + theName + ">";
		}
	}

	/** A processing instruction, <code>&lt;?TARGET?></code> or <code>&lt;?TARGET TEXT?></code> */
	public static final class ProcessingInstructionToken {
		private final String theTarget;
		private final String theText;

		/**
		 * @param target The processing instruction's target
		 * @param text The processing instruction's text, empty if there was none
		 */
		public ProcessingInstructionToken(String target, String text) {
			theTarget = target;
			theText = text;
		}

		/** @return The processing instruction's target */
		public String getTarget() {
			return theTarget;
		}

		/** @return The processing instruction's text, empty if there was none */
		public String getText() {
			return theText;
		}

		@Override
		public String toString() {
			return "<?" + theTarget + (theText.isEmpty() ? "" : " " + theText) + "?>";
		}
	}

	private final ImmutableMap<String, String> theNamedEntities;

	private final Recognizer<String> theCharacterData = this::recognizeCharacterData;
	private final Recognizer<StartTag> theElementStart = this::recognizeElementStart;
	private final Recognizer<EndTag> theElementEnd = MarkupGrammar::recognizeElementEnd;
	private final Recognizer<String> theComment = (buffer, position) -> recognizeDelimited(buffer, position, COMMENT_START, COMMENT_END);
	private final Recognizer<String> theCdata = (buffer, position) -> recognizeDelimited(buffer, position, CDATA_START, CDATA_END);
	private final Recognizer<ProcessingInstructionToken> theProcessingInstruction = MarkupGrammar::recognizeProcessingInstruction;
	private final Recognizer<String> theDoctype = MarkupGrammar::recognizeDoctype;

	private MarkupGrammar(Map<String, String> namedEntities) {
		theNamedEntities = ImmutableMap.copyOf(namedEntities);
	}

	/** @return The named entities (by name, without the <code>&amp;</code> and <code>;</code>) that this grammar decodes */
	public Map<String, String> getNamedEntities() {
		return theNamedEntities;
	}

	/**
	 * @param name The name of the entity (e.g. "nbsp" for "&amp;nbsp;")
	 * @param sequence The character sequence to replace the entity reference with
	 * @return A grammar identical to this one, but which also decodes the given entity
	 */
	public MarkupGrammar withNamedEntity(String name, String sequence) {
		return withNamedEntities(ImmutableMap.of(name, sequence));
	}

	/**
	 * @param entities The entities to decode, by name
	 * @return A grammar identical to this one, but which also decodes the given entities
	 */
	public MarkupGrammar withNamedEntities(Map<String, String> entities) {
		Map<String, String> newEntities = new LinkedHashMap<>(theNamedEntities);
		for (Map.Entry<String, String> entity : entities.entrySet()) {
			String name = entity.getKey();
			if (name.isEmpty() || !isNameStart(name.charAt(0)))
				throw new IllegalArgumentException("Illegal entity name: '" + name + "'");
			for (int i = 1; i < name.length(); i++) {
				if (!isNameChar(name.charAt(i)))
					throw new IllegalArgumentException("Illegal entity name: '" + name + "'");
			}
			if (entity.getValue() == null)
				throw new NullPointerException("Entity value cannot be null");
			newEntities.put(name, entity.getValue());
		}
		return new MarkupGrammar(newEntities);
	}

	/**
	 * @return The recognizer for character data: any run of characters up to the next <code>&lt;</code>, with entity references decoded.
	 *         The run ends before any malformed or unknown entity reference.
	 */
	public Recognizer<String> characterData() {
		return theCharacterData;
	}

	/** @return The recognizer for element start tags, including self-closing ones */
	public Recognizer<StartTag> elementStart() {
		return theElementStart;
	}

	/** @return The recognizer for element end tags */
	public Recognizer<EndTag> elementEnd() {
		return theElementEnd;
	}

	/** @return The recognizer for comments, whose value is the text between the delimiters */
	public Recognizer<String> comment() {
		return theComment;
	}

	/** @return The recognizer for CDATA sections, whose value is the raw text between the delimiters */
	public Recognizer<String> cdata() {
		return theCdata;
	}

	/** @return The recognizer for processing instructions */
	public Recognizer<ProcessingInstructionToken> processingInstruction() {
		return theProcessingInstruction;
	}

	/** @return The recognizer for document type declarations, whose value is the declaration's content after the keyword */
	public Recognizer<String> doctype() {
		return theDoctype;
	}

	private Match<String> recognizeCharacterData(CharSequence buffer, int position) {
		StringBuilder decoded = null;
		int runStart = position;
		int i = position;
		while (i < buffer.length()) {
			char ch = buffer.charAt(i);
			if (ch == '<')
				break;
			else if (ch == '&') {
				StringBuilder reference = new StringBuilder();
				int end = decodeReference(buffer, i, reference);
				if (end < 0)
					break; // The run ends before the reference
				if (decoded == null)
					decoded = new StringBuilder();
				decoded.append(buffer, runStart, i).append(reference);
				i = runStart = end;
			} else
				i++;
		}
		if (i == position)
			return Match.failure();
		if (decoded == null)
			return Match.success(buffer.subSequence(position, i).toString(), i);
		decoded.append(buffer, runStart, i);
		return Match.success(decoded.toString(), i);
	}

	private Match<StartTag> recognizeElementStart(CharSequence buffer, int position) {
		if (!startsWith(buffer, position, ELEMENT_START))
			return Match.failure();
		int nameStart = position + ELEMENT_START.length();
		int i = scanName(buffer, nameStart);
		if (i < 0)
			return Match.failure();
		QualifiedName name = QualifiedName.parse(buffer.subSequence(nameStart, i).toString());
		List<MarkupAttribute> attributes = new ArrayList<>();
		while (true) {
			int attrStart = skipWhitespace(buffer, i);
			if (attrStart == i)
				break; // Attributes must be separated by white space
			int attrEnd = recognizeAttribute(buffer, attrStart, attributes);
			if (attrEnd < 0) {
				i = attrStart; // Just trailing white space
				break;
			}
			i = attrEnd;
		}
		i = skipWhitespace(buffer, i);
		if (startsWith(buffer, i, SELF_CLOSING_END))
			return Match.success(new StartTag(name, attributes, true), i + SELF_CLOSING_END.length());
		else if (startsWith(buffer, i, TAG_END))
			return Match.success(new StartTag(name, attributes, false), i + TAG_END.length());
		else
			return Match.failure();
	}

	/** @return The position after the attribute, or -1 if no well-formed attribute starts at the position */
	private int recognizeAttribute(CharSequence buffer, int position, List<MarkupAttribute> attributes) {
		int i = scanName(buffer, position);
		if (i < 0)
			return -1;
		String name = buffer.subSequence(position, i).toString();
		i = skipWhitespace(buffer, i);
		if (i == buffer.length() || buffer.charAt(i) != '=')
			return -1;
		i = skipWhitespace(buffer, i + 1);
		if (i == buffer.length())
			return -1;
		char quote = buffer.charAt(i);
		if (quote != '"' && quote != '\'')
			return -1;
		StringBuilder value = new StringBuilder();
		i++;
		while (true) {
			if (i == buffer.length())
				return -1;
			char ch = buffer.charAt(i);
			if (ch == quote)
				break;
			else if (ch == '<')
				return -1;
			else if (ch == '&') {
				i = decodeReference(buffer, i, value);
				if (i < 0)
					return -1;
			} else {
				value.append(ch);
				i++;
			}
		}
		attributes.add(new MarkupAttribute(QualifiedName.parse(name), value.toString()));
		return i + 1;
	}

	private static Match<EndTag> recognizeElementEnd(CharSequence buffer, int position) {
		if (!startsWith(buffer, position, ELEMENT_END_START))
			return Match.failure();
		int nameStart = position + ELEMENT_END_START.length();
		int i = scanName(buffer, nameStart);
		if (i < 0)
			return Match.failure();
		QualifiedName name = QualifiedName.parse(buffer.subSequence(nameStart, i).toString());
		i = skipWhitespace(buffer, i);
		if (!startsWith(buffer, i, TAG_END))
			return Match.failure();
		return Match.success(new EndTag(name), i + TAG_END.length());
	}

	private static Match<String> recognizeDelimited(CharSequence buffer, int position, String start, String end) {
		if (!startsWith(buffer, position, start))
			return Match.failure();
		int contentStart = position + start.length();
		int contentEnd = indexOf(buffer, end, contentStart);
		if (contentEnd < 0)
			return Match.failure();
		return Match.success(buffer.subSequence(contentStart, contentEnd).toString(), contentEnd + end.length());
	}

	private static Match<ProcessingInstructionToken> recognizeProcessingInstruction(CharSequence buffer, int position) {
		if (!startsWith(buffer, position, PROCESSING_INSTRUCTION_BEGIN))
			return Match.failure();
		int targetStart = position + PROCESSING_INSTRUCTION_BEGIN.length();
		int i = scanName(buffer, targetStart);
		if (i < 0)
			return Match.failure();
		String target = buffer.subSequence(targetStart, i).toString();
		int textStart = skipWhitespace(buffer, i);
		if (textStart == i) { // No text
			if (!startsWith(buffer, i, PROCESSING_INSTRUCTION_END))
				return Match.failure();
			return Match.success(new ProcessingInstructionToken(target, ""), i + PROCESSING_INSTRUCTION_END.length());
		}
		int textEnd = indexOf(buffer, PROCESSING_INSTRUCTION_END, textStart);
		if (textEnd < 0)
			return Match.failure();
		return Match.success(new ProcessingInstructionToken(target, buffer.subSequence(textStart, textEnd).toString()),
			textEnd + PROCESSING_INSTRUCTION_END.length());
	}

	private static Match<String> recognizeDoctype(CharSequence buffer, int position) {
		if (!startsWith(buffer, position, DOCTYPE_START))
			return Match.failure();
		int keywordEnd = position + DOCTYPE_START.length();
		int contentStart = skipWhitespace(buffer, keywordEnd);
		if (contentStart == keywordEnd)
			return Match.failure();
		char quote = 0;
		int subsetDepth = 0;
		for (int i = contentStart; i < buffer.length(); i++) {
			char ch = buffer.charAt(i);
			if (quote != 0) {
				if (ch == quote)
					quote = 0;
			} else if (ch == '"' || ch == '\'')
				quote = ch;
			else if (ch == '[')
				subsetDepth++;
			else if (ch == ']' && subsetDepth > 0)
				subsetDepth--;
			else if (ch == '>' && subsetDepth == 0) {
				int contentEnd = i;
				while (contentEnd > contentStart && Character.isWhitespace(buffer.charAt(contentEnd - 1)))
					contentEnd--;
				return Match.success(buffer.subSequence(contentStart, contentEnd).toString(), i + 1);
			}
		}
		return Match.failure();
	}

	/**
	 * Decodes an entity reference starting with the <code>&amp;</code> at the given position
	 *
	 * @param buffer The text containing the reference
	 * @param position The position of the <code>&amp;</code>
	 * @param decoded The builder to append the decoded characters to. Nothing is appended if the reference is malformed.
	 * @return The position after the terminal <code>;</code>, or -1 if the reference is malformed or unknown
	 */
	private int decodeReference(CharSequence buffer, int position, StringBuilder decoded) {
		int i;
		if (startsWith(buffer, position, HEX_ENTITY_PREFIX)) {
			i = position + HEX_ENTITY_PREFIX.length();
			int code = 0, count = 0;
			for (int hex = hex(buffer, i); hex >= 0; hex = hex(buffer, ++i)) {
				code = code * 16 + hex;
				if (code > Character.MAX_CODE_POINT)
					return -1;
				count++;
			}
			if (count == 0 || i == buffer.length() || buffer.charAt(i) != ENTITY_END)
				return -1;
			decoded.appendCodePoint(code);
		} else if (startsWith(buffer, position, DECIMAL_ENTITY_PREFIX)) {
			i = position + DECIMAL_ENTITY_PREFIX.length();
			int code = 0, count = 0;
			for (; i < buffer.length() && buffer.charAt(i) >= '0' && buffer.charAt(i) <= '9'; i++) {
				code = code * 10 + buffer.charAt(i) - '0';
				if (code > Character.MAX_CODE_POINT)
					return -1;
				count++;
			}
			if (count == 0 || i == buffer.length() || buffer.charAt(i) != ENTITY_END)
				return -1;
			decoded.appendCodePoint(code);
		} else {
			int nameStart = position + NAMED_ENTITY_PREFIX.length();
			i = scanName(buffer, nameStart);
			if (i < 0 || i == buffer.length() || buffer.charAt(i) != ENTITY_END)
				return -1;
			String content = theNamedEntities.get(buffer.subSequence(nameStart, i).toString());
			if (content == null)
				return -1;
			decoded.append(content);
		}
		return i + 1;
	}

	private static int hex(CharSequence buffer, int position) {
		if (position >= buffer.length())
			return -1;
		char ch = buffer.charAt(position);
		if (ch >= '0' && ch <= '9')
			return ch - '0';
		else if (ch >= 'a' && ch <= 'f')
			return ch - 'a' + 10;
		else if (ch >= 'A' && ch <= 'F')
			return ch - 'A' + 10;
		else
			return -1;
	}

	static boolean isNameStart(char ch) {
		return ch == '_' || ch == ':' || Character.isLetter(ch);
	}

	static boolean isNameChar(char ch) {
		switch (ch) {
		case '-':
		case '_':
		case '.':
		case ':':
			return true;
		default:
			return Character.isLetter(ch) || Character.isDigit(ch);
		}
	}

	/** @return The position after the name starting at the given position, or -1 if no name starts there */
	static int scanName(CharSequence buffer, int position) {
		if (position >= buffer.length() || !isNameStart(buffer.charAt(position)))
			return -1;
		int i = position + 1;
		while (i < buffer.length() && isNameChar(buffer.charAt(i)))
			i++;
		return i;
	}

	static int skipWhitespace(CharSequence buffer, int position) {
		int i = position;
		while (i < buffer.length() && Character.isWhitespace(buffer.charAt(i)))
			i++;
		return i;
	}

	static boolean startsWith(CharSequence buffer, int position, String prefix) {
		if (position + prefix.length() > buffer.length())
			return false;
		for (int i = 0; i < prefix.length(); i++) {
			if (buffer.charAt(position + i) != prefix.charAt(i))
				return false;
		}
		return true;
	}

	static int indexOf(CharSequence buffer, String target, int from) {
		int last = buffer.length() - target.length();
		for (int i = from; i <= last; i++) {
			if (startsWith(buffer, i, target))
				return i;
		}
		return -1;
	}
}
