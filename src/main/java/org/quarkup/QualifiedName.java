package org.quarkup;

import java.util.Objects;

/**
 * A possibly-prefixed name of an element, attribute or processing instruction target, e.g. <code>ns1:attr1</code>. Namespaces are not
 * resolved; the prefix is just the part of the name before the first colon.
 */
public final class QualifiedName implements Named {
	/** Separates the prefix from the local name */
	public static final char PREFIX_SEPARATOR = ':';

	private final String theName;
	private final String thePrefix;
	private final String theLocalName;

	private QualifiedName(String name, String prefix, String localName) {
		theName = name;
		thePrefix = prefix;
		theLocalName = localName;
	}

	/**
	 * @param name The qualified name text
	 * @return The parsed name
	 */
	public static QualifiedName parse(String name) {
		Objects.requireNonNull(name, "Name cannot be null");
		if (name.isEmpty())
			throw new IllegalArgumentException("Name cannot be empty");
		int sep = name.indexOf(PREFIX_SEPARATOR);
		// A leading colon is part of the local name, not an empty prefix
		if (sep <= 0)
			return new QualifiedName(name, null, name);
		return new QualifiedName(name, name.substring(0, sep), name.substring(sep + 1));
	}

	/** @return The full qualified text of this name */
	@Override
	public String getName() {
		return theName;
	}

	/** @return The prefix of this name, or null if it has none */
	public String getPrefix() {
		return thePrefix;
	}

	/** @return The part of this name after the prefix */
	public String getLocalName() {
		return theLocalName;
	}

	@Override
	public int hashCode() {
		return theName.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof QualifiedName && theName.equals(((QualifiedName) obj).theName);
	}

	@Override
	public String toString() {
		return theName;
	}
}
