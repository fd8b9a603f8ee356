package org.quarkup;

import java.util.Objects;

/** An attribute declared in an element's start tag */
public final class MarkupAttribute implements Named {
	private final QualifiedName theName;
	private final String theValue;

	/**
	 * @param name The name of the attribute
	 * @param value The value of the attribute, with any entity references already decoded
	 */
	public MarkupAttribute(QualifiedName name, String value) {
		theName = Objects.requireNonNull(name, "Attribute name cannot be null");
		theValue = Objects.requireNonNull(value, "Attribute value cannot be null");
	}

	/**
	 * @param name The name of the attribute
	 * @param value The value of the attribute
	 */
	public MarkupAttribute(String name, String value) {
		this(QualifiedName.parse(name), value);
	}

	@Override
	public String getName() {
		return theName.getName();
	}

	/** @return The name of the attribute */
	public QualifiedName getQualifiedName() {
		return theName;
	}

	/** @return The decoded value of the attribute */
	public String getValue() {
		return theValue;
	}

	@Override
	public int hashCode() {
		return theName.hashCode() * 31 + theValue.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof MarkupAttribute))
			return false;
		MarkupAttribute other = (MarkupAttribute) obj;
		return theName.equals(other.theName) && theValue.equals(other.theValue);
	}

	@Override
	public String toString() {
		return theName + "=\"" + theValue + "\"";
	}
}
