package org.quarkup.tree;

/** The types of {@link MarkupNode}s in a markup tree */
public enum MarkupNodeType {
	/** The root of a parsed document */
	DOCUMENT,
	/** An element, which may have attributes and children */
	ELEMENT,
	/** An attribute of an element */
	ATTRIBUTE,
	/** Character data, from text or CDATA sections */
	TEXT,
	/** A comment */
	COMMENT,
	/** A processing instruction, named by its target */
	PROCESSING_INSTRUCTION,
	/** A document type declaration */
	DOCUMENT_TYPE;

	/** @return Whether nodes of this type may have children */
	public boolean isContainer() {
		return this == DOCUMENT || this == ELEMENT;
	}
}
