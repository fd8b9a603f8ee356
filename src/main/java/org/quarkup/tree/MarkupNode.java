package org.quarkup.tree;

import java.util.List;

import org.quarkup.QualifiedName;

import com.google.common.collect.FluentIterable;

/**
 * A node in a markup tree. Nodes are read-only; the tree's structure is exposed through {@link #getParent()}, {@link #getChildren()} and
 * {@link #getAttributes()}, from which the {@link MarkupAxes axes} are computed.
 */
public interface MarkupNode {
	/** @return The type of this node */
	MarkupNodeType getType();

	/** @return The name of this node, if it is an element, attribute or processing instruction, or null */
	QualifiedName getName();

	/** @return The text value of this node, if it is an attribute, text, comment, processing instruction or doctype, or null */
	String getValue();

	/** @return This node's parent (an attribute's owning element), or null if this is the root */
	MarkupNode getParent();

	/** @return This node's children, in order. Empty for nodes that are not {@link MarkupNodeType#isContainer() containers}. */
	List<MarkupNode> getChildren();

	/** @return This element's attributes, in declaration order. Empty for nodes that are not elements. */
	List<MarkupNode> getAttributes();

	/** @return This node's ancestors, nearest first */
	default FluentIterable<MarkupNode> ancestors() {
		return MarkupAxes.ancestors(this);
	}

	/** @return All nodes in this node's subtree except itself, in document order */
	default FluentIterable<MarkupNode> descendants() {
		return MarkupAxes.descendants(this);
	}

	/** @return All nodes before this one in document order, excluding its ancestors */
	default FluentIterable<MarkupNode> preceding() {
		return MarkupAxes.preceding(this);
	}

	/** @return All nodes after this one in document order, excluding its descendants */
	default FluentIterable<MarkupNode> following() {
		return MarkupAxes.following(this);
	}
}
