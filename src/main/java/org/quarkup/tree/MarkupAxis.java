package org.quarkup.tree;

import com.google.common.collect.FluentIterable;

/** The structural axes that may be navigated from a {@link MarkupNode}, named as in XPath */
public enum MarkupAxis {
	/** The node's parent, grandparent, and so on up to the root */
	ANCESTOR("ancestor") {
		@Override
		public FluentIterable<MarkupNode> nodes(MarkupNode node) {
			return MarkupAxes.ancestors(node);
		}
	},
	/** Every node in the subtree of the node except the node itself */
	DESCENDANT("descendant") {
		@Override
		public FluentIterable<MarkupNode> nodes(MarkupNode node) {
			return MarkupAxes.descendants(node);
		}
	},
	/** Every node before the node in document order except its ancestors */
	PRECEDING("preceding") {
		@Override
		public FluentIterable<MarkupNode> nodes(MarkupNode node) {
			return MarkupAxes.preceding(node);
		}
	},
	/** Every node after the node in document order except its descendants */
	FOLLOWING("following") {
		@Override
		public FluentIterable<MarkupNode> nodes(MarkupNode node) {
			return MarkupAxes.following(node);
		}
	};

	private final String theXPathName;

	private MarkupAxis(String xpathName) {
		theXPathName = xpathName;
	}

	/** @return The name of this axis in XPath, e.g. "following" */
	public String getXPathName() {
		return theXPathName;
	}

	/**
	 * @param node The reference node
	 * @return The nodes on this axis of the given node
	 */
	public abstract FluentIterable<MarkupNode> nodes(MarkupNode node);

	/**
	 * @param xpathName The XPath name of the axis
	 * @return The axis with the given name
	 * @throws IllegalArgumentException If no axis has the given name
	 */
	public static MarkupAxis forXPathName(String xpathName) {
		for (MarkupAxis axis : values()) {
			if (axis.theXPathName.equals(xpathName))
				return axis;
		}
		throw new IllegalArgumentException("Unrecognized axis: " + xpathName);
	}
}
