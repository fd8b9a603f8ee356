package org.quarkup.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.Iterables;

/**
 * <p>
 * Computes the structural axes of {@link MarkupNode}s: ancestors, descendants, preceding and following.
 * </p>
 * <p>
 * The four axes never overlap, so {@link #preceding(MarkupNode)} leaves out ancestors. Use
 * {@link #precedingInDocumentOrder(MarkupNode)} for every node before a node in document order, ancestors included.
 * </p>
 * <p>
 * Each axis is a lazily evaluated, restartable sequence: nothing is traversed until it is iterated, and each call to
 * {@link Iterable#iterator() iterator()} starts a fresh traversal. Once an iterator is exhausted it stays exhausted.
 * </p>
 * <p>
 * In document order, an element's attributes (in declaration order) come directly after the element and before its first child. For
 * axis purposes, the siblings of a node are therefore its parent's attributes followed by its parent's children.
 * </p>
 * <p>
 * Traversals use explicit stacks, so the depth of the tree is not limited by the call stack. The tree must not change while it is being
 * navigated.
 * </p>
 */
public final class MarkupAxes {
	private MarkupAxes() {
	}

	/**
	 * @param node The reference node
	 * @return The node's parent, grandparent, and so on up to the root. Empty for the root.
	 */
	public static FluentIterable<MarkupNode> ancestors(MarkupNode node) {
		Objects.requireNonNull(node, "Node cannot be null");
		return new FluentIterable<MarkupNode>() {
			@Override
			public Iterator<MarkupNode> iterator() {
				return new AbstractIterator<MarkupNode>() {
					private MarkupNode theCurrent = node;

					@Override
					protected MarkupNode computeNext() {
						theCurrent = theCurrent.getParent();
						return theCurrent == null ? endOfData() : theCurrent;
					}
				};
			}
		};
	}

	/**
	 * @param node The reference node
	 * @return Every node in the subtree of the given node except the node itself, in document order
	 */
	public static FluentIterable<MarkupNode> descendants(MarkupNode node) {
		Objects.requireNonNull(node, "Node cannot be null");
		return new FluentIterable<MarkupNode>() {
			@Override
			public Iterator<MarkupNode> iterator() {
				return new SubtreeIterator(contents(node).iterator());
			}
		};
	}

	/**
	 * @param node The reference node
	 * @return Every node after the given one in document order, excluding its descendants
	 */
	public static FluentIterable<MarkupNode> following(MarkupNode node) {
		Objects.requireNonNull(node, "Node cannot be null");
		return new FluentIterable<MarkupNode>() {
			@Override
			public Iterator<MarkupNode> iterator() {
				return new AbstractIterator<MarkupNode>() {
					private MarkupNode theLevel = node;
					private Iterator<MarkupNode> theSubtrees = new SubtreeIterator(laterSiblings(node).iterator());

					@Override
					protected MarkupNode computeNext() {
						// Exhaust the later siblings at one level before moving out to the parent's later siblings
						while (!theSubtrees.hasNext()) {
							theLevel = theLevel.getParent();
							if (theLevel == null)
								return endOfData();
							theSubtrees = new SubtreeIterator(laterSiblings(theLevel).iterator());
						}
						return theSubtrees.next();
					}
				};
			}
		};
	}

	/**
	 * @param node The reference node
	 * @return Every node before the given one in document order, excluding its ancestors
	 */
	public static FluentIterable<MarkupNode> preceding(MarkupNode node) {
		Objects.requireNonNull(node, "Node cannot be null");
		return new FluentIterable<MarkupNode>() {
			@Override
			public Iterator<MarkupNode> iterator() {
				return new PrecedingIterator(node, false);
			}
		};
	}

	/**
	 * @param node The reference node
	 * @return Every node before the given one in document order, including its ancestors
	 */
	public static FluentIterable<MarkupNode> precedingInDocumentOrder(MarkupNode node) {
		Objects.requireNonNull(node, "Node cannot be null");
		return new FluentIterable<MarkupNode>() {
			@Override
			public Iterator<MarkupNode> iterator() {
				return new PrecedingIterator(node, true);
			}
		};
	}

	/**
	 * @param node The node
	 * @return The node's attributes followed by its children
	 */
	static Iterable<MarkupNode> contents(MarkupNode node) {
		List<MarkupNode> attributes = node.getAttributes();
		List<MarkupNode> children = node.getChildren();
		if (attributes.isEmpty())
			return children;
		else if (children.isEmpty())
			return attributes;
		return Iterables.concat(attributes, children);
	}

	/**
	 * @param parent The parent of the node
	 * @param node The node
	 * @return The index of the node in its parent's {@link #contents(MarkupNode) contents}
	 */
	static int contentIndex(MarkupNode parent, MarkupNode node) {
		if (node.getType() == MarkupNodeType.ATTRIBUTE) {
			int index = indexOf(parent.getAttributes(), node);
			if (index >= 0)
				return index;
		} else {
			int index = indexOf(parent.getChildren(), node);
			if (index >= 0)
				return parent.getAttributes().size() + index;
		}
		throw new IllegalStateException(node + " is not among the contents of its parent " + parent);
	}

	private static Iterable<MarkupNode> earlierSiblings(MarkupNode node) {
		MarkupNode parent = node.getParent();
		if (parent == null)
			return Collections.emptyList();
		int index = contentIndex(parent, node);
		List<MarkupNode> attributes = parent.getAttributes();
		if (index <= attributes.size())
			return attributes.subList(0, index);
		return Iterables.concat(attributes, parent.getChildren().subList(0, index - attributes.size()));
	}

	private static Iterable<MarkupNode> laterSiblings(MarkupNode node) {
		MarkupNode parent = node.getParent();
		if (parent == null)
			return Collections.emptyList();
		int index = contentIndex(parent, node);
		List<MarkupNode> attributes = parent.getAttributes();
		if (index < attributes.size())
			return Iterables.concat(attributes.subList(index + 1, attributes.size()), parent.getChildren());
		List<MarkupNode> children = parent.getChildren();
		return children.subList(index - attributes.size() + 1, children.size());
	}

	/** Identity search, so that nodes with value-based equality are still located correctly */
	private static int indexOf(List<MarkupNode> nodes, MarkupNode node) {
		for (int i = 0; i < nodes.size(); i++) {
			if (nodes.get(i) == node)
				return i;
		}
		return -1;
	}

	/** Iterates through a sequence of nodes, each followed by its descendants */
	private static class SubtreeIterator extends AbstractIterator<MarkupNode> {
		private final Deque<Iterator<MarkupNode>> theStack = new ArrayDeque<>();

		SubtreeIterator(Iterator<MarkupNode> roots) {
			if (roots.hasNext())
				theStack.push(roots);
		}

		@Override
		protected MarkupNode computeNext() {
			while (!theStack.isEmpty()) {
				Iterator<MarkupNode> top = theStack.peek();
				if (top.hasNext()) {
					MarkupNode next = top.next();
					Iterator<MarkupNode> contents = contents(next).iterator();
					if (contents.hasNext())
						theStack.push(contents);
					return next;
				}
				theStack.pop();
			}
			return endOfData();
		}
	}

	/**
	 * Walks down the ancestor-or-self path of the reference node from the root, producing at each level the earlier siblings of the path
	 * node (each followed by its descendants), then optionally the path node itself
	 */
	private static class PrecedingIterator extends AbstractIterator<MarkupNode> {
		private final List<MarkupNode> thePath;
		private final boolean isIncludingAncestors;
		private int theLevel;
		private Iterator<MarkupNode> theSubtrees;

		PrecedingIterator(MarkupNode node, boolean includeAncestors) {
			List<MarkupNode> path = new ArrayList<>();
			for (MarkupNode n = node; n != null; n = n.getParent())
				path.add(n);
			Collections.reverse(path);
			thePath = path;
			isIncludingAncestors = includeAncestors;
			theSubtrees = new SubtreeIterator(earlierSiblings(thePath.get(0)).iterator());
		}

		@Override
		protected MarkupNode computeNext() {
			while (!theSubtrees.hasNext()) {
				MarkupNode pathNode = thePath.get(theLevel);
				theLevel++;
				if (theLevel == thePath.size())
					return endOfData(); // The path node was the reference node itself
				theSubtrees = new SubtreeIterator(earlierSiblings(thePath.get(theLevel)).iterator());
				if (isIncludingAncestors)
					return pathNode;
			}
			return theSubtrees.next();
		}
	}
}
