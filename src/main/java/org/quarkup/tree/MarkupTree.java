package org.quarkup.tree;

import java.util.AbstractList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

import org.quarkup.QualifiedName;

/**
 * <p>
 * An immutable markup tree. The nodes are stored in an arena, each addressed by an integer ID, with parent, child and attribute relations
 * held as IDs rather than as references between node objects. {@link Node} is a lightweight handle onto one entry of the arena.
 * </p>
 * <p>
 * IDs are assigned in document order, so {@link #nodes()} lists every node of the tree in document order, starting with the root.
 * </p>
 * <p>
 * Trees are built with {@link #build()} or {@link #buildDocument()}, or parsed from text with {@link MarkupTreeBuilder}. A built tree is
 * safe to navigate from multiple threads.
 * </p>
 */
public final class MarkupTree {
	private static final int[] NONE = new int[0];

	private final MarkupNodeType[] theTypes;
	private final QualifiedName[] theNames;
	private final String[] theValues;
	private final int[] theParents;
	private final int[][] theChildren;
	private final int[][] theAttributes;
	private final Node[] theNodes;
	private final int theRoot;

	private MarkupTree(Builder builder) {
		int size = builder.theTypes.size();
		theTypes = builder.theTypes.toArray(new MarkupNodeType[size]);
		theNames = builder.theNames.toArray(new QualifiedName[size]);
		theValues = builder.theValues.toArray(new String[size]);
		theParents = new int[size];
		theChildren = new int[size][];
		theAttributes = new int[size][];
		theNodes = new Node[size];
		for (int i = 0; i < size; i++) {
			theParents[i] = builder.theParents.get(i);
			theChildren[i] = toArray(builder.theChildren.get(i));
			theAttributes[i] = toArray(builder.theAttributes.get(i));
			theNodes[i] = new Node(this, i);
		}
		theRoot = builder.theRoot;
	}

	private static int[] toArray(List<Integer> ids) {
		if (ids == null || ids.isEmpty())
			return NONE;
		int[] array = new int[ids.size()];
		for (int i = 0; i < array.length; i++)
			array[i] = ids.get(i);
		return array;
	}

	/** @return The root node of this tree */
	public Node getRoot() {
		return theNodes[theRoot];
	}

	/**
	 * @param id The ID of the node
	 * @return The node in this tree with the given ID
	 */
	public Node getNode(int id) {
		if (id < 0 || id >= theNodes.length)
			throw new IndexOutOfBoundsException(id + " of " + theNodes.length);
		return theNodes[id];
	}

	/** @return The number of nodes in this tree, attributes included */
	public int size() {
		return theNodes.length;
	}

	/** @return Every node in this tree, in document order */
	public List<MarkupNode> nodes() {
		return Collections.unmodifiableList(Arrays.<MarkupNode> asList(theNodes));
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder();
		for (Node node : theNodes) {
			int depth = 0;
			for (int p = theParents[node.getId()]; p >= 0; p = theParents[p])
				depth++;
			for (int i = 0; i < depth; i++)
				str.append('\t');
			str.append(node).append('\n');
		}
		return str.toString();
	}

	/** @return A builder for a tree whose root is the first node added to it */
	public static Builder build() {
		return new Builder(false);
	}

	/** @return A builder for a tree whose root is a {@link MarkupNodeType#DOCUMENT document} node */
	public static Builder buildDocument() {
		return new Builder(true);
	}

	/** A handle onto one node of a {@link MarkupTree} */
	public static final class Node implements MarkupNode {
		private final MarkupTree theTree;
		private final int theId;
		private final List<MarkupNode> theChildList;
		private final List<MarkupNode> theAttributeList;

		Node(MarkupTree tree, int id) {
			theTree = tree;
			theId = id;
			theChildList = new IdList(tree, tree.theChildren[id]);
			theAttributeList = new IdList(tree, tree.theAttributes[id]);
		}

		/** @return The tree this node belongs to */
		public MarkupTree getTree() {
			return theTree;
		}

		/** @return This node's ID in its tree */
		public int getId() {
			return theId;
		}

		@Override
		public MarkupNodeType getType() {
			return theTree.theTypes[theId];
		}

		@Override
		public QualifiedName getName() {
			return theTree.theNames[theId];
		}

		@Override
		public String getValue() {
			return theTree.theValues[theId];
		}

		@Override
		public Node getParent() {
			int parent = theTree.theParents[theId];
			return parent < 0 ? null : theTree.theNodes[parent];
		}

		@Override
		public List<MarkupNode> getChildren() {
			return theChildList;
		}

		@Override
		public List<MarkupNode> getAttributes() {
			return theAttributeList;
		}

		@Override
		public String toString() {
			switch (getType()) {
			case DOCUMENT:
				return "#document";
			case ELEMENT:
				return "<" + getName() + ">";
			case ATTRIBUTE:
				return "@" + getName() + "=\"" + getValue() + "\"";
			case TEXT:
				return "'" + getValue() + "'";
			case COMMENT:
				return "<!--" + getValue() + "-->";
			case PROCESSING_INSTRUCTION:
				return "<?" + getName() + (getValue().isEmpty() ? "" : " " + getValue()) + "?>";
			case DOCUMENT_TYPE:
				return "<!DOCTYPE " + getValue() + ">";
			default:
				return getType() + "#" + theId;
			}
		}
	}

	private static class IdList extends AbstractList<MarkupNode> implements RandomAccess {
		private final MarkupTree theTree;
		private final int[] theIds;

		IdList(MarkupTree tree, int[] ids) {
			theTree = tree;
			theIds = ids;
		}

		@Override
		public MarkupNode get(int index) {
			if (index < 0 || index >= theIds.length)
				throw new IndexOutOfBoundsException(index + " of " + theIds.length);
			return theTree.theNodes[theIds[index]];
		}

		@Override
		public int size() {
			return theIds.length;
		}
	}

	/**
	 * Builds a {@link MarkupTree} in document order. Elements are opened with {@link #startElement(QualifiedName)} and closed with
	 * {@link #endElement()}; all other nodes are added to the element currently open, or as the root if none is.
	 */
	public static final class Builder {
		private final List<MarkupNodeType> theTypes = new ArrayList<>();
		private final List<QualifiedName> theNames = new ArrayList<>();
		private final List<String> theValues = new ArrayList<>();
		private final List<Integer> theParents = new ArrayList<>();
		private final List<List<Integer>> theChildren = new ArrayList<>();
		private final List<List<Integer>> theAttributes = new ArrayList<>();
		private final Deque<Integer> theOpen = new ArrayDeque<>();
		private int theRoot = -1;
		private boolean isBuilt;

		Builder(boolean document) {
			if (document) {
				theRoot = add(MarkupNodeType.DOCUMENT, null, null, -1);
				theOpen.push(theRoot);
			}
		}

		/** @return The number of elements currently open in this builder */
		public int getDepth() {
			int depth = theOpen.size();
			if (depth > 0 && theTypes.get(theOpen.getLast()) == MarkupNodeType.DOCUMENT)
				depth--;
			return depth;
		}

		/**
		 * @param name The name of the element to open
		 * @return This builder
		 */
		public Builder startElement(String name) {
			return startElement(QualifiedName.parse(name));
		}

		/**
		 * @param name The name of the element to open
		 * @return This builder
		 */
		public Builder startElement(QualifiedName name) {
			int id = addContent(MarkupNodeType.ELEMENT, Objects.requireNonNull(name, "Element name cannot be null"), null);
			theOpen.push(id);
			return this;
		}

		/**
		 * @param name The name of the attribute
		 * @param value The value of the attribute
		 * @return This builder
		 */
		public Builder attribute(String name, String value) {
			return attribute(QualifiedName.parse(name), value);
		}

		/**
		 * Adds an attribute to the element currently open. Attributes must be added before any of the element's content.
		 *
		 * @param name The name of the attribute
		 * @param value The value of the attribute
		 * @return This builder
		 */
		public Builder attribute(QualifiedName name, String value) {
			checkBuilding();
			Objects.requireNonNull(name, "Attribute name cannot be null");
			Objects.requireNonNull(value, "Attribute value cannot be null");
			Integer owner = theOpen.peek();
			if (owner == null || theTypes.get(owner) != MarkupNodeType.ELEMENT)
				throw new IllegalStateException("No element is open to add attribute " + name + " to");
			else if (!theChildren.get(owner).isEmpty())
				throw new IllegalStateException("Attribute " + name + " cannot be added after the content of element " + theNames.get(owner));
			theAttributes.get(owner).add(add(MarkupNodeType.ATTRIBUTE, name, value, owner));
			return this;
		}

		/**
		 * @param value The character data
		 * @return This builder
		 */
		public Builder text(String value) {
			addContent(MarkupNodeType.TEXT, null, Objects.requireNonNull(value, "Text cannot be null"));
			return this;
		}

		/**
		 * @param value The text of the comment
		 * @return This builder
		 */
		public Builder comment(String value) {
			addContent(MarkupNodeType.COMMENT, null, Objects.requireNonNull(value, "Comment cannot be null"));
			return this;
		}

		/**
		 * @param target The target of the processing instruction
		 * @param value The text of the processing instruction, empty if none
		 * @return This builder
		 */
		public Builder processingInstruction(String target, String value) {
			addContent(MarkupNodeType.PROCESSING_INSTRUCTION, QualifiedName.parse(target),
				Objects.requireNonNull(value, "Processing instruction text cannot be null"));
			return this;
		}

		/**
		 * @param value The content of the document type declaration
		 * @return This builder
		 */
		public Builder doctype(String value) {
			addContent(MarkupNodeType.DOCUMENT_TYPE, null, Objects.requireNonNull(value, "Doctype cannot be null"));
			return this;
		}

		/**
		 * Closes the element currently open
		 *
		 * @return This builder
		 */
		public Builder endElement() {
			checkBuilding();
			Integer open = theOpen.peek();
			if (open == null || theTypes.get(open) != MarkupNodeType.ELEMENT)
				throw new IllegalStateException("No element is open");
			theOpen.pop();
			return this;
		}

		/**
		 * Closes any elements still open and creates the tree
		 *
		 * @return The built tree
		 */
		public MarkupTree build() {
			checkBuilding();
			if (theRoot < 0)
				throw new IllegalStateException("Nothing has been added to the tree");
			isBuilt = true;
			theOpen.clear();
			return new MarkupTree(this);
		}

		private void checkBuilding() {
			if (isBuilt)
				throw new IllegalStateException("This tree has already been built");
		}

		private int addContent(MarkupNodeType type, QualifiedName name, String value) {
			checkBuilding();
			Integer parent = theOpen.peek();
			if (parent == null) {
				if (theRoot >= 0)
					throw new IllegalStateException("A tree without a document root may only have one top-level node");
				theRoot = add(type, name, value, -1);
				return theRoot;
			}
			int id = add(type, name, value, parent);
			theChildren.get(parent).add(id);
			return id;
		}

		private int add(MarkupNodeType type, QualifiedName name, String value, int parent) {
			int id = theTypes.size();
			theTypes.add(type);
			theNames.add(name);
			theValues.add(value);
			theParents.add(parent);
			theChildren.add(type.isContainer() ? new ArrayList<Integer>() : Collections.<Integer> emptyList());
			theAttributes.add(type == MarkupNodeType.ELEMENT ? new ArrayList<Integer>() : Collections.<Integer> emptyList());
			return id;
		}
	}
}
