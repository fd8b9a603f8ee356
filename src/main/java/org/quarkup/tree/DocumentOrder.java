package org.quarkup.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the nodes of a single tree by document order: an ancestor comes before its descendants, an element's attributes come before its
 * children, and earlier siblings come first
 */
public final class DocumentOrder implements Comparator<MarkupNode> {
	/** The singleton document order comparator */
	public static final DocumentOrder INSTANCE = new DocumentOrder();

	private DocumentOrder() {
	}

	@Override
	public int compare(MarkupNode n1, MarkupNode n2) {
		if (n1 == n2)
			return 0;
		List<MarkupNode> path1 = pathFromRoot(n1);
		List<MarkupNode> path2 = pathFromRoot(n2);
		if (path1.get(0) != path2.get(0))
			throw new IllegalArgumentException(n1 + " and " + n2 + " are not in the same tree");
		int common = Math.min(path1.size(), path2.size());
		for (int i = 1; i < common; i++) {
			MarkupNode a = path1.get(i);
			MarkupNode b = path2.get(i);
			if (a != b) {
				MarkupNode parent = path1.get(i - 1);
				return Integer.compare(MarkupAxes.contentIndex(parent, a), MarkupAxes.contentIndex(parent, b));
			}
		}
		// One path is a prefix of the other, so the shorter one is an ancestor
		return Integer.compare(path1.size(), path2.size());
	}

	private static List<MarkupNode> pathFromRoot(MarkupNode node) {
		List<MarkupNode> path = new ArrayList<>();
		for (MarkupNode n = node; n != null; n = n.getParent())
			path.add(n);
		Collections.reverse(path);
		return path;
	}

	@Override
	public String toString() {
		return "document order";
	}
}
