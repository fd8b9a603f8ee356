package org.quarkup.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.FluentIterable;

/** Tests the axes of {@link MarkupAxes} */
public class MarkupAxesTest {
	private final MarkupTree theBook;
	private final MarkupNode book;
	private final MarkupNode title;
	private final MarkupNode lang;
	private final MarkupNode price;
	private final MarkupNode xml;
	private final MarkupNode description;

	/** Builds <code>&lt;book>&lt;title lang="en" price="12.00">XML&lt;/title>&lt;description/>&lt;/book></code> */
	public MarkupAxesTest() {
		theBook = MarkupTree.build()//
			.startElement("book")//
			.startElement("title").attribute("lang", "en").attribute("price", "12.00").text("XML").endElement()//
			.startElement("description").endElement()//
			.endElement().build();
		book = theBook.getRoot();
		title = book.getChildren().get(0);
		lang = title.getAttributes().get(0);
		price = title.getAttributes().get(1);
		xml = title.getChildren().get(0);
		description = book.getChildren().get(1);
	}

	/** Ancestors run from the parent up to the root */
	@Test
	public void testAncestors() {
		Assert.assertEquals(Arrays.asList(book), title.ancestors().toList());
		Assert.assertEquals(Collections.emptyList(), book.ancestors().toList());
		Assert.assertEquals(Arrays.asList(title, book), lang.ancestors().toList());
		Assert.assertEquals(Arrays.asList(title, book), xml.ancestors().toList());
	}

	/** Descendants are in document order, attributes before children */
	@Test
	public void testDescendants() {
		Assert.assertEquals(Arrays.asList(title, lang, price, xml, description), book.descendants().toList());
		Assert.assertEquals(Arrays.asList(lang, price, xml), title.descendants().toList());
		Assert.assertEquals(Collections.emptyList(), description.descendants().toList());
		Assert.assertEquals(Collections.emptyList(), lang.descendants().toList());
	}

	/** An attribute's later siblings include its element's children */
	@Test
	public void testFollowing() {
		Assert.assertEquals(Arrays.asList(price, xml, description), lang.following().toList());
		Assert.assertEquals(Arrays.asList(xml, description), price.following().toList());
		Assert.assertEquals(Arrays.asList(description), title.following().toList());
		Assert.assertEquals(Collections.emptyList(), description.following().toList());
		Assert.assertEquals(Collections.emptyList(), book.following().toList());
	}

	/** Preceding excludes ancestors, unless they are asked for */
	@Test
	public void testPreceding() {
		Assert.assertEquals(Arrays.asList(lang), price.preceding().toList());
		Assert.assertEquals(Arrays.asList(book, title, lang), MarkupAxes.precedingInDocumentOrder(price).toList());
		Assert.assertEquals(Arrays.asList(title, lang, price, xml), description.preceding().toList());
		Assert.assertEquals(Arrays.asList(lang, price), xml.preceding().toList());
		Assert.assertEquals(Collections.emptyList(), book.preceding().toList());
		Assert.assertEquals(Collections.emptyList(), MarkupAxes.precedingInDocumentOrder(book).toList());
	}

	/** The axes with the node itself cover the whole tree exactly once */
	@Test
	public void testPartition() {
		assertPartitions(theBook);
		assertPartitions(MarkupTreeBuilder.parse("<?top?><!DOCTYPE r><r a='1' b='2'><!--c--><x y='3'>t<z/>u</x><w><v q='4'/></w>end</r>"
			+ "<!--tail-->"));
	}

	/** Since IDs are assigned in document order, each axis is a contiguous range or a filtered range of the tree's nodes */
	@Test
	public void testDocumentOrderRanges() {
		MarkupTree tree = MarkupTreeBuilder.parse("<r a='1' b='2'><x y='3'>t<z/>u</x><!--c--><w><v q='4'/></w>end</r>");
		List<MarkupNode> all = tree.nodes();
		for (MarkupNode node : all) {
			int id = ((MarkupTree.Node) node).getId();
			int descendants = node.descendants().size();
			Assert.assertEquals(all.subList(0, id), MarkupAxes.precedingInDocumentOrder(node).toList());
			Assert.assertEquals(all.subList(id + 1, id + 1 + descendants), node.descendants().toList());
			Assert.assertEquals(all.subList(id + 1 + descendants, all.size()), node.following().toList());
		}
	}

	/** Exhausted iterators stay exhausted */
	@Test
	public void testExhaustion() {
		Iterator<MarkupNode> iter = book.ancestors().iterator();
		assertExhausted(iter);

		iter = title.descendants().iterator();
		Assert.assertSame(lang, iter.next());
		Assert.assertSame(price, iter.next());
		Assert.assertSame(xml, iter.next());
		assertExhausted(iter);

		iter = price.preceding().iterator();
		Assert.assertSame(lang, iter.next());
		assertExhausted(iter);

		iter = xml.following().iterator();
		Assert.assertSame(description, iter.next());
		assertExhausted(iter);
	}

	/** Each iteration of an axis starts over */
	@Test
	public void testRestartable() {
		for (MarkupAxis axis : MarkupAxis.values()) {
			FluentIterable<MarkupNode> nodes = axis.nodes(price);
			List<MarkupNode> first = nodes.toList();
			Assert.assertEquals(axis.toString(), first, nodes.toList());
			Iterator<MarkupNode> partial = nodes.iterator();
			if (partial.hasNext())
				partial.next();
			Assert.assertEquals(axis.toString(), first, nodes.toList());
		}
	}

	/** Axes are looked up by their XPath names */
	@Test
	public void testAxisNames() {
		for (MarkupAxis axis : MarkupAxis.values())
			Assert.assertSame(axis, MarkupAxis.forXPathName(axis.getXPathName()));
		Assert.assertEquals("following", MarkupAxis.FOLLOWING.getXPathName());
		Assert.assertEquals(lang.following().toList(), MarkupAxis.FOLLOWING.nodes(lang).toList());
		Assert.assertEquals(price.preceding().toList(), MarkupAxis.PRECEDING.nodes(price).toList());
	}

	/** Axes with no name are rejected */
	@Test(expected = IllegalArgumentException.class)
	public void testUnknownAxis() {
		MarkupAxis.forXPathName("child");
	}

	/** Very deep trees are navigated without overflowing the stack */
	@Test
	public void testDeepTree() {
		int depth = 50_000;
		MarkupTree.Builder builder = MarkupTree.build();
		for (int i = 0; i < depth; i++)
			builder.startElement("e").attribute("i", String.valueOf(i));
		builder.text("leaf");
		MarkupTree tree = builder.build();
		MarkupNode leaf = tree.getNode(tree.size() - 1);
		Assert.assertEquals(MarkupNodeType.TEXT, leaf.getType());

		Assert.assertEquals(depth, leaf.ancestors().size());
		Assert.assertEquals(depth * 2, tree.getRoot().descendants().size());
		Assert.assertEquals(depth, leaf.preceding().size());
		Assert.assertEquals(depth * 2, MarkupAxes.precedingInDocumentOrder(leaf).size());
		Assert.assertTrue(tree.getRoot().getAttributes().get(0).following().size() == depth * 2 - 1);
		Assert.assertTrue(DocumentOrder.INSTANCE.compare(tree.getRoot(), leaf) < 0);
	}

	/** Nulls are rejected immediately */
	@Test(expected = NullPointerException.class)
	public void testNull() {
		MarkupAxes.following(null);
	}

	private static void assertPartitions(MarkupTree tree) {
		Set<MarkupNode> all = new HashSet<>(tree.nodes());
		for (MarkupNode node : tree.nodes()) {
			List<MarkupNode> covered = new ArrayList<>();
			covered.add(node);
			covered.addAll(node.ancestors().toList());
			covered.addAll(node.descendants().toList());
			covered.addAll(node.preceding().toList());
			covered.addAll(node.following().toList());
			Assert.assertEquals(node.toString(), tree.size(), covered.size());
			Assert.assertEquals(node.toString(), all, new HashSet<>(covered));
		}
	}

	private static void assertExhausted(Iterator<MarkupNode> iter) {
		for (int i = 0; i < 2; i++) {
			Assert.assertFalse(iter.hasNext());
			try {
				iter.next();
				Assert.fail("Expected NoSuchElementException");
			} catch (NoSuchElementException e) {
				// Expected
			}
		}
	}
}
