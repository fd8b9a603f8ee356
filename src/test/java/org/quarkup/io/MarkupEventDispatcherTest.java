package org.quarkup.io;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/** Unit tests for {@link MarkupEventDispatcher} */
public class MarkupEventDispatcherTest {
	/** A self-closing element is read in one step but produces both a start and an end */
	@Test
	public void testSelfClosing() {
		List<String> calls = new ArrayList<>();
		new MarkupEventDispatcher(MarkupEventHandler.build()//
			.onStartElement((name, attrs) -> calls.add("start " + name))//
			.onEndElement(name -> calls.add("end " + name))//
			.build()).dispatch("<a/>");
		Assert.assertEquals(Arrays.asList("start a", "end a"), calls);

		List<MarkupEvent> events = new MarkupEventDispatcher().events("<a/>");
		Assert.assertEquals("[startDocument, start(a)@1, end(a)@0, endDocument]", events.toString());
		assertThat(((MarkupEvent.StartElement) events.get(1)).isSelfClosing(), is(true));
		assertThat(((MarkupEvent.EndElement) events.get(2)).isSynthetic(), is(true));
	}

	/** Element events carry the depth of the element, or of its parent once it is closed */
	@Test
	public void testDepths() {
		List<Integer> depths = new ArrayList<>();
		MarkupEvent.Visitor<Void> visitor = new DepthCollector(depths);
		for (MarkupEvent event : new MarkupEventDispatcher().events("<a><b/><c/></a>"))
			event.accept(visitor);
		Assert.assertEquals(Arrays.asList(1, 2, 1, 2, 1, 0), depths);
	}

	/** White space-only text is reported unless the dispatcher is told to ignore it */
	@Test
	public void testWhitespace() {
		String text = "<a> <b/>\n</a>";
		List<String> preserved = new ArrayList<>();
		new MarkupEventDispatcher(MarkupEventHandler.build().onCharacterData(preserved::add).build()).dispatch(text);
		Assert.assertEquals(Arrays.asList(" ", "\n"), preserved);

		List<String> ignored = new ArrayList<>();
		new MarkupEventDispatcher(MarkupEventHandler.build().onCharacterData(ignored::add).build()).setIgnoreWhitespace(true)
			.dispatch(text);
		Assert.assertEquals(Arrays.asList(), ignored);
	}

	/** Parse errors are delivered in line with the nodes around them */
	@Test
	public void testParseErrors() {
		Assert.assertEquals("[startDocument, start(a)@1, error@3, text('bad'), error@7, endDocument]",
			new MarkupEventDispatcher().events("<a>&bad<").toString());

		List<FilePosition> errors = new ArrayList<>();
		new MarkupEventDispatcher(MarkupEventHandler.build().onParseError(errors::add).build()).dispatch("<a>\n  &bad<");
		Assert.assertEquals(2, errors.size());
		Assert.assertEquals("L2,C3", errors.get(0).toString());
	}

	/** A handler that handles nothing can still be given every kind of content */
	@Test
	public void testMissingHandlers() {
		MarkupEventDispatcher dispatcher = new MarkupEventDispatcher(MarkupEventHandler.build().build());
		dispatcher.dispatch("<!DOCTYPE d><?pi x?><d a='1'><!--c--><![CDATA[x]]>text<e/>&oops;</d></extra>");
		new MarkupEventDispatcher(new MarkupEventHandler() {
		}).dispatch("<a><b/>&bad<");
	}

	/** Every kind of content reaches the matching handler method */
	@Test
	public void testHandlerCalls() {
		List<String> calls = new ArrayList<>();
		new MarkupEventDispatcher(MarkupEventHandler.build()//
			.onStartDocument(() -> calls.add("startDoc"))//
			.onEndDocument(() -> calls.add("endDoc"))//
			.onStartElement((name, attrs) -> calls.add("start " + name + attrs))//
			.onEndElement(name -> calls.add("end " + name))//
			.onCharacterData(text -> calls.add("chars " + text))//
			.onProcessingInstruction((target, text) -> calls.add("pi " + target + " " + text))//
			.onDoctype(text -> calls.add("doctype " + text))//
			.onComment(text -> calls.add("comment " + text))//
			.onParseError(pos -> calls.add("error " + pos.getPosition()))//
			.build()).dispatch("<!DOCTYPE d><?pi x?><d a='1'><!--c--><![CDATA[x]]>y<</d>");
		Assert.assertEquals(Arrays.asList("startDoc", "doctype d", "pi pi x", "start d[a=\"1\"]", "comment c", "chars x", "chars y",
			"error 51", "end d", "endDoc"), calls);
	}

	/** Events can be matched exhaustively by a visitor */
	@Test
	public void testVisitor() {
		List<MarkupEvent> events = new MarkupEventDispatcher()
			.events("<!DOCTYPE d><?pi?><d><!--c--><![CDATA[x]]>y<</d>");
		List<String> kinds = new ArrayList<>();
		for (MarkupEvent event : events)
			kinds.add(event.accept(new KindVisitor()));
		Assert.assertEquals(Arrays.asList("startDocument", "doctype", "pi", "startElement", "comment", "cdata", "text", "error",
			"endElement", "endDocument"), kinds);
		assertThat(events.get(0), instanceOf(MarkupEvent.StartDocument.class));
		Assert.assertFalse(((MarkupEvent.EndElement) events.get(8)).isSynthetic());
		Assert.assertEquals("", ((MarkupEvent.ProcessingInstruction) events.get(2)).getValue());
	}

	/** The dispatcher's grammar and tab length are used by the reader */
	@Test
	public void testConfiguration() {
		MarkupEventDispatcher dispatcher = new MarkupEventDispatcher()//
			.setGrammar(MarkupGrammar.STANDARD.withNamedEntity("hi", "hello"))//
			.setTabLength(8);
		Assert.assertEquals("[startDocument, text('hello'), endDocument]", dispatcher.events("&hi;").toString());
		MarkupEvent.ParseError error = (MarkupEvent.ParseError) dispatcher.events("\t<").get(2);
		Assert.assertEquals(8, error.getPosition().getCharNumber());
	}

	static class DepthCollector implements MarkupEvent.Visitor<Void> {
		private final List<Integer> theDepths;

		DepthCollector(List<Integer> depths) {
			theDepths = depths;
		}

		@Override
		public Void visitStartElement(MarkupEvent.StartElement event) {
			theDepths.add(event.getDepth());
			return null;
		}

		@Override
		public Void visitEndElement(MarkupEvent.EndElement event) {
			theDepths.add(event.getDepth());
			return null;
		}

		@Override
		public Void visitStartDocument(MarkupEvent.StartDocument event) {
			return null;
		}

		@Override
		public Void visitEndDocument(MarkupEvent.EndDocument event) {
			return null;
		}

		@Override
		public Void visitCharacters(MarkupEvent.Characters event) {
			return null;
		}

		@Override
		public Void visitProcessingInstruction(MarkupEvent.ProcessingInstruction event) {
			return null;
		}

		@Override
		public Void visitDoctype(MarkupEvent.Doctype event) {
			return null;
		}

		@Override
		public Void visitComment(MarkupEvent.Comment event) {
			return null;
		}

		@Override
		public Void visitParseError(MarkupEvent.ParseError event) {
			return null;
		}
	}

	static class KindVisitor implements MarkupEvent.Visitor<String> {
		@Override
		public String visitStartDocument(MarkupEvent.StartDocument event) {
			return "startDocument";
		}

		@Override
		public String visitEndDocument(MarkupEvent.EndDocument event) {
			return "endDocument";
		}

		@Override
		public String visitStartElement(MarkupEvent.StartElement event) {
			return "startElement";
		}

		@Override
		public String visitEndElement(MarkupEvent.EndElement event) {
			return "endElement";
		}

		@Override
		public String visitCharacters(MarkupEvent.Characters event) {
			return event.isCData() ? "cdata" : "text";
		}

		@Override
		public String visitProcessingInstruction(MarkupEvent.ProcessingInstruction event) {
			return "pi";
		}

		@Override
		public String visitDoctype(MarkupEvent.Doctype event) {
			return "doctype";
		}

		@Override
		public String visitComment(MarkupEvent.Comment event) {
			return "comment";
		}

		@Override
		public String visitParseError(MarkupEvent.ParseError event) {
			return "error";
		}
	}
}
