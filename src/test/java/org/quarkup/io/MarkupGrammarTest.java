package org.quarkup.io;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;
import org.quarkup.MarkupAttribute;
import org.quarkup.io.MarkupGrammar.EndTag;
import org.quarkup.io.MarkupGrammar.Match;
import org.quarkup.io.MarkupGrammar.ProcessingInstructionToken;
import org.quarkup.io.MarkupGrammar.StartTag;

/** Tests the individual recognizers of {@link MarkupGrammar} */
public class MarkupGrammarTest {
	private final MarkupGrammar theGrammar = MarkupGrammar.STANDARD;

	/** Character data runs up to the next tag and decodes entity references */
	@Test
	public void testCharacterData() {
		Match<String> match = theGrammar.characterData().recognize("ab<c", 0);
		Assert.assertTrue(match.isSuccess());
		Assert.assertEquals("ab", match.getValue());
		Assert.assertEquals(2, match.getPosition());

		Assert.assertFalse(theGrammar.characterData().recognize("ab<c", 2).isSuccess());
		Assert.assertFalse(theGrammar.characterData().recognize("ab", 2).isSuccess());

		match = theGrammar.characterData().recognize("&quot;&apos;&#x263A;&#9731;", 0);
		Assert.assertEquals("\"'☺☃", match.getValue());
		Assert.assertEquals(27, match.getPosition());
	}

	/** Character data stops before an entity reference it cannot decode */
	@Test
	public void testUnknownEntity() {
		Match<String> match = theGrammar.characterData().recognize("a&nbsp;b", 0);
		Assert.assertEquals("a", match.getValue());
		Assert.assertEquals(1, match.getPosition());
		Assert.assertFalse(theGrammar.characterData().recognize("&#xZZ;", 0).isSuccess());
		Assert.assertFalse(theGrammar.characterData().recognize("&amp", 0).isSuccess());

		MarkupGrammar custom = theGrammar.withNamedEntity("nbsp", " ");
		Assert.assertEquals("a b", custom.characterData().recognize("a&nbsp;b", 0).getValue());
		// STANDARD is unchanged
		Assert.assertFalse(theGrammar.getNamedEntities().containsKey("nbsp"));
		Assert.assertTrue(custom.getNamedEntities().containsKey("amp"));
	}

	/** Text before a reference that cannot be decoded is kept exactly once */
	@Test
	public void testTextBeforeBadReference() {
		Match<String> match = theGrammar.characterData().recognize("abc&bad;def", 0);
		Assert.assertEquals("abc", match.getValue());
		Assert.assertEquals(3, match.getPosition());

		match = theGrammar.characterData().recognize("a&amp;b&bad;", 0);
		Assert.assertEquals("a&b", match.getValue());
		Assert.assertEquals(7, match.getPosition());

		match = theGrammar.characterData().recognize("&lt;&#xZ;", 0);
		Assert.assertEquals("<", match.getValue());
		Assert.assertEquals(4, match.getPosition());
	}

	/** Entity names must be legal names */
	@Test(expected = IllegalArgumentException.class)
	public void testIllegalEntityName() {
		theGrammar.withNamedEntity("1st", "first");
	}

	/** Start tags, with and without attributes */
	@Test
	public void testElementStart() {
		Match<StartTag> match = theGrammar.elementStart().recognize("<a b = 'x' c=\"y\" >rest", 0);
		Assert.assertTrue(match.isSuccess());
		Assert.assertEquals("a", match.getValue().getName().getName());
		Assert.assertEquals(Arrays.asList(new MarkupAttribute("b", "x"), new MarkupAttribute("c", "y")), match.getValue().getAttributes());
		Assert.assertFalse(match.getValue().isSelfClosing());
		Assert.assertEquals(18, match.getPosition());

		match = theGrammar.elementStart().recognize("<br/>", 0);
		Assert.assertTrue(match.getValue().isSelfClosing());
		Assert.assertEquals(5, match.getPosition());
	}

	/** Start tags that are not well-formed are not recognized */
	@Test
	public void testMalformedElementStart() {
		Assert.assertFalse(theGrammar.elementStart().recognize("<a b>", 0).isSuccess());
		Assert.assertFalse(theGrammar.elementStart().recognize("<a x=\"1\"y=\"2\">", 0).isSuccess());
		Assert.assertFalse(theGrammar.elementStart().recognize("<a x=\"<\">", 0).isSuccess());
		Assert.assertFalse(theGrammar.elementStart().recognize("<a x=1>", 0).isSuccess());
		Assert.assertFalse(theGrammar.elementStart().recognize("< a>", 0).isSuccess());
		Assert.assertFalse(theGrammar.elementStart().recognize("<a", 0).isSuccess());
		Assert.assertFalse(theGrammar.elementStart().recognize("</a>", 0).isSuccess());
	}

	/** End tags may have trailing white space before the closing bracket */
	@Test
	public void testElementEnd() {
		Match<EndTag> match = theGrammar.elementEnd().recognize("x</a:b >", 1);
		Assert.assertTrue(match.isSuccess());
		Assert.assertEquals("a", match.getValue().getName().getPrefix());
		Assert.assertEquals("b", match.getValue().getName().getLocalName());
		Assert.assertEquals(8, match.getPosition());
		Assert.assertFalse(theGrammar.elementEnd().recognize("</a x>", 0).isSuccess());
	}

	/** Comments and CDATA sections need their terminators */
	@Test
	public void testDelimited() {
		Assert.assertEquals(" a -- b ", theGrammar.comment().recognize("<!-- a -- b -->", 0).getValue());
		Assert.assertFalse(theGrammar.comment().recognize("<!-- open", 0).isSuccess());
		Assert.assertEquals("", theGrammar.cdata().recognize("<![CDATA[]]>", 0).getValue());
		Assert.assertEquals("]]", theGrammar.cdata().recognize("<![CDATA[]]]]>", 0).getValue());
		Assert.assertFalse(theGrammar.cdata().recognize("<![CDATA[x]>", 0).isSuccess());
	}

	/** Processing instructions, with and without text */
	@Test
	public void testProcessingInstruction() {
		Match<ProcessingInstructionToken> match = theGrammar.processingInstruction().recognize("<?go?>", 0);
		Assert.assertEquals("go", match.getValue().getTarget());
		Assert.assertEquals("", match.getValue().getText());
		Assert.assertEquals(6, match.getPosition());

		match = theGrammar.processingInstruction().recognize("<?go now please?>", 0);
		Assert.assertEquals("go", match.getValue().getTarget());
		Assert.assertEquals("now please", match.getValue().getText());

		Assert.assertFalse(theGrammar.processingInstruction().recognize("<?go", 0).isSuccess());
		Assert.assertFalse(theGrammar.processingInstruction().recognize("<? go?>", 0).isSuccess());
	}

	/** Document type declarations may contain quoted strings and an internal subset */
	@Test
	public void testDoctype() {
		String text = "<!DOCTYPE note [<!ELEMENT note (#PCDATA)>] >";
		Match<String> match = theGrammar.doctype().recognize(text, 0);
		Assert.assertEquals("note [<!ELEMENT note (#PCDATA)>]", match.getValue());
		Assert.assertEquals(text.length(), match.getPosition());

		match = theGrammar.doctype().recognize("<!DOCTYPE html SYSTEM \"a>b.dtd\">", 0);
		Assert.assertEquals("html SYSTEM \"a>b.dtd\"", match.getValue());

		Assert.assertFalse(theGrammar.doctype().recognize("<!DOCTYPE>", 0).isSuccess());
		Assert.assertFalse(theGrammar.doctype().recognize("<!DOCTYPE html", 0).isSuccess());
	}
}
