/*
 * Copyright 2026 The Verus Syntax Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.google.verus.parse;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.verus.syntax.Node;
import com.google.verus.syntax.NodeKind;
import com.google.verus.syntax.OrdinaryCode;
import com.google.verus.syntax.SourceFile;
import com.google.verus.syntax.Span;
import com.google.verus.syntax.Tag;
import com.google.verus.syntax.VerusBlock;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourcePartitionerTest {

  private static final String FILE =
      "use vstd::prelude::*;\n"
          + "\n"
          + "verus! {\n"
          + "\n"
          + "spec fn one() -> int { 1 }\n"
          + "\n"
          + "} // verus!\n"
          + "\n"
          + "fn main() {}\n";

  private final VerusParser parser = new VerusParser();

  @Test
  public void testPartition() {
    SourceFile file = parser.parse("lib.rs", FILE);
    assertThat(file.getSpans()).hasSize(3);
    assertThat(file.getSpans().get(0)).isInstanceOf(OrdinaryCode.class);
    assertThat(file.getSpans().get(1)).isInstanceOf(VerusBlock.class);
    assertThat(file.getSpans().get(2)).isInstanceOf(OrdinaryCode.class);

    VerusBlock block = file.getVerusBlocks().get(0);
    assertThat(block.start()).isEqualTo(23);
    assertThat(block.text()).startsWith("verus! {");
    assertThat(block.text()).endsWith("} // verus!");
    assertThat(block.trailingComment().text()).isEqualTo("// verus!");
    assertThat(block.getItems()).hasSize(1);
    assertThat(file.getText(block.getItems().get(0))).isEqualTo("spec fn one() -> int { 1 }");

    OrdinaryCode tail = file.getOrdinaryCode().get(1);
    assertThat(tail.start()).isEqualTo(block.end());
    assertThat(tail.text()).isEqualTo("\n\nfn main() {}\n");
    assertThat(file.toString()).isEqualTo("SourceFile lib.rs 3 spans");
  }

  @Test
  public void testSpansCoverTheFile() {
    SourceFile file = parser.parse("lib.rs", FILE);
    assertThat(file.toSource()).isEqualTo(FILE);
    int end = 0;
    for (Span span : file.getSpans()) {
      assertThat(span.start()).isEqualTo(end);
      end = span.end();
    }
    assertThat(end).isEqualTo(FILE.length());
  }

  @Test
  public void testReparseIsIdempotent() {
    SourceFile file = parser.parse("lib.rs", FILE);
    SourceFile again = parser.parse("lib.rs", file.toSource());
    assertThat(again.toStringTree()).isEqualTo(file.toStringTree());
  }

  @Test
  public void testTrailingCommentKeptOutWhenDisabled() {
    ParserOptions options = new ParserOptions();
    options.setAbsorbTrailingVerusComment(false);
    SourceFile file = new VerusParser(options).parse("lib.rs", FILE);
    VerusBlock block = file.getVerusBlocks().get(0);
    assertThat(block.trailingComment()).isNull();
    assertThat(block.text()).endsWith("}");
    assertThat(file.getOrdinaryCode().get(1).text()).startsWith(" // verus!\n");
    assertThat(file.toSource()).isEqualTo(FILE);
  }

  @Test
  public void testOtherTrailingCommentsStayOrdinary() {
    SourceFile file = parser.parse("lib.rs", "verus! { } // done\n");
    VerusBlock block = file.getVerusBlocks().get(0);
    assertThat(block.trailingComment()).isNull();
    assertThat(block.end()).isEqualTo(10);

    SourceFile nextLine = parser.parse("lib.rs", "verus! { }\n// verus!\n");
    assertThat(nextLine.getVerusBlocks().get(0).trailingComment()).isNull();
  }

  @Test
  public void testByteOffsets() {
    SourceFile file = parser.parse("lib.rs", "// é\nverus! {}");
    VerusBlock block = file.getVerusBlocks().get(0);
    assertThat(block.start()).isEqualTo(5);
    assertThat(block.byteStart()).isEqualTo(6);
    assertThat(block.end()).isEqualTo(14);
    assertThat(block.byteEnd()).isEqualTo(15);
    assertThat(file.getOrdinaryCode().get(0).byteEnd()).isEqualTo(6);
  }

  @Test
  public void testNoBlocks() {
    assertThat(parser.parse("empty.rs", "").getSpans()).isEmpty();
    SourceFile plain = parser.parse("main.rs", "fn main() { println!(\"verus!\"); }\n");
    assertThat(plain.getSpans()).hasSize(1);
    assertThat(plain.getVerusBlocks()).isEmpty();
  }

  @Test
  public void testMarkerNeedsBrace() {
    SourceFile file = parser.parse("lib.rs", "macro_rules! m { () => { verus!(x) } }\n");
    assertThat(file.getVerusBlocks()).isEmpty();
    assertThat(file.getOrdinaryCode()).hasSize(1);
  }

  @Test
  public void testMarkerInsideStringStartsBlock() {
    String text = "fn main() { let s = \"verus! {}\"; }";
    SourceFile file = parser.parse("main.rs", text);
    assertThat(file.getSpans()).hasSize(3);
    VerusBlock block = file.getVerusBlocks().get(0);
    assertThat(block.start()).isEqualTo(21);
    assertThat(block.text()).isEqualTo("verus! {}");
    assertThat(file.toSource()).isEqualTo(text);
  }

  @Test
  public void testSeveralBlocks() {
    SourceFile file =
        parser.parse(
            "lib.rs", "verus! { fn a() {} }\nmod m {}\nverus! { fn b() {} fn c() {} }\n");
    assertThat(file.getVerusBlocks()).hasSize(2);
    assertThat(file.getVerusBlocks().get(0).getItems()).hasSize(1);
    assertThat(file.getVerusBlocks().get(1).getItems()).hasSize(2);
    assertThat(file.getOrdinaryCode()).hasSize(2);
  }

  @Test
  public void testFunctionWithClauses() {
    SourceFile file =
        parser.parse(
            "lib.rs",
            "verus! { fn f(x: int) -> (r: int) requires x > 0 ensures r > x { x + 1 } }");
    Node fn = file.getVerusBlocks().get(0).getItems().get(0);
    assertThat(fn.getKind()).isEqualTo(NodeKind.FN);
    ImmutableList<Node> clauses = fn.getNodes(Tag.CLAUSE);
    assertThat(clauses).hasSize(2);
    assertThat(file.getText(clauses.get(0).getFirstNode(Tag.CLAUSE_EXPR))).isEqualTo("x > 0");
    assertThat(file.getText(clauses.get(1).getFirstNode(Tag.CLAUSE_EXPR))).isEqualTo("r > x");
    Node tail = fn.getFirstNode(Tag.BODY).getFirstNode(Tag.TAIL);
    assertThat(file.getText(tail)).isEqualTo("x + 1");
  }

  @Test
  public void testUnterminatedBlock() {
    SyntaxException e =
        assertThrows(
            SyntaxException.class, () -> parser.parse("lib.rs", "verus! {\nfn f() {}\n"));
    assertThat(e.getType()).isEqualTo(ParseErrors.UNTERMINATED_VERUS_BLOCK);
    assertThat(e.getOffset()).isEqualTo(0);
    assertThat(e.getError().sourceName()).isEqualTo("lib.rs");
  }

  @Test
  public void testSyntaxErrorInsideBlock() {
    SyntaxException e =
        assertThrows(SyntaxException.class, () -> parser.parse("lib.rs", "verus! { fn f( }"));
    assertThat(e.getType()).isEqualTo(ParseErrors.EXPECTED_TOKEN);
    assertThat(e.getOffset()).isEqualTo(15);
  }

  @Test
  public void testToStringTree() {
    SourceFile file = parser.parse("lib.rs", "verus! {} // verus!\nfn main() {}");
    assertThat(file.toStringTree())
        .isEqualTo(
            "VERUS_BLOCK [0,19)\n"
                + "VERUS_MACRO [0,9)\n"
                + "    IDENTIFIER 'verus'\n"
                + "    PUNCTUATION '!'\n"
                + "    PUNCTUATION '{'\n"
                + "    PUNCTUATION '}'\n"
                + "LINE_COMMENT '// verus!'\n"
                + "ORDINARY_CODE [19,32)\n");
  }
}
